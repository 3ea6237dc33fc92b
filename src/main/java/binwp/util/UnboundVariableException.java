// Copyright 2024 The binwp Project Developers
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//    http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
package binwp.util;

import binwp.core.BirFile.Var;

/**
 * Thrown when an expression refers to a variable with no solver binding.
 */
public class UnboundVariableException extends TranslationException {
    private static final long serialVersionUID = 1L;

    private final transient Var variable;

    public UnboundVariableException(Var variable) {
        super("unbound variable " + variable.getName());
        this.variable = variable;
    }

    public Var getVariable() {
        return variable;
    }
}
