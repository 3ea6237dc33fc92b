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

/**
 * Thrown when the operands of an operation, or the two sides of an assignment,
 * have different bit widths.
 */
public class WidthMismatchException extends TranslationException {
    private static final long serialVersionUID = 1L;

    private final int expected;
    private final int actual;

    public WidthMismatchException(String operation, int expected, int actual) {
        super("width mismatch in " + operation + " (" + expected + " vs " + actual + ")");
        this.expected = expected;
        this.actual = actual;
    }

    public int getExpected() {
        return expected;
    }

    public int getActual() {
        return actual;
    }
}
