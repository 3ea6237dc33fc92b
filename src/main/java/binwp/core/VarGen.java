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
package binwp.core;

/**
 * Generates names which are distinct within a single generator. Environments
 * analysing different programs use generators with different namespaces so
 * their fresh names never collide.
 */
public class VarGen {
	private final String namespace;
	private int counter;

	public VarGen() {
		this("");
	}

	public VarGen(String namespace) {
		this.namespace = namespace;
	}

	public String getNamespace() {
		return namespace;
	}

	public String fresh(String prefix) {
		int index = counter++;
		if (namespace.isEmpty()) {
			return prefix + "_" + index;
		} else {
			return namespace + "_" + prefix + "_" + index;
		}
	}
}
