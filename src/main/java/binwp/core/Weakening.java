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

import binwp.core.BirFile.Tid;

/**
 * Records a place where the computed precondition is weaker or stronger than the
 * exact one, because the analysis could not follow the program precisely.
 */
public final class Weakening {

	public enum Kind {
		/**
		 * A jump whose target is computed at runtime was not followed.
		 */
		INDIRECT_JUMP,
		/**
		 * A call whose target is computed at runtime, or not part of the program.
		 */
		INDIRECT_CALL,
		/**
		 * A loop was cut off after the maximum number of unrollings.
		 */
		LOOP_UNROLL_BOUND,
		/**
		 * A phi node was resolved along a single incoming edge.
		 */
		PHI_NODE,
		/**
		 * An inlined call was recursive and summarised instead.
		 */
		RECURSIVE_INLINE
	}

	private final Kind kind;
	private final Tid location;
	private final String detail;

	public Weakening(Kind kind, Tid location, String detail) {
		this.kind = kind;
		this.location = location;
		this.detail = detail;
	}

	public Kind getKind() {
		return kind;
	}

	public Tid getLocation() {
		return location;
	}

	public String getDetail() {
		return detail;
	}

	@Override
	public String toString() {
		return kind + " at " + location + ": " + detail;
	}
}
