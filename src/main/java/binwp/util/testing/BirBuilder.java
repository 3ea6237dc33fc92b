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
package binwp.util.testing;

import static binwp.core.BirFile.*;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import binwp.core.Architecture;
import binwp.core.BirFile;
import binwp.core.BirFile.Arg;
import binwp.core.BirFile.Block;
import binwp.core.BirFile.Elt;
import binwp.core.BirFile.Expr;
import binwp.core.BirFile.Subroutine;
import binwp.core.BirFile.Tid;
import binwp.core.BirFile.Var;

/**
 * Builds programs without going through the lifter. Subroutines are
 * identified by <code>@name</code>, blocks by <code>name:label</code> and
 * block elements by <code>name:label.n</code>. The first block of a
 * subroutine is its entry.
 *
 * <pre>
 * BirFile file = new BirBuilder(Architecture.X86_64)
 *     .sub("main")
 *         .block("entry").def(RAX, ADD(VAR(RDI), CONST(1, 64))).ret()
 *     .end().build();
 * </pre>
 */
public class BirBuilder {
	private final Architecture arch;
	private final List<Subroutine> subroutines = new ArrayList<>();

	public BirBuilder(Architecture arch) {
		this.arch = arch;
	}

	public Architecture getArchitecture() {
		return arch;
	}

	public SubBuilder sub(String name, Arg... args) {
		return new SubBuilder(name, Arrays.asList(args));
	}

	/**
	 * Add a subroutine with no blocks, such as an external function.
	 *
	 * @param name
	 * @param args
	 * @return
	 */
	public BirBuilder external(String name, Arg... args) {
		return sub(name, args).end();
	}

	public BirFile build() {
		return new BirFile(arch, subroutines);
	}

	public static Tid subTid(String name) {
		return new Tid("@" + name);
	}

	public static Tid blockTid(String sub, String label) {
		return new Tid(sub + ":" + label);
	}

	public class SubBuilder {
		private final String name;
		private final List<Arg> args;
		private final List<Block> blocks = new ArrayList<>();
		private BigInteger address;
		private BlockBuilder current;

		private SubBuilder(String name, List<Arg> args) {
			this.name = name;
			this.args = args;
		}

		public SubBuilder address(long address) {
			this.address = BigInteger.valueOf(address);
			return this;
		}

		public BlockBuilder block(String label) {
			finishBlock();
			current = new BlockBuilder(this, label);
			return current;
		}

		/**
		 * Finish this subroutine and return to the enclosing program.
		 *
		 * @return
		 */
		public BirBuilder end() {
			subroutines.add(build());
			return BirBuilder.this;
		}

		private Subroutine build() {
			finishBlock();
			if (address == null) {
				return new Subroutine(subTid(name), name, args, blocks);
			} else {
				return new Subroutine(subTid(name), name, args, blocks, new Attribute.Address(address));
			}
		}

		private void finishBlock() {
			if (current != null) {
				blocks.add(current.build());
				current = null;
			}
		}
	}

	public class BlockBuilder {
		private final SubBuilder parent;
		private final Tid tid;
		private final List<Elt.Phi> phis = new ArrayList<>();
		private final List<Elt.Def> defs = new ArrayList<>();
		private final List<Elt.Jmp> jmps = new ArrayList<>();
		private int count;

		private BlockBuilder(SubBuilder parent, String label) {
			this.parent = parent;
			this.tid = blockTid(parent.name, label);
		}

		/**
		 * Add a phi node, where incoming values are keyed by the label of their
		 * predecessor.
		 *
		 * @param lhs
		 * @param incoming
		 * @return
		 */
		public BlockBuilder phi(Var lhs, Map<String, Expr> incoming) {
			Map<Tid, Expr> values = new LinkedHashMap<>();
			for (Map.Entry<String, Expr> e : incoming.entrySet()) {
				values.put(blockTid(parent.name, e.getKey()), e.getValue());
			}
			phis.add(new Elt.Phi(next(), lhs, values));
			return this;
		}

		public BlockBuilder def(Var lhs, Expr rhs) {
			defs.add(new Elt.Def(next(), lhs, rhs));
			return this;
		}

		public BlockBuilder goTo(String label) {
			return goTo(TRUE(), label);
		}

		public BlockBuilder goTo(Expr condition, String label) {
			jmps.add(new Elt.Goto(next(), condition, DIRECT(blockTid(parent.name, label))));
			return this;
		}

		public BlockBuilder goToIndirect(Expr target) {
			jmps.add(new Elt.Goto(next(), TRUE(), INDIRECT(target)));
			return this;
		}

		/**
		 * Call a subroutine and continue at a given label, or never return when the
		 * label is <code>null</code>.
		 *
		 * @param callee
		 * @param returns
		 * @return
		 */
		public BlockBuilder call(String callee, String returns) {
			return call(TRUE(), callee, returns);
		}

		public BlockBuilder call(Expr condition, String callee, String returns) {
			Label ret = returns == null ? null : DIRECT(blockTid(parent.name, returns));
			jmps.add(new Elt.Call(next(), condition, DIRECT(subTid(callee)), ret));
			return this;
		}

		public BlockBuilder callIndirect(Expr target, String returns) {
			Label ret = returns == null ? null : DIRECT(blockTid(parent.name, returns));
			jmps.add(new Elt.Call(next(), TRUE(), INDIRECT(target), ret));
			return this;
		}

		/**
		 * Return to the caller through the stack pointer.
		 *
		 * @return
		 */
		public BlockBuilder ret() {
			return ret(TRUE());
		}

		public BlockBuilder ret(Expr condition) {
			jmps.add(new Elt.Ret(next(), condition, INDIRECT(VAR(arch.getStackPointer()))));
			return this;
		}

		public BlockBuilder interrupt(int number, String returns) {
			jmps.add(new Elt.Interrupt(next(), TRUE(), number, blockTid(parent.name, returns)));
			return this;
		}

		public BlockBuilder block(String label) {
			return parent.block(label);
		}

		public BirBuilder end() {
			return parent.end();
		}

		private Tid next() {
			return new Tid(tid.getName() + "." + (count++));
		}

		private Block build() {
			return new Block(tid, phis, defs, jmps);
		}
	}
}
