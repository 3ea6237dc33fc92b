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
package binwp.tasks;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import binwp.core.BirFile.Block;
import binwp.core.BirFile.Elt;
import binwp.core.BirFile.Label;
import binwp.core.BirFile.Subroutine;
import binwp.core.BirFile.Tid;

/**
 * The intraprocedural control-flow graph of a subroutine. Edges follow direct
 * jumps, the return targets of calls and the resumption points of interrupts.
 */
public class ControlFlowGraph {
	private final Subroutine subroutine;
	private final Map<Tid, Block> blocks = new LinkedHashMap<>();

	public ControlFlowGraph(Subroutine subroutine) {
		this.subroutine = subroutine;
		for (Block b : subroutine.getBlocks()) {
			if (blocks.put(b.getTid(), b) != null) {
				throw new IllegalArgumentException(
						"duplicate block " + b.getTid() + " in subroutine " + subroutine.getName());
			}
		}
	}

	public Subroutine getSubroutine() {
		return subroutine;
	}

	public Block getEntry() {
		return subroutine.getEntry();
	}

	public boolean contains(Tid tid) {
		return blocks.containsKey(tid);
	}

	public Block getBlock(Tid tid) {
		Block b = blocks.get(tid);
		if (b == null) {
			throw new IllegalArgumentException("no block " + tid + " in subroutine " + subroutine.getName());
		}
		return b;
	}

	/**
	 * Get the successors of a block within this graph, in jump order.
	 *
	 * @param tid
	 * @return
	 */
	public List<Tid> getSuccessors(Tid tid) {
		ArrayList<Tid> succs = new ArrayList<>();
		for (Elt.Jmp j : getBlock(tid).getJmps()) {
			Tid target = null;
			if (j instanceof Elt.Goto) {
				target = direct(((Elt.Goto) j).getTarget());
			} else if (j instanceof Elt.Call) {
				target = direct(((Elt.Call) j).getReturn());
			} else if (j instanceof Elt.Interrupt) {
				target = ((Elt.Interrupt) j).getReturn();
			}
			if (target != null && blocks.containsKey(target) && !succs.contains(target)) {
				succs.add(target);
			}
		}
		return Collections.unmodifiableList(succs);
	}

	private static Tid direct(Label label) {
		return label instanceof Label.Direct ? ((Label.Direct) label).getTarget() : null;
	}
}
