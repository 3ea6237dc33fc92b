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
package binwp.io;

import java.io.OutputStream;
import java.io.PrintWriter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;

import com.microsoft.z3.Model;

import binwp.core.Constraint;
import binwp.core.Constraint.Clause;
import binwp.core.Constraint.Goal;

/**
 * Prints constraint trees, and the branch decisions a model takes through
 * them.
 */
public class ConstraintPrinter {
	private final PrintWriter out;

	public ConstraintPrinter(OutputStream output) {
		this.out = new PrintWriter(output);
	}

	public void flush() {
		out.flush();
	}

	public void write(Constraint c) {
		write(0, c);
		out.flush();
	}

	private void write(int indent, Constraint c) {
		tab(indent);
		if (c instanceof Goal) {
			Goal g = (Goal) c;
			out.print(g.getName());
			if (g.getOrigin() != null) {
				out.print(" @ " + g.getOrigin());
			}
			out.println(": " + g.getTerm());
		} else {
			Clause cl = (Clause) c;
			if (cl.getHypotheses().isEmpty()) {
				out.println("(and");
			} else {
				out.println("(implies");
				tab(indent + 1);
				out.println("(and");
				for (Constraint h : cl.getHypotheses()) {
					write(indent + 2, h);
				}
				tab(indent + 1);
				out.println(")");
				tab(indent + 1);
				out.println("(and");
				indent++;
			}
			for (Constraint k : cl.getConclusions()) {
				write(indent + 1, k);
			}
			if (!cl.getHypotheses().isEmpty()) {
				tab(indent);
				out.println(")");
				indent--;
			}
			tab(indent);
			out.println(")");
		}
	}

	/**
	 * Print the jumps taken under a given model, one per line.
	 *
	 * @param c
	 * @param model
	 */
	public void writePaths(Constraint c, Model model) {
		for (Goal g : getPath(c, model)) {
			boolean taken = g.getName().equals("jump_taken");
			out.println("jump " + g.getOrigin() + (taken ? " taken" : " not taken"));
		}
		out.flush();
	}

	/**
	 * Collect the branch goals which hold under a given model, following only
	 * clauses whose hypotheses hold.
	 *
	 * @param c
	 * @param model
	 * @return
	 */
	public static List<Goal> getPath(Constraint c, Model model) {
		ArrayList<Goal> path = new ArrayList<>();
		Set<Constraint> visited = Collections.newSetFromMap(new IdentityHashMap<>());
		collectPath(c, model, path, visited);
		return path;
	}

	private static void collectPath(Constraint c, Model model, List<Goal> path, Set<Constraint> visited) {
		if (!(c instanceof Clause) || !visited.add(c)) {
			return;
		}
		Clause cl = (Clause) c;
		ArrayList<Goal> branches = new ArrayList<>();
		for (Constraint h : cl.getHypotheses()) {
			if (h instanceof Goal) {
				Goal g = (Goal) h;
				if (!model.eval(g.getTerm(), true).isTrue()) {
					return;
				} else if (isBranch(g)) {
					branches.add(g);
				}
			}
		}
		path.addAll(branches);
		for (Constraint k : cl.getConclusions()) {
			collectPath(k, model, path, visited);
		}
	}

	private static boolean isBranch(Goal g) {
		return g.getOrigin() != null && (g.getName().equals("jump_taken") || g.getName().equals("jump_not_taken"));
	}

	private void tab(int n) {
		for (int i = 0; i != n; ++i) {
			out.print("  ");
		}
	}
}
