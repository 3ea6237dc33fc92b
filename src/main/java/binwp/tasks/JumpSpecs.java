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

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;

import binwp.core.BirFile.Elt;
import binwp.core.BirFile.Label;
import binwp.core.BirFile.Tid;
import binwp.core.Constraint;
import binwp.core.Environment;
import binwp.core.Environment.IntSpec;
import binwp.core.Environment.JmpSpec;
import binwp.util.ExpressionTranslator;
import binwp.util.Util;

/**
 * Specs for jumps and interrupts.
 */
public class JumpSpecs {

	/**
	 * Leaves every jump to the default treatment.
	 */
	public static final JmpSpec DEFAULT = (env, post, blk, jmp) -> Optional.empty();

	/**
	 * Interrupts have no effect.
	 */
	public static final IntSpec INTERRUPT_DEFAULT = (env, post, number) -> post;

	/**
	 * Force a path through the program. For every jump in the map, its guard is
	 * required to hold when the jump is mapped to <code>true</code> and required
	 * to fail otherwise. Other jumps get the default treatment, as do taken calls,
	 * returns and jumps whose target has no precondition yet.
	 *
	 * @param taken
	 * @return
	 */
	public static JmpSpec reach(Map<Tid, Boolean> taken) {
		Map<Tid, Boolean> path = new HashMap<>(taken);
		return (env, post, blk, jmp) -> {
			Boolean t = path.get(jmp.getTid());
			if (t == null) {
				return Optional.empty();
			}
			Constraint target = t ? directSuccessor(env, jmp) : post;
			if (target == null) {
				return Optional.empty();
			}
			Context ctx = env.getContext();
			ExpressionTranslator.Result r = env.getTranslator().translate(jmp.getCondition());
			BoolExpr guard = Util.toBool(ctx, ExpressionTranslator.asBitVector(r.getTerm()));
			Constraint pre = t ? Constraint.conjunction(Constraint.goal("reach_taken", guard, jmp.getTid()), target)
					: Constraint.conjunction(Constraint.goal("reach_not_taken", ctx.mkNot(guard), jmp.getTid()), post);
			ExpressionTranslator.Hooks hooks = r.getHooks();
			return Optional.of(PreconditionCompiler.guard(pre,
					Util.append(hooks.getAssumeBefore(), hooks.getAssumeAfter()),
					Util.append(hooks.getVerifyBefore(), hooks.getVerifyAfter()), jmp.getTid()));
		};
	}

	private static Constraint directSuccessor(Environment env, Elt.Jmp jmp) {
		if (jmp instanceof Elt.Goto && ((Elt.Goto) jmp).getTarget() instanceof Label.Direct) {
			return env.getPrecondition(((Label.Direct) ((Elt.Goto) jmp).getTarget()).getTarget());
		}
		return null;
	}
}
