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

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

import binwp.core.BirFile.Block;
import binwp.core.BirFile.Elt;
import binwp.core.BirFile.Expr;
import binwp.core.BirFile.Label;
import binwp.core.BirFile.Subroutine;
import binwp.core.BirFile.Var;

/**
 * Collects the free variables used or defined by expressions and subroutines.
 * Variables bound by a <code>let</code> are not free in its body.
 */
public class VariableCollector extends AbstractExpressionFold<Set<Var>> {

    public static Set<Var> collect(Expr expr) {
        return new VariableCollector().visitExpression(expr);
    }

    public static Set<Var> collect(Subroutine sub) {
        VariableCollector collector = new VariableCollector();
        Set<Var> vars = new LinkedHashSet<>();
        for (Block b : sub.getBlocks()) {
            for (Elt.Phi p : b.getPhis()) {
                vars.add(p.getLhs());
                for (Expr e : p.getIncoming().values()) {
                    vars.addAll(collector.visitExpression(e));
                }
            }
            for (Elt.Def d : b.getDefs()) {
                vars.add(d.getLhs());
                vars.addAll(collector.visitExpression(d.getRhs()));
            }
            for (Elt.Jmp j : b.getJmps()) {
                vars.addAll(collector.visitExpression(j.getCondition()));
                Label target = null;
                if (j instanceof Elt.Goto) {
                    target = ((Elt.Goto) j).getTarget();
                } else if (j instanceof Elt.Call) {
                    target = ((Elt.Call) j).getTarget();
                } else if (j instanceof Elt.Ret) {
                    target = ((Elt.Ret) j).getTarget();
                }
                if (target instanceof Label.Indirect) {
                    vars.addAll(collector.visitExpression(((Label.Indirect) target).getTarget()));
                }
            }
        }
        return vars;
    }

    /**
     * Collect the variables assigned anywhere in a subroutine.
     *
     * @param sub
     * @return
     */
    public static Set<Var> collectAssigned(Subroutine sub) {
        Set<Var> vars = new LinkedHashSet<>();
        for (Block b : sub.getBlocks()) {
            for (Elt.Phi p : b.getPhis()) {
                vars.add(p.getLhs());
            }
            for (Elt.Def d : b.getDefs()) {
                vars.add(d.getLhs());
            }
        }
        return vars;
    }

    @Override
    protected Set<Var> constructVariableAccess(Expr.VariableAccess expr) {
        return Collections.singleton(expr.getVariable());
    }

    @Override
    protected Set<Var> constructLet(Expr.Let expr, Set<Var> value, Set<Var> body) {
        Set<Var> result = new LinkedHashSet<>(body);
        result.remove(expr.getVariable());
        return join(value, result);
    }

    @Override
    public Set<Var> join(Set<Var> lhs, Set<Var> rhs) {
        if (lhs.isEmpty()) {
            return rhs;
        } else if (rhs.isEmpty()) {
            return lhs;
        }
        Set<Var> result = new LinkedHashSet<>(lhs);
        result.addAll(rhs);
        return result;
    }

    @Override
    public Set<Var> BOTTOM() {
        return Collections.emptySet();
    }
}
