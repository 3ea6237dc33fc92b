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

import java.util.LinkedHashMap;
import java.util.Map;

import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import com.microsoft.z3.Expr;
import com.microsoft.z3.FuncDecl;
import com.microsoft.z3.Sort;
import com.microsoft.z3.Symbol;
import com.microsoft.z3.Z3Exception;

import binwp.core.BirFile.Var;
import binwp.core.Environment;

/**
 * Parses user-supplied SMT-LIB2 formulas, resolving names against the
 * constants bound in one or more environments.
 */
public class Smtlib {

    /**
     * Parse a formula. The input is either a sequence of <code>assert</code>
     * commands, whose conjunction is returned, or a single boolean term.
     *
     * @param ctx
     * @param smtlib
     * @param names maps each name the formula may use to its solver term.
     * @return
     */
    public static BoolExpr parse(Context ctx, String smtlib, Map<String, Expr<?>> names) {
        String text = smtlib.trim();
        if (!text.startsWith("(assert") && !text.startsWith("(declare")) {
            text = "(assert " + text + ")";
        }
        Symbol[] declNames = new Symbol[names.size()];
        FuncDecl<?>[] decls = new FuncDecl<?>[names.size()];
        int i = 0;
        for (Map.Entry<String, Expr<?>> e : names.entrySet()) {
            declNames[i] = ctx.mkSymbol(e.getKey());
            decls[i] = e.getValue().getFuncDecl();
            i = i + 1;
        }
        BoolExpr[] formulas;
        try {
            formulas = ctx.parseSMTLIB2String(text, new Symbol[0], new Sort[0], declNames, decls);
        } catch (Z3Exception e) {
            throw new TranslationException("invalid SMT-LIB2 formula \"" + smtlib + "\"", e);
        }
        if (formulas.length == 1) {
            return formulas[0];
        }
        return ctx.mkAnd(formulas);
    }

    /**
     * Collect the names of the registers bound in an environment. Each register
     * <code>x</code> is available as <code>x + suffix</code> and, where it has
     * one, its initial value as <code>init_x + suffix</code>.
     *
     * @param env
     * @param suffix
     * @return
     */
    public static Map<String, Expr<?>> names(Environment env, String suffix) {
        Map<String, Expr<?>> names = new LinkedHashMap<>();
        addNames(env, suffix, names);
        return names;
    }

    public static void addNames(Environment env, String suffix, Map<String, Expr<?>> names) {
        for (Map.Entry<Var, Expr<?>> e : env.getVars().entrySet()) {
            names.put(e.getKey().getName() + suffix, e.getValue());
        }
        for (Map.Entry<Var, Expr<?>> e : env.getInitVars().entrySet()) {
            names.put("init_" + e.getKey().getName() + suffix, e.getValue());
        }
    }
}
