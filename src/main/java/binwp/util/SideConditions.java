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

import java.math.BigInteger;
import java.util.Optional;
import java.util.function.UnaryOperator;

import com.microsoft.z3.ArrayExpr;
import com.microsoft.z3.BitVecExpr;
import com.microsoft.z3.BitVecSort;
import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;

import binwp.core.BirFile.Expr;
import binwp.core.BirFile.Var;
import binwp.core.Environment;
import binwp.core.Environment.Cond;
import binwp.core.Environment.ExpCond;

/**
 * Expression conditions which make the implicit requirements of an expression
 * explicit. For example, consider the following assignment:
 *
 * <pre>
 *     RAX := mem[RDI, el]:u64
 * </pre>
 *
 * There is an implicit requirement that <code>RDI</code> is not null. A
 * <i>verification</i> condition makes this a goal which must be proved, whilst
 * an <i>assumption</i> adds it as a hypothesis. Conditions are placed before
 * the assignment, since they constrain the state in which the expression is
 * evaluated.
 */
public class SideConditions {

    public static final ExpCond NON_NULL_LOAD_VC = nonNull(Cond.Kind.VERIFY, true, false);
    public static final ExpCond NON_NULL_LOAD_ASSUME = nonNull(Cond.Kind.ASSUME, true, false);
    public static final ExpCond NON_NULL_STORE_VC = nonNull(Cond.Kind.VERIFY, false, true);
    public static final ExpCond NON_NULL_STORE_ASSUME = nonNull(Cond.Kind.ASSUME, false, true);

    public static final ExpCond VALID_LOAD_VC = validRegion(Cond.Kind.VERIFY, true, false);
    public static final ExpCond VALID_LOAD_ASSUME = validRegion(Cond.Kind.ASSUME, true, false);
    public static final ExpCond VALID_STORE_VC = validRegion(Cond.Kind.VERIFY, false, true);
    public static final ExpCond VALID_STORE_ASSUME = validRegion(Cond.Kind.ASSUME, false, true);

    /**
     * Requires the divisor of every division and remainder to be non-zero.
     */
    public static final ExpCond DIVISION_BY_ZERO_VC = (env, expr) -> {
        if (expr instanceof Expr.BinaryOperator && ((Expr.BinaryOperator) expr).getKind().isDivision()) {
            Context ctx = env.getContext();
            BitVecExpr divisor = env.getTranslator().bitvector(((Expr.BinaryOperator) expr).getRightHandSide());
            BoolExpr term = ctx.mkNot(ctx.mkEq(divisor, ctx.mkBV(0, divisor.getSortSize())));
            return Optional.of(new Cond("division_by_zero", Cond.Kind.VERIFY, Cond.Placement.BEFORE, term));
        }
        return Optional.empty();
    };

    /**
     * Construct a condition on the address of loads and/or stores that it is not
     * zero.
     */
    public static ExpCond nonNull(Cond.Kind kind, boolean loads, boolean stores) {
        return (env, expr) -> {
            Expr address = addressOf(expr, loads, stores);
            if (address == null) {
                return Optional.empty();
            }
            Context ctx = env.getContext();
            BitVecExpr addr = env.getTranslator().bitvector(address);
            BoolExpr term = ctx.mkNot(ctx.mkEq(addr, ctx.mkBV(0, addr.getSortSize())));
            String name = (expr instanceof Expr.Load ? "load" : "store") + "_non_null";
            return Optional.of(new Cond(name, kind, Cond.Placement.BEFORE, term));
        };
    }

    /**
     * Construct a condition that every byte accessed by loads and/or stores lies
     * within either the stack or the heap region of the environment.
     */
    public static ExpCond validRegion(Cond.Kind kind, boolean loads, boolean stores) {
        return (env, expr) -> {
            Expr address = addressOf(expr, loads, stores);
            if (address == null) {
                return Optional.empty();
            }
            Context ctx = env.getContext();
            BitVecExpr first = env.getTranslator().bitvector(address);
            int bytes = (expr instanceof Expr.Load ? ((Expr.Load) expr).getSize() : ((Expr.Store) expr).getSize()) / 8;
            BitVecExpr last = ctx.mkBVAdd(first, ctx.mkBV(Math.max(bytes - 1, 0), first.getSortSize()));
            BoolExpr inStack = ctx.mkAnd(env.getStackRange().contains(ctx, first),
                    env.getStackRange().contains(ctx, last));
            BoolExpr inHeap = ctx.mkAnd(env.getHeapRange().contains(ctx, first), env.getHeapRange().contains(ctx, last));
            String name = (expr instanceof Expr.Load ? "load" : "store") + "_in_region";
            return Optional.of(new Cond(name, kind, Cond.Placement.BEFORE, ctx.mkOr(inStack, inHeap)));
        };
    }

    /**
     * Relates the memory read by one program to the initial memory of another.
     * For every load at address <code>a</code> in the program being analysed,
     * this assumes the loaded value equals the value at
     * <code>offset(a)</code> in the initial memory of <code>other</code>. This
     * is used where the data of the second program has been relocated.
     *
     * @param other
     * @param offset
     * @return
     */
    public static ExpCond memReadOffsets(Environment other, UnaryOperator<BitVecExpr> offset) {
        return (env, expr) -> {
            if (!(expr instanceof Expr.Load)) {
                return Optional.empty();
            }
            Expr.Load load = (Expr.Load) expr;
            Context ctx = env.getContext();
            Var memory = memoryOf(load);
            com.microsoft.z3.Expr<?> otherMemory = memory == null ? null : other.getVar(memory);
            if (otherMemory == null) {
                return Optional.empty();
            }
            BitVecExpr addr = env.getTranslator().bitvector(load.getAddress());
            ArrayExpr<BitVecSort, BitVecSort> mem = ExpressionTranslator
                    .asMemory(env.getTranslator().term(load.getMemory()));
            BitVecExpr mine = ExpressionTranslator.load(ctx, mem, addr, load.getSize(), load.getEndian());
            BitVecExpr theirs = ExpressionTranslator.load(ctx, ExpressionTranslator.asMemory(otherMemory),
                    offset.apply(addr), load.getSize(), load.getEndian());
            return Optional.of(new Cond("mem_read_offset", Cond.Kind.ASSUME, Cond.Placement.BEFORE,
                    ctx.mkEq(mine, theirs)));
        };
    }

    /**
     * Construct the offset function <code>a ==> a + delta</code>.
     *
     * @param ctx
     * @param delta
     * @return
     */
    public static UnaryOperator<BitVecExpr> constantOffset(Context ctx, BigInteger delta) {
        return addr -> ctx.mkBVAdd(addr, ctx.mkBV(delta.toString(), addr.getSortSize()));
    }

    private static Expr addressOf(Expr expr, boolean loads, boolean stores) {
        if (loads && expr instanceof Expr.Load) {
            return ((Expr.Load) expr).getAddress();
        } else if (stores && expr instanceof Expr.Store) {
            return ((Expr.Store) expr).getAddress();
        } else {
            return null;
        }
    }

    private static Var memoryOf(Expr.Load load) {
        Expr m = load.getMemory();
        while (m instanceof Expr.Store) {
            m = ((Expr.Store) m).getMemory();
        }
        return m instanceof Expr.VariableAccess ? ((Expr.VariableAccess) m).getVariable() : null;
    }
}
