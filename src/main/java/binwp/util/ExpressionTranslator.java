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
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.microsoft.z3.ArrayExpr;
import com.microsoft.z3.ArraySort;
import com.microsoft.z3.BitVecExpr;
import com.microsoft.z3.BitVecSort;
import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;

import binwp.core.BirFile.Endian;
import binwp.core.BirFile.Expr;
import binwp.core.BirFile.Type;
import binwp.core.BirFile.Var;
import binwp.core.Environment;
import binwp.core.Environment.Cond;
import binwp.core.Environment.ExpCond;

/**
 * Translates lifted expressions into solver terms over bit-vectors and arrays.
 * Registers become bit-vector constants and memory becomes an array from
 * addresses to bytes. While translating, the expression conditions of the
 * environment are consulted for every subexpression and the resulting side
 * conditions are collected as <i>hooks</i>.
 */
public class ExpressionTranslator {
    private static final Logger logger = LoggerFactory.getLogger(ExpressionTranslator.class);

    private final Environment env;
    private final Context ctx;
    /**
     * Number of calls to <code>translate()</code>.
     */
    private int callCount;
    /**
     * The terms of every subexpression translated so far by the current call to
     * <code>translate()</code>, or <code>null</code> outside of one.
     */
    private Map<Expr, com.microsoft.z3.Expr<?>> translated;

    public ExpressionTranslator(Environment env) {
        this.env = env;
        this.ctx = env.getContext();
    }

    /**
     * Translate an expression and collect the side conditions it generates.
     *
     * @param expr
     * @return
     */
    public Result translate(Expr expr) {
        callCount++;
        Translator translator = new Translator(true);
        Map<Expr, com.microsoft.z3.Expr<?>> outer = translated;
        translated = new IdentityHashMap<>();
        com.microsoft.z3.Expr<?> term;
        try {
            term = translator.visitExpression(expr);
        } finally {
            translated = outer;
        }
        if (logger.isTraceEnabled()) {
            logger.trace("translated {} hook(s) for term {}", translator.hooks.size(), term);
        }
        return new Result(term, translator.hooks);
    }

    /**
     * Translate an expression without consulting any expression conditions.
     * During a call to <code>translate()</code>, a subexpression already
     * translated yields the same term, so expression conditions see the same
     * unknown values as the expression they constrain.
     *
     * @param expr
     * @return
     */
    public com.microsoft.z3.Expr<?> term(Expr expr) {
        com.microsoft.z3.Expr<?> term = translated == null ? null : translated.get(expr);
        return term != null ? term : new Translator(false).visitExpression(expr);
    }

    public BitVecExpr bitvector(Expr expr) {
        return asBitVector(term(expr));
    }

    /**
     * Translate a one-bit condition into a boolean.
     *
     * @param expr
     * @return
     */
    public BoolExpr condition(Expr expr) {
        return Util.toBool(ctx, bitvector(expr));
    }

    public int getCallCount() {
        return callCount;
    }

    // =========================================================================
    // Memory
    // =========================================================================

    /**
     * Read <code>size</code> bits starting at a given address, one memory cell at
     * a time. In little-endian order the cell at the lowest address is least
     * significant.
     *
     * @param ctx
     * @param mem
     * @param addr
     * @param size
     * @param endian
     * @return
     */
    public static BitVecExpr load(Context ctx, ArrayExpr<BitVecSort, BitVecSort> mem, BitVecExpr addr, int size,
            Endian endian) {
        int cell = cellWidth(mem);
        int n = cellCount(size, cell);
        BitVecExpr result = null;
        for (int i = 0; i != n; ++i) {
            BitVecExpr b = (BitVecExpr) ctx.mkSelect(mem, offset(ctx, addr, i));
            if (result == null) {
                result = b;
            } else if (endian == Endian.LITTLE) {
                result = ctx.mkConcat(b, result);
            } else {
                result = ctx.mkConcat(result, b);
            }
        }
        return result;
    }

    /**
     * Write a value of <code>size</code> bits starting at a given address, one
     * memory cell at a time.
     *
     * @param ctx
     * @param mem
     * @param addr
     * @param value
     * @param size
     * @param endian
     * @return
     */
    public static ArrayExpr<BitVecSort, BitVecSort> store(Context ctx, ArrayExpr<BitVecSort, BitVecSort> mem,
            BitVecExpr addr, BitVecExpr value, int size, Endian endian) {
        int cell = cellWidth(mem);
        int n = cellCount(size, cell);
        if (value.getSortSize() != size) {
            throw new WidthMismatchException("store", size, value.getSortSize());
        }
        for (int i = 0; i != n; ++i) {
            BitVecExpr b;
            if (endian == Endian.LITTLE) {
                b = ctx.mkExtract(cell * (i + 1) - 1, cell * i, value);
            } else {
                b = ctx.mkExtract(size - 1 - cell * i, size - cell * (i + 1), value);
            }
            mem = ctx.mkStore(mem, offset(ctx, addr, i), b);
        }
        return mem;
    }

    private static int cellWidth(ArrayExpr<BitVecSort, BitVecSort> mem) {
        ArraySort<BitVecSort, BitVecSort> sort = mem.getSort();
        return sort.getRange().getSize();
    }

    private static int cellCount(int size, int cell) {
        if (size <= 0 || size % cell != 0) {
            throw new TranslationException("cannot access " + size + " bits in memory of " + cell + "-bit cells");
        }
        return size / cell;
    }

    private static BitVecExpr offset(Context ctx, BitVecExpr addr, int i) {
        return i == 0 ? addr : ctx.mkBVAdd(addr, ctx.mkBV(i, addr.getSortSize()));
    }

    public static BitVecExpr asBitVector(com.microsoft.z3.Expr<?> term) {
        if (term instanceof BitVecExpr) {
            return (BitVecExpr) term;
        }
        throw new TranslationException("expected bit-vector term, found " + term.getSort());
    }

    @SuppressWarnings("unchecked")
    public static ArrayExpr<BitVecSort, BitVecSort> asMemory(com.microsoft.z3.Expr<?> term) {
        if (term instanceof ArrayExpr) {
            return (ArrayExpr<BitVecSort, BitVecSort>) term;
        }
        throw new TranslationException("expected memory term, found " + term.getSort());
    }

    // =========================================================================
    // Results
    // =========================================================================

    public static final class Result {
        private final com.microsoft.z3.Expr<?> term;
        private final Hooks hooks;

        private Result(com.microsoft.z3.Expr<?> term, Hooks hooks) {
            this.term = term;
            this.hooks = hooks;
        }

        public com.microsoft.z3.Expr<?> getTerm() {
            return term;
        }

        public Hooks getHooks() {
            return hooks;
        }
    }

    /**
     * The side conditions generated while translating an expression, split by
     * kind and by whether they belong before or after the enclosing assignment.
     */
    public static final class Hooks {
        private final List<Cond> assumeBefore = new ArrayList<>();
        private final List<Cond> verifyBefore = new ArrayList<>();
        private final List<Cond> assumeAfter = new ArrayList<>();
        private final List<Cond> verifyAfter = new ArrayList<>();

        public void add(Cond cond) {
            boolean before = cond.getPlacement() == Cond.Placement.BEFORE;
            if (cond.getKind() == Cond.Kind.ASSUME) {
                (before ? assumeBefore : assumeAfter).add(cond);
            } else {
                (before ? verifyBefore : verifyAfter).add(cond);
            }
        }

        public List<Cond> getAssumeBefore() {
            return Collections.unmodifiableList(assumeBefore);
        }

        public List<Cond> getVerifyBefore() {
            return Collections.unmodifiableList(verifyBefore);
        }

        public List<Cond> getAssumeAfter() {
            return Collections.unmodifiableList(assumeAfter);
        }

        public List<Cond> getVerifyAfter() {
            return Collections.unmodifiableList(verifyAfter);
        }

        /**
         * Add the conditions of a subexpression which is only evaluated when a
         * given guard holds, such as a branch of an <code>ite</code>.
         *
         * @param ctx
         * @param guard
         * @param inner
         */
        public void addGuarded(Context ctx, BoolExpr guard, Hooks inner) {
            for (List<Cond> conds : Arrays.asList(inner.assumeBefore, inner.verifyBefore, inner.assumeAfter,
                    inner.verifyAfter)) {
                for (Cond c : conds) {
                    add(new Cond(c.getName(), c.getKind(), c.getPlacement(), ctx.mkImplies(guard, c.getTerm())));
                }
            }
        }

        public int size() {
            return assumeBefore.size() + verifyBefore.size() + assumeAfter.size() + verifyAfter.size();
        }

        public boolean isEmpty() {
            return size() == 0;
        }
    }

    // =========================================================================
    // Translator
    // =========================================================================

    private class Translator extends AbstractExpressionVisitor<com.microsoft.z3.Expr<?>> {
        private final boolean collect;
        private Hooks hooks = new Hooks();

        public Translator(boolean collect) {
            this.collect = collect;
        }

        @Override
        public com.microsoft.z3.Expr<?> visitExpression(Expr expr) {
            com.microsoft.z3.Expr<?> term = super.visitExpression(expr);
            if (collect) {
                translated.put(expr, term);
                for (ExpCond cond : env.getExpConds()) {
                    Optional<Cond> c = cond.apply(env, expr);
                    if (c.isPresent()) {
                        hooks.add(c.get());
                    }
                }
            }
            return term;
        }

        /**
         * Side conditions arising in either branch are only required when that
         * branch is taken.
         */
        @Override
        public com.microsoft.z3.Expr<?> visitIte(Expr.Ite expr) {
            com.microsoft.z3.Expr<?> condition = visitExpression(expr.getCondition());
            BoolExpr guard = Util.toBool(ctx, asBitVector(condition));
            Hooks outer = hooks;
            try {
                hooks = new Hooks();
                com.microsoft.z3.Expr<?> trueBranch = visitExpression(expr.getTrueBranch());
                outer.addGuarded(ctx, guard, hooks);
                hooks = new Hooks();
                com.microsoft.z3.Expr<?> falseBranch = visitExpression(expr.getFalseBranch());
                outer.addGuarded(ctx, ctx.mkNot(guard), hooks);
                return constructIte(expr, condition, trueBranch, falseBranch);
            } finally {
                hooks = outer;
            }
        }

        @Override
        public com.microsoft.z3.Expr<?> visitLet(Expr.Let expr) {
            com.microsoft.z3.Expr<?> value = visitExpression(expr.getValue());
            Var var = expr.getVariable();
            com.microsoft.z3.Expr<?> previous = env.getVar(var);
            env.bindVar(var, value);
            try {
                return visitExpression(expr.getBody());
            } finally {
                if (previous == null) {
                    env.unbindVar(var);
                } else {
                    env.bindVar(var, previous);
                }
            }
        }

        @Override
        protected com.microsoft.z3.Expr<?> constructConstant(Expr.Constant expr) {
            BigInteger value = expr.getValue();
            if (value.bitLength() < 63) {
                return ctx.mkBV(value.longValue(), expr.getWidth());
            } else {
                return ctx.mkBV(value.toString(), expr.getWidth());
            }
        }

        @Override
        protected com.microsoft.z3.Expr<?> constructVariableAccess(Expr.VariableAccess expr) {
            com.microsoft.z3.Expr<?> term = env.getVar(expr.getVariable());
            if (term == null) {
                throw new UnboundVariableException(expr.getVariable());
            }
            return term;
        }

        @Override
        protected com.microsoft.z3.Expr<?> constructLoad(Expr.Load expr, com.microsoft.z3.Expr<?> memory,
                com.microsoft.z3.Expr<?> address) {
            return load(ctx, asMemory(memory), asBitVector(address), expr.getSize(), expr.getEndian());
        }

        @Override
        protected com.microsoft.z3.Expr<?> constructStore(Expr.Store expr, com.microsoft.z3.Expr<?> memory,
                com.microsoft.z3.Expr<?> address, com.microsoft.z3.Expr<?> value) {
            return store(ctx, asMemory(memory), asBitVector(address), asBitVector(value), expr.getSize(),
                    expr.getEndian());
        }

        @Override
        protected com.microsoft.z3.Expr<?> constructBinaryOperator(Expr.BinaryOperator expr,
                com.microsoft.z3.Expr<?> l, com.microsoft.z3.Expr<?> r) {
            BitVecExpr lhs = asBitVector(l);
            BitVecExpr rhs = asBitVector(r);
            Expr.BinOp kind = expr.getKind();
            if (kind.isShift()) {
                return shift(kind, lhs, rhs);
            } else if (lhs.getSortSize() != rhs.getSortSize()) {
                throw new WidthMismatchException(kind.getSymbol(), lhs.getSortSize(), rhs.getSortSize());
            }
            switch (kind) {
            case PLUS:
                return ctx.mkBVAdd(lhs, rhs);
            case MINUS:
                return ctx.mkBVSub(lhs, rhs);
            case TIMES:
                return ctx.mkBVMul(lhs, rhs);
            case DIVIDE:
                return ctx.mkBVUDiv(lhs, rhs);
            case SDIVIDE:
                return ctx.mkBVSDiv(lhs, rhs);
            case MOD:
                return ctx.mkBVURem(lhs, rhs);
            case SMOD:
                return ctx.mkBVSMod(lhs, rhs);
            case AND:
                return ctx.mkBVAND(lhs, rhs);
            case OR:
                return ctx.mkBVOR(lhs, rhs);
            case XOR:
                return ctx.mkBVXOR(lhs, rhs);
            case EQ:
                return Util.toBit(ctx, ctx.mkEq(lhs, rhs));
            case NEQ:
                return Util.toBit(ctx, ctx.mkNot(ctx.mkEq(lhs, rhs)));
            case LT:
                return Util.toBit(ctx, ctx.mkBVULT(lhs, rhs));
            case LE:
                return Util.toBit(ctx, ctx.mkBVULE(lhs, rhs));
            case SLT:
                return Util.toBit(ctx, ctx.mkBVSLT(lhs, rhs));
            case SLE:
                return Util.toBit(ctx, ctx.mkBVSLE(lhs, rhs));
            default:
                throw new TranslationException("unknown binary operator " + kind);
            }
        }

        /**
         * Shift amounts may have a different width from the value shifted. The
         * shift is then carried out at the wider of the two widths and the result
         * truncated.
         */
        private BitVecExpr shift(Expr.BinOp kind, BitVecExpr lhs, BitVecExpr rhs) {
            int w = lhs.getSortSize();
            int n = rhs.getSortSize();
            if (n < w) {
                rhs = ctx.mkZeroExt(w - n, rhs);
            } else if (n > w) {
                lhs = kind == Expr.BinOp.ARSHIFT ? ctx.mkSignExt(n - w, lhs) : ctx.mkZeroExt(n - w, lhs);
            }
            BitVecExpr result;
            switch (kind) {
            case LSHIFT:
                result = ctx.mkBVSHL(lhs, rhs);
                break;
            case RSHIFT:
                result = ctx.mkBVLSHR(lhs, rhs);
                break;
            default:
                result = ctx.mkBVASHR(lhs, rhs);
                break;
            }
            return n > w ? ctx.mkExtract(w - 1, 0, result) : result;
        }

        @Override
        protected com.microsoft.z3.Expr<?> constructUnaryOperator(Expr.UnaryOperator expr,
                com.microsoft.z3.Expr<?> operand) {
            BitVecExpr bv = asBitVector(operand);
            switch (expr.getKind()) {
            case NEG:
                return ctx.mkBVNeg(bv);
            default:
                return ctx.mkBVNot(bv);
            }
        }

        @Override
        protected com.microsoft.z3.Expr<?> constructCast(Expr.Cast expr, com.microsoft.z3.Expr<?> operand) {
            BitVecExpr bv = asBitVector(operand);
            int n = bv.getSortSize();
            int w = expr.getWidth();
            switch (expr.getKind()) {
            case UNSIGNED:
                return w > n ? ctx.mkZeroExt(w - n, bv) : w < n ? ctx.mkExtract(w - 1, 0, bv) : bv;
            case SIGNED:
                return w > n ? ctx.mkSignExt(w - n, bv) : w < n ? ctx.mkExtract(w - 1, 0, bv) : bv;
            case HIGH:
                if (w > n) {
                    throw new WidthMismatchException("high cast", n, w);
                }
                return w == n ? bv : ctx.mkExtract(n - 1, n - w, bv);
            default:
                if (w > n) {
                    throw new WidthMismatchException("low cast", n, w);
                }
                return w == n ? bv : ctx.mkExtract(w - 1, 0, bv);
            }
        }

        @Override
        protected com.microsoft.z3.Expr<?> constructIte(Expr.Ite expr, com.microsoft.z3.Expr<?> condition,
                com.microsoft.z3.Expr<?> trueBranch, com.microsoft.z3.Expr<?> falseBranch) {
            BoolExpr c = Util.toBool(ctx, asBitVector(condition));
            if (!trueBranch.getSort().equals(falseBranch.getSort())) {
                if (trueBranch instanceof BitVecExpr && falseBranch instanceof BitVecExpr) {
                    throw new WidthMismatchException("ite", ((BitVecExpr) trueBranch).getSortSize(),
                            ((BitVecExpr) falseBranch).getSortSize());
                }
                throw new TranslationException("mismatched branches in ite");
            }
            return ctx.mkITE(c, trueBranch, falseBranch);
        }

        @Override
        protected com.microsoft.z3.Expr<?> constructExtract(Expr.Extract expr, com.microsoft.z3.Expr<?> operand) {
            BitVecExpr bv = asBitVector(operand);
            if (expr.getHigh() >= bv.getSortSize()) {
                throw new WidthMismatchException("extract", bv.getSortSize(), expr.getHigh() + 1);
            }
            return ctx.mkExtract(expr.getHigh(), expr.getLow(), bv);
        }

        @Override
        protected com.microsoft.z3.Expr<?> constructConcat(Expr.Concat expr, com.microsoft.z3.Expr<?> lhs,
                com.microsoft.z3.Expr<?> rhs) {
            return ctx.mkConcat(asBitVector(lhs), asBitVector(rhs));
        }

        @Override
        protected com.microsoft.z3.Expr<?> constructLet(Expr.Let expr, com.microsoft.z3.Expr<?> value,
                com.microsoft.z3.Expr<?> body) {
            // Never reached since visitLet() is overridden.
            return body;
        }

        @Override
        protected com.microsoft.z3.Expr<?> constructUnknown(Expr.Unknown expr) {
            if (expr.getType() instanceof Type.Unknown) {
                throw new TranslationException("unknown expression of unknown type: " + expr.getDescription());
            }
            return ctx.mkConst(env.getVarGen().fresh("unknown"), env.sortOf(expr.getType()));
        }
    }
}
