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

import binwp.core.BirFile.Expr;

/**
 * An expression visitor which combines the results of all subexpressions using
 * a join operator. Leaves produce <code>BOTTOM()</code> unless overridden.
 *
 * @param <E>
 */
public abstract class AbstractExpressionFold<E> extends AbstractExpressionVisitor<E> {

    @Override
    protected E constructConstant(Expr.Constant expr) {
        return BOTTOM();
    }

    @Override
    protected E constructVariableAccess(Expr.VariableAccess expr) {
        return BOTTOM();
    }

    @Override
    protected E constructLoad(Expr.Load expr, E memory, E address) {
        return join(memory, address);
    }

    @Override
    protected E constructStore(Expr.Store expr, E memory, E address, E value) {
        return join(memory, join(address, value));
    }

    @Override
    protected E constructBinaryOperator(Expr.BinaryOperator expr, E lhs, E rhs) {
        return join(lhs, rhs);
    }

    @Override
    protected E constructUnaryOperator(Expr.UnaryOperator expr, E operand) {
        return operand;
    }

    @Override
    protected E constructCast(Expr.Cast expr, E operand) {
        return operand;
    }

    @Override
    protected E constructIte(Expr.Ite expr, E condition, E trueBranch, E falseBranch) {
        return join(condition, join(trueBranch, falseBranch));
    }

    @Override
    protected E constructExtract(Expr.Extract expr, E operand) {
        return operand;
    }

    @Override
    protected E constructConcat(Expr.Concat expr, E lhs, E rhs) {
        return join(lhs, rhs);
    }

    @Override
    protected E constructLet(Expr.Let expr, E value, E body) {
        return join(value, body);
    }

    @Override
    protected E constructUnknown(Expr.Unknown expr) {
        return BOTTOM();
    }

    public abstract E join(E lhs, E rhs);

    public abstract E BOTTOM();
}
