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
 * Dispatches over the expression forms of a lifted program, visiting operands
 * before constructing a result for the enclosing expression.
 *
 * @param <E> the type of result produced for each expression.
 */
public abstract class AbstractExpressionVisitor<E> {

    public E visitExpression(Expr expr) {
        if (expr instanceof Expr.Constant) {
            return constructConstant((Expr.Constant) expr);
        } else if (expr instanceof Expr.VariableAccess) {
            return constructVariableAccess((Expr.VariableAccess) expr);
        } else if (expr instanceof Expr.Load) {
            return visitLoad((Expr.Load) expr);
        } else if (expr instanceof Expr.Store) {
            return visitStore((Expr.Store) expr);
        } else if (expr instanceof Expr.BinaryOperator) {
            return visitBinaryOperator((Expr.BinaryOperator) expr);
        } else if (expr instanceof Expr.UnaryOperator) {
            return visitUnaryOperator((Expr.UnaryOperator) expr);
        } else if (expr instanceof Expr.Cast) {
            return visitCast((Expr.Cast) expr);
        } else if (expr instanceof Expr.Ite) {
            return visitIte((Expr.Ite) expr);
        } else if (expr instanceof Expr.Extract) {
            return visitExtract((Expr.Extract) expr);
        } else if (expr instanceof Expr.Concat) {
            return visitConcat((Expr.Concat) expr);
        } else if (expr instanceof Expr.Let) {
            return visitLet((Expr.Let) expr);
        } else if (expr instanceof Expr.Unknown) {
            return constructUnknown((Expr.Unknown) expr);
        } else {
            throw new IllegalArgumentException("unknown expression encountered (" + expr.getClass().getName() + ")");
        }
    }

    public E visitLoad(Expr.Load expr) {
        E memory = visitExpression(expr.getMemory());
        E address = visitExpression(expr.getAddress());
        return constructLoad(expr, memory, address);
    }

    public E visitStore(Expr.Store expr) {
        E memory = visitExpression(expr.getMemory());
        E address = visitExpression(expr.getAddress());
        E value = visitExpression(expr.getValue());
        return constructStore(expr, memory, address, value);
    }

    public E visitBinaryOperator(Expr.BinaryOperator expr) {
        E lhs = visitExpression(expr.getLeftHandSide());
        E rhs = visitExpression(expr.getRightHandSide());
        return constructBinaryOperator(expr, lhs, rhs);
    }

    public E visitUnaryOperator(Expr.UnaryOperator expr) {
        E operand = visitExpression(expr.getOperand());
        return constructUnaryOperator(expr, operand);
    }

    public E visitCast(Expr.Cast expr) {
        E operand = visitExpression(expr.getOperand());
        return constructCast(expr, operand);
    }

    public E visitIte(Expr.Ite expr) {
        E condition = visitExpression(expr.getCondition());
        E trueBranch = visitExpression(expr.getTrueBranch());
        E falseBranch = visitExpression(expr.getFalseBranch());
        return constructIte(expr, condition, trueBranch, falseBranch);
    }

    public E visitExtract(Expr.Extract expr) {
        E operand = visitExpression(expr.getOperand());
        return constructExtract(expr, operand);
    }

    public E visitConcat(Expr.Concat expr) {
        E lhs = visitExpression(expr.getLeftHandSide());
        E rhs = visitExpression(expr.getRightHandSide());
        return constructConcat(expr, lhs, rhs);
    }

    public E visitLet(Expr.Let expr) {
        E value = visitExpression(expr.getValue());
        E body = visitExpression(expr.getBody());
        return constructLet(expr, value, body);
    }

    protected abstract E constructConstant(Expr.Constant expr);

    protected abstract E constructVariableAccess(Expr.VariableAccess expr);

    protected abstract E constructLoad(Expr.Load expr, E memory, E address);

    protected abstract E constructStore(Expr.Store expr, E memory, E address, E value);

    protected abstract E constructBinaryOperator(Expr.BinaryOperator expr, E lhs, E rhs);

    protected abstract E constructUnaryOperator(Expr.UnaryOperator expr, E operand);

    protected abstract E constructCast(Expr.Cast expr, E operand);

    protected abstract E constructIte(Expr.Ite expr, E condition, E trueBranch, E falseBranch);

    protected abstract E constructExtract(Expr.Extract expr, E operand);

    protected abstract E constructConcat(Expr.Concat expr, E lhs, E rhs);

    protected abstract E constructLet(Expr.Let expr, E value, E body);

    protected abstract E constructUnknown(Expr.Unknown expr);
}
