// Copyright 2020 The Whiley Project Developers
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
package specexec.util;

import specexec.core.SpecFile.Expr;

import java.util.List;

/**
 * Folds information over every subexpression of an expression. Subclasses
 * override the <code>construct</code> methods for the nodes they are
 * interested in, and rely on {@link #join(Object, Object)} for the rest.
 */
public abstract class AbstractExpressionFold<E> extends AbstractExpressionVisitor<E> {

    @Override
    protected E visitUniversalQuantifier(Expr.UniversalQuantifier expr) {
        return visitExpression(expr.getBody());
    }

    @Override
    protected E visitExistentialQuantifier(Expr.ExistentialQuantifier expr) {
        return visitExpression(expr.getBody());
    }

    @Override
    protected E visitAt(Expr.At expr) {
        return visitExpression(expr.getOperand());
    }

    @Override
    protected E visitInvoke(Expr.Invoke expr) {
        return join(visitExpressions(expr.getArguments()));
    }

    @Override
    protected E visitMethodCall(Expr.MethodCall expr) {
        E args = join(visitExpressions(expr.getArguments()));
        if (expr.getEnvironment() != null) {
            return join(visitExpression(expr.getEnvironment()), args);
        }
        return args;
    }

    @Override
    protected E visitFieldAccess(Expr.FieldAccess expr) {
        return visitExpression(expr.getOperand());
    }

    @Override
    protected E constructInteger(Expr.Integer expr) {
        return BOTTOM();
    }

    @Override
    protected E constructBoolean(Expr.Boolean expr) {
        return BOTTOM();
    }

    @Override
    protected E constructVariableAccess(Expr.VariableAccess expr) {
        return BOTTOM();
    }

    @Override
    protected E constructNegation(Expr.Negation expr, E operand) {
        return operand;
    }

    @Override
    protected E constructAddition(Expr.Addition expr, E lhs, E rhs) {
        return join(lhs, rhs);
    }

    @Override
    protected E constructSubtraction(Expr.Subtraction expr, E lhs, E rhs) {
        return join(lhs, rhs);
    }

    @Override
    protected E constructMultiplication(Expr.Multiplication expr, E lhs, E rhs) {
        return join(lhs, rhs);
    }

    @Override
    protected E constructDivision(Expr.Division expr, E lhs, E rhs) {
        return join(lhs, rhs);
    }

    @Override
    protected E constructRemainder(Expr.Remainder expr, E lhs, E rhs) {
        return join(lhs, rhs);
    }

    @Override
    protected E constructEquals(Expr.Equals expr, E lhs, E rhs) {
        return join(lhs, rhs);
    }

    @Override
    protected E constructNotEquals(Expr.NotEquals expr, E lhs, E rhs) {
        return join(lhs, rhs);
    }

    @Override
    protected E constructLessThan(Expr.LessThan expr, E lhs, E rhs) {
        return join(lhs, rhs);
    }

    @Override
    protected E constructLessThanOrEqual(Expr.LessThanOrEqual expr, E lhs, E rhs) {
        return join(lhs, rhs);
    }

    @Override
    protected E constructGreaterThan(Expr.GreaterThan expr, E lhs, E rhs) {
        return join(lhs, rhs);
    }

    @Override
    protected E constructGreaterThanOrEqual(Expr.GreaterThanOrEqual expr, E lhs, E rhs) {
        return join(lhs, rhs);
    }

    @Override
    protected E constructLogicalAnd(Expr.LogicalAnd expr, List<E> operands) {
        return join(operands);
    }

    @Override
    protected E constructLogicalOr(Expr.LogicalOr expr, List<E> operands) {
        return join(operands);
    }

    @Override
    protected E constructLogicalNot(Expr.LogicalNot expr, E operand) {
        return operand;
    }

    @Override
    protected E constructLogicalImplication(Expr.Implies expr, E lhs, E rhs) {
        return join(lhs, rhs);
    }

    @Override
    protected E constructLogicalIff(Expr.Iff expr, E lhs, E rhs) {
        return join(lhs, rhs);
    }

    @Override
    protected E constructIfThenElse(Expr.IfThenElse expr, E condition, E trueBranch, E falseBranch) {
        return join(condition, join(trueBranch, falseBranch));
    }

    @Override
    protected E constructCast(Expr.Cast expr, E operand) {
        return operand;
    }

    @Override
    protected E constructStorageAccess(Expr.StorageAccess expr, List<E> keys) {
        return join(keys);
    }

    @Override
    protected E constructGhostAccess(Expr.GhostAccess expr, List<E> keys) {
        return join(keys);
    }

    @Override
    protected E constructLastReverted(Expr.LastReverted expr) {
        return BOTTOM();
    }

    @Override
    protected E constructStorageComparison(Expr.StorageComparison expr) {
        return BOTTOM();
    }

    @Override
    protected E constructSelectorLiteral(Expr.SelectorLiteral expr) {
        return BOTTOM();
    }

    protected E join(List<E> items) {
        E result = BOTTOM();
        for (int i = 0; i != items.size(); ++i) {
            result = join(result, items.get(i));
        }
        return result;
    }

    protected abstract E BOTTOM();

    protected abstract E join(E lhs, E rhs);
}
