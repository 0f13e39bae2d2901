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
import specexec.core.SpecFile.Path;

import java.util.ArrayList;
import java.util.List;

/**
 * Visits a specification expression bottom-up, constructing a result of type
 * <code>E</code> for each node from the results of its children. Expressions
 * which introduce bindings or change the state they are evaluated against
 * (quantifiers, snapshots, definitions and method calls) must be handled
 * directly by the subclass, since the order in which their children are
 * visited matters.
 */
public abstract class AbstractExpressionVisitor<E> {

    public E visitExpression(Expr expr) {
        if (expr instanceof Expr.Integer) {
            return constructInteger((Expr.Integer) expr);
        } else if (expr instanceof Expr.Boolean) {
            return constructBoolean((Expr.Boolean) expr);
        } else if (expr instanceof Expr.VariableAccess) {
            return constructVariableAccess((Expr.VariableAccess) expr);
        } else if (expr instanceof Expr.Negation) {
            return visitNegation((Expr.Negation) expr);
        } else if (expr instanceof Expr.Cast) {
            return visitCast((Expr.Cast) expr);
        } else if (expr instanceof Expr.At) {
            return visitAt((Expr.At) expr);
        } else if (expr instanceof Expr.FieldAccess) {
            return visitFieldAccess((Expr.FieldAccess) expr);
        } else if (expr instanceof Expr.LogicalNot) {
            return visitLogicalNot((Expr.LogicalNot) expr);
        } else if (expr instanceof Expr.BinaryOperator) {
            return visitBinaryOperator((Expr.BinaryOperator) expr);
        } else if (expr instanceof Expr.LogicalAnd) {
            return visitLogicalAnd((Expr.LogicalAnd) expr);
        } else if (expr instanceof Expr.LogicalOr) {
            return visitLogicalOr((Expr.LogicalOr) expr);
        } else if (expr instanceof Expr.IfThenElse) {
            return visitIfThenElse((Expr.IfThenElse) expr);
        } else if (expr instanceof Expr.StorageAccess) {
            return visitStorageAccess((Expr.StorageAccess) expr);
        } else if (expr instanceof Expr.GhostAccess) {
            return visitGhostAccess((Expr.GhostAccess) expr);
        } else if (expr instanceof Expr.UniversalQuantifier) {
            return visitUniversalQuantifier((Expr.UniversalQuantifier) expr);
        } else if (expr instanceof Expr.ExistentialQuantifier) {
            return visitExistentialQuantifier((Expr.ExistentialQuantifier) expr);
        } else if (expr instanceof Expr.Invoke) {
            return visitInvoke((Expr.Invoke) expr);
        } else if (expr instanceof Expr.MethodCall) {
            return visitMethodCall((Expr.MethodCall) expr);
        } else if (expr instanceof Expr.LastReverted) {
            return constructLastReverted((Expr.LastReverted) expr);
        } else if (expr instanceof Expr.StorageComparison) {
            return constructStorageComparison((Expr.StorageComparison) expr);
        } else if (expr instanceof Expr.SelectorLiteral) {
            return constructSelectorLiteral((Expr.SelectorLiteral) expr);
        } else {
            throw new IllegalArgumentException("unknown expression encountered (" + expr.getClass().getName() + ")");
        }
    }

    protected List<E> visitExpressions(List<Expr> exprs) {
        List<E> results = new ArrayList<>();
        for (int i = 0; i != exprs.size(); ++i) {
            results.add(visitExpression(exprs.get(i)));
        }
        return results;
    }

    protected E visitBinaryOperator(Expr.BinaryOperator expr) {
        E lhs = visitExpression(expr.getLeftHandSide());
        E rhs = visitExpression(expr.getRightHandSide());
        if (expr instanceof Expr.Addition) {
            return constructAddition((Expr.Addition) expr, lhs, rhs);
        } else if (expr instanceof Expr.Subtraction) {
            return constructSubtraction((Expr.Subtraction) expr, lhs, rhs);
        } else if (expr instanceof Expr.Multiplication) {
            return constructMultiplication((Expr.Multiplication) expr, lhs, rhs);
        } else if (expr instanceof Expr.Division) {
            return constructDivision((Expr.Division) expr, lhs, rhs);
        } else if (expr instanceof Expr.Remainder) {
            return constructRemainder((Expr.Remainder) expr, lhs, rhs);
        } else if (expr instanceof Expr.Equals) {
            return constructEquals((Expr.Equals) expr, lhs, rhs);
        } else if (expr instanceof Expr.NotEquals) {
            return constructNotEquals((Expr.NotEquals) expr, lhs, rhs);
        } else if (expr instanceof Expr.LessThan) {
            return constructLessThan((Expr.LessThan) expr, lhs, rhs);
        } else if (expr instanceof Expr.LessThanOrEqual) {
            return constructLessThanOrEqual((Expr.LessThanOrEqual) expr, lhs, rhs);
        } else if (expr instanceof Expr.GreaterThan) {
            return constructGreaterThan((Expr.GreaterThan) expr, lhs, rhs);
        } else if (expr instanceof Expr.GreaterThanOrEqual) {
            return constructGreaterThanOrEqual((Expr.GreaterThanOrEqual) expr, lhs, rhs);
        } else if (expr instanceof Expr.Implies) {
            return constructLogicalImplication((Expr.Implies) expr, lhs, rhs);
        } else if (expr instanceof Expr.Iff) {
            return constructLogicalIff((Expr.Iff) expr, lhs, rhs);
        } else {
            throw new IllegalArgumentException("unknown operator encountered (" + expr.getClass().getName() + ")");
        }
    }

    protected E visitNegation(Expr.Negation expr) {
        E operand = visitExpression(expr.getOperand());
        return constructNegation(expr, operand);
    }

    protected E visitLogicalNot(Expr.LogicalNot expr) {
        E operand = visitExpression(expr.getOperand());
        return constructLogicalNot(expr, operand);
    }

    protected E visitLogicalAnd(Expr.LogicalAnd expr) {
        List<E> operands = visitExpressions(expr.getOperands());
        return constructLogicalAnd(expr, operands);
    }

    protected E visitLogicalOr(Expr.LogicalOr expr) {
        List<E> operands = visitExpressions(expr.getOperands());
        return constructLogicalOr(expr, operands);
    }

    protected E visitIfThenElse(Expr.IfThenElse expr) {
        E condition = visitExpression(expr.getCondition());
        E trueBranch = visitExpression(expr.getTrueBranch());
        E falseBranch = visitExpression(expr.getFalseBranch());
        return constructIfThenElse(expr, condition, trueBranch, falseBranch);
    }

    protected E visitCast(Expr.Cast expr) {
        E operand = visitExpression(expr.getOperand());
        return constructCast(expr, operand);
    }

    protected E visitStorageAccess(Expr.StorageAccess expr) {
        List<E> keys = new ArrayList<>();
        for (Path p : expr.getPath()) {
            if (p instanceof Path.Key) {
                keys.add(visitExpression(((Path.Key) p).getKey()));
            } else if (p instanceof Path.Index) {
                keys.add(visitExpression(((Path.Index) p).getIndex()));
            }
        }
        return constructStorageAccess(expr, keys);
    }

    protected E visitGhostAccess(Expr.GhostAccess expr) {
        List<E> keys = visitExpressions(expr.getKeys());
        return constructGhostAccess(expr, keys);
    }

    protected abstract E visitUniversalQuantifier(Expr.UniversalQuantifier expr);
    protected abstract E visitExistentialQuantifier(Expr.ExistentialQuantifier expr);
    protected abstract E visitAt(Expr.At expr);
    protected abstract E visitInvoke(Expr.Invoke expr);
    protected abstract E visitMethodCall(Expr.MethodCall expr);
    protected abstract E visitFieldAccess(Expr.FieldAccess expr);

    protected abstract E constructInteger(Expr.Integer expr);
    protected abstract E constructBoolean(Expr.Boolean expr);
    protected abstract E constructVariableAccess(Expr.VariableAccess expr);
    protected abstract E constructNegation(Expr.Negation expr, E operand);
    protected abstract E constructAddition(Expr.Addition expr, E lhs, E rhs);
    protected abstract E constructSubtraction(Expr.Subtraction expr, E lhs, E rhs);
    protected abstract E constructMultiplication(Expr.Multiplication expr, E lhs, E rhs);
    protected abstract E constructDivision(Expr.Division expr, E lhs, E rhs);
    protected abstract E constructRemainder(Expr.Remainder expr, E lhs, E rhs);
    protected abstract E constructEquals(Expr.Equals expr, E lhs, E rhs);
    protected abstract E constructNotEquals(Expr.NotEquals expr, E lhs, E rhs);
    protected abstract E constructLessThan(Expr.LessThan expr, E lhs, E rhs);
    protected abstract E constructLessThanOrEqual(Expr.LessThanOrEqual expr, E lhs, E rhs);
    protected abstract E constructGreaterThan(Expr.GreaterThan expr, E lhs, E rhs);
    protected abstract E constructGreaterThanOrEqual(Expr.GreaterThanOrEqual expr, E lhs, E rhs);
    protected abstract E constructLogicalAnd(Expr.LogicalAnd expr, List<E> operands);
    protected abstract E constructLogicalOr(Expr.LogicalOr expr, List<E> operands);
    protected abstract E constructLogicalNot(Expr.LogicalNot expr, E operand);
    protected abstract E constructLogicalImplication(Expr.Implies expr, E lhs, E rhs);
    protected abstract E constructLogicalIff(Expr.Iff expr, E lhs, E rhs);
    protected abstract E constructIfThenElse(Expr.IfThenElse expr, E condition, E trueBranch, E falseBranch);
    protected abstract E constructCast(Expr.Cast expr, E operand);
    protected abstract E constructStorageAccess(Expr.StorageAccess expr, List<E> keys);
    protected abstract E constructGhostAccess(Expr.GhostAccess expr, List<E> keys);
    protected abstract E constructLastReverted(Expr.LastReverted expr);
    protected abstract E constructStorageComparison(Expr.StorageComparison expr);
    protected abstract E constructSelectorLiteral(Expr.SelectorLiteral expr);
}
