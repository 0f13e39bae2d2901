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
package specexec.tasks;

import java.math.BigInteger;
import java.util.List;
import java.util.Objects;

import specexec.core.LoadException;
import specexec.core.MethodDescriptor;
import specexec.core.MethodUniverse;
import specexec.core.SpecFile.Decl;
import specexec.core.SpecFile.Expr;
import specexec.core.Term;
import specexec.io.SpecFilePrinter;
import specexec.util.AbstractExpressionVisitor;

/**
 * Evaluates the filter of a parametric rule or invariant against each method
 * of the universe. Filters are decided before any solving takes place, hence
 * may only depend on declarative properties of the method: its selector,
 * mutability, number of arguments and declaring contract. Anything else is
 * rejected.
 *
 * @author David J. Pearce
 *
 */
public class MethodFilter extends AbstractExpressionVisitor<Object> {
	/**
	 * Name which denotes the contract of the target system in a filter.
	 */
	public static final String CURRENT_CONTRACT = "currentContract";

	private final Decl.Filter filter;
	private final MethodUniverse universe;
	private final String contract;
	private MethodDescriptor method;

	public MethodFilter(Decl.Filter filter, MethodUniverse universe, String contract) {
		this.filter = filter;
		this.universe = universe;
		this.contract = contract;
	}

	/**
	 * Determine whether a given method passes this filter.
	 *
	 * @param method
	 * @return
	 * @throws LoadException if the filter is not declarative
	 */
	public boolean test(MethodDescriptor method) {
		this.method = method;
		Object r = visitExpression(filter.getCondition());
		if (!(r instanceof Boolean)) {
			throw new LoadException("filter is not a predicate", filter);
		}
		return (Boolean) r;
	}

	/**
	 * Apply this filter across the entire universe, in declaration order.
	 *
	 * @return
	 */
	public List<MethodDescriptor> apply() {
		return universe.filter(this::test);
	}

	private LoadException nonDeclarative(Expr e) {
		return new LoadException("filter uses non-declarative expression " + SpecFilePrinter.toString(e), filter);
	}

	@Override
	protected Object visitFieldAccess(Expr.FieldAccess expr) {
		Expr operand = expr.getOperand();
		if (!(operand instanceof Expr.VariableAccess)
				|| !((Expr.VariableAccess) operand).getName().equals(filter.getBinder())) {
			throw nonDeclarative(expr);
		}
		switch (expr.getField()) {
		case "selector":
			return method.getSelector();
		case "isView":
			return method.isView();
		case "isPure":
			return method.isPure();
		case "isPayable":
			return method.isPayable();
		case "numberOfArguments":
			return BigInteger.valueOf(method.getNumberOfArguments());
		case "contract":
			return method.getContract();
		default:
			throw nonDeclarative(expr);
		}
	}

	@Override
	protected Object constructVariableAccess(Expr.VariableAccess expr) {
		if (expr.getName().equals(CURRENT_CONTRACT)) {
			return contract;
		}
		throw nonDeclarative(expr);
	}

	@Override
	protected Object constructSelectorLiteral(Expr.SelectorLiteral expr) {
		MethodDescriptor m = universe.lookup(expr.getSignature());
		if (m == null) {
			throw new LoadException("unknown method " + expr.getSignature(), filter);
		}
		return m.getSelector();
	}

	@Override
	protected Object constructInteger(Expr.Integer expr) {
		return expr.getValue();
	}

	@Override
	protected Object constructBoolean(Expr.Boolean expr) {
		return expr.getValue();
	}

	@Override
	protected Object constructEquals(Expr.Equals expr, Object lhs, Object rhs) {
		return Objects.equals(lhs, rhs);
	}

	@Override
	protected Object constructNotEquals(Expr.NotEquals expr, Object lhs, Object rhs) {
		return !Objects.equals(lhs, rhs);
	}

	@Override
	protected Object constructLessThan(Expr.LessThan expr, Object lhs, Object rhs) {
		return integer(expr, lhs).compareTo(integer(expr, rhs)) < 0;
	}

	@Override
	protected Object constructLessThanOrEqual(Expr.LessThanOrEqual expr, Object lhs, Object rhs) {
		return integer(expr, lhs).compareTo(integer(expr, rhs)) <= 0;
	}

	@Override
	protected Object constructGreaterThan(Expr.GreaterThan expr, Object lhs, Object rhs) {
		return integer(expr, lhs).compareTo(integer(expr, rhs)) > 0;
	}

	@Override
	protected Object constructGreaterThanOrEqual(Expr.GreaterThanOrEqual expr, Object lhs, Object rhs) {
		return integer(expr, lhs).compareTo(integer(expr, rhs)) >= 0;
	}

	@Override
	protected Object constructLogicalAnd(Expr.LogicalAnd expr, List<Object> operands) {
		for (Object o : operands) {
			if (!bool(expr, o)) {
				return false;
			}
		}
		return true;
	}

	@Override
	protected Object constructLogicalOr(Expr.LogicalOr expr, List<Object> operands) {
		for (Object o : operands) {
			if (bool(expr, o)) {
				return true;
			}
		}
		return false;
	}

	@Override
	protected Object constructLogicalNot(Expr.LogicalNot expr, Object operand) {
		return !bool(expr, operand);
	}

	@Override
	protected Object constructLogicalImplication(Expr.Implies expr, Object lhs, Object rhs) {
		return !bool(expr, lhs) || bool(expr, rhs);
	}

	@Override
	protected Object constructLogicalIff(Expr.Iff expr, Object lhs, Object rhs) {
		return bool(expr, lhs) == bool(expr, rhs);
	}

	@Override
	protected Object constructIfThenElse(Expr.IfThenElse expr, Object condition, Object trueBranch,
			Object falseBranch) {
		return bool(expr, condition) ? trueBranch : falseBranch;
	}

	private BigInteger integer(Expr e, Object o) {
		if (o instanceof BigInteger) {
			return (BigInteger) o;
		}
		throw new LoadException("expected integer in " + SpecFilePrinter.toString(e), filter);
	}

	private boolean bool(Expr e, Object o) {
		if (o instanceof Boolean) {
			return (Boolean) o;
		}
		throw new LoadException("expected boolean in " + SpecFilePrinter.toString(e), filter);
	}

	// =========================================================================
	// Non-declarative Expressions
	// =========================================================================

	@Override
	protected Object visitUniversalQuantifier(Expr.UniversalQuantifier expr) {
		throw nonDeclarative(expr);
	}

	@Override
	protected Object visitExistentialQuantifier(Expr.ExistentialQuantifier expr) {
		throw nonDeclarative(expr);
	}

	@Override
	protected Object visitAt(Expr.At expr) {
		throw nonDeclarative(expr);
	}

	@Override
	protected Object visitInvoke(Expr.Invoke expr) {
		throw nonDeclarative(expr);
	}

	@Override
	protected Object visitMethodCall(Expr.MethodCall expr) {
		throw nonDeclarative(expr);
	}

	@Override
	protected Object visitStorageAccess(Expr.StorageAccess expr) {
		throw nonDeclarative(expr);
	}

	@Override
	protected Object visitGhostAccess(Expr.GhostAccess expr) {
		throw nonDeclarative(expr);
	}

	@Override
	protected Object visitCast(Expr.Cast expr) {
		throw nonDeclarative(expr);
	}

	@Override
	protected Object constructNegation(Expr.Negation expr, Object operand) {
		return integer(expr, operand).negate();
	}

	@Override
	protected Object constructAddition(Expr.Addition expr, Object lhs, Object rhs) {
		return integer(expr, lhs).add(integer(expr, rhs));
	}

	@Override
	protected Object constructSubtraction(Expr.Subtraction expr, Object lhs, Object rhs) {
		return integer(expr, lhs).subtract(integer(expr, rhs));
	}

	@Override
	protected Object constructMultiplication(Expr.Multiplication expr, Object lhs, Object rhs) {
		return integer(expr, lhs).multiply(integer(expr, rhs));
	}

	@Override
	protected Object constructDivision(Expr.Division expr, Object lhs, Object rhs) {
		return value(Term.DIV(Term.CONST(integer(expr, lhs)), Term.CONST(integer(expr, rhs))), expr);
	}

	@Override
	protected Object constructRemainder(Expr.Remainder expr, Object lhs, Object rhs) {
		return value(Term.MOD(Term.CONST(integer(expr, lhs)), Term.CONST(integer(expr, rhs))), expr);
	}

	private BigInteger value(Term t, Expr e) {
		BigInteger v = Term.value(t);
		if (v == null) {
			throw new LoadException("division by zero in " + SpecFilePrinter.toString(e), filter);
		}
		return v;
	}

	@Override
	protected Object constructCast(Expr.Cast expr, Object operand) {
		throw nonDeclarative(expr);
	}

	@Override
	protected Object constructStorageAccess(Expr.StorageAccess expr, List<Object> keys) {
		throw nonDeclarative(expr);
	}

	@Override
	protected Object constructGhostAccess(Expr.GhostAccess expr, List<Object> keys) {
		throw nonDeclarative(expr);
	}

	@Override
	protected Object constructLastReverted(Expr.LastReverted expr) {
		throw nonDeclarative(expr);
	}

	@Override
	protected Object constructStorageComparison(Expr.StorageComparison expr) {
		throw nonDeclarative(expr);
	}
}
