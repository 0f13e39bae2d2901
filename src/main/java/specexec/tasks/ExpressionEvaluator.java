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

import static specexec.core.Term.*;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import specexec.core.Environment;
import specexec.core.GhostStore;
import specexec.core.Location;
import specexec.core.MethodDescriptor;
import specexec.core.MethodUniverse;
import specexec.core.SpecFile.Decl;
import specexec.core.SpecFile.Expr;
import specexec.core.SpecFile.Path;
import specexec.core.StorageState;
import specexec.core.Term;
import specexec.core.Types;
import specexec.core.VerificationCondition;
import specexec.io.SpecFilePrinter;
import specexec.util.AbstractExpressionVisitor;

/**
 * Translates specification expressions into solver terms over the current
 * state. Reading storage or ghosts from the specification never fires hooks.
 * Method calls made in expression position assume the method does not revert.
 *
 * Bounded casts and calls are only considered where they are actually reached.
 * For example, a cast in one arm of a conditional expression is guarded by
 * that arm's condition. Under a quantifier they hold for every instance of
 * the bound variables.
 *
 * Integer arithmetic is unbounded. Division and remainder follow the solver's
 * (Euclidean) semantics, so the remainder is never negative.
 *
 * @author David J. Pearce
 *
 */
public class ExpressionEvaluator extends AbstractExpressionVisitor<Term> {
	private final Generator generator;
	private final StorageState storage;
	private final GhostStore ghosts;
	private final SnapshotManager snapshots;
	private final CallExecutor executor;
	private final MethodUniverse universe;
	private final Map<String, Decl.Definition> definitions;
	private final VerificationCondition vc;
	private Scope scope = new Scope();
	/**
	 * Number of enclosing quantifiers. Values read under a quantifier depend on
	 * bound variables, hence are not meaningful in a counterexample.
	 */
	private int depth;
	/**
	 * Variables bound by the enclosing quantifiers, and the domain of each.
	 */
	private final ArrayList<Variable> bound = new ArrayList<>();
	private final ArrayList<Term> domains = new ArrayList<>();
	/**
	 * Conditions under which the subexpression being evaluated is reached, such
	 * as the condition of an enclosing conditional expression.
	 */
	private final ArrayDeque<Term> reached = new ArrayDeque<>();
	/**
	 * Assumptions made by casts under a quantifier, which are assumed once the
	 * outermost quantifier has been evaluated.
	 */
	private final ArrayList<Term> deferred = new ArrayList<>();
	private final ArrayList<String> deferredSources = new ArrayList<>();

	public ExpressionEvaluator(Generator generator, StorageState storage, GhostStore ghosts,
			SnapshotManager snapshots, CallExecutor executor, MethodUniverse universe,
			Map<String, Decl.Definition> definitions, VerificationCondition vc) {
		this.generator = generator;
		this.storage = storage;
		this.ghosts = ghosts;
		this.snapshots = snapshots;
		this.executor = executor;
		this.universe = universe;
		this.definitions = definitions;
		this.vc = vc;
	}

	public Scope getScope() {
		return scope;
	}

	public void setScope(Scope scope) {
		this.scope = scope;
	}

	/**
	 * Evaluate an expression in a given scope, rather than the current one.
	 *
	 * @param expr
	 * @param scope
	 * @return
	 */
	public Term evaluate(Expr expr, Scope scope) {
		Scope old = this.scope;
		this.scope = scope;
		try {
			return visitExpression(expr);
		} finally {
			this.scope = old;
		}
	}

	public Term evaluate(Expr expr) {
		return visitExpression(expr);
	}

	/**
	 * Evaluate an expression against a named storage snapshot. The current
	 * storage is unaffected.
	 *
	 * @param expr
	 * @param snapshot
	 * @return
	 */
	public Term evaluateAt(Expr expr, String snapshot) {
		return snapshots.evaluateAt(snapshot, () -> visitExpression(expr));
	}

	// =========================================================================
	// Binding Expressions
	// =========================================================================

	@Override
	protected Term visitUniversalQuantifier(Expr.UniversalQuantifier expr) {
		ArrayList<Variable> variables = new ArrayList<>();
		Term domain = bind(expr.getParameters(), variables);
		Term body;
		List<Term> facts;
		try {
			body = visitExpression(expr.getBody());
		} finally {
			facts = unbind(variables);
		}
		return FORALL(variables, IMPLIES(AND(domain, AND(facts)), body));
	}

	@Override
	protected Term visitExistentialQuantifier(Expr.ExistentialQuantifier expr) {
		ArrayList<Variable> variables = new ArrayList<>();
		Term domain = bind(expr.getParameters(), variables);
		Term body;
		List<Term> facts;
		try {
			body = visitExpression(expr.getBody());
		} finally {
			facts = unbind(variables);
		}
		return EXISTS(variables, AND(domain, AND(facts), body));
	}

	private Term bind(List<Decl.Parameter> parameters, List<Variable> variables) {
		scope = new Scope(scope);
		depth++;
		ArrayList<Term> domain = new ArrayList<>();
		for (Decl.Parameter p : parameters) {
			Variable v = generator.fresh(p.getName(), Types.toSort(p.getType()));
			Term d = Types.domain(p.getType(), v);
			scope.declare(p.getName(), v);
			variables.add(v);
			domain.add(d);
			bound.add(v);
			domains.add(d);
		}
		vc.beginCapture();
		return AND(domain);
	}

	/**
	 * Leave a quantifier, returning the facts established about its instances
	 * whilst evaluating its body.
	 *
	 * @param variables
	 * @return
	 */
	private List<Term> unbind(List<Variable> variables) {
		List<Term> facts = vc.endCapture();
		int n = bound.size() - variables.size();
		bound.subList(n, bound.size()).clear();
		domains.subList(n, domains.size()).clear();
		depth--;
		scope = scope.getParent();
		if (depth == 0) {
			for (int i = 0; i != deferred.size(); ++i) {
				vc.assume(deferred.get(i), deferredSources.get(i));
			}
			deferred.clear();
			deferredSources.clear();
		}
		return facts;
	}

	/**
	 * Construct a condition which must hold wherever the current subexpression
	 * is reached. Under a quantifier, this must hold for every instance of the
	 * bound variables.
	 *
	 * @param condition
	 * @return
	 */
	private Term whereReached(Term condition) {
		condition = IMPLIES(AND(new ArrayList<>(reached)), condition);
		if (depth == 0) {
			return condition;
		}
		ArrayList<Term> context = new ArrayList<>(domains);
		context.addAll(vc.getCaptured());
		return FORALL(new ArrayList<>(bound), IMPLIES(AND(context), condition));
	}

	// =========================================================================
	// Guarded Expressions
	// =========================================================================

	@Override
	protected Term visitIfThenElse(Expr.IfThenElse expr) {
		Term condition = visitExpression(expr.getCondition());
		Term trueBranch = visitReached(condition, expr.getTrueBranch());
		Term falseBranch = visitReached(NOT(condition), expr.getFalseBranch());
		return constructIfThenElse(expr, condition, trueBranch, falseBranch);
	}

	@Override
	protected Term visitLogicalAnd(Expr.LogicalAnd expr) {
		ArrayList<Term> operands = new ArrayList<>();
		int n = reached.size();
		try {
			for (Expr operand : expr.getOperands()) {
				Term t = visitExpression(operand);
				operands.add(t);
				reached.push(t);
			}
		} finally {
			restore(n);
		}
		return constructLogicalAnd(expr, operands);
	}

	@Override
	protected Term visitLogicalOr(Expr.LogicalOr expr) {
		ArrayList<Term> operands = new ArrayList<>();
		int n = reached.size();
		try {
			for (Expr operand : expr.getOperands()) {
				Term t = visitExpression(operand);
				operands.add(t);
				reached.push(NOT(t));
			}
		} finally {
			restore(n);
		}
		return constructLogicalOr(expr, operands);
	}

	@Override
	protected Term visitBinaryOperator(Expr.BinaryOperator expr) {
		if (expr instanceof Expr.Implies) {
			Term lhs = visitExpression(expr.getLeftHandSide());
			Term rhs = visitReached(lhs, expr.getRightHandSide());
			return constructLogicalImplication((Expr.Implies) expr, lhs, rhs);
		}
		return super.visitBinaryOperator(expr);
	}

	private Term visitReached(Term condition, Expr expr) {
		reached.push(condition);
		try {
			return visitExpression(expr);
		} finally {
			reached.pop();
		}
	}

	private void restore(int n) {
		while (reached.size() > n) {
			reached.pop();
		}
	}

	@Override
	protected Term visitAt(Expr.At expr) {
		return evaluateAt(expr.getOperand(), expr.getSnapshot());
	}

	@Override
	protected Term visitInvoke(Expr.Invoke expr) {
		Decl.Definition def = definitions.get(expr.getName());
		if (def == null) {
			throw new IllegalArgumentException("unknown definition: " + expr.getName());
		}
		List<Term> arguments = visitExpressions(expr.getArguments());
		List<Decl.Parameter> parameters = def.getParameters();
		// Definitions see only their parameters
		Scope local = new Scope();
		for (int i = 0; i != parameters.size(); ++i) {
			local.declare(parameters.get(i).getName(), arguments.get(i));
		}
		return evaluate(def.getBody(), local);
	}

	@Override
	protected Term visitMethodCall(Expr.MethodCall expr) {
		MethodDescriptor method = resolveMethod(expr.getMethod());
		Environment environment = expr.getEnvironment() == null ? executor.envfree()
				: resolveEnvironment(expr.getEnvironment());
		List<Term> arguments = visitExpressions(expr.getArguments());
		CallExecutor.Result r;
		vc.pushGuard(AND(new ArrayList<>(reached)));
		try {
			r = executor.invoke(method, environment, arguments);
		} finally {
			vc.popGuard();
		}
		if (r.getReturns().isEmpty()) {
			throw new IllegalArgumentException(method + " does not return a value");
		}
		return r.getReturns().get(0);
	}

	@Override
	protected Term visitFieldAccess(Expr.FieldAccess expr) {
		String field = expr.getField();
		Expr operand = expr.getOperand();
		if (operand instanceof Expr.VariableAccess) {
			String name = ((Expr.VariableAccess) operand).getName();
			Environment e = scope.getEnvironment(name);
			if (e != null) {
				return e.get(field);
			}
			MethodDescriptor m = scope.getMethod(name);
			if (m != null) {
				return methodField(m, field);
			}
		}
		throw new IllegalArgumentException("invalid field access: " + SpecFilePrinter.toString(expr));
	}

	private static Term methodField(MethodDescriptor m, String field) {
		switch (field) {
		case "selector":
			return CONST(m.getSelector());
		case "isView":
			return CONST(m.isView());
		case "isPure":
			return CONST(m.isPure());
		case "isPayable":
			return CONST(m.isPayable());
		case "numberOfArguments":
			return CONST(m.getNumberOfArguments());
		default:
			throw new IllegalArgumentException("unknown method field: " + field);
		}
	}

	// =========================================================================
	// Simple Expressions
	// =========================================================================

	@Override
	protected Term constructInteger(Expr.Integer expr) {
		return CONST(expr.getValue());
	}

	@Override
	protected Term constructBoolean(Expr.Boolean expr) {
		return CONST(expr.getValue());
	}

	@Override
	protected Term constructVariableAccess(Expr.VariableAccess expr) {
		Term t = scope.getValue(expr.getName());
		if (t == null) {
			throw new IllegalArgumentException("unknown variable: " + expr.getName());
		}
		return t;
	}

	@Override
	protected Term constructNegation(Expr.Negation expr, Term operand) {
		return NEG(operand);
	}

	@Override
	protected Term constructAddition(Expr.Addition expr, Term lhs, Term rhs) {
		return ADD(lhs, rhs);
	}

	@Override
	protected Term constructSubtraction(Expr.Subtraction expr, Term lhs, Term rhs) {
		return SUB(lhs, rhs);
	}

	@Override
	protected Term constructMultiplication(Expr.Multiplication expr, Term lhs, Term rhs) {
		return MUL(lhs, rhs);
	}

	@Override
	protected Term constructDivision(Expr.Division expr, Term lhs, Term rhs) {
		return DIV(lhs, rhs);
	}

	@Override
	protected Term constructRemainder(Expr.Remainder expr, Term lhs, Term rhs) {
		return MOD(lhs, rhs);
	}

	@Override
	protected Term constructEquals(Expr.Equals expr, Term lhs, Term rhs) {
		return EQ(lhs, rhs);
	}

	@Override
	protected Term constructNotEquals(Expr.NotEquals expr, Term lhs, Term rhs) {
		return NEQ(lhs, rhs);
	}

	@Override
	protected Term constructLessThan(Expr.LessThan expr, Term lhs, Term rhs) {
		return LT(lhs, rhs);
	}

	@Override
	protected Term constructLessThanOrEqual(Expr.LessThanOrEqual expr, Term lhs, Term rhs) {
		return LTEQ(lhs, rhs);
	}

	@Override
	protected Term constructGreaterThan(Expr.GreaterThan expr, Term lhs, Term rhs) {
		return GT(lhs, rhs);
	}

	@Override
	protected Term constructGreaterThanOrEqual(Expr.GreaterThanOrEqual expr, Term lhs, Term rhs) {
		return GTEQ(lhs, rhs);
	}

	@Override
	protected Term constructLogicalAnd(Expr.LogicalAnd expr, List<Term> operands) {
		return AND(operands);
	}

	@Override
	protected Term constructLogicalOr(Expr.LogicalOr expr, List<Term> operands) {
		return OR(operands);
	}

	@Override
	protected Term constructLogicalNot(Expr.LogicalNot expr, Term operand) {
		return NOT(operand);
	}

	@Override
	protected Term constructLogicalImplication(Expr.Implies expr, Term lhs, Term rhs) {
		return IMPLIES(lhs, rhs);
	}

	@Override
	protected Term constructLogicalIff(Expr.Iff expr, Term lhs, Term rhs) {
		return IFF(lhs, rhs);
	}

	@Override
	protected Term constructIfThenElse(Expr.IfThenElse expr, Term condition, Term trueBranch, Term falseBranch) {
		return ITE(condition, trueBranch, falseBranch);
	}

	@Override
	protected Term constructCast(Expr.Cast expr, Term operand) {
		Term fits = whereReached(Types.fits(expr.getType(), operand));
		String description = SpecFilePrinter.toString(expr);
		if (expr.isAsserting()) {
			vc.obligate(fits, description);
		} else if (depth > 0) {
			deferred.add(fits);
			deferredSources.add(description);
		} else {
			vc.assume(fits, description);
		}
		return operand;
	}

	@Override
	protected Term constructStorageAccess(Expr.StorageAccess expr, List<Term> keys) {
		Location location = new Location(expr.getRoot());
		int k = 0;
		for (Path p : expr.getPath()) {
			if (p instanceof Path.Field) {
				location = location.append(Location.FIELD(((Path.Field) p).getName()));
			} else if (p instanceof Path.Key) {
				location = location.append(Location.KEY(keys.get(k++)));
			} else if (p instanceof Path.Index) {
				location = location.append(Location.INDEX(keys.get(k++)));
			} else {
				location = location.append(Location.LENGTH());
			}
		}
		Term value = storage.read(location);
		observe(location, value);
		return value;
	}

	@Override
	protected Term constructGhostAccess(Expr.GhostAccess expr, List<Term> keys) {
		Term value;
		if (expr.getTiming() == Expr.GhostAccess.Timing.OLD) {
			value = ghosts.getOld(expr.getName(), keys);
		} else {
			value = ghosts.get(expr.getName(), keys);
		}
		Location location = new Location(expr.getName());
		for (Term key : keys) {
			location = location.append(Location.KEY(key));
		}
		observe(location, value);
		return value;
	}

	@Override
	protected Term constructLastReverted(Expr.LastReverted expr) {
		return executor.getLastReverted();
	}

	@Override
	protected Term constructStorageComparison(Expr.StorageComparison expr) {
		return StorageState.equal(snapshots.get(expr.getLeftHandSide()), snapshots.get(expr.getRightHandSide()));
	}

	@Override
	protected Term constructSelectorLiteral(Expr.SelectorLiteral expr) {
		MethodDescriptor m = universe.lookup(expr.getSignature());
		if (m == null) {
			throw new IllegalArgumentException("unknown method: " + expr.getSignature());
		}
		return CONST(m.getSelector());
	}

	// =========================================================================
	// Helpers
	// =========================================================================

	/**
	 * Resolve a method name, which may refer to a method parameter of the
	 * enclosing rule.
	 *
	 * @param name
	 * @return
	 */
	public MethodDescriptor resolveMethod(String name) {
		MethodDescriptor m = scope.getMethod(name);
		if (m == null) {
			m = universe.lookup(name);
		}
		if (m == null) {
			throw new IllegalArgumentException("unknown method: " + name);
		}
		return m;
	}

	public Environment resolveEnvironment(Expr expr) {
		if (expr instanceof Expr.VariableAccess) {
			Environment e = scope.getEnvironment(((Expr.VariableAccess) expr).getName());
			if (e != null) {
				return e;
			}
		}
		throw new IllegalArgumentException("not an environment: " + SpecFilePrinter.toString(expr));
	}

	private void observe(Location location, Term value) {
		if (depth == 0) {
			vc.observe(location, value);
		}
	}
}
