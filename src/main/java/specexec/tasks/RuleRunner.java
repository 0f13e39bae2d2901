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

import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import specexec.core.CallData;
import specexec.core.Environment;
import specexec.core.GhostStore;
import specexec.core.MethodDescriptor;
import specexec.core.SpecFile.Decl;
import specexec.core.SpecFile.Expr;
import specexec.core.SpecFile.Stmt;
import specexec.core.SpecFile.Type;
import specexec.core.StorageState;
import specexec.core.TargetSystem;
import specexec.core.Term;
import specexec.core.Types;
import specexec.core.VerificationCondition;
import specexec.io.SpecFilePrinter;
import specexec.util.AbstractStatementVisitor;
import specexec.util.Util;

/**
 * Symbolically executes a single verification unit, producing the
 * verification condition which is subsequently discharged by the solver. Each
 * runner owns a private copy of all mutable state (storage, ghosts, snapshots
 * and so on), hence distinct runners can execute concurrently.
 *
 * Execution passes through a fixed sequence of phases. First, parameters are
 * bound to fresh values; then ghost axioms and (for an invariant step) the
 * invariant itself are assumed; then the body is executed; and, finally, all
 * checks have been recorded.
 *
 * @author David J. Pearce
 *
 */
public class RuleRunner extends AbstractStatementVisitor implements HookDispatcher.Trigger {
	private static final Logger logger = LoggerFactory.getLogger(RuleRunner.class);

	public enum Phase {
		INIT, BOUND, CONSTRAINED, EXECUTED, CHECKED
	}

	private final Specification spec;
	private final SpecItem item;
	private final Generator generator = new Generator();
	private final VerificationCondition vc = new VerificationCondition();
	private final StorageState storage;
	private final GhostStore ghosts;
	private final SnapshotManager snapshots;
	private final CallExecutor executor;
	private final ExpressionEvaluator evaluator;
	private final Scope locals;
	private Phase phase = Phase.INIT;

	public RuleRunner(Specification spec, SpecItem item) {
		this.spec = spec;
		this.item = item;
		TargetSystem target = spec.getTarget();
		// The base case of an invariant starts from the zeroed pre-constructor
		// state, every other unit from an arbitrary one.
		if (item.getKind() == SpecItem.Kind.INVARIANT_BASE) {
			this.storage = StorageState.zero(target.getLayout(), vc::constrain);
		} else {
			this.storage = StorageState.fresh(target.getLayout(), generator, vc::constrain);
		}
		HookDispatcher dispatcher = new HookDispatcher(target.getLayout());
		for (Decl.Hook hook : spec.getHooks()) {
			dispatcher.register(hook);
		}
		dispatcher.setTrigger(this);
		this.storage.setObserver(dispatcher);
		this.ghosts = new GhostStore(generator, vc::constrain);
		for (Decl.Ghost ghost : spec.getGhosts()) {
			ghosts.declare(ghost);
		}
		this.snapshots = new SnapshotManager(storage);
		this.executor = new CallExecutor(target, storage, ghosts, generator, vc);
		this.evaluator = new ExpressionEvaluator(generator, storage, ghosts, snapshots, executor, spec.getUniverse(),
				spec.getDefinitions(), vc);
		this.locals = evaluator.getScope();
	}

	public SpecItem getItem() {
		return item;
	}

	public Phase getPhase() {
		return phase;
	}

	public VerificationCondition getVerificationCondition() {
		return vc;
	}

	/**
	 * Get the final values of the unit's parameters and local variables.
	 *
	 * @return
	 */
	public Map<String, Term> getLocals() {
		return locals.capture();
	}

	/**
	 * Execute the unit, returning the resulting verification condition.
	 *
	 * @return
	 */
	public VerificationCondition run() {
		switch (item.getKind()) {
		case RULE:
			runRule((Decl.Rule) item.getDeclaration());
			break;
		case INVARIANT_BASE:
			runBase((Decl.Invariant) item.getDeclaration());
			break;
		default:
			runStep((Decl.Invariant) item.getDeclaration(), item.getMethod(null));
		}
		advance(Phase.CHECKED);
		return vc;
	}

	private void runRule(Decl.Rule rule) {
		Scope scope = evaluator.getScope();
		for (Decl.Parameter p : rule.getParameters()) {
			bind(scope, p);
		}
		advance(Phase.BOUND);
		initialiseGhosts(false);
		advance(Phase.CONSTRAINED);
		visitStatement(rule.getBody());
		advance(Phase.EXECUTED);
	}

	/**
	 * Check that an invariant is established by the constructor.
	 *
	 * @param invariant
	 */
	private void runBase(Decl.Invariant invariant) {
		Scope scope = evaluator.getScope();
		for (Decl.Parameter p : invariant.getParameters()) {
			bind(scope, p);
		}
		advance(Phase.BOUND);
		initialiseGhosts(true);
		advance(Phase.CONSTRAINED);
		MethodDescriptor constructor = spec.getTarget().getConstructor();
		if (constructor != null) {
			Environment env = Environment.fresh("e", generator, vc::constrain);
			List<Term> arguments = new CallData("args").getArguments(constructor, generator, vc::constrain);
			executor.invoke(constructor, env, arguments);
		}
		advance(Phase.EXECUTED);
		vc.assertThat(evaluator.evaluate(invariant.getPredicate()), invariant.getName() + " established");
	}

	/**
	 * Check that an invariant is preserved by a given method.
	 *
	 * @param invariant
	 * @param method
	 */
	private void runStep(Decl.Invariant invariant, MethodDescriptor method) {
		Scope scope = evaluator.getScope();
		for (Decl.Parameter p : invariant.getParameters()) {
			bind(scope, p);
		}
		advance(Phase.BOUND);
		initialiseGhosts(false);
		vc.assume(evaluator.evaluate(invariant.getPredicate()), invariant.getName() + " holds before " + method);
		advance(Phase.CONSTRAINED);
		Decl.Preserved preserved = invariant.getPreserved(method.getSignature());
		Environment env;
		if (preserved != null && preserved.getEnvironment() != null) {
			env = Environment.fresh(preserved.getEnvironment().getName(), generator, vc::constrain);
			scope.declare(preserved.getEnvironment().getName(), env);
		} else {
			env = Environment.fresh("e", generator, vc::constrain);
		}
		if (preserved != null) {
			visitStatement(preserved.getBody());
		}
		List<Term> arguments = new CallData("args").getArguments(method, generator, vc::constrain);
		executor.invoke(method, env, arguments);
		advance(Phase.EXECUTED);
		vc.assertThat(evaluator.evaluate(invariant.getPredicate()), invariant.getName() + " preserved by " + method);
	}

	private void advance(Phase next) {
		logger.debug("{}: {} -> {}", item, phase, next);
		phase = next;
	}

	/**
	 * Bind a parameter of the unit to an arbitrary value of its type.
	 *
	 * @param scope
	 * @param p
	 */
	private void bind(Scope scope, Decl.Parameter p) {
		String name = p.getName();
		Type type = p.getType();
		if (type instanceof Type.Method) {
			MethodDescriptor m = item.getMethod(name);
			if (m == null) {
				throw new IllegalArgumentException("unbound method parameter: " + name);
			}
			scope.declare(name, m);
		} else {
			declare(scope, name, type, null);
		}
	}

	private void declare(Scope scope, String name, Type type, Term initialiser) {
		if (type instanceof Type.Env) {
			scope.declare(name, Environment.fresh(name, generator, vc::constrain));
		} else if (type instanceof Type.CallData) {
			scope.declare(name, new CallData(name));
		} else if (initialiser != null) {
			scope.declare(name, initialiser);
		} else {
			Variable v = generator.fresh(name, Types.toSort(type));
			vc.constrain(Types.domain(type, v));
			scope.declare(name, v);
		}
	}

	/**
	 * Give every ghost an arbitrary value satisfying its axioms.
	 *
	 * @param initial whether this is the constructor state, in which case the
	 *                <code>init_state</code> axioms hold as well
	 */
	private void initialiseGhosts(boolean initial) {
		ghosts.reset();
		for (Decl.Ghost ghost : spec.getGhosts()) {
			for (Expr axiom : ghost.getAxioms()) {
				vc.assume(evaluator.evaluate(axiom, new Scope()), "axiom of " + ghost.getName());
			}
			if (initial) {
				for (Expr axiom : ghost.getInitialAxioms()) {
					vc.assume(evaluator.evaluate(axiom, new Scope()), "init_state axiom of " + ghost.getName());
				}
			}
		}
	}

	// =========================================================================
	// Hooks
	// =========================================================================

	@Override
	public void fire(Decl.Hook hook, Map<String, Term> bindings, Term guard) {
		Scope local = new Scope();
		for (Map.Entry<String, Term> e : bindings.entrySet()) {
			local.declare(e.getKey(), e.getValue());
		}
		Scope outer = evaluator.getScope();
		evaluator.setScope(local);
		vc.pushGuard(guard);
		try {
			visitStatement(hook.getBody());
		} finally {
			vc.popGuard();
			evaluator.setScope(outer);
		}
	}

	// =========================================================================
	// Statements
	// =========================================================================

	@Override
	protected void visitDeclaration(Stmt.Declaration s) {
		Decl.Parameter v = s.getVariable();
		Term init = s.getInitialiser() == null ? null : evaluator.evaluate(s.getInitialiser());
		declare(evaluator.getScope(), v.getName(), v.getType(), init);
	}

	@Override
	protected void visitAssign(Stmt.Assign s) {
		assign(s.getName(), evaluator.evaluate(s.getValue()));
	}

	private void assign(String name, Term value) {
		Scope scope = evaluator.getScope();
		Term guard = vc.getGuard();
		if (!guard.isTrue()) {
			value = ITE(guard, value, scope.getValue(name));
		}
		scope.assign(name, value);
	}

	@Override
	protected void visitGhostAssign(Stmt.GhostAssign s) {
		List<Term> keys = Util.map(s.getKeys(), evaluator::evaluate);
		Term value = evaluator.evaluate(s.getValue());
		Term guard = vc.getGuard();
		if (!guard.isTrue()) {
			value = ITE(guard, value, ghosts.get(s.getGhost(), keys));
		}
		ghosts.set(s.getGhost(), keys, value);
	}

	@Override
	protected void visitRequire(Stmt.Require s) {
		vc.assume(evaluator.evaluate(s.getCondition()), "require " + SpecFilePrinter.toString(s.getCondition()));
	}

	@Override
	protected void visitAssert(Stmt.Assert s) {
		vc.assertThat(evaluator.evaluate(s.getCondition()), describe(s.getMessage(), s.getCondition()));
	}

	@Override
	protected void visitSatisfy(Stmt.Satisfy s) {
		vc.satisfy(evaluator.evaluate(s.getCondition()), describe(s.getMessage(), s.getCondition()));
	}

	private static String describe(String message, Expr condition) {
		return message != null ? message : SpecFilePrinter.toString(condition);
	}

	@Override
	protected void visitCall(Stmt.Call s) {
		if (s.getSnapshot() != null) {
			snapshots.restore(s.getSnapshot());
		}
		MethodDescriptor method = evaluator.resolveMethod(s.getMethod());
		Environment env = s.getEnvironment() == null ? executor.envfree()
				: evaluator.resolveEnvironment(s.getEnvironment());
		List<Term> arguments;
		if (s.getCallData() != null) {
			CallData data = evaluator.getScope().getCallData(s.getCallData());
			if (data == null) {
				throw new IllegalArgumentException("unknown calldata: " + s.getCallData());
			}
			arguments = data.getArguments(method, generator, vc::constrain);
		} else {
			arguments = Util.map(s.getArguments(), evaluator::evaluate);
		}
		CallExecutor.Result r = s.isWithRevert() ? executor.invokeOrRevert(method, env, arguments)
				: executor.invoke(method, env, arguments);
		List<String> lvals = s.getLVals();
		if (lvals.size() > r.getReturns().size()) {
			throw new IllegalArgumentException(method + " returns " + r.getReturns().size() + " value(s)");
		}
		Scope scope = evaluator.getScope();
		for (int i = 0; i != lvals.size(); ++i) {
			String lval = lvals.get(i);
			if (scope.getValue(lval) == null) {
				scope.declare(lval, r.getReturns().get(i));
			} else {
				assign(lval, r.getReturns().get(i));
			}
		}
	}

	@Override
	protected void visitHavoc(Stmt.Havoc s) {
		ghosts.havoc(s.getGhost());
		if (s.getAssumption() != null) {
			vc.assume(evaluator.evaluate(s.getAssumption()), "havoc " + s.getGhost());
		}
	}

	@Override
	protected void visitSnapshot(Stmt.Snapshot s) {
		snapshots.capture(s.getName());
	}

	@Override
	protected void visitIfElse(Stmt.IfElse s) {
		Term c = evaluator.evaluate(s.getCondition());
		if (c.isTrue()) {
			visitStatement(s.getTrueBranch());
			return;
		} else if (c.isFalse()) {
			if (s.getFalseBranch() != null) {
				visitStatement(s.getFalseBranch());
			}
			return;
		}
		Scope scope = evaluator.getScope();
		StorageState.Snapshot storageBefore = storage.snapshot();
		GhostStore.Snapshot ghostsBefore = ghosts.snapshot();
		Map<String, Term> localsBefore = scope.capture();
		Term revertedBefore = executor.getLastReverted();
		// True branch
		vc.pushGuard(c);
		try {
			visitStatement(s.getTrueBranch());
		} finally {
			vc.popGuard();
		}
		StorageState.Snapshot storageTrue = storage.snapshot();
		GhostStore.Snapshot ghostsTrue = ghosts.snapshot();
		Map<String, Term> localsTrue = scope.capture();
		Term revertedTrue = executor.getLastReverted();
		storage.restore(storageBefore);
		ghosts.restore(ghostsBefore);
		scope.restore(localsBefore);
		executor.setLastReverted(revertedBefore);
		// False branch
		if (s.getFalseBranch() != null) {
			vc.pushGuard(NOT(c));
			try {
				visitStatement(s.getFalseBranch());
			} finally {
				vc.popGuard();
			}
		}
		// Join
		storage.merge(c, storageTrue, storage.snapshot());
		ghosts.merge(c, ghostsTrue, ghosts.snapshot(), true);
		scope.merge(c, localsTrue, scope.capture());
		executor.setLastReverted(ITE(c, revertedTrue, executor.getLastReverted()));
	}

	@Override
	protected void visitRequireInvariant(Stmt.RequireInvariant s) {
		Decl.Invariant invariant = spec.getInvariant(s.getName());
		if (invariant == null) {
			throw new IllegalArgumentException("unknown invariant: " + s.getName());
		}
		List<Decl.Parameter> parameters = invariant.getParameters();
		Scope local = new Scope();
		for (int i = 0; i != parameters.size(); ++i) {
			local.declare(parameters.get(i).getName(), evaluator.evaluate(s.getArguments().get(i)));
		}
		vc.assume(evaluator.evaluate(invariant.getPredicate(), local), "requireInvariant " + s.getName());
	}
}
