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

import static org.junit.Assert.*;
import static specexec.core.SpecFile.*;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.junit.Before;
import org.junit.Test;

import specexec.core.Environment;
import specexec.core.GhostStore;
import specexec.core.Location;
import specexec.core.MethodUniverse;
import specexec.core.SpecFile.Decl;
import specexec.core.SpecFile.Expr;
import specexec.core.SpecFile.Pattern;
import specexec.core.SpecFile.Type;
import specexec.core.StorageState;
import specexec.core.Term;
import specexec.core.Types;
import specexec.core.VerificationCondition;
import specexec.testing.TokenSystem;

/**
 * Tests for the evaluation of specification expressions into terms.
 *
 * @author David J. Pearce
 *
 */
public class ExpressionEvaluatorTest {
	private final TokenSystem token = new TokenSystem();
	private final Map<String, Decl.Definition> definitions = new HashMap<>();
	private Term.Generator generator;
	private VerificationCondition vc;
	private StorageState storage;
	private GhostStore ghosts;
	private SnapshotManager snapshots;
	private ExpressionEvaluator evaluator;
	private List<Location> loads;

	@Before
	public void setup() {
		generator = new Term.Generator();
		vc = new VerificationCondition();
		storage = StorageState.fresh(token.getLayout(), generator, vc::constrain);
		ghosts = new GhostStore(generator, vc::constrain);
		ghosts.declare(GHOST("total", Type.MathInt));
		snapshots = new SnapshotManager(storage);
		CallExecutor executor = new CallExecutor(token, storage, ghosts, generator, vc);
		evaluator = new ExpressionEvaluator(generator, storage, ghosts, snapshots, executor,
				new MethodUniverse(token.getMethods()), definitions, vc);
		// Record loads which would trigger a read hook
		loads = new ArrayList<>();
		HookDispatcher dispatcher = new HookDispatcher(token.getLayout());
		dispatcher.register(SLOAD(PATTERN("balances", new Pattern.Key(PARAM("a", Type.Address))),
				PARAM("v", Type.Uint256), SEQUENCE()));
		dispatcher.setTrigger((hook, bindings, guard) -> loads.add(TokenSystem.balance(bindings.get("a"))));
		storage.setObserver(dispatcher);
	}

	@Test
	public void arithmetic() {
		assertEquals(Term.CONST(42), evaluator.evaluate(MUL(ADD(CONST(4), CONST(2)), CONST(7))));
		assertEquals(Term.CONST(-3), evaluator.evaluate(DIV(CONST(7), NEG(CONST(2)))));
		assertEquals(Term.CONST(1), evaluator.evaluate(REM(CONST(-7), CONST(2))));
		assertEquals(Term.TRUE, evaluator.evaluate(IMPLIES(CONST(false), CONST(false))));
	}

	@Test(expected = IllegalArgumentException.class)
	public void unknownVariable() {
		evaluator.evaluate(VAR("missing"));
	}

	@Test
	public void storageAccessIsObserved() {
		Term.Variable a = generator.fresh("a", Term.Sort.INT);
		evaluator.getScope().declare("a", a);
		Term v = evaluator.evaluate(STORAGE("balances", KEY(VAR("a"))));
		assertEquals(storage.read(TokenSystem.balance(a)), v);
		assertEquals(1, vc.getObservations().size());
		assertEquals(TokenSystem.balance(a), vc.getObservations().get(0).getLocation());
		// The specification reading storage is not a load by the target
		assertTrue(loads.isEmpty());
	}

	@Test
	public void evaluateAtLeavesStorageUntouched() {
		Location loc = TokenSystem.balance(Term.ONE);
		Term initial = storage.read(loc);
		snapshots.capture("init");
		storage.write(loc, Term.CONST(5));
		StorageState.Snapshot live = storage.snapshot();
		// Evaluation at a snapshot, including a call which loads storage
		Expr e = ADD(STORAGE("balances", KEY(CONST(1))), INVOKE_METHOD("balanceOf", null, CONST(1)));
		Term at = evaluator.evaluateAt(e, "init");
		assertEquals(Term.ADD(initial, initial), at);
		assertTrue(loads.isEmpty());
		assertEquals(Term.TRUE, StorageState.equal(live, storage.snapshot()));
		assertEquals(Term.CONST(5), storage.read(loc));
		assertFalse(storage.isMuted());
		// Doing so twice gives the same result
		assertEquals(at, evaluator.evaluate(AT(e, "init")));
	}

	@Test
	public void methodCallsLoadThroughHooks() {
		evaluator.evaluate(INVOKE_METHOD("balanceOf", null, CONST(1)));
		assertEquals(1, loads.size());
		assertEquals(1, vc.getCalls().size());
	}

	@Test
	public void fieldAccess() {
		Environment env = Environment.fresh("e", generator, vc::constrain);
		evaluator.getScope().declare("e", env);
		evaluator.getScope().declare("f", TokenSystem.TRANSFER);
		assertEquals(env.getSender(), evaluator.evaluate(FIELD_ACCESS(VAR("e"), Environment.MSG_SENDER)));
		assertEquals(env.getValue(), evaluator.evaluate(FIELD_ACCESS(VAR("e"), Environment.MSG_VALUE)));
		assertEquals(Term.CONST(BigInteger.valueOf(0xa9059cbbL)),
				evaluator.evaluate(FIELD_ACCESS(VAR("f"), "selector")));
		assertEquals(Term.FALSE, evaluator.evaluate(FIELD_ACCESS(VAR("f"), "isView")));
		assertEquals(Term.CONST(2), evaluator.evaluate(FIELD_ACCESS(VAR("f"), "numberOfArguments")));
		assertEquals(Term.TRUE,
				evaluator.evaluate(EQ(FIELD_ACCESS(VAR("f"), "selector"), SELECTOR("transfer(address,uint256)"))));
	}

	@Test
	public void definitionsSeeOnlyTheirParameters() {
		definitions.put("twice", DEFINITION("twice", PARAMS(PARAM("x", Type.MathInt)), Type.MathInt,
				ADD(VAR("x"), VAR("x"))));
		evaluator.getScope().declare("x", Term.CONST(100));
		assertEquals(Term.CONST(42), evaluator.evaluate(INVOKE("twice", CONST(21))));
	}

	@Test
	public void quantifiersBindFreshVariables() {
		Term t = evaluator.evaluate(FORALL("x", Type.Uint8, LTEQ(VAR("x"), CONST(255))));
		assertTrue(t instanceof Term.Quantifier);
		Term.Quantifier q = (Term.Quantifier) t;
		assertTrue(q.isUniversal());
		assertEquals(1, q.getVariables().length);
		// The bound variable is out of scope afterwards
		assertNull(evaluator.getScope().getValue("x"));
		// Values read under a quantifier are not observed
		evaluator.evaluate(EXISTS("k", Type.Address, GT(STORAGE("balances", KEY(VAR("k"))), CONST(0))));
		assertTrue(vc.getObservations().isEmpty());
	}

	@Test
	public void boundedCasts() {
		evaluator.evaluate(ASSERT_CAST(Type.Uint8, CONST(300)));
		assertEquals(1, vc.getChecks().size());
		assertEquals(VerificationCondition.Check.Kind.CAST, vc.getChecks().get(0).getKind());
		assertEquals(Term.FALSE, vc.getChecks().get(0).getCondition());
		int before = vc.getAssumptions().size();
		evaluator.evaluate(REQUIRE_CAST(Type.Uint8, CONST(300)));
		assertEquals(1, vc.getChecks().size());
		assertEquals(before + 1, vc.getAssumptions().size());
		assertEquals(Term.FALSE, vc.getAssumptions().get(before).getCondition());
	}

	@Test
	public void ghostReads() {
		Term t = evaluator.evaluate(ADD(GHOST_READ("total"), CONST(1)));
		assertEquals(Term.ADD(ghosts.get("total", new ArrayList<>()), Term.ONE), t);
	}

	@Test
	public void castsInUntakenBranchesAreDischarged() {
		evaluator.evaluate(ITE(CONST(true), CONST(0), ASSERT_CAST(Type.Uint8, CONST(300))));
		evaluator.evaluate(IMPLIES(CONST(false), EQ(ASSERT_CAST(Type.Uint8, CONST(300)), CONST(0))));
		evaluator.evaluate(OR(CONST(true), EQ(ASSERT_CAST(Type.Uint8, CONST(300)), CONST(0))));
		evaluator.evaluate(AND(CONST(false), EQ(ASSERT_CAST(Type.Uint8, CONST(300)), CONST(0))));
		assertEquals(4, vc.getChecks().size());
		for (VerificationCondition.Check c : vc.getChecks()) {
			assertEquals(Term.TRUE, c.getCondition());
		}
		// The branch taken is still checked
		evaluator.evaluate(ITE(CONST(false), CONST(0), ASSERT_CAST(Type.Uint8, CONST(300))));
		assertEquals(Term.FALSE, vc.getChecks().get(4).getCondition());
	}

	@Test
	public void castsInBranchesAreGuardedByCondition() {
		Term x = Term.VAR("x", Term.Sort.INT);
		evaluator.getScope().declare("x", x);
		evaluator.evaluate(ITE(GT(VAR("x"), CONST(255)), CONST(0), ASSERT_CAST(Type.Uint8, VAR("x"))));
		Term fits = Types.fits(Type.Uint8, x);
		assertEquals(Term.IMPLIES(Term.NOT(Term.GT(x, Term.CONST(255))), fits),
				vc.getChecks().get(0).getCondition());
	}

	@Test
	public void quantifiedReadsKeepTheirDomain() {
		int before = vc.getAssumptions().size();
		Term t = evaluator.evaluate(FORALL("a", Type.Address, GTEQ(STORAGE("balances", KEY(VAR("a"))), CONST(0))));
		// The range of each balance mentions the bound variable, so belongs to
		// the quantifier rather than the path
		assertEquals(before, vc.getAssumptions().size());
		assertTrue(t instanceof Term.Quantifier);
		assertTrue(((Term.Quantifier) t).getBody() instanceof Term.Implies);
	}

	@Test
	public void quantifiedCastsCoverEveryInstance() {
		evaluator.evaluate(FORALL("x", Type.Uint8, EQ(ASSERT_CAST(Type.Uint8, VAR("x")), VAR("x"))));
		assertEquals(1, vc.getChecks().size());
		assertTrue(vc.getChecks().get(0).getCondition() instanceof Term.Quantifier);
		int before = vc.getAssumptions().size();
		evaluator.evaluate(FORALL("y", Type.Uint256, EQ(REQUIRE_CAST(Type.Uint8, VAR("y")), VAR("y"))));
		assertEquals(before + 1, vc.getAssumptions().size());
		assertTrue(vc.getAssumptions().get(before).getCondition() instanceof Term.Quantifier);
	}
}
