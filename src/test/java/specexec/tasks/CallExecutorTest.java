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
import static specexec.core.Term.*;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.Before;
import org.junit.Test;

import specexec.core.CallFrame;
import specexec.core.Environment;
import specexec.core.GhostStore;
import specexec.core.MethodDescriptor;
import specexec.core.ModelingException;
import specexec.core.SpecFile;
import specexec.core.SpecFile.Type;
import specexec.core.StorageLayout;
import specexec.core.StorageState;
import specexec.core.TargetSystem;
import specexec.core.Term;
import specexec.core.VerificationCondition;
import specexec.testing.TokenSystem;

/**
 * Tests for executing calls against the token fixture.
 *
 * @author David J. Pearce
 *
 */
public class CallExecutorTest {
	private Generator generator;
	private VerificationCondition vc;
	private StorageState storage;
	private GhostStore ghosts;
	private CallExecutor executor;

	@Before
	public void setup() {
		TokenSystem token = new TokenSystem();
		generator = new Generator();
		vc = new VerificationCondition();
		storage = StorageState.zero(token.getLayout(), vc::constrain);
		ghosts = new GhostStore(generator, vc::constrain);
		ghosts.declare(SpecFile.GHOST("total", Type.MathInt));
		executor = new CallExecutor(token, storage, ghosts, generator, vc);
	}

	private static Environment env(Term sender, Term value) {
		return new Environment(sender, value, ZERO, ZERO);
	}

	@Test
	public void transferMovesBalance() {
		storage.write(TokenSystem.balance(ONE), CONST(100));
		CallExecutor.Result r = executor.invoke(TokenSystem.TRANSFER, env(ONE, ZERO),
				Arrays.asList(CONST(2), CONST(30)));
		assertEquals(FALSE, r.getReverted());
		assertEquals(Collections.singletonList(TRUE), r.getReturns());
		assertEquals(CONST(70), storage.read(TokenSystem.balance(ONE)));
		assertEquals(CONST(30), storage.read(TokenSystem.balance(CONST(2))));
		assertFalse(executor.getLastReverted().isTrue());
		assertEquals(1, vc.getCalls().size());
	}

	@Test
	public void revertRollsBackStorageAndGhosts() {
		Term amount = generator.fresh("amount", Sort.INT);
		storage.write(TokenSystem.balance(ONE), CONST(100));
		StorageState.Snapshot before = storage.snapshot();
		Term ghostBefore = ghosts.get("total", Collections.<Term>emptyList());
		CallExecutor.Result r = executor.invokeOrRevert(TokenSystem.TRANSFER, env(ONE, ZERO),
				Arrays.asList(CONST(2), amount));
		Term reverted = r.getReverted();
		assertFalse(reverted.isFalse());
		assertEquals(reverted, executor.getLastReverted());
		// Whenever the call reverts, storage is exactly as before
		Term balance = storage.read(TokenSystem.balance(ONE));
		assertTrue(balance instanceof Term.IfThenElse);
		Term.IfThenElse ite = (Term.IfThenElse) balance;
		assertEquals(reverted, ite.getCondition());
		assertEquals(CONST(100), ite.getTrueBranch());
		assertEquals(SUB(CONST(100), amount), ite.getFalseBranch());
		assertEquals(before.get("balances[]"), ((Term.IfThenElse) storage.snapshot().get("balances[]")).getTrueBranch());
		assertEquals(ghostBefore, ghosts.get("total", Collections.<Term>emptyList()));
		// Nothing is assumed about whether the call reverts
		for (VerificationCondition.Assumption a : vc.getAssumptions()) {
			assertFalse(a.getSource().contains("does not revert"));
		}
	}

	@Test
	public void unconditionalRevert() {
		// Insufficient balance in zeroed storage
		CallExecutor.Result r = executor.invokeOrRevert(TokenSystem.WITHDRAW, env(ONE, ZERO),
				Arrays.asList(CONST(1)));
		assertEquals(TRUE, r.getReverted());
		assertEquals(ZERO, storage.read(TokenSystem.balance(ONE)));
		assertEquals(ZERO, storage.read(TokenSystem.totalSupply()));
	}

	@Test
	public void nonPayableRevertsOnValue() {
		storage.write(TokenSystem.balance(ONE), CONST(100));
		CallExecutor.Result r = executor.invokeOrRevert(TokenSystem.TRANSFER, env(ONE, CONST(1)),
				Arrays.asList(CONST(2), CONST(1)));
		assertEquals(TRUE, r.getReverted());
		// Whereas a payable method accepts it
		r = executor.invokeOrRevert(TokenSystem.DEPOSIT, env(ONE, CONST(1)), Collections.<Term>emptyList());
		assertEquals(FALSE, r.getReverted());
		assertEquals(CONST(101), storage.read(TokenSystem.balance(ONE)));
		assertEquals(CONST(1), storage.read(TokenSystem.totalSupply()));
	}

	@Test
	public void invokeAssumesSuccess() {
		Term amount = generator.fresh("amount", Sort.INT);
		executor.invoke(TokenSystem.WITHDRAW, env(ONE, ZERO), Arrays.asList(amount));
		List<VerificationCondition.Assumption> as = vc.getAssumptions();
		assertTrue(as.get(as.size() - 1).getSource().contains("does not revert"));
		assertEquals(FALSE, executor.getLastReverted());
	}

	@Test(expected = IllegalArgumentException.class)
	public void wrongArity() {
		executor.invoke(TokenSystem.TRANSFER, env(ONE, ZERO), Arrays.asList(ONE));
	}

	@Test
	public void envfreeSendsNoValue() {
		Environment e = executor.envfree();
		assertEquals(ZERO, e.getValue());
		CallExecutor.Result r = executor.invoke(TokenSystem.BALANCE_OF, e, Arrays.asList(ONE));
		assertFalse(r.isEnvironmentAccessed());
		assertEquals(Collections.singletonList(ZERO), r.getReturns());
	}

	@Test
	public void viewMethodWhichWrites() {
		final MethodDescriptor peek = new MethodDescriptor("Broken", "peek", Collections.<Type>emptyList(),
				Collections.<Type>emptyList(), MethodDescriptor.Mutability.VIEW, BigInteger.ONE);
		final StorageLayout layout = new StorageLayout().add("counter", Type.Uint256);
		TargetSystem broken = new TargetSystem() {
			@Override
			public String getName() {
				return "Broken";
			}

			@Override
			public StorageLayout getLayout() {
				return layout;
			}

			@Override
			public List<MethodDescriptor> getMethods() {
				return Collections.singletonList(peek);
			}

			@Override
			public MethodDescriptor getConstructor() {
				return null;
			}

			@Override
			public void apply(MethodDescriptor method, CallFrame frame) {
				specexec.core.Location counter = new specexec.core.Location("counter");
				frame.write(counter, ADD(frame.load(counter), ONE));
			}
		};
		CallExecutor e = new CallExecutor(broken, StorageState.zero(layout, vc::constrain), ghosts, generator, vc);
		try {
			e.invoke(peek, env(ONE, ZERO), Collections.<Term>emptyList());
			fail("view method wrote storage");
		} catch (ModelingException ex) {
			assertTrue(ex.getMessage().contains("Broken.peek() is declared view but writes counter"));
		}
	}
}
