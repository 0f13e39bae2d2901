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

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.junit.Before;
import org.junit.Test;

import specexec.core.Location;
import specexec.core.SpecFile;
import specexec.core.SpecFile.Decl;
import specexec.core.SpecFile.Pattern;
import specexec.core.SpecFile.Type;
import specexec.core.StorageLayout;
import specexec.core.StorageState;
import specexec.core.Term;
import specexec.testing.TokenSystem;

/**
 * Tests for the matching and ordering of hooks. Hook bodies are replaced here
 * by a trigger which records what fired.
 *
 * @author David J. Pearce
 *
 */
public class HookDispatcherTest {
	private static final Decl.Hook BALANCE_STORE = SpecFile.SSTORE(
			SpecFile.PATTERN("balances", new Pattern.Key(SpecFile.PARAM("a", Type.Address))),
			SpecFile.PARAM("v", Type.Uint256), SpecFile.PARAM("old", Type.Uint256), SpecFile.SEQUENCE());
	private static final Decl.Hook BALANCE_LOAD = SpecFile.SLOAD(
			SpecFile.PATTERN("balances", new Pattern.Key(SpecFile.PARAM("a", Type.Address))),
			SpecFile.PARAM("v", Type.Uint256), SpecFile.SEQUENCE());
	private static final Decl.Hook ZERO_STORE = SpecFile.SSTORE(
			SpecFile.PATTERN("balances", new Pattern.Constant(SpecFile.CONST(0))), SpecFile.PARAM("v", Type.Uint256),
			null, SpecFile.SEQUENCE());
	private static final Decl.Hook ALLOWANCE_STORE = SpecFile.SSTORE(
			SpecFile.PATTERN("allowances", new Pattern.Key(SpecFile.PARAM("o", Type.Address)),
					new Pattern.Key(SpecFile.PARAM("s", Type.Address))),
			SpecFile.PARAM("v", Type.Uint256), null, SpecFile.SEQUENCE());
	private static final Decl.Hook ANY_STORE = SpecFile.ALL_SSTORE(SpecFile.PARAM("slot", Type.Uint256),
			SpecFile.PARAM("v", Type.Uint256), SpecFile.SEQUENCE());

	/**
	 * Records each firing, and maintains a running delta sum for balance writes.
	 */
	private static class Recorder implements HookDispatcher.Trigger {
		private final List<Decl.Hook> fired = new ArrayList<>();
		private final List<Map<String, Term>> bindings = new ArrayList<>();
		private final List<Term> guards = new ArrayList<>();
		private Term sum = ZERO;

		@Override
		public void fire(Decl.Hook hook, Map<String, Term> binding, Term guard) {
			fired.add(hook);
			bindings.add(new LinkedHashMap<>(binding));
			guards.add(guard);
			if (hook == BALANCE_STORE) {
				sum = ADD(sum, SUB(binding.get("v"), binding.get("old")));
			}
		}
	}

	private final StorageLayout layout = new TokenSystem().getLayout();
	private StorageState storage;
	private Recorder recorder;

	@Before
	public void setup() {
		storage = StorageState.zero(layout, t -> {
		});
		recorder = new Recorder();
	}

	private HookDispatcher install(Decl.Hook... hooks) {
		HookDispatcher dispatcher = new HookDispatcher(layout);
		for (Decl.Hook h : hooks) {
			dispatcher.register(h);
		}
		dispatcher.setTrigger(recorder);
		storage.setObserver(dispatcher);
		return dispatcher;
	}

	@Test
	public void deltaSumOverSequentialWrites() {
		install(BALANCE_STORE);
		storage.write(TokenSystem.balance(ONE), CONST(100));
		storage.write(TokenSystem.balance(ONE), CONST(60));
		assertEquals(CONST(60), recorder.sum);
		assertEquals(ONE, recorder.bindings.get(1).get("a"));
		assertEquals(CONST(100), recorder.bindings.get(1).get("old"));
		assertEquals(CONST(60), recorder.bindings.get(1).get("v"));
	}

	@Test
	public void deltaSumOverDistinctKeys() {
		install(BALANCE_STORE);
		storage.write(TokenSystem.balance(ONE), CONST(100));
		storage.write(TokenSystem.balance(CONST(2)), CONST(30));
		storage.write(TokenSystem.balance(ONE), CONST(60));
		storage.write(TokenSystem.balance(CONST(2)), CONST(0));
		storage.write(TokenSystem.balance(CONST(3)), CONST(5));
		Term actual = ZERO;
		for (int i = 1; i <= 3; ++i) {
			actual = ADD(actual, storage.read(TokenSystem.balance(CONST(i))));
		}
		assertEquals(actual, recorder.sum);
		assertEquals(CONST(65), recorder.sum);
	}

	@Test
	public void declarationOrder() {
		install(ANY_STORE, BALANCE_STORE, ZERO_STORE);
		storage.write(TokenSystem.balance(ZERO), CONST(1));
		assertEquals(3, recorder.fired.size());
		assertSame(ANY_STORE, recorder.fired.get(0));
		assertSame(BALANCE_STORE, recorder.fired.get(1));
		assertSame(ZERO_STORE, recorder.fired.get(2));
	}

	@Test
	public void eachHookFiresOncePerAccess() {
		install(BALANCE_STORE, ALLOWANCE_STORE);
		storage.write(TokenSystem.allowance(ONE, CONST(2)), CONST(7));
		assertEquals(1, recorder.fired.size());
		assertSame(ALLOWANCE_STORE, recorder.fired.get(0));
		assertEquals(ONE, recorder.bindings.get(0).get("o"));
		assertEquals(CONST(2), recorder.bindings.get(0).get("s"));
	}

	@Test
	public void constantPatterns() {
		install(ZERO_STORE);
		// Decidably distinct key
		storage.write(TokenSystem.balance(ONE), CONST(1));
		assertTrue(recorder.fired.isEmpty());
		// Decidably equal key
		storage.write(TokenSystem.balance(ZERO), CONST(1));
		assertEquals(1, recorder.fired.size());
		assertEquals(TRUE, recorder.guards.get(0));
		// Symbolic key fires under a guard
		Term k = VAR("k", Sort.INT);
		storage.write(TokenSystem.balance(k), CONST(1));
		assertEquals(2, recorder.fired.size());
		assertEquals(EQ(k, ZERO), recorder.guards.get(1));
	}

	@Test
	public void wildcardSeesRawSlot() {
		install(ANY_STORE);
		storage.write(TokenSystem.totalSupply(), CONST(9));
		assertEquals(ONE, recorder.bindings.get(0).get("slot"));
		assertEquals(CONST(9), recorder.bindings.get(0).get("v"));
	}

	@Test
	public void readHooksFireOnLoadOnly() {
		install(BALANCE_LOAD, BALANCE_STORE);
		storage.read(TokenSystem.balance(ONE));
		assertTrue(recorder.fired.isEmpty());
		storage.load(TokenSystem.balance(ONE));
		assertEquals(1, recorder.fired.size());
		assertSame(BALANCE_LOAD, recorder.fired.get(0));
	}

	@Test
	public void noReentrantDispatch() {
		HookDispatcher dispatcher = install(BALANCE_STORE);
		dispatcher.setTrigger(new HookDispatcher.Trigger() {
			@Override
			public void fire(Decl.Hook hook, Map<String, Term> bindings, Term guard) {
				recorder.fired.add(hook);
				// A write from within a hook body is not dispatched again
				storage.write(TokenSystem.balance(CONST(2)), CONST(1));
			}
		});
		storage.write(TokenSystem.balance(ONE), CONST(1));
		assertEquals(1, recorder.fired.size());
	}

	@Test
	public void matchRejectsOtherRoots() {
		Map<String, Term> bindings = new LinkedHashMap<>();
		Pattern p = BALANCE_STORE.getPattern();
		assertNull(HookDispatcher.match(p, TokenSystem.totalSupply(), bindings));
		assertNull(HookDispatcher.match(p, new Location("allowances", Location.KEY(ONE), Location.KEY(ONE)),
				bindings));
		assertEquals(TRUE, HookDispatcher.match(p, TokenSystem.balance(ONE), bindings));
		assertEquals(ONE, bindings.get("a"));
	}
}
