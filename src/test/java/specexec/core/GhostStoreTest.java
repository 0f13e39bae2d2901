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
package specexec.core;

import static org.junit.Assert.*;
import static specexec.core.Term.*;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.Before;
import org.junit.Test;

import specexec.core.SpecFile.Decl;
import specexec.core.SpecFile.Type;

/**
 * Tests for the ghost store.
 *
 * @author David J. Pearce
 *
 */
public class GhostStoreTest {
	private static final Decl.Ghost TOTAL = SpecFile.GHOST("total", Type.MathInt);
	private static final Decl.Ghost SHADOW = SpecFile.GHOST("shadow", Type.Address, Type.Uint256);
	private static final Decl.Ghost CALLS = new Decl.Ghost("calls", Collections.emptyList(), Type.Uint256,
			Collections.emptyList(), Collections.emptyList(), true);

	private List<Term> constraints;
	private GhostStore ghosts;

	@Before
	public void setup() {
		constraints = new ArrayList<>();
		ghosts = new GhostStore(new Generator(), constraints::add);
		ghosts.declare(TOTAL);
		ghosts.declare(SHADOW);
		ghosts.declare(CALLS);
	}

	@Test(expected = IllegalArgumentException.class)
	public void duplicateGhost() {
		ghosts.declare(TOTAL);
	}

	@Test(expected = IllegalArgumentException.class)
	public void unknownGhost() {
		ghosts.get("missing", Collections.emptyList());
	}

	@Test
	public void setThenGet() {
		ghosts.set("total", Collections.emptyList(), CONST(60));
		assertEquals(CONST(60), ghosts.get("total", Collections.emptyList()));
		List<Term> key = Arrays.asList(ONE);
		ghosts.set("shadow", key, CONST(3));
		assertEquals(CONST(3), ghosts.get("shadow", key));
	}

	@Test
	public void boundedGhostsAreConstrained() {
		// Unbounded ghosts need no constraint
		ghosts.get("total", Collections.emptyList());
		assertTrue(constraints.isEmpty());
		Term v = ghosts.get("shadow", Arrays.asList(ONE));
		assertEquals(1, constraints.size());
		assertEquals(Types.domain(Type.Uint256, v), constraints.get(0));
	}

	@Test
	public void writtenValuesAreNotConstrained() {
		ghosts.set("calls", Collections.emptyList(), CONST(-1));
		ghosts.get("calls", Collections.emptyList());
		// Only the arbitrary initial value is constrained, not the value written
		for (Term c : constraints) {
			assertNotEquals(Types.domain(Type.Uint256, CONST(-1)), c);
		}
	}

	@Test
	public void havocKeepsOldValue() {
		ghosts.set("total", Collections.emptyList(), CONST(5));
		ghosts.havoc("total");
		assertEquals(CONST(5), ghosts.getOld("total", Collections.emptyList()));
		assertNotEquals(CONST(5), ghosts.get("total", Collections.emptyList()));
	}

	@Test(expected = IllegalStateException.class)
	public void oldWithoutHavoc() {
		ghosts.getOld("total", Collections.emptyList());
	}

	@Test
	public void resetGivesFreshValues() {
		Term before = ghosts.get("total", Collections.emptyList());
		ghosts.reset();
		assertNotEquals(before, ghosts.get("total", Collections.emptyList()));
	}

	@Test
	public void mergeSkipsPersistentGhosts() {
		GhostStore.Snapshot before = ghosts.snapshot();
		ghosts.set("total", Collections.emptyList(), CONST(1));
		ghosts.set("calls", Collections.emptyList(), CONST(1));
		GhostStore.Snapshot after = ghosts.snapshot();
		Term c = VAR("reverted", Sort.BOOL);
		ghosts.merge(c, before, after, false);
		assertEquals(ITE(c, before.get("total"), CONST(1)), ghosts.get("total", Collections.emptyList()));
		// Persistent ghosts keep their latest value
		assertEquals(CONST(1), ghosts.get("calls", Collections.emptyList()));
		ghosts.merge(TRUE, before, after, true);
		assertEquals(before.get("calls"), ghosts.get("calls", Collections.emptyList()));
	}

	@Test
	public void sorts() {
		assertEquals(Sort.INT, GhostStore.sortOf(TOTAL));
		assertEquals(new Sort.Array(Sort.INT, Sort.INT), GhostStore.sortOf(SHADOW));
	}
}
