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
import java.util.List;

import org.junit.Before;
import org.junit.Test;

import specexec.core.SpecFile.Type;
import specexec.testing.TokenSystem;

/**
 * Tests for the storage model and layout of the token fixture.
 *
 * @author David J. Pearce
 *
 */
public class StorageStateTest {
	private final StorageLayout layout = new TokenSystem().getLayout();
	private Generator generator;
	private List<Term> constraints;

	@Before
	public void setup() {
		generator = new Generator();
		constraints = new ArrayList<>();
	}

	@Test
	public void shapes() {
		assertNotNull(layout.getShape("balances[]"));
		assertNotNull(layout.getShape("allowances[][]"));
		assertEquals(Type.Uint256, layout.typeOf(TokenSystem.balance(ZERO)));
		assertEquals(Type.Address, layout.typeOf(TokenSystem.owner()));
	}

	@Test(expected = IllegalArgumentException.class)
	public void invalidLocation() {
		layout.typeOf(new Location("balances", Location.FIELD("x")));
	}

	@Test
	public void zeroStorageReadsZero() {
		StorageState s = StorageState.zero(layout, constraints::add);
		assertEquals(ZERO, s.read(TokenSystem.balance(VAR("a", Sort.INT))));
		assertEquals(ZERO, s.read(TokenSystem.allowance(ONE, CONST(2))));
		assertEquals(ZERO, s.read(TokenSystem.totalSupply()));
		// Nothing to constrain in zeroed storage
		assertTrue(constraints.isEmpty());
	}

	@Test
	public void freshStorageIsConstrained() {
		StorageState s = StorageState.fresh(layout, generator, constraints::add);
		Term v = s.read(TokenSystem.totalSupply());
		assertTrue(v instanceof Term.Variable);
		assertEquals(1, constraints.size());
		assertEquals(Types.domain(Type.Uint256, v), constraints.get(0));
	}

	@Test
	public void writeThenRead() {
		StorageState s = StorageState.fresh(layout, generator, constraints::add);
		Term k = VAR("k", Sort.INT);
		s.write(TokenSystem.balance(k), CONST(100));
		assertEquals(CONST(100), s.read(TokenSystem.balance(k)));
		// A different concrete key is unaffected
		s.write(TokenSystem.balance(ONE), CONST(5));
		assertEquals(CONST(5), s.read(TokenSystem.balance(ONE)));
		assertEquals(CONST(6), ADD(s.read(TokenSystem.balance(ONE)), ONE));
	}

	@Test
	public void observerSeesOldAndNewValues() {
		StorageState s = StorageState.zero(layout, constraints::add);
		final List<Term[]> writes = new ArrayList<>();
		final List<Location> reads = new ArrayList<>();
		s.setObserver(new StorageState.Observer() {
			@Override
			public void onWrite(Location location, Term oldValue, Term newValue) {
				writes.add(new Term[] { oldValue, newValue });
			}

			@Override
			public void onRead(Location location, Term value) {
				reads.add(location);
			}
		});
		s.write(TokenSystem.balance(ONE), CONST(100));
		s.write(TokenSystem.balance(ONE), CONST(60));
		assertEquals(2, writes.size());
		assertArrayEquals(new Term[] { ZERO, CONST(100) }, writes.get(0));
		assertArrayEquals(new Term[] { CONST(100), CONST(60) }, writes.get(1));
		// Only loads notify, not reads
		s.read(TokenSystem.balance(ONE));
		assertTrue(reads.isEmpty());
		s.load(TokenSystem.balance(ONE));
		assertEquals(1, reads.size());
		// Muted storage notifies nobody
		s.setMuted(true);
		s.write(TokenSystem.balance(ONE), CONST(1));
		s.load(TokenSystem.balance(ONE));
		assertEquals(2, writes.size());
		assertEquals(1, reads.size());
	}

	@Test
	public void snapshotsAreImmutable() {
		StorageState s = StorageState.zero(layout, constraints::add);
		StorageState.Snapshot before = s.snapshot();
		s.write(TokenSystem.totalSupply(), CONST(7));
		StorageState.Snapshot after = s.snapshot();
		assertEquals(ZERO, before.get("totalSupply"));
		assertEquals(CONST(7), after.get("totalSupply"));
		assertEquals(FALSE, StorageState.equal(before, after));
		assertEquals(TRUE, StorageState.equal(after, s.snapshot()));
		s.restore(before);
		assertEquals(ZERO, s.read(TokenSystem.totalSupply()));
	}

	@Test
	public void merge() {
		StorageState s = StorageState.zero(layout, constraints::add);
		StorageState.Snapshot before = s.snapshot();
		s.write(TokenSystem.totalSupply(), CONST(7));
		StorageState.Snapshot after = s.snapshot();
		Term c = VAR("c", Sort.BOOL);
		s.merge(c, before, after);
		assertEquals(ITE(c, ZERO, CONST(7)), s.read(TokenSystem.totalSupply()));
		s.merge(TRUE, before, after);
		assertEquals(ZERO, s.read(TokenSystem.totalSupply()));
	}

	@Test
	public void rawSlots() {
		assertEquals(ZERO, layout.slotOf(TokenSystem.owner()));
		assertEquals(ONE, layout.slotOf(TokenSystem.totalSupply()));
		Term slot = layout.slotOf(TokenSystem.balance(CONST(9)));
		assertEquals(APPLY(StorageLayout.MAPPING_SLOT, Sort.INT, CONST(9), CONST(2)), slot);
	}
}
