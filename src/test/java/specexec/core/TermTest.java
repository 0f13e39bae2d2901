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

import org.junit.Test;

/**
 * Checks the simplifications performed when constructing terms.
 *
 * @author David J. Pearce
 *
 */
public class TermTest {
	private static final long N = 42;

	@Test
	public void identities() {
		Term x = VAR("x", Sort.INT);
		assertSame(x, ADD(x, ZERO));
		assertSame(x, MUL(ONE, x));
		assertEquals(ZERO, SUB(x, x));
		assertEquals(ZERO, MUL(x, ZERO));
		assertEquals(TRUE, LTEQ(x, x));
		assertEquals(FALSE, LT(x, x));
	}

	@Test
	public void logicalFolding() {
		Term p = VAR("p", Sort.BOOL);
		Term q = VAR("q", Sort.BOOL);
		assertEquals(FALSE, AND(p, FALSE, q));
		assertEquals(TRUE, OR(p, TRUE));
		assertSame(p, AND(TRUE, p));
		assertSame(p, NOT(NOT(p)));
		assertEquals(TRUE, IMPLIES(FALSE, q));
		assertEquals(NOT(p), IMPLIES(p, FALSE));
		assertSame(p, ITE(p, TRUE, FALSE));
		assertSame(q, ITE(TRUE, q, p));
		// Nested conjunctions are flattened
		Term r = VAR("r", Sort.BOOL);
		assertEquals(AND(p, q, r), AND(AND(p, q), r));
	}

	@Test
	public void selectThroughStore() {
		Sort.Array sort = new Sort.Array(Sort.INT, Sort.INT);
		Term a = VAR("a", sort);
		Term k = VAR("k", Sort.INT);
		Term updated = STORE(a, CONST(1), CONST(N));
		// Decidably equal index
		assertEquals(CONST(N), SELECT(updated, CONST(1)));
		// Decidably distinct index
		assertEquals(SELECT(a, CONST(2)), SELECT(updated, CONST(2)));
		// Undecided index
		assertTrue(SELECT(updated, k) instanceof Term.Select);
		// Constant arrays
		assertEquals(ZERO, SELECT(CONST_ARRAY(sort, ZERO), k));
	}

	@Test
	public void freshVariablesAreDistinct() {
		Generator g = new Generator();
		Variable v1 = g.fresh("x", Sort.INT);
		Variable v2 = g.fresh("x", Sort.INT);
		assertNotEquals(v1, v2);
		assertEquals(Sort.INT, v1.getSort());
	}
}
