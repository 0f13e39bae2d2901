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

import static org.junit.Assert.*;
import static specexec.core.Term.*;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.Test;

import specexec.core.Term;

/**
 * Tests for the translation of terms into Z3.
 *
 * @author David J. Pearce
 *
 */
public class Z3SolverTest {
	private static final List<Term> NONE = Collections.emptyList();

	private final Z3Solver z3 = new Z3Solver().setOption("smt.random_seed", "0");

	@Test
	public void satisfiableWithModel() {
		Variable x = VAR("x", Sort.INT);
		Variable b = VAR("b", Sort.BOOL);
		try (Solver.Session s = z3.open(10_000)) {
			s.assume(EQ(ADD(x, CONST(3)), CONST(10)));
			s.assume(IFF(b, GT(x, CONST(5))));
			Solver.Result r = s.check(NONE, Arrays.<Term>asList(x, b, MUL(x, CONST(2))));
			assertEquals(Solver.Status.SAT, r.getStatus());
			assertEquals(Arrays.<Object>asList(BigInteger.valueOf(7), Boolean.TRUE, BigInteger.valueOf(14)),
					r.getValues());
		}
	}

	@Test
	public void unsatisfiable() {
		Variable x = VAR("x", Sort.INT);
		try (Solver.Session s = z3.open(10_000)) {
			s.assume(GT(x, CONST(5)));
			s.assume(LT(x, CONST(3)));
			Solver.Result r = s.check(NONE, Collections.<Term>singletonList(x));
			assertEquals(Solver.Status.UNSAT, r.getStatus());
			assertTrue(r.getValues().isEmpty());
		}
	}

	@Test
	public void goalsAreDiscarded() {
		Variable x = VAR("x", Sort.INT);
		try (Solver.Session s = z3.open(10_000)) {
			s.assume(GTEQ(x, ZERO));
			assertEquals(Solver.Status.UNSAT, s.check(Arrays.asList(LT(x, ZERO)), NONE).getStatus());
			assertEquals(Solver.Status.SAT, s.check(Arrays.asList(EQ(x, ZERO)), NONE).getStatus());
			assertEquals(Solver.Status.SAT, s.check(NONE, NONE).getStatus());
		}
	}

	@Test
	public void euclideanDivision() {
		Variable q = VAR("q", Sort.INT);
		Variable r = VAR("r", Sort.INT);
		Variable n = VAR("n", Sort.INT);
		// Prevent folding by hiding the numerator behind a variable
		try (Solver.Session s = z3.open(10_000)) {
			s.assume(EQ(n, CONST(-7)));
			s.assume(EQ(q, DIV(n, CONST(2))));
			s.assume(EQ(r, MOD(n, CONST(2))));
			Solver.Result res = s.check(NONE, Arrays.<Term>asList(q, r));
			assertEquals(Arrays.<Object>asList(BigInteger.valueOf(-4), BigInteger.ONE), res.getValues());
		}
	}

	@Test
	public void arrays() {
		Sort.Array sort = new Sort.Array(Sort.INT, Sort.INT);
		Variable m = VAR("m", sort);
		Variable k = VAR("k", Sort.INT);
		Term updated = STORE(STORE(m, k, CONST(5)), ONE, CONST(7));
		try (Solver.Session s = z3.open(10_000)) {
			// Reading the key back gives what was written, unless it aliases
			s.assume(NOT(IMPLIES(NEQ(k, ONE), EQ(SELECT(updated, k), CONST(5)))));
			assertEquals(Solver.Status.UNSAT, s.check(NONE, NONE).getStatus());
		}
		try (Solver.Session s = z3.open(10_000)) {
			s.assume(NEQ(SELECT(CONST_ARRAY(sort, ZERO), k), ZERO));
			assertEquals(Solver.Status.UNSAT, s.check(NONE, NONE).getStatus());
		}
	}

	@Test
	public void uninterpretedFunctions() {
		Variable a = VAR("a", Sort.INT);
		Variable b = VAR("b", Sort.INT);
		try (Solver.Session s = z3.open(10_000)) {
			s.assume(EQ(a, b));
			s.assume(NEQ(APPLY("hash", Sort.INT, a), APPLY("hash", Sort.INT, b)));
			assertEquals(Solver.Status.UNSAT, s.check(NONE, NONE).getStatus());
		}
	}

	@Test
	public void quantifiers() {
		Variable x = VAR("x", Sort.INT);
		Variable y = VAR("y", Sort.INT);
		try (Solver.Session s = z3.open(10_000)) {
			s.assume(FORALL(Arrays.asList(x), GT(APPLY("f", Sort.INT, x), ZERO)));
			assertEquals(Solver.Status.UNSAT,
					s.check(Arrays.asList(LTEQ(APPLY("f", Sort.INT, CONST(3)), ZERO)), NONE).getStatus());
			s.assume(EXISTS(Arrays.asList(y), EQ(APPLY("f", Sort.INT, y), CONST(42))));
			assertEquals(Solver.Status.SAT, s.check(NONE, NONE).getStatus());
		}
	}

	@Test
	public void uninterpretedSorts() {
		Sort id = new Sort.Uninterpreted("Id");
		Variable u = VAR("u", id);
		Variable v = VAR("v", id);
		try (Solver.Session s = z3.open(10_000)) {
			s.assume(NEQ(u, v));
			Solver.Result r = s.check(NONE, Arrays.<Term>asList(u, v));
			assertEquals(Solver.Status.SAT, r.getStatus());
			assertTrue(r.getValues().get(0) instanceof String);
			assertNotEquals(r.getValues().get(0), r.getValues().get(1));
		}
	}

	@Test
	public void cancelledSessionAnswersUnknown() {
		try (Solver.Session s = z3.open(10_000)) {
			s.assume(GT(VAR("x", Sort.INT), ZERO));
			s.cancel();
			Solver.Result r = s.check(NONE, NONE);
			assertEquals(Solver.Status.UNKNOWN, r.getStatus());
			assertEquals("cancelled", r.getReason());
		}
	}

	@Test
	public void sessionsAreIndependent() {
		Variable x = VAR("x", Sort.INT);
		try (Solver.Session s1 = z3.open(10_000); Solver.Session s2 = z3.open(10_000)) {
			s1.assume(EQ(x, ONE));
			s2.assume(EQ(x, CONST(2)));
			assertEquals(Arrays.<Object>asList(BigInteger.ONE),
					s1.check(NONE, Collections.<Term>singletonList(x)).getValues());
			assertEquals(Arrays.<Object>asList(BigInteger.valueOf(2)),
					s2.check(NONE, Collections.<Term>singletonList(x)).getValues());
		}
	}
}
