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

import java.math.BigInteger;
import java.util.Arrays;
import java.util.Collection;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;
import org.junit.runners.Parameterized.Parameters;

/**
 * Constant integer division must agree with the solver's (Euclidean)
 * semantics, since folded and unfolded terms are mixed freely.
 *
 * @author David J. Pearce
 *
 */
@RunWith(Parameterized.class)
public class ArithmeticTest {
	private final long lhs;
	private final long rhs;
	private final long quotient;
	private final long remainder;

	public ArithmeticTest(long lhs, long rhs, long quotient, long remainder) {
		this.lhs = lhs;
		this.rhs = rhs;
		this.quotient = quotient;
		this.remainder = remainder;
	}

	@Parameters(name = "{0} / {1}")
	public static Collection<Object[]> data() {
		return Arrays.asList(new Object[][] {
			{ 7, 2, 3, 1 },
			{ -7, 2, -4, 1 },
			{ 7, -2, -3, 1 },
			{ -7, -2, 4, 1 },
			{ 6, 3, 2, 0 },
			{ -6, 3, -2, 0 },
			{ 0, 5, 0, 0 }
		});
	}

	@Test
	public void euclideanDivision() {
		assertEquals(BigInteger.valueOf(quotient), value(DIV(CONST(lhs), CONST(rhs))));
		assertEquals(BigInteger.valueOf(remainder), value(MOD(CONST(lhs), CONST(rhs))));
		// The remainder is never negative
		assertTrue(remainder >= 0);
		assertEquals(lhs, quotient * rhs + remainder);
	}

	@Test
	public void divisionByZeroIsNotFolded() {
		assertNull(value(DIV(CONST(lhs), ZERO)));
		assertNull(value(MOD(CONST(lhs), ZERO)));
	}

	@Test
	public void arithmeticFolding() {
		assertEquals(CONST(lhs + rhs), ADD(CONST(lhs), CONST(rhs)));
		assertEquals(CONST(lhs - rhs), SUB(CONST(lhs), CONST(rhs)));
		assertEquals(CONST(lhs * rhs), MUL(CONST(lhs), CONST(rhs)));
		assertEquals(CONST(lhs < rhs), LT(CONST(lhs), CONST(rhs)));
		assertEquals(CONST(lhs == rhs), EQ(CONST(lhs), CONST(rhs)));
	}
}
