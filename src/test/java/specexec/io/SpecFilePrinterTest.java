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
package specexec.io;

import static org.junit.Assert.*;
import static specexec.core.SpecFile.*;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

import org.junit.Test;

import specexec.core.SpecFile;
import specexec.core.SpecFile.Pattern;
import specexec.core.SpecFile.Type;
import specexec.core.Term;

/**
 * Tests for pretty printing specifications and terms.
 *
 * @author David J. Pearce
 *
 */
public class SpecFilePrinterTest {

	private static String print(SpecFile file) {
		ByteArrayOutputStream buf = new ByteArrayOutputStream();
		new SpecFilePrinter(buf).write(file);
		return new String(buf.toByteArray(), StandardCharsets.UTF_8);
	}

	@Test
	public void expressions() {
		assertEquals("assert_uint256(5)", SpecFilePrinter.toString(ASSERT_CAST(Type.Uint256, CONST(5))));
		assertEquals("balances[a]", SpecFilePrinter.toString(STORAGE("balances", KEY(VAR("a")))));
		assertEquals("allowances[a][e.msg.sender]", SpecFilePrinter.toString(
				STORAGE("allowances", KEY(VAR("a")), KEY(FIELD_ACCESS(VAR("e"), "msg.sender")))));
		assertEquals("(x + 1) * 2", SpecFilePrinter.toString(MUL(ADD(VAR("x"), CONST(1)), CONST(2))));
		assertEquals("(x > 0) && lastReverted", SpecFilePrinter.toString(AND(GT(VAR("x"), CONST(0)), LAST_REVERTED())));
		assertEquals("f.selector == sig:withdraw(uint256).selector",
				SpecFilePrinter.toString(EQ(FIELD_ACCESS(VAR("f"), "selector"), SELECTOR("withdraw(uint256)"))));
		assertEquals("forall address a. balances[a] >= 0", SpecFilePrinter.toString(
				FORALL("a", Type.Address, GTEQ(STORAGE("balances", KEY(VAR("a"))), CONST(0)))));
		assertEquals("totalSupply at init", SpecFilePrinter.toString(AT(STORAGE("totalSupply"), "init")));
		assertEquals("balanceOf(e, a)", SpecFilePrinter.toString(INVOKE_METHOD("balanceOf", VAR("e"), VAR("a"))));
	}

	@Test
	public void declarations() {
		SpecFile file = new SpecFile(METHOD("balanceOf(address)", true),
				GHOST("sum", Type.MathInt, GTEQ(GHOST_READ("sum"), CONST(0))),
				SSTORE(PATTERN("balances", new Pattern.Key(PARAM("a", Type.Address))), PARAM("v", Type.Uint256),
						PARAM("old", Type.Uint256), GHOST_ASSIGN("sum", ADD(GHOST_READ("sum"), SUB(VAR("v"), VAR("old"))))),
				RULE("r", PARAMS(PARAM("e", Type.Env), PARAM("f", Type.Method)),
						Arrays.asList(FILTER("f", "f", NOT(FIELD_ACCESS(VAR("f"), "isView")))),
						SNAPSHOT("init"), CALL_CALLDATA("f", VAR("e"), "args", true),
						ASSERT(IMPLIES(LAST_REVERTED(), STORAGE_EQ("lastStorage", "init")), "rolled back")));
		String expected = "function balanceOf(address) envfree;\n"
				+ "ghost mathint sum {\n"
				+ "    axiom sum >= 0;\n"
				+ "}\n"
				+ "hook Sstore balances[KEY address a] uint256 v (uint256 old) {\n"
				+ "    sum = sum + (v - old);\n"
				+ "}\n"
				+ "rule r(env e, method f) filtered { f -> !f.isView } {\n"
				+ "    storage init = lastStorage;\n"
				+ "    f@withrevert(e, args);\n"
				+ "    assert lastReverted => lastStorage == init, \"rolled back\";\n"
				+ "}\n";
		assertEquals(expected, print(file).replace("\r\n", "\n"));
	}

	@Test
	public void terms() {
		Term x = Term.VAR("x", Term.Sort.INT);
		assertEquals("(x + 1)", SpecFilePrinter.toString(Term.ADD(x, Term.ONE)));
		assertEquals("(if (x < 0) then 0 else x)",
				SpecFilePrinter.toString(Term.ITE(Term.LT(x, Term.ZERO), Term.ZERO, x)));
	}
}
