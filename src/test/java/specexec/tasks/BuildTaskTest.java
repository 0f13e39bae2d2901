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

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.Test;

import specexec.core.Environment;
import specexec.core.LoadException;
import specexec.core.SpecFile;
import specexec.core.SpecFile.Decl;
import specexec.core.SpecFile.Expr;
import specexec.core.SpecFile.Pattern;
import specexec.core.SpecFile.Type;
import specexec.core.Verdict;
import specexec.testing.TokenSystem;

/**
 * Tests for running whole batches of verification units.
 *
 * @author David J. Pearce
 *
 */
public class BuildTaskTest {
	private static final Expr SENDER = FIELD_ACCESS(VAR("e"), Environment.MSG_SENDER);

	private static SpecFile ghosts() {
		return new SpecFile(
				new Decl.Ghost("sumBalances", Collections.<Type>emptyList(), Type.MathInt,
						Collections.<Expr>emptyList(), Arrays.<Expr>asList(EQ(GHOST_READ("sumBalances"), CONST(0))),
						false),
				SSTORE(PATTERN("balances", new Pattern.Key(PARAM("a", Type.Address))), PARAM("v", Type.Uint256),
						PARAM("old", Type.Uint256),
						GHOST_ASSIGN("sumBalances", ADD(GHOST_READ("sumBalances"), SUB(VAR("v"), VAR("old"))))));
	}

	private static SpecFile rules() {
		return new SpecFile(INVARIANT("totalIsSum", PARAMS(), EQ(STORAGE("totalSupply"), GHOST_READ("sumBalances"))),
				RULE("noDecrease", PARAMS(PARAM("e", Type.Env), PARAM("f", Type.Method), PARAM("args", Type.CallData)),
						DECLARE("before", Type.MathInt, STORAGE("balances", KEY(SENDER))),
						CALL_CALLDATA("f", VAR("e"), "args", false),
						ASSERT(GTEQ(STORAGE("balances", KEY(SENDER)), VAR("before")))));
	}

	private static List<String> summarise(List<Verdict> verdicts) {
		ArrayList<String> rs = new ArrayList<>();
		for (Verdict v : verdicts) {
			rs.add(v.getName() + ":" + v.getStatus());
		}
		return rs;
	}

	@Test
	public void threadsDoNotAffectVerdicts() {
		List<Verdict> sequential = new BuildTask(new TokenSystem(true)).setThreads(1).addSource(ghosts())
				.addSource(rules()).run();
		List<Verdict> concurrent = new BuildTask(new TokenSystem(true)).setThreads(4)
				.addSources(Arrays.asList(ghosts(), rules())).run();
		// Rules first, then the invariant
		assertEquals(17, sequential.size());
		assertEquals("noDecrease[totalSupply()]", sequential.get(0).getName());
		assertEquals("totalIsSum[base]", sequential.get(8).getName());
		assertEquals(summarise(sequential), summarise(concurrent));
	}

	@Test
	public void verboseReportsFailures() {
		ByteArrayOutputStream buf = new ByteArrayOutputStream();
		PrintStream out = new PrintStream(buf, true);
		List<Verdict> verdicts = new BuildTask(new TokenSystem(true)).setThreads(2).setVerbose(true).setOutput(out)
				.addSource(ghosts()).addSource(rules()).run();
		String report = new String(buf.toByteArray(), StandardCharsets.UTF_8);
		assertTrue(report.contains("REFUTED: totalIsSum[deposit()]"));
		assertTrue(report.contains("REFUTED: noDecrease[withdraw(uint256)]"));
		assertFalse(report.contains("totalIsSum[base]"));
		for (Verdict v : verdicts) {
			assertNotEquals(Verdict.Status.ERROR, v.getStatus());
		}
	}

	@Test(expected = LoadException.class)
	public void invalidSpecificationRunsNothing() {
		new BuildTask(new TokenSystem()).addSource(rules()).run();
	}

	@Test(expected = IllegalArgumentException.class)
	public void invalidThreads() {
		new BuildTask(new TokenSystem()).setThreads(0);
	}
}
