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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.junit.Test;

import specexec.core.SpecFile;
import specexec.core.SpecFile.Decl;
import specexec.core.SpecFile.Pattern;
import specexec.core.SpecFile.Type;
import specexec.testing.TokenSystem;

/**
 * Tests for loading well-formed specifications, and for their instantiation
 * into verification units.
 *
 * @author David J. Pearce
 *
 */
public class SpecLoaderTest {
	private static final List<Decl.Parameter> ENV = PARAMS(PARAM("e", Type.Env));

	private static List<String> names(List<SpecItem> items) {
		ArrayList<String> rs = new ArrayList<>();
		for (SpecItem i : items) {
			rs.add(i.getName());
		}
		return rs;
	}

	private static Specification load(Decl... decls) {
		return new SpecLoader(new TokenSystem()).load(new SpecFile(decls));
	}

	@Test
	public void emptySpecification() {
		Specification spec = load();
		assertTrue(spec.getRules().isEmpty());
		assertTrue(SpecLoader.instantiate(spec).isEmpty());
	}

	@Test
	public void wellFormed() {
		Specification spec = load(METHOD("balanceOf(address)", true), METHOD("totalSupply", true),
				GHOST("sum", Type.MathInt),
				SSTORE(PATTERN("balances", new Pattern.Key(PARAM("a", Type.Address))), PARAM("v", Type.Uint256),
						PARAM("old", Type.Uint256),
						GHOST_ASSIGN("sum", ADD(GHOST_READ("sum"), SUB(VAR("v"), VAR("old"))))),
				DEFINITION("positive", PARAMS(PARAM("x", Type.MathInt)), Type.Bool, GT(VAR("x"), CONST(0))),
				INVARIANT("solvent", PARAMS(), GTEQ(STORAGE("totalSupply"), CONST(0))),
				RULE("r", ENV, REQUIRE_INVARIANT("solvent"),
						ASSERT(INVOKE("positive", ADD(INVOKE_METHOD("balanceOf", null, CONST(1)), CONST(1))))));
		assertEquals(1, spec.getGhosts().size());
		assertEquals(1, spec.getHooks().size());
		assertEquals(1, spec.getRules().size());
		assertNotNull(spec.getInvariant("solvent"));
		assertNotNull(spec.getDefinitions().get("positive"));
		assertTrue(spec.isEnvfree(TokenSystem.BALANCE_OF));
		assertTrue(spec.isEnvfree(TokenSystem.TOTAL_SUPPLY));
		assertFalse(spec.isEnvfree(TokenSystem.TRANSFER));
	}

	@Test
	public void instantiationOrder() {
		Decl.Rule plain = RULE("plain", ENV, ASSERT(CONST(true)));
		Decl.Rule pair = RULE("pair", PARAMS(PARAM("e", Type.Env), PARAM("f", Type.Method), PARAM("g", Type.Method)),
				Arrays.asList(FILTER("f", "m", FIELD_ACCESS(VAR("m"), "isPayable")),
						FILTER("g", "m", FIELD_ACCESS(VAR("m"), "isView"))),
				ASSERT(CONST(true)));
		Decl.Invariant inv = new Decl.Invariant("inv", PARAMS(), CONST(true),
				FILTER("f", "f", GT(FIELD_ACCESS(VAR("f"), "numberOfArguments"), CONST(1))),
				new ArrayList<Decl.Preserved>());
		Specification spec = load(inv, plain, pair);
		List<SpecItem> items = SpecLoader.instantiate(spec);
		assertEquals(Arrays.asList("plain", "pair[deposit(),totalSupply()]", "pair[deposit(),balanceOf(address)]",
				"inv[base]", "inv[transfer(address,uint256)]", "inv[approve(address,uint256)]",
				"inv[transferFrom(address,address,uint256)]", "inv[mint(address,uint256)]"), names(items));
		assertEquals(SpecItem.Kind.INVARIANT_BASE, items.get(3).getKind());
		assertEquals(SpecItem.Kind.INVARIANT_STEP, items.get(4).getKind());
		assertSame(TokenSystem.TRANSFER, items.get(4).getMethod(null));
		assertSame(TokenSystem.DEPOSIT, items.get(1).getMethod("f"));
		assertSame(TokenSystem.BALANCE_OF, items.get(2).getMethod("g"));
		for (SpecItem i : items) {
			assertNull(i.getVacuity());
		}
	}

	@Test
	public void unfilteredRuleCoversEveryMethod() {
		Specification spec = load(RULE("any", PARAMS(PARAM("e", Type.Env), PARAM("f", Type.Method)),
				CALL_CALLDATA("f", VAR("e"), "args", false)));
		List<SpecItem> items = SpecLoader.instantiate(spec);
		assertEquals(new TokenSystem().getMethods().size(), items.size());
		assertEquals("any[totalSupply()]", items.get(0).getName());
	}

	@Test
	public void emptyFilterIsVacuous() {
		Specification spec = load(RULE("none", PARAMS(PARAM("e", Type.Env), PARAM("f", Type.Method)),
				Arrays.asList(FILTER("f", "f", CONST(false))), ASSERT(CONST(false))));
		List<SpecItem> items = SpecLoader.instantiate(spec);
		assertEquals(1, items.size());
		assertEquals("none", items.get(0).getName());
		assertEquals("no method satisfies the filter on f", items.get(0).getVacuity());
	}

	@Test
	public void emptyInvariantFilterGivesBaseOnly() {
		Specification spec = load(new Decl.Invariant("inv", PARAMS(), CONST(true),
				FILTER("f", "f", CONST(false)), new ArrayList<Decl.Preserved>()));
		assertEquals(Arrays.asList("inv[base]"), names(SpecLoader.instantiate(spec)));
	}
}
