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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import specexec.core.MethodDescriptor;
import specexec.core.SpecFile.Decl;

/**
 * A single verification unit. A rule without method parameters gives exactly
 * one unit, whilst a parametric rule gives one unit per combination of the
 * methods admitted by its filters. An invariant gives a base unit, plus one
 * step unit per admitted method.
 *
 * @author David J. Pearce
 *
 */
public class SpecItem {
	public enum Kind {
		RULE, INVARIANT_BASE, INVARIANT_STEP
	}

	private final Kind kind;
	private final String name;
	private final Decl declaration;
	private final Map<String, MethodDescriptor> methods;
	private final String vacuity;

	private SpecItem(Kind kind, String name, Decl declaration, Map<String, MethodDescriptor> methods,
			String vacuity) {
		this.kind = kind;
		this.name = name;
		this.declaration = declaration;
		this.methods = Collections.unmodifiableMap(new LinkedHashMap<>(methods));
		this.vacuity = vacuity;
	}

	public static SpecItem rule(Decl.Rule rule, Map<String, MethodDescriptor> methods) {
		String name = rule.getName();
		if (!methods.isEmpty()) {
			StringBuilder sb = new StringBuilder(name).append("[");
			boolean first = true;
			for (MethodDescriptor m : methods.values()) {
				sb.append(first ? "" : ",").append(m.getSignature());
				first = false;
			}
			name = sb.append("]").toString();
		}
		return new SpecItem(Kind.RULE, name, rule, methods, null);
	}

	/**
	 * Construct a unit for a rule which cannot be instantiated, because a filter
	 * admits no methods at all.
	 *
	 * @param rule
	 * @param reason
	 * @return
	 */
	public static SpecItem vacuous(Decl.Rule rule, String reason) {
		return new SpecItem(Kind.RULE, rule.getName(), rule, Collections.emptyMap(), reason);
	}

	public static SpecItem base(Decl.Invariant invariant) {
		return new SpecItem(Kind.INVARIANT_BASE, invariant.getName() + "[base]", invariant, Collections.emptyMap(),
				null);
	}

	public static SpecItem step(Decl.Invariant invariant, MethodDescriptor method) {
		Map<String, MethodDescriptor> methods = Collections.singletonMap(null, method);
		return new SpecItem(Kind.INVARIANT_STEP, invariant.getName() + "[" + method.getSignature() + "]", invariant,
				methods, null);
	}

	public Kind getKind() {
		return kind;
	}

	public String getName() {
		return name;
	}

	public Decl getDeclaration() {
		return declaration;
	}

	/**
	 * Get the method bound to a given method parameter. For an invariant step
	 * the method under test is bound to <code>null</code>.
	 *
	 * @param parameter
	 * @return
	 */
	public MethodDescriptor getMethod(String parameter) {
		return methods.get(parameter);
	}

	public Map<String, MethodDescriptor> getMethods() {
		return methods;
	}

	/**
	 * Get the reason this unit is vacuous without needing to be executed, or
	 * <code>null</code>.
	 *
	 * @return
	 */
	public String getVacuity() {
		return vacuity;
	}

	@Override
	public String toString() {
		return name;
	}
}
