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

import static specexec.core.Term.*;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The outcome of symbolically executing a single verification unit. This
 * records, in execution order, the assumptions made along the way and the
 * checks to be discharged against them, together with the calls made and the
 * values observed so that a counterexample can be reported.
 *
 * Every assumption and check is made relative to the current <i>path
 * guard</i>, which is the conjunction of the conditions of all enclosing
 * conditional statements and hooks.
 *
 * @author David J. Pearce
 *
 */
public class VerificationCondition {
	private final ArrayList<Assumption> assumptions = new ArrayList<>();
	private final ArrayList<Check> checks = new ArrayList<>();
	private final ArrayList<Call> calls = new ArrayList<>();
	private final ArrayList<Observation> observations = new ArrayList<>();
	private final ArrayDeque<Term> guards = new ArrayDeque<>();
	private final ArrayDeque<List<Term>> captures = new ArrayDeque<>();

	public Term getGuard() {
		return guards.isEmpty() ? TRUE : guards.peek();
	}

	/**
	 * Enter a region of execution which only happens when a given condition
	 * holds.
	 *
	 * @param condition
	 */
	public void pushGuard(Term condition) {
		guards.push(AND(getGuard(), condition));
	}

	public void popGuard() {
		guards.pop();
	}

	/**
	 * Assume a condition holds on the current path.
	 *
	 * @param condition
	 * @param source    describes where the assumption came from
	 */
	public void assume(Term condition, String source) {
		if (condition.isTrue()) {
			return;
		} else if (!captures.isEmpty()) {
			captures.peek().add(IMPLIES(getGuard(), condition));
		} else {
			assumptions.add(new Assumption(IMPLIES(getGuard(), condition), source, false));
		}
	}

	/**
	 * Record a fact which holds regardless of the path taken, such as the range
	 * of a value read from storage.
	 *
	 * @param condition
	 */
	public void constrain(Term condition) {
		if (condition.isTrue()) {
			return;
		} else if (!captures.isEmpty()) {
			captures.peek().add(condition);
		} else {
			assumptions.add(new Assumption(condition, "domain", true));
		}
	}

	// =========================================================================
	// Capturing
	// =========================================================================

	/**
	 * Begin collecting the facts established whilst evaluating the body of a
	 * quantifier. These may mention its bound variables, hence cannot be assumed
	 * outright. Instead, they become part of the quantified formula itself.
	 */
	public void beginCapture() {
		captures.push(new ArrayList<>());
	}

	/**
	 * Stop collecting facts for the innermost quantifier, returning those
	 * collected.
	 *
	 * @return
	 */
	public List<Term> endCapture() {
		return captures.pop();
	}

	/**
	 * Get the facts collected so far for all enclosing quantifiers.
	 *
	 * @return
	 */
	public List<Term> getCaptured() {
		ArrayList<Term> facts = new ArrayList<>();
		for (List<Term> c : captures) {
			facts.addAll(c);
		}
		return facts;
	}

	public void assertThat(Term condition, String description) {
		checks.add(new Check(Check.Kind.ASSERT, IMPLIES(getGuard(), condition), description, assumptions.size()));
	}

	public void satisfy(Term condition, String description) {
		checks.add(new Check(Check.Kind.SATISFY, AND(getGuard(), condition), description, assumptions.size()));
	}

	/**
	 * Record the obligation that a bounded cast does not overflow.
	 *
	 * @param condition
	 * @param description
	 */
	public void obligate(Term condition, String description) {
		checks.add(new Check(Check.Kind.CAST, IMPLIES(getGuard(), condition), description, assumptions.size()));
	}

	public void recordCall(MethodDescriptor method, Environment environment, List<Term> arguments, Term reverted) {
		// Calls under a quantifier have no single instance to report
		if (captures.isEmpty()) {
			calls.add(new Call(method, environment, arguments, reverted));
		}
	}

	public void observe(Location location, Term value) {
		observations.add(new Observation(location, value));
	}

	public List<Assumption> getAssumptions() {
		return Collections.unmodifiableList(assumptions);
	}

	public List<Check> getChecks() {
		return Collections.unmodifiableList(checks);
	}

	public List<Call> getCalls() {
		return Collections.unmodifiableList(calls);
	}

	public List<Observation> getObservations() {
		return Collections.unmodifiableList(observations);
	}

	public static class Assumption {
		private final Term condition;
		private final String source;
		private final boolean domain;

		public Assumption(Term condition, String source, boolean domain) {
			this.condition = condition;
			this.source = source;
			this.domain = domain;
		}

		public Term getCondition() {
			return condition;
		}

		public String getSource() {
			return source;
		}

		/**
		 * Check whether this assumption merely restricts a value to its type.
		 * Such assumptions are never the cause of vacuity on their own.
		 *
		 * @return
		 */
		public boolean isDomain() {
			return domain;
		}
	}

	public static class Check {
		public enum Kind {
			ASSERT, SATISFY, CAST
		}

		private final Kind kind;
		private final Term condition;
		private final String description;
		private final int prefix;

		public Check(Kind kind, Term condition, String description, int prefix) {
			this.kind = kind;
			this.condition = condition;
			this.description = description;
			this.prefix = prefix;
		}

		public Kind getKind() {
			return kind;
		}

		public Term getCondition() {
			return condition;
		}

		public String getDescription() {
			return description;
		}

		/**
		 * Get the number of assumptions made before this check, all of which
		 * apply to it.
		 *
		 * @return
		 */
		public int getPrefix() {
			return prefix;
		}
	}

	public static class Call {
		private final MethodDescriptor method;
		private final Environment environment;
		private final List<Term> arguments;
		private final Term reverted;

		public Call(MethodDescriptor method, Environment environment, List<Term> arguments, Term reverted) {
			this.method = method;
			this.environment = environment;
			this.arguments = arguments;
			this.reverted = reverted;
		}

		public MethodDescriptor getMethod() {
			return method;
		}

		public Environment getEnvironment() {
			return environment;
		}

		public List<Term> getArguments() {
			return arguments;
		}

		public Term getReverted() {
			return reverted;
		}
	}

	/**
	 * A value read during execution. Storage locations are identified by their
	 * location, ghosts by a location rooted at the ghost's name and locals by a
	 * location without accessors.
	 */
	public static class Observation {
		private final Location location;
		private final Term value;

		public Observation(Location location, Term value) {
			this.location = location;
			this.value = value;
		}

		public Location getLocation() {
			return location;
		}

		public Term getValue() {
			return value;
		}
	}
}
