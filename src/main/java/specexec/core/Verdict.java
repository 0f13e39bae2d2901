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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The outcome of checking one verification unit.
 *
 * @author David J. Pearce
 *
 */
public class Verdict {
	public enum Status {
		/**
		 * Every assertion holds in every execution, and at least one execution
		 * exists.
		 */
		PROVED,
		/**
		 * Some assertion fails (or some <code>satisfy</code> has no witness).
		 */
		REFUTED,
		/**
		 * No execution satisfies the accumulated assumptions, hence nothing was
		 * actually checked.
		 */
		VACUOUS,
		/**
		 * The solver could not decide (e.g. it timed out, or was cancelled).
		 */
		UNKNOWN,
		/**
		 * The target system behaved inconsistently with its declaration.
		 */
		ERROR
	}

	private final String name;
	private final Status status;
	private final String reason;
	private final Counterexample counterexample;

	public Verdict(String name, Status status, String reason, Counterexample counterexample) {
		this.name = name;
		this.status = status;
		this.reason = reason;
		this.counterexample = counterexample;
	}

	public String getName() {
		return name;
	}

	public Status getStatus() {
		return status;
	}

	/**
	 * Get a human-readable explanation of this verdict (e.g. the failing
	 * assertion), or <code>null</code>.
	 *
	 * @return
	 */
	public String getReason() {
		return reason;
	}

	/**
	 * Get the counterexample (or, for <code>satisfy</code>, the witness)
	 * associated with this verdict, or <code>null</code>.
	 *
	 * @return
	 */
	public Counterexample getCounterexample() {
		return counterexample;
	}

	@Override
	public String toString() {
		String r = name + ": " + status;
		if (reason != null) {
			r += " (" + reason + ")";
		}
		return r;
	}

	/**
	 * A concrete model projected onto the calls made and the values observed
	 * during a check. This is sufficient to replay the violation.
	 */
	public static class Counterexample {
		private final List<Call> calls;
		private final LinkedHashMap<String, Object> values;

		public Counterexample(List<Call> calls, Map<String, Object> values) {
			this.calls = Collections.unmodifiableList(new ArrayList<>(calls));
			this.values = new LinkedHashMap<>(values);
		}

		public List<Call> getCalls() {
			return calls;
		}

		/**
		 * Get the concrete values of observed storage locations, ghosts and
		 * local variables, keyed by their (concrete) description.
		 *
		 * @return
		 */
		public Map<String, Object> getValues() {
			return Collections.unmodifiableMap(values);
		}

		public Object get(String name) {
			return values.get(name);
		}

		@Override
		public String toString() {
			StringBuilder sb = new StringBuilder();
			for (Call c : calls) {
				sb.append(c).append("\n");
			}
			for (Map.Entry<String, Object> e : values.entrySet()) {
				sb.append(e.getKey()).append(" = ").append(e.getValue()).append("\n");
			}
			return sb.toString();
		}
	}

	public static class Call {
		private final String method;
		private final Map<String, Object> environment;
		private final List<Object> arguments;
		private final Object reverted;

		public Call(String method, Map<String, Object> environment, List<Object> arguments, Object reverted) {
			this.method = method;
			this.environment = Collections.unmodifiableMap(new LinkedHashMap<>(environment));
			this.arguments = Collections.unmodifiableList(new ArrayList<>(arguments));
			this.reverted = reverted;
		}

		public String getMethod() {
			return method;
		}

		public Map<String, Object> getEnvironment() {
			return environment;
		}

		public List<Object> getArguments() {
			return arguments;
		}

		public Object getReverted() {
			return reverted;
		}

		@Override
		public String toString() {
			return method + " " + environment + " " + arguments + (Boolean.TRUE.equals(reverted) ? " [reverted]" : "");
		}
	}
}
