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

import java.util.Collections;
import java.util.List;

import specexec.core.Term;

/**
 * A decision procedure over terms. Each verification unit opens its own
 * session, hence constraints of one unit can never leak into the queries of
 * another.
 *
 * @author David J. Pearce
 *
 */
public interface Solver {

	/**
	 * Open a new session with a given per-query timeout.
	 *
	 * @param timeout (in milli seconds)
	 * @return
	 */
	public Session open(int timeout);

	public interface Session extends AutoCloseable {
		/**
		 * Add a constraint which holds for all subsequent queries of this session.
		 *
		 * @param constraint
		 */
		public void assume(Term constraint);

		/**
		 * Check whether the assumptions made so far, together with some goals,
		 * are satisfiable. Goals are discarded after the query.
		 *
		 * @param goals   additional constraints for this query only
		 * @param observe terms whose values should be extracted from the model
		 * @return
		 */
		public Result check(List<Term> goals, List<Term> observe);

		/**
		 * Abort any query in progress. Subsequent queries answer
		 * {@link Status#UNKNOWN}. This may be called from any thread.
		 */
		public void cancel();

		@Override
		public void close();
	}

	public enum Status {
		SAT, UNSAT, UNKNOWN
	}

	public static class Result {
		private final Status status;
		private final List<Object> values;
		private final String reason;

		public Result(Status status, List<Object> values, String reason) {
			this.status = status;
			this.values = values == null ? Collections.emptyList() : values;
			this.reason = reason;
		}

		public Status getStatus() {
			return status;
		}

		/**
		 * Get the value of each observed term in the model, in order. Integers
		 * are given as <code>BigInteger</code>, booleans as <code>Boolean</code>
		 * and anything else as a string. Empty unless satisfiable.
		 *
		 * @return
		 */
		public List<Object> getValues() {
			return values;
		}

		/**
		 * Get the reason an unknown result was returned.
		 *
		 * @return
		 */
		public String getReason() {
			return reason;
		}
	}
}
