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

import static specexec.core.Term.NOT;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import specexec.core.Environment;
import specexec.core.Location;
import specexec.core.ModelingException;
import specexec.core.Term;
import specexec.core.Verdict;
import specexec.core.VerificationCondition;
import specexec.util.Solver;

/**
 * Verifies a single unit by executing it symbolically and then discharging the
 * resulting verification condition. Checks are discharged in the order they
 * were recorded, each against only those assumptions made before it. The
 * outcome is:
 *
 * <ul>
 * <li><b>Refuted</b> if some assertion (or asserting cast) can fail, or some
 * <code>satisfy</code> has no witness.</li>
 * <li><b>Vacuous</b> if the assumptions are unsatisfiable, in which case
 * nothing was actually checked.</li>
 * <li><b>Unknown</b> if the solver could not decide some query.</li>
 * <li><b>Proved</b> otherwise.</li>
 * </ul>
 *
 * @author David J. Pearce
 *
 */
public class VerifyTask implements Callable<Verdict> {
	private static final Logger logger = LoggerFactory.getLogger(VerifyTask.class);

	private final Specification spec;
	private final SpecItem item;
	private final Solver solver;
	/**
	 * Timeout for each solver query (in milli seconds).
	 */
	private int timeout = 10_000;
	private volatile boolean cancelled;
	private volatile Solver.Session session;

	public VerifyTask(Specification spec, SpecItem item, Solver solver) {
		this.spec = spec;
		this.item = item;
		this.solver = solver;
	}

	public SpecItem getItem() {
		return item;
	}

	public VerifyTask setTimeout(int millis) {
		this.timeout = millis;
		return this;
	}

	/**
	 * Abandon this task. Any query in progress is interrupted, and the task
	 * completes with an unknown verdict.
	 */
	public void cancel() {
		cancelled = true;
		Solver.Session s = session;
		if (s != null) {
			s.cancel();
		}
	}

	@Override
	public Verdict call() {
		Verdict v = verify();
		logger.info("{}", v);
		return v;
	}

	private Verdict verify() {
		if (item.getVacuity() != null) {
			return verdict(Verdict.Status.VACUOUS, item.getVacuity(), null);
		} else if (cancelled) {
			return verdict(Verdict.Status.UNKNOWN, "cancelled", null);
		}
		RuleRunner runner = new RuleRunner(spec, item);
		VerificationCondition vc;
		try {
			vc = runner.run();
		} catch (ModelingException | IllegalArgumentException | IllegalStateException e) {
			logger.debug("{} failed to execute", item, e);
			return verdict(Verdict.Status.ERROR, e.getMessage(), null);
		}
		Verdict v;
		try (Solver.Session s = solver.open(timeout)) {
			session = s;
			if (cancelled) {
				s.cancel();
			}
			v = discharge(s, vc, runner.getLocals());
		} finally {
			session = null;
		}
		// Diagnosis needs a session of its own, so happens after the first is
		// released
		if (v.getStatus() == Verdict.Status.VACUOUS && v.getReason() == null) {
			v = verdict(Verdict.Status.VACUOUS, diagnose(vc), null);
		}
		return v;
	}

	private Verdict discharge(Solver.Session s, VerificationCondition vc, Map<String, Term> locals) {
		List<VerificationCondition.Assumption> assumptions = vc.getAssumptions();
		String unknown = null;
		int n = 0;
		for (VerificationCondition.Check c : vc.getChecks()) {
			while (n < c.getPrefix()) {
				s.assume(assumptions.get(n++).getCondition());
			}
			if (c.getKind() == VerificationCondition.Check.Kind.SATISFY) {
				Solver.Result r = query(s, c.getCondition(), Collections.emptyList());
				if (r.getStatus() == Solver.Status.UNSAT) {
					if (query(s, null, Collections.emptyList()).getStatus() == Solver.Status.UNSAT) {
						return verdict(Verdict.Status.VACUOUS, null, null);
					}
					return verdict(Verdict.Status.REFUTED, "no witness for " + c.getDescription(), null);
				} else if (r.getStatus() == Solver.Status.UNKNOWN && unknown == null) {
					unknown = r.getReason();
				}
			} else {
				Observer observer = new Observer(vc, locals);
				Solver.Result r = query(s, NOT(c.getCondition()), observer.getTerms());
				if (r.getStatus() == Solver.Status.SAT) {
					String reason = (c.getKind() == VerificationCondition.Check.Kind.CAST ? "overflow in " : "violated: ")
							+ c.getDescription();
					return verdict(Verdict.Status.REFUTED, reason, observer.project(r.getValues()));
				} else if (r.getStatus() == Solver.Status.UNKNOWN && unknown == null) {
					unknown = r.getReason();
				}
			}
		}
		while (n < assumptions.size()) {
			s.assume(assumptions.get(n++).getCondition());
		}
		Solver.Result r = query(s, null, Collections.emptyList());
		if (r.getStatus() == Solver.Status.UNSAT) {
			return verdict(Verdict.Status.VACUOUS, null, null);
		} else if (r.getStatus() == Solver.Status.UNKNOWN && unknown == null) {
			unknown = r.getReason();
		}
		if (unknown != null) {
			return verdict(Verdict.Status.UNKNOWN, unknown, null);
		}
		return verdict(Verdict.Status.PROVED, null, null);
	}

	private Solver.Result query(Solver.Session s, Term goal, List<Term> observe) {
		List<Term> goals = goal == null ? Collections.emptyList() : Collections.singletonList(goal);
		Solver.Result r = s.check(goals, observe);
		logger.debug("{}: {} => {}", item, goal, r.getStatus());
		return r;
	}

	/**
	 * Determine which assumption made the assumptions unsatisfiable. Domain
	 * constraints are added first, since they cannot be at fault on their own,
	 * and then the remaining assumptions one at a time until the first failure.
	 *
	 * @param vc
	 * @return
	 */
	private String diagnose(VerificationCondition vc) {
		try (Solver.Session s = solver.open(timeout)) {
			session = s;
			if (cancelled) {
				s.cancel();
			}
			for (VerificationCondition.Assumption a : vc.getAssumptions()) {
				if (a.isDomain()) {
					s.assume(a.getCondition());
				}
			}
			for (VerificationCondition.Assumption a : vc.getAssumptions()) {
				if (!a.isDomain()) {
					s.assume(a.getCondition());
					Solver.Status status = s.check(Collections.emptyList(), Collections.emptyList()).getStatus();
					if (status == Solver.Status.UNSAT) {
						return "unsatisfiable assumptions at " + a.getSource();
					} else if (status == Solver.Status.UNKNOWN) {
						break;
					}
				}
			}
			return "unsatisfiable assumptions";
		} finally {
			session = null;
		}
	}

	private Verdict verdict(Verdict.Status status, String reason, Verdict.Counterexample cex) {
		return new Verdict(item.getName(), status, reason, cex);
	}

	// =========================================================================
	// Counterexamples
	// =========================================================================

	/**
	 * Determines the terms whose values make up a counterexample, and projects a
	 * model back onto the calls, locations and variables they came from.
	 */
	private static class Observer {
		private final VerificationCondition vc;
		private final Map<String, Term> locals;
		private final ArrayList<Term> terms = new ArrayList<>();

		public Observer(VerificationCondition vc, Map<String, Term> locals) {
			this.vc = vc;
			this.locals = locals;
			for (VerificationCondition.Call c : vc.getCalls()) {
				Environment e = c.getEnvironment();
				for (String field : Environment.FIELDS) {
					terms.add(e.get(field));
				}
				terms.addAll(c.getArguments());
				terms.add(c.getReverted());
			}
			for (VerificationCondition.Observation o : vc.getObservations()) {
				terms.addAll(o.getLocation().getKeys());
				terms.add(o.getValue());
			}
			terms.addAll(locals.values());
		}

		public List<Term> getTerms() {
			return terms;
		}

		public Verdict.Counterexample project(List<Object> values) {
			int i = 0;
			ArrayList<Verdict.Call> calls = new ArrayList<>();
			for (VerificationCondition.Call c : vc.getCalls()) {
				LinkedHashMap<String, Object> env = new LinkedHashMap<>();
				for (String field : Environment.FIELDS) {
					env.put(field, values.get(i++));
				}
				ArrayList<Object> args = new ArrayList<>();
				for (int j = 0; j != c.getArguments().size(); ++j) {
					args.add(values.get(i++));
				}
				calls.add(new Verdict.Call(c.getMethod().getSignature(), env, args, values.get(i++)));
			}
			LinkedHashMap<String, Object> observed = new LinkedHashMap<>();
			for (VerificationCondition.Observation o : vc.getObservations()) {
				Location l = o.getLocation();
				StringBuilder label = new StringBuilder(l.getRoot());
				for (int j = 0; j != l.size(); ++j) {
					Location.Accessor a = l.get(j);
					if (a instanceof Location.Field) {
						label.append(".").append(((Location.Field) a).getName());
					} else if (a instanceof Location.Length) {
						label.append(".length");
					} else {
						label.append("[").append(values.get(i++)).append("]");
					}
				}
				put(observed, label.toString(), values.get(i++));
			}
			for (String name : locals.keySet()) {
				put(observed, name, values.get(i++));
			}
			return new Verdict.Counterexample(calls, observed);
		}

		private static void put(Map<String, Object> map, String label, Object value) {
			String key = label;
			for (int k = 2; map.containsKey(key); ++k) {
				if (Objects.equals(map.get(key), value)) {
					return;
				}
				key = label + "#" + k;
			}
			map.put(key, value);
		}
	}
}
