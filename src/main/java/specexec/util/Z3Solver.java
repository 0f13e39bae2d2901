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

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.microsoft.z3.ArithExpr;
import com.microsoft.z3.ArrayExpr;
import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import com.microsoft.z3.Expr;
import com.microsoft.z3.FuncDecl;
import com.microsoft.z3.IntNum;
import com.microsoft.z3.IntSort;
import com.microsoft.z3.Model;
import com.microsoft.z3.Params;
import com.microsoft.z3.Z3Exception;

import specexec.core.Term;

/**
 * A wrapper for the Z3 theorem prover. Every session owns a separate Z3
 * context, hence sessions may be used concurrently from different threads.
 *
 * @author David J. Pearce
 */
public class Z3Solver implements Solver {
	private static final Logger logger = LoggerFactory.getLogger(Z3Solver.class);

	private static final Pattern INTEGER = Pattern.compile("-?[0-9]+");

	/**
	 * Record solver options, which are passed through as Z3 parameters.
	 */
	private final Map<String, String> options;

	private boolean debug;

	public Z3Solver() {
		this.options = new LinkedHashMap<>();
	}

	/**
	 * Set a Z3 solver parameter, such as <code>smt.random_seed</code>.
	 *
	 * @param key
	 * @param value
	 * @return
	 */
	public Z3Solver setOption(String key, String value) {
		options.put(key, value);
		return this;
	}

	/**
	 * Control logging of every query sent to Z3.
	 *
	 * @param flag
	 * @return
	 */
	public Z3Solver setDebug(boolean flag) {
		this.debug = flag;
		return this;
	}

	@Override
	public Session open(int timeout) {
		return new Z3Session(timeout);
	}

	private class Z3Session implements Session {
		private final Context context;
		private final com.microsoft.z3.Solver solver;
		private final HashMap<Term, Expr<?>> cache;
		private final HashMap<String, FuncDecl<?>> functions;
		private volatile boolean cancelled;

		public Z3Session(int timeout) {
			this.context = new Context();
			this.solver = context.mkSolver();
			this.cache = new HashMap<>();
			this.functions = new HashMap<>();
			Params params = context.mkParams();
			if (timeout > 0) {
				params.add("timeout", timeout);
			}
			for (Map.Entry<String, String> e : options.entrySet()) {
				String val = e.getValue();
				if (val.equals("true") || val.equals("false")) {
					params.add(e.getKey(), Boolean.parseBoolean(val));
				} else if (INTEGER.matcher(val).matches()) {
					params.add(e.getKey(), Integer.parseInt(val));
				} else {
					params.add(e.getKey(), val);
				}
			}
			solver.setParameters(params);
		}

		@Override
		public void assume(Term constraint) {
			solver.add(toBoolean(constraint));
		}

		@Override
		public Result check(List<Term> goals, List<Term> observe) {
			if (cancelled) {
				return new Result(Solver.Status.UNKNOWN, null, "cancelled");
			}
			solver.push();
			try {
				for (Term g : goals) {
					solver.add(toBoolean(g));
				}
				if (debug) {
					logger.debug("query:\n{}", solver);
				}
				com.microsoft.z3.Status status = solver.check();
				switch (status) {
				case SATISFIABLE:
					return new Result(Solver.Status.SAT, extract(solver.getModel(), observe), null);
				case UNSATISFIABLE:
					return new Result(Solver.Status.UNSAT, null, null);
				default:
					return new Result(Solver.Status.UNKNOWN, null, cancelled ? "cancelled" : solver.getReasonUnknown());
				}
			} catch (Z3Exception e) {
				logger.debug("query failed", e);
				return new Result(Solver.Status.UNKNOWN, null, cancelled ? "cancelled" : e.getMessage());
			} finally {
				if (!cancelled) {
					solver.pop();
				}
			}
		}

		@Override
		public void cancel() {
			cancelled = true;
			context.interrupt();
		}

		@Override
		public void close() {
			context.close();
		}

		private List<Object> extract(Model model, List<Term> observe) {
			ArrayList<Object> values = new ArrayList<>();
			for (Term t : observe) {
				Expr<?> v = model.eval(translate(t), true);
				if (v instanceof IntNum) {
					values.add(((IntNum) v).getBigInteger());
				} else if (v.isTrue()) {
					values.add(Boolean.TRUE);
				} else if (v.isFalse()) {
					values.add(Boolean.FALSE);
				} else {
					values.add(v.toString());
				}
			}
			return values;
		}

		private BoolExpr toBoolean(Term t) {
			return (BoolExpr) translate(t);
		}

		private BoolExpr[] toBooleans(Term[] ts) {
			BoolExpr[] rs = new BoolExpr[ts.length];
			for (int i = 0; i != ts.length; ++i) {
				rs[i] = toBoolean(ts[i]);
			}
			return rs;
		}

		private Expr<?> translate(Term t) {
			Expr<?> e = cache.get(t);
			if (e == null) {
				e = construct(t);
				cache.put(t, e);
			}
			return e;
		}

		/**
		 * Construct the Z3 expression for a term. Terms are well sorted, hence the
		 * casts to particular sorts are safe.
		 *
		 * @param t
		 * @return
		 */
		@SuppressWarnings("unchecked")
		private Expr<?> construct(Term t) {
			if (t instanceof Term.Constant) {
				return context.mkInt(((Term.Constant) t).getValue().toString());
			} else if (t instanceof Term.Bool) {
				return context.mkBool(((Term.Bool) t).getValue());
			} else if (t instanceof Term.Variable) {
				return context.mkConst(((Term.Variable) t).getName(), toSort(t.getSort()));
			} else if (t instanceof Term.Quantifier) {
				Term.Quantifier q = (Term.Quantifier) t;
				Expr<?>[] bound = new Expr<?>[q.getVariables().length];
				for (int i = 0; i != bound.length; ++i) {
					bound[i] = translate(q.getVariables()[i]);
				}
				BoolExpr body = toBoolean(q.getBody());
				if (q.isUniversal()) {
					return context.mkForall(bound, body, 1, null, null, null, null);
				} else {
					return context.mkExists(bound, body, 1, null, null, null, null);
				}
			}
			Term.Operator op = (Term.Operator) t;
			if (op instanceof Term.And) {
				return context.mkAnd(toBooleans(op.getAll()));
			} else if (op instanceof Term.Or) {
				return context.mkOr(toBooleans(op.getAll()));
			} else if (op instanceof Term.Apply) {
				return constructApply((Term.Apply) op);
			} else if (op instanceof Term.ConstArray) {
				Term.Sort.Array sort = (Term.Sort.Array) op.getSort();
				return context.mkConstArray(toSort(sort.getDomain()), translate(op.get(0)));
			}
			Expr<?> lhs = translate(op.get(0));
			if (op instanceof Term.Negate) {
				return context.mkUnaryMinus((ArithExpr<IntSort>) lhs);
			} else if (op instanceof Term.Not) {
				return context.mkNot((BoolExpr) lhs);
			}
			Expr<?> rhs = translate(op.get(1));
			if (op instanceof Term.Add) {
				return context.mkAdd((ArithExpr<IntSort>) lhs, (ArithExpr<IntSort>) rhs);
			} else if (op instanceof Term.Sub) {
				return context.mkSub((ArithExpr<IntSort>) lhs, (ArithExpr<IntSort>) rhs);
			} else if (op instanceof Term.Mul) {
				return context.mkMul((ArithExpr<IntSort>) lhs, (ArithExpr<IntSort>) rhs);
			} else if (op instanceof Term.Div) {
				return context.mkDiv((ArithExpr<IntSort>) lhs, (ArithExpr<IntSort>) rhs);
			} else if (op instanceof Term.Mod) {
				return context.mkMod((ArithExpr<IntSort>) lhs, (ArithExpr<IntSort>) rhs);
			} else if (op instanceof Term.Equal) {
				return context.mkEq((Expr<com.microsoft.z3.Sort>) lhs, (Expr<com.microsoft.z3.Sort>) rhs);
			} else if (op instanceof Term.LessThan) {
				return context.mkLt((ArithExpr<IntSort>) lhs, (ArithExpr<IntSort>) rhs);
			} else if (op instanceof Term.LessThanOrEqual) {
				return context.mkLe((ArithExpr<IntSort>) lhs, (ArithExpr<IntSort>) rhs);
			} else if (op instanceof Term.Implies) {
				return context.mkImplies((BoolExpr) lhs, (BoolExpr) rhs);
			} else if (op instanceof Term.Iff) {
				return context.mkIff((BoolExpr) lhs, (BoolExpr) rhs);
			} else if (op instanceof Term.Select) {
				return context.mkSelect((ArrayExpr<com.microsoft.z3.Sort, com.microsoft.z3.Sort>) lhs,
						(Expr<com.microsoft.z3.Sort>) rhs);
			} else if (op instanceof Term.IfThenElse) {
				return context.mkITE((BoolExpr) lhs, (Expr<com.microsoft.z3.Sort>) rhs,
						(Expr<com.microsoft.z3.Sort>) translate(op.get(2)));
			} else if (op instanceof Term.Store) {
				return context.mkStore((ArrayExpr<com.microsoft.z3.Sort, com.microsoft.z3.Sort>) lhs,
						(Expr<com.microsoft.z3.Sort>) rhs, (Expr<com.microsoft.z3.Sort>) translate(op.get(2)));
			} else {
				throw new IllegalArgumentException("unknown term encountered (" + t.getClass().getName() + ")");
			}
		}

		private Expr<?> constructApply(Term.Apply t) {
			String key = t.getName() + "/" + t.size();
			FuncDecl<?> fn = functions.get(key);
			Expr<?>[] args = new Expr<?>[t.size()];
			for (int i = 0; i != args.length; ++i) {
				args[i] = translate(t.get(i));
			}
			if (fn == null) {
				com.microsoft.z3.Sort[] domain = new com.microsoft.z3.Sort[args.length];
				for (int i = 0; i != args.length; ++i) {
					domain[i] = toSort(t.get(i).getSort());
				}
				fn = context.mkFuncDecl(t.getName(), domain, toSort(t.getSort()));
				functions.put(key, fn);
			}
			return context.mkApp(fn, args);
		}

		private com.microsoft.z3.Sort toSort(Term.Sort sort) {
			if (sort == Term.Sort.INT) {
				return context.mkIntSort();
			} else if (sort == Term.Sort.BOOL) {
				return context.mkBoolSort();
			} else if (sort instanceof Term.Sort.Uninterpreted) {
				return context.mkUninterpretedSort(((Term.Sort.Uninterpreted) sort).getName());
			} else {
				Term.Sort.Array a = (Term.Sort.Array) sort;
				return context.mkArraySort(toSort(a.getDomain()), toSort(a.getRange()));
			}
		}
	}
}
