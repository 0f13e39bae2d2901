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

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import specexec.io.SpecFilePrinter;

/**
 * A symbolic value manipulated during execution of a specification. Terms form
 * a small first-order language over unbounded integers, booleans, uninterpreted
 * sorts and arrays which is handed directly to the solver. Terms are immutable
 * and compared structurally.
 *
 * @author David J. Pearce
 *
 */
public abstract class Term {
	private final Sort sort;

	protected Term(Sort sort) {
		this.sort = sort;
	}

	public Sort getSort() {
		return sort;
	}

	public boolean isFalse() {
		return (this instanceof Bool) && !((Bool) this).getValue();
	}

	public boolean isTrue() {
		return (this instanceof Bool) && ((Bool) this).getValue();
	}

	@Override
	public String toString() {
		return SpecFilePrinter.toString(this);
	}

	// =========================================================================
	// Sorts
	// =========================================================================

	public interface Sort {
		public static final Sort INT = new Int();
		public static final Sort BOOL = new Bool();

		public static class Int implements Sort {
			private Int() {
			}

			@Override
			public String toString() {
				return "Int";
			}
		}

		public static class Bool implements Sort {
			private Bool() {
			}

			@Override
			public String toString() {
				return "Bool";
			}
		}

		/**
		 * A sort declared by the specification without any interpretation, such
		 * as a sort of opaque identifiers.
		 */
		public static class Uninterpreted implements Sort {
			private final String name;

			public Uninterpreted(String name) {
				this.name = name;
			}

			public String getName() {
				return name;
			}

			@Override
			public boolean equals(Object o) {
				return o instanceof Uninterpreted && ((Uninterpreted) o).name.equals(name);
			}

			@Override
			public int hashCode() {
				return name.hashCode();
			}

			@Override
			public String toString() {
				return name;
			}
		}

		/**
		 * A total map from a domain sort to a range sort. Mappings with several
		 * keys are modelled as arrays of arrays.
		 */
		public static class Array implements Sort {
			private final Sort domain;
			private final Sort range;

			public Array(Sort domain, Sort range) {
				this.domain = domain;
				this.range = range;
			}

			public Sort getDomain() {
				return domain;
			}

			public Sort getRange() {
				return range;
			}

			@Override
			public boolean equals(Object o) {
				if (o instanceof Array) {
					Array a = (Array) o;
					return domain.equals(a.domain) && range.equals(a.range);
				}
				return false;
			}

			@Override
			public int hashCode() {
				return domain.hashCode() ^ (31 * range.hashCode());
			}

			@Override
			public String toString() {
				return "[" + domain + "]" + range;
			}
		}
	}

	// =========================================================================
	// Leaves
	// =========================================================================

	public static class Constant extends Term {
		private final BigInteger value;

		private Constant(BigInteger value) {
			super(Sort.INT);
			this.value = value;
		}

		public BigInteger getValue() {
			return value;
		}

		@Override
		public boolean equals(Object o) {
			return o instanceof Constant && ((Constant) o).value.equals(value);
		}

		@Override
		public int hashCode() {
			return value.hashCode();
		}
	}

	public static class Bool extends Term {
		private final boolean value;

		private Bool(boolean value) {
			super(Sort.BOOL);
			this.value = value;
		}

		public boolean getValue() {
			return value;
		}

		@Override
		public boolean equals(Object o) {
			return o instanceof Bool && ((Bool) o).value == value;
		}

		@Override
		public int hashCode() {
			return value ? 1 : 0;
		}
	}

	public static class Variable extends Term {
		private final String name;

		private Variable(String name, Sort sort) {
			super(sort);
			this.name = name;
		}

		public String getName() {
			return name;
		}

		@Override
		public boolean equals(Object o) {
			if (o instanceof Variable) {
				Variable v = (Variable) o;
				return v.name.equals(name) && v.getSort().equals(getSort());
			}
			return false;
		}

		@Override
		public int hashCode() {
			return name.hashCode();
		}
	}

	// =========================================================================
	// Operators
	// =========================================================================

	/**
	 * Base class for all terms which are made up from a fixed sequence of
	 * operands. Two such terms are equal when they are of the same kind and
	 * their operands are pairwise equal.
	 */
	public abstract static class Operator extends Term {
		private final Term[] operands;
		private int hash;

		protected Operator(Sort sort, Term... operands) {
			super(sort);
			this.operands = operands;
		}

		public int size() {
			return operands.length;
		}

		public Term get(int i) {
			return operands[i];
		}

		public Term[] getAll() {
			return operands;
		}

		@Override
		public boolean equals(Object o) {
			if (o != null && o.getClass() == getClass()) {
				Operator t = (Operator) o;
				return t.getSort().equals(getSort()) && Arrays.equals(operands, t.operands);
			}
			return false;
		}

		@Override
		public int hashCode() {
			// Terms are immutable, so the hash is computed once.
			if (hash == 0) {
				hash = getClass().getName().hashCode() ^ Arrays.hashCode(operands);
			}
			return hash;
		}
	}

	public static class Negate extends Operator {
		private Negate(Term operand) {
			super(Sort.INT, operand);
		}
	}

	public static class Add extends Operator {
		private Add(Term lhs, Term rhs) {
			super(Sort.INT, lhs, rhs);
		}
	}

	public static class Sub extends Operator {
		private Sub(Term lhs, Term rhs) {
			super(Sort.INT, lhs, rhs);
		}
	}

	public static class Mul extends Operator {
		private Mul(Term lhs, Term rhs) {
			super(Sort.INT, lhs, rhs);
		}
	}

	public static class Div extends Operator {
		private Div(Term lhs, Term rhs) {
			super(Sort.INT, lhs, rhs);
		}
	}

	public static class Mod extends Operator {
		private Mod(Term lhs, Term rhs) {
			super(Sort.INT, lhs, rhs);
		}
	}

	public static class Equal extends Operator {
		private Equal(Term lhs, Term rhs) {
			super(Sort.BOOL, lhs, rhs);
		}
	}

	public static class LessThan extends Operator {
		private LessThan(Term lhs, Term rhs) {
			super(Sort.BOOL, lhs, rhs);
		}
	}

	public static class LessThanOrEqual extends Operator {
		private LessThanOrEqual(Term lhs, Term rhs) {
			super(Sort.BOOL, lhs, rhs);
		}
	}

	public static class And extends Operator {
		private And(Term... operands) {
			super(Sort.BOOL, operands);
		}
	}

	public static class Or extends Operator {
		private Or(Term... operands) {
			super(Sort.BOOL, operands);
		}
	}

	public static class Not extends Operator {
		private Not(Term operand) {
			super(Sort.BOOL, operand);
		}
	}

	public static class Implies extends Operator {
		private Implies(Term lhs, Term rhs) {
			super(Sort.BOOL, lhs, rhs);
		}
	}

	public static class Iff extends Operator {
		private Iff(Term lhs, Term rhs) {
			super(Sort.BOOL, lhs, rhs);
		}
	}

	public static class IfThenElse extends Operator {
		private IfThenElse(Term condition, Term trueBranch, Term falseBranch) {
			super(trueBranch.getSort(), condition, trueBranch, falseBranch);
		}

		public Term getCondition() {
			return get(0);
		}

		public Term getTrueBranch() {
			return get(1);
		}

		public Term getFalseBranch() {
			return get(2);
		}
	}

	public static class Select extends Operator {
		private Select(Term array, Term index) {
			super(((Sort.Array) array.getSort()).getRange(), array, index);
		}
	}

	public static class Store extends Operator {
		private Store(Term array, Term index, Term value) {
			super(array.getSort(), array, index, value);
		}
	}

	/**
	 * An array which maps every index to the same value.
	 */
	public static class ConstArray extends Operator {
		private ConstArray(Sort.Array sort, Term value) {
			super(sort, value);
		}
	}

	/**
	 * Application of an uninterpreted function, such as the hash function used
	 * to compute raw storage slots.
	 */
	public static class Apply extends Operator {
		private final String name;

		private Apply(String name, Sort sort, Term... arguments) {
			super(sort, arguments);
			this.name = name;
		}

		public String getName() {
			return name;
		}

		@Override
		public boolean equals(Object o) {
			return super.equals(o) && ((Apply) o).name.equals(name);
		}

		@Override
		public int hashCode() {
			return super.hashCode() ^ name.hashCode();
		}
	}

	public static class Quantifier extends Term {
		private final boolean universal;
		private final Variable[] variables;
		private final Term body;

		private Quantifier(boolean universal, Variable[] variables, Term body) {
			super(Sort.BOOL);
			this.universal = universal;
			this.variables = variables;
			this.body = body;
		}

		public boolean isUniversal() {
			return universal;
		}

		public Variable[] getVariables() {
			return variables;
		}

		public Term getBody() {
			return body;
		}

		@Override
		public boolean equals(Object o) {
			if (o instanceof Quantifier) {
				Quantifier q = (Quantifier) o;
				return q.universal == universal && Arrays.equals(q.variables, variables) && q.body.equals(body);
			}
			return false;
		}

		@Override
		public int hashCode() {
			return Arrays.hashCode(variables) ^ body.hashCode();
		}
	}

	// =========================================================================
	// Fresh Names
	// =========================================================================

	/**
	 * Generates variables which are guaranteed not to clash with any other
	 * variable generated by the same instance. Each verification unit owns
	 * exactly one generator.
	 */
	public static class Generator {
		private int counter;

		public Variable fresh(String prefix, Sort sort) {
			return new Variable(prefix + "!" + (counter++), sort);
		}
	}

	// =========================================================================
	// Constructor API (for convenience)
	// =========================================================================

	public static final Term TRUE = new Bool(true);
	public static final Term FALSE = new Bool(false);
	public static final Term ZERO = new Constant(BigInteger.ZERO);
	public static final Term ONE = new Constant(BigInteger.ONE);

	public static Term CONST(boolean b) {
		return b ? TRUE : FALSE;
	}

	public static Term CONST(long i) {
		return CONST(BigInteger.valueOf(i));
	}

	public static Term CONST(BigInteger i) {
		return new Constant(i);
	}

	public static Variable VAR(String name, Sort sort) {
		return new Variable(name, sort);
	}

	// Arithmetic Operators

	public static Term NEG(Term operand) {
		if (operand instanceof Constant) {
			return CONST(((Constant) operand).value.negate());
		} else if (operand instanceof Negate) {
			return ((Negate) operand).get(0);
		} else {
			return new Negate(operand);
		}
	}

	public static Term ADD(Term lhs, Term rhs) {
		if (lhs instanceof Constant && rhs instanceof Constant) {
			return CONST(value(lhs).add(value(rhs)));
		} else if (isZero(lhs)) {
			return rhs;
		} else if (isZero(rhs)) {
			return lhs;
		} else {
			return new Add(lhs, rhs);
		}
	}

	public static Term SUB(Term lhs, Term rhs) {
		if (lhs instanceof Constant && rhs instanceof Constant) {
			return CONST(value(lhs).subtract(value(rhs)));
		} else if (isZero(rhs)) {
			return lhs;
		} else if (lhs.equals(rhs)) {
			return ZERO;
		} else {
			return new Sub(lhs, rhs);
		}
	}

	public static Term MUL(Term lhs, Term rhs) {
		if (lhs instanceof Constant && rhs instanceof Constant) {
			return CONST(value(lhs).multiply(value(rhs)));
		} else if (isZero(lhs) || isZero(rhs)) {
			return ZERO;
		} else if (ONE.equals(lhs)) {
			return rhs;
		} else if (ONE.equals(rhs)) {
			return lhs;
		} else {
			return new Mul(lhs, rhs);
		}
	}

	/**
	 * Integer division following the solver's semantics, where the remainder
	 * is always non-negative. Division by zero is left uninterpreted.
	 *
	 * @param lhs
	 * @param rhs
	 * @return
	 */
	public static Term DIV(Term lhs, Term rhs) {
		if (lhs instanceof Constant && rhs instanceof Constant && !isZero(rhs)) {
			return CONST(euclidean(value(lhs), value(rhs))[0]);
		} else if (ONE.equals(rhs)) {
			return lhs;
		} else {
			return new Div(lhs, rhs);
		}
	}

	public static Term MOD(Term lhs, Term rhs) {
		if (lhs instanceof Constant && rhs instanceof Constant && !isZero(rhs)) {
			return CONST(euclidean(value(lhs), value(rhs))[1]);
		} else {
			return new Mod(lhs, rhs);
		}
	}

	// Relational Operators

	public static Term EQ(Term lhs, Term rhs) {
		java.lang.Boolean r = decideEqual(lhs, rhs);
		if (r != null) {
			return CONST(r);
		} else if (lhs.getSort() == Sort.BOOL && rhs instanceof Bool) {
			return rhs.isTrue() ? lhs : NOT(lhs);
		} else if (rhs.getSort() == Sort.BOOL && lhs instanceof Bool) {
			return lhs.isTrue() ? rhs : NOT(rhs);
		} else {
			return new Equal(lhs, rhs);
		}
	}

	public static Term NEQ(Term lhs, Term rhs) {
		return NOT(EQ(lhs, rhs));
	}

	public static Term LT(Term lhs, Term rhs) {
		if (lhs instanceof Constant && rhs instanceof Constant) {
			return CONST(value(lhs).compareTo(value(rhs)) < 0);
		} else if (lhs.equals(rhs)) {
			return FALSE;
		} else {
			return new LessThan(lhs, rhs);
		}
	}

	public static Term LTEQ(Term lhs, Term rhs) {
		if (lhs instanceof Constant && rhs instanceof Constant) {
			return CONST(value(lhs).compareTo(value(rhs)) <= 0);
		} else if (lhs.equals(rhs)) {
			return TRUE;
		} else {
			return new LessThanOrEqual(lhs, rhs);
		}
	}

	public static Term GT(Term lhs, Term rhs) {
		return LT(rhs, lhs);
	}

	public static Term GTEQ(Term lhs, Term rhs) {
		return LTEQ(rhs, lhs);
	}

	/**
	 * Construct a term which holds when a given value lies within an inclusive
	 * range.
	 *
	 * @param value
	 * @param lower
	 * @param upper
	 * @return
	 */
	public static Term INRANGE(Term value, BigInteger lower, BigInteger upper) {
		return AND(LTEQ(CONST(lower), value), LTEQ(value, CONST(upper)));
	}

	// Logical Operators

	public static Term AND(List<Term> operands) {
		ArrayList<Term> noperands = new ArrayList<>();
		for (int i = 0; i != operands.size(); ++i) {
			Term ith = operands.get(i);
			if (ith.isFalse()) {
				return FALSE;
			} else if (ith instanceof And) {
				noperands.addAll(Arrays.asList(((And) ith).getAll()));
			} else if (!ith.isTrue()) {
				noperands.add(ith);
			}
		}
		switch (noperands.size()) {
		case 0:
			return TRUE;
		case 1:
			return noperands.get(0);
		default:
			return new And(noperands.toArray(new Term[noperands.size()]));
		}
	}

	public static Term AND(Term... operands) {
		return AND(Arrays.asList(operands));
	}

	public static Term OR(List<Term> operands) {
		ArrayList<Term> noperands = new ArrayList<>();
		for (int i = 0; i != operands.size(); ++i) {
			Term ith = operands.get(i);
			if (ith.isTrue()) {
				return TRUE;
			} else if (ith instanceof Or) {
				noperands.addAll(Arrays.asList(((Or) ith).getAll()));
			} else if (!ith.isFalse()) {
				noperands.add(ith);
			}
		}
		switch (noperands.size()) {
		case 0:
			return FALSE;
		case 1:
			return noperands.get(0);
		default:
			return new Or(noperands.toArray(new Term[noperands.size()]));
		}
	}

	public static Term OR(Term... operands) {
		return OR(Arrays.asList(operands));
	}

	public static Term NOT(Term operand) {
		if (operand.isFalse()) {
			return TRUE;
		} else if (operand.isTrue()) {
			return FALSE;
		} else if (operand instanceof Not) {
			return ((Not) operand).get(0);
		} else {
			return new Not(operand);
		}
	}

	public static Term IMPLIES(Term lhs, Term rhs) {
		if (lhs.isFalse() || rhs.isTrue()) {
			return TRUE;
		} else if (lhs.isTrue()) {
			return rhs;
		} else if (rhs.isFalse()) {
			return NOT(lhs);
		} else {
			return new Implies(lhs, rhs);
		}
	}

	public static Term IFF(Term lhs, Term rhs) {
		if (lhs instanceof Bool && rhs instanceof Bool) {
			return CONST(lhs.equals(rhs));
		} else if (lhs.equals(rhs)) {
			return TRUE;
		} else if (lhs.isTrue()) {
			return rhs;
		} else if (rhs.isTrue()) {
			return lhs;
		} else {
			return new Iff(lhs, rhs);
		}
	}

	public static Term ITE(Term condition, Term trueBranch, Term falseBranch) {
		if (condition.isTrue()) {
			return trueBranch;
		} else if (condition.isFalse()) {
			return falseBranch;
		} else if (trueBranch.equals(falseBranch)) {
			return trueBranch;
		} else if (trueBranch.isTrue() && falseBranch.isFalse()) {
			return condition;
		} else if (trueBranch.isFalse() && falseBranch.isTrue()) {
			return NOT(condition);
		} else {
			return new IfThenElse(condition, trueBranch, falseBranch);
		}
	}

	// Arrays

	/**
	 * Read an element from an array, simplifying through updates whose index
	 * is decidably equal or unequal to the one being read.
	 *
	 * @param array
	 * @param index
	 * @return
	 */
	public static Term SELECT(Term array, Term index) {
		if (array instanceof Store) {
			Store s = (Store) array;
			java.lang.Boolean r = decideEqual(s.get(1), index);
			if (r == java.lang.Boolean.TRUE) {
				return s.get(2);
			} else if (r == java.lang.Boolean.FALSE) {
				return SELECT(s.get(0), index);
			}
		} else if (array instanceof ConstArray) {
			return ((ConstArray) array).get(0);
		} else if (array instanceof IfThenElse) {
			IfThenElse ite = (IfThenElse) array;
			return ITE(ite.getCondition(), SELECT(ite.getTrueBranch(), index), SELECT(ite.getFalseBranch(), index));
		}
		return new Select(array, index);
	}

	public static Term STORE(Term array, Term index, Term value) {
		return new Store(array, index, value);
	}

	public static Term CONST_ARRAY(Sort.Array sort, Term value) {
		return new ConstArray(sort, value);
	}

	public static Term APPLY(String name, Sort sort, Term... arguments) {
		return new Apply(name, sort, arguments);
	}

	// Quantifiers

	public static Term FORALL(List<Variable> variables, Term body) {
		if (variables.isEmpty() || body instanceof Bool) {
			return body;
		}
		return new Quantifier(true, variables.toArray(new Variable[variables.size()]), body);
	}

	public static Term EXISTS(List<Variable> variables, Term body) {
		if (variables.isEmpty() || body instanceof Bool) {
			return body;
		}
		return new Quantifier(false, variables.toArray(new Variable[variables.size()]), body);
	}

	// =========================================================================
	// Helpers
	// =========================================================================

	/**
	 * Attempt to decide whether two terms are equal without consulting the
	 * solver.
	 *
	 * @param lhs
	 * @param rhs
	 * @return <code>TRUE</code> or <code>FALSE</code> when decided, otherwise
	 *         <code>null</code>.
	 */
	public static java.lang.Boolean decideEqual(Term lhs, Term rhs) {
		if (lhs.equals(rhs)) {
			return java.lang.Boolean.TRUE;
		} else if (lhs instanceof Constant && rhs instanceof Constant) {
			return java.lang.Boolean.FALSE;
		} else if (lhs instanceof Bool && rhs instanceof Bool) {
			return java.lang.Boolean.FALSE;
		} else {
			return null;
		}
	}

	/**
	 * Extract the value of a constant integer term.
	 *
	 * @param t
	 * @return The value, or <code>null</code> if the term is not constant.
	 */
	public static BigInteger value(Term t) {
		return (t instanceof Constant) ? ((Constant) t).value : null;
	}

	private static boolean isZero(Term t) {
		return t instanceof Constant && ((Constant) t).value.signum() == 0;
	}

	private static BigInteger[] euclidean(BigInteger lhs, BigInteger rhs) {
		BigInteger[] qr = lhs.divideAndRemainder(rhs);
		if (qr[1].signum() < 0) {
			if (rhs.signum() > 0) {
				qr[0] = qr[0].subtract(BigInteger.ONE);
				qr[1] = qr[1].add(rhs);
			} else {
				qr[0] = qr[0].add(BigInteger.ONE);
				qr[1] = qr[1].subtract(rhs);
			}
		}
		return qr;
	}
}
