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

import java.math.BigInteger;

import specexec.core.SpecFile.Type;

/**
 * Relates specification types to the terms which represent their values. Every
 * value type is represented by an unbounded sort, and bounded types are
 * recovered by the domain constraint attached to each value.
 *
 * @author David J. Pearce
 *
 */
public class Types {
	public static final int ADDRESS_WIDTH = 160;

	/**
	 * Determine the sort used to represent values of a given type.
	 *
	 * @param type
	 * @return
	 */
	public static Sort toSort(Type type) {
		if (type instanceof Type.Bool) {
			return Sort.BOOL;
		} else if (type instanceof Type.Int || type instanceof Type.Bounded || type instanceof Type.Address
				|| type instanceof Type.Enum) {
			return Sort.INT;
		} else if (type instanceof Type.Uninterpreted) {
			return new Sort.Uninterpreted(((Type.Uninterpreted) type).getName());
		} else if (type instanceof Type.Mapping) {
			Type.Mapping m = (Type.Mapping) type;
			return new Sort.Array(toSort(m.getKey()), toSort(m.getValue()));
		} else if (type instanceof Type.Array) {
			return new Sort.Array(Sort.INT, toSort(((Type.Array) type).getElement()));
		} else {
			throw new IllegalArgumentException("type has no value representation: " + type);
		}
	}

	/**
	 * Check whether values of a given type can be held in a single storage slot
	 * (i.e. it is not a struct, mapping or array).
	 *
	 * @param type
	 * @return
	 */
	public static boolean isValueType(Type type) {
		return type instanceof Type.Bool || type instanceof Type.Int || type instanceof Type.Bounded
				|| type instanceof Type.Address || type instanceof Type.Enum || type instanceof Type.Uninterpreted;
	}

	/**
	 * Construct the constraint describing the values a term of a given type may
	 * take. For example, a <code>uint8</code> lies between 0 and 255 inclusive.
	 * Unbounded types give <code>true</code>.
	 *
	 * @param type
	 * @param value
	 * @return
	 */
	public static Term domain(Type type, Term value) {
		if (type instanceof Type.Bounded) {
			Type.Bounded b = (Type.Bounded) type;
			return INRANGE(value, min(b), max(b));
		} else if (type instanceof Type.Address) {
			return INRANGE(value, BigInteger.ZERO, BigInteger.ONE.shiftLeft(ADDRESS_WIDTH).subtract(BigInteger.ONE));
		} else if (type instanceof Type.Enum) {
			int n = ((Type.Enum) type).getValues().size();
			return INRANGE(value, BigInteger.ZERO, BigInteger.valueOf(n - 1));
		} else {
			return TRUE;
		}
	}

	/**
	 * Construct the constraint that a value fits within a type. This is used for
	 * bounded casts.
	 *
	 * @param type
	 * @param value
	 * @return
	 */
	public static Term fits(Type type, Term value) {
		return domain(type, value);
	}

	public static BigInteger min(Type.Bounded type) {
		if (type.isSigned()) {
			return BigInteger.ONE.shiftLeft(type.getWidth() - 1).negate();
		} else {
			return BigInteger.ZERO;
		}
	}

	public static BigInteger max(Type.Bounded type) {
		if (type.isSigned()) {
			return BigInteger.ONE.shiftLeft(type.getWidth() - 1).subtract(BigInteger.ONE);
		} else {
			return BigInteger.ONE.shiftLeft(type.getWidth()).subtract(BigInteger.ONE);
		}
	}

	/**
	 * Construct the default (i.e. zero) value of a given type, as found in
	 * freshly constructed storage.
	 *
	 * @param type
	 * @return
	 */
	public static Term zero(Type type) {
		if (type instanceof Type.Bool) {
			return FALSE;
		} else if (type instanceof Type.Mapping) {
			Type.Mapping m = (Type.Mapping) type;
			return CONST_ARRAY((Sort.Array) toSort(m), zero(m.getValue()));
		} else if (type instanceof Type.Array) {
			Type.Array a = (Type.Array) type;
			return CONST_ARRAY((Sort.Array) toSort(a), zero(a.getElement()));
		} else if (type instanceof Type.Uninterpreted) {
			return VAR("zero!" + type, toSort(type));
		} else {
			return ZERO;
		}
	}
}
