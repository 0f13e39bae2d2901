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

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

import specexec.core.SpecFile.Decl;
import specexec.core.SpecFile.Type;

/**
 * Auxiliary state used only by the specification. A ghost is either a scalar
 * or a mapping from key tuples to values, held as a single (possibly nested)
 * array term. A ghost store is owned by exactly one check and never shared.
 *
 * @author David J. Pearce
 *
 */
public class GhostStore {
	private final Generator generator;
	private final Consumer<Term> constraints;
	private final LinkedHashMap<String, Decl.Ghost> declarations;
	private final HashMap<String, Term> values;
	/**
	 * The value of each ghost immediately before it was last havoced.
	 */
	private final HashMap<String, Term> previous;
	/**
	 * Every arbitrary value each ghost has been given. These lie within the
	 * domain of the ghost's type, unlike values assigned by the specification.
	 */
	private final HashMap<String, List<Term>> origins;

	public GhostStore(Generator generator, Consumer<Term> constraints) {
		this.generator = generator;
		this.constraints = constraints;
		this.declarations = new LinkedHashMap<>();
		this.values = new HashMap<>();
		this.previous = new HashMap<>();
		this.origins = new HashMap<>();
	}

	/**
	 * Declare a new ghost, which initially holds an arbitrary value. Its axioms
	 * are the responsibility of the caller.
	 *
	 * @param ghost
	 */
	public void declare(Decl.Ghost ghost) {
		if (declarations.containsKey(ghost.getName())) {
			throw new IllegalArgumentException("duplicate ghost: " + ghost.getName());
		}
		declarations.put(ghost.getName(), ghost);
		origins.put(ghost.getName(), new ArrayList<>());
		values.put(ghost.getName(), arbitrary(ghost));
	}

	public boolean isDeclared(String name) {
		return declarations.containsKey(name);
	}

	public Decl.Ghost getDeclaration(String name) {
		Decl.Ghost g = declarations.get(name);
		if (g == null) {
			throw new IllegalArgumentException("unknown ghost: " + name);
		}
		return g;
	}

	public Collection<Decl.Ghost> getDeclarations() {
		return Collections.unmodifiableCollection(declarations.values());
	}

	/**
	 * Read a ghost at a given key tuple (which is empty for a scalar ghost).
	 *
	 * @param name
	 * @param keys
	 * @return
	 */
	public Term get(String name, List<Term> keys) {
		return read(name, values.get(name), keys);
	}

	/**
	 * Read the value a ghost held immediately before it was last havoced.
	 *
	 * @param name
	 * @param keys
	 * @return
	 */
	public Term getOld(String name, List<Term> keys) {
		Term old = previous.get(name);
		if (old == null) {
			throw new IllegalStateException("ghost not havoced: " + name);
		}
		return read(name, old, keys);
	}

	private Term read(String name, Term value, List<Term> keys) {
		Decl.Ghost ghost = getDeclaration(name);
		checkArity(ghost, keys);
		for (Term origin : origins.get(name)) {
			Term domain = Types.domain(ghost.getValueType(), select(origin, keys));
			if (!domain.isTrue()) {
				constraints.accept(domain);
			}
		}
		return select(value, keys);
	}

	private static Term select(Term value, List<Term> keys) {
		for (Term key : keys) {
			value = SELECT(value, key);
		}
		return value;
	}

	private Term arbitrary(Decl.Ghost ghost) {
		Term v = generator.fresh(ghost.getName(), sortOf(ghost));
		origins.get(ghost.getName()).add(v);
		return v;
	}

	public void set(String name, List<Term> keys, Term value) {
		Decl.Ghost ghost = getDeclaration(name);
		checkArity(ghost, keys);
		values.put(name, update(values.get(name), keys, 0, value));
	}

	private static Term update(Term base, List<Term> keys, int i, Term value) {
		if (i == keys.size()) {
			return value;
		} else {
			Term key = keys.get(i);
			return STORE(base, key, update(SELECT(base, key), keys, i + 1, value));
		}
	}

	/**
	 * Replace a ghost's entire value with a fresh one. The value it held before
	 * remains accessible through {@link #getOld(String, List)}, such that an
	 * assumption relating the two can be constructed.
	 *
	 * @param name
	 */
	public void havoc(String name) {
		Decl.Ghost ghost = getDeclaration(name);
		previous.put(name, values.get(name));
		values.put(name, arbitrary(ghost));
	}

	/**
	 * Give every ghost a fresh unconstrained value, as at the start of a check.
	 */
	public void reset() {
		previous.clear();
		for (Decl.Ghost ghost : declarations.values()) {
			origins.get(ghost.getName()).clear();
			values.put(ghost.getName(), arbitrary(ghost));
		}
	}

	public Snapshot snapshot() {
		return new Snapshot(new HashMap<>(values));
	}

	public void restore(Snapshot snapshot) {
		values.putAll(snapshot.values);
	}

	/**
	 * Set every ghost to one image or another depending on a condition.
	 *
	 * @param condition
	 * @param trueBranch
	 * @param falseBranch
	 * @param includePersistent whether persistent ghosts are merged as well
	 */
	public void merge(Term condition, Snapshot trueBranch, Snapshot falseBranch, boolean includePersistent) {
		for (Decl.Ghost ghost : declarations.values()) {
			if (includePersistent || !ghost.isPersistent()) {
				String n = ghost.getName();
				values.put(n, ITE(condition, trueBranch.values.get(n), falseBranch.values.get(n)));
			}
		}
	}

	/**
	 * Determine the sort of the term representing an entire ghost.
	 *
	 * @param ghost
	 * @return
	 */
	public static Sort sortOf(Decl.Ghost ghost) {
		Sort sort = Types.toSort(ghost.getValueType());
		List<Type> keys = ghost.getKeyTypes();
		for (int i = keys.size() - 1; i >= 0; --i) {
			sort = new Sort.Array(Types.toSort(keys.get(i)), sort);
		}
		return sort;
	}

	private static void checkArity(Decl.Ghost ghost, List<Term> keys) {
		if (ghost.getKeyTypes().size() != keys.size()) {
			throw new IllegalArgumentException("ghost " + ghost.getName() + " expects " + ghost.getKeyTypes().size()
					+ " key(s), found " + keys.size());
		}
	}

	/**
	 * An immutable image of all ghosts.
	 */
	public static class Snapshot {
		private final Map<String, Term> values;

		private Snapshot(Map<String, Term> values) {
			this.values = Collections.unmodifiableMap(values);
		}

		public Term get(String name) {
			return values.get(name);
		}
	}
}
