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
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/**
 * The symbolic persistent storage of a target system during a single check.
 * Each storage shape is held as a single term: a scalar for shapes without
 * keys, or a (nested) array otherwise. Writes are applied as array updates and
 * reported to an observer (normally the hook dispatcher) together with the
 * value they overwrote.
 *
 * @author David J. Pearce
 *
 */
public class StorageState {
	/**
	 * Receives notification of storage accesses.
	 */
	public interface Observer {
		/**
		 * Called after a location has been written.
		 *
		 * @param location
		 * @param oldValue the value held before the write
		 * @param newValue the value held after the write
		 */
		public void onWrite(Location location, Term oldValue, Term newValue);

		/**
		 * Called after a location has been loaded by the target system.
		 *
		 * @param location
		 * @param value
		 */
		public void onRead(Location location, Term value);
	}

	private final StorageLayout layout;
	private final LinkedHashMap<String, Term> shapes;
	/**
	 * The arbitrary shapes this storage started from, or <code>null</code> if it
	 * started zeroed. Every location of these lies within the domain of its type.
	 */
	private final Map<String, Term> initial;
	/**
	 * Receives the domain constraints of values read from storage.
	 */
	private final Consumer<Term> constraints;
	private Observer observer;
	private boolean muted;

	private StorageState(StorageLayout layout, LinkedHashMap<String, Term> shapes, Map<String, Term> initial,
			Consumer<Term> constraints) {
		this.layout = layout;
		this.shapes = shapes;
		this.initial = initial;
		this.constraints = constraints;
	}

	/**
	 * Construct storage where every location holds an arbitrary value of its
	 * type.
	 *
	 * @param layout
	 * @param generator
	 * @param constraints
	 * @return
	 */
	public static StorageState fresh(StorageLayout layout, Generator generator, Consumer<Term> constraints) {
		LinkedHashMap<String, Term> shapes = new LinkedHashMap<>();
		for (StorageLayout.Shape s : layout.getShapes()) {
			shapes.put(s.getName(), generator.fresh(s.getName(), s.getSort()));
		}
		return new StorageState(layout, shapes, new HashMap<>(shapes), constraints);
	}

	/**
	 * Construct storage where every location holds the zero value of its type,
	 * as found immediately before a constructor runs.
	 *
	 * @param layout
	 * @param constraints
	 * @return
	 */
	public static StorageState zero(StorageLayout layout, Consumer<Term> constraints) {
		LinkedHashMap<String, Term> shapes = new LinkedHashMap<>();
		for (StorageLayout.Shape s : layout.getShapes()) {
			shapes.put(s.getName(), s.getZero());
		}
		return new StorageState(layout, shapes, null, constraints);
	}

	public StorageLayout getLayout() {
		return layout;
	}

	public void setObserver(Observer observer) {
		this.observer = observer;
	}

	/**
	 * Check whether accesses are currently hidden from the observer.
	 *
	 * @return
	 */
	public boolean isMuted() {
		return muted;
	}

	public void setMuted(boolean flag) {
		this.muted = flag;
	}

	/**
	 * Read the value at a given location without notifying the observer. The
	 * value this location held initially is constrained to lie within the domain
	 * of its type. Values written since are the responsibility of the writer.
	 *
	 * @param location
	 * @return
	 */
	public Term read(Location location) {
		SpecFile.Type type = layout.typeOf(location);
		if (!Types.isValueType(type)) {
			throw new IllegalArgumentException("location does not hold a value: " + location);
		}
		List<Term> keys = location.getKeys();
		String shape = location.getShape();
		if (initial != null) {
			Term domain = Types.domain(type, select(initial.get(shape), keys));
			if (!domain.isTrue()) {
				constraints.accept(domain);
			}
		}
		return select(shapes.get(shape), keys);
	}

	private static Term select(Term value, List<Term> keys) {
		for (Term key : keys) {
			value = SELECT(value, key);
		}
		return value;
	}

	/**
	 * Read the value at a given location on behalf of the target system. This
	 * notifies the observer, hence may trigger read hooks.
	 *
	 * @param location
	 * @return
	 */
	public Term load(Location location) {
		Term value = read(location);
		if (observer != null && !muted) {
			observer.onRead(location, value);
		}
		return value;
	}

	/**
	 * Write a value to a given location, notifying the observer with the value
	 * previously held there before returning.
	 *
	 * @param location
	 * @param value
	 */
	public void write(Location location, Term value) {
		Term oldValue = read(location);
		String shape = location.getShape();
		shapes.put(shape, update(shapes.get(shape), location.getKeys(), 0, value));
		if (observer != null && !muted) {
			observer.onWrite(location, oldValue, value);
		}
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
	 * Take an image of the current storage. Since terms are immutable this is
	 * cheap, and later writes cannot affect it.
	 *
	 * @return
	 */
	public Snapshot snapshot() {
		return new Snapshot(new LinkedHashMap<>(shapes));
	}

	/**
	 * Replace the current storage with a previously taken image. This is not a
	 * sequence of writes, hence the observer is not notified.
	 *
	 * @param snapshot
	 */
	public void restore(Snapshot snapshot) {
		shapes.clear();
		shapes.putAll(snapshot.shapes);
	}

	/**
	 * Set the current storage to one image or another depending on a condition.
	 * This is used to join the two outcomes of a call which may revert, and the
	 * two branches of a conditional.
	 *
	 * @param condition
	 * @param trueBranch
	 * @param falseBranch
	 */
	public void merge(Term condition, Snapshot trueBranch, Snapshot falseBranch) {
		for (String shape : trueBranch.shapes.keySet()) {
			shapes.put(shape, ITE(condition, trueBranch.get(shape), falseBranch.get(shape)));
		}
	}

	/**
	 * Construct the condition under which two storage images are identical.
	 *
	 * @param lhs
	 * @param rhs
	 * @return
	 */
	public static Term equal(Snapshot lhs, Snapshot rhs) {
		ArrayList<Term> clauses = new ArrayList<>();
		for (Map.Entry<String, Term> e : lhs.shapes.entrySet()) {
			clauses.add(EQ(e.getValue(), rhs.get(e.getKey())));
		}
		return AND(clauses);
	}

	/**
	 * An immutable image of storage.
	 */
	public static class Snapshot {
		private final Map<String, Term> shapes;

		private Snapshot(Map<String, Term> shapes) {
			this.shapes = Collections.unmodifiableMap(shapes);
		}

		public Term get(String shape) {
			return shapes.get(shape);
		}

		public Map<String, Term> getShapes() {
			return shapes;
		}
	}
}
