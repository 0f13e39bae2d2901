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
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * An addressable unit of persistent state: a root storage variable followed by
 * a path of structural accessors. For example, <code>users[k].balance</code>
 * is the root <code>users</code> followed by a key access and a field access.
 * Keys are symbolic, hence two locations with the same shape may or may not
 * alias.
 *
 * @author David J. Pearce
 *
 */
public class Location {
	private final String root;
	private final Accessor[] accessors;

	public Location(String root, Accessor... accessors) {
		this.root = root;
		this.accessors = accessors;
	}

	public Location(String root, List<Accessor> accessors) {
		this(root, accessors.toArray(new Accessor[accessors.size()]));
	}

	public String getRoot() {
		return root;
	}

	public int size() {
		return accessors.length;
	}

	public Accessor get(int i) {
		return accessors[i];
	}

	public List<Accessor> getAccessors() {
		return Collections.unmodifiableList(Arrays.asList(accessors));
	}

	/**
	 * Extend this location with a further accessor.
	 *
	 * @param accessor
	 * @return
	 */
	public Location append(Accessor accessor) {
		Accessor[] naccessors = Arrays.copyOf(accessors, accessors.length + 1);
		naccessors[accessors.length] = accessor;
		return new Location(root, naccessors);
	}

	/**
	 * Get the name of the storage shape this location belongs to. This is the
	 * location with all keys and indices erased, such as
	 * <code>users[].balance</code>.
	 *
	 * @return
	 */
	public String getShape() {
		StringBuilder sb = new StringBuilder(root);
		for (Accessor a : accessors) {
			if (a instanceof Field) {
				sb.append(".").append(((Field) a).getName());
			} else if (a instanceof Length) {
				sb.append(".length");
			} else {
				sb.append("[]");
			}
		}
		return sb.toString();
	}

	/**
	 * Get the sequence of keys and indices used in this location, in order.
	 *
	 * @return
	 */
	public List<Term> getKeys() {
		ArrayList<Term> keys = new ArrayList<>();
		for (Accessor a : accessors) {
			if (a instanceof Key) {
				keys.add(((Key) a).getKey());
			} else if (a instanceof Index) {
				keys.add(((Index) a).getIndex());
			}
		}
		return keys;
	}

	@Override
	public boolean equals(Object o) {
		if (o instanceof Location) {
			Location l = (Location) o;
			return root.equals(l.root) && Arrays.equals(accessors, l.accessors);
		}
		return false;
	}

	@Override
	public int hashCode() {
		return root.hashCode() ^ Arrays.hashCode(accessors);
	}

	@Override
	public String toString() {
		StringBuilder sb = new StringBuilder(root);
		for (Accessor a : accessors) {
			sb.append(a);
		}
		return sb.toString();
	}

	// =========================================================================
	// Accessors
	// =========================================================================

	public interface Accessor {
	}

	public static class Field implements Accessor {
		private final String name;

		public Field(String name) {
			this.name = name;
		}

		public String getName() {
			return name;
		}

		@Override
		public boolean equals(Object o) {
			return o instanceof Field && ((Field) o).name.equals(name);
		}

		@Override
		public int hashCode() {
			return name.hashCode();
		}

		@Override
		public String toString() {
			return "." + name;
		}
	}

	/**
	 * A mapping access with a (symbolic) key.
	 */
	public static class Key implements Accessor {
		private final Term key;

		public Key(Term key) {
			this.key = key;
		}

		public Term getKey() {
			return key;
		}

		@Override
		public boolean equals(Object o) {
			return o instanceof Key && ((Key) o).key.equals(key);
		}

		@Override
		public int hashCode() {
			return key.hashCode();
		}

		@Override
		public String toString() {
			return "[" + key + "]";
		}
	}

	/**
	 * An array element access with a (symbolic) index.
	 */
	public static class Index implements Accessor {
		private final Term index;

		public Index(Term index) {
			this.index = index;
		}

		public Term getIndex() {
			return index;
		}

		@Override
		public boolean equals(Object o) {
			return o instanceof Index && ((Index) o).index.equals(index);
		}

		@Override
		public int hashCode() {
			return 31 * index.hashCode();
		}

		@Override
		public String toString() {
			return "[" + index + "]";
		}
	}

	public static class Length implements Accessor {
		@Override
		public boolean equals(Object o) {
			return o instanceof Length;
		}

		@Override
		public int hashCode() {
			return 17;
		}

		@Override
		public String toString() {
			return ".length";
		}
	}

	// =========================================================================
	// Constructor API (for convenience)
	// =========================================================================

	public static Field FIELD(String name) {
		return new Field(name);
	}

	public static Key KEY(Term key) {
		return new Key(key);
	}

	public static Index INDEX(Term index) {
		return new Index(index);
	}

	public static Length LENGTH() {
		return new Length();
	}
}
