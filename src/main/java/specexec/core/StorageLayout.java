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
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import specexec.core.SpecFile.Type;

/**
 * Describes the addressable persistent state of a target system. The layout
 * is a sequence of typed root variables, each occupying its own slot. Each
 * root is flattened into one or more <i>shapes</i>: a shape is a path through
 * the root's structure with every mapping key and array index erased, such as
 * <code>users[].balance</code>. Every location belongs to exactly one shape.
 *
 * @author David J. Pearce
 *
 */
public class StorageLayout {
	public static final String MAPPING_SLOT = "slot.mapping";
	public static final String ARRAY_SLOT = "slot.array";

	private final Map<String, Root> roots;
	private final Map<String, Shape> shapes;

	public StorageLayout() {
		this.roots = new LinkedHashMap<>();
		this.shapes = new LinkedHashMap<>();
	}

	/**
	 * Declare a new root storage variable. Roots are assigned consecutive slots
	 * in declaration order.
	 *
	 * @param name
	 * @param type
	 * @return
	 */
	public StorageLayout add(String name, Type type) {
		if (roots.containsKey(name)) {
			throw new IllegalArgumentException("duplicate storage variable: " + name);
		}
		Root root = new Root(name, type, BigInteger.valueOf(roots.size()));
		roots.put(name, root);
		flatten(name, name, type, new ArrayList<>());
		return this;
	}

	public Root getRoot(String name) {
		return roots.get(name);
	}

	public Collection<Root> getRoots() {
		return Collections.unmodifiableCollection(roots.values());
	}

	public Collection<Shape> getShapes() {
		return Collections.unmodifiableCollection(shapes.values());
	}

	public Shape getShape(String name) {
		return shapes.get(name);
	}

	/**
	 * Determine the type of the value held at a given location. This will fail
	 * if the location does not correspond to the structure of its root.
	 *
	 * @param location
	 * @return
	 */
	public Type typeOf(Location location) {
		Root root = roots.get(location.getRoot());
		if (root == null) {
			throw new IllegalArgumentException("unknown storage variable: " + location.getRoot());
		}
		Type type = root.getType();
		for (int i = 0; i != location.size(); ++i) {
			type = step(type, location.get(i), location);
		}
		return type;
	}

	/**
	 * Determine the type reached by applying an accessor to a value of a given
	 * type.
	 *
	 * @param type
	 * @param accessor
	 * @param location (for error reporting)
	 * @return
	 */
	private static Type step(Type type, Location.Accessor accessor, Object location) {
		if (accessor instanceof Location.Field && type instanceof Type.Struct) {
			Type field = ((Type.Struct) type).getField(((Location.Field) accessor).getName());
			if (field != null) {
				return field;
			}
		} else if (accessor instanceof Location.Key && type instanceof Type.Mapping) {
			return ((Type.Mapping) type).getValue();
		} else if (accessor instanceof Location.Index && type instanceof Type.Array) {
			return ((Type.Array) type).getElement();
		} else if (accessor instanceof Location.Length && type instanceof Type.Array) {
			return Type.Uint256;
		}
		throw new IllegalArgumentException("invalid access " + accessor + " on " + type + " in " + location);
	}

	/**
	 * Compute the raw storage slot of a given location. Struct fields are laid
	 * out in consecutive slots, mapping entries are placed at the hash of their
	 * key and base slot, whilst array elements are placed consecutively from the
	 * hash of their base slot. The length of an array lives in its base slot.
	 *
	 * @param location
	 * @return
	 */
	public Term slotOf(Location location) {
		Root root = roots.get(location.getRoot());
		Type type = root.getType();
		Term slot = CONST(root.getSlot());
		for (int i = 0; i != location.size(); ++i) {
			Location.Accessor a = location.get(i);
			if (a instanceof Location.Field) {
				Type.Struct struct = (Type.Struct) type;
				String name = ((Location.Field) a).getName();
				int offset = 0;
				while (!struct.getFields().get(offset).getName().equals(name)) {
					offset = offset + 1;
				}
				slot = ADD(slot, CONST(offset));
			} else if (a instanceof Location.Key) {
				slot = APPLY(MAPPING_SLOT, Sort.INT, ((Location.Key) a).getKey(), slot);
			} else if (a instanceof Location.Index) {
				slot = ADD(APPLY(ARRAY_SLOT, Sort.INT, slot), ((Location.Index) a).getIndex());
			}
			type = step(type, a, location);
		}
		return slot;
	}

	private void flatten(String root, String name, Type type, List<Type> keys) {
		if (type instanceof Type.Struct) {
			for (SpecFile.Decl.Parameter field : ((Type.Struct) type).getFields()) {
				flatten(root, name + "." + field.getName(), field.getType(), keys);
			}
		} else if (type instanceof Type.Mapping) {
			Type.Mapping m = (Type.Mapping) type;
			List<Type> nkeys = new ArrayList<>(keys);
			nkeys.add(m.getKey());
			flatten(root, name + "[]", m.getValue(), nkeys);
		} else if (type instanceof Type.Array) {
			shapes.put(name + ".length", new Shape(name + ".length", root, keys, Type.Uint256));
			List<Type> nkeys = new ArrayList<>(keys);
			nkeys.add(Type.Uint256);
			flatten(root, name + "[]", ((Type.Array) type).getElement(), nkeys);
		} else {
			shapes.put(name, new Shape(name, root, keys, type));
		}
	}

	// =========================================================================
	// Roots & Shapes
	// =========================================================================

	public static class Root {
		private final String name;
		private final Type type;
		private final BigInteger slot;

		public Root(String name, Type type, BigInteger slot) {
			this.name = name;
			this.type = type;
			this.slot = slot;
		}

		public String getName() {
			return name;
		}

		public Type getType() {
			return type;
		}

		public BigInteger getSlot() {
			return slot;
		}
	}

	/**
	 * A flattened component of a root, represented in the solver as a single
	 * (possibly nested) array indexed by its keys.
	 */
	public static class Shape {
		private final String name;
		private final String root;
		private final List<Type> keys;
		private final Type value;

		public Shape(String name, String root, List<Type> keys, Type value) {
			this.name = name;
			this.root = root;
			this.keys = Collections.unmodifiableList(new ArrayList<>(keys));
			this.value = value;
		}

		public String getName() {
			return name;
		}

		public String getRoot() {
			return root;
		}

		public List<Type> getKeyTypes() {
			return keys;
		}

		public Type getValueType() {
			return value;
		}

		/**
		 * Get the sort of the term representing this entire shape.
		 *
		 * @return
		 */
		public Sort getSort() {
			Sort sort = Types.toSort(value);
			for (int i = keys.size() - 1; i >= 0; --i) {
				sort = new Sort.Array(Types.toSort(keys.get(i)), sort);
			}
			return sort;
		}

		/**
		 * Get the term representing this entire shape in zero-initialised
		 * storage.
		 *
		 * @return
		 */
		public Term getZero() {
			Term zero = Types.zero(value);
			Sort sort = Types.toSort(value);
			for (int i = keys.size() - 1; i >= 0; --i) {
				sort = new Sort.Array(Types.toSort(keys.get(i)), sort);
				zero = CONST_ARRAY((Sort.Array) sort, zero);
			}
			return zero;
		}
	}
}
