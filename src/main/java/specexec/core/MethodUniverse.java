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
import java.util.List;
import java.util.function.Predicate;

/**
 * The closed set of externally callable methods of a target system, fixed at
 * load time. Quantification over "any method" is expressed by enumerating a
 * (filtered) subset of the universe, never by reflection.
 *
 * @author David J. Pearce
 *
 */
public class MethodUniverse {
	private final List<MethodDescriptor> methods;

	public MethodUniverse(List<MethodDescriptor> methods) {
		ArrayList<MethodDescriptor> ms = new ArrayList<>();
		for (MethodDescriptor m : methods) {
			if (ms.contains(m)) {
				throw new IllegalArgumentException("duplicate method: " + m);
			}
			ms.add(m);
		}
		this.methods = Collections.unmodifiableList(ms);
	}

	public List<MethodDescriptor> getAll() {
		return methods;
	}

	/**
	 * Get those methods satisfying a given predicate, in declaration order.
	 *
	 * @param predicate
	 * @return
	 */
	public List<MethodDescriptor> filter(Predicate<MethodDescriptor> predicate) {
		ArrayList<MethodDescriptor> rs = new ArrayList<>();
		for (MethodDescriptor m : methods) {
			if (predicate.test(m)) {
				rs.add(m);
			}
		}
		return rs;
	}

	/**
	 * Find a method by its signature or, where unambiguous, by its name alone.
	 *
	 * @param nameOrSignature
	 * @return The method, or <code>null</code> if there is none.
	 */
	public MethodDescriptor lookup(String nameOrSignature) {
		MethodDescriptor found = null;
		for (MethodDescriptor m : methods) {
			if (m.getSignature().equals(nameOrSignature)) {
				return m;
			} else if (m.getName().equals(nameOrSignature)) {
				if (found != null) {
					throw new IllegalArgumentException("ambiguous method name: " + nameOrSignature);
				}
				found = m;
			}
		}
		return found;
	}
}
