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

import static specexec.core.Term.ITE;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

import specexec.core.CallData;
import specexec.core.Environment;
import specexec.core.MethodDescriptor;
import specexec.core.Term;

/**
 * Binds the names visible to a specification expression. Besides ordinary
 * values, a name may denote an environment, a method (for parametric rules) or
 * a calldata argument. Scopes nest, with inner bindings shadowing outer ones.
 *
 * @author David J. Pearce
 *
 */
public class Scope {
	private final Scope parent;
	private final LinkedHashMap<String, Term> values = new LinkedHashMap<>();
	private final HashMap<String, Environment> environments = new HashMap<>();
	private final HashMap<String, MethodDescriptor> methods = new HashMap<>();
	private final HashMap<String, CallData> calldata = new HashMap<>();

	public Scope() {
		this(null);
	}

	public Scope(Scope parent) {
		this.parent = parent;
	}

	public Scope getParent() {
		return parent;
	}

	public void declare(String name, Term value) {
		values.put(name, value);
	}

	public void declare(String name, Environment environment) {
		environments.put(name, environment);
	}

	public void declare(String name, MethodDescriptor method) {
		methods.put(name, method);
	}

	public void declare(String name, CallData data) {
		calldata.put(name, data);
	}

	/**
	 * Update a previously declared value.
	 *
	 * @param name
	 * @param value
	 */
	public void assign(String name, Term value) {
		for (Scope s = this; s != null; s = s.parent) {
			if (s.values.containsKey(name)) {
				s.values.put(name, value);
				return;
			}
		}
		throw new IllegalArgumentException("unknown variable: " + name);
	}

	public Term getValue(String name) {
		for (Scope s = this; s != null; s = s.parent) {
			Term t = s.values.get(name);
			if (t != null) {
				return t;
			}
		}
		return null;
	}

	public Environment getEnvironment(String name) {
		for (Scope s = this; s != null; s = s.parent) {
			Environment e = s.environments.get(name);
			if (e != null) {
				return e;
			}
		}
		return null;
	}

	public MethodDescriptor getMethod(String name) {
		for (Scope s = this; s != null; s = s.parent) {
			MethodDescriptor m = s.methods.get(name);
			if (m != null) {
				return m;
			}
		}
		return null;
	}

	public CallData getCallData(String name) {
		for (Scope s = this; s != null; s = s.parent) {
			CallData d = s.calldata.get(name);
			if (d != null) {
				return d;
			}
		}
		return null;
	}

	/**
	 * Take a copy of the values declared directly in this scope.
	 *
	 * @return
	 */
	public Map<String, Term> capture() {
		return new LinkedHashMap<>(values);
	}

	public void restore(Map<String, Term> image) {
		values.clear();
		values.putAll(image);
	}

	/**
	 * Join the values of two branches. Variables declared in only one branch go
	 * out of scope.
	 *
	 * @param condition
	 * @param trueBranch
	 * @param falseBranch
	 */
	public void merge(Term condition, Map<String, Term> trueBranch, Map<String, Term> falseBranch) {
		values.clear();
		for (Map.Entry<String, Term> e : trueBranch.entrySet()) {
			Term f = falseBranch.get(e.getKey());
			if (f != null) {
				values.put(e.getKey(), ITE(condition, e.getValue(), f));
			}
		}
	}
}
