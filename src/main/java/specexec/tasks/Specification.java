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

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import specexec.core.MethodDescriptor;
import specexec.core.MethodUniverse;
import specexec.core.SpecFile.Decl;
import specexec.core.TargetSystem;

/**
 * A specification which has been checked against a particular target system,
 * and is therefore ready to be instantiated into verification units. Once
 * loaded, a specification is never modified and may be shared between
 * threads.
 *
 * @author David J. Pearce
 *
 */
public class Specification {
	private final TargetSystem target;
	private final MethodUniverse universe;
	private final List<Decl.Ghost> ghosts = new ArrayList<>();
	private final List<Decl.Hook> hooks = new ArrayList<>();
	private final Map<String, Decl.Definition> definitions = new LinkedHashMap<>();
	private final Map<String, Decl.Invariant> invariants = new LinkedHashMap<>();
	private final List<Decl.Rule> rules = new ArrayList<>();
	private final Set<MethodDescriptor> envfree = new HashSet<>();

	public Specification(TargetSystem target, MethodUniverse universe) {
		this.target = target;
		this.universe = universe;
	}

	public TargetSystem getTarget() {
		return target;
	}

	public MethodUniverse getUniverse() {
		return universe;
	}

	public List<Decl.Ghost> getGhosts() {
		return Collections.unmodifiableList(ghosts);
	}

	public List<Decl.Hook> getHooks() {
		return Collections.unmodifiableList(hooks);
	}

	public Map<String, Decl.Definition> getDefinitions() {
		return Collections.unmodifiableMap(definitions);
	}

	public Map<String, Decl.Invariant> getInvariants() {
		return Collections.unmodifiableMap(invariants);
	}

	public Decl.Invariant getInvariant(String name) {
		return invariants.get(name);
	}

	public List<Decl.Rule> getRules() {
		return Collections.unmodifiableList(rules);
	}

	public boolean isEnvfree(MethodDescriptor method) {
		return envfree.contains(method);
	}

	// Only the loader populates a specification

	void add(Decl.Ghost ghost) {
		ghosts.add(ghost);
	}

	void add(Decl.Hook hook) {
		hooks.add(hook);
	}

	void add(Decl.Definition definition) {
		definitions.put(definition.getName(), definition);
	}

	void add(Decl.Invariant invariant) {
		invariants.put(invariant.getName(), invariant);
	}

	void add(Decl.Rule rule) {
		rules.add(rule);
	}

	void addEnvfree(MethodDescriptor method) {
		envfree.add(method);
	}
}
