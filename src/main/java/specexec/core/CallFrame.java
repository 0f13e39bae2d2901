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
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.function.Consumer;

/**
 * The interface through which a target system executes a single method call.
 * The frame gives access to the call's arguments and environment, mediates
 * all storage accesses, and accumulates the condition under which the call
 * reverts.
 *
 * @author David J. Pearce
 *
 */
public class CallFrame {
	private final MethodDescriptor method;
	private final Environment environment;
	private final List<Term> arguments;
	private final StorageState storage;
	private final Generator generator;
	private final Consumer<Term> assumptions;
	private Term reverted = FALSE;
	private List<Term> returns = Collections.emptyList();
	private boolean environmentAccessed;

	public CallFrame(MethodDescriptor method, Environment environment, List<Term> arguments, StorageState storage,
			Generator generator, Consumer<Term> assumptions) {
		this.method = method;
		this.environment = environment;
		this.arguments = arguments;
		this.storage = storage;
		this.generator = generator;
		this.assumptions = assumptions;
	}

	public MethodDescriptor getMethod() {
		return method;
	}

	/**
	 * Get the calling environment. Accessing the environment is recorded, such
	 * that methods declared independent of it can be checked.
	 *
	 * @return
	 */
	public Environment getEnvironment() {
		environmentAccessed = true;
		return environment;
	}

	public boolean isEnvironmentAccessed() {
		return environmentAccessed;
	}

	public Term getArgument(int i) {
		return arguments.get(i);
	}

	public List<Term> getArguments() {
		return arguments;
	}

	/**
	 * Load a value from storage.
	 *
	 * @param location
	 * @return
	 */
	public Term load(Location location) {
		return storage.load(location);
	}

	/**
	 * Write a value to storage.
	 *
	 * @param location
	 * @param value
	 * @throws ModelingException if the method is declared not to modify storage
	 */
	public void write(Location location, Term value) {
		if (method.isReadOnly()) {
			throw new ModelingException(method + " is declared " + method.getMutability().toString().toLowerCase()
					+ " but writes " + location);
		}
		storage.write(location, value);
	}

	/**
	 * Revert the call whenever a given condition does not hold.
	 *
	 * @param condition
	 */
	public void require(Term condition) {
		revertIf(NOT(condition));
	}

	/**
	 * Revert the call whenever a given condition holds.
	 *
	 * @param condition
	 */
	public void revertIf(Term condition) {
		reverted = OR(reverted, condition);
	}

	/**
	 * Revert the call unconditionally.
	 *
	 * @param reason
	 */
	public void revert(String reason) {
		throw new RevertException(reason);
	}

	/**
	 * Constrain the values in this call, for example to describe the result of
	 * an external call whose effects are not modelled.
	 *
	 * @param condition
	 */
	public void assume(Term condition) {
		assumptions.accept(condition);
	}

	/**
	 * Create an arbitrary value.
	 *
	 * @param name
	 * @param sort
	 * @return
	 */
	public Term fresh(String name, Sort sort) {
		return generator.fresh(name, sort);
	}

	public void setReturns(Term... values) {
		this.returns = new ArrayList<>(Arrays.asList(values));
	}

	public List<Term> getReturns() {
		return returns;
	}

	/**
	 * Get the condition under which this call reverts.
	 *
	 * @return
	 */
	public Term getReverted() {
		return reverted;
	}
}
