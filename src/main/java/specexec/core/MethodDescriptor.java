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
import java.util.Collections;
import java.util.List;

import specexec.core.SpecFile.Type;

/**
 * Describes an externally callable method of a target system: its signature,
 * its state mutability and its selector. Descriptors are immutable and
 * identified by their declaring contract and signature.
 *
 * @author David J. Pearce
 *
 */
public class MethodDescriptor {
	public enum Mutability {
		PURE, VIEW, NONPAYABLE, PAYABLE
	}

	private final String contract;
	private final String name;
	private final List<Type> parameters;
	private final List<Type> returns;
	private final Mutability mutability;
	private final BigInteger selector;

	public MethodDescriptor(String contract, String name, List<Type> parameters, List<Type> returns,
			Mutability mutability, BigInteger selector) {
		this.contract = contract;
		this.name = name;
		this.parameters = Collections.unmodifiableList(new ArrayList<>(parameters));
		this.returns = Collections.unmodifiableList(new ArrayList<>(returns));
		this.mutability = mutability;
		this.selector = selector;
	}

	public String getContract() {
		return contract;
	}

	public String getName() {
		return name;
	}

	/**
	 * Get the canonical signature of this method, such as
	 * <code>transfer(address,uint256)</code>.
	 *
	 * @return
	 */
	public String getSignature() {
		StringBuilder sb = new StringBuilder(name);
		sb.append("(");
		for (int i = 0; i != parameters.size(); ++i) {
			if (i != 0) {
				sb.append(",");
			}
			sb.append(parameters.get(i));
		}
		sb.append(")");
		return sb.toString();
	}

	public List<Type> getParameterTypes() {
		return parameters;
	}

	public List<Type> getReturnTypes() {
		return returns;
	}

	public int getNumberOfArguments() {
		return parameters.size();
	}

	public Mutability getMutability() {
		return mutability;
	}

	public boolean isView() {
		return mutability == Mutability.VIEW;
	}

	public boolean isPure() {
		return mutability == Mutability.PURE;
	}

	/**
	 * Check whether this method is declared not to modify storage.
	 *
	 * @return
	 */
	public boolean isReadOnly() {
		return mutability == Mutability.VIEW || mutability == Mutability.PURE;
	}

	public boolean isPayable() {
		return mutability == Mutability.PAYABLE;
	}

	public BigInteger getSelector() {
		return selector;
	}

	@Override
	public boolean equals(Object o) {
		if (o instanceof MethodDescriptor) {
			MethodDescriptor m = (MethodDescriptor) o;
			return m.contract.equals(contract) && m.getSignature().equals(getSignature());
		}
		return false;
	}

	@Override
	public int hashCode() {
		return contract.hashCode() ^ getSignature().hashCode();
	}

	@Override
	public String toString() {
		return contract + "." + getSignature();
	}
}
