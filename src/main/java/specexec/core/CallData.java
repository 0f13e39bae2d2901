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
import java.util.HashMap;
import java.util.List;
import java.util.function.Consumer;

import specexec.core.SpecFile.Type;

/**
 * Arbitrary arguments for an arbitrary method (a <code>calldataarg</code>).
 * Arguments are created on first use for each method and reused thereafter,
 * so that two calls of the same method with the same calldata receive the
 * same arguments.
 *
 * @author David J. Pearce
 *
 */
public class CallData {
	private final String name;
	private final HashMap<String, List<Term>> arguments;

	public CallData(String name) {
		this.name = name;
		this.arguments = new HashMap<>();
	}

	public String getName() {
		return name;
	}

	public List<Term> getArguments(MethodDescriptor method, Term.Generator generator, Consumer<Term> constraints) {
		String sig = method.getSignature();
		List<Term> args = arguments.get(sig);
		if (args == null) {
			args = new ArrayList<>();
			List<Type> types = method.getParameterTypes();
			for (int i = 0; i != types.size(); ++i) {
				Term arg = generator.fresh(name + "." + method.getName() + "." + i, Types.toSort(types.get(i)));
				constraints.accept(Types.domain(types.get(i), arg));
				args.add(arg);
			}
			arguments.put(sig, args);
		}
		return args;
	}
}
