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

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.function.Consumer;

import specexec.core.SpecFile.Type;

/**
 * The calling environment of a method: the caller, the value sent with the
 * call and the current block.
 *
 * @author David J. Pearce
 *
 */
public class Environment {
	public static final String MSG_SENDER = "msg.sender";
	public static final String MSG_VALUE = "msg.value";
	public static final String BLOCK_TIMESTAMP = "block.timestamp";
	public static final String BLOCK_NUMBER = "block.number";

	public static final List<String> FIELDS = Collections
			.unmodifiableList(Arrays.asList(MSG_SENDER, MSG_VALUE, BLOCK_TIMESTAMP, BLOCK_NUMBER));

	private final Term sender;
	private final Term value;
	private final Term timestamp;
	private final Term number;

	public Environment(Term sender, Term value, Term timestamp, Term number) {
		this.sender = sender;
		this.value = value;
		this.timestamp = timestamp;
		this.number = number;
	}

	/**
	 * Construct an arbitrary environment, whose fields are constrained only by
	 * their types.
	 *
	 * @param name
	 * @param generator
	 * @param constraints
	 * @return
	 */
	public static Environment fresh(String name, Term.Generator generator, Consumer<Term> constraints) {
		Term sender = generator.fresh(name + "." + MSG_SENDER, Term.Sort.INT);
		Term value = generator.fresh(name + "." + MSG_VALUE, Term.Sort.INT);
		Term timestamp = generator.fresh(name + "." + BLOCK_TIMESTAMP, Term.Sort.INT);
		Term number = generator.fresh(name + "." + BLOCK_NUMBER, Term.Sort.INT);
		constraints.accept(Types.domain(Type.Address, sender));
		constraints.accept(Types.domain(Type.Uint256, value));
		constraints.accept(Types.domain(Type.Uint256, timestamp));
		constraints.accept(Types.domain(Type.Uint256, number));
		return new Environment(sender, value, timestamp, number);
	}

	public Term getSender() {
		return sender;
	}

	public Term getValue() {
		return value;
	}

	public Term getTimestamp() {
		return timestamp;
	}

	public Term getNumber() {
		return number;
	}

	/**
	 * Get a field by its qualified name, such as <code>msg.sender</code>.
	 *
	 * @param field
	 * @return
	 */
	public Term get(String field) {
		switch (field) {
		case MSG_SENDER:
			return sender;
		case MSG_VALUE:
			return value;
		case BLOCK_TIMESTAMP:
			return timestamp;
		case BLOCK_NUMBER:
			return number;
		default:
			throw new IllegalArgumentException("unknown environment field: " + field);
		}
	}

	/**
	 * Get a copy of this environment with a different value sent.
	 *
	 * @param value
	 * @return
	 */
	public Environment withValue(Term value) {
		return new Environment(sender, value, timestamp, number);
	}
}
