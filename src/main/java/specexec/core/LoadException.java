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

/**
 * Signals that a specification is malformed with respect to the target system
 * it is checked against (e.g. a hook pattern whose types do not match the
 * storage layout). Such errors are detected before any check is run and
 * prevent the whole batch from starting.
 *
 * @author David J. Pearce
 *
 */
public class LoadException extends RuntimeException {
	private static final long serialVersionUID = 1L;

	private final SpecFile.Item item;

	public LoadException(String message) {
		this(message, null);
	}

	public LoadException(String message, SpecFile.Item item) {
		super(message);
		this.item = item;
	}

	/**
	 * Get the item responsible for this error (if known).
	 *
	 * @return
	 */
	public SpecFile.Item getItem() {
		return item;
	}

	@Override
	public String getMessage() {
		SpecFile.Position p = item == null ? null : item.getAttribute(SpecFile.Position.class);
		return p == null ? super.getMessage() : p + ": " + super.getMessage();
	}
}
