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

import java.util.List;

/**
 * The system being checked, consumed as an opaque transition function over
 * storage. The engine never inspects a target system beyond its declared
 * storage layout and method surface.
 *
 * @author David J. Pearce
 *
 */
public interface TargetSystem {

	/**
	 * Get the name of the contract implementing this system.
	 *
	 * @return
	 */
	public String getName();

	public StorageLayout getLayout();

	/**
	 * Get the externally callable methods of this system.
	 *
	 * @return
	 */
	public List<MethodDescriptor> getMethods();

	/**
	 * Get the constructor of this system, or <code>null</code> if storage is
	 * simply zero-initialised.
	 *
	 * @return
	 */
	public MethodDescriptor getConstructor();

	/**
	 * Execute a method (or the constructor) within a given frame. Storage must
	 * be accessed only through the frame. A method may revert conditionally
	 * through {@link CallFrame#require(Term)} or unconditionally by throwing a
	 * {@link RevertException}.
	 *
	 * @param method
	 * @param frame
	 */
	public void apply(MethodDescriptor method, CallFrame frame);
}
