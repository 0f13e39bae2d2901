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
 * Signals that the target system behaved inconsistently with how it was
 * declared, such as a method declared <code>view</code> writing to storage.
 * This is fatal for the check in which it arises, but not for others.
 *
 * @author David J. Pearce
 *
 */
public class ModelingException extends RuntimeException {
	private static final long serialVersionUID = 1L;

	public ModelingException(String message) {
		super(message);
	}
}
