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

import static specexec.core.Term.*;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import specexec.core.CallFrame;
import specexec.core.Environment;
import specexec.core.GhostStore;
import specexec.core.MethodDescriptor;
import specexec.core.RevertException;
import specexec.core.StorageState;
import specexec.core.TargetSystem;
import specexec.core.Term;
import specexec.core.VerificationCondition;

/**
 * Invokes methods of the target system against the current storage. A call
 * made without <code>@withrevert</code> simply assumes the method does not
 * revert. Otherwise, the call may revert, in which case storage and all
 * non-persistent ghosts are rolled back to their values before the call, and
 * <code>lastReverted</code> records the revert condition.
 *
 * A method which is not payable always reverts when sent a non-zero value.
 *
 * @author David J. Pearce
 *
 */
public class CallExecutor {
	private static final Logger logger = LoggerFactory.getLogger(CallExecutor.class);

	private final TargetSystem target;
	private final StorageState storage;
	private final GhostStore ghosts;
	private final Generator generator;
	private final VerificationCondition vc;
	private Term lastReverted = FALSE;

	public CallExecutor(TargetSystem target, StorageState storage, GhostStore ghosts, Generator generator,
			VerificationCondition vc) {
		this.target = target;
		this.storage = storage;
		this.ghosts = ghosts;
		this.generator = generator;
		this.vc = vc;
	}

	public Term getLastReverted() {
		return lastReverted;
	}

	public void setLastReverted(Term condition) {
		this.lastReverted = condition;
	}

	/**
	 * Construct the environment used for a call to an envfree method. Since such
	 * a method does not observe its environment, the sender is arbitrary, but no
	 * value is sent.
	 *
	 * @return
	 */
	public Environment envfree() {
		Environment e = Environment.fresh("envfree", generator, vc::constrain);
		return e.withValue(ZERO);
	}

	/**
	 * Call a method, assuming it does not revert.
	 *
	 * @param method
	 * @param environment
	 * @param arguments
	 * @return
	 */
	public Result invoke(MethodDescriptor method, Environment environment, List<Term> arguments) {
		Result r = execute(method, environment, arguments);
		vc.assume(NOT(r.getReverted()), method + " does not revert");
		lastReverted = FALSE;
		return r;
	}

	/**
	 * Call a method which may revert.
	 *
	 * @param method
	 * @param environment
	 * @param arguments
	 * @return
	 */
	public Result invokeOrRevert(MethodDescriptor method, Environment environment, List<Term> arguments) {
		StorageState.Snapshot storageBefore = storage.snapshot();
		GhostStore.Snapshot ghostsBefore = ghosts.snapshot();
		Result r = execute(method, environment, arguments);
		Term reverted = r.getReverted();
		if (!reverted.isFalse()) {
			storage.merge(reverted, storageBefore, storage.snapshot());
			ghosts.merge(reverted, ghostsBefore, ghosts.snapshot(), false);
		}
		lastReverted = reverted;
		return r;
	}

	private Result execute(MethodDescriptor method, Environment environment, List<Term> arguments) {
		if (arguments.size() != method.getNumberOfArguments()) {
			throw new IllegalArgumentException(
					method + " expects " + method.getNumberOfArguments() + " argument(s), found " + arguments.size());
		}
		logger.debug("calling {}", method);
		CallFrame frame = new CallFrame(method, environment, arguments, storage, generator,
				t -> vc.assume(t, "assumption within " + method));
		if (!method.isPayable()) {
			frame.revertIf(NEQ(environment.getValue(), ZERO));
		}
		try {
			target.apply(method, frame);
		} catch (RevertException e) {
			logger.debug("{} reverted: {}", method, e.getMessage());
			frame.revertIf(TRUE);
		}
		Term reverted = frame.getReverted();
		vc.recordCall(method, environment, arguments, reverted);
		return new Result(reverted, frame.getReturns(), frame.isEnvironmentAccessed());
	}

	public static class Result {
		private final Term reverted;
		private final List<Term> returns;
		private final boolean environmentAccessed;

		public Result(Term reverted, List<Term> returns, boolean environmentAccessed) {
			this.reverted = reverted;
			this.returns = returns;
			this.environmentAccessed = environmentAccessed;
		}

		public Term getReverted() {
			return reverted;
		}

		public List<Term> getReturns() {
			return returns;
		}

		public boolean isEnvironmentAccessed() {
			return environmentAccessed;
		}
	}
}
