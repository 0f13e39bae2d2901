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
package specexec.util;

import java.util.List;
import java.util.concurrent.Semaphore;

import specexec.core.Term;

/**
 * Bounds the number of sessions which may be open on an underlying solver at
 * any one time. Opening a session blocks until capacity is available.
 *
 * @author David J. Pearce
 *
 */
public class SolverPool implements Solver {
	private final Solver backend;
	private final Semaphore permits;

	public SolverPool(Solver backend, int capacity) {
		if (capacity < 1) {
			throw new IllegalArgumentException("invalid capacity: " + capacity);
		}
		this.backend = backend;
		this.permits = new Semaphore(capacity, true);
	}

	public int getAvailable() {
		return permits.availablePermits();
	}

	@Override
	public Session open(int timeout) {
		try {
			permits.acquire();
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new IllegalStateException("interrupted whilst waiting for solver", e);
		}
		try {
			return new PooledSession(backend.open(timeout));
		} catch (RuntimeException e) {
			permits.release();
			throw e;
		}
	}

	private class PooledSession implements Session {
		private final Session session;
		private boolean closed;

		public PooledSession(Session session) {
			this.session = session;
		}

		@Override
		public void assume(Term constraint) {
			session.assume(constraint);
		}

		@Override
		public Result check(List<Term> goals, List<Term> observe) {
			return session.check(goals, observe);
		}

		@Override
		public void cancel() {
			session.cancel();
		}

		@Override
		public synchronized void close() {
			if (!closed) {
				closed = true;
				try {
					session.close();
				} finally {
					permits.release();
				}
			}
		}
	}
}
