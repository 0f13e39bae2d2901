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

import static org.junit.Assert.*;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.Test;

import specexec.core.Term;

/**
 * Tests for bounding the number of open sessions.
 *
 * @author David J. Pearce
 *
 */
public class SolverPoolTest {

	/**
	 * A solver which answers everything as satisfiable, and counts the sessions
	 * open at any one time.
	 */
	private static class CountingSolver implements Solver {
		private final AtomicInteger open = new AtomicInteger();
		private final AtomicInteger peak = new AtomicInteger();
		private final List<Term> assumed = new ArrayList<>();

		@Override
		public Session open(int timeout) {
			peak.accumulateAndGet(open.incrementAndGet(), Math::max);
			return new Session() {
				@Override
				public void assume(Term constraint) {
					synchronized (assumed) {
						assumed.add(constraint);
					}
				}

				@Override
				public Result check(List<Term> goals, List<Term> observe) {
					return new Result(Status.SAT, null, null);
				}

				@Override
				public void cancel() {
				}

				@Override
				public void close() {
					open.decrementAndGet();
				}
			};
		}
	}

	@Test(expected = IllegalArgumentException.class)
	public void invalidCapacity() {
		new SolverPool(new CountingSolver(), 0);
	}

	@Test
	public void sessionsReturnPermits() {
		CountingSolver backend = new CountingSolver();
		SolverPool pool = new SolverPool(backend, 2);
		Solver.Session s = pool.open(100);
		assertEquals(1, pool.getAvailable());
		s.assume(Term.TRUE);
		assertEquals(Solver.Status.SAT, s.check(new ArrayList<>(), new ArrayList<>()).getStatus());
		s.close();
		// Closing twice releases only once
		s.close();
		assertEquals(2, pool.getAvailable());
		assertEquals(0, backend.open.get());
		assertEquals(1, backend.assumed.size());
	}

	@Test
	public void capacityBoundsConcurrentSessions() throws InterruptedException {
		final CountingSolver backend = new CountingSolver();
		final SolverPool pool = new SolverPool(backend, 2);
		final int n = 8;
		final CountDownLatch done = new CountDownLatch(n);
		for (int i = 0; i != n; ++i) {
			new Thread(() -> {
				try (Solver.Session s = pool.open(100)) {
					Thread.sleep(20);
				} catch (InterruptedException e) {
					Thread.currentThread().interrupt();
				} finally {
					done.countDown();
				}
			}).start();
		}
		assertTrue(done.await(30, TimeUnit.SECONDS));
		assertTrue(backend.peak.get() <= 2);
		assertEquals(2, pool.getAvailable());
	}
}
