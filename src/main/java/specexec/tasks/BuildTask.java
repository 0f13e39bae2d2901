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

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import specexec.core.SpecFile;
import specexec.core.TargetSystem;
import specexec.core.Verdict;
import specexec.util.Solver;
import specexec.util.SolverPool;
import specexec.util.Z3Solver;

/**
 * Verifies one or more specification files against a target system. The
 * specification is first loaded (which fails with a
 * {@link specexec.core.LoadException} before anything runs if it is
 * malformed), then instantiated into units which are verified concurrently.
 * Verdicts are always returned in unit order, regardless of the order in
 * which units complete.
 *
 * @author David J. Pearce
 *
 */
public class BuildTask {
	private static final Logger logger = LoggerFactory.getLogger(BuildTask.class);

	/**
	 * The system being verified.
	 */
	private final TargetSystem target;
	/**
	 * The set of specification files to verify against.
	 */
	private final List<SpecFile> sources = new ArrayList<>();
	/**
	 * Handle for the default solver.
	 */
	private final Z3Solver z3 = new Z3Solver();
	/**
	 * Solver to use, or <code>null</code> for the default.
	 */
	private Solver solver;
	/**
	 * Specify debugging mode (this logs every query)
	 */
	private boolean debug = false;
	/**
	 * Specify whether to print verbose progress messages or not
	 */
	private boolean verbose = false;
	/**
	 * Solver query timeout (in seconds)
	 */
	private int timeout = 10;
	/**
	 * Timeout for the entire batch (in seconds), or zero for none.
	 */
	private int globalTimeout = 0;
	/**
	 * Number of units verified concurrently.
	 */
	private int threads = Runtime.getRuntime().availableProcessors();
	private PrintStream output = System.out;
	private boolean expired;

	public BuildTask(TargetSystem target) {
		this.target = target;
	}

	public BuildTask setDebug(boolean flag) {
		this.debug = flag;
		return this;
	}

	public BuildTask setVerbose(boolean flag) {
		this.verbose = flag;
		return this;
	}

	public BuildTask setTimeout(int timeout) {
		this.timeout = timeout;
		return this;
	}

	public BuildTask setGlobalTimeout(int timeout) {
		this.globalTimeout = timeout;
		return this;
	}

	public BuildTask setThreads(int threads) {
		if (threads < 1) {
			throw new IllegalArgumentException("invalid number of threads: " + threads);
		}
		this.threads = threads;
		return this;
	}

	public BuildTask setSolverOption(String key, String value) {
		z3.setOption(key, value);
		return this;
	}

	public BuildTask setSolver(Solver solver) {
		this.solver = solver;
		return this;
	}

	public BuildTask setOutput(PrintStream output) {
		this.output = output;
		return this;
	}

	public BuildTask addSource(SpecFile f) {
		this.sources.add(f);
		return this;
	}

	public BuildTask addSources(Collection<SpecFile> fs) {
		this.sources.addAll(fs);
		return this;
	}

	public List<SpecFile> getSources() {
		return this.sources;
	}

	public List<Verdict> run() {
		// Combine source files into one
		SpecFile combined = new SpecFile();
		for (SpecFile f : sources) {
			combined.getDeclarations().addAll(f.getDeclarations());
		}
		Specification spec = new SpecLoader(target).load(combined);
		List<SpecItem> items = SpecLoader.instantiate(spec);
		logger.info("verifying {} unit(s) of {} on {} thread(s)", items.size(), target.getName(), threads);
		Solver backend = solver != null ? solver : z3.setDebug(debug);
		SolverPool pool = new SolverPool(backend, threads);
		ArrayList<VerifyTask> tasks = new ArrayList<>();
		for (SpecItem item : items) {
			tasks.add(new VerifyTask(spec, item, pool).setTimeout(timeout * 1000));
		}
		List<Verdict> verdicts = execute(tasks);
		report(verdicts);
		logger.info("verified {} unit(s) of {}", verdicts.size(), target.getName());
		return verdicts;
	}

	private List<Verdict> execute(List<VerifyTask> tasks) {
		expired = false;
		ExecutorService executor = Executors.newFixedThreadPool(threads);
		try {
			ArrayList<Future<Verdict>> futures = new ArrayList<>();
			for (VerifyTask t : tasks) {
				futures.add(executor.submit(t));
			}
			long deadline = System.currentTimeMillis() + globalTimeout * 1000L;
			ArrayList<Verdict> verdicts = new ArrayList<>();
			for (int i = 0; i != futures.size(); ++i) {
				verdicts.add(await(futures.get(i), tasks.get(i), tasks, deadline));
			}
			return verdicts;
		} finally {
			executor.shutdownNow();
		}
	}

	private Verdict await(Future<Verdict> future, VerifyTask task, List<VerifyTask> tasks, long deadline) {
		try {
			if (globalTimeout > 0 && !expired) {
				long remaining = deadline - System.currentTimeMillis();
				try {
					return future.get(Math.max(remaining, 0), TimeUnit.MILLISECONDS);
				} catch (TimeoutException e) {
					logger.info("global timeout of {}s exceeded", globalTimeout);
					expired = true;
					// Cancelled tasks complete promptly with an unknown verdict
					for (VerifyTask t : tasks) {
						t.cancel();
					}
				}
			}
			return future.get();
		} catch (ExecutionException e) {
			Throwable cause = e.getCause();
			logger.error("verification failed", cause);
			return new Verdict(task.getItem().getName(), Verdict.Status.ERROR, String.valueOf(cause.getMessage()),
					null);
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			for (VerifyTask t : tasks) {
				t.cancel();
			}
			return new Verdict(task.getItem().getName(), Verdict.Status.UNKNOWN, "interrupted", null);
		}
	}

	private void report(List<Verdict> verdicts) {
		if (!verbose) {
			return;
		}
		for (Verdict v : verdicts) {
			if (v.getStatus() != Verdict.Status.PROVED) {
				output.println("=================================================");
				output.println(v.getStatus() + ": " + v.getName());
				output.println("=================================================");
				if (v.getReason() != null) {
					output.println(v.getReason());
				}
				if (v.getCounterexample() != null) {
					output.print(v.getCounterexample());
				}
			}
		}
	}
}
