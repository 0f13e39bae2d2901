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

import java.util.HashMap;
import java.util.function.Supplier;

import specexec.core.StorageState;

/**
 * Named images of storage, taken with <code>storage s = lastStorage</code>.
 * Ghosts are not part of a snapshot.
 *
 * @author David J. Pearce
 *
 */
public class SnapshotManager {
	/**
	 * The name which always refers to the current storage.
	 */
	public static final String LAST_STORAGE = "lastStorage";

	private final StorageState storage;
	private final HashMap<String, StorageState.Snapshot> snapshots = new HashMap<>();

	public SnapshotManager(StorageState storage) {
		this.storage = storage;
	}

	public StorageState.Snapshot capture(String name) {
		StorageState.Snapshot s = storage.snapshot();
		snapshots.put(name, s);
		return s;
	}

	public boolean contains(String name) {
		return LAST_STORAGE.equals(name) || snapshots.containsKey(name);
	}

	public StorageState.Snapshot get(String name) {
		if (LAST_STORAGE.equals(name)) {
			return storage.snapshot();
		}
		StorageState.Snapshot s = snapshots.get(name);
		if (s == null) {
			throw new IllegalArgumentException("unknown snapshot: " + name);
		}
		return s;
	}

	/**
	 * Evaluate something against a snapshot, rather than the current storage.
	 * Storage is left exactly as it was beforehand, even if evaluation fails,
	 * and no hooks fire for accesses made during evaluation.
	 *
	 * @param name
	 * @param fn
	 * @return
	 */
	public <T> T evaluateAt(String name, Supplier<T> fn) {
		StorageState.Snapshot target = get(name);
		StorageState.Snapshot live = storage.snapshot();
		boolean muted = storage.isMuted();
		storage.setMuted(true);
		storage.restore(target);
		try {
			return fn.get();
		} finally {
			storage.restore(live);
			storage.setMuted(muted);
		}
	}

	/**
	 * Make a snapshot the current storage. This does not fire any hooks.
	 *
	 * @param name
	 */
	public void restore(String name) {
		storage.restore(get(name));
	}
}
