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

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import specexec.core.Location;
import specexec.core.SpecFile.Decl;
import specexec.core.SpecFile.Expr;
import specexec.core.SpecFile.Pattern;
import specexec.core.StorageLayout;
import specexec.core.StorageState;
import specexec.core.Term;

/**
 * Routes storage accesses made by the target system to the hooks whose
 * patterns match them. Hooks fire in declaration order, and each matching hook
 * fires exactly once per access. Where a pattern matches only for particular
 * key values (e.g. <code>balances[0]</code>) and the accessed key is symbolic,
 * the hook fires under the guard that the key takes that value.
 *
 * Accesses made whilst a hook body executes are not dispatched again.
 *
 * @author David J. Pearce
 *
 */
public class HookDispatcher implements StorageState.Observer {
	private static final Logger logger = LoggerFactory.getLogger(HookDispatcher.class);

	/**
	 * Executes the body of a hook.
	 */
	public interface Trigger {
		/**
		 * Execute a hook body.
		 *
		 * @param hook
		 * @param bindings the values of the hook's parameters
		 * @param guard    the condition under which the hook actually matched
		 */
		public void fire(Decl.Hook hook, Map<String, Term> bindings, Term guard);
	}

	private final StorageLayout layout;
	private final List<Decl.Hook> hooks = new ArrayList<>();
	private Trigger trigger;
	private boolean dispatching;

	public HookDispatcher(StorageLayout layout) {
		this.layout = layout;
	}

	public HookDispatcher register(Decl.Hook hook) {
		hooks.add(hook);
		return this;
	}

	public HookDispatcher setTrigger(Trigger trigger) {
		this.trigger = trigger;
		return this;
	}

	@Override
	public void onWrite(Location location, Term oldValue, Term newValue) {
		dispatch(true, location, oldValue, newValue);
	}

	@Override
	public void onRead(Location location, Term value) {
		dispatch(false, location, null, value);
	}

	private void dispatch(boolean write, Location location, Term oldValue, Term value) {
		if (dispatching || trigger == null) {
			return;
		}
		dispatching = true;
		try {
			for (Decl.Hook hook : hooks) {
				if (hook.isWrite() != write) {
					continue;
				}
				LinkedHashMap<String, Term> bindings = new LinkedHashMap<>();
				Term guard = hook.isWildcard() ? bindWildcard(hook, location, value, bindings)
						: match(hook.getPattern(), location, bindings);
				if (guard == null || guard.isFalse()) {
					continue;
				}
				if (!hook.isWildcard()) {
					bindings.put(hook.getValue().getName(), value);
					if (hook.getOldValue() != null) {
						bindings.put(hook.getOldValue().getName(), oldValue);
					}
				}
				logger.trace("{} matched {}", hook.getName(), location);
				trigger.fire(hook, bindings, guard);
			}
		} finally {
			dispatching = false;
		}
	}

	private Term bindWildcard(Decl.Hook hook, Location location, Term value, Map<String, Term> bindings) {
		bindings.put(hook.getSlot().getName(), layout.slotOf(location));
		// Raw slots hold words, hence booleans are seen as 0 or 1
		Term word = value.getSort() == Sort.BOOL ? ITE(value, ONE, ZERO) : value;
		bindings.put(hook.getValue().getName(), word);
		return TRUE;
	}

	/**
	 * Match a pattern against a concrete location, binding the pattern's key
	 * variables.
	 *
	 * @param pattern
	 * @param location
	 * @param bindings
	 * @return The condition under which the location matches, or
	 *         <code>null</code> if it cannot match.
	 */
	public static Term match(Pattern pattern, Location location, Map<String, Term> bindings) {
		List<Pattern.Accessor> accessors = pattern.getAccessors();
		if (!pattern.getRoot().equals(location.getRoot()) || accessors.size() != location.size()) {
			return null;
		}
		ArrayList<Term> guard = new ArrayList<>();
		for (int i = 0; i != accessors.size(); ++i) {
			Pattern.Accessor p = accessors.get(i);
			Location.Accessor l = location.get(i);
			if (p instanceof Pattern.Field) {
				if (!(l instanceof Location.Field)
						|| !((Pattern.Field) p).getName().equals(((Location.Field) l).getName())) {
					return null;
				}
			} else if (p instanceof Pattern.Key) {
				if (!(l instanceof Location.Key)) {
					return null;
				}
				bindings.put(((Pattern.Key) p).getBinder().getName(), ((Location.Key) l).getKey());
			} else if (p instanceof Pattern.Index) {
				if (!(l instanceof Location.Index)) {
					return null;
				}
				bindings.put(((Pattern.Index) p).getBinder().getName(), ((Location.Index) l).getIndex());
			} else if (p instanceof Pattern.Constant) {
				Term key;
				if (l instanceof Location.Key) {
					key = ((Location.Key) l).getKey();
				} else if (l instanceof Location.Index) {
					key = ((Location.Index) l).getIndex();
				} else {
					return null;
				}
				guard.add(EQ(key, toConstant(((Pattern.Constant) p).getValue())));
			} else if (!(l instanceof Location.Length)) {
				return null;
			}
		}
		return AND(guard);
	}

	private static Term toConstant(Expr e) {
		if (e instanceof Expr.Integer) {
			return CONST(((Expr.Integer) e).getValue());
		} else if (e instanceof Expr.Boolean) {
			return CONST(((Expr.Boolean) e).getValue());
		} else {
			throw new IllegalArgumentException("invalid pattern constant: " + e);
		}
	}
}
