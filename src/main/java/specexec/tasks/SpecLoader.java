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

import static specexec.core.Term.ZERO;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import specexec.core.CallData;
import specexec.core.Environment;
import specexec.core.GhostStore;
import specexec.core.LoadException;
import specexec.core.Location;
import specexec.core.MethodDescriptor;
import specexec.core.MethodUniverse;
import specexec.core.ModelingException;
import specexec.core.SpecFile;
import specexec.core.SpecFile.Decl;
import specexec.core.SpecFile.Expr;
import specexec.core.SpecFile.Path;
import specexec.core.SpecFile.Pattern;
import specexec.core.SpecFile.Stmt;
import specexec.core.SpecFile.Type;
import specexec.core.StorageLayout;
import specexec.core.StorageState;
import specexec.core.TargetSystem;
import specexec.core.Term;
import specexec.core.Types;
import specexec.core.VerificationCondition;
import specexec.util.AbstractExpressionFold;
import specexec.util.AbstractStatementVisitor;

/**
 * Checks a specification against a target system, producing a
 * {@link Specification} which is ready for verification. All problems detected
 * here are reported as a {@link LoadException}, and prevent any verification
 * unit from running. This includes malformed hook patterns, references to
 * unknown methods, ghosts, definitions or invariants, filters which are not
 * declarative, and methods whose behaviour contradicts their declaration
 * (e.g. a view method which writes storage).
 *
 * @author David J. Pearce
 *
 */
public class SpecLoader {
	private static final Logger logger = LoggerFactory.getLogger(SpecLoader.class);

	private final TargetSystem target;
	private final MethodUniverse universe;

	public SpecLoader(TargetSystem target) {
		this.target = target;
		this.universe = new MethodUniverse(target.getMethods());
	}

	public MethodUniverse getUniverse() {
		return universe;
	}

	/**
	 * Check a specification file against the target system.
	 *
	 * @param file
	 * @return
	 * @throws LoadException
	 */
	public Specification load(SpecFile file) {
		Specification spec = new Specification(target, universe);
		Set<String> names = new HashSet<>();
		Set<String> sorts = new HashSet<>();
		// Sorts come first, since any other declaration may use them
		for (Decl.Sort s : file.getDeclarations(Decl.Sort.class)) {
			declare(names, s);
			sorts.add(s.getName());
		}
		for (Decl d : file.getDeclarations()) {
			if (d instanceof Decl.Sort) {
				continue;
			} else if (d instanceof Decl.MethodSpec) {
				checkMethodSpec(spec, (Decl.MethodSpec) d);
			} else if (d instanceof Decl.Ghost) {
				declare(names, d);
				checkGhost((Decl.Ghost) d, sorts);
				spec.add((Decl.Ghost) d);
			} else if (d instanceof Decl.Hook) {
				checkHook((Decl.Hook) d);
				spec.add((Decl.Hook) d);
			} else if (d instanceof Decl.Definition) {
				declare(names, d);
				spec.add((Decl.Definition) d);
			} else if (d instanceof Decl.Rule) {
				declare(names, d);
				checkFilters((Decl.Rule) d);
				spec.add((Decl.Rule) d);
			} else if (d instanceof Decl.Invariant) {
				declare(names, d);
				checkFilter(((Decl.Invariant) d).getFilter());
				spec.add((Decl.Invariant) d);
			} else {
				throw new LoadException("unknown declaration", d);
			}
		}
		new ReferenceChecker(spec, sorts).check(file);
		probe(spec);
		logger.debug("loaded {} rule(s), {} invariant(s) against {}", spec.getRules().size(),
				spec.getInvariants().size(), target.getName());
		return spec;
	}

	private static void declare(Set<String> names, Decl d) {
		if (!names.add(d.getName())) {
			throw new LoadException("duplicate declaration " + d.getName(), d);
		}
	}

	private void checkMethodSpec(Specification spec, Decl.MethodSpec d) {
		MethodDescriptor m = lookup(d.getName(), d);
		if (m == null) {
			throw new LoadException("unknown method " + d.getName(), d);
		}
		if (d.isEnvfree()) {
			spec.addEnvfree(m);
		}
	}

	private MethodDescriptor lookup(String name, SpecFile.Item item) {
		try {
			return universe.lookup(name);
		} catch (IllegalArgumentException e) {
			throw new LoadException(e.getMessage(), item);
		}
	}

	private static void checkGhost(Decl.Ghost ghost, Set<String> sorts) {
		for (Type key : ghost.getKeyTypes()) {
			checkType(key, sorts, ghost);
			if (!Types.isValueType(key)) {
				throw new LoadException("ghost key type " + key + " is not a value type", ghost);
			}
		}
		checkType(ghost.getValueType(), sorts, ghost);
		if (!Types.isValueType(ghost.getValueType())) {
			throw new LoadException("ghost value type " + ghost.getValueType() + " is not a value type", ghost);
		}
	}

	/**
	 * Check a type is well-formed. That is, every struct is qualified by its
	 * declaring contract, and every uninterpreted sort has been declared.
	 *
	 * @param type
	 * @param sorts
	 * @param item
	 */
	private static void checkType(Type type, Set<String> sorts, SpecFile.Item item) {
		if (type instanceof Type.Struct) {
			Type.Struct s = (Type.Struct) type;
			if (!s.isQualified()) {
				throw new LoadException("struct type " + s.getName() + " must be qualified by its contract", item);
			}
			for (Decl.Parameter f : s.getFields()) {
				checkType(f.getType(), sorts, item);
			}
		} else if (type instanceof Type.Mapping) {
			checkType(((Type.Mapping) type).getKey(), sorts, item);
			checkType(((Type.Mapping) type).getValue(), sorts, item);
		} else if (type instanceof Type.Array) {
			checkType(((Type.Array) type).getElement(), sorts, item);
		} else if (type instanceof Type.Uninterpreted) {
			if (!sorts.contains(((Type.Uninterpreted) type).getName())) {
				throw new LoadException("unknown sort " + type, item);
			}
		}
	}

	// =========================================================================
	// Hooks
	// =========================================================================

	private void checkHook(Decl.Hook hook) {
		if (hook.isWildcard()) {
			expect(Type.Uint256, hook.getSlot(), hook);
			expect(Type.Uint256, hook.getValue(), hook);
			return;
		}
		if (!hook.isWrite() && hook.getOldValue() != null) {
			throw new LoadException("load hook cannot bind an old value", hook);
		}
		Type leaf = typeOf(hook.getPattern(), hook);
		if (!Types.isValueType(leaf)) {
			throw new LoadException("hook pattern must reach a value, found " + leaf, hook);
		}
		expect(leaf, hook.getValue(), hook);
		if (hook.getOldValue() != null) {
			expect(leaf, hook.getOldValue(), hook);
		}
	}

	private static void expect(Type type, Decl.Parameter binder, Decl.Hook hook) {
		if (!type.equals(binder.getType())) {
			throw new LoadException(
					"hook binder " + binder.getName() + " has type " + binder.getType() + ", expected " + type, hook);
		}
	}

	/**
	 * Determine the type reached by a hook pattern, checking each accessor
	 * against the storage layout as we go.
	 *
	 * @param pattern
	 * @param hook
	 * @return
	 */
	private Type typeOf(Pattern pattern, Decl.Hook hook) {
		StorageLayout.Root root = target.getLayout().getRoot(pattern.getRoot());
		if (root == null) {
			throw new LoadException("unknown storage variable " + pattern.getRoot(), hook);
		}
		Type type = root.getType();
		List<Pattern.Accessor> accessors = pattern.getAccessors();
		for (int i = 0; i != accessors.size(); ++i) {
			Pattern.Accessor a = accessors.get(i);
			if (a instanceof Pattern.Field && type instanceof Type.Struct) {
				String field = ((Pattern.Field) a).getName();
				type = ((Type.Struct) type).getField(field);
				if (type == null) {
					throw new LoadException("unknown field " + field, hook);
				}
			} else if (a instanceof Pattern.Key && type instanceof Type.Mapping) {
				Type.Mapping m = (Type.Mapping) type;
				Decl.Parameter binder = ((Pattern.Key) a).getBinder();
				if (!m.getKey().equals(binder.getType())) {
					throw new LoadException("key " + binder.getName() + " has type " + binder.getType()
							+ ", expected " + m.getKey(), hook);
				}
				type = m.getValue();
			} else if (a instanceof Pattern.Index && type instanceof Type.Array) {
				Decl.Parameter binder = ((Pattern.Index) a).getBinder();
				if (!Type.Uint256.equals(binder.getType())) {
					throw new LoadException("index " + binder.getName() + " must have type uint256", hook);
				}
				type = ((Type.Array) type).getElement();
			} else if (a instanceof Pattern.Constant
					&& (type instanceof Type.Mapping || type instanceof Type.Array)) {
				Expr value = ((Pattern.Constant) a).getValue();
				if (!(value instanceof Expr.Integer) && !(value instanceof Expr.Boolean)) {
					throw new LoadException("pattern key must be a literal", hook);
				}
				type = type instanceof Type.Mapping ? ((Type.Mapping) type).getValue()
						: ((Type.Array) type).getElement();
			} else if (a instanceof Pattern.Length && type instanceof Type.Array && i + 1 == accessors.size()) {
				type = Type.Uint256;
			} else {
				throw new LoadException("invalid pattern " + pattern + " for " + type, hook);
			}
		}
		return type;
	}

	// =========================================================================
	// Filters
	// =========================================================================

	private void checkFilters(Decl.Rule rule) {
		for (Decl.Filter f : rule.getFilters()) {
			Decl.Parameter p = null;
			for (Decl.Parameter q : rule.getParameters()) {
				if (q.getName().equals(f.getParameter())) {
					p = q;
				}
			}
			if (p == null || !(p.getType() instanceof Type.Method)) {
				throw new LoadException("filter on " + f.getParameter() + " which is not a method parameter", f);
			}
			checkFilter(f);
		}
	}

	private void checkFilter(Decl.Filter filter) {
		if (filter != null) {
			// Evaluating against every method exposes any non-declarative use
			new MethodFilter(filter, universe, target.getName()).apply();
		}
	}

	// =========================================================================
	// Probes
	// =========================================================================

	/**
	 * Execute each method whose declaration makes a promise about its behaviour
	 * against an arbitrary state, to check it keeps that promise. View and pure
	 * methods must not write storage, whilst envfree methods must not read
	 * their environment.
	 *
	 * @param spec
	 */
	private void probe(Specification spec) {
		for (MethodDescriptor m : universe.getAll()) {
			boolean envfree = spec.isEnvfree(m);
			if (!m.isReadOnly() && !envfree) {
				continue;
			}
			logger.debug("probing {}", m);
			Term.Generator generator = new Term.Generator();
			VerificationCondition vc = new VerificationCondition();
			StorageState storage = StorageState.fresh(target.getLayout(), generator, vc::constrain);
			GhostStore ghosts = new GhostStore(generator, vc::constrain);
			CallExecutor executor = new CallExecutor(target, storage, ghosts, generator, vc);
			Environment env = Environment.fresh("probe", generator, vc::constrain).withValue(ZERO);
			List<Term> arguments = new CallData("probe").getArguments(m, generator, vc::constrain);
			CallExecutor.Result r;
			try {
				r = executor.invokeOrRevert(m, env, arguments);
			} catch (ModelingException e) {
				throw new LoadException(e.getMessage());
			}
			if (envfree && r.isEnvironmentAccessed()) {
				throw new LoadException(m + " is declared envfree but reads its environment");
			}
		}
	}

	// =========================================================================
	// Instantiation
	// =========================================================================

	/**
	 * Instantiate every rule and invariant of a specification into verification
	 * units. A parametric rule produces one unit for each combination of methods
	 * admitted by its filters, whilst an invariant produces a base unit plus one
	 * step unit for each admitted method. Units are produced in a deterministic
	 * order: rules first, then invariants, each in declaration order.
	 *
	 * @param spec
	 * @return
	 */
	public static List<SpecItem> instantiate(Specification spec) {
		ArrayList<SpecItem> items = new ArrayList<>();
		String contract = spec.getTarget().getName();
		MethodUniverse universe = spec.getUniverse();
		for (Decl.Rule rule : spec.getRules()) {
			LinkedHashMap<String, List<MethodDescriptor>> domains = new LinkedHashMap<>();
			String vacuity = null;
			for (Decl.Parameter p : rule.getParameters()) {
				if (p.getType() instanceof Type.Method) {
					Decl.Filter f = rule.getFilter(p.getName());
					List<MethodDescriptor> ms = f == null ? universe.getAll()
							: new MethodFilter(f, universe, contract).apply();
					if (ms.isEmpty() && vacuity == null) {
						vacuity = "no method satisfies the filter on " + p.getName();
					}
					domains.put(p.getName(), ms);
				}
			}
			if (vacuity != null) {
				items.add(SpecItem.vacuous(rule, vacuity));
			} else {
				enumerate(rule, new ArrayList<>(domains.entrySet()), 0, new LinkedHashMap<>(), items);
			}
		}
		for (Decl.Invariant invariant : spec.getInvariants().values()) {
			items.add(SpecItem.base(invariant));
			List<MethodDescriptor> ms = invariant.getFilter() == null ? universe.getAll()
					: new MethodFilter(invariant.getFilter(), universe, contract).apply();
			for (MethodDescriptor m : ms) {
				items.add(SpecItem.step(invariant, m));
			}
		}
		return items;
	}

	private static void enumerate(Decl.Rule rule, List<Map.Entry<String, List<MethodDescriptor>>> domains, int i,
			LinkedHashMap<String, MethodDescriptor> binding, List<SpecItem> items) {
		if (i == domains.size()) {
			items.add(SpecItem.rule(rule, binding));
		} else {
			Map.Entry<String, List<MethodDescriptor>> e = domains.get(i);
			for (MethodDescriptor m : e.getValue()) {
				binding.put(e.getKey(), m);
				enumerate(rule, domains, i + 1, binding, items);
			}
			binding.remove(e.getKey());
		}
	}

	// =========================================================================
	// References
	// =========================================================================

	/**
	 * Checks every name used in a statement or expression refers to something
	 * which exists, and is used appropriately.
	 */
	private class ReferenceChecker extends AbstractStatementVisitor {
		private final Specification spec;
		private final Set<String> sorts;
		private final Expressions expressions = new Expressions();
		/**
		 * Method parameters of the enclosing rule (if any).
		 */
		private Set<String> methods = Collections.emptySet();
		private SpecFile.Item enclosing;

		public ReferenceChecker(Specification spec, Set<String> sorts) {
			this.spec = spec;
			this.sorts = sorts;
		}

		public void check(SpecFile file) {
			for (Decl d : file.getDeclarations()) {
				enclosing = d;
				methods = Collections.emptySet();
				if (d instanceof Decl.Ghost) {
					Decl.Ghost g = (Decl.Ghost) d;
					check(g.getAxioms());
					check(g.getInitialAxioms());
				} else if (d instanceof Decl.Hook) {
					visitStatement(((Decl.Hook) d).getBody());
				} else if (d instanceof Decl.Definition) {
					Decl.Definition def = (Decl.Definition) d;
					checkParameters(def.getParameters());
					expressions.visitExpression(def.getBody());
				} else if (d instanceof Decl.Rule) {
					Decl.Rule r = (Decl.Rule) d;
					checkParameters(r.getParameters());
					methods = new HashSet<>();
					for (Decl.Parameter p : r.getParameters()) {
						if (p.getType() instanceof Type.Method) {
							methods.add(p.getName());
						}
					}
					visitStatement(r.getBody());
				} else if (d instanceof Decl.Invariant) {
					Decl.Invariant inv = (Decl.Invariant) d;
					checkParameters(inv.getParameters());
					expressions.visitExpression(inv.getPredicate());
					for (Decl.Preserved p : inv.getPreserved()) {
						if (p.getSignature() != null && lookup(p.getSignature(), p) == null) {
							throw new LoadException("unknown method " + p.getSignature(), p);
						}
						visitStatement(p.getBody());
					}
				}
			}
		}

		private void check(List<Expr> exprs) {
			for (Expr e : exprs) {
				expressions.visitExpression(e);
			}
		}

		private void checkParameters(List<Decl.Parameter> parameters) {
			for (Decl.Parameter p : parameters) {
				checkType(p.getType(), sorts, enclosing);
			}
		}

		private void checkCall(String name, Expr environment, int arity, SpecFile.Item item) {
			if (methods.contains(name)) {
				if (environment == null) {
					throw new LoadException("call to " + name + " requires an environment", item);
				}
				return;
			}
			MethodDescriptor m = lookup(name, item);
			if (m == null) {
				throw new LoadException("unknown method " + name, item);
			} else if (environment == null && !spec.isEnvfree(m)) {
				throw new LoadException(m + " is not envfree, hence requires an environment", item);
			} else if (arity >= 0 && arity != m.getNumberOfArguments()) {
				throw new LoadException(m + " expects " + m.getNumberOfArguments() + " argument(s)", item);
			}
		}

		private void checkGhost(String name, int arity, SpecFile.Item item) {
			Decl.Ghost g = null;
			for (Decl.Ghost h : spec.getGhosts()) {
				if (h.getName().equals(name)) {
					g = h;
				}
			}
			if (g == null) {
				throw new LoadException("unknown ghost " + name, item);
			} else if (arity >= 0 && g.getKeyTypes().size() != arity) {
				throw new LoadException("ghost " + name + " expects " + g.getKeyTypes().size() + " key(s)", item);
			}
		}

		@Override
		protected void visitDeclaration(Stmt.Declaration s) {
			checkType(s.getVariable().getType(), sorts, s);
			if (s.getInitialiser() != null) {
				expressions.visitExpression(s.getInitialiser());
			}
		}

		@Override
		protected void visitAssign(Stmt.Assign s) {
			expressions.visitExpression(s.getValue());
		}

		@Override
		protected void visitGhostAssign(Stmt.GhostAssign s) {
			checkGhost(s.getGhost(), s.getKeys().size(), s);
			check(s.getKeys());
			expressions.visitExpression(s.getValue());
		}

		@Override
		protected void visitRequire(Stmt.Require s) {
			expressions.visitExpression(s.getCondition());
		}

		@Override
		protected void visitAssert(Stmt.Assert s) {
			expressions.visitExpression(s.getCondition());
		}

		@Override
		protected void visitSatisfy(Stmt.Satisfy s) {
			expressions.visitExpression(s.getCondition());
		}

		@Override
		protected void visitCall(Stmt.Call s) {
			int arity = s.getCallData() == null ? s.getArguments().size() : -1;
			checkCall(s.getMethod(), s.getEnvironment(), arity, s);
			if (s.getEnvironment() != null) {
				expressions.visitExpression(s.getEnvironment());
			}
			if (s.getCallData() == null) {
				check(s.getArguments());
			}
		}

		@Override
		protected void visitHavoc(Stmt.Havoc s) {
			checkGhost(s.getGhost(), -1, s);
			if (s.getAssumption() != null) {
				expressions.visitExpression(s.getAssumption());
			}
		}

		@Override
		protected void visitSnapshot(Stmt.Snapshot s) {
			// nothing to check
		}

		@Override
		protected void visitIfElse(Stmt.IfElse s) {
			expressions.visitExpression(s.getCondition());
			super.visitIfElse(s);
		}

		@Override
		protected void visitRequireInvariant(Stmt.RequireInvariant s) {
			Decl.Invariant inv = spec.getInvariant(s.getName());
			if (inv == null) {
				throw new LoadException("unknown invariant " + s.getName(), s);
			} else if (inv.getParameters().size() != s.getArguments().size()) {
				throw new LoadException("invariant " + s.getName() + " expects " + inv.getParameters().size()
						+ " argument(s)", s);
			}
			check(s.getArguments());
		}

		private class Expressions extends AbstractExpressionFold<Void> {
			@Override
			protected Void visitUniversalQuantifier(Expr.UniversalQuantifier expr) {
				checkParameters(expr.getParameters());
				return super.visitUniversalQuantifier(expr);
			}

			@Override
			protected Void visitExistentialQuantifier(Expr.ExistentialQuantifier expr) {
				checkParameters(expr.getParameters());
				return super.visitExistentialQuantifier(expr);
			}

			@Override
			protected Void visitInvoke(Expr.Invoke expr) {
				Decl.Definition def = spec.getDefinitions().get(expr.getName());
				if (def == null) {
					throw new LoadException("unknown definition " + expr.getName(), expr);
				} else if (def.getParameters().size() != expr.getArguments().size()) {
					throw new LoadException("definition " + expr.getName() + " expects "
							+ def.getParameters().size() + " argument(s)", expr);
				}
				return super.visitInvoke(expr);
			}

			@Override
			protected Void visitMethodCall(Expr.MethodCall expr) {
				checkCall(expr.getMethod(), expr.getEnvironment(), expr.getArguments().size(), expr);
				return super.visitMethodCall(expr);
			}

			@Override
			protected Void constructCast(Expr.Cast expr, Void operand) {
				checkType(expr.getType(), sorts, expr);
				return null;
			}

			@Override
			protected Void constructStorageAccess(Expr.StorageAccess expr, List<Void> keys) {
				// Any key will do to check the shape of the access
				Location location = new Location(expr.getRoot());
				for (Path p : expr.getPath()) {
					if (p instanceof Path.Field) {
						location = location.append(Location.FIELD(((Path.Field) p).getName()));
					} else if (p instanceof Path.Key) {
						location = location.append(Location.KEY(ZERO));
					} else if (p instanceof Path.Index) {
						location = location.append(Location.INDEX(ZERO));
					} else {
						location = location.append(Location.LENGTH());
					}
				}
				try {
					Type type = target.getLayout().typeOf(location);
					if (!Types.isValueType(type)) {
						throw new LoadException("storage access must reach a value, found " + type, expr);
					}
				} catch (IllegalArgumentException e) {
					throw new LoadException(e.getMessage(), expr);
				}
				return null;
			}

			@Override
			protected Void constructGhostAccess(Expr.GhostAccess expr, List<Void> keys) {
				checkGhost(expr.getName(), expr.getKeys().size(), expr);
				return null;
			}

			@Override
			protected Void constructSelectorLiteral(Expr.SelectorLiteral expr) {
				if (lookup(expr.getSignature(), expr) == null) {
					throw new LoadException("unknown method " + expr.getSignature(), expr);
				}
				return null;
			}

			@Override
			protected Void BOTTOM() {
				return null;
			}

			@Override
			protected Void join(Void lhs, Void rhs) {
				return null;
			}
		}
	}
}
