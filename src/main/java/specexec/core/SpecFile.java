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

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import specexec.io.SpecFilePrinter;

/**
 * An already parsed and resolved specification. This is the input handed to
 * the engine by the front end: a sequence of declarations (ghosts, hooks,
 * definitions, rules, invariants, etc) over the storage layout and method
 * surface of a target system.
 *
 * @author David J. Pearce
 *
 */
public class SpecFile {
	/**
	 * The list of top-level declarations within this file.
	 */
	private final List<Decl> declarations;

	public SpecFile() {
		this.declarations = new ArrayList<>();
	}

	public SpecFile(List<Decl> declarations) {
		this.declarations = new ArrayList<>(declarations);
	}

	public SpecFile(Decl... declarations) {
		this(Arrays.asList(declarations));
	}

	public List<Decl> getDeclarations() {
		return declarations;
	}

	/**
	 * Get all declarations of a given kind, in declaration order.
	 *
	 * @param kind
	 * @param <T>
	 * @return
	 */
	public <T extends Decl> List<T> getDeclarations(Class<T> kind) {
		ArrayList<T> rs = new ArrayList<>();
		for (Decl d : declarations) {
			if (kind.isInstance(d)) {
				rs.add(kind.cast(d));
			}
		}
		return rs;
	}

	// =========================================================================
	// Top-Level Item
	// =========================================================================

	public interface Item {
		/**
		 * Get a particular attribute associated with this item.
		 * @param kind
		 * @param <T>
		 * @return
		 */
		public <T> T getAttribute(Class<T> kind);

		/**
		 * Get all attributes within this item.
		 * @return
		 */
		public Attribute[] getAttributes();
	}

	public static class AbstractItem implements Item {
		private static final Attribute[] NONE = new Attribute[0];

		private final Attribute[] attributes;

		public AbstractItem(Attribute[] attributes) {
			this.attributes = attributes == null ? NONE : attributes;
		}

		@Override
		public <T> T getAttribute(Class<T> kind) {
			for(int i=0;i!=attributes.length;++i) {
				T ith = attributes[i].as(kind);
				if(ith != null) {
					return ith;
				}
			}
			return null;
		}

		@Override
		public Attribute[] getAttributes() {
			return attributes;
		}

		@Override
		public String toString() {
			return SpecFilePrinter.toString(this);
		}
	}

	// =========================================================================
	// Declarations
	// =========================================================================

	public interface Decl extends Item {

		public String getName();

		/**
		 * An uninterpreted sort, such as <code>sort Id;</code>. Values of an
		 * uninterpreted sort can only be compared for equality.
		 */
		public static class Sort extends AbstractItem implements Decl {
			private final String name;

			public Sort(String name, Attribute... attributes) {
				super(attributes);
				this.name = name;
			}

			@Override
			public String getName() {
				return name;
			}
		}

		/**
		 * A ghost variable or ghost mapping. For example:
		 *
		 * <pre>
		 * ghost mapping(address => mathint) shadow {
		 *     init_state axiom forall address a. shadow[a] == 0;
		 * }
		 * </pre>
		 *
		 * Plain axioms hold at the start of every check, whilst
		 * <code>init_state</code> axioms hold only in the constructor state used
		 * for the base case of an invariant. A <code>persistent</code> ghost is not
		 * rolled back when a call reverts.
		 */
		public static class Ghost extends AbstractItem implements Decl {
			private final String name;
			private final List<Type> keys;
			private final Type value;
			private final List<Expr> axioms;
			private final List<Expr> initialAxioms;
			private final boolean persistent;

			public Ghost(String name, List<Type> keys, Type value, List<Expr> axioms, List<Expr> initialAxioms,
					boolean persistent, Attribute... attributes) {
				super(attributes);
				this.name = name;
				this.keys = keys;
				this.value = value;
				this.axioms = axioms;
				this.initialAxioms = initialAxioms;
				this.persistent = persistent;
			}

			@Override
			public String getName() {
				return name;
			}

			public List<Type> getKeyTypes() {
				return keys;
			}

			public Type getValueType() {
				return value;
			}

			public List<Expr> getAxioms() {
				return axioms;
			}

			public List<Expr> getInitialAxioms() {
				return initialAxioms;
			}

			public boolean isPersistent() {
				return persistent;
			}
		}

		/**
		 * Binds a storage location pattern to a trigger body. For write hooks the
		 * body sees the new value and, optionally, the value before the write. For
		 * wildcard hooks the body additionally sees the raw slot being accessed.
		 */
		public static class Hook extends AbstractItem implements Decl {
			public enum Kind {
				SSTORE, SLOAD, ALL_SSTORE, ALL_SLOAD
			}

			private final Kind kind;
			private final Pattern pattern;
			private final Parameter slot;
			private final Parameter value;
			private final Parameter oldValue;
			private final Stmt body;

			public Hook(Kind kind, Pattern pattern, Parameter slot, Parameter value, Parameter oldValue, Stmt body,
					Attribute... attributes) {
				super(attributes);
				this.kind = kind;
				this.pattern = pattern;
				this.slot = slot;
				this.value = value;
				this.oldValue = oldValue;
				this.body = body;
			}

			@Override
			public String getName() {
				return kind + " " + (pattern == null ? "*" : pattern.toString());
			}

			public Kind getKind() {
				return kind;
			}

			public boolean isWrite() {
				return kind == Kind.SSTORE || kind == Kind.ALL_SSTORE;
			}

			public boolean isWildcard() {
				return kind == Kind.ALL_SSTORE || kind == Kind.ALL_SLOAD;
			}

			/**
			 * Get the location pattern of this hook, or <code>null</code> for a
			 * wildcard hook.
			 * @return
			 */
			public Pattern getPattern() {
				return pattern;
			}

			public Parameter getSlot() {
				return slot;
			}

			public Parameter getValue() {
				return value;
			}

			public Parameter getOldValue() {
				return oldValue;
			}

			public Stmt getBody() {
				return body;
			}
		}

		/**
		 * A named, parameterised expression which is expanded at each use.
		 */
		public static class Definition extends AbstractItem implements Decl {
			private final String name;
			private final List<Parameter> parameters;
			private final Type returns;
			private final Expr body;

			public Definition(String name, List<Parameter> parameters, Type returns, Expr body, Attribute... attributes) {
				super(attributes);
				this.name = name;
				this.parameters = parameters;
				this.returns = returns;
				this.body = body;
			}

			@Override
			public String getName() {
				return name;
			}

			public List<Parameter> getParameters() {
				return parameters;
			}

			public Type getReturnType() {
				return returns;
			}

			public Expr getBody() {
				return body;
			}
		}

		/**
		 * An entry in the methods block. This identifies a method of the target
		 * system by signature and, optionally, declares it to be independent of
		 * its calling environment.
		 */
		public static class MethodSpec extends AbstractItem implements Decl {
			private final String signature;
			private final boolean envfree;

			public MethodSpec(String signature, boolean envfree, Attribute... attributes) {
				super(attributes);
				this.signature = signature;
				this.envfree = envfree;
			}

			@Override
			public String getName() {
				return signature;
			}

			public boolean isEnvfree() {
				return envfree;
			}
		}

		public static class Rule extends AbstractItem implements Decl {
			private final String name;
			private final List<Parameter> parameters;
			private final List<Filter> filters;
			private final Stmt body;

			public Rule(String name, List<Parameter> parameters, List<Filter> filters, Stmt body, Attribute... attributes) {
				super(attributes);
				this.name = name;
				this.parameters = parameters;
				this.filters = filters;
				this.body = body;
			}

			@Override
			public String getName() {
				return name;
			}

			public List<Parameter> getParameters() {
				return parameters;
			}

			public List<Filter> getFilters() {
				return filters;
			}

			/**
			 * Get the filter applied to a given method parameter (if any).
			 * @param parameter
			 * @return
			 */
			public Filter getFilter(String parameter) {
				for (Filter f : filters) {
					if (parameter.equals(f.getParameter())) {
						return f;
					}
				}
				return null;
			}

			public Stmt getBody() {
				return body;
			}
		}

		public static class Invariant extends AbstractItem implements Decl {
			private final String name;
			private final List<Parameter> parameters;
			private final Expr predicate;
			private final Filter filter;
			private final List<Preserved> preserved;

			public Invariant(String name, List<Parameter> parameters, Expr predicate, Filter filter,
					List<Preserved> preserved, Attribute... attributes) {
				super(attributes);
				this.name = name;
				this.parameters = parameters;
				this.predicate = predicate;
				this.filter = filter;
				this.preserved = preserved;
			}

			@Override
			public String getName() {
				return name;
			}

			public List<Parameter> getParameters() {
				return parameters;
			}

			public Expr getPredicate() {
				return predicate;
			}

			/**
			 * Get the filter restricting which methods this invariant is checked
			 * against, or <code>null</code> if there is none.
			 * @return
			 */
			public Filter getFilter() {
				return filter;
			}

			public List<Preserved> getPreserved() {
				return preserved;
			}

			/**
			 * Determine the preserved block applicable to a given method. A block
			 * naming the method's signature takes precedence over a generic one.
			 *
			 * @param signature
			 * @return
			 */
			public Preserved getPreserved(String signature) {
				Preserved generic = null;
				for (Preserved p : preserved) {
					if (p.getSignature() == null) {
						generic = p;
					} else if (p.getSignature().equals(signature)) {
						return p;
					}
				}
				return generic;
			}
		}

		public static class Parameter extends AbstractItem implements Item {
			private final String name;
			private final Type type;

			public Parameter(String name, Type type, Attribute... attributes) {
				super(attributes);
				this.name = name;
				this.type = type;
			}

			public String getName() {
				return name;
			}

			public Type getType() {
				return type;
			}
		}

		/**
		 * A declarative restriction over a method parameter, such as
		 * <code>filtered { f -> !f.isView }</code>.
		 */
		public static class Filter extends AbstractItem implements Item {
			private final String parameter;
			private final String binder;
			private final Expr condition;

			public Filter(String parameter, String binder, Expr condition, Attribute... attributes) {
				super(attributes);
				this.parameter = parameter;
				this.binder = binder;
				this.condition = condition;
			}

			public String getParameter() {
				return parameter;
			}

			public String getBinder() {
				return binder;
			}

			public Expr getCondition() {
				return condition;
			}
		}

		public static class Preserved extends AbstractItem implements Item {
			private final String signature;
			private final Parameter environment;
			private final Stmt body;

			public Preserved(String signature, Parameter environment, Stmt body, Attribute... attributes) {
				super(attributes);
				this.signature = signature;
				this.environment = environment;
				this.body = body;
			}

			/**
			 * Get the signature of the method this block applies to, or
			 * <code>null</code> for a generic block.
			 * @return
			 */
			public String getSignature() {
				return signature;
			}

			public Parameter getEnvironment() {
				return environment;
			}

			public Stmt getBody() {
				return body;
			}
		}
	}

	// =========================================================================
	// Location Patterns
	// =========================================================================

	/**
	 * The location matched by a (non-wildcard) hook, such as
	 * <code>users[KEY address u].balance</code>.
	 */
	public static class Pattern extends AbstractItem implements Item {
		private final String root;
		private final List<Accessor> accessors;

		public Pattern(String root, List<Accessor> accessors, Attribute... attributes) {
			super(attributes);
			this.root = root;
			this.accessors = accessors;
		}

		public String getRoot() {
			return root;
		}

		public List<Accessor> getAccessors() {
			return accessors;
		}

		public interface Accessor extends Item {
		}

		public static class Field extends AbstractItem implements Accessor {
			private final String name;

			public Field(String name) {
				super(null);
				this.name = name;
			}

			public String getName() {
				return name;
			}
		}

		public static class Key extends AbstractItem implements Accessor {
			private final Decl.Parameter binder;

			public Key(Decl.Parameter binder) {
				super(null);
				this.binder = binder;
			}

			public Decl.Parameter getBinder() {
				return binder;
			}
		}

		public static class Index extends AbstractItem implements Accessor {
			private final Decl.Parameter binder;

			public Index(Decl.Parameter binder) {
				super(null);
				this.binder = binder;
			}

			public Decl.Parameter getBinder() {
				return binder;
			}
		}

		/**
		 * Matches a mapping or array access whose key may equal a given constant.
		 */
		public static class Constant extends AbstractItem implements Accessor {
			private final Expr value;

			public Constant(Expr value) {
				super(null);
				this.value = value;
			}

			public Expr getValue() {
				return value;
			}
		}

		public static class Length extends AbstractItem implements Accessor {
			public Length() {
				super(null);
			}
		}
	}

	/**
	 * A structural step in a storage access expression.
	 */
	public interface Path extends Item {

		public static class Field extends AbstractItem implements Path {
			private final String name;

			public Field(String name) {
				super(null);
				this.name = name;
			}

			public String getName() {
				return name;
			}
		}

		public static class Key extends AbstractItem implements Path {
			private final Expr key;

			public Key(Expr key) {
				super(null);
				this.key = key;
			}

			public Expr getKey() {
				return key;
			}
		}

		public static class Index extends AbstractItem implements Path {
			private final Expr index;

			public Index(Expr index) {
				super(null);
				this.index = index;
			}

			public Expr getIndex() {
				return index;
			}
		}

		public static class Length extends AbstractItem implements Path {
			public Length() {
				super(null);
			}
		}
	}

	// =========================================================================
	// Statements
	// =========================================================================

	public interface Stmt extends Item {

		/**
		 * Declares a local variable. Without an initialiser the variable holds an
		 * arbitrary value of its type.
		 */
		public static class Declaration extends AbstractItem implements Stmt {
			private final Decl.Parameter variable;
			private final Expr initialiser;

			public Declaration(Decl.Parameter variable, Expr initialiser, Attribute... attributes) {
				super(attributes);
				this.variable = variable;
				this.initialiser = initialiser;
			}

			public Decl.Parameter getVariable() {
				return variable;
			}

			public Expr getInitialiser() {
				return initialiser;
			}
		}

		public static class Assign extends AbstractItem implements Stmt {
			private final String name;
			private final Expr value;

			public Assign(String name, Expr value, Attribute... attributes) {
				super(attributes);
				this.name = name;
				this.value = value;
			}

			public String getName() {
				return name;
			}

			public Expr getValue() {
				return value;
			}
		}

		public static class GhostAssign extends AbstractItem implements Stmt {
			private final String ghost;
			private final List<Expr> keys;
			private final Expr value;

			public GhostAssign(String ghost, List<Expr> keys, Expr value, Attribute... attributes) {
				super(attributes);
				this.ghost = ghost;
				this.keys = keys;
				this.value = value;
			}

			public String getGhost() {
				return ghost;
			}

			public List<Expr> getKeys() {
				return keys;
			}

			public Expr getValue() {
				return value;
			}
		}

		public static class Require extends AbstractItem implements Stmt {
			private final Expr condition;

			public Require(Expr condition, Attribute... attributes) {
				super(attributes);
				this.condition = condition;
			}

			public Expr getCondition() {
				return condition;
			}
		}

		public static class Assert extends AbstractItem implements Stmt {
			private final Expr condition;
			private final String message;

			public Assert(Expr condition, String message, Attribute... attributes) {
				super(attributes);
				this.condition = condition;
				this.message = message;
			}

			public Expr getCondition() {
				return condition;
			}

			public String getMessage() {
				return message;
			}
		}

		public static class Satisfy extends AbstractItem implements Stmt {
			private final Expr condition;
			private final String message;

			public Satisfy(Expr condition, String message, Attribute... attributes) {
				super(attributes);
				this.condition = condition;
				this.message = message;
			}

			public Expr getCondition() {
				return condition;
			}

			public String getMessage() {
				return message;
			}
		}

		/**
		 * A call to a method of the target system. The method is either named by
		 * signature (or unique name), or is a method parameter of the enclosing
		 * rule. Arguments are given explicitly or as a single calldata parameter.
		 */
		public static class Call extends AbstractItem implements Stmt {
			private final List<String> lvals;
			private final String method;
			private final Expr environment;
			private final List<Expr> arguments;
			private final String calldata;
			private final boolean withRevert;
			private final String snapshot;

			public Call(List<String> lvals, String method, Expr environment, List<Expr> arguments, String calldata,
					boolean withRevert, String snapshot, Attribute... attributes) {
				super(attributes);
				this.lvals = lvals;
				this.method = method;
				this.environment = environment;
				this.arguments = arguments;
				this.calldata = calldata;
				this.withRevert = withRevert;
				this.snapshot = snapshot;
			}

			public List<String> getLVals() {
				return lvals;
			}

			public String getMethod() {
				return method;
			}

			/**
			 * Get the environment passed to this call, or <code>null</code> if the
			 * method is envfree.
			 * @return
			 */
			public Expr getEnvironment() {
				return environment;
			}

			public List<Expr> getArguments() {
				return arguments;
			}

			public String getCallData() {
				return calldata;
			}

			public boolean isWithRevert() {
				return withRevert;
			}

			/**
			 * Get the snapshot the call starts from, or <code>null</code> if it
			 * starts from the current state.
			 * @return
			 */
			public String getSnapshot() {
				return snapshot;
			}
		}

		/**
		 * Replaces a ghost with an arbitrary value, optionally constrained by an
		 * assumption relating its old and new values.
		 */
		public static class Havoc extends AbstractItem implements Stmt {
			private final String ghost;
			private final Expr assumption;

			public Havoc(String ghost, Expr assumption, Attribute... attributes) {
				super(attributes);
				this.ghost = ghost;
				this.assumption = assumption;
			}

			public String getGhost() {
				return ghost;
			}

			public Expr getAssumption() {
				return assumption;
			}
		}

		/**
		 * Captures the current storage under a given name, as in
		 * <code>storage init = lastStorage;</code>.
		 */
		public static class Snapshot extends AbstractItem implements Stmt {
			private final String name;

			public Snapshot(String name, Attribute... attributes) {
				super(attributes);
				this.name = name;
			}

			public String getName() {
				return name;
			}
		}

		public static class IfElse extends AbstractItem implements Stmt {
			private final Expr condition;
			private final Stmt trueBranch;
			private final Stmt falseBranch;

			public IfElse(Expr condition, Stmt trueBranch, Stmt falseBranch, Attribute... attributes) {
				super(attributes);
				this.condition = condition;
				this.trueBranch = trueBranch;
				this.falseBranch = falseBranch;
			}

			public Expr getCondition() {
				return condition;
			}

			public Stmt getTrueBranch() {
				return trueBranch;
			}

			public Stmt getFalseBranch() {
				return falseBranch;
			}
		}

		public static class RequireInvariant extends AbstractItem implements Stmt {
			private final String name;
			private final List<Expr> arguments;

			public RequireInvariant(String name, List<Expr> arguments, Attribute... attributes) {
				super(attributes);
				this.name = name;
				this.arguments = arguments;
			}

			public String getName() {
				return name;
			}

			public List<Expr> getArguments() {
				return arguments;
			}
		}

		public static class Sequence extends AbstractItem implements Stmt {
			private final List<Stmt> stmts;

			public Sequence(List<Stmt> stmts, Attribute... attributes) {
				super(attributes);
				this.stmts = stmts;
			}

			public int size() {
				return stmts.size();
			}

			public Stmt get(int i) {
				return stmts.get(i);
			}

			public List<Stmt> getAll() {
				return stmts;
			}
		}
	}

	// =========================================================================
	// Expressions
	// =========================================================================

	public interface Expr extends Item {

		public abstract static class UnaryOperator extends AbstractItem implements Expr {
			private final Expr operand;

			public UnaryOperator(Expr operand, Attribute[] attributes) {
				super(attributes);
				this.operand = operand;
			}

			public Expr getOperand() {
				return operand;
			}
		}

		public abstract static class BinaryOperator extends AbstractItem implements Expr {
			private final Expr lhs;
			private final Expr rhs;

			public BinaryOperator(Expr lhs, Expr rhs, Attribute[] attributes) {
				super(attributes);
				this.lhs = lhs;
				this.rhs = rhs;
			}

			public Expr getLeftHandSide() {
				return lhs;
			}

			public Expr getRightHandSide() {
				return rhs;
			}
		}

		public abstract static class NaryOperator extends AbstractItem implements Expr {
			private final List<Expr> operands;

			public NaryOperator(List<Expr> operands, Attribute[] attributes) {
				super(attributes);
				this.operands = operands;
			}

			public List<Expr> getOperands() {
				return operands;
			}
		}

		public static class Integer extends AbstractItem implements Expr {
			private final BigInteger value;

			private Integer(BigInteger v, Attribute[] attributes) {
				super(attributes);
				this.value = v;
			}

			public BigInteger getValue() {
				return value;
			}
		}

		public static class Boolean extends AbstractItem implements Expr {
			private final boolean value;

			private Boolean(boolean v, Attribute[] attributes) {
				super(attributes);
				this.value = v;
			}

			public boolean getValue() {
				return value;
			}
		}

		public static class VariableAccess extends AbstractItem implements Expr {
			private final String name;

			private VariableAccess(String name, Attribute[] attributes) {
				super(attributes);
				this.name = name;
			}

			public String getName() {
				return name;
			}
		}

		public static class Negation extends UnaryOperator {
			private Negation(Expr operand, Attribute[] attributes) {
				super(operand, attributes);
			}
		}

		public static class Addition extends BinaryOperator {
			private Addition(Expr lhs, Expr rhs, Attribute[] attributes) {
				super(lhs, rhs, attributes);
			}
		}

		public static class Subtraction extends BinaryOperator {
			private Subtraction(Expr lhs, Expr rhs, Attribute[] attributes) {
				super(lhs, rhs, attributes);
			}
		}

		public static class Multiplication extends BinaryOperator {
			private Multiplication(Expr lhs, Expr rhs, Attribute[] attributes) {
				super(lhs, rhs, attributes);
			}
		}

		public static class Division extends BinaryOperator {
			private Division(Expr lhs, Expr rhs, Attribute[] attributes) {
				super(lhs, rhs, attributes);
			}
		}

		public static class Remainder extends BinaryOperator {
			private Remainder(Expr lhs, Expr rhs, Attribute[] attributes) {
				super(lhs, rhs, attributes);
			}
		}

		public static class Equals extends BinaryOperator {
			private Equals(Expr lhs, Expr rhs, Attribute[] attributes) {
				super(lhs, rhs, attributes);
			}
		}

		public static class NotEquals extends BinaryOperator {
			private NotEquals(Expr lhs, Expr rhs, Attribute[] attributes) {
				super(lhs, rhs, attributes);
			}
		}

		public static class LessThan extends BinaryOperator {
			private LessThan(Expr lhs, Expr rhs, Attribute[] attributes) {
				super(lhs, rhs, attributes);
			}
		}

		public static class LessThanOrEqual extends BinaryOperator {
			private LessThanOrEqual(Expr lhs, Expr rhs, Attribute[] attributes) {
				super(lhs, rhs, attributes);
			}
		}

		public static class GreaterThan extends BinaryOperator {
			private GreaterThan(Expr lhs, Expr rhs, Attribute[] attributes) {
				super(lhs, rhs, attributes);
			}
		}

		public static class GreaterThanOrEqual extends BinaryOperator {
			private GreaterThanOrEqual(Expr lhs, Expr rhs, Attribute[] attributes) {
				super(lhs, rhs, attributes);
			}
		}

		public static class LogicalAnd extends NaryOperator {
			private LogicalAnd(List<Expr> operands, Attribute[] attributes) {
				super(operands, attributes);
			}
		}

		public static class LogicalOr extends NaryOperator {
			private LogicalOr(List<Expr> operands, Attribute[] attributes) {
				super(operands, attributes);
			}
		}

		public static class LogicalNot extends UnaryOperator {
			private LogicalNot(Expr operand, Attribute[] attributes) {
				super(operand, attributes);
			}
		}

		public static class Implies extends BinaryOperator {
			private Implies(Expr lhs, Expr rhs, Attribute[] attributes) {
				super(lhs, rhs, attributes);
			}
		}

		public static class Iff extends BinaryOperator {
			private Iff(Expr lhs, Expr rhs, Attribute[] attributes) {
				super(lhs, rhs, attributes);
			}
		}

		public static class IfThenElse extends AbstractItem implements Expr {
			private final Expr condition;
			private final Expr trueBranch;
			private final Expr falseBranch;

			private IfThenElse(Expr condition, Expr trueBranch, Expr falseBranch, Attribute[] attributes) {
				super(attributes);
				this.condition = condition;
				this.trueBranch = trueBranch;
				this.falseBranch = falseBranch;
			}

			public Expr getCondition() {
				return condition;
			}

			public Expr getTrueBranch() {
				return trueBranch;
			}

			public Expr getFalseBranch() {
				return falseBranch;
			}
		}

		/**
		 * Reads a location of the target system's storage, such as
		 * <code>users[a].balance</code>.
		 */
		public static class StorageAccess extends AbstractItem implements Expr {
			private final String root;
			private final List<Path> path;

			private StorageAccess(String root, List<Path> path, Attribute[] attributes) {
				super(attributes);
				this.root = root;
				this.path = path;
			}

			public String getRoot() {
				return root;
			}

			public List<Path> getPath() {
				return path;
			}
		}

		public static class GhostAccess extends AbstractItem implements Expr {
			/**
			 * Distinguishes the value of a ghost before (<code>@old</code>) and after
			 * (<code>@new</code>) a havoc statement. Outside a havoc assumption only
			 * the current value is accessible.
			 */
			public enum Timing {
				CURRENT, OLD, NEW
			}

			private final String name;
			private final List<Expr> keys;
			private final Timing timing;

			private GhostAccess(String name, List<Expr> keys, Timing timing, Attribute[] attributes) {
				super(attributes);
				this.name = name;
				this.keys = keys;
				this.timing = timing;
			}

			public String getName() {
				return name;
			}

			public List<Expr> getKeys() {
				return keys;
			}

			public Timing getTiming() {
				return timing;
			}
		}

		/**
		 * A bounded cast such as <code>assert_uint256(x)</code> or
		 * <code>require_uint256(x)</code>. An asserting cast fails the check when
		 * its operand may be out of range, whilst a requiring cast silently
		 * discards such executions.
		 */
		public static class Cast extends UnaryOperator {
			private final Type type;
			private final boolean asserting;

			private Cast(Type type, Expr operand, boolean asserting, Attribute[] attributes) {
				super(operand, attributes);
				this.type = type;
				this.asserting = asserting;
			}

			public Type getType() {
				return type;
			}

			public boolean isAsserting() {
				return asserting;
			}
		}

		public abstract static class Quantifier extends AbstractItem implements Expr {
			private final List<Decl.Parameter> parameters;
			private final Expr body;

			private Quantifier(List<Decl.Parameter> parameters, Expr body, Attribute[] attributes) {
				super(attributes);
				this.parameters = parameters;
				this.body = body;
			}

			public List<Decl.Parameter> getParameters() {
				return parameters;
			}

			public Expr getBody() {
				return body;
			}
		}

		public static class UniversalQuantifier extends Quantifier {
			private UniversalQuantifier(List<Decl.Parameter> parameters, Expr body, Attribute[] attributes) {
				super(parameters, body, attributes);
			}
		}

		public static class ExistentialQuantifier extends Quantifier {
			private ExistentialQuantifier(List<Decl.Parameter> parameters, Expr body, Attribute[] attributes) {
				super(parameters, body, attributes);
			}
		}

		/**
		 * Evaluates an expression against a named storage snapshot, as in
		 * <code>balanceOf(a) at init</code>.
		 */
		public static class At extends UnaryOperator {
			private final String snapshot;

			private At(Expr operand, String snapshot, Attribute[] attributes) {
				super(operand, attributes);
				this.snapshot = snapshot;
			}

			public String getSnapshot() {
				return snapshot;
			}
		}

		/**
		 * Invocation of a definition.
		 */
		public static class Invoke extends AbstractItem implements Expr {
			private final String name;
			private final List<Expr> arguments;

			private Invoke(String name, List<Expr> arguments, Attribute[] attributes) {
				super(attributes);
				this.name = name;
				this.arguments = arguments;
			}

			public String getName() {
				return name;
			}

			public List<Expr> getArguments() {
				return arguments;
			}
		}

		/**
		 * A call to a method of the target system in expression position. Such
		 * calls assume the method does not revert and evaluate to its first
		 * return value.
		 */
		public static class MethodCall extends AbstractItem implements Expr {
			private final String method;
			private final Expr environment;
			private final List<Expr> arguments;

			private MethodCall(String method, Expr environment, List<Expr> arguments, Attribute[] attributes) {
				super(attributes);
				this.method = method;
				this.environment = environment;
				this.arguments = arguments;
			}

			public String getMethod() {
				return method;
			}

			public Expr getEnvironment() {
				return environment;
			}

			public List<Expr> getArguments() {
				return arguments;
			}
		}

		/**
		 * Access to a field of an environment variable (e.g.
		 * <code>e.msg.sender</code>) or of a method variable (e.g.
		 * <code>f.selector</code>).
		 */
		public static class FieldAccess extends UnaryOperator {
			private final String field;

			private FieldAccess(Expr operand, String field, Attribute[] attributes) {
				super(operand, attributes);
				this.field = field;
			}

			public String getField() {
				return field;
			}
		}

		public static class LastReverted extends AbstractItem implements Expr {
			private LastReverted(Attribute[] attributes) {
				super(attributes);
			}
		}

		/**
		 * Compares two storage snapshots for equality. The name
		 * <code>lastStorage</code> denotes the current storage.
		 */
		public static class StorageComparison extends AbstractItem implements Expr {
			private final String lhs;
			private final String rhs;

			private StorageComparison(String lhs, String rhs, Attribute[] attributes) {
				super(attributes);
				this.lhs = lhs;
				this.rhs = rhs;
			}

			public String getLeftHandSide() {
				return lhs;
			}

			public String getRightHandSide() {
				return rhs;
			}
		}

		/**
		 * The selector of a method given by signature, as in
		 * <code>sig:transfer(address,uint256).selector</code>.
		 */
		public static class SelectorLiteral extends AbstractItem implements Expr {
			private final String signature;

			private SelectorLiteral(String signature, Attribute[] attributes) {
				super(attributes);
				this.signature = signature;
			}

			public String getSignature() {
				return signature;
			}
		}
	}

	// =========================================================================
	// Types
	// =========================================================================

	public interface Type extends Item {
		public static final Type MathInt = new Int();
		public static final Type Uint8 = new Uint(8);
		public static final Type Uint256 = new Uint(256);
		public static final Type Int256 = new Sint(256);
		public static final Type Bool = new Bool();
		public static final Type Address = new Address();
		public static final Type Env = new Env();
		public static final Type Method = new Method();
		public static final Type CallData = new CallData();
		public static final Type Storage = new Storage();

		/**
		 * Base class for types without structure, where all instances of the same
		 * class are equal.
		 */
		public abstract static class Primitive extends AbstractItem implements Type {
			private final String name;

			private Primitive(String name) {
				super(null);
				this.name = name;
			}

			@Override
			public boolean equals(Object o) {
				return o != null && o.getClass() == getClass();
			}

			@Override
			public int hashCode() {
				return getClass().hashCode();
			}

			@Override
			public String toString() {
				return name;
			}
		}

		/**
		 * Unbounded integers (<code>mathint</code>).
		 */
		public static class Int extends Primitive {
			private Int() {
				super("mathint");
			}
		}

		public static class Bool extends Primitive {
			private Bool() {
				super("bool");
			}
		}

		public static class Address extends Primitive {
			private Address() {
				super("address");
			}
		}

		public static class Env extends Primitive {
			private Env() {
				super("env");
			}
		}

		public static class Method extends Primitive {
			private Method() {
				super("method");
			}
		}

		public static class CallData extends Primitive {
			private CallData() {
				super("calldataarg");
			}
		}

		public static class Storage extends Primitive {
			private Storage() {
				super("storage");
			}
		}

		/**
		 * Bounded integers of a given width, either unsigned (<code>uintN</code>)
		 * or signed (<code>intN</code>).
		 */
		public abstract static class Bounded extends AbstractItem implements Type {
			private final int width;

			private Bounded(int width) {
				super(null);
				this.width = width;
			}

			public int getWidth() {
				return width;
			}

			public abstract boolean isSigned();

			@Override
			public boolean equals(Object o) {
				return o != null && o.getClass() == getClass() && ((Bounded) o).width == width;
			}

			@Override
			public int hashCode() {
				return getClass().hashCode() ^ width;
			}

			@Override
			public String toString() {
				return (isSigned() ? "int" : "uint") + width;
			}
		}

		public static class Uint extends Bounded {
			public Uint(int width) {
				super(width);
			}

			@Override
			public boolean isSigned() {
				return false;
			}
		}

		public static class Sint extends Bounded {
			public Sint(int width) {
				super(width);
			}

			@Override
			public boolean isSigned() {
				return true;
			}
		}

		public static class Enum extends AbstractItem implements Type {
			private final String name;
			private final List<String> values;

			public Enum(String name, List<String> values) {
				super(null);
				this.name = name;
				this.values = values;
			}

			public String getName() {
				return name;
			}

			public List<String> getValues() {
				return values;
			}

			@Override
			public boolean equals(Object o) {
				return o instanceof Enum && ((Enum) o).name.equals(name);
			}

			@Override
			public int hashCode() {
				return name.hashCode();
			}

			@Override
			public String toString() {
				return name;
			}
		}

		/**
		 * A struct type. Struct types must be referred to by their qualified name
		 * (e.g. <code>Token.User</code>).
		 */
		public static class Struct extends AbstractItem implements Type {
			private final String name;
			private final List<Decl.Parameter> fields;

			public Struct(String name, List<Decl.Parameter> fields) {
				super(null);
				this.name = name;
				this.fields = fields;
			}

			public String getName() {
				return name;
			}

			public boolean isQualified() {
				int i = name.indexOf('.');
				return i > 0 && i < name.length() - 1;
			}

			public List<Decl.Parameter> getFields() {
				return fields;
			}

			public Type getField(String field) {
				for (Decl.Parameter p : fields) {
					if (p.getName().equals(field)) {
						return p.getType();
					}
				}
				return null;
			}

			@Override
			public boolean equals(Object o) {
				return o instanceof Struct && ((Struct) o).name.equals(name);
			}

			@Override
			public int hashCode() {
				return name.hashCode();
			}

			@Override
			public String toString() {
				return name;
			}
		}

		public static class Mapping extends AbstractItem implements Type {
			private final Type key;
			private final Type value;

			public Mapping(Type key, Type value) {
				super(null);
				this.key = key;
				this.value = value;
			}

			public Type getKey() {
				return key;
			}

			public Type getValue() {
				return value;
			}

			@Override
			public boolean equals(Object o) {
				if (o instanceof Mapping) {
					Mapping m = (Mapping) o;
					return key.equals(m.key) && value.equals(m.value);
				}
				return false;
			}

			@Override
			public int hashCode() {
				return Objects.hash(key, value);
			}

			@Override
			public String toString() {
				return "mapping(" + key + " => " + value + ")";
			}
		}

		/**
		 * A dynamically sized array.
		 */
		public static class Array extends AbstractItem implements Type {
			private final Type element;

			public Array(Type element) {
				super(null);
				this.element = element;
			}

			public Type getElement() {
				return element;
			}

			@Override
			public boolean equals(Object o) {
				return o instanceof Array && ((Array) o).element.equals(element);
			}

			@Override
			public int hashCode() {
				return element.hashCode() * 7;
			}

			@Override
			public String toString() {
				return element + "[]";
			}
		}

		public static class Uninterpreted extends AbstractItem implements Type {
			private final String name;

			public Uninterpreted(String name) {
				super(null);
				this.name = name;
			}

			public String getName() {
				return name;
			}

			@Override
			public boolean equals(Object o) {
				return o instanceof Uninterpreted && ((Uninterpreted) o).name.equals(name);
			}

			@Override
			public int hashCode() {
				return name.hashCode();
			}

			@Override
			public String toString() {
				return name;
			}
		}
	}

	// =========================================================================
	// Attributes
	// =========================================================================

	public interface Attribute {
		/**
		 * Get the contents of this attribute as a given kind.  If that doesn't match, then return <code>null</code>.
		 * @param kind
		 * @param <T>
		 * @return
		 */
		public <T> T as(Class<T> kind);
	}

	/**
	 * Identifies where in the original source text an item came from.
	 */
	public static class Position {
		private final String file;
		private final int line;

		public Position(String file, int line) {
			this.file = file;
			this.line = line;
		}

		public String getFile() {
			return file;
		}

		public int getLine() {
			return line;
		}

		@Override
		public String toString() {
			return file + ":" + line;
		}
	}

	// =======================================================
	// Constructor API (for convenience)
	// =======================================================

	public static Attribute ATTRIBUTE(Object o) {
		return new Attribute() {
			@Override
			public <T> T as(Class<T> kind) {
				if(kind.isInstance(o)) {
					return kind.cast(o);
				} else {
					return null;
				}
			}
			@Override
			public String toString() {
				return "ATTR(" + o + ")";
			}
		};
	}

	// Declarations

	public static Decl.Parameter PARAM(String name, Type type) {
		return new Decl.Parameter(name, type);
	}

	public static List<Decl.Parameter> PARAMS(Decl.Parameter... parameters) {
		return Arrays.asList(parameters);
	}

	public static Decl.Ghost GHOST(String name, Type type, Expr... axioms) {
		return new Decl.Ghost(name, Collections.emptyList(), type, Arrays.asList(axioms), Collections.emptyList(), false);
	}

	public static Decl.Ghost GHOST(String name, Type key, Type value, Expr... axioms) {
		return new Decl.Ghost(name, Arrays.asList(key), value, Arrays.asList(axioms), Collections.emptyList(), false);
	}

	public static Decl.Hook SSTORE(Pattern pattern, Decl.Parameter value, Decl.Parameter oldValue, Stmt body) {
		return new Decl.Hook(Decl.Hook.Kind.SSTORE, pattern, null, value, oldValue, body);
	}

	public static Decl.Hook SLOAD(Pattern pattern, Decl.Parameter value, Stmt body) {
		return new Decl.Hook(Decl.Hook.Kind.SLOAD, pattern, null, value, null, body);
	}

	public static Decl.Hook ALL_SSTORE(Decl.Parameter slot, Decl.Parameter value, Stmt body) {
		return new Decl.Hook(Decl.Hook.Kind.ALL_SSTORE, null, slot, value, null, body);
	}

	public static Decl.Hook ALL_SLOAD(Decl.Parameter slot, Decl.Parameter value, Stmt body) {
		return new Decl.Hook(Decl.Hook.Kind.ALL_SLOAD, null, slot, value, null, body);
	}

	public static Pattern PATTERN(String root, Pattern.Accessor... accessors) {
		return new Pattern(root, Arrays.asList(accessors));
	}

	public static Decl.Definition DEFINITION(String name, List<Decl.Parameter> parameters, Type returns, Expr body) {
		return new Decl.Definition(name, parameters, returns, body);
	}

	public static Decl.MethodSpec METHOD(String signature, boolean envfree) {
		return new Decl.MethodSpec(signature, envfree);
	}

	public static Decl.Rule RULE(String name, List<Decl.Parameter> parameters, Stmt... body) {
		return new Decl.Rule(name, parameters, Collections.emptyList(), SEQUENCE(body));
	}

	public static Decl.Rule RULE(String name, List<Decl.Parameter> parameters, List<Decl.Filter> filters, Stmt... body) {
		return new Decl.Rule(name, parameters, filters, SEQUENCE(body));
	}

	public static Decl.Filter FILTER(String parameter, String binder, Expr condition) {
		return new Decl.Filter(parameter, binder, condition);
	}

	public static Decl.Invariant INVARIANT(String name, List<Decl.Parameter> parameters, Expr predicate,
			Decl.Preserved... preserved) {
		return new Decl.Invariant(name, parameters, predicate, null, Arrays.asList(preserved));
	}

	public static Decl.Preserved PRESERVED(String signature, Decl.Parameter environment, Stmt... body) {
		return new Decl.Preserved(signature, environment, SEQUENCE(body));
	}

	// Statements

	public static Stmt.Declaration DECLARE(String name, Type type, Attribute... attributes) {
		return new Stmt.Declaration(PARAM(name, type), null, attributes);
	}

	public static Stmt.Declaration DECLARE(String name, Type type, Expr initialiser, Attribute... attributes) {
		return new Stmt.Declaration(PARAM(name, type), initialiser, attributes);
	}

	public static Stmt.Assign ASSIGN(String name, Expr value, Attribute... attributes) {
		return new Stmt.Assign(name, value, attributes);
	}

	public static Stmt.GhostAssign GHOST_ASSIGN(String ghost, Expr value, Attribute... attributes) {
		return new Stmt.GhostAssign(ghost, Collections.emptyList(), value, attributes);
	}

	public static Stmt.GhostAssign GHOST_ASSIGN(String ghost, Expr key, Expr value, Attribute... attributes) {
		return new Stmt.GhostAssign(ghost, Arrays.asList(key), value, attributes);
	}

	public static Stmt.Require REQUIRE(Expr condition, Attribute... attributes) {
		return new Stmt.Require(condition, attributes);
	}

	public static Stmt.Assert ASSERT(Expr condition, Attribute... attributes) {
		return new Stmt.Assert(condition, null, attributes);
	}

	public static Stmt.Assert ASSERT(Expr condition, String message, Attribute... attributes) {
		return new Stmt.Assert(condition, message, attributes);
	}

	public static Stmt.Satisfy SATISFY(Expr condition, Attribute... attributes) {
		return new Stmt.Satisfy(condition, null, attributes);
	}

	public static Stmt.Call CALL(String method, Expr environment, Expr... arguments) {
		return new Stmt.Call(Collections.emptyList(), method, environment, Arrays.asList(arguments), null, false, null);
	}

	public static Stmt.Call CALL(List<String> lvals, String method, Expr environment, Expr... arguments) {
		return new Stmt.Call(lvals, method, environment, Arrays.asList(arguments), null, false, null);
	}

	public static Stmt.Call CALL_WITHREVERT(String method, Expr environment, Expr... arguments) {
		return new Stmt.Call(Collections.emptyList(), method, environment, Arrays.asList(arguments), null, true, null);
	}

	public static Stmt.Call CALL_CALLDATA(String method, Expr environment, String calldata, boolean withRevert) {
		return new Stmt.Call(Collections.emptyList(), method, environment, Collections.emptyList(), calldata,
				withRevert, null);
	}

	public static Stmt.Havoc HAVOC(String ghost, Expr assumption, Attribute... attributes) {
		return new Stmt.Havoc(ghost, assumption, attributes);
	}

	public static Stmt.Snapshot SNAPSHOT(String name, Attribute... attributes) {
		return new Stmt.Snapshot(name, attributes);
	}

	public static Stmt.IfElse IFELSE(Expr condition, Stmt trueBranch, Stmt falseBranch, Attribute... attributes) {
		return new Stmt.IfElse(condition, trueBranch, falseBranch, attributes);
	}

	public static Stmt.RequireInvariant REQUIRE_INVARIANT(String name, Expr... arguments) {
		return new Stmt.RequireInvariant(name, Arrays.asList(arguments));
	}

	public static Stmt.Sequence SEQUENCE(Stmt... stmts) {
		return new Stmt.Sequence(Arrays.asList(stmts));
	}

	// Expressions

	public static Expr.Integer CONST(long i, Attribute... attributes) {
		return new Expr.Integer(BigInteger.valueOf(i), attributes);
	}

	public static Expr.Integer CONST(BigInteger i, Attribute... attributes) {
		return new Expr.Integer(i, attributes);
	}

	public static Expr.Boolean CONST(boolean b, Attribute... attributes) {
		return new Expr.Boolean(b, attributes);
	}

	public static Expr.VariableAccess VAR(String name, Attribute... attributes) {
		return new Expr.VariableAccess(name, attributes);
	}

	public static Expr.Negation NEG(Expr operand, Attribute... attributes) {
		return new Expr.Negation(operand, attributes);
	}

	public static Expr.Addition ADD(Expr lhs, Expr rhs, Attribute... attributes) {
		return new Expr.Addition(lhs, rhs, attributes);
	}

	public static Expr.Subtraction SUB(Expr lhs, Expr rhs, Attribute... attributes) {
		return new Expr.Subtraction(lhs, rhs, attributes);
	}

	public static Expr.Multiplication MUL(Expr lhs, Expr rhs, Attribute... attributes) {
		return new Expr.Multiplication(lhs, rhs, attributes);
	}

	public static Expr.Division DIV(Expr lhs, Expr rhs, Attribute... attributes) {
		return new Expr.Division(lhs, rhs, attributes);
	}

	public static Expr.Remainder REM(Expr lhs, Expr rhs, Attribute... attributes) {
		return new Expr.Remainder(lhs, rhs, attributes);
	}

	public static Expr.Equals EQ(Expr lhs, Expr rhs, Attribute... attributes) {
		return new Expr.Equals(lhs, rhs, attributes);
	}

	public static Expr.NotEquals NEQ(Expr lhs, Expr rhs, Attribute... attributes) {
		return new Expr.NotEquals(lhs, rhs, attributes);
	}

	public static Expr.LessThan LT(Expr lhs, Expr rhs, Attribute... attributes) {
		return new Expr.LessThan(lhs, rhs, attributes);
	}

	public static Expr.LessThanOrEqual LTEQ(Expr lhs, Expr rhs, Attribute... attributes) {
		return new Expr.LessThanOrEqual(lhs, rhs, attributes);
	}

	public static Expr.GreaterThan GT(Expr lhs, Expr rhs, Attribute... attributes) {
		return new Expr.GreaterThan(lhs, rhs, attributes);
	}

	public static Expr.GreaterThanOrEqual GTEQ(Expr lhs, Expr rhs, Attribute... attributes) {
		return new Expr.GreaterThanOrEqual(lhs, rhs, attributes);
	}

	public static Expr.LogicalAnd AND(Expr... operands) {
		return new Expr.LogicalAnd(Arrays.asList(operands), null);
	}

	public static Expr.LogicalOr OR(Expr... operands) {
		return new Expr.LogicalOr(Arrays.asList(operands), null);
	}

	public static Expr.LogicalNot NOT(Expr operand, Attribute... attributes) {
		return new Expr.LogicalNot(operand, attributes);
	}

	public static Expr.Implies IMPLIES(Expr lhs, Expr rhs, Attribute... attributes) {
		return new Expr.Implies(lhs, rhs, attributes);
	}

	public static Expr.Iff IFF(Expr lhs, Expr rhs, Attribute... attributes) {
		return new Expr.Iff(lhs, rhs, attributes);
	}

	public static Expr.IfThenElse ITE(Expr condition, Expr trueBranch, Expr falseBranch, Attribute... attributes) {
		return new Expr.IfThenElse(condition, trueBranch, falseBranch, attributes);
	}

	public static Expr.StorageAccess STORAGE(String root, Path... path) {
		return new Expr.StorageAccess(root, Arrays.asList(path), null);
	}

	public static Path.Field FIELD(String name) {
		return new Path.Field(name);
	}

	public static Path.Key KEY(Expr key) {
		return new Path.Key(key);
	}

	public static Path.Index INDEX(Expr index) {
		return new Path.Index(index);
	}

	public static Path.Length LENGTH() {
		return new Path.Length();
	}

	public static Expr.GhostAccess GHOST_READ(String name, Expr... keys) {
		return new Expr.GhostAccess(name, Arrays.asList(keys), Expr.GhostAccess.Timing.CURRENT, null);
	}

	public static Expr.GhostAccess GHOST_READ(String name, Expr.GhostAccess.Timing timing, Expr... keys) {
		return new Expr.GhostAccess(name, Arrays.asList(keys), timing, null);
	}

	public static Expr.Cast ASSERT_CAST(Type type, Expr operand, Attribute... attributes) {
		return new Expr.Cast(type, operand, true, attributes);
	}

	public static Expr.Cast REQUIRE_CAST(Type type, Expr operand, Attribute... attributes) {
		return new Expr.Cast(type, operand, false, attributes);
	}

	public static Expr.UniversalQuantifier FORALL(String name, Type type, Expr body, Attribute... attributes) {
		return new Expr.UniversalQuantifier(Arrays.asList(PARAM(name, type)), body, attributes);
	}

	public static Expr.UniversalQuantifier FORALL(List<Decl.Parameter> parameters, Expr body, Attribute... attributes) {
		return new Expr.UniversalQuantifier(parameters, body, attributes);
	}

	public static Expr.ExistentialQuantifier EXISTS(String name, Type type, Expr body, Attribute... attributes) {
		return new Expr.ExistentialQuantifier(Arrays.asList(PARAM(name, type)), body, attributes);
	}

	public static Expr.ExistentialQuantifier EXISTS(List<Decl.Parameter> parameters, Expr body, Attribute... attributes) {
		return new Expr.ExistentialQuantifier(parameters, body, attributes);
	}

	public static Expr.At AT(Expr operand, String snapshot, Attribute... attributes) {
		return new Expr.At(operand, snapshot, attributes);
	}

	public static Expr.Invoke INVOKE(String name, Expr... arguments) {
		return new Expr.Invoke(name, Arrays.asList(arguments), null);
	}

	public static Expr.MethodCall INVOKE_METHOD(String method, Expr environment, Expr... arguments) {
		return new Expr.MethodCall(method, environment, Arrays.asList(arguments), null);
	}

	public static Expr.FieldAccess FIELD_ACCESS(Expr operand, String field, Attribute... attributes) {
		return new Expr.FieldAccess(operand, field, attributes);
	}

	public static Expr.LastReverted LAST_REVERTED(Attribute... attributes) {
		return new Expr.LastReverted(attributes);
	}

	public static Expr.StorageComparison STORAGE_EQ(String lhs, String rhs, Attribute... attributes) {
		return new Expr.StorageComparison(lhs, rhs, attributes);
	}

	public static Expr.SelectorLiteral SELECTOR(String signature, Attribute... attributes) {
		return new Expr.SelectorLiteral(signature, attributes);
	}

	// Types

	public static Type.Uint UINT(int width) {
		return new Type.Uint(width);
	}

	public static Type.Sint INT(int width) {
		return new Type.Sint(width);
	}

	public static Type.Mapping MAPPING(Type key, Type value) {
		return new Type.Mapping(key, value);
	}

	public static Type.Array ARRAY(Type element) {
		return new Type.Array(element);
	}

	public static Type.Struct STRUCT(String name, Decl.Parameter... fields) {
		return new Type.Struct(name, Arrays.asList(fields));
	}

	public static Type.Enum ENUM(String name, String... values) {
		return new Type.Enum(name, Arrays.asList(values));
	}
}
