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
package specexec.io;

import java.io.ByteArrayOutputStream;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.util.List;

import specexec.core.SpecFile;
import specexec.core.SpecFile.Decl;
import specexec.core.SpecFile.Expr;
import specexec.core.SpecFile.Path;
import specexec.core.SpecFile.Pattern;
import specexec.core.SpecFile.Stmt;
import specexec.core.SpecFile.Type;
import specexec.core.Term;

/**
 * Writes specifications (and solver terms) in a readable concrete syntax. This
 * is used for diagnostics and for describing the assumptions and assertions of
 * a check, rather than as an input format.
 */
public class SpecFilePrinter {
	private final PrintWriter out;

	public SpecFilePrinter(OutputStream output) {
		this.out = new PrintWriter(new OutputStreamWriter(output, StandardCharsets.UTF_8));
	}

	public void flush() {
		out.flush();
	}

	public void write(SpecFile file) {
		for (Decl d : file.getDeclarations()) {
			writeDecl(0, d);
		}
		out.flush();
	}

	private void tab(int indent) {
		for (int i = 0; i < indent; ++i) {
			out.print("    ");
		}
	}

	// =========================================================================
	// Declarations
	// =========================================================================

	private void writeDecl(int indent, Decl d) {
		if (d instanceof Decl.Sort) {
			tab(indent);
			out.println("sort " + d.getName() + ";");
		} else if (d instanceof Decl.Ghost) {
			writeGhost(indent, (Decl.Ghost) d);
		} else if (d instanceof Decl.Hook) {
			writeHook(indent, (Decl.Hook) d);
		} else if (d instanceof Decl.Definition) {
			writeDefinition(indent, (Decl.Definition) d);
		} else if (d instanceof Decl.MethodSpec) {
			writeMethodSpec(indent, (Decl.MethodSpec) d);
		} else if (d instanceof Decl.Rule) {
			writeRule(indent, (Decl.Rule) d);
		} else if (d instanceof Decl.Invariant) {
			writeInvariant(indent, (Decl.Invariant) d);
		} else {
			throw new IllegalArgumentException("unknown declaration encountered (" + d.getClass().getName() + ")");
		}
	}

	private void writeGhost(int indent, Decl.Ghost d) {
		tab(indent);
		if (d.isPersistent()) {
			out.print("persistent ");
		}
		out.print("ghost ");
		List<Type> keys = d.getKeyTypes();
		for (int i = 0; i != keys.size(); ++i) {
			out.print("mapping(");
			writeType(keys.get(i));
			out.print(" => ");
		}
		writeType(d.getValueType());
		for (int i = 0; i != keys.size(); ++i) {
			out.print(")");
		}
		out.print(" " + d.getName());
		if (d.getAxioms().isEmpty() && d.getInitialAxioms().isEmpty()) {
			out.println(";");
		} else {
			out.println(" {");
			for (Expr axiom : d.getAxioms()) {
				tab(indent + 1);
				out.print("axiom ");
				writeExpression(axiom);
				out.println(";");
			}
			for (Expr axiom : d.getInitialAxioms()) {
				tab(indent + 1);
				out.print("init_state axiom ");
				writeExpression(axiom);
				out.println(";");
			}
			tab(indent);
			out.println("}");
		}
	}

	private void writeHook(int indent, Decl.Hook d) {
		tab(indent);
		out.print("hook " + (d.isWrite() ? "Sstore " : "Sload "));
		if (d.isWildcard()) {
			out.print("(slot ");
			writeParameter(d.getSlot());
			out.print(") ");
			writeParameter(d.getValue());
		} else if (d.isWrite()) {
			writePattern(d.getPattern());
			out.print(" ");
			writeParameter(d.getValue());
			if (d.getOldValue() != null) {
				out.print(" (");
				writeParameter(d.getOldValue());
				out.print(")");
			}
		} else {
			writeParameter(d.getValue());
			out.print(" ");
			writePattern(d.getPattern());
		}
		out.println(" {");
		writeStmt(indent + 1, d.getBody());
		tab(indent);
		out.println("}");
	}

	private void writeDefinition(int indent, Decl.Definition d) {
		tab(indent);
		out.print("definition " + d.getName());
		writeParameters(d.getParameters());
		out.print(" returns ");
		writeType(d.getReturnType());
		out.print(" = ");
		writeExpression(d.getBody());
		out.println(";");
	}

	private void writeMethodSpec(int indent, Decl.MethodSpec d) {
		tab(indent);
		out.print("function " + d.getName());
		if (d.isEnvfree()) {
			out.print(" envfree");
		}
		out.println(";");
	}

	private void writeRule(int indent, Decl.Rule d) {
		tab(indent);
		out.print("rule " + d.getName());
		writeParameters(d.getParameters());
		if (!d.getFilters().isEmpty()) {
			out.print(" filtered { ");
			for (int i = 0; i != d.getFilters().size(); ++i) {
				if (i != 0) {
					out.print(", ");
				}
				writeFilter(d.getFilters().get(i));
			}
			out.print(" }");
		}
		out.println(" {");
		writeStmt(indent + 1, d.getBody());
		tab(indent);
		out.println("}");
	}

	private void writeInvariant(int indent, Decl.Invariant d) {
		tab(indent);
		out.print("invariant " + d.getName());
		writeParameters(d.getParameters());
		out.print(" ");
		writeExpression(d.getPredicate());
		if (d.getFilter() != null) {
			out.print(" filtered { ");
			writeFilter(d.getFilter());
			out.print(" }");
		}
		if (d.getPreserved().isEmpty()) {
			out.println(";");
			return;
		}
		out.println(" {");
		for (Decl.Preserved p : d.getPreserved()) {
			tab(indent + 1);
			out.print("preserved");
			if (p.getSignature() != null) {
				out.print(" " + p.getSignature());
			}
			if (p.getEnvironment() != null) {
				out.print(" with (");
				writeParameter(p.getEnvironment());
				out.print(")");
			}
			out.println(" {");
			writeStmt(indent + 2, p.getBody());
			tab(indent + 1);
			out.println("}");
		}
		tab(indent);
		out.println("}");
	}

	private void writeFilter(Decl.Filter f) {
		out.print(f.getBinder() + " -> ");
		writeExpression(f.getCondition());
	}

	private void writeParameters(List<Decl.Parameter> parameters) {
		out.print("(");
		for (int i = 0; i != parameters.size(); ++i) {
			if (i != 0) {
				out.print(", ");
			}
			writeParameter(parameters.get(i));
		}
		out.print(")");
	}

	private void writeParameter(Decl.Parameter p) {
		writeType(p.getType());
		out.print(" " + p.getName());
	}

	private void writePattern(Pattern p) {
		out.print(p.getRoot());
		for (Pattern.Accessor a : p.getAccessors()) {
			if (a instanceof Pattern.Field) {
				out.print("." + ((Pattern.Field) a).getName());
			} else if (a instanceof Pattern.Key) {
				out.print("[KEY ");
				writeParameter(((Pattern.Key) a).getBinder());
				out.print("]");
			} else if (a instanceof Pattern.Index) {
				out.print("[INDEX ");
				writeParameter(((Pattern.Index) a).getBinder());
				out.print("]");
			} else if (a instanceof Pattern.Constant) {
				out.print("[");
				writeExpression(((Pattern.Constant) a).getValue());
				out.print("]");
			} else {
				out.print(".length");
			}
		}
	}

	// =========================================================================
	// Statements
	// =========================================================================

	private void writeStmt(int indent, Stmt s) {
		if (s instanceof Stmt.Sequence) {
			for (Stmt st : ((Stmt.Sequence) s).getAll()) {
				writeStmt(indent, st);
			}
			return;
		}
		tab(indent);
		if (s instanceof Stmt.Declaration) {
			Stmt.Declaration d = (Stmt.Declaration) s;
			writeParameter(d.getVariable());
			if (d.getInitialiser() != null) {
				out.print(" = ");
				writeExpression(d.getInitialiser());
			}
		} else if (s instanceof Stmt.Assign) {
			Stmt.Assign a = (Stmt.Assign) s;
			out.print(a.getName() + " = ");
			writeExpression(a.getValue());
		} else if (s instanceof Stmt.GhostAssign) {
			Stmt.GhostAssign a = (Stmt.GhostAssign) s;
			out.print(a.getGhost());
			writeKeys(a.getKeys());
			out.print(" = ");
			writeExpression(a.getValue());
		} else if (s instanceof Stmt.Require) {
			out.print("require ");
			writeExpression(((Stmt.Require) s).getCondition());
		} else if (s instanceof Stmt.Assert) {
			out.print("assert ");
			writeExpression(((Stmt.Assert) s).getCondition());
			writeMessage(((Stmt.Assert) s).getMessage());
		} else if (s instanceof Stmt.Satisfy) {
			out.print("satisfy ");
			writeExpression(((Stmt.Satisfy) s).getCondition());
			writeMessage(((Stmt.Satisfy) s).getMessage());
		} else if (s instanceof Stmt.Call) {
			writeCall((Stmt.Call) s);
		} else if (s instanceof Stmt.Havoc) {
			Stmt.Havoc h = (Stmt.Havoc) s;
			out.print("havoc " + h.getGhost());
			if (h.getAssumption() != null) {
				out.print(" assuming ");
				writeExpression(h.getAssumption());
			}
		} else if (s instanceof Stmt.Snapshot) {
			out.print("storage " + ((Stmt.Snapshot) s).getName() + " = lastStorage");
		} else if (s instanceof Stmt.IfElse) {
			writeIfElse(indent, (Stmt.IfElse) s);
			return;
		} else if (s instanceof Stmt.RequireInvariant) {
			Stmt.RequireInvariant r = (Stmt.RequireInvariant) s;
			out.print("requireInvariant " + r.getName());
			writeArguments(r.getArguments());
		} else {
			throw new IllegalArgumentException("unknown statement encountered (" + s.getClass().getName() + ")");
		}
		out.println(";");
	}

	private void writeMessage(String message) {
		if (message != null) {
			out.print(", \"" + message + "\"");
		}
	}

	private void writeCall(Stmt.Call s) {
		List<String> lvals = s.getLVals();
		for (int i = 0; i != lvals.size(); ++i) {
			out.print(i == 0 ? "" : ", ");
			out.print(lvals.get(i));
		}
		if (!lvals.isEmpty()) {
			out.print(" = ");
		}
		out.print(s.getMethod());
		if (s.isWithRevert()) {
			out.print("@withrevert");
		}
		out.print("(");
		boolean first = true;
		if (s.getEnvironment() != null) {
			writeExpression(s.getEnvironment());
			first = false;
		}
		if (s.getCallData() != null) {
			out.print((first ? "" : ", ") + s.getCallData());
		} else {
			for (Expr arg : s.getArguments()) {
				out.print(first ? "" : ", ");
				writeExpression(arg);
				first = false;
			}
		}
		out.print(")");
		if (s.getSnapshot() != null) {
			out.print(" at " + s.getSnapshot());
		}
	}

	private void writeIfElse(int indent, Stmt.IfElse s) {
		out.print("if (");
		writeExpression(s.getCondition());
		out.println(") {");
		writeStmt(indent + 1, s.getTrueBranch());
		tab(indent);
		if (s.getFalseBranch() != null) {
			out.println("} else {");
			writeStmt(indent + 1, s.getFalseBranch());
			tab(indent);
		}
		out.println("}");
	}

	// =========================================================================
	// Expressions
	// =========================================================================

	private void writeExpressionWithBraces(Expr e) {
		if (e instanceof Expr.BinaryOperator || e instanceof Expr.NaryOperator || e instanceof Expr.IfThenElse
				|| e instanceof Expr.Quantifier) {
			out.print("(");
			writeExpression(e);
			out.print(")");
		} else {
			writeExpression(e);
		}
	}

	private void writeExpression(Expr e) {
		if (e instanceof Expr.Integer) {
			out.print(((Expr.Integer) e).getValue());
		} else if (e instanceof Expr.Boolean) {
			out.print(((Expr.Boolean) e).getValue());
		} else if (e instanceof Expr.VariableAccess) {
			out.print(((Expr.VariableAccess) e).getName());
		} else if (e instanceof Expr.Negation) {
			out.print("-");
			writeExpressionWithBraces(((Expr.Negation) e).getOperand());
		} else if (e instanceof Expr.LogicalNot) {
			out.print("!");
			writeExpressionWithBraces(((Expr.LogicalNot) e).getOperand());
		} else if (e instanceof Expr.Cast) {
			Expr.Cast c = (Expr.Cast) e;
			out.print((c.isAsserting() ? "assert_" : "require_") + c.getType() + "(");
			writeExpression(c.getOperand());
			out.print(")");
		} else if (e instanceof Expr.At) {
			Expr.At a = (Expr.At) e;
			writeExpressionWithBraces(a.getOperand());
			out.print(" at " + a.getSnapshot());
		} else if (e instanceof Expr.FieldAccess) {
			Expr.FieldAccess f = (Expr.FieldAccess) e;
			writeExpressionWithBraces(f.getOperand());
			out.print("." + f.getField());
		} else if (e instanceof Expr.BinaryOperator) {
			writeBinaryOperator((Expr.BinaryOperator) e);
		} else if (e instanceof Expr.LogicalAnd) {
			writeNaryOperator(" && ", ((Expr.LogicalAnd) e).getOperands());
		} else if (e instanceof Expr.LogicalOr) {
			writeNaryOperator(" || ", ((Expr.LogicalOr) e).getOperands());
		} else if (e instanceof Expr.IfThenElse) {
			Expr.IfThenElse ite = (Expr.IfThenElse) e;
			writeExpressionWithBraces(ite.getCondition());
			out.print(" ? ");
			writeExpressionWithBraces(ite.getTrueBranch());
			out.print(" : ");
			writeExpressionWithBraces(ite.getFalseBranch());
		} else if (e instanceof Expr.StorageAccess) {
			writeStorageAccess((Expr.StorageAccess) e);
		} else if (e instanceof Expr.GhostAccess) {
			Expr.GhostAccess g = (Expr.GhostAccess) e;
			out.print(g.getName());
			if (g.getTiming() != Expr.GhostAccess.Timing.CURRENT) {
				out.print("@" + g.getTiming().toString().toLowerCase());
			}
			writeKeys(g.getKeys());
		} else if (e instanceof Expr.Quantifier) {
			Expr.Quantifier q = (Expr.Quantifier) e;
			out.print(e instanceof Expr.UniversalQuantifier ? "forall " : "exists ");
			for (int i = 0; i != q.getParameters().size(); ++i) {
				out.print(i == 0 ? "" : ", ");
				writeParameter(q.getParameters().get(i));
			}
			out.print(". ");
			writeExpression(q.getBody());
		} else if (e instanceof Expr.Invoke) {
			Expr.Invoke i = (Expr.Invoke) e;
			out.print(i.getName());
			writeArguments(i.getArguments());
		} else if (e instanceof Expr.MethodCall) {
			Expr.MethodCall m = (Expr.MethodCall) e;
			out.print(m.getMethod() + "(");
			boolean first = true;
			if (m.getEnvironment() != null) {
				writeExpression(m.getEnvironment());
				first = false;
			}
			for (Expr arg : m.getArguments()) {
				out.print(first ? "" : ", ");
				writeExpression(arg);
				first = false;
			}
			out.print(")");
		} else if (e instanceof Expr.LastReverted) {
			out.print("lastReverted");
		} else if (e instanceof Expr.StorageComparison) {
			Expr.StorageComparison c = (Expr.StorageComparison) e;
			out.print(c.getLeftHandSide() + " == " + c.getRightHandSide());
		} else if (e instanceof Expr.SelectorLiteral) {
			out.print("sig:" + ((Expr.SelectorLiteral) e).getSignature() + ".selector");
		} else {
			throw new IllegalArgumentException("unknown expression encountered (" + e.getClass().getName() + ")");
		}
	}

	private void writeBinaryOperator(Expr.BinaryOperator e) {
		writeExpressionWithBraces(e.getLeftHandSide());
		out.print(" " + operatorOf(e) + " ");
		writeExpressionWithBraces(e.getRightHandSide());
	}

	private static String operatorOf(Expr.BinaryOperator e) {
		if (e instanceof Expr.Addition) {
			return "+";
		} else if (e instanceof Expr.Subtraction) {
			return "-";
		} else if (e instanceof Expr.Multiplication) {
			return "*";
		} else if (e instanceof Expr.Division) {
			return "/";
		} else if (e instanceof Expr.Remainder) {
			return "%";
		} else if (e instanceof Expr.Equals) {
			return "==";
		} else if (e instanceof Expr.NotEquals) {
			return "!=";
		} else if (e instanceof Expr.LessThan) {
			return "<";
		} else if (e instanceof Expr.LessThanOrEqual) {
			return "<=";
		} else if (e instanceof Expr.GreaterThan) {
			return ">";
		} else if (e instanceof Expr.GreaterThanOrEqual) {
			return ">=";
		} else if (e instanceof Expr.Implies) {
			return "=>";
		} else if (e instanceof Expr.Iff) {
			return "<=>";
		} else {
			throw new IllegalArgumentException("unknown operator encountered (" + e.getClass().getName() + ")");
		}
	}

	private void writeNaryOperator(String operator, List<Expr> operands) {
		for (int i = 0; i != operands.size(); ++i) {
			if (i != 0) {
				out.print(operator);
			}
			writeExpressionWithBraces(operands.get(i));
		}
	}

	private void writeStorageAccess(Expr.StorageAccess e) {
		out.print(e.getRoot());
		for (Path p : e.getPath()) {
			if (p instanceof Path.Field) {
				out.print("." + ((Path.Field) p).getName());
			} else if (p instanceof Path.Key) {
				out.print("[");
				writeExpression(((Path.Key) p).getKey());
				out.print("]");
			} else if (p instanceof Path.Index) {
				out.print("[");
				writeExpression(((Path.Index) p).getIndex());
				out.print("]");
			} else {
				out.print(".length");
			}
		}
	}

	private void writeKeys(List<Expr> keys) {
		for (Expr k : keys) {
			out.print("[");
			writeExpression(k);
			out.print("]");
		}
	}

	private void writeArguments(List<Expr> arguments) {
		out.print("(");
		for (int i = 0; i != arguments.size(); ++i) {
			if (i != 0) {
				out.print(", ");
			}
			writeExpression(arguments.get(i));
		}
		out.print(")");
	}

	private void writeType(Type t) {
		out.print(t.toString());
	}

	// =========================================================================
	// Terms
	// =========================================================================

	private void writeTerm(Term t) {
		if (t instanceof Term.Constant) {
			out.print(((Term.Constant) t).getValue());
		} else if (t instanceof Term.Bool) {
			out.print(((Term.Bool) t).getValue());
		} else if (t instanceof Term.Variable) {
			out.print(((Term.Variable) t).getName());
		} else if (t instanceof Term.Quantifier) {
			Term.Quantifier q = (Term.Quantifier) t;
			out.print(q.isUniversal() ? "(forall " : "(exists ");
			Term.Variable[] vars = q.getVariables();
			for (int i = 0; i != vars.length; ++i) {
				out.print(i == 0 ? "" : ", ");
				out.print(vars[i].getName() + ":" + vars[i].getSort());
			}
			out.print(" :: ");
			writeTerm(q.getBody());
			out.print(")");
		} else if (t instanceof Term.Apply) {
			Term.Apply a = (Term.Apply) t;
			out.print(a.getName());
			writeTerms("(", ", ", ")", a.getAll());
		} else if (t instanceof Term.Select) {
			Term.Operator s = (Term.Operator) t;
			writeTerm(s.get(0));
			out.print("[");
			writeTerm(s.get(1));
			out.print("]");
		} else if (t instanceof Term.Store) {
			Term.Operator s = (Term.Operator) t;
			writeTerm(s.get(0));
			out.print("[");
			writeTerm(s.get(1));
			out.print(" := ");
			writeTerm(s.get(2));
			out.print("]");
		} else if (t instanceof Term.ConstArray) {
			out.print("const[");
			writeTerm(((Term.Operator) t).get(0));
			out.print("]");
		} else if (t instanceof Term.IfThenElse) {
			Term.IfThenElse ite = (Term.IfThenElse) t;
			out.print("(if ");
			writeTerm(ite.getCondition());
			out.print(" then ");
			writeTerm(ite.getTrueBranch());
			out.print(" else ");
			writeTerm(ite.getFalseBranch());
			out.print(")");
		} else if (t instanceof Term.Negate) {
			out.print("-");
			writeTerms("(", "", ")", ((Term.Operator) t).getAll());
		} else if (t instanceof Term.Not) {
			out.print("!");
			writeTerms("(", "", ")", ((Term.Operator) t).getAll());
		} else {
			writeTerms("(", " " + operatorOf((Term.Operator) t) + " ", ")", ((Term.Operator) t).getAll());
		}
	}

	private void writeTerms(String open, String separator, String close, Term[] terms) {
		out.print(open);
		for (int i = 0; i != terms.length; ++i) {
			if (i != 0) {
				out.print(separator);
			}
			writeTerm(terms[i]);
		}
		out.print(close);
	}

	private static String operatorOf(Term.Operator t) {
		if (t instanceof Term.Add) {
			return "+";
		} else if (t instanceof Term.Sub) {
			return "-";
		} else if (t instanceof Term.Mul) {
			return "*";
		} else if (t instanceof Term.Div) {
			return "div";
		} else if (t instanceof Term.Mod) {
			return "mod";
		} else if (t instanceof Term.Equal) {
			return "==";
		} else if (t instanceof Term.LessThan) {
			return "<";
		} else if (t instanceof Term.LessThanOrEqual) {
			return "<=";
		} else if (t instanceof Term.And) {
			return "&&";
		} else if (t instanceof Term.Or) {
			return "||";
		} else if (t instanceof Term.Implies) {
			return "==>";
		} else if (t instanceof Term.Iff) {
			return "<==>";
		} else {
			throw new IllegalArgumentException("unknown term encountered (" + t.getClass().getName() + ")");
		}
	}

	// =========================================================================
	// Helpers
	// =========================================================================

	public static String toString(SpecFile.Item item) {
		ByteArrayOutputStream buf = new ByteArrayOutputStream();
		SpecFilePrinter p = new SpecFilePrinter(buf);
		if (item instanceof Expr) {
			p.writeExpression((Expr) item);
		} else if (item instanceof Stmt) {
			p.writeStmt(0, (Stmt) item);
		} else if (item instanceof Decl) {
			p.writeDecl(0, (Decl) item);
		} else if (item instanceof Decl.Parameter) {
			p.writeParameter((Decl.Parameter) item);
		} else if (item instanceof Pattern) {
			p.writePattern((Pattern) item);
		} else if (item instanceof Type) {
			p.writeType((Type) item);
		} else {
			p.out.print(item.getClass().getSimpleName());
		}
		p.flush();
		return new String(buf.toByteArray(), StandardCharsets.UTF_8).trim();
	}

	public static String toString(Term term) {
		ByteArrayOutputStream buf = new ByteArrayOutputStream();
		SpecFilePrinter p = new SpecFilePrinter(buf);
		p.writeTerm(term);
		p.flush();
		return new String(buf.toByteArray(), StandardCharsets.UTF_8);
	}
}
