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

import specexec.core.SpecFile.Stmt;

/**
 * Walks the statements of a rule, hook or preserved block in order. Compound
 * statements are traversed by default, whilst each kind of simple statement
 * must be handled by the subclass.
 */
public abstract class AbstractStatementVisitor {

    public void visitStatement(Stmt s) {
        if (s instanceof Stmt.Declaration) {
            visitDeclaration((Stmt.Declaration) s);
        } else if (s instanceof Stmt.Assign) {
            visitAssign((Stmt.Assign) s);
        } else if (s instanceof Stmt.GhostAssign) {
            visitGhostAssign((Stmt.GhostAssign) s);
        } else if (s instanceof Stmt.Require) {
            visitRequire((Stmt.Require) s);
        } else if (s instanceof Stmt.Assert) {
            visitAssert((Stmt.Assert) s);
        } else if (s instanceof Stmt.Satisfy) {
            visitSatisfy((Stmt.Satisfy) s);
        } else if (s instanceof Stmt.Call) {
            visitCall((Stmt.Call) s);
        } else if (s instanceof Stmt.Havoc) {
            visitHavoc((Stmt.Havoc) s);
        } else if (s instanceof Stmt.Snapshot) {
            visitSnapshot((Stmt.Snapshot) s);
        } else if (s instanceof Stmt.IfElse) {
            visitIfElse((Stmt.IfElse) s);
        } else if (s instanceof Stmt.RequireInvariant) {
            visitRequireInvariant((Stmt.RequireInvariant) s);
        } else if (s instanceof Stmt.Sequence) {
            visitSequence((Stmt.Sequence) s);
        } else {
            throw new IllegalArgumentException("unknown statement encountered (" + s.getClass().getName() + ")");
        }
    }

    protected void visitSequence(Stmt.Sequence s) {
        for (int i = 0; i != s.size(); ++i) {
            visitStatement(s.get(i));
        }
    }

    protected void visitIfElse(Stmt.IfElse s) {
        visitStatement(s.getTrueBranch());
        if (s.getFalseBranch() != null) {
            visitStatement(s.getFalseBranch());
        }
    }

    protected abstract void visitDeclaration(Stmt.Declaration s);
    protected abstract void visitAssign(Stmt.Assign s);
    protected abstract void visitGhostAssign(Stmt.GhostAssign s);
    protected abstract void visitRequire(Stmt.Require s);
    protected abstract void visitAssert(Stmt.Assert s);
    protected abstract void visitSatisfy(Stmt.Satisfy s);
    protected abstract void visitCall(Stmt.Call s);
    protected abstract void visitHavoc(Stmt.Havoc s);
    protected abstract void visitSnapshot(Stmt.Snapshot s);
    protected abstract void visitRequireInvariant(Stmt.RequireInvariant s);
}
