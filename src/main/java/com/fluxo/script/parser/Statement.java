package com.fluxo.script.parser;

import java.util.List;

public class Statement {

    public interface Stmt {
        void accept(StmtVisitor visitor);
    }

    public interface StmtVisitor {
        void visitExprStmt(ExprStmt stmt);
        void visitVarStmt(VarStmt stmt);
        void visitBlockStmt(Block stmt);
        void visitIfStmt(If stmt);
        void visitWhileStmt(While stmt);
        void visitFunctionStmt(FunctionStmt stmt);
        void visitReturnStmt(ReturnStmt stmt);
        void visitBreakStmt(BreakStmt stmt);
        void visitContinueStmt(ContinueStmt stmt);
        void visitModuleStmt(ModuleStmt stmt);
        void visitExportListStmt(ExportListStmt stmt);
        void visitImportFromStmt(ImportFromStmt stmt);
        void visitWaitStmt(WaitStmt stmt);
    }

    public static final class ExprStmt implements Stmt {
        public final Expr.ExprInterface expression;
        ExprStmt(Expr.ExprInterface expression) { this.expression = expression; }
        public void accept(StmtVisitor visitor) { visitor.visitExprStmt(this); }
    }

    /** {@code local name [= initializer]} */
    public static final class VarStmt implements Stmt {
        public final Token name;
        public final Expr.ExprInterface initializer;
        VarStmt(Token name, Expr.ExprInterface initializer) { this.name = name; this.initializer = initializer; }
        public void accept(StmtVisitor visitor) { visitor.visitVarStmt(this); }
    }

    public static final class Block implements Stmt {
        public final List<Stmt> statements;
        Block(List<Stmt> statements) { this.statements = statements; }
        public void accept(StmtVisitor visitor) { visitor.visitBlockStmt(this); }
    }

    public static final class If implements Stmt {
        public final Expr.ExprInterface condition;
        public final Stmt thenBranch;
        public final Stmt elseBranch;
        If(Expr.ExprInterface condition, Stmt thenBranch, Stmt elseBranch) {
            this.condition = condition;
            this.thenBranch = thenBranch;
            this.elseBranch = elseBranch;
        }
        public void accept(StmtVisitor visitor) { visitor.visitIfStmt(this); }
    }

    /**
     * Loop node for both {@code while} and desugared {@code for}. The increment
     * (for-loops only) also runs after a {@code continue}.
     */
    public static final class While implements Stmt {
        public final Token keyword;
        public final Expr.ExprInterface condition;
        public final Stmt body;
        public final Expr.ExprInterface increment;
        While(Token keyword, Expr.ExprInterface condition, Stmt body, Expr.ExprInterface increment) {
            this.keyword = keyword;
            this.condition = condition;
            this.body = body;
            this.increment = increment;
        }
        public void accept(StmtVisitor visitor) { visitor.visitWhileStmt(this); }
    }

    public static final class FunctionStmt implements Stmt {
        public final Token name;
        public final List<Token> params;
        public final Token restParam;
        public final List<Stmt> body;
        public final boolean exported;
        FunctionStmt(Token name, List<Token> params, Token restParam, List<Stmt> body, boolean exported) {
            this.name = name;
            this.params = params;
            this.restParam = restParam;
            this.body = body;
            this.exported = exported;
        }
        public void accept(StmtVisitor visitor) { visitor.visitFunctionStmt(this); }
    }

    public static final class ReturnStmt implements Stmt {
        public final Token keyword;
        public final Expr.ExprInterface value;
        ReturnStmt(Token keyword, Expr.ExprInterface value) { this.keyword = keyword; this.value = value; }
        public void accept(StmtVisitor visitor) { visitor.visitReturnStmt(this); }
    }

    public static final class BreakStmt implements Stmt {
        public final Token keyword;
        BreakStmt(Token keyword) { this.keyword = keyword; }
        public void accept(StmtVisitor visitor) { visitor.visitBreakStmt(this); }
    }

    public static final class ContinueStmt implements Stmt {
        public final Token keyword;
        ContinueStmt(Token keyword) { this.keyword = keyword; }
        public void accept(StmtVisitor visitor) { visitor.visitContinueStmt(this); }
    }

    /** {@code module name { ... }}, top level only. */
    public static final class ModuleStmt implements Stmt {
        public final Token name;
        public final List<Stmt> body;
        ModuleStmt(Token name, List<Stmt> body) { this.name = name; this.body = body; }
        public void accept(StmtVisitor visitor) { visitor.visitModuleStmt(this); }
    }

    /** {@code export { a, b }} */
    public static final class ExportListStmt implements Stmt {
        public final Token keyword;
        public final List<Token> names;
        ExportListStmt(Token keyword, List<Token> names) { this.keyword = keyword; this.names = names; }
        public void accept(StmtVisitor visitor) { visitor.visitExportListStmt(this); }
    }

    /** {@code import from "path" { a, b }} */
    public static final class ImportFromStmt implements Stmt {
        public final Token keyword;
        public final String specifier;
        public final List<Token> names;
        ImportFromStmt(Token keyword, String specifier, List<Token> names) {
            this.keyword = keyword;
            this.specifier = specifier;
            this.names = names;
        }
        public void accept(StmtVisitor visitor) { visitor.visitImportFromStmt(this); }
    }

    /** {@code wait(seconds) { body }}: body runs later, control continues now. */
    public static final class WaitStmt implements Stmt {
        public final Token keyword;
        public final Expr.ExprInterface seconds;
        public final List<Stmt> body;
        WaitStmt(Token keyword, Expr.ExprInterface seconds, List<Stmt> body) {
            this.keyword = keyword;
            this.seconds = seconds;
            this.body = body;
        }
        public void accept(StmtVisitor visitor) { visitor.visitWaitStmt(this); }
    }
}
