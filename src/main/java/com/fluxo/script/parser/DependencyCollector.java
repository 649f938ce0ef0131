package com.fluxo.script.parser;

import com.fluxo.script.parser.Expr.*;
import com.fluxo.script.parser.Statement.*;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

/**
 * Collects the import specifiers a program names literally, in source order.
 * Covers {@code import from "p" {..}}, {@code import("p")} and {@code require("p")}
 * anywhere in the tree, including function and deferred bodies.
 * Specifiers computed at run time are not visible here.
 */
public final class DependencyCollector implements ExprVisitor<Void>, StmtVisitor {

    private final LinkedHashSet<String> specifiers = new LinkedHashSet<>();

    private DependencyCollector() {}

    public static List<String> collect(Program program) {
        DependencyCollector c = new DependencyCollector();
        c.stmts(program.statements);
        return new ArrayList<>(c.specifiers);
    }

    private void stmts(List<Stmt> list) {
        for (Stmt s : list) s.accept(this);
    }

    private void expr(ExprInterface e) {
        if (e != null) e.accept(this);
    }

    @Override public void visitExprStmt(ExprStmt stmt) { expr(stmt.expression); }
    @Override public void visitVarStmt(VarStmt stmt) { expr(stmt.initializer); }
    @Override public void visitBlockStmt(Block stmt) { stmts(stmt.statements); }

    @Override
    public void visitIfStmt(If stmt) {
        expr(stmt.condition);
        stmt.thenBranch.accept(this);
        if (stmt.elseBranch != null) stmt.elseBranch.accept(this);
    }

    @Override
    public void visitWhileStmt(While stmt) {
        expr(stmt.condition);
        stmt.body.accept(this);
        expr(stmt.increment);
    }

    @Override public void visitFunctionStmt(FunctionStmt stmt) { stmts(stmt.body); }
    @Override public void visitReturnStmt(ReturnStmt stmt) { expr(stmt.value); }
    @Override public void visitBreakStmt(BreakStmt stmt) { }
    @Override public void visitContinueStmt(ContinueStmt stmt) { }
    @Override public void visitModuleStmt(ModuleStmt stmt) { stmts(stmt.body); }
    @Override public void visitExportListStmt(ExportListStmt stmt) { }
    @Override public void visitImportFromStmt(ImportFromStmt stmt) { specifiers.add(stmt.specifier); }

    @Override
    public void visitWaitStmt(WaitStmt stmt) {
        expr(stmt.seconds);
        stmts(stmt.body);
    }

    @Override
    public Void visitBinaryExpr(Binary expr) {
        expr(expr.left);
        expr(expr.right);
        return null;
    }

    @Override
    public Void visitUnaryExpr(Unary expr) {
        expr(expr.right);
        return null;
    }

    @Override public Void visitLiteralExpr(Literal expr) { return null; }

    @Override
    public Void visitArrayLiteralExpr(ArrayLiteral expr) {
        for (ExprInterface e : expr.items) expr(e);
        return null;
    }

    @Override
    public Void visitObjectLiteralExpr(ObjectLiteral expr) {
        for (Map.Entry<String, ExprInterface> e : expr.entries.entrySet()) expr(e.getValue());
        return null;
    }

    @Override public Void visitVariableExpr(Variable expr) { return null; }

    @Override
    public Void visitAssignExpr(Assign expr) {
        expr(expr.value);
        return null;
    }

    @Override
    public Void visitLogicalExpr(Logical expr) {
        expr(expr.left);
        expr(expr.right);
        return null;
    }

    @Override
    public Void visitCallExpr(Call expr) {
        expr(expr.callee);
        for (ExprInterface a : expr.arguments) expr(a);
        return null;
    }

    @Override
    public Void visitGetExpr(Get expr) {
        expr(expr.object);
        return null;
    }

    @Override
    public Void visitSetExpr(Expr.Set expr) {
        expr(expr.object);
        expr(expr.value);
        return null;
    }

    @Override
    public Void visitIndexExpr(Index expr) {
        expr(expr.target);
        expr(expr.index);
        return null;
    }

    @Override
    public Void visitSetIndexExpr(SetIndex expr) {
        expr(expr.target);
        expr(expr.index);
        expr(expr.value);
        return null;
    }

    @Override
    public Void visitFunctionExpr(FunctionExpr expr) {
        stmts(expr.body);
        return null;
    }

    @Override
    public Void visitImportExpr(Import expr) {
        String spec = expr.staticSpecifier();
        if (spec != null) specifiers.add(spec);
        else expr(expr.specifier);
        return null;
    }
}
