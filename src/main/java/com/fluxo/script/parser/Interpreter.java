package com.fluxo.script.parser;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fluxo.script.errors.FluxoError;
import com.fluxo.script.errors.FluxoReferenceError;
import com.fluxo.script.errors.FluxoRuntimeError;
import com.fluxo.script.errors.FluxoTypeError;
import com.fluxo.script.errors.ModuleError;
import com.fluxo.script.errors.ModuleNotFoundError;
import com.fluxo.script.parser.Expr.ArrayLiteral;
import com.fluxo.script.parser.Expr.Assign;
import com.fluxo.script.parser.Expr.Binary;
import com.fluxo.script.parser.Expr.Call;
import com.fluxo.script.parser.Expr.FunctionExpr;
import com.fluxo.script.parser.Expr.Get;
import com.fluxo.script.parser.Expr.Import;
import com.fluxo.script.parser.Expr.Index;
import com.fluxo.script.parser.Expr.Literal;
import com.fluxo.script.parser.Expr.Logical;
import com.fluxo.script.parser.Expr.ObjectLiteral;
import com.fluxo.script.parser.Expr.SetIndex;
import com.fluxo.script.parser.Expr.Unary;
import com.fluxo.script.parser.Expr.Variable;
import com.fluxo.script.parser.Statement.Block;
import com.fluxo.script.parser.Statement.BreakStmt;
import com.fluxo.script.parser.Statement.ContinueStmt;
import com.fluxo.script.parser.Statement.ExportListStmt;
import com.fluxo.script.parser.Statement.ExprStmt;
import com.fluxo.script.parser.Statement.FunctionStmt;
import com.fluxo.script.parser.Statement.If;
import com.fluxo.script.parser.Statement.ImportFromStmt;
import com.fluxo.script.parser.Statement.ModuleStmt;
import com.fluxo.script.parser.Statement.ReturnStmt;
import com.fluxo.script.parser.Statement.Stmt;
import com.fluxo.script.parser.Statement.VarStmt;
import com.fluxo.script.parser.Statement.WaitStmt;
import com.fluxo.script.parser.Statement.While;
import com.fluxo.script.resolve.FileKind;
import com.fluxo.script.resolve.ModuleResolver;

/**
 * Tree-walking evaluator for one source file.
 *
 * A run creates one Interpreter per file and hands each the run's shared
 * {@link ExecutionContext}. Deferred ({@code wait}) bodies re-enter the same
 * instance later, from the context's scheduler.
 */
public class Interpreter implements Expr.ExprVisitor<Value>, Statement.StmtVisitor {

    private final ExecutionContext ctx;
    private final String path;
    // File whose code is running: differs from path inside functions defined elsewhere.
    private String currentFile;

    Environment env;
    private FluxoModule fileModule;
    private boolean inModuleBody = false;
    private int callDepth = 0;

    public Interpreter(ExecutionContext ctx, String path) {
        this.ctx = ctx;
        this.path = path;
        this.currentFile = path;
        this.env = ctx.globals();
    }

    public ExecutionContext context() {
        return ctx;
    }

    public String path() {
        return path;
    }

    // ===================== FILE ENTRY =====================

    /**
     * Evaluates a whole file. Registers the file's module first, freezes it
     * on success, and binds a declared module's name globally.
     *
     * @throws FluxoError when evaluation stops; the module is then marked failed
     */
    public FluxoModule run(Program program) {
        fileModule = new FluxoModule(path, ModuleResolver.stemOf(path));
        ModuleStmt decl = program.moduleDeclaration();
        if (decl != null) fileModule.declareName(decl.name.lexeme);
        ctx.registerModule(path, fileModule);

        ctx.pushInitializing(path);
        String prevFile = ctx.beginFile(path);
        try {
            executeBlock(program.statements, ctx.globals().childScope());
        } catch (ReturnSignal rs) {
            // top-level return ends the file
        } catch (FluxoError e) {
            fileModule.markFailed(e.attachFile(path));
            throw e;
        } catch (StackOverflowError so) {
            FluxoError e = new FluxoRuntimeError("Maximum call stack size exceeded").attachFile(path);
            fileModule.markFailed(e);
            throw e;
        } catch (RuntimeException re) {
            FluxoError e = new FluxoError("InternalError", String.valueOf(re.getMessage()), re).attachFile(path);
            fileModule.markFailed(e);
            throw e;
        } finally {
            ctx.popInitializing();
            ctx.beginFile(prevFile);
        }

        fileModule.freeze();
        if (fileModule.isDeclared()) {
            ctx.globals().define(fileModule.name(), Value.module(fileModule));
        }
        return fileModule;
    }

    /** Evaluates code that belongs to no module (inline entry code). Bindings go to a fresh file scope. */
    public void runDetached(Program program) {
        fileModule = new FluxoModule(path, ModuleResolver.stemOf(path));
        String prevFile = ctx.beginFile(path);
        try {
            executeBlock(program.statements, ctx.globals().childScope());
        } catch (ReturnSignal rs) {
            // top-level return ends the code
        } catch (FluxoError e) {
            throw e.attachFile(path);
        } catch (StackOverflowError so) {
            throw new FluxoRuntimeError("Maximum call stack size exceeded").attachFile(path);
        } catch (RuntimeException re) {
            throw new FluxoError("InternalError", String.valueOf(re.getMessage()), re).attachFile(path);
        } finally {
            ctx.beginFile(prevFile);
        }
    }

    /** Invokes a Fluxo function from host code (event handlers, entry points). */
    public Value invoke(Value fn, List<Value> args) {
        if (fn == null || fn.getType() != Value.Type.FUNC) {
            throw new FluxoTypeError((fn == null ? "undefined" : fn.typeName()) + " is not a function");
        }
        return fn.asFunc().call(this, args, null);
    }

    // ===================== STATEMENTS =====================

    /** Runs {@code statements} in {@code scope}, function declarations first. */
    void executeBlock(List<Stmt> statements, Environment scope) {
        Environment previous = env;
        env = scope;
        try {
            for (Stmt s : statements) {
                if (s instanceof FunctionStmt) s.accept(this);
            }
            for (Stmt s : statements) {
                if (!(s instanceof FunctionStmt)) s.accept(this);
            }
        } finally {
            env = previous;
        }
    }

    void enterCall(String name, Token site) {
        if (callDepth >= ctx.options().maxCallDepth()) {
            FluxoRuntimeError e = new FluxoRuntimeError("Maximum call depth exceeded (" + ctx.options().maxCallDepth() + ") in " + name + "()");
            if (site != null) e.attachPosition(site.line, site.column);
            throw e;
        }
        callDepth++;
    }

    void exitCall() {
        callDepth--;
    }

    /** Switches relative import resolution to {@code file}; returns the previous one. */
    String enterFile(String file) {
        String prev = currentFile;
        if (file != null) currentFile = file;
        return prev;
    }

    void restoreFile(String prev) {
        currentFile = prev;
    }

    @Override
    public void visitExprStmt(ExprStmt stmt) {
        eval(stmt.expression);
    }

    @Override
    public void visitVarStmt(VarStmt stmt) {
        Value v = (stmt.initializer == null) ? Value.undefined() : eval(stmt.initializer);
        env.define(stmt.name.lexeme, v);
    }

    @Override
    public void visitBlockStmt(Block stmt) {
        executeBlock(stmt.statements, env.childScope());
    }

    @Override
    public void visitIfStmt(If stmt) {
        if (eval(stmt.condition).isTruthy()) {
            stmt.thenBranch.accept(this);
        } else if (stmt.elseBranch != null) {
            stmt.elseBranch.accept(this);
        }
    }

    @Override
    public void visitWhileStmt(While stmt) {
        int limit = ctx.options().maxLoopIterations();
        int iterations = 0;
        while (eval(stmt.condition).isTruthy()) {
            if (++iterations > limit) {
                throw located(new FluxoRuntimeError("Loop exceeded " + limit + " iterations"), stmt.keyword);
            }
            try {
                stmt.body.accept(this);
            } catch (BreakSignal bs) {
                break;
            } catch (ContinueSignal cs) {
                // fall through to the increment
            }
            if (stmt.increment != null) eval(stmt.increment);
        }
    }

    @Override
    public void visitFunctionStmt(FunctionStmt stmt) {
        String name = stmt.name.lexeme;
        Value fn = Value.func(new UserFunction(name, stmt.params, stmt.restParam, stmt.body, env, currentFile));
        env.define(name, fn);
        if (stmt.exported) {
            try {
                fileModule.export(name, fn);
            } catch (FluxoError e) {
                throw located(e, stmt.name);
            }
        }
    }

    @Override
    public void visitReturnStmt(ReturnStmt stmt) {
        Value v = (stmt.value == null) ? Value.undefined() : eval(stmt.value);
        throw new ReturnSignal(v);
    }

    @Override
    public void visitBreakStmt(BreakStmt stmt) {
        throw new BreakSignal();
    }

    @Override
    public void visitContinueStmt(ContinueStmt stmt) {
        throw new ContinueSignal();
    }

    @Override
    public void visitModuleStmt(ModuleStmt stmt) {
        Environment moduleScope = env.childScope();
        boolean saved = inModuleBody;
        inModuleBody = true;
        try {
            executeBlock(stmt.body, moduleScope);
        } finally {
            inModuleBody = saved;
        }
        // the declaring file sees its module under its name right away
        env.define(stmt.name.lexeme, Value.module(fileModule));
    }

    @Override
    public void visitExportListStmt(ExportListStmt stmt) {
        if (!inModuleBody) {
            String where = (FileKind.fromPath(path) == FileKind.SCRIPT) ? "script file " : "file ";
            throw located(new ModuleError("export { } is only allowed inside a module block ("
                    + where + path + " declares none)"), stmt.keyword);
        }
        for (Token name : stmt.names) {
            Value v = env.get(name.lexeme);
            if (v == null) {
                throw located(new FluxoReferenceError("Cannot export '" + name.lexeme + "': it is not defined"), name);
            }
            fileModule.export(name.lexeme, v);
        }
    }

    @Override
    public void visitImportFromStmt(ImportFromStmt stmt) {
        FluxoModule module = loadModule(stmt.specifier, stmt.keyword);
        for (Token name : stmt.names) {
            if (!module.hasExport(name.lexeme)) {
                throw located(new FluxoReferenceError("Module '" + module.name() + "' has no export '" + name.lexeme + "'"), name);
            }
            env.define(name.lexeme, module.get(name.lexeme));
        }
    }

    @Override
    public void visitWaitStmt(WaitStmt stmt) {
        Value seconds = eval(stmt.seconds);
        double s;
        try {
            s = seconds.toNumber();
        } catch (FluxoError e) {
            throw located(e, stmt.keyword);
        }
        if (Double.isNaN(s)) {
            throw located(new FluxoTypeError("wait() expects a number of seconds, got " + seconds.toDisplayString()), stmt.keyword);
        }
        long delay = Math.round(Math.max(0.0, s) * 1000.0);
        Environment captured = env;
        boolean moduleBody = inModuleBody;
        String file = currentFile;
        try {
            ctx.scheduleDeferred(delay, path, () -> runDeferred(stmt.body, captured, moduleBody, file));
        } catch (FluxoError e) {
            throw located(e, stmt.keyword);
        }
    }

    private void runDeferred(List<Stmt> body, Environment scope, boolean moduleBody, String file) {
        String savedFile = enterFile(file);
        Environment savedEnv = env;
        boolean savedModule = inModuleBody;
        int savedDepth = callDepth;
        inModuleBody = moduleBody;
        callDepth = 0;
        try {
            executeBlock(body, scope.childScope());
        } catch (ReturnSignal rs) {
            // return ends the deferred body only
        } catch (FluxoError e) {
            ctx.reportError(e.attachFile(path));
        } catch (StackOverflowError so) {
            ctx.reportError(new FluxoRuntimeError("Maximum call stack size exceeded").attachFile(path));
        } finally {
            env = savedEnv;
            inModuleBody = savedModule;
            callDepth = savedDepth;
            restoreFile(savedFile);
        }
    }

    // ===================== EXPRESSIONS =====================

    Value eval(Expr.ExprInterface expr) {
        return expr.accept(this);
    }

    @Override
    public Value visitLiteralExpr(Literal expr) {
        return expr.value;
    }

    @Override
    public Value visitArrayLiteralExpr(ArrayLiteral expr) {
        List<Value> out = new ArrayList<>(expr.items.size());
        for (Expr.ExprInterface item : expr.items) out.add(eval(item));
        return Value.array(out);
    }

    @Override
    public Value visitObjectLiteralExpr(ObjectLiteral expr) {
        Map<String, Value> out = new LinkedHashMap<>();
        for (Map.Entry<String, Expr.ExprInterface> e : expr.entries.entrySet()) {
            out.put(e.getKey(), eval(e.getValue()));
        }
        return Value.map(out);
    }

    @Override
    public Value visitFunctionExpr(FunctionExpr expr) {
        String name = (expr.name == null) ? null : expr.name.lexeme;
        return Value.func(new UserFunction(name, expr.params, expr.restParam, expr.body, env, currentFile));
    }

    @Override
    public Value visitVariableExpr(Variable expr) {
        Value v = env.get(expr.name.lexeme);
        if (v == null) {
            throw located(new FluxoReferenceError(expr.name.lexeme + " is not defined"), expr.name);
        }
        return v;
    }

    @Override
    public Value visitAssignExpr(Assign expr) {
        Value v = eval(expr.value);
        String name = expr.name.lexeme;
        if (!env.assign(name, v)) {
            if (ctx.options().undeclaredAssignment() == RunOptions.UndeclaredAssignment.CREATE_GLOBAL) {
                ctx.globals().define(name, v);
            } else {
                throw located(new FluxoReferenceError("Assignment to undeclared variable '" + name
                        + "' (declare it with 'local' first)"), expr.name);
            }
        }
        return v;
    }

    @Override
    public Value visitLogicalExpr(Logical expr) {
        Value left = eval(expr.left);
        if (expr.operator.type == TokenType.OR_OR) {
            return left.isTruthy() ? left : eval(expr.right);
        }
        return left.isTruthy() ? eval(expr.right) : left;
    }

    @Override
    public Value visitUnaryExpr(Unary expr) {
        Value right = eval(expr.right);
        try {
            if (expr.operator.type == TokenType.BANG) return Value.bool(!right.isTruthy());
            return Value.number(-right.toNumber());
        } catch (FluxoError e) {
            throw located(e, expr.operator);
        }
    }

    @Override
    public Value visitBinaryExpr(Binary expr) {
        Value left = eval(expr.left);
        Value right = eval(expr.right);
        try {
            return Operators.binary(expr.operator.type, left, right);
        } catch (FluxoError e) {
            throw located(e, expr.operator);
        }
    }

    @Override
    public Value visitCallExpr(Call expr) {
        Value callee = eval(expr.callee);
        List<Value> args = new ArrayList<>(expr.arguments.size());
        for (Expr.ExprInterface a : expr.arguments) args.add(eval(a));

        if (callee.getType() != Value.Type.FUNC) {
            throw located(new FluxoTypeError(describeCallee(expr.callee) + " is not a function (got "
                    + callee.typeName() + ")"), expr.paren);
        }
        try {
            return callee.asFunc().call(this, args, expr.paren);
        } catch (FluxoError e) {
            throw located(e, expr.paren);
        }
    }

    @Override
    public Value visitGetExpr(Get expr) {
        Value object = eval(expr.object);
        try {
            return Members.get(object, expr.name.lexeme);
        } catch (FluxoError e) {
            throw located(e, expr.name);
        }
    }

    @Override
    public Value visitSetExpr(Expr.Set expr) {
        Value object = eval(expr.object);
        Value v = eval(expr.value);
        String name = expr.name.lexeme;
        switch (object.getType()) {
            case MAP:
                object.asMap().put(name, v);
                return v;
            case MODULE:
                throw located(new FluxoTypeError("Cannot assign to '" + name + "': module '"
                        + object.asModule().name() + "' is read-only"), expr.name);
            default:
                throw located(new FluxoTypeError("Cannot set property '" + name + "' on " + object.typeName()), expr.name);
        }
    }

    @Override
    public Value visitIndexExpr(Index expr) {
        Value target = eval(expr.target);
        Value index = eval(expr.index);
        try {
            return Members.index(target, index);
        } catch (FluxoError e) {
            throw located(e, expr.bracket);
        }
    }

    @Override
    public Value visitSetIndexExpr(SetIndex expr) {
        Value target = eval(expr.target);
        Value index = eval(expr.index);
        Value v = eval(expr.value);
        try {
            Members.setIndex(target, index, v);
            return v;
        } catch (FluxoError e) {
            throw located(e, expr.bracket);
        }
    }

    @Override
    public Value visitImportExpr(Import expr) {
        Value spec = eval(expr.specifier);
        if (spec.getType() != Value.Type.STRING) {
            throw located(new FluxoTypeError(expr.keyword.lexeme + "() expects a path string, got " + spec.typeName()), expr.keyword);
        }
        FluxoModule module = loadModule(spec.asString(), expr.keyword);
        Value ns = Value.module(module);
        env.define(module.name(), ns);
        return ns;
    }

    private FluxoModule loadModule(String specifier, Token site) {
        ModuleLoader loader = ctx.moduleLoader();
        try {
            String canonical = ctx.resolver().resolve(specifier, currentFile);
            if (loader == null) throw new ModuleNotFoundError(canonical);
            return loader.load(canonical, ctx);
        } catch (FluxoError e) {
            throw located(e, site);
        }
    }

    // ===================== HELPERS =====================

    private static String describeCallee(Expr.ExprInterface callee) {
        if (callee instanceof Variable) return ((Variable) callee).name.lexeme;
        if (callee instanceof Get) {
            Get g = (Get) callee;
            return describeCallee(g.object) + "." + g.name.lexeme;
        }
        return "expression";
    }

    private static FluxoError located(FluxoError e, Token t) {
        if (t != null) e.attachPosition(t.line, t.column);
        return e;
    }

    public static final class ReturnSignal extends RuntimeException {
        private static final long serialVersionUID = 1L;
        final Value value;
        ReturnSignal(Value value) { super(null, null, false, false); this.value = value; }
    }

    public static final class BreakSignal extends RuntimeException {
        private static final long serialVersionUID = 1L;
        BreakSignal() { super(null, null, false, false); }
    }

    public static final class ContinueSignal extends RuntimeException {
        private static final long serialVersionUID = 1L;
        ContinueSignal() { super(null, null, false, false); }
    }
}
