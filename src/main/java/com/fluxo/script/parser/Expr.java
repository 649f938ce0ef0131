package com.fluxo.script.parser;

import java.util.LinkedHashMap;
import java.util.List;

public class Expr {

    public interface ExprInterface {
        <R> R accept(ExprVisitor<R> visitor);
    }

    public interface ExprVisitor<R> {
        R visitBinaryExpr(Binary expr);
        R visitUnaryExpr(Unary expr);
        R visitLiteralExpr(Literal expr);
        R visitArrayLiteralExpr(ArrayLiteral expr);
        R visitObjectLiteralExpr(ObjectLiteral expr);
        R visitVariableExpr(Variable expr);
        R visitAssignExpr(Assign expr);
        R visitLogicalExpr(Logical expr);
        R visitCallExpr(Call expr);
        R visitGetExpr(Get expr);
        R visitSetExpr(Set expr);
        R visitIndexExpr(Index expr);
        R visitSetIndexExpr(SetIndex expr);
        R visitFunctionExpr(FunctionExpr expr);
        R visitImportExpr(Import expr);
    }

    // -------------------------
    // Operators
    // -------------------------

    public static final class Binary implements ExprInterface {
        public final ExprInterface left;
        public final Token operator;
        public final ExprInterface right;

        public Binary(ExprInterface left, Token operator, ExprInterface right) {
            this.left = left;
            this.operator = operator;
            this.right = right;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitBinaryExpr(this);
        }
    }

    public static final class Unary implements ExprInterface {
        public final Token operator;
        public final ExprInterface right;

        public Unary(Token operator, ExprInterface right) {
            this.operator = operator;
            this.right = right;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitUnaryExpr(this);
        }
    }

    /** Short-circuit {@code &&} / {@code ||}; yields one of its operands. */
    public static final class Logical implements ExprInterface {
        public final ExprInterface left;
        public final Token operator;
        public final ExprInterface right;

        public Logical(ExprInterface left, Token operator, ExprInterface right) {
            this.left = left;
            this.operator = operator;
            this.right = right;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitLogicalExpr(this);
        }
    }

    // -------------------------
    // Literals
    // -------------------------

    public static final class Literal implements ExprInterface {
        public final Value value;

        public Literal(Value value) {
            this.value = value;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitLiteralExpr(this);
        }
    }

    public static final class ArrayLiteral implements ExprInterface {
        public final Token bracket;
        public final List<ExprInterface> items;

        public ArrayLiteral(Token bracket, List<ExprInterface> items) {
            this.bracket = bracket;
            this.items = items;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitArrayLiteralExpr(this);
        }
    }

    public static final class ObjectLiteral implements ExprInterface {
        public final Token brace;
        public final LinkedHashMap<String, ExprInterface> entries;

        public ObjectLiteral(Token brace, LinkedHashMap<String, ExprInterface> entries) {
            this.brace = brace;
            this.entries = entries;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitObjectLiteralExpr(this);
        }
    }

    /** Anonymous or named function in expression position. */
    public static final class FunctionExpr implements ExprInterface {
        public final Token keyword;
        public final Token name;
        public final List<Token> params;
        public final Token restParam;
        public final List<Statement.Stmt> body;

        public FunctionExpr(Token keyword, Token name, List<Token> params, Token restParam, List<Statement.Stmt> body) {
            this.keyword = keyword;
            this.name = name;
            this.params = params;
            this.restParam = restParam;
            this.body = body;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitFunctionExpr(this);
        }
    }

    // -------------------------
    // Names and members
    // -------------------------

    public static final class Variable implements ExprInterface {
        public final Token name;

        public Variable(Token name) {
            this.name = name;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitVariableExpr(this);
        }
    }

    public static final class Assign implements ExprInterface {
        public final Token name;
        public final ExprInterface value;

        public Assign(Token name, ExprInterface value) {
            this.name = name;
            this.value = value;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitAssignExpr(this);
        }
    }

    public static final class Call implements ExprInterface {
        public final ExprInterface callee;
        public final Token paren;
        public final List<ExprInterface> arguments;

        public Call(ExprInterface callee, Token paren, List<ExprInterface> arguments) {
            this.callee = callee;
            this.paren = paren;
            this.arguments = arguments;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitCallExpr(this);
        }
    }

    /** {@code object.name} */
    public static final class Get implements ExprInterface {
        public final ExprInterface object;
        public final Token name;

        public Get(ExprInterface object, Token name) {
            this.object = object;
            this.name = name;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitGetExpr(this);
        }
    }

    /** {@code object.name = value} */
    public static final class Set implements ExprInterface {
        public final ExprInterface object;
        public final Token name;
        public final ExprInterface value;

        public Set(ExprInterface object, Token name, ExprInterface value) {
            this.object = object;
            this.name = name;
            this.value = value;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitSetExpr(this);
        }
    }

    public static final class Index implements ExprInterface {
        public final ExprInterface target;
        public final ExprInterface index;
        public final Token bracket;

        public Index(ExprInterface target, ExprInterface index, Token bracket) {
            this.target = target;
            this.index = index;
            this.bracket = bracket;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitIndexExpr(this);
        }
    }

    public static final class SetIndex implements ExprInterface {
        public final ExprInterface target;
        public final ExprInterface index;
        public final ExprInterface value;
        public final Token bracket;

        public SetIndex(ExprInterface target, ExprInterface index, ExprInterface value, Token bracket) {
            this.target = target;
            this.index = index;
            this.value = value;
            this.bracket = bracket;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitSetIndexExpr(this);
        }
    }

    // -------------------------
    // Modules
    // -------------------------

    /**
     * {@code import("path")} or the legacy {@code require("path")}.
     * Evaluates to the module namespace and binds it under the module's name.
     */
    public static final class Import implements ExprInterface {
        public final Token keyword;
        public final ExprInterface specifier;
        public final boolean legacyRequire;

        public Import(Token keyword, ExprInterface specifier, boolean legacyRequire) {
            this.keyword = keyword;
            this.specifier = specifier;
            this.legacyRequire = legacyRequire;
        }

        /** The specifier text when it is a string literal, else null. */
        public String staticSpecifier() {
            if (specifier instanceof Literal) {
                Value v = ((Literal) specifier).value;
                if (v.getType() == Value.Type.STRING) return v.asString();
            }
            return null;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitImportExpr(this);
        }
    }
}
