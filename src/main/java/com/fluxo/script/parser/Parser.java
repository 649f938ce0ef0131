package com.fluxo.script.parser;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;

import com.fluxo.script.errors.FluxoSyntaxError;
import com.fluxo.script.parser.Expr.ArrayLiteral;
import com.fluxo.script.parser.Expr.Assign;
import com.fluxo.script.parser.Expr.Binary;
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
import com.fluxo.script.parser.Statement.ExprStmt;
import com.fluxo.script.parser.Statement.FunctionStmt;
import com.fluxo.script.parser.Statement.Stmt;
import com.fluxo.script.parser.Statement.While;

/**
 * Recursive-descent parser for Fluxo.
 *
 * Semicolons are optional: a simple statement ends at ';', at '}', at end of
 * input, or at a line break. A '(' or '[' that starts a new line begins a new
 * statement rather than continuing a call or index on the previous line.
 */
public class Parser {
    private static final int MAX_PARAMS = 255;

    private final List<Token> tokens;
    private int current = 0;

    private int loopDepth = 0;
    private int functionDepth = 0;
    private int blockDepth = 0;
    private boolean inModuleBody = false;
    private boolean moduleDeclared = false;

    public Parser(List<Token> tokens) { this.tokens = tokens; }

    public List<Stmt> parse() {
        List<Stmt> statements = new ArrayList<>();
        while (!isAtEnd()) {
            statements.add(declaration());
        }
        return statements;
    }

    // -------------------------
    // Declarations
    // -------------------------

    private Stmt declaration() {
        if (check(TokenType.FUNCTION) && checkNext(TokenType.IDENTIFIER)) {
            advance();
            return functionDeclaration(false);
        }
        if (match(TokenType.LOCAL)) {
            Stmt s = varDeclaration();
            endStatement("variable declaration");
            return s;
        }
        if (match(TokenType.MODULE)) return moduleDeclaration();
        if (match(TokenType.EXPORT)) return exportDeclaration();
        if (check(TokenType.IMPORT) && checkNextWord("from")) {
            advance();
            return importFromDeclaration();
        }
        return statement();
    }

    private FunctionStmt functionDeclaration(boolean exported) {
        Token name = consume(TokenType.IDENTIFIER, "Expect function name.");
        Token open = consume(TokenType.LEFT_PAREN, "Expect '(' after function name.");
        List<Token> params = new ArrayList<>();
        Token rest = parameters(params, open);
        Token brace = consume(TokenType.LEFT_BRACE, "Expect '{' before function body.");
        List<Stmt> body = functionBody(brace);
        return new FunctionStmt(name, params, rest, body, exported);
    }

    /** Parses a parameter list after '('; returns the rest parameter or null. */
    private Token parameters(List<Token> params, Token open) {
        Token rest = null;
        if (!check(TokenType.RIGHT_PAREN)) {
            do {
                if (params.size() >= MAX_PARAMS) {
                    throw error(peek(), "Too many parameters (max " + MAX_PARAMS + ").");
                }
                if (match(TokenType.ELLIPSIS)) {
                    rest = consume(TokenType.IDENTIFIER, "Expect rest parameter name after '...'.");
                    if (!check(TokenType.RIGHT_PAREN)) {
                        throw error(peek(), "Rest parameter must be the last parameter.");
                    }
                    break;
                }
                params.add(consume(TokenType.IDENTIFIER, "Expect parameter name."));
            } while (match(TokenType.COMMA));
        }
        close(TokenType.RIGHT_PAREN, open, "')' after parameters");
        return rest;
    }

    private List<Stmt> functionBody(Token brace) {
        int savedLoop = loopDepth;
        boolean savedModule = inModuleBody;
        loopDepth = 0;
        inModuleBody = false;
        functionDepth++;
        try {
            return block(brace);
        } finally {
            functionDepth--;
            loopDepth = savedLoop;
            inModuleBody = savedModule;
        }
    }

    private Stmt varDeclaration() {
        Token name = consume(TokenType.IDENTIFIER, "Expect variable name.");
        Expr.ExprInterface initializer = null;
        if (match(TokenType.EQUAL)) {
            initializer = expression();
        }
        return new Statement.VarStmt(name, initializer);
    }

    private Stmt moduleDeclaration() {
        Token keyword = previous();
        if (blockDepth > 0 || functionDepth > 0 || inModuleBody) {
            throw error(keyword, "Module declarations are only allowed at top level.");
        }
        if (moduleDeclared) {
            throw error(keyword, "Only one module block is allowed per file.");
        }
        moduleDeclared = true;
        Token name = consume(TokenType.IDENTIFIER, "Expect module name.");
        Token brace = consume(TokenType.LEFT_BRACE, "Expect '{' after module name.");

        List<Stmt> body = new ArrayList<>();
        inModuleBody = true;
        try {
            while (!check(TokenType.RIGHT_BRACE) && !isAtEnd()) {
                body.add(declaration());
            }
        } finally {
            inModuleBody = false;
        }
        close(TokenType.RIGHT_BRACE, brace, "'}' after module body");
        return new Statement.ModuleStmt(name, body);
    }

    private Stmt exportDeclaration() {
        Token keyword = previous();
        if (!atExportLevel()) {
            throw error(keyword, "'export' is only allowed at the top level of a file or module.");
        }
        if (match(TokenType.FUNCTION)) {
            return functionDeclaration(true);
        }
        if (match(TokenType.LEFT_BRACE)) {
            Token brace = previous();
            List<Token> names = new ArrayList<>();
            if (!check(TokenType.RIGHT_BRACE)) {
                do {
                    names.add(consume(TokenType.IDENTIFIER, "Expect exported name."));
                } while (match(TokenType.COMMA));
            }
            close(TokenType.RIGHT_BRACE, brace, "'}' after export list");
            endStatement("export list");
            return new Statement.ExportListStmt(keyword, names);
        }
        throw error(peek(), "Expect 'function' or '{' after 'export'.");
    }

    private Stmt importFromDeclaration() {
        Token keyword = previous();
        advance(); // 'from'
        Token path = consume(TokenType.STRING, "Expect module path string after 'from'.");
        Token brace = consume(TokenType.LEFT_BRACE, "Expect '{' after module path.");
        List<Token> names = new ArrayList<>();
        if (!check(TokenType.RIGHT_BRACE)) {
            do {
                names.add(consume(TokenType.IDENTIFIER, "Expect imported name."));
            } while (match(TokenType.COMMA));
        }
        close(TokenType.RIGHT_BRACE, brace, "'}' after import list");
        endStatement("import");
        return new Statement.ImportFromStmt(keyword, (String) path.literal, names);
    }

    // Top level of the file, or top level of its module body.
    private boolean atExportLevel() {
        return functionDepth == 0 && blockDepth == 0;
    }

    // -------------------------
    // Statements
    // -------------------------

    private Stmt statement() {
        if (match(TokenType.IF)) return ifStatement();
        if (match(TokenType.WHILE)) return whileStatement();
        if (match(TokenType.FOR)) return forStatement();
        if (match(TokenType.RETURN)) return returnStatement();
        if (match(TokenType.BREAK)) return breakStatement();
        if (match(TokenType.CONTINUE)) return continueStatement();
        if (match(TokenType.WAIT)) return waitStatement();
        if (match(TokenType.LEFT_BRACE)) return new Block(block(previous()));
        if (match(TokenType.SEMICOLON)) return new Block(new ArrayList<>());
        return exprStatement();
    }

    private Stmt breakStatement() {
        Token keyword = previous();
        if (loopDepth <= 0) {
            throw error(keyword, "'break' used outside of a loop.");
        }
        endStatement("'break'");
        return new Statement.BreakStmt(keyword);
    }

    private Stmt continueStatement() {
        Token keyword = previous();
        if (loopDepth <= 0) {
            throw error(keyword, "'continue' used outside of a loop.");
        }
        endStatement("'continue'");
        return new Statement.ContinueStmt(keyword);
    }

    private Stmt returnStatement() {
        Token keyword = previous();
        Expr.ExprInterface value = null;
        if (!check(TokenType.SEMICOLON) && !check(TokenType.RIGHT_BRACE) && !isAtEnd()
                && peek().line == keyword.line) {
            value = expression();
        }
        endStatement("return value");
        return new Statement.ReturnStmt(keyword, value);
    }

    private Stmt ifStatement() {
        Token open = consume(TokenType.LEFT_PAREN, "Expect '(' after 'if'.");
        Expr.ExprInterface condition = expression();
        close(TokenType.RIGHT_PAREN, open, "')' after if condition");
        Stmt thenBranch = nestedStatement();
        Stmt elseBranch = null;
        if (match(TokenType.ELSE)) elseBranch = nestedStatement();
        return new Statement.If(condition, thenBranch, elseBranch);
    }

    private Stmt whileStatement() {
        Token keyword = previous();
        Token open = consume(TokenType.LEFT_PAREN, "Expect '(' after 'while'.");
        Expr.ExprInterface condition = expression();
        close(TokenType.RIGHT_PAREN, open, "')' after condition");

        loopDepth++;
        try {
            Stmt body = nestedStatement();
            return new While(keyword, condition, body, null);
        } finally {
            loopDepth--;
        }
    }

    // for (init; cond; inc) body
    // => { init; while (cond) { body } with inc run after each pass }
    private Stmt forStatement() {
        Token keyword = previous();
        Token open = consume(TokenType.LEFT_PAREN, "Expect '(' after 'for'.");

        Stmt initializer = null;
        if (match(TokenType.SEMICOLON)) {
            initializer = null;
        } else {
            if (match(TokenType.LOCAL)) {
                initializer = varDeclaration();
            } else {
                initializer = new ExprStmt(expression());
            }
            consume(TokenType.SEMICOLON, "Expect ';' after loop initializer.");
        }

        Expr.ExprInterface condition = null;
        if (!check(TokenType.SEMICOLON)) {
            condition = expression();
        }
        consume(TokenType.SEMICOLON, "Expect ';' after loop condition.");

        Expr.ExprInterface increment = null;
        if (!check(TokenType.RIGHT_PAREN)) {
            increment = expression();
        }
        close(TokenType.RIGHT_PAREN, open, "')' after for clauses");

        loopDepth++;
        Stmt body;
        try {
            body = nestedStatement();
        } finally {
            loopDepth--;
        }

        if (condition == null) condition = new Literal(Value.bool(true));
        Stmt loop = new While(keyword, condition, body, increment);

        if (initializer == null) return loop;
        List<Stmt> list = new ArrayList<>();
        list.add(initializer);
        list.add(loop);
        return new Block(list);
    }

    private Stmt waitStatement() {
        Token keyword = previous();
        Token open = consume(TokenType.LEFT_PAREN, "Expect '(' after 'wait'.");
        Expr.ExprInterface seconds = expression();
        close(TokenType.RIGHT_PAREN, open, "')' after wait delay");
        Token brace = consume(TokenType.LEFT_BRACE, "Expect '{' before wait body.");
        // the body runs later, outside any enclosing loop
        int savedLoop = loopDepth;
        loopDepth = 0;
        List<Stmt> body;
        try {
            body = block(brace);
        } finally {
            loopDepth = savedLoop;
        }
        return new Statement.WaitStmt(keyword, seconds, body);
    }

    private Stmt nestedStatement() {
        blockDepth++;
        try {
            return statement();
        } finally {
            blockDepth--;
        }
    }

    private List<Stmt> block(Token brace) {
        List<Stmt> statements = new ArrayList<>();
        blockDepth++;
        try {
            while (!check(TokenType.RIGHT_BRACE) && !isAtEnd()) {
                statements.add(declaration());
            }
        } finally {
            blockDepth--;
        }
        close(TokenType.RIGHT_BRACE, brace, "'}' after block");
        return statements;
    }

    private Stmt exprStatement() {
        Expr.ExprInterface expr = expression();
        endStatement("expression");
        return new ExprStmt(expr);
    }

    // -------------------------
    // Expressions
    // -------------------------

    private Expr.ExprInterface expression() { return assignment(); }

    private Expr.ExprInterface assignment() {
        Expr.ExprInterface expr = or();
        if (match(TokenType.EQUAL)) {
            Token equals = previous();
            Expr.ExprInterface value = assignment();
            if (expr instanceof Variable) {
                return new Assign(((Variable) expr).name, value);
            }
            if (expr instanceof Get) {
                Get get = (Get) expr;
                return new Expr.Set(get.object, get.name, value);
            }
            if (expr instanceof Index) {
                Index ix = (Index) expr;
                return new SetIndex(ix.target, ix.index, value, ix.bracket);
            }
            throw error(equals, "Invalid assignment target.");
        }
        return expr;
    }

    private Expr.ExprInterface or() {
        Expr.ExprInterface expr = and();
        while (match(TokenType.OR_OR)) {
            Token op = previous();
            Expr.ExprInterface right = and();
            expr = new Logical(expr, op, right);
        }
        return expr;
    }

    private Expr.ExprInterface and() {
        Expr.ExprInterface expr = equality();
        while (match(TokenType.AND_AND)) {
            Token op = previous();
            Expr.ExprInterface right = equality();
            expr = new Logical(expr, op, right);
        }
        return expr;
    }

    private Expr.ExprInterface equality() {
        Expr.ExprInterface expr = comparison();
        while (match(TokenType.EQUAL_EQUAL, TokenType.BANG_EQUAL)) {
            Token op = previous();
            Expr.ExprInterface right = comparison();
            expr = new Binary(expr, op, right);
        }
        return expr;
    }

    private Expr.ExprInterface comparison() {
        Expr.ExprInterface expr = term();
        while (match(TokenType.GREATER, TokenType.GREATER_EQUAL, TokenType.LESS, TokenType.LESS_EQUAL)) {
            Token op = previous();
            Expr.ExprInterface right = term();
            expr = new Binary(expr, op, right);
        }
        return expr;
    }

    private Expr.ExprInterface term() {
        Expr.ExprInterface expr = factor();
        while (match(TokenType.PLUS, TokenType.MINUS)) {
            Token op = previous();
            Expr.ExprInterface right = factor();
            expr = new Binary(expr, op, right);
        }
        return expr;
    }

    private Expr.ExprInterface factor() {
        Expr.ExprInterface expr = unary();
        while (match(TokenType.STAR, TokenType.SLASH, TokenType.PERCENT)) {
            Token op = previous();
            Expr.ExprInterface right = unary();
            expr = new Binary(expr, op, right);
        }
        return expr;
    }

    private Expr.ExprInterface unary() {
        if (match(TokenType.BANG, TokenType.MINUS)) {
            Token op = previous();
            Expr.ExprInterface right = unary();
            return new Unary(op, right);
        }
        return call();
    }

    private Expr.ExprInterface call() {
        Expr.ExprInterface expr = primary();

        while (true) {
            if (checkSameLine(TokenType.LEFT_PAREN)) {
                advance();
                expr = finishCall(expr);
            } else if (checkSameLine(TokenType.LEFT_BRACKET)) {
                Token bracket = advance();
                Expr.ExprInterface index = expression();
                close(TokenType.RIGHT_BRACKET, bracket, "']' after index");
                expr = new Index(expr, index, bracket);
            } else if (match(TokenType.DOT)) {
                Token name = memberName("Expect property name after '.'.");
                expr = new Get(expr, name);
            } else {
                break;
            }
        }

        return expr;
    }

    private Expr.ExprInterface finishCall(Expr.ExprInterface callee) {
        Token open = previous();
        List<Expr.ExprInterface> arguments = new ArrayList<>();
        if (!check(TokenType.RIGHT_PAREN)) {
            do {
                if (arguments.size() >= MAX_PARAMS) {
                    throw error(peek(), "Too many arguments (max " + MAX_PARAMS + ").");
                }
                arguments.add(expression());
            } while (match(TokenType.COMMA));
        }
        close(TokenType.RIGHT_PAREN, open, "')' after arguments");
        return new Expr.Call(callee, open, arguments);
    }

    private Expr.ExprInterface primary() {
        if (match(TokenType.FALSE)) return new Literal(Value.bool(false));
        if (match(TokenType.TRUE)) return new Literal(Value.bool(true));
        if (match(TokenType.NULL)) return new Literal(Value.nil());
        if (match(TokenType.UNDEFINED)) return new Literal(Value.undefined());
        if (match(TokenType.NUMBER)) return new Literal(Value.number((Double) previous().literal));
        if (match(TokenType.STRING)) return new Literal(Value.string((String) previous().literal));
        if (match(TokenType.IDENTIFIER)) return new Variable(previous());

        if (match(TokenType.LEFT_PAREN)) {
            Token open = previous();
            Expr.ExprInterface expr = expression();
            close(TokenType.RIGHT_PAREN, open, "')' after expression");
            return expr;
        }

        if (match(TokenType.LEFT_BRACKET)) {
            Token bracket = previous();
            List<Expr.ExprInterface> items = new ArrayList<>();
            if (!check(TokenType.RIGHT_BRACKET)) {
                do {
                    if (check(TokenType.RIGHT_BRACKET)) break; // trailing comma
                    items.add(expression());
                } while (match(TokenType.COMMA));
            }
            close(TokenType.RIGHT_BRACKET, bracket, "']' after array literal");
            return new ArrayLiteral(bracket, items);
        }

        // Object literal (JSON-style)
        if (match(TokenType.LEFT_BRACE)) {
            Token brace = previous();
            LinkedHashMap<String, Expr.ExprInterface> entries = new LinkedHashMap<>();
            if (!check(TokenType.RIGHT_BRACE)) {
                do {
                    if (check(TokenType.RIGHT_BRACE)) break; // trailing comma
                    String key;
                    if (match(TokenType.STRING)) {
                        key = (String) previous().literal;
                    } else if (match(TokenType.NUMBER)) {
                        key = Value.number((Double) previous().literal).toDisplayString();
                    } else {
                        key = memberName("Expect object key (string or identifier).").lexeme;
                    }
                    consume(TokenType.COLON, "Expect ':' after object key.");
                    entries.put(key, expression());
                } while (match(TokenType.COMMA));
            }
            close(TokenType.RIGHT_BRACE, brace, "'}' after object literal");
            return new ObjectLiteral(brace, entries);
        }

        if (match(TokenType.FUNCTION)) {
            Token keyword = previous();
            Token name = match(TokenType.IDENTIFIER) ? previous() : null;
            Token open = consume(TokenType.LEFT_PAREN, "Expect '(' after 'function'.");
            List<Token> params = new ArrayList<>();
            Token rest = parameters(params, open);
            Token brace = consume(TokenType.LEFT_BRACE, "Expect '{' before function body.");
            List<Stmt> body = functionBody(brace);
            return new FunctionExpr(keyword, name, params, rest, body);
        }

        if (match(TokenType.IMPORT, TokenType.REQUIRE)) {
            Token keyword = previous();
            Token open = consume(TokenType.LEFT_PAREN, "Expect '(' after '" + keyword.lexeme + "'.");
            Expr.ExprInterface specifier = expression();
            close(TokenType.RIGHT_PAREN, open, "')' after module path");
            return new Import(keyword, specifier, keyword.type == TokenType.REQUIRE);
        }

        if (isAtEnd()) throw error(peek(), "Unexpected end of input.");
        throw error(peek(), "Unexpected '" + peek().lexeme + "'.");
    }

    // -------------------------
    // Helpers
    // -------------------------

    /** Identifier or keyword used as a property name. */
    private Token memberName(String message) {
        if (check(TokenType.IDENTIFIER) || isWord(peek())) return advance();
        throw error(peek(), message);
    }

    private static boolean isWord(Token t) {
        if (t.type == TokenType.EOF || t.lexeme.isEmpty()) return false;
        char c = t.lexeme.charAt(0);
        return Character.isLetter(c) || c == '_' || c == '$';
    }

    private void endStatement(String what) {
        if (match(TokenType.SEMICOLON)) return;
        if (check(TokenType.RIGHT_BRACE) || isAtEnd()) return;
        if (peek().line > previous().line) return;
        throw error(peek(), "Expect ';' or newline after " + what + ".");
    }

    /** Consumes a closing bracket; reports an unclosed opener at the opener's position. */
    private Token close(TokenType type, Token open, String what) {
        if (check(type)) return advance();
        if (isAtEnd()) {
            throw error(open, "Unclosed '" + open.lexeme + "' (expected " + what + ").");
        }
        throw error(peek(), "Expect " + what + ".");
    }

    private boolean match(TokenType... types) {
        for (TokenType type : types) {
            if (check(type)) {
                advance();
                return true;
            }
        }
        return false;
    }

    private Token consume(TokenType type, String message) {
        if (check(type)) return advance();
        throw error(peek(), message);
    }

    private boolean check(TokenType type) {
        if (isAtEnd()) return false;
        return peek().type == type;
    }

    private boolean checkSameLine(TokenType type) {
        return check(type) && peek().line == previous().line;
    }

    private boolean checkNext(TokenType type) {
        if (current + 1 >= tokens.size()) return false;
        return tokens.get(current + 1).type == type;
    }

    private boolean checkNextWord(String word) {
        if (current + 1 >= tokens.size()) return false;
        Token t = tokens.get(current + 1);
        return t.type == TokenType.IDENTIFIER && t.lexeme.equals(word);
    }

    private Token advance() {
        if (!isAtEnd()) current++;
        return previous();
    }

    private boolean isAtEnd() { return peek().type == TokenType.EOF; }
    private Token peek() { return tokens.get(current); }
    private Token previous() { return tokens.get(current - 1); }

    private FluxoSyntaxError error(Token token, String message) {
        return new FluxoSyntaxError(message, token.line, token.column);
    }
}
