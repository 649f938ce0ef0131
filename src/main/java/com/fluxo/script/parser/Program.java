package com.fluxo.script.parser;

import com.fluxo.script.parser.Statement.ModuleStmt;
import com.fluxo.script.parser.Statement.Stmt;

import java.util.List;

/** Parsed form of one source file. Never mutated after parsing. */
public final class Program {
    public final String path;
    public final List<Stmt> statements;

    public Program(String path, List<Stmt> statements) {
        this.path = path;
        this.statements = List.copyOf(statements);
    }

    /** Parses {@code source}; lexer and parser failures surface as FluxoSyntaxError tagged with {@code path}. */
    public static Program parse(String path, String source) {
        try {
            List<Token> tokens = new Lexer(source).tokenize();
            return new Program(path, new Parser(tokens).parse());
        } catch (com.fluxo.script.errors.FluxoError e) {
            throw e.attachFile(path);
        }
    }

    /** The file's {@code module} block, or null when it declares none. */
    public ModuleStmt moduleDeclaration() {
        for (Stmt s : statements) {
            if (s instanceof ModuleStmt) return (ModuleStmt) s;
        }
        return null;
    }
}
