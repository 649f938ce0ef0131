package com.fluxo.script.parser;

import java.util.ArrayList;
import java.util.List;

import com.fluxo.script.errors.FluxoError;
import com.fluxo.script.parser.Interpreter.ReturnSignal;
import com.fluxo.script.parser.Statement.Stmt;

/** Function declared in Fluxo source, closed over its defining scope. */
public class UserFunction implements FluxoCallable {
    final String name;
    final List<Token> params;
    final Token restParam;
    final List<Stmt> body;
    final Environment closure;
    final String definingFile;

    UserFunction(String name, List<Token> params, Token restParam, List<Stmt> body,
                 Environment closure, String definingFile) {
        this.name = (name == null) ? "anonymous" : name;
        this.params = params;
        this.restParam = restParam;
        this.body = body;
        this.closure = closure;
        this.definingFile = definingFile;
    }

    @Override
    public String name() {
        return name;
    }

    public int arity() {
        return params.size();
    }

    @Override
    public Value call(Interpreter interpreter, List<Value> args, Token site) {
        // New call frame is a child of the closure (lexical scoping), not of the caller.
        Environment frame = closure.childScope();
        for (int i = 0; i < params.size(); i++) {
            Value v = (i < args.size()) ? args.get(i) : Value.undefined();
            frame.define(params.get(i).lexeme, v);
        }
        if (restParam != null) {
            List<Value> rest = new ArrayList<>();
            for (int i = params.size(); i < args.size(); i++) rest.add(args.get(i));
            frame.define(restParam.lexeme, Value.array(rest));
        }

        interpreter.enterCall(name, site);
        String callerFile = interpreter.enterFile(definingFile);
        try {
            interpreter.executeBlock(body, frame);
            return Value.undefined();
        } catch (ReturnSignal rs) {
            return rs.value;
        } catch (FluxoError e) {
            throw e.attachFile(definingFile);
        } finally {
            interpreter.restoreFile(callerFile);
            interpreter.exitCall();
        }
    }
}
