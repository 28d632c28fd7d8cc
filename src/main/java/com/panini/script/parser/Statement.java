package com.panini.script.parser;

import java.util.List;

/**
 * Statement nodes produced from normalized lines. Expressions and conditions
 * stay as raw text and are evaluated directly from it.
 */
public class Statement {

    public interface Stmt {
        /** 1-based source line the statement begins on. */
        int line();
        void accept(StmtVisitor visitor);
    }

    public interface StmtVisitor {
        void visitBlockStmt(Block stmt);
        void visitSimpleStmt(SimpleStmt stmt);
        void visitIfStmt(If stmt);
        void visitWhileStmt(While stmt);
        void visitForStmt(For stmt);
        void visitFunctionStmt(FunctionStmt stmt);
        void visitInvalidStmt(InvalidStmt stmt);
    }

    public static final class Block implements Stmt {
        public final int line;
        public final List<Stmt> statements;
        Block(int line, List<Stmt> statements) { this.line = line; this.statements = statements; }
        public int line() { return line; }
        public void accept(StmtVisitor visitor) { visitor.visitBlockStmt(this); }
    }

    /** Assignment, print, bare call, help, or anything else that is not a compound statement. */
    public static final class SimpleStmt implements Stmt {
        public final int line;
        public final String text;
        SimpleStmt(int line, String text) { this.line = line; this.text = text; }
        public int line() { return line; }
        public void accept(StmtVisitor visitor) { visitor.visitSimpleStmt(this); }
    }

    public static final class If implements Stmt {
        public final int line;
        public final String condition;
        public final Block thenBranch;
        public final Block elseBranch; // may be null
        If(int line, String condition, Block thenBranch, Block elseBranch) {
            this.line = line;
            this.condition = condition;
            this.thenBranch = thenBranch;
            this.elseBranch = elseBranch;
        }
        public int line() { return line; }
        public void accept(StmtVisitor visitor) { visitor.visitIfStmt(this); }
    }

    public static final class While implements Stmt {
        public final int line;
        public final String condition;
        public final Block body;
        While(int line, String condition, Block body) {
            this.line = line;
            this.condition = condition;
            this.body = body;
        }
        public int line() { return line; }
        public void accept(StmtVisitor visitor) { visitor.visitWhileStmt(this); }
    }

    /** Counted loop over range(count). */
    public static final class For implements Stmt {
        public final int line;
        public final String variable;
        public final String count;
        public final Block body;
        For(int line, String variable, String count, Block body) {
            this.line = line;
            this.variable = variable;
            this.count = count;
            this.body = body;
        }
        public int line() { return line; }
        public void accept(StmtVisitor visitor) { visitor.visitForStmt(this); }
    }

    public static final class FunctionStmt implements Stmt {
        public final int line;
        public final String name;
        public final List<String> params;
        public final Block body;
        FunctionStmt(int line, String name, List<String> params, Block body) {
            this.line = line;
            this.name = name;
            this.params = params;
            this.body = body;
        }
        public int line() { return line; }
        public void accept(StmtVisitor visitor) { visitor.visitFunctionStmt(this); }
    }

    /** A statement that failed to parse; executing it reports the error. */
    public static final class InvalidStmt implements Stmt {
        public final int line;
        public final ScriptException error;
        InvalidStmt(int line, ScriptException error) { this.line = line; this.error = error; }
        public int line() { return line; }
        public void accept(StmtVisitor visitor) { visitor.visitInvalidStmt(this); }
    }
}
