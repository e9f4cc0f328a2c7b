package org.pragmatica.unionize.shared;

import org.pragmatica.unionize.splice.EditOperation;

/// Fatal conditions of a single-file rewrite. None of them leaves partial output behind.
public abstract sealed class RewriteException extends Exception
permits RewriteException.ParseFailure, RewriteException.ConflictingEdits, RewriteException.NoFixedPoint {
    private final String fileName;

    protected RewriteException(String fileName, String message) {
        super(message);
        this.fileName = fileName;
    }

    public String fileName() {
        return fileName;
    }

    public static ParseFailure parseFailure(String fileName, int line, int column, String detail) {
        return new ParseFailure(fileName, line, column, detail);
    }

    public static ConflictingEdits conflictingEdits(String fileName, EditOperation first, EditOperation second) {
        return new ConflictingEdits(fileName, first, second);
    }

    public static NoFixedPoint noFixedPoint(String fileName, int passes) {
        return new NoFixedPoint(fileName, passes);
    }

    /// Input is not valid Python.
    public static final class ParseFailure extends RewriteException {
        private final int line;
        private final int column;
        private final String detail;

        private ParseFailure(String fileName, int line, int column, String detail) {
            super(fileName, fileName + ":" + line + ":" + column + ": " + detail);
            this.line = line;
            this.column = column;
            this.detail = detail;
        }

        public int line() {
            return line;
        }

        public int column() {
            return column;
        }

        public String detail() {
            return detail;
        }
    }

    /// Two edits of one pass overlap. Indicates a defect in edit generation, never bad input.
    public static final class ConflictingEdits extends RewriteException {
        private final EditOperation first;
        private final EditOperation second;

        private ConflictingEdits(String fileName, EditOperation first, EditOperation second) {
            super(fileName, fileName + ": conflicting edits " + first.describe() + " and " + second.describe());
            this.first = first;
            this.second = second;
        }

        public EditOperation first() {
            return first;
        }

        public EditOperation second() {
            return second;
        }
    }

    /// Passes kept producing edits past the configured limit.
    public static final class NoFixedPoint extends RewriteException {
        private final int passes;

        private NoFixedPoint(String fileName, int passes) {
            super(fileName, fileName + ": no fixed point after " + passes + " passes");
            this.passes = passes;
        }

        public int passes() {
            return passes;
        }
    }
}
