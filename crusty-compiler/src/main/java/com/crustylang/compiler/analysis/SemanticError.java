package com.crustylang.compiler.analysis;

import com.crustylang.compiler.ast.SourceLocation;

/**
 * 语义错误条目
 */
public final class SemanticError {

    public enum ErrorKind {
        UNDEFINED_TYPE,
        TYPE_MISMATCH,
        CIRCULAR_TYPE_ALIAS,
        CAPTURE_VIOLATION,
        VISIBILITY_ERROR,
        UNDEFINED_VARIABLE,
        DUPLICATE_DEFINITION,
        INVALID_OPERATION
    }

    private final ErrorKind kind;
    private final String message;
    private final SourceLocation location;

    public SemanticError(ErrorKind kind, String message, SourceLocation location) {
        this.kind = kind;
        this.message = message;
        this.location = location != null ? location : SourceLocation.UNKNOWN;
    }

    public ErrorKind getKind() { return kind; }
    public String getMessage() { return message; }
    public SourceLocation getLocation() { return location; }

    @Override
    public String toString() {
        return location.getLine() + ":" + location.getColumn() + ": " + kind + ": " + message;
    }
}
