package org.qwed.errors;

public final class UnsupportedConstructException extends CompileException {

    public UnsupportedConstructException(String message, SourcePosition position) {
        super("UNSUPPORTED_CONSTRUCT", message + " @" + position, position);
    }
}
