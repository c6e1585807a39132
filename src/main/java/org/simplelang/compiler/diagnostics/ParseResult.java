package org.simplelang.compiler.diagnostics;

import java.util.Optional;

/**
 * Outcome of a grammar production: either success or the first {@link SyntaxError}.
 * <p>
 * Productions return a failure unchanged to their caller without reading further
 * tokens, so the first violation always reaches the top-level caller.
 */
public final class ParseResult {

    private static final ParseResult SUCCESS = new ParseResult(null);

    private final SyntaxError error;

    private ParseResult(SyntaxError error) {
        this.error = error;
    }

    public static ParseResult success() {
        return SUCCESS;
    }

    public static ParseResult failure(SyntaxError error) {
        if (error == null) {
            throw new IllegalArgumentException("A failure needs a syntax error");
        }
        return new ParseResult(error);
    }

    public boolean isSuccess() {
        return error == null;
    }

    public boolean isFailure() {
        return error != null;
    }

    public Optional<SyntaxError> error() {
        return Optional.ofNullable(error);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ParseResult other)) return false;
        return error == null ? other.error == null : error.equals(other.error);
    }

    @Override
    public int hashCode() {
        return error == null ? 0 : error.hashCode();
    }

    @Override
    public String toString() {
        return isSuccess() ? "ParseResult[accepted]" : "ParseResult[" + error.format() + "]";
    }
}
