package org.dxworks.mdtree.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Inline code. A code span never has a language tag; parsers that attach one are rejected.
 */
public final class CodeSpan implements Inline {

    private final String code;

    private CodeSpan(String code) {
        this.code = code;
    }

    public static CodeSpan of(String code) {
        return new CodeSpan(Objects.requireNonNull(code, "code"));
    }

    public static CodeSpan of(String language, String code) throws InvariantViolationException {
        if (language != null && !language.isEmpty()) {
            throw new InvariantViolationException("code span must not have a language tag, got '" + language + "'");
        }
        return of(code);
    }

    @JsonProperty
    public String code() {
        return code;
    }

    @Override
    public <R> R accept(InlineVisitor<R> visitor) {
        return visitor.visit(this);
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof CodeSpan other && code.equals(other.code));
    }

    @Override
    public int hashCode() {
        return code.hashCode();
    }

    @Override
    public String toString() {
        return "CodeSpan[code=" + code + "]";
    }
}
