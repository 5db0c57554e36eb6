package org.finos.lime.engine.runtime;

import java.util.Objects;

/**
 * Unicode text. Indexing and length work on code points.
 */
public record StringValue(String value) implements LimeValue {

    public StringValue {
        Objects.requireNonNull(value, "Value cannot be null");
    }

    public static StringValue of(String value) {
        return new StringValue(value);
    }

    public int length() {
        return value.codePointCount(0, value.length());
    }

    /**
     * The code point at {@code index} as a one-character string.
     */
    public StringValue codePointAt(int index) {
        int offset = value.offsetByCodePoints(0, index);
        return new StringValue(new String(Character.toChars(value.codePointAt(offset))));
    }

    @Override
    public String kindName() {
        return "string";
    }

    @Override
    public String display() {
        return value;
    }
}
