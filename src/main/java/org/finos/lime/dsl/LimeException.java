package org.finos.lime.dsl;

/**
 * Base exception for every error a Lime program can raise.
 * Carries the error kind plus optional source location.
 *
 * The line is usually only known to the driver, so it can be attached after
 * the fact with {@link #locate(int)}.
 */
public class LimeException extends RuntimeException {

    /**
     * Error taxonomy. The label is what users see in front of "error:".
     */
    public enum Kind {
        LEX("token"),
        PARSE("parse"),
        UNBOUND_IDENTIFIER("name"),
        NOT_CALLABLE("type"),
        TYPE("type"),
        DIVISION_BY_ZERO("math"),
        INDEX_OUT_OF_RANGE("index"),
        NUMBER_PARSE("cast"),
        RECURSION_LIMIT_EXCEEDED("recursion"),
        IO("io");

        private final String label;

        Kind(String label) {
            this.label = label;
        }

        public String label() {
            return label;
        }
    }

    private final Kind kind;
    private final String detail;
    private int line;
    private final int column;

    public LimeException(Kind kind, String detail) {
        this(kind, detail, -1, -1, null);
    }

    public LimeException(Kind kind, String detail, int line, int column) {
        this(kind, detail, line, column, null);
    }

    public LimeException(Kind kind, String detail, Throwable cause) {
        this(kind, detail, -1, -1, cause);
    }

    protected LimeException(Kind kind, String detail, int line, int column, Throwable cause) {
        super(detail, cause);
        this.kind = kind;
        this.detail = detail;
        this.line = line;
        this.column = column;
    }

    /**
     * Attaches a source line if none is known yet.
     *
     * @return this exception, for rethrowing
     */
    public LimeException locate(int line) {
        if (this.line < 0) {
            this.line = line;
        }
        return this;
    }

    public Kind getKind() {
        return kind;
    }

    public String getDetail() {
        return detail;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    public boolean hasLocation() {
        return line >= 0;
    }

    /**
     * Errors that end the whole run regardless of the error policy.
     */
    public boolean isFatal() {
        return kind == Kind.RECURSION_LIMIT_EXCEEDED;
    }

    @Override
    public String getMessage() {
        StringBuilder sb = new StringBuilder();
        sb.append(kind.label()).append(" error: ").append(detail);
        if (line >= 0) {
            sb.append(" at line ").append(line);
            if (column >= 0) {
                sb.append(':').append(column);
            }
        }
        return sb.toString();
    }
}
