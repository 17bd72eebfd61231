package armscript;

import java.util.Objects;

public final class CompilerError {

    public enum Kind {
        LEXICAL("Lexical"), SYNTAX("Syntax"), SEMANTIC("Semantic"), INTERNAL("Internal");

        private final String label;

        Kind(String label) {
            this.label = label;
        }

        public String label() {
            return label;
        }
    }

    private final Kind kind;
    private final String message;
    private final int tokenIndex; // -1 when the error is not tied to a token

    public CompilerError(Kind kind, String message, int tokenIndex) {
        this.kind = Objects.requireNonNull(kind);
        this.message = Objects.requireNonNull(message);
        this.tokenIndex = tokenIndex;
    }

    public Kind kind() { return kind; }
    public String message() { return message; }
    public int tokenIndex() { return tokenIndex; }

    @Override
    public String toString() {
        return kind.label() + " error: " + message;
    }
}
