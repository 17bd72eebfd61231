package armscript;

/** Thrown by the lexer on the first token containing a character outside the script alphabet. */
public class LexicalException extends RuntimeException {
    private final String lexeme;
    private final int index;

    public LexicalException(String lexeme, int index) {
        super("invalid token '" + lexeme + "'");
        this.lexeme = lexeme;
        this.index = index;
    }

    public String getLexeme() { return lexeme; }
    public int getIndex() { return index; }
}
