package armscript;

public class Token {
    public final TokenType tokenType;
    public final String lexeme;
    public final int index; // position in the token stream, the only location we track

    public Token(TokenType tokenType, String lexeme, int index) {
        this.tokenType = tokenType;
        this.lexeme = lexeme;
        this.index = index;
    }

    // pad lexeme so its printed field is a multiple of 6
    private static String padToNext6(String s) {
        int len = s.length();
        int next = ((len + 5) / 6) * 6; // multiples of 6
        if (next == len) next += 6;     // already a multiple of 6, add a full cell so there is a gap
        StringBuilder sb = new StringBuilder(next);
        sb.append(s);
        while (sb.length() < next) sb.append(' ');
        return sb.toString();
    }

    @Override
    public String toString() {
        String name = TokenType.TPRINT[tokenType.getId()];
        // punctuation prints as its name only
        boolean withLex = tokenType != TokenType.TEQUL
                       && tokenType != TokenType.TLBRC
                       && tokenType != TokenType.TRBRC;
        if (!withLex) return name;
        return name + padToNext6(lexeme == null ? "" : lexeme);
    }
}
