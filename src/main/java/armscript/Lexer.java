package armscript;

import java.util.*;
import java.util.regex.Pattern;

/**
 * Splits a script into whitespace-delimited words and checks each one against the
 * script alphabet (letters, digits, '.', '=', '{', '}').
 * Scanning stops at the first illegal word, nothing after it is looked at.
 */
public final class Lexer {

    private static final Pattern WHITESPACE = Pattern.compile("[\\s\\p{Z}]+"); // Unicode spaces too, e.g. U+00A0
    private static final Pattern LEGAL = Pattern.compile("[A-Za-z0-9.={}]+");
    private static final Pattern IDENT = Pattern.compile("[A-Za-z]+[0-9]*");
    private static final Pattern DIGITS = Pattern.compile("\\d+");

    private final String source;

    public Lexer(String source) {
        this.source = Objects.requireNonNull(source);
    }

    public List<Token> tokenize() {
        List<Token> tokens = new ArrayList<>();
        String trimmed = source.strip();
        if (trimmed.isEmpty()) return tokens;

        for (String word : WHITESPACE.split(trimmed)) {
            if (word.isEmpty()) continue; // leading no-break space survives strip()
            int index = tokens.size();
            if (!LEGAL.matcher(word).matches()) {
                throw new LexicalException(word, index);
            }
            tokens.add(new Token(classify(word), word, index));
        }
        return tokens;
    }

    // identifier shape used for robot names
    static boolean isIdentifier(String s) {
        return s != null && IDENT.matcher(s).matches();
    }

    // unsigned decimal literal, signs are never part of a literal
    static boolean isUnsignedInteger(String s) {
        return s != null && DIGITS.matcher(s).matches();
    }

    private static TokenType classify(String word) {
        if (word.equalsIgnoreCase("robot")) return TokenType.TROBT;
        if (word.equals("=")) return TokenType.TEQUL;
        if (word.equals("{")) return TokenType.TLBRC;
        if (word.equals("}")) return TokenType.TRBRC;
        if (word.indexOf('.') >= 0) return TokenType.TMEMB;
        if (isUnsignedInteger(word)) return TokenType.TILIT;
        if (isIdentifier(word)) return TokenType.TIDEN;
        return TokenType.TWORD;
    }
}
