package armscript;

import java.util.*;

final class TokenStream {
    private final List<Token> tokens; // the entire token list produced by the lexer
    private int i = 0; // current index into tokens, where we are up to

    TokenStream(List<Token> tokens) {
        this.tokens = Objects.requireNonNull(tokens);
    }

    boolean atEnd() {
        return i >= tokens.size();
    }

    // number of tokens not yet consumed, including the current one
    int remaining() {
        return Math.max(0, tokens.size() - i);
    }

    // look at current token without consuming, null once the stream is exhausted
    Token peek() {
        return lookahead(0);
    }

    // lookahead k tokens, null when that runs past the end
    Token lookahead(int k) {
        int j = i + Math.max(0, k); // never look backwards
        return j < tokens.size() ? tokens.get(j) : null;
    }

    void advance(int n) {
        i = Math.min(tokens.size(), i + Math.max(0, n));
    }

    int mark() { return i; }

    void reset(int pos) {
        // clamp to [0, tokens.size()]
        if (pos < 0) pos = 0;
        if (pos > tokens.size()) pos = tokens.size();
        i = pos;
    }

    // tokens in [from, to), used to cut a block body out of the stream
    List<Token> slice(int from, int to) {
        return Collections.unmodifiableList(tokens.subList(from, to));
    }

    int size() {
        return tokens.size();
    }
}
