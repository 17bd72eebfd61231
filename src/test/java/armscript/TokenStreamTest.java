package armscript;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

class TokenStreamTest {

    private TokenStream stream(String src) {
        return new TokenStream(new Lexer(src).tokenize());
    }

    @Test
    void lookaheadStopsAtTheEnd() {
        TokenStream ts = stream("a b c");

        assertEquals("a", ts.peek().lexeme);
        assertEquals("c", ts.lookahead(2).lexeme);
        assertNull(ts.lookahead(3));
        assertEquals(3, ts.remaining());
    }

    @Test
    void advanceAndResetClamp() {
        TokenStream ts = stream("a b c");

        ts.advance(10);
        assertTrue(ts.atEnd());
        assertNull(ts.peek());
        assertEquals(0, ts.remaining());

        ts.reset(-4);
        assertEquals(0, ts.mark());
        ts.advance(1);
        assertEquals("b", ts.peek().lexeme);
    }

    @Test
    void sliceIsHalfOpen() {
        TokenStream ts = stream("x { a b } y");
        assertEquals(2, ts.slice(2, 4).size());
        assertEquals("a", ts.slice(2, 4).get(0).lexeme);
        assertTrue(ts.slice(3, 3).isEmpty());
    }
}
