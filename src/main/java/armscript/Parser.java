package armscript;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Left-to-right statement dispatcher. Recognizes three shapes:
 * <pre>
 *   Robot ID
 *   ID.command[.negativo] = value
 *   ID.repetir = N { ID.command = value ... }
 * </pre>
 * Each handler returns the cursor after its statement, or {@link #FAILED} once it
 * has reported an error; the first failure ends the parse.
 */
public class Parser {
    private static final Logger log = LoggerFactory.getLogger(Parser.class);

    public static final int FAILED = -1;

    private static final int ASSIGNMENT_LENGTH = 3; // ID.cmd = value
    private static final int REPEAT_HEADER_LENGTH = 4; // ID.repetir = N {

    private final TokenStream ts;
    private final ErrorReporter er;
    private final SemanticAnalyzer sema;
    private final CodeGenerator gen;

    Parser(TokenStream ts, SemanticAnalyzer sema, CodeGenerator gen, ErrorReporter er) {
        this.ts = ts;
        this.sema = sema;
        this.gen = gen;
        this.er = er;
    }

    Parser(TokenStream ts, AnalysisContext ctx) {
        this(ts,
             new SemanticAnalyzer(ctx.symbols, ctx.errors, ctx.config.gripperMode()),
             new CodeGenerator(ctx.symbols, ctx.velocities, ctx.emitter),
             ctx.errors);
    }

    /** Parses until the stream is exhausted. Returns the final cursor or {@link #FAILED}. */
    public int parseProgram() {
        while (!ts.atEnd()) {
            int next = parseStatement();
            if (next == FAILED) return FAILED;
            ts.reset(next);
        }
        return ts.mark();
    }

    private int parseStatement() {
        Token t = ts.peek();
        log.debug("token {}: '{}' ({} left)", t.index, t.lexeme, ts.remaining() - 1);

        if (t.tokenType == TokenType.TROBT) {
            return parseRobotDecl();
        }
        if (t.lexeme.indexOf('.') >= 0 && ts.remaining() >= ASSIGNMENT_LENGTH) {
            if (startsRepeatBlock()) {
                return parseRepeat();
            }
            return parseAssignment();
        }
        er.syntax("incomplete or invalid expression: '" + t.lexeme + "'", t);
        return FAILED;
    }

    // ID.repetir = N { with the brace exactly four tokens ahead
    private boolean startsRepeatBlock() {
        Token target = ts.peek();
        Token op = ts.lookahead(1);
        Token brace = ts.lookahead(3);
        return brace != null
            && target.lexeme.toLowerCase(Locale.ROOT).endsWith("." + Command.REPETIR.keyword())
            && op.lexeme.equals("=")
            && brace.lexeme.equals("{");
    }

    private int parseRobotDecl() {
        Token keyword = ts.peek();
        String id = sema.checkRobotDeclaration(keyword, ts.lookahead(1));
        if (id == null) return FAILED;

        gen.genRobot(id);
        ts.advance(2);
        return ts.mark();
    }

    private int parseAssignment() {
        SemanticAnalyzer.Assignment a =
            sema.checkAssignment(ts.peek(), ts.lookahead(1), ts.lookahead(2), null);
        if (a == null) return FAILED;

        gen.genAssignment(a);
        ts.advance(ASSIGNMENT_LENGTH);
        return ts.mark();
    }

    private int parseRepeat() {
        int start = ts.mark();
        SemanticAnalyzer.RepeatHeader header =
            sema.checkRepeatHeader(ts.peek(), ts.lookahead(1), ts.lookahead(2), ts.lookahead(3));
        if (header == null) return FAILED;

        // find the brace that brings the depth back to zero
        int bodyStart = start + REPEAT_HEADER_LENGTH;
        int j = bodyStart;
        int depth = 1;
        while (j < ts.size() && depth > 0) {
            String lx = ts.lookahead(j - start).lexeme;
            if (lx.equals("{")) depth++;
            else if (lx.equals("}")) depth--;
            j++;
        }
        if (depth > 0) {
            er.syntax("missing '}' to close the repeat block of '" + header.robotId() + "'", header.at());
            return FAILED;
        }
        // j is one past the closing brace
        List<Token> body = ts.slice(bodyStart, j - 1);

        List<SemanticAnalyzer.Assignment> statements = parseBlockBody(body, header);
        if (statements == null) return FAILED;

        gen.genRepeat(header, statements);
        ts.reset(j);
        return j;
    }

    // flat run of 3-token assignments, all checked before anything is emitted
    private List<SemanticAnalyzer.Assignment> parseBlockBody(List<Token> body, SemanticAnalyzer.RepeatHeader header) {
        List<SemanticAnalyzer.Assignment> out = new ArrayList<>();
        int k = 0;
        while (k < body.size()) {
            Token target = body.get(k);
            if (target.lexeme.indexOf('.') < 0) {
                er.syntax("expected ID.command inside repeat block: '" + target.lexeme + "'", target);
                return null;
            }
            if (body.size() - k < ASSIGNMENT_LENGTH) {
                er.syntax("incomplete statement inside repeat block: '" + target.lexeme + "'", target);
                return null;
            }
            SemanticAnalyzer.Assignment a =
                sema.checkAssignment(target, body.get(k + 1), body.get(k + 2), header.robotId());
            if (a == null) return null;
            out.add(a);
            k += ASSIGNMENT_LENGTH;
        }
        if (out.isEmpty()) {
            er.semantic("empty repeat block for '" + header.robotId() + "'", header.at());
            return null;
        }
        return out;
    }
}
