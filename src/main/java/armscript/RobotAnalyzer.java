package armscript;

import java.util.List;
import java.util.Objects;
import java.util.function.BiFunction;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point of the pipeline: lexer, dispatcher, checks and emission over a fresh
 * {@link AnalysisContext}. The analyzer itself holds only its configuration, so one
 * instance may serve concurrent callers.
 */
public final class RobotAnalyzer {
    private static final Logger log = LoggerFactory.getLogger(RobotAnalyzer.class);

    private final AnalyzerConfig config;
    private final BiFunction<TokenStream, AnalysisContext, Parser> parsers;

    public RobotAnalyzer() {
        this(AnalyzerConfig.load());
    }

    public RobotAnalyzer(AnalyzerConfig config) {
        this(config, Parser::new);
    }

    // lets tests swap in their own parser
    RobotAnalyzer(AnalyzerConfig config, BiFunction<TokenStream, AnalysisContext, Parser> parsers) {
        this.config = Objects.requireNonNull(config);
        this.parsers = Objects.requireNonNull(parsers);
    }

    /** Never throws for bad input; every problem ends up as a diagnostic. */
    public AnalysisResult analyze(String source) {
        AnalysisContext ctx = new AnalysisContext(config);
        try {
            run(source == null ? "" : source, ctx);
        } catch (RuntimeException e) {
            log.error("analysis aborted by an internal fault", e);
            ctx.errors.internal("Unexpected error: " + e.getMessage());
        }

        AnalysisResult result = ctx.errors.hasErrors()
            ? new AnalysisResult.Failure(ctx.errors.all())
            : new AnalysisResult.Success(ctx.symbols.snapshot(), ctx.emitter.code());

        log.info("analysis finished: {} symbols, {} quadruples, {} errors",
                 ctx.symbols.size(), ctx.emitter.code().size(), ctx.errors.all().size());
        return result;
    }

    private void run(String source, AnalysisContext ctx) {
        List<Token> tokens;
        try {
            tokens = new Lexer(source).tokenize();
        } catch (LexicalException e) {
            ctx.errors.lexical(e.getMessage(), e.getIndex());
            return;
        }
        if (tokens.isEmpty()) {
            ctx.errors.syntax("empty source", null);
            return;
        }
        log.debug("{} tokens", tokens.size());

        parsers.apply(new TokenStream(tokens), ctx).parseProgram();
    }
}
