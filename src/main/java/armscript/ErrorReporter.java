package armscript;

import java.util.*;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Collects the diagnostics of one analysis. Analysis is fail-fast, so only the first
 * report is kept; anything reported after it is dropped.
 */
final class ErrorReporter {
    private static final Logger log = LoggerFactory.getLogger(ErrorReporter.class);

    private final List<CompilerError> errors = new ArrayList<>();

    void lexical(String message, int tokenIndex) {
        report(CompilerError.Kind.LEXICAL, message, tokenIndex);
    }

    // statement has the wrong shape
    void syntax(String message, Token at) {
        report(CompilerError.Kind.SYNTAX, message, at != null ? at.index : -1);
    }

    void semantic(String message, Token at) {
        report(CompilerError.Kind.SEMANTIC, message, at != null ? at.index : -1);
    }

    void internal(String message) {
        report(CompilerError.Kind.INTERNAL, message, -1);
    }

    private void report(CompilerError.Kind kind, String message, int tokenIndex) {
        if (hasErrors()) return;
        CompilerError e = new CompilerError(kind, message, tokenIndex);
        errors.add(e);
        log.warn("{} (token {})", e, e.tokenIndex());
    }

    List<CompilerError> all() {
        return Collections.unmodifiableList(errors);
    }

    boolean hasErrors() {
        return !errors.isEmpty();
    }
}
