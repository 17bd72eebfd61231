package armscript;

import java.util.Objects;

// all mutable state of a single analysis, created fresh for every call
final class AnalysisContext {
    final AnalyzerConfig config;
    final SymbolTable symbols = new SymbolTable();
    final VelocityRegistry velocities;
    final Emitter emitter = new Emitter();
    final ErrorReporter errors = new ErrorReporter();

    AnalysisContext(AnalyzerConfig config) {
        this.config = Objects.requireNonNull(config);
        this.velocities = new VelocityRegistry(config.defaultDelaySeconds());
    }
}
