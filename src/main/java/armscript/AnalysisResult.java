package armscript;

import java.util.List;

/**
 * Outcome of one analysis. A {@link Success} carries the symbol table and the
 * quadruples; a {@link Failure} carries only diagnostics, so partial output from a
 * failed run can never be mistaken for a result.
 */
public sealed interface AnalysisResult permits AnalysisResult.Success, AnalysisResult.Failure {

    boolean success();

    List<Symbol> symbols();

    List<Quadruple> quadruples();

    List<CompilerError> diagnostics();

    // rendered diagnostics, empty on success
    default List<String> errors() {
        return diagnostics().stream().map(CompilerError::toString).toList();
    }

    record Success(List<Symbol> symbols, List<Quadruple> quadruples) implements AnalysisResult {
        public Success {
            symbols = List.copyOf(symbols);
            quadruples = List.copyOf(quadruples);
        }

        public boolean success() { return true; }

        public List<CompilerError> diagnostics() { return List.of(); }
    }

    record Failure(List<CompilerError> diagnostics) implements AnalysisResult {
        public Failure {
            if (diagnostics.isEmpty()) {
                throw new IllegalArgumentException("a failure needs at least one diagnostic");
            }
            diagnostics = List.copyOf(diagnostics);
        }

        public boolean success() { return false; }

        public List<Symbol> symbols() { return List.of(); }

        public List<Quadruple> quadruples() { return List.of(); }
    }
}
