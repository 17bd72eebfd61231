package armscript;

import java.io.PrintStream;
import java.util.List;

/** Plain-text listing of an analysis: symbol table and quadruples, or the errors. */
final class ListingPrinter {

    private static final int CELLS = 7;

    static void print(AnalysisResult result, PrintStream out) {
        if (!result.success()) {
            out.println("==== Errors ====");
            for (String e : result.errors()) {
                out.println(e);
            }
            return;
        }
        printSymbols(result.symbols(), out);
        out.println();
        printQuadruples(result.quadruples(), out);
    }

    static void printSymbols(List<Symbol> symbols, PrintStream out) {
        out.println("==== Symbol table ====");
        CellWriter w = new CellWriter(out, CELLS);
        w.row("ID", "METHOD", "PARAM", "VALUE");
        for (Symbol s : symbols) {
            w.row(s.robotId(), s.command(), String.valueOf(s.parameter()), String.valueOf(s.value()));
        }
    }

    static void printQuadruples(List<Quadruple> code, PrintStream out) {
        out.println("==== Quadruples ====");
        CellWriter w = new CellWriter(out, CELLS);
        w.row("#", "OPERATOR", "OPERAND1", "OPERAND2", "RESULT");
        for (int i = 0; i < code.size(); i++) {
            Quadruple q = code.get(i);
            w.row(String.valueOf(i), q.operator().name(), q.operand1(), q.operand2(), q.result());
        }
    }

    private static final class CellWriter {
        private final PrintStream out;
        private final int cells;

        CellWriter(PrintStream out, int cells) {
            this.out = out;
            this.cells = cells;
        }

        void row(String... columns) {
            StringBuilder sb = new StringBuilder();
            for (String c : columns) {
                sb.append(padCell(c, cells));
            }
            out.println(sb.toString().stripTrailing());
        }

        // pad to the next multiple of the cell width, always leaving one blank
        private static String padCell(String raw, int cells) {
            String s = (raw == null) ? "" : raw;
            int needed = s.length() + 1;
            int width = ((needed + cells - 1) / cells) * cells;
            StringBuilder sb = new StringBuilder(width);

            sb.append(s);
            while (sb.length() < width) {
                sb.append(" ");
            }
            return sb.toString();
        }
    }
}
