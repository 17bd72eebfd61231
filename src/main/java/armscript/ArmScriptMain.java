/* Command line entry point: analyze a robot script, print and store its listing */
package armscript;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.nio.file.*;

public class ArmScriptMain {
    static final int EXIT_OK = 0;
    static final int EXIT_ANALYSIS_FAILED = 1;
    static final int EXIT_USAGE = 2;

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    static int run(String[] args, PrintStream out, PrintStream err) {
        if (args.length < 1 || args.length > 2 || (args.length == 2 && !args[1].equals("--simulate"))) {
            err.println("Usage: ArmScriptMain <file> [--simulate]");
            return EXIT_USAGE;
        }

        Path file = Path.of(args[0]);
        boolean simulate = args.length == 2;

        try {
            String source = Files.readString(file, StandardCharsets.UTF_8);

            try {
                TokenPrinter.printTokens(new Lexer(source).tokenize(), out);
            } catch (LexicalException e) {
                err.println("Token listing stopped: " + e.getMessage());
            }

            RobotAnalyzer analyzer = new RobotAnalyzer();
            AnalysisResult result = analyzer.analyze(source);
            out.println();
            ListingPrinter.print(result, out);

            ListingWriter lw = new ListingWriter(file);
            lw.write(source, result);
            out.println("\nListing written to " + lw.target());

            if (!result.success()) return EXIT_ANALYSIS_FAILED;

            if (simulate) {
                SimulatedRobotDriver driver = new SimulatedRobotDriver();
                QuadrupleExecutor.of(result, driver).run();
                out.println("\n==== Simulation ====");
                for (SimulatedRobotDriver.Motion m : driver.motions()) {
                    out.println(m);
                }
                out.println("total " + driver.motions().size() + " movements, " + driver.simulatedSeconds() + "s");
            }
            return EXIT_OK;

        } catch (IOException e) {
            err.println("Error reading file: " + file + " (" + e.getMessage() + ")");
            return EXIT_USAGE;
        } catch (ExecutionException e) {
            err.println("Simulation failed: " + e.getMessage());
            return EXIT_ANALYSIS_FAILED;
        }
    }
}
