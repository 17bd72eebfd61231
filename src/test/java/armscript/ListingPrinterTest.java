package armscript;

import static org.junit.jupiter.api.Assertions.*;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ListingPrinterTest {

    private final RobotAnalyzer analyzer = new RobotAnalyzer(AnalyzerConfig.defaults());

    private static String render(AnalysisResult r) {
        ByteArrayOutputStream buf = new ByteArrayOutputStream();
        ListingPrinter.print(r, new PrintStream(buf, true, StandardCharsets.UTF_8));
        return buf.toString(StandardCharsets.UTF_8);
    }

    @Test
    void successListsSymbolsAndQuadruples() {
        String out = render(analyzer.analyze("Robot R1 R1.base = 90"));

        assertTrue(out.contains("==== Symbol table ===="));
        assertTrue(out.contains("==== Quadruples ===="));
        assertTrue(out.contains("CREATE"));
        assertTrue(out.contains("MOVE"));
        assertFalse(out.contains("Errors"));
    }

    @Test
    void failureListsOnlyErrors() {
        String out = render(analyzer.analyze("Robot R1 R1.base = 500"));

        assertTrue(out.startsWith("==== Errors ===="));
        assertTrue(out.contains("Semantic error: value out of range for base: 500 (range: 0-360)"));
        assertFalse(out.contains("Quadruples"));
    }

    @Test
    void listingFileSitsNextToTheSource(@TempDir Path dir) throws Exception {
        Path src = dir.resolve("pick.robot");
        String text = "Robot R1\nR1.base = 90\n";
        Files.writeString(src, text);

        ListingWriter w = new ListingWriter(src);
        assertEquals(dir.resolve("pick.lst"), w.target());
        w.write(text, analyzer.analyze(text));

        String lst = Files.readString(w.target());
        assertTrue(lst.startsWith("1  Robot R1"));
        assertTrue(lst.contains("2  R1.base = 90"));
        assertTrue(lst.contains("MOVE"));
    }
}
