package armscript;

import static org.junit.jupiter.api.Assertions.*;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ArmScriptMainTest {

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();

    private int run(String... args) {
        return ArmScriptMain.run(args,
            new PrintStream(out, true, StandardCharsets.UTF_8),
            new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    @Test
    void usageWithoutArguments() {
        assertEquals(ArmScriptMain.EXIT_USAGE, run());
        assertTrue(err.toString(StandardCharsets.UTF_8).contains("Usage"));
    }

    @Test
    void missingFile(@TempDir Path dir) {
        assertEquals(ArmScriptMain.EXIT_USAGE, run(dir.resolve("nope.robot").toString()));
    }

    @Test
    void simulatesAValidScript(@TempDir Path dir) throws Exception {
        Path src = dir.resolve("demo.robot");
        Files.writeString(src, "Robot R1\nR1.repetir = 2 {\n R1.base = 45\n}\n");

        assertEquals(ArmScriptMain.EXIT_OK, run(src.toString(), "--simulate"));
        String text = out.toString(StandardCharsets.UTF_8);
        assertTrue(text.contains("BEGIN_LOOP"));
        assertTrue(text.contains("total 2 movements"));
        assertTrue(Files.exists(dir.resolve("demo.lst")));
    }

    @Test
    void invalidScriptExitsWithFailure(@TempDir Path dir) throws Exception {
        Path src = dir.resolve("bad.robot");
        Files.writeString(src, "Robot R1 R1.base = 9$");

        assertEquals(ArmScriptMain.EXIT_ANALYSIS_FAILED, run(src.toString()));
        assertTrue(out.toString(StandardCharsets.UTF_8).contains("Lexical error"));
    }
}
