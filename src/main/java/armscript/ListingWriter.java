package armscript;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.nio.file.*;

// writes the numbered source followed by the listing to <input name>.lst
public class ListingWriter {
    private final Path target;

    public ListingWriter(Path source) {
        this.target = createFileName(source);
    }

    public Path target() {
        return target;
    }

    public void write(String source, AnalysisResult result) throws IOException {
        ByteArrayOutputStream buf = new ByteArrayOutputStream();
        try (PrintStream ps = new PrintStream(buf, true, StandardCharsets.UTF_8)) {
            int line = 0;
            for (String l : source.split("\r?\n", -1)) {
                ps.println(++line + "  " + l);
            }
            ps.println();
            ListingPrinter.print(result, ps);
        }
        Files.writeString(target, buf.toString(StandardCharsets.UTF_8), StandardCharsets.UTF_8);
    }

    /* 'dir/prog.robot' becomes 'dir/prog.lst' */
    static Path createFileName(Path source) {
        String name = source.getFileName().toString();
        int dot = name.indexOf('.');
        String base = dot > 0 ? name.substring(0, dot) : name;
        Path parent = source.getParent();
        return parent == null ? Path.of(base + ".lst") : parent.resolve(base + ".lst");
    }
}
