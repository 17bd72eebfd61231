package armscript;

import java.io.*;
import java.util.*;

final class TokenPrinter {
    private static final int LINE_WIDTH = 60;

    // the actual final printer, packs tokens into lines of at most 60 columns
    static void printTokens(List<Token> tokens, PrintStream out) {
        StringBuilder line = new StringBuilder(80);

        for (Token t : tokens) {
            String chunk = t.toString();

            // a chunk wider than a line gets a line to itself, never split it
            if (chunk.length() > LINE_WIDTH) {
                if (line.length() > 0) { out.println(line); line.setLength(0); }
                out.println(chunk);
                continue;
            }

            // would push the current line past 60
            if (line.length() > 0 && line.length() + chunk.length() > LINE_WIDTH) {
                out.println(line);
                line.setLength(0);
            }

            line.append(chunk);
        }

        if (line.length() > 0) out.println(line); // print any remaining text
    }
}
