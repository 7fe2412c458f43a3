package com.lispcalc.eval;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

/** Blocking line reader: writes the prompt without a newline, flushes, then waits for one line. */
public final class ConsoleLineSource implements LineSource {

    private final BufferedReader in;
    private final PrintStream out;

    public ConsoleLineSource() {
        this(System.in, System.out);
    }

    public ConsoleLineSource(InputStream in, PrintStream out) {
        this.in = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
        this.out = out;
    }

    @Override
    public String readLine(String prompt) throws IOException {
        if (prompt != null) {
            out.print(prompt);
            out.flush();
        }
        return in.readLine(); // blocks
    }
}
