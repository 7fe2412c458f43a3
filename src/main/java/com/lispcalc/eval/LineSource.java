package com.lispcalc.eval;

import java.io.IOException;

/** Where {@code read} gets its input from. Returns null at end of input. */
@FunctionalInterface
public interface LineSource {
    String readLine(String prompt) throws IOException;
}
