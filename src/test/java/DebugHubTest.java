import com.lispcalc.LispCalc;
import com.lispcalc.debug.Debug;
import com.lispcalc.debug.DebugLevel;
import com.lispcalc.debug.DebugSink;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class DebugHubTest {

    @AfterEach
    void reset() {
        Debug.get().reset();
    }

    @Test
    void uninterpretedCall_logsWarning() {
        List<String> seen = new ArrayList<>();
        Debug.get().setSink((level, tag, message, error) -> {
            if (level == DebugLevel.WARN) seen.add(tag + ":" + message);
        });

        LispCalc es = new LispCalc();
        es.evaluate("(frob 1 2)");

        assertEquals(1, seen.size());
        assertTrue(seen.get(0).startsWith("lispcalc.eval:"), seen.get(0));
        assertTrue(seen.get(0).contains("frob"));
    }

    @Test
    void pipelineStages_logUnderTheirTags() {
        List<String> tags = new ArrayList<>();
        Debug.get().setSink((level, tag, message, error) -> tags.add(tag));

        LispCalc es = new LispCalc();
        es.partialEvaluate(es.parse("(let ((x 1)) (+ x 2))"));
        es.evaluate("(let ((x 1)) (+ x 2))");

        assertTrue(tags.contains("lispcalc.lexer"));
        assertTrue(tags.contains("lispcalc.parser"));
        assertTrue(tags.contains("lispcalc.pe"));
        assertTrue(tags.contains("lispcalc.eval"));
    }

    @Test
    void nullSink_fallsBackToNoop() {
        Debug.get().setSink(null);
        assertNotNull(Debug.get().getSink());
        assertDoesNotThrow(() -> Debug.get().e("t", "m", new RuntimeException("x")));
    }

    @Test
    void consoleSink_filtersBelowMinimum() {
        ByteArrayOutputStream buf = new ByteArrayOutputStream();
        DebugSink sink = Debug.console(new PrintStream(buf, true), DebugLevel.WARN);
        Debug.get().setSink(sink);

        Debug.get().d("lispcalc.test", "hidden");
        Debug.get().w("lispcalc.test", "shown");

        String s = buf.toString();
        assertFalse(s.contains("hidden"));
        assertTrue(s.contains("[WARN][lispcalc.test] shown"), s);
    }
}
