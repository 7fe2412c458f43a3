import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.JsonNode;
import com.lispcalc.LispCalc;

import org.junit.jupiter.api.Test;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.net.URL;
import java.net.URLClassLoader;

import static org.junit.jupiter.api.Assertions.*;

/**
 * The debug hub is a static singleton, so any test that installs a sink changes what later
 * tests see. These tests load the project's classes in their own class loader to observe the
 * hub exactly as a fresh JVM does, whatever ran before.
 */
public class DebugDefaultStateTest {

    private static URL location(Class<?> c) {
        return c.getProtectionDomain().getCodeSource().getLocation();
    }

    private static URLClassLoader freshLoader() {
        URL[] urls = {
                location(LispCalc.class),
                location(JsonNode.class),
                location(JsonParser.class),
                location(JsonInclude.class),
        };
        return new URLClassLoader(urls, ClassLoader.getPlatformClassLoader());
    }

    @Test
    void freshHub_hasNonNullSink_andLogsWithoutThrowing() throws Exception {
        try (URLClassLoader loader = freshLoader()) {
            Class<?> debug = loader.loadClass("com.lispcalc.debug.Debug");
            assertNotSame(com.lispcalc.debug.Debug.class, debug);

            Object hub = debug.getMethod("get").invoke(null);
            assertNotNull(debug.getMethod("getSink").invoke(hub));
            assertDoesNotThrow(() -> debug.getMethod("w", String.class, String.class).invoke(hub, "lispcalc.test", "hello"));
        }
    }

    @Test
    void freshPipeline_runsWithoutInstallingSink() throws Exception {
        try (URLClassLoader loader = freshLoader()) {
            Class<?> engineClass = loader.loadClass("com.lispcalc.LispCalc");
            Object engine = engineClass.getConstructor().newInstance();

            Method evaluate = engineClass.getMethod("evaluate", String.class);
            assertEquals(4, evaluate.invoke(engine, "(+ 2 (- 4 2))"));

            Method parse = engineClass.getMethod("parse", String.class);
            Object folded = engineClass.getMethod("partialEvaluate", loader.loadClass("com.lispcalc.parser.Expr$ExprInterface"))
                    .invoke(engine, parse.invoke(engine, "(+ 2 (- 4 2))"));
            assertEquals("4", folded.toString());
        }
    }

    @Test
    void freshPipeline_reportsMalformedInput_notNullPointer() throws Exception {
        try (URLClassLoader loader = freshLoader()) {
            Class<?> engineClass = loader.loadClass("com.lispcalc.LispCalc");
            Object engine = engineClass.getConstructor().newInstance();
            Method parse = engineClass.getMethod("parse", String.class);

            InvocationTargetException ex = assertThrows(InvocationTargetException.class,
                    () -> parse.invoke(engine, "(+ 2"));
            assertEquals("com.lispcalc.error.MalformedInputException", ex.getCause().getClass().getName());
        }
    }
}
