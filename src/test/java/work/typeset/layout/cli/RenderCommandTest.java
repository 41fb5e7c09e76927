package work.typeset.layout.cli;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;

class RenderCommandTest {
    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();

    private int run(String... args) {
        return Main.commandLine()
            .setOut(new PrintWriter(out))
            .setErr(new PrintWriter(err))
            .execute(args);
    }

    private static String fixture(String name) {
        return Path.of("src", "test", "resources", "layouts", name).toAbsolutePath().toString();
    }

    @Test
    void printsCompactLayout() {
        int exitCode = run("-i", fixture("nested.yaml"));

        assertEquals(0, exitCode);
        assertTrue(out.toString().startsWith("1\n200.0000 100.0000\n7\n"));
        assertTrue(out.toString().contains("w inner\n"));
    }

    @Test
    void settingsFileSelectsDiagnosticFormat() {
        int exitCode = run("-i", fixture("pages.json"), "--config", fixture("settings.toml"));

        assertEquals(0, exitCode);
        assertTrue(out.toString().contains("box [10pt, 10pt] [20pt, 20pt]"));
        assertTrue(out.toString().contains("write \"boxed\""));
    }

    @Test
    void formatFlagOverridesSettings() {
        int exitCode = run("-i", fixture("pages.json"), "--config", fixture("settings.toml"), "-f", "compact");

        assertEquals(0, exitCode);
        assertTrue(out.toString().startsWith("2\n"));
        assertTrue(out.toString().contains("b 10.0000 10.0000 20.0000 20.0000\n"));
    }

    @Test
    void printsVersion() {
        int exitCode = run("--version");

        assertEquals(0, exitCode);
        assertTrue(out.toString().startsWith("layout-render "));
    }

    @Test
    void failsOnBrokenDocument() {
        int exitCode = run("-i", fixture("broken.yaml"));

        assertEquals(1, exitCode);
        assertTrue(err.toString().contains("rotate"));
    }

    @Test
    void failsOnMissingDocument() {
        int exitCode = run("-i", fixture("missing.yaml"));

        assertNotEquals(0, exitCode);
        assertTrue(err.toString().contains("not found"));
    }

    @Test
    void failsOnUnknownLogLevel() {
        int exitCode = run("-i", fixture("nested.yaml"), "--log-level", "loud");

        assertEquals(1, exitCode);
        assertTrue(err.toString().contains("Unsupported log level"));
    }
}
