package io.quakeflow.commands;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class ExtractCommandTest {

    @TempDir
    Path tempDir;

    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();

    @Test
    void testMockExtractionExitsZero() {
        int exit = execute("--out-dir", tempDir.toString(), "--use-mock",
                "--start-year", "2020", "--end-year", "2021", "--interval-years", "1");

        assertThat(exit).isZero();
        assertThat(out.toString()).contains("Combined output:");
        assertThat(Files.exists(tempDir.resolve("earthquakes_combined.geojson"))).isTrue();
    }

    @Test
    void testStartYearAfterEndYear() {
        int exit = execute("--out-dir", tempDir.toString(), "--use-mock",
                "--start-year", "2022", "--end-year", "2020");

        assertThat(exit).isEqualTo(1);
        assertThat(err.toString()).startsWith("ERROR: ");
        assertThat(err.toString()).contains("startYear 2022 is after endYear 2020");
    }

    @Test
    void testUnwritableOutputDirectory() throws Exception {
        Path blocked = tempDir.resolve("blocked");
        Files.writeString(blocked, "a file, not a directory");

        int exit = execute("--out-dir", blocked.toString(), "--use-mock",
                "--start-year", "2020", "--end-year", "2020");

        assertThat(exit).isEqualTo(1);
        assertThat(err.toString()).startsWith("ERROR: ");
    }

    // Helper

    private int execute(String... args) {
        CommandLine cmd = new CommandLine(new ExtractCommand());
        cmd.setOut(new PrintWriter(out));
        cmd.setErr(new PrintWriter(err));
        int exit = cmd.execute(args);
        cmd.getOut().flush();
        cmd.getErr().flush();
        return exit;
    }
}
