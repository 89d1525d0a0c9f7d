package org.tessera.cli;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Smoke tests for the command line entry point: usage, help, and argument parsing.
 */
@Tag("unit")
public class CommandLineInterfaceTest {

    @TempDir
    Path tempDir;

    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();

    private CommandLine commandLine() {
        CommandLine cmdLine = CommandLineInterface.createCommandLine();
        cmdLine.setOut(new PrintWriter(out));
        cmdLine.setErr(new PrintWriter(err));
        return cmdLine;
    }

    @Test
    void testNoArgumentsPrintsUsageAndSucceeds() {
        int exitCode = commandLine().execute();

        assertThat(exitCode).isZero();
        assertThat(out.toString()).contains("Usage: tessera").contains("<image>").contains("<tiles directory>");
    }

    @Test
    void testSingleArgumentPrintsUsage() {
        int exitCode = commandLine().execute("photo.jpg");

        assertThat(exitCode).isZero();
        assertThat(out.toString()).contains("Usage: tessera");
    }

    @Test
    void testHelpOutput() {
        int exitCode = commandLine().execute("--help");

        // Help may go to stdout or stderr depending on PicoCLI version
        String output = out.toString() + err.toString();
        assertThat(exitCode).isZero();
        assertThat(output).contains("--config");
        assertThat(output).contains("tessera.mosaic.tileSize");
    }

    @Test
    void testVersionOutput() {
        commandLine().execute("--version");

        assertThat(out.toString()).contains("Tessera 1.0");
    }

    @Test
    void testMissingConfigFileFails() {
        Path missing = tempDir.resolve("nope.conf");

        int exitCode = commandLine().execute("-c", missing.toString(), "photo.jpg", "tiles");

        assertThat(exitCode).isEqualTo(1);
    }

    @Test
    void testTooManyArgumentsIsAUsageError() {
        int exitCode = commandLine().execute("a.jpg", "tiles", "extra");

        assertThat(exitCode).isEqualTo(CommandLine.ExitCode.USAGE);
        assertThat(err.toString()).contains("extra");
    }
}
