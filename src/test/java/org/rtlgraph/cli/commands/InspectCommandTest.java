package org.rtlgraph.cli.commands;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.rtlgraph.cli.CommandLineInterface;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Smoke tests for the inspect command.
 */
@Tag("unit")
public class InspectCommandTest {

    @TempDir
    Path tempDir;

    @Test
    void testPrintsClassifiedBlocks() throws Exception {
        Path ast = CommandTestSupport.copyFixture("counter.xml", tempDir);

        CommandLine cmdLine = CommandLineInterface.createCommandLine();
        StringWriter out = new StringWriter();
        StringWriter err = new StringWriter();
        cmdLine.setOut(new PrintWriter(out));
        cmdLine.setErr(new PrintWriter(err));

        int exitCode = cmdLine.execute("inspect", "--ast", ast.toString());

        assertThat(exitCode).describedAs("stderr: %s", err.toString()).isEqualTo(0);
        assertThat(out.toString())
            .contains("=== Module counter ===")
            .contains("Blocks:")
            .contains("Counter")
            .contains("-> always_0")
            .contains("Connections:")
            .contains("=== Diagnostics (0 errors");
    }

    @Test
    void testPrintsConnectionsAndModuleLinks() throws Exception {
        Path ast = CommandTestSupport.copyFixture("instances.xml", tempDir);

        CommandLine cmdLine = CommandLineInterface.createCommandLine();
        StringWriter out = new StringWriter();
        cmdLine.setOut(new PrintWriter(out));

        int exitCode = cmdLine.execute("inspect", "--ast", ast.toString());

        assertThat(exitCode).isEqualTo(0);
        assertThat(out.toString())
            .contains("=== Module top ===")
            .contains("=> module source")
            .contains("=> module sink")
            .contains(" : w");
    }

    @Test
    void testNonexistentFileReturnsError() {
        CommandLine cmdLine = CommandLineInterface.createCommandLine();
        StringWriter err = new StringWriter();
        cmdLine.setErr(new PrintWriter(err));

        int exitCode = cmdLine.execute("inspect", "--ast", tempDir.resolve("missing.xml").toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString()).contains("Error:");
    }
}
