package org.rtlgraph.frontend.verilator;

import com.typesafe.config.Config;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Runs {@code verilator --xml-only} on an HDL source and returns the path of the XML it wrote.
 */
public class VerilatorRunner {

    private static final Logger log = LoggerFactory.getLogger(VerilatorRunner.class);

    private final String executable;
    private final List<String> extraArgs;

    public VerilatorRunner(String executable, List<String> extraArgs) {
        this.executable = executable;
        this.extraArgs = List.copyOf(extraArgs);
    }

    /**
     * Creates a runner from the {@code rtlgraph.verilator} section.
     */
    public static VerilatorRunner fromConfig(Config config) {
        String executable = config.hasPath("rtlgraph.verilator.executable")
                ? config.getString("rtlgraph.verilator.executable") : "verilator";
        List<String> extraArgs = config.hasPath("rtlgraph.verilator.extra-args")
                ? config.getStringList("rtlgraph.verilator.extra-args") : List.of();
        return new VerilatorRunner(executable, extraArgs);
    }

    /**
     * Builds the frontend command line.
     *
     * @param source    The HDL source file.
     * @param xmlOutput Where the XML is to be written.
     * @param topModule The top module, or null to let the frontend pick it.
     * @return The command and its arguments.
     */
    public List<String> buildCommand(Path source, Path xmlOutput, String topModule) {
        List<String> command = new ArrayList<>();
        command.add(executable);
        command.add("--xml-only");
        command.add("--xml-output");
        command.add(xmlOutput.toString());
        command.add("-Wno-fatal");
        if (topModule != null && !topModule.isBlank()) {
            command.add("--top-module");
            command.add(topModule);
        }
        command.addAll(extraArgs);
        command.add(source.toString());
        return command;
    }

    /**
     * Elaborates a source file into {@code workDir}.
     *
     * @param source    The HDL source file.
     * @param workDir   Directory receiving the XML file.
     * @param topModule The top module, or null.
     * @return The path of the written XML file.
     * @throws VerilatorException if the frontend is missing, fails or writes no XML.
     */
    public Path run(Path source, Path workDir, String topModule) {
        String baseName = source.getFileName().toString().replaceFirst("\\.[^.]*$", "");
        Path xmlOutput = workDir.resolve(baseName + ".xml");
        List<String> command = buildCommand(source, xmlOutput, topModule);
        log.debug("Running {}", String.join(" ", command));

        Process process;
        try {
            Files.createDirectories(workDir);
            ProcessBuilder pb = new ProcessBuilder(command);
            pb.redirectErrorStream(true);
            process = pb.start();
        } catch (IOException e) {
            throw new VerilatorException("Cannot start '" + executable + "': " + e.getMessage(), e);
        }

        String output;
        int exitCode;
        try (InputStream stream = process.getInputStream()) {
            output = new String(stream.readAllBytes(), StandardCharsets.UTF_8);
            exitCode = process.waitFor();
        } catch (IOException e) {
            process.destroyForcibly();
            throw new VerilatorException("Failed reading output of '" + executable + "': " + e.getMessage(), e);
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            throw new VerilatorException("Interrupted while waiting for '" + executable + "'", e);
        }

        if (exitCode != 0) {
            throw new VerilatorException(executable + " exited with code " + exitCode + " for " + source, output);
        }
        if (!Files.isRegularFile(xmlOutput)) {
            throw new VerilatorException(executable + " wrote no XML to " + xmlOutput, output);
        }
        log.info("Elaborated {} -> {}", source, xmlOutput);
        return xmlOutput;
    }
}
