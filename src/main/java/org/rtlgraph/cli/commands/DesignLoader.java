package org.rtlgraph.cli.commands;

import com.typesafe.config.Config;
import org.rtlgraph.frontend.ast.DesignNode;
import org.rtlgraph.frontend.verilator.VerilatorRunner;
import org.rtlgraph.frontend.xml.AstReadException;
import org.rtlgraph.frontend.xml.VerilatorXmlReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;

/**
 * Loads the design named by {@link InputOptions}, elaborating HDL sources with Verilator first.
 */
final class DesignLoader {

    private static final Logger log = LoggerFactory.getLogger(DesignLoader.class);

    /**
     * A loaded design with the source it came from.
     *
     * @param design      The syntax tree.
     * @param sourceName  The input file name, used in diagnostics.
     * @param sourceLines HDL source lines when the input was a source file, else empty.
     */
    record LoadedDesign(DesignNode design, String sourceName, List<String> sourceLines) {}

    private DesignLoader() {
    }

    /**
     * @throws AstReadException if the syntax tree cannot be read.
     * @throws org.rtlgraph.frontend.verilator.VerilatorException if elaboration fails.
     */
    static LoadedDesign load(InputOptions input, String topModule, Config config) {
        return load(input, topModule, config, Path.of(System.getProperty("java.io.tmpdir")));
    }

    /**
     * Loads the design, elaborating HDL sources in a work directory under {@code tempRoot} that
     * is removed again once the syntax tree has been read.
     */
    static LoadedDesign load(InputOptions input, String topModule, Config config, Path tempRoot) {
        if (input.astFile != null) {
            DesignNode design = new VerilatorXmlReader().read(input.astFile);
            return new LoadedDesign(design, input.astFile.toString(), List.of());
        }

        Path source = input.verilogFile;
        if (!Files.isRegularFile(source)) {
            throw new AstReadException("Source file not found: " + source);
        }
        Path workDir;
        try {
            workDir = Files.createTempDirectory(tempRoot, "rtlgraph-");
        } catch (IOException e) {
            throw new AstReadException("Cannot create a working directory: " + e.getMessage(), e);
        }
        DesignNode design;
        try {
            Path xml = VerilatorRunner.fromConfig(config).run(source, workDir, topModule);
            design = new VerilatorXmlReader().read(xml);
        } finally {
            deleteRecursively(workDir);
        }

        List<String> lines;
        try {
            lines = Files.readAllLines(source, StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.warn("Cannot read source lines of {}: {}", source, e.getMessage());
            lines = List.of();
        }
        return new LoadedDesign(design, source.toString(), lines);
    }

    /**
     * Deletes a directory tree. Failures are logged; a leftover temporary file never fails a run.
     *
     * @return true if everything was deleted.
     */
    static boolean deleteRecursively(Path directory) {
        if (!Files.exists(directory)) {
            return true;
        }
        boolean[] success = {true};
        try (Stream<Path> walk = Files.walk(directory)) {
            walk.sorted(Comparator.reverseOrder()).forEach(path -> {
                try {
                    Files.delete(path);
                } catch (IOException e) {
                    success[0] = false;
                    log.warn("Failed to delete {}: {}", path, e.getMessage());
                }
            });
            log.debug("Deleted work directory {}", directory);
        } catch (IOException e) {
            log.warn("Failed to walk work directory {}: {}", directory, e.getMessage());
            return false;
        }
        return success[0];
    }
}
