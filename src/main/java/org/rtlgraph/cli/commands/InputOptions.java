package org.rtlgraph.cli.commands;

import picocli.CommandLine.Option;

import java.nio.file.Path;

/**
 * Where a command gets its design from: a ready syntax tree or an HDL source to elaborate.
 */
public class InputOptions {

    @Option(
        names = {"--ast"},
        description = "Syntax tree written by 'verilator --xml-only'"
    )
    Path astFile;

    @Option(
        names = {"--verilog"},
        description = "HDL source file, elaborated with Verilator"
    )
    Path verilogFile;

    /**
     * The file named on the command line, whichever option was used.
     */
    Path inputFile() {
        return astFile != null ? astFile : verilogFile;
    }
}
