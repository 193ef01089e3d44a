package org.portlang.cli.commands;

import org.portlang.cli.CommandLineInterface;
import org.portlang.compiler.Compiler;
import org.portlang.compiler.CompilerSettings;
import org.portlang.compiler.api.CompilationException;
import org.portlang.compiler.api.CompilationResult;
import org.portlang.compiler.api.ICompiler;
import org.portlang.report.RenderedReport;
import org.portlang.report.ReportFormat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Compiles one or more portfolio files, prints their diagnostics and writes a report
 * for every file that compiled without errors.
 * <p>
 * Exit codes: 0 when all files are valid, 1 when any file has errors, 2 when a file could not be read or a
 * report could not be written.
 */
@Command(
    name = "compile",
    description = "Compile and validate portfolio files",
    mixinStandardHelpOptions = true
)
public class CompileCommand implements Callable<Integer> {

    private static final Logger LOGGER = LoggerFactory.getLogger(CompileCommand.class);

    static final int EXIT_OK = 0;
    static final int EXIT_INVALID = 1;
    static final int EXIT_IO_FAILURE = 2;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Parameters(arity = "1..*", paramLabel = "FILE", description = "Portfolio source files")
    private List<Path> files;

    @Option(names = "--report-dir", paramLabel = "DIR", description = "Directory for generated reports (default: portlang.report.output-directory)")
    private Path reportDirectory;

    @Option(names = "--no-report", description = "Do not render reports")
    private boolean noReport;

    @Option(names = "--format", paramLabel = "FORMAT", description = "Report format: ${COMPLETION-CANDIDATES} (default: portlang.report.format)")
    private ReportFormat reportFormat;

    @Override
    public Integer call() {
        CompilerSettings settings = CompilerSettings.fromConfig(parent.getConfig());
        if (noReport) {
            settings = settings.withReportEnabled(false);
        }
        if (reportDirectory != null) {
            settings = settings.withReportDirectory(reportDirectory);
        }
        if (reportFormat != null) {
            settings = settings.withReportFormat(reportFormat);
        }

        Compiler compiler = new Compiler(settings.validation(),
                settings.reportEnabled()
                        ? settings.reportFormat().createRenderer(Clock.systemDefaultZone(), settings.validation())
                        : null);

        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        int exitCode = EXIT_OK;
        for (Path file : files) {
            exitCode = Math.max(exitCode, compileOne(compiler, settings, file, out, err));
        }
        out.flush();
        err.flush();
        return exitCode;
    }

    private int compileOne(Compiler compiler, CompilerSettings settings, Path file, PrintWriter out, PrintWriter err) {
        String source;
        try {
            source = ICompiler.readSource(file);
        } catch (CompilationException e) {
            LOGGER.debug("Cannot read {}", file, e);
            err.println(file + ": cannot read file: " + e.getCause().getMessage());
            return EXIT_IO_FAILURE;
        }

        CompilationResult result = settings.reportEnabled()
                ? compiler.compileAndRender(source)
                : compiler.compile(source);

        if (result.diagnostics().isEmpty()) {
            out.println(file + ": OK");
        } else {
            out.println(file + ":");
            out.println(result.summary());
        }
        if (result.hasErrors()) {
            return EXIT_INVALID;
        }

        if (result.hasReport()) {
            RenderedReport report = result.report();
            Path target = settings.reportDirectory().resolve(report.fileName());
            try {
                Files.createDirectories(settings.reportDirectory());
                Files.write(target, report.content());
            } catch (IOException e) {
                LOGGER.debug("Cannot write report {}", target, e);
                err.println(file + ": cannot write report " + target + ": " + e.getMessage());
                return EXIT_IO_FAILURE;
            }
            out.println("Report written to " + target);
        }
        return EXIT_OK;
    }
}
