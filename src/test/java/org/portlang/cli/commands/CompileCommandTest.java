package org.portlang.cli.commands;

import org.portlang.cli.CommandLineInterface;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests the {@code portlang compile} command through picocli, with captured output streams.
 */
@Tag("unit")
class CompileCommandTest {

    @TempDir
    Path tempDir;

    private StringWriter out;
    private StringWriter err;
    private CommandLine commandLine;

    @BeforeEach
    void setUp() {
        out = new StringWriter();
        err = new StringWriter();
        commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setOut(new PrintWriter(out));
        commandLine.setErr(new PrintWriter(err));
    }

    private Path fixture(String name) throws IOException {
        Path target = tempDir.resolve(name);
        try (InputStream in = CompileCommandTest.class.getResourceAsStream("/portfolios/" + name)) {
            assertThat(in).as("fixture %s", name).isNotNull();
            Files.copy(in, target);
        }
        return target;
    }

    @Test
    void validFileWritesPdfReportByDefault() throws IOException {
        // Given
        Path source = fixture("valid.port");
        Path reports = tempDir.resolve("reports");

        // When
        int exitCode = commandLine.execute("compile", "--report-dir", reports.toString(), source.toString());

        // Then
        assertThat(exitCode).isEqualTo(0);
        assertThat(out.toString()).contains(source + ": OK").contains("Report written to");
        Path report = reports.resolve("fundos_de_inovacao_report.pdf");
        assertThat(report).exists();
        assertThat(new String(Files.readAllBytes(report), 0, 5, StandardCharsets.US_ASCII)).isEqualTo("%PDF-");
    }

    @Test
    void formatOptionSelectsTextReport() throws IOException {
        Path source = fixture("valid.port");
        Path reports = tempDir.resolve("reports");

        int exitCode = commandLine.execute("compile", "--format", "TEXT", "--report-dir", reports.toString(), source.toString());

        assertThat(exitCode).isEqualTo(0);
        Path report = reports.resolve("fundos_de_inovacao_report.txt");
        assertThat(report).exists();
        assertThat(Files.readString(report, StandardCharsets.UTF_8)).contains("Fundos de Inovação");
        assertThat(reports.resolve("fundos_de_inovacao_report.pdf")).doesNotExist();
    }

    @Test
    void configFileSelectsReportFormat() throws IOException {
        Path source = fixture("valid.port");
        Path reports = tempDir.resolve("reports");
        Path config = tempDir.resolve("text.conf");
        Files.writeString(config, "portlang.report.format = TEXT\n");

        int exitCode = commandLine.execute("--config", config.toString(),
                "compile", "--report-dir", reports.toString(), source.toString());

        assertThat(exitCode).isEqualTo(0);
        assertThat(reports.resolve("fundos_de_inovacao_report.txt")).exists();
    }

    @Test
    void invalidFilePrintsDiagnosticsAndFails() throws IOException {
        Path source = fixture("sum_error.port");

        int exitCode = commandLine.execute("compile", "--report-dir", tempDir.resolve("reports").toString(), source.toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(out.toString())
                .contains("1 error(s):")
                .contains("[SEM003] Allocation total is 110%, exceeds 100%")
                .contains("suggestion: Reduce the allocations by 10.00%");
        assertThat(tempDir.resolve("reports")).doesNotExist();
    }

    @Test
    void noReportOptionSkipsRendering() throws IOException {
        Path source = fixture("valid.port");
        Path reports = tempDir.resolve("reports");

        int exitCode = commandLine.execute("compile", "--no-report", "--report-dir", reports.toString(), source.toString());

        assertThat(exitCode).isEqualTo(0);
        assertThat(reports).doesNotExist();
    }

    @Test
    void unreadableFileIsAnIoFailure() throws IOException {
        Path valid = fixture("valid.port");
        Path missing = tempDir.resolve("missing.port");

        int exitCode = commandLine.execute("compile", "--no-report", valid.toString(), missing.toString());

        assertThat(exitCode).isEqualTo(2);
        assertThat(err.toString()).contains("missing.port: cannot read file");
        assertThat(out.toString()).contains(valid + ": OK");
    }

    @Test
    void configFileOverridesValidationLimits() throws IOException {
        // Given
        Path source = fixture("valid.port");
        Path config = tempDir.resolve("strict.conf");
        Files.writeString(config, """
                portlang {
                  validation { max-management-fee-limit = 3 }
                  report { enabled = false }
                }
                """);

        // When
        int exitCode = commandLine.execute("--config", config.toString(), "compile", source.toString());

        // Then
        assertThat(exitCode).isEqualTo(1);
        assertThat(out.toString()).contains("[SEM018]");
    }

    @Test
    void unknownLogLevelInConfigIsRejected() throws IOException {
        Path source = fixture("valid.port");
        Path config = tempDir.resolve("logging.conf");
        Files.writeString(config, "logging.default-level = LOUD\n");

        int exitCode = commandLine.execute("--config", config.toString(), "compile", "--no-report", source.toString());

        assertThat(exitCode).isNotZero();
        assertThat(err.toString()).contains("Failed to load or parse configuration").contains("unknown log level 'LOUD'");
    }

    @Test
    void missingConfigFileIsRejected() throws IOException {
        Path source = fixture("valid.port");

        int exitCode = commandLine.execute("--config", tempDir.resolve("absent.conf").toString(), "compile", source.toString());

        assertThat(exitCode).isNotZero();
        assertThat(err.toString()).contains("was not found");
    }
}
