package org.portlang.compiler;

import org.portlang.compiler.api.CompilationResult;
import org.portlang.compiler.diagnostics.Diagnostic;
import org.portlang.compiler.frontend.semantics.ValidationSettings;
import org.portlang.compiler.model.PortfolioDocument;
import org.portlang.report.IReportRenderer;
import org.portlang.report.RenderedReport;
import org.portlang.report.ReportGenerationException;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * Unit tests for report rendering through {@link Compiler#compileAndRender(String)}.
 */
@Tag("unit")
@ExtendWith(MockitoExtension.class)
class CompilerTest {

    private static final String VALID = "carteira { perfil = \"conservador\"; alocação { renda_fixa = 100%; } }";
    private static final String INVALID = "carteira { perfil = \"conservador\"; alocação { renda_fixa = 90%; } }";

    @Mock
    private IReportRenderer renderer;

    @Test
    void rendersValidPortfolio() throws Exception {
        RenderedReport report = new RenderedReport("portfolio_report.txt", new byte[]{1, 2, 3});
        when(renderer.render(any(PortfolioDocument.class))).thenReturn(report);
        Compiler compiler = new Compiler(ValidationSettings.defaults(), renderer);

        CompilationResult result = compiler.compileAndRender(VALID);

        assertThat(result.diagnostics()).isEmpty();
        assertThat(result.hasReport()).isTrue();
        assertThat(result.report()).isEqualTo(report);
        verify(renderer).render(result.document());
    }

    @Test
    void doesNotRenderWhenErrorsExist() {
        Compiler compiler = new Compiler(ValidationSettings.defaults(), renderer);

        CompilationResult result = compiler.compileAndRender(INVALID);

        assertThat(result.hasErrors()).isTrue();
        assertThat(result.hasReport()).isFalse();
        verifyNoInteractions(renderer);
    }

    @Test
    void missingRendererIsAWarning() {
        Compiler compiler = new Compiler();

        CompilationResult result = compiler.compileAndRender(VALID);

        assertThat(compiler.getReportRenderer()).isEmpty();
        assertThat(result.hasErrors()).isFalse();
        assertThat(result.warnings()).extracting(Diagnostic::code).containsExactly("GEN001");
        assertThat(result.report()).isNull();
    }

    @Test
    void rendererFailureIsAnError() throws Exception {
        when(renderer.render(any(PortfolioDocument.class))).thenThrow(new ReportGenerationException("disk full"));
        Compiler compiler = new Compiler(ValidationSettings.defaults(), renderer);

        CompilationResult result = compiler.compileAndRender(VALID);

        assertThat(result.errors()).extracting(Diagnostic::code).containsExactly("GEN003");
        assertThat(result.errors().get(0).category()).isEqualTo(Diagnostic.Category.GENERATION);
        assertThat(result.errors().get(0).message()).contains("disk full");
        assertThat(result.hasDocument()).isTrue();
    }

    @Test
    void plainCompileNeverRenders() {
        Compiler compiler = new Compiler(ValidationSettings.defaults(), renderer);

        CompilationResult result = compiler.compile(VALID);

        assertThat(result.report()).isNull();
        verifyNoInteractions(renderer);
    }
}
