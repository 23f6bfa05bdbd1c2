package my.termsheetrecon.app.cli;

import my.termsheetrecon.app.report.ReconciliationReportWriter;
import my.termsheetrecon.app.service.ReconciliationRun;
import my.termsheetrecon.app.service.ReconciliationRunException;
import my.termsheetrecon.app.service.ReconciliationWorkflowService;
import org.junit.jupiter.api.Test;
import org.springframework.boot.DefaultApplicationArguments;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ReconciliationRunnerTest {
	private final ReconciliationWorkflowService workflowService = mock(ReconciliationWorkflowService.class);
	private final ReconciliationReportWriter reportWriter = mock(ReconciliationReportWriter.class);
	private final ReconciliationRunner runner = new ReconciliationRunner(workflowService, reportWriter);

	@Test
	void doesNothingWithoutTwoFileArguments() {
		runner.run(new DefaultApplicationArguments());
		runner.run(new DefaultApplicationArguments("only.pdf"));
		runner.run(new DefaultApplicationArguments("a.pdf", "b.csv", "c.csv"));
		runner.run(null);

		verify(workflowService, never()).run(any(), any());
	}

	@Test
	void runsWorkflowWithPositionalArguments() {
		ReconciliationRun run = new ReconciliationRun(null, 1.0d, null, List.of(), null,
				Path.of("out.csv"), Path.of("out.md"));
		when(workflowService.run(Path.of("sheet.pdf"), Path.of("trades.json"))).thenReturn(run);
		when(reportWriter.renderConsoleSummary(List.of())).thenReturn("No reconciliation results to display");

		runner.run(new DefaultApplicationArguments("--app.report.output-dir=tmp", "sheet.pdf", "trades.json"));

		verify(workflowService).run(Path.of("sheet.pdf"), Path.of("trades.json"));
		verify(reportWriter).renderConsoleSummary(List.of());
	}

	@Test
	void propagatesWorkflowFailures() {
		ReconciliationRunException failure = new ReconciliationRunException("PDF extraction failed: broken");
		when(workflowService.run(any(), any())).thenThrow(failure);

		assertThatThrownBy(() -> runner.run(new DefaultApplicationArguments("sheet.pdf", "trades.csv")))
				.isSameAs(failure);
	}

	@Test
	void wrapsUnexpectedFailures() {
		when(workflowService.run(any(), any())).thenThrow(new UncheckedIOException("disk full", new IOException("disk full")));

		assertThatThrownBy(() -> runner.run(new DefaultApplicationArguments("sheet.pdf", "trades.csv")))
				.isInstanceOf(ReconciliationRunException.class)
				.hasRootCauseMessage("disk full");
		assertThat(ReconciliationRunner.USAGE).contains("<term-sheet.pdf>");
	}
}
