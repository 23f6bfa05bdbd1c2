package my.termsheetrecon.app.cli;

import my.termsheetrecon.app.report.ReconciliationReportWriter;
import my.termsheetrecon.app.service.ReconciliationRun;
import my.termsheetrecon.app.service.ReconciliationRunException;
import my.termsheetrecon.app.service.ReconciliationWorkflowService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.List;

@Component
public class ReconciliationRunner implements ApplicationRunner {
	private static final Logger logger = LoggerFactory.getLogger(ReconciliationRunner.class);
	static final String USAGE = "Usage: termsheet-recon <term-sheet.pdf> <bookings.csv|bookings.json>";

	private final ReconciliationWorkflowService workflowService;
	private final ReconciliationReportWriter reportWriter;

	public ReconciliationRunner(ReconciliationWorkflowService workflowService,
								ReconciliationReportWriter reportWriter) {
		this.workflowService = workflowService;
		this.reportWriter = reportWriter;
	}

	@Override
	public void run(ApplicationArguments args) {
		List<String> files = args == null ? List.of() : args.getNonOptionArgs();
		if (files.size() != 2) {
			logger.info(USAGE);
			return;
		}
		Path termSheet = Path.of(files.get(0));
		Path bookings = Path.of(files.get(1));
		ReconciliationRun run;
		try {
			run = workflowService.run(termSheet, bookings);
		} catch (ReconciliationRunException exc) {
			logger.error("Reconciliation failed: {}", exc.getMessage());
			throw exc;
		} catch (RuntimeException exc) {
			logger.error("Reconciliation failed: {}", exc.getMessage(), exc);
			throw new ReconciliationRunException("Reconciliation failed: " + exc.getMessage(), exc);
		}
		logger.info("\n{}", reportWriter.renderConsoleSummary(run.results()));
		logger.info("Reports: {} and {}", run.csvReport(), run.markdownReport());
	}
}
