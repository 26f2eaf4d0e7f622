package com.mk.fx.qa.login.load.report;

import com.mk.fx.qa.login.load.model.LoginResult;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;

/**
 * Persists the results of a drained run and prints the console summary. A failure to persist is
 * logged and never prevents the summary from being printed.
 */
@Slf4j
public class LoginReportPublisher {

  private final ResultsCsvWriter csvWriter;
  private final RunSummaryWriter summaryWriter;
  private final ConsoleSummaryPrinter printer;

  public LoginReportPublisher(
      ResultsCsvWriter csvWriter, RunSummaryWriter summaryWriter, ConsoleSummaryPrinter printer) {
    this.csvWriter = Objects.requireNonNull(csvWriter, "csvWriter");
    this.summaryWriter = Objects.requireNonNull(summaryWriter, "summaryWriter");
    this.printer = Objects.requireNonNull(printer, "printer");
  }

  /**
   * @param outputDir destination directory, or {@code null} to only print the summary
   * @return the written results file, empty when nothing was persisted
   */
  public Optional<Path> publish(RunSummary summary, List<LoginResult> results, Path outputDir) {
    Path resultsFile = null;
    if (outputDir != null) {
      try {
        resultsFile = csvWriter.write(outputDir, results);
        summaryWriter.write(outputDir, summary);
      } catch (IOException | RuntimeException e) {
        log.error("Run {} error saving results to {} - {}", summary.runId(), outputDir, e.toString());
      }
    }

    printer.print(summary.statistics());
    if (resultsFile != null) {
      printer.line("Results saved to " + resultsFile.toAbsolutePath());
    }
    return Optional.ofNullable(resultsFile);
  }
}
