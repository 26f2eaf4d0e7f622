package com.mk.fx.qa.login.load.report;

import com.mk.fx.qa.login.load.metrics.LoginStatistics;
import java.io.PrintStream;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import picocli.CommandLine.Help.Ansi;

/** Prints the end-of-run summary block to the console. */
public class ConsoleSummaryPrinter {

  static final String NOT_AVAILABLE = "n/a";

  private final PrintStream out;
  private final Ansi ansi;

  public ConsoleSummaryPrinter(PrintStream out, Ansi ansi) {
    this.out = Objects.requireNonNull(out, "out");
    this.ansi = Objects.requireNonNull(ansi, "ansi");
  }

  public void print(LoginStatistics statistics) {
    out.println();
    line("Total number of logins: " + statistics.iterationCount());
    line("Successful logins: " + statistics.successCount());
    line("Failed logins: " + statistics.errorCount());
    if (statistics.notRunCount() > 0) {
      line("Not run: " + statistics.notRunCount());
    }
    line(String.format(Locale.ROOT, "Success rate: %.2f%%", statistics.successRate()));
    line("Average duration: " + seconds(statistics.avgDurationSec()));
    line("Minimum duration: " + seconds(statistics.minDurationSec()));
    line("Maximum duration: " + seconds(statistics.maxDurationSec()));
  }

  public void line(String message) {
    out.println(ansi.string("@|fg(magenta) " + message + "|@"));
  }

  static String seconds(Optional<Double> value) {
    return value.map(v -> String.format(Locale.ROOT, "%.3fs", v)).orElse(NOT_AVAILABLE);
  }
}
