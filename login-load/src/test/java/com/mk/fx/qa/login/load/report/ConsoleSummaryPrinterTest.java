package com.mk.fx.qa.login.load.report;

import static org.junit.jupiter.api.Assertions.*;

import com.mk.fx.qa.login.load.metrics.LoginStatistics;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import org.junit.jupiter.api.Test;
import picocli.CommandLine.Help.Ansi;

class ConsoleSummaryPrinterTest {

  private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
  private final ConsoleSummaryPrinter printer =
      new ConsoleSummaryPrinter(new PrintStream(buffer, true, StandardCharsets.UTF_8), Ansi.OFF);

  private String output() {
    return buffer.toString(StandardCharsets.UTF_8);
  }

  @Test
  void printsCountsRateAndDurations() {
    printer.print(new LoginStatistics(5, 4, 1, 0, 80.0, 0.8, 1.25, 1.0, Map.of("WRONG_PAGE", 1L)));

    var out = output();
    assertTrue(out.contains("Total number of logins: 5"));
    assertTrue(out.contains("Successful logins: 4"));
    assertTrue(out.contains("Failed logins: 1"));
    assertTrue(out.contains("Success rate: 80.00%"));
    assertTrue(out.contains("Average duration: 1.000s"));
    assertTrue(out.contains("Minimum duration: 0.800s"));
    assertTrue(out.contains("Maximum duration: 1.250s"));
    assertFalse(out.contains("Not run"));
  }

  @Test
  void noSuccesses_rendersNotAvailable() {
    printer.print(new LoginStatistics(2, 0, 2, 0, 0.0, null, null, null, Map.of()));

    var out = output();
    assertTrue(out.contains("Success rate: 0.00%"));
    assertTrue(out.contains("Average duration: n/a"));
    assertTrue(out.contains("Minimum duration: n/a"));
    assertTrue(out.contains("Maximum duration: n/a"));
    assertFalse(out.contains("NaN"));
  }

  @Test
  void abortedRun_showsNotRunCount() {
    printer.print(new LoginStatistics(5, 2, 3, 3, 40.0, 1.0, 1.0, 1.0, Map.of("NOT_RUN", 3L)));

    assertTrue(output().contains("Not run: 3"));
  }
}
