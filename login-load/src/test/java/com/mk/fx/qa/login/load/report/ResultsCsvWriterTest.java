package com.mk.fx.qa.login.load.report;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.mk.fx.qa.login.load.model.LoginResult;
import com.mk.fx.qa.login.load.model.LoginTaskContext;
import com.mk.fx.qa.login.load.model.TaskState;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ResultsCsvWriterTest {

  private static final Instant T0 = Instant.parse("2024-03-05T10:15:30Z");

  private final CsvMapper csvMapper = new CsvMapper();
  private final ResultsCsvWriter writer = new ResultsCsvWriter(csvMapper, ZoneOffset.UTC);
  private final ResultsCsvReader reader = new ResultsCsvReader(csvMapper);

  @TempDir Path tempDir;

  private static List<LoginResult> sampleResults() {
    return List.of(
        new LoginResult(2, TaskState.NOT_RUN, null, null, LoginTaskContext.NOT_RUN_REASON, "NOT_RUN"),
        new LoginResult(0, TaskState.SUCCEEDED, T0, T0.plusMillis(1500), null, null),
        new LoginResult(
            1,
            TaskState.FAILED,
            T0.plusSeconds(2),
            null,
            "Ended on wrong page - https://idp.example.com/denied?a=1,b=2",
            "WRONG_PAGE"));
  }

  @Test
  void writesHeaderAndOneRowPerResultInIndexOrder() throws Exception {
    var file = writer.write(tempDir.resolve("run"), sampleResults());

    assertEquals(tempDir.resolve("run").resolve("results.csv"), file);
    var lines = Files.readAllLines(file);
    assertEquals(4, lines.size());
    assertEquals("Iteration,Start time,Finish Time,Duration,Failure reason", lines.get(0));
    assertEquals("0,5 Mar 2024 10:15:30,5 Mar 2024 10:15:31,1.5,", lines.get(1));
    assertEquals(
        "1,5 Mar 2024 10:15:32,,,"
            + "\"Ended on wrong page - https://idp.example.com/denied?a=1,b=2\"",
        lines.get(2));
    assertEquals("2,,,,Not run (aborted before dispatch)", lines.get(3));
  }

  @Test
  void readsBackWhatWasWritten() throws Exception {
    var file = writer.write(tempDir, sampleResults());

    var rows = reader.read(file);

    assertEquals(3, rows.size());
    var success = rows.get(0);
    assertEquals(0, success.iteration());
    assertEquals("5 Mar 2024 10:15:30", success.startTime());
    assertEquals("5 Mar 2024 10:15:31", success.finishTime());
    assertEquals(1.5, success.duration());
    assertNull(success.failureReason());

    var failed = rows.get(1);
    assertEquals("5 Mar 2024 10:15:32", failed.startTime());
    assertNull(failed.finishTime());
    assertNull(failed.duration());
    assertEquals(
        "Ended on wrong page - https://idp.example.com/denied?a=1,b=2", failed.failureReason());

    var notRun = rows.get(2);
    assertNull(notRun.startTime());
    assertNull(notRun.duration());
    assertEquals(LoginTaskContext.NOT_RUN_REASON, notRun.failureReason());
  }

  @Test
  void emptyResults_stillWriteHeader() throws Exception {
    var file = writer.write(tempDir, List.of());

    var lines = Files.readAllLines(file);
    assertEquals(1, lines.size());
    assertTrue(reader.read(file).isEmpty());
  }
}
