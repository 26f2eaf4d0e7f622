package com.mk.fx.qa.login.load.report;

import com.fasterxml.jackson.dataformat.csv.CsvGenerator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.mk.fx.qa.login.load.model.LoginResult;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import lombok.extern.slf4j.Slf4j;

/**
 * Writes {@code results.csv}: a header row followed by one row per login in index order. Start and
 * finish times are rendered as local date-times; only fields containing the delimiter, a quote or
 * a line break are quoted.
 */
@Slf4j
public class ResultsCsvWriter {

  private final CsvMapper csvMapper;
  private final DateTimeFormatter timestamps;

  public ResultsCsvWriter(CsvMapper csvMapper, ZoneId zone) {
    this.csvMapper = Objects.requireNonNull(csvMapper, "csvMapper");
    this.timestamps = ResultsCsv.timestamps(Objects.requireNonNull(zone, "zone"));
  }

  /**
   * Writes the results into {@code outputDir/results.csv}, creating the directory if needed.
   *
   * @return path of the written file
   * @throws IOException if the directory or file cannot be written
   */
  public Path write(Path outputDir, List<LoginResult> results) throws IOException {
    Objects.requireNonNull(outputDir, "outputDir");
    Objects.requireNonNull(results, "results");
    Files.createDirectories(outputDir);
    var file = outputDir.resolve(ResultsCsv.FILE_NAME);

    var rows =
        results.stream()
            .sorted(Comparator.comparingInt(LoginResult::index))
            .map(result -> ResultRow.from(result, timestamps))
            .toList();
    try (var out = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
        var writer =
            csvMapper
                .writerFor(ResultRow.class)
                .with(ResultsCsv.schema())
                .with(CsvGenerator.Feature.STRICT_CHECK_FOR_QUOTING)
                .writeValues(out)) {
      writer.writeAll(rows);
    }
    log.debug("Wrote {} result rows to {}", rows.size(), file);
    return file;
  }
}
