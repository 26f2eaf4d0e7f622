package com.mk.fx.qa.login.load.report;

import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/** Reads a {@code results.csv} written by {@link ResultsCsvWriter} back into rows. */
public class ResultsCsvReader {

  private final CsvMapper csvMapper;

  public ResultsCsvReader(CsvMapper csvMapper) {
    this.csvMapper = Objects.requireNonNull(csvMapper, "csvMapper");
  }

  public List<ResultRow> read(Path file) throws IOException {
    try (var in = Files.newBufferedReader(file, StandardCharsets.UTF_8);
        var rows =
            csvMapper
                .readerFor(ResultRow.class)
                .with(ResultsCsv.schema())
                .with(CsvParser.Feature.EMPTY_STRING_AS_NULL)
                .<ResultRow>readValues(in)) {
      return rows.readAll();
    }
  }
}
