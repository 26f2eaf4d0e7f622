package com.mk.fx.qa.login.load.report;

import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/** Layout shared by the results writer and reader. */
final class ResultsCsv {

  static final String FILE_NAME = "results.csv";
  static final String TIMESTAMP_PATTERN = "d MMM yyyy HH:mm:ss";

  private ResultsCsv() {}

  static CsvSchema schema() {
    return CsvSchema.builder()
        .addNumberColumn(ResultRow.ITERATION)
        .addColumn(ResultRow.START_TIME)
        .addColumn(ResultRow.FINISH_TIME)
        .addNumberColumn(ResultRow.DURATION)
        .addColumn(ResultRow.FAILURE_REASON)
        .build()
        .withHeader();
  }

  static DateTimeFormatter timestamps(ZoneId zone) {
    return DateTimeFormatter.ofPattern(TIMESTAMP_PATTERN, Locale.ENGLISH).withZone(zone);
  }
}
