package com.mk.fx.qa.login.load.report;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/** Writes {@code summary.json} next to the results file. */
public class RunSummaryWriter {

  static final String FILE_NAME = "summary.json";

  private final ObjectMapper objectMapper;

  public RunSummaryWriter(ObjectMapper objectMapper) {
    this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
  }

  public Path write(Path outputDir, RunSummary summary) throws IOException {
    Files.createDirectories(outputDir);
    var file = outputDir.resolve(FILE_NAME);
    objectMapper.writeValue(file.toFile(), summary);
    return file;
  }
}
