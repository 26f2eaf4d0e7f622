package com.mk.fx.qa.login.load.artifacts;

import com.mk.fx.qa.login.load.model.LoginTaskContext;
import com.mk.fx.qa.login.load.session.PageArtifactSink;
import com.mk.fx.qa.login.load.session.PageSnapshot;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import lombok.extern.slf4j.Slf4j;

/** Stores page snapshots of one login as {@code <output>/iteration-NNN/<step>.html}. */
@Slf4j
public final class IterationArtifactSink implements PageArtifactSink {

  static final String EXTENSION = ".html";

  private final Path directory;

  IterationArtifactSink(Path directory) {
    this.directory = directory;
  }

  /**
   * Returns the sink for a login. Capture is a no-op when it is disabled or the run has no output
   * directory.
   */
  public static PageArtifactSink forContext(LoginTaskContext context, boolean captureEnabled) {
    if (!captureEnabled) {
      return PageArtifactSink.NONE;
    }
    return context.outputDir().<PageArtifactSink>map(IterationArtifactSink::new)
        .orElse(PageArtifactSink.NONE);
  }

  @Override
  public void capture(String name, PageSnapshot page) throws IOException {
    Files.createDirectories(directory);
    var file = directory.resolve(name + EXTENSION);
    Files.writeString(file, page.html(), StandardCharsets.UTF_8);
    log.debug("Captured {} ({}) to {}", name, page.uri(), file);
  }
}
