package com.mk.fx.qa.login.load.model;

import com.mk.fx.qa.login.load.session.Credential;
import java.net.URI;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Fully resolved settings of one login load run. Construction validates everything that would
 * otherwise make the run fail after dispatch started.
 *
 * @param startUrl relying party start page
 * @param logins total number of login attempts
 * @param concurrency maximum number of attempts in flight
 * @param credentials non-empty credential pool
 * @param outputPath directory for results and artifacts, or {@code null}
 * @param captureArtifacts whether page snapshots are stored per iteration
 * @param navigationTimeout limit for each page navigation of a login
 * @param seed seed for credential selection, or {@code null} for a random seed
 */
public record RunConfiguration(
    String startUrl,
    int logins,
    int concurrency,
    List<Credential> credentials,
    Path outputPath,
    boolean captureArtifacts,
    Duration navigationTimeout,
    Long seed) {

  public RunConfiguration {
    if (startUrl == null || startUrl.isBlank()) {
      throw new IllegalArgumentException("Start URL must be provided");
    }
    var uri = URI.create(startUrl.trim());
    if (uri.getScheme() == null || uri.getHost() == null) {
      throw new IllegalArgumentException("Start URL must be absolute: " + startUrl);
    }
    if (logins < 1) {
      throw new IllegalArgumentException("Number of logins must be at least 1");
    }
    if (concurrency < 1) {
      throw new IllegalArgumentException("Concurrency must be at least 1");
    }
    Objects.requireNonNull(credentials, "credentials");
    if (credentials.isEmpty()) {
      throw new IllegalArgumentException("Must specify at least 1 user");
    }
    credentials = List.copyOf(credentials);
    Objects.requireNonNull(navigationTimeout, "navigationTimeout");
    if (navigationTimeout.isZero() || navigationTimeout.isNegative()) {
      throw new IllegalArgumentException("Navigation timeout must be positive");
    }
  }

  public boolean hasOutput() {
    return outputPath != null;
  }
}
