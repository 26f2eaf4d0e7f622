package com.mk.fx.qa.login.load.cfg;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/**
 * Defaults for a login load run, bound from {@code login.load.*}. Command line options take
 * precedence over these values.
 *
 * <pre>{@code
 * login:
 *   load:
 *     start-url: https://app.example.com/
 *     logins: 40
 *     concurrency: 2
 *     users:
 *       - alice:secret
 *     output: build/login-load
 *     screenshot: false
 *     navigation-timeout: 60s
 *     abort-grace-period: 5s
 * }</pre>
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "login.load")
public class LoginLoadCfg {

  /** Relying party start page. */
  private String startUrl;

  @Min(1)
  private int logins = 40;

  @Min(1)
  private int concurrency = 2;

  /** Credential pool entries, each {@code username:password}. */
  private List<String> users = new ArrayList<>();

  /** Directory for results and page artifacts; nothing is written when unset. */
  private String output;

  private boolean screenshot;

  @NotNull private Duration navigationTimeout = Duration.ofSeconds(60);

  @NotNull private Duration abortGracePeriod = Duration.ofSeconds(5);

  /** Fixed seed for credential selection. */
  private Long seed;
}
