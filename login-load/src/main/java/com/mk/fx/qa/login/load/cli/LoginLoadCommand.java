package com.mk.fx.qa.login.load.cli;

import com.mk.fx.qa.login.load.cancel.CancellationController;
import com.mk.fx.qa.login.load.cancel.ProcessTerminator;
import com.mk.fx.qa.login.load.cfg.LoginLoadCfg;
import com.mk.fx.qa.login.load.executors.LoginExecutionException;
import com.mk.fx.qa.login.load.model.RunConfiguration;
import com.mk.fx.qa.login.load.service.LoginLoadService;
import com.mk.fx.qa.login.load.session.Credential;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.Callable;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Help.Ansi;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

/**
 * CLI command: login-load -s &lt;url&gt; -u user:pass [-u ...] [options]
 *
 * <p>Options left out fall back to the {@code login.load.*} configuration properties.
 */
@Slf4j
@Component
@Command(
    name = "login-load",
    mixinStandardHelpOptions = true,
    version = "login-load 1.0.0",
    description = "Runs repeated concurrent logins against a start page and reports timings")
public class LoginLoadCommand implements Callable<Integer> {

  public static final int EXIT_OK = 0;
  public static final int EXIT_EXECUTION_ERROR = 1;
  public static final int EXIT_INVALID_CONFIGURATION = 2;

  @Spec private CommandSpec spec;

  @Option(
      names = {"-s", "--start-url"},
      description = "Start page of the application to log in to")
  private String startUrl;

  @Option(
      names = {"-l", "--logins"},
      description = "Number of logins to perform (default: 40)")
  private Integer logins;

  @Option(
      names = {"-c", "--concurrency"},
      description = "Maximum number of logins in flight (default: 2)")
  private Integer concurrency;

  @Option(
      names = {"-u", "--user"},
      description = "Credential as username:password, repeat for a pool")
  private List<String> users;

  @Option(
      names = {"-o", "--output"},
      description = "Directory for results.csv, summary.json and page artifacts")
  private Path output;

  @Option(
      names = {"--ss", "--screenshot"},
      description = "Capture the pages seen by every login into the output directory")
  private boolean screenshot;

  @Option(names = "--seed", description = "Seed for credential selection")
  private Long seed;

  @Option(
      names = "--navigation-timeout",
      converter = DurationConverter.class,
      description = "Timeout for each page navigation, e.g. 60s")
  private Duration navigationTimeout;

  @Option(
      names = "--abort-grace",
      converter = DurationConverter.class,
      description = "Time running logins get after Ctrl+C before the process exits, e.g. 5s")
  private Duration abortGrace;

  private final LoginLoadCfg cfg;
  private final LoginLoadService service;
  private final ProcessTerminator terminator;

  public LoginLoadCommand(LoginLoadCfg cfg, LoginLoadService service, ProcessTerminator terminator) {
    this.cfg = cfg;
    this.service = service;
    this.terminator = terminator;
  }

  @Override
  public Integer call() {
    RunConfiguration configuration;
    CancellationController cancellation;
    try {
      configuration = toRunConfiguration();
      cancellation =
          new CancellationController(
              abortGrace != null ? abortGrace : cfg.getAbortGracePeriod(), terminator);
    } catch (IllegalArgumentException e) {
      return invalidConfiguration(e);
    }

    var hook = cancellation.installShutdownHook();
    try {
      var outcome = service.run(configuration, cancellation);
      return outcome.aborted() ? CancellationController.ABORT_EXIT_CODE : EXIT_OK;
    } catch (IllegalArgumentException e) {
      return invalidConfiguration(e);
    } catch (LoginExecutionException e) {
      log.error("Login run failed", e);
      error("Login run failed: " + e.getMessage());
      return EXIT_EXECUTION_ERROR;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      log.warn("Interrupted while waiting for logins to finish");
      return CancellationController.ABORT_EXIT_CODE;
    } finally {
      removeShutdownHook(hook);
    }
  }

  RunConfiguration toRunConfiguration() {
    var userSpecs = users != null && !users.isEmpty() ? users : cfg.getUsers();
    List<Credential> credentials = userSpecs.stream().map(Credential::parse).toList();
    var outputPath = output != null ? output : toPath(cfg.getOutput());
    return new RunConfiguration(
        startUrl != null ? startUrl : cfg.getStartUrl(),
        logins != null ? logins : cfg.getLogins(),
        concurrency != null ? concurrency : cfg.getConcurrency(),
        credentials,
        outputPath,
        screenshot || cfg.isScreenshot(),
        navigationTimeout != null ? navigationTimeout : cfg.getNavigationTimeout(),
        seed != null ? seed : cfg.getSeed());
  }

  private int invalidConfiguration(IllegalArgumentException e) {
    log.error("Invalid configuration: {}", e.getMessage());
    error(e.getMessage());
    return EXIT_INVALID_CONFIGURATION;
  }

  private void error(String message) {
    spec.commandLine().getErr().println(Ansi.AUTO.string("@|fg(red) " + message + "|@"));
  }

  private static Path toPath(String value) {
    return value == null || value.isBlank() ? null : Path.of(value);
  }

  private static void removeShutdownHook(Thread hook) {
    try {
      Runtime.getRuntime().removeShutdownHook(hook);
    } catch (IllegalStateException shuttingDown) {
      log.debug("JVM already shutting down, abort hook stays registered");
    }
  }
}
