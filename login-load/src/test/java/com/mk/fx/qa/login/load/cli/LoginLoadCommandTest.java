package com.mk.fx.qa.login.load.cli;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.mk.fx.qa.login.load.cancel.CancellationController;
import com.mk.fx.qa.login.load.cfg.LoginLoadCfg;
import com.mk.fx.qa.login.load.executors.LoginExecutionException;
import com.mk.fx.qa.login.load.metrics.LoginStatisticsCalculator;
import com.mk.fx.qa.login.load.model.RunConfiguration;
import com.mk.fx.qa.login.load.service.LoginLoadService;
import com.mk.fx.qa.login.load.service.LoginRunOutcome;
import com.mk.fx.qa.login.load.session.Credential;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import picocli.CommandLine;

class LoginLoadCommandTest {

  private final LoginLoadService service = mock(LoginLoadService.class);
  private final StringWriter err = new StringWriter();

  private static LoginRunOutcome outcome(boolean aborted) {
    return new LoginRunOutcome(
        "run1",
        List.of(),
        new LoginStatisticsCalculator().calculate(List.of()),
        aborted,
        Optional.empty());
  }

  private int execute(LoginLoadCfg cfg, String... args) {
    var command = new LoginLoadCommand(cfg, service, status -> {});
    var commandLine = new CommandLine(command);
    commandLine.setErr(new PrintWriter(err, true));
    return commandLine.execute(args);
  }

  @Test
  void optionsOverrideConfiguredDefaults() throws Exception {
    when(service.run(any(), any())).thenReturn(outcome(false));
    var cfg = new LoginLoadCfg();
    cfg.setStartUrl("https://configured.example.com/");
    cfg.setUsers(List.of("configured:pw"));

    int exit =
        execute(
            cfg,
            "-s", "https://app.example.com/",
            "-l", "3",
            "-c", "1",
            "-u", "alice:pa:ss",
            "--user", "bob:pw",
            "-o", "out",
            "--ss",
            "--seed", "9",
            "--navigation-timeout", "1500ms");

    assertEquals(LoginLoadCommand.EXIT_OK, exit);
    var captor = ArgumentCaptor.forClass(RunConfiguration.class);
    verify(service).run(captor.capture(), any(CancellationController.class));
    var configuration = captor.getValue();
    assertEquals("https://app.example.com/", configuration.startUrl());
    assertEquals(3, configuration.logins());
    assertEquals(1, configuration.concurrency());
    assertEquals(
        List.of(new Credential("alice", "pa:ss"), new Credential("bob", "pw")),
        configuration.credentials());
    assertEquals(Path.of("out"), configuration.outputPath());
    assertTrue(configuration.captureArtifacts());
    assertEquals(9L, configuration.seed());
    assertEquals(Duration.ofMillis(1500), configuration.navigationTimeout());
  }

  @Test
  void configuredDefaultsApply_whenOptionsAreOmitted() throws Exception {
    when(service.run(any(), any())).thenReturn(outcome(false));
    var cfg = new LoginLoadCfg();
    cfg.setStartUrl("https://configured.example.com/");
    cfg.setUsers(List.of("configured:pw"));

    assertEquals(LoginLoadCommand.EXIT_OK, execute(cfg));

    var captor = ArgumentCaptor.forClass(RunConfiguration.class);
    verify(service).run(captor.capture(), any());
    var configuration = captor.getValue();
    assertEquals(40, configuration.logins());
    assertEquals(2, configuration.concurrency());
    assertNull(configuration.outputPath());
    assertFalse(configuration.captureArtifacts());
    assertEquals(Duration.ofSeconds(60), configuration.navigationTimeout());
  }

  @Test
  void noUsers_isInvalidConfiguration() throws Exception {
    int exit = execute(new LoginLoadCfg(), "-s", "https://app.example.com/");

    assertEquals(LoginLoadCommand.EXIT_INVALID_CONFIGURATION, exit);
    assertTrue(err.toString().contains("Must specify at least 1 user"));
    verify(service, never()).run(any(), any());
  }

  @Test
  void zeroConcurrency_isInvalidConfiguration() throws Exception {
    int exit = execute(new LoginLoadCfg(), "-s", "https://app.example.com/", "-u", "a:b", "-c", "0");

    assertEquals(LoginLoadCommand.EXIT_INVALID_CONFIGURATION, exit);
    verify(service, never()).run(any(), any());
  }

  @Test
  void malformedCredential_isInvalidConfiguration() {
    int exit = execute(new LoginLoadCfg(), "-s", "https://app.example.com/", "-u", "nocolon");

    assertEquals(LoginLoadCommand.EXIT_INVALID_CONFIGURATION, exit);
  }

  @Test
  void unparsableOption_isUsageError() {
    int exit = execute(new LoginLoadCfg(), "-l", "many");

    assertEquals(CommandLine.ExitCode.USAGE, exit);
  }

  @Test
  void abortedRun_exitsWithAbortCode() throws Exception {
    when(service.run(any(), any())).thenReturn(outcome(true));

    int exit = execute(new LoginLoadCfg(), "-s", "https://app.example.com/", "-u", "a:b");

    assertEquals(CancellationController.ABORT_EXIT_CODE, exit);
  }

  @Test
  void orchestrationFailure_exitsWithExecutionErrorCode() throws Exception {
    when(service.run(any(), any()))
        .thenThrow(new LoginExecutionException("worker died", new IllegalStateException()));

    int exit = execute(new LoginLoadCfg(), "-s", "https://app.example.com/", "-u", "a:b");

    assertEquals(LoginLoadCommand.EXIT_EXECUTION_ERROR, exit);
    assertTrue(err.toString().contains("worker died"));
  }
}
