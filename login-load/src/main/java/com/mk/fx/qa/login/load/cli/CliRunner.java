package com.mk.fx.qa.login.load.cli;

import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.IFactory;

/** Bridges picocli with the Spring Boot lifecycle; the command's exit code becomes the JVM's. */
@Component
public class CliRunner implements CommandLineRunner, ExitCodeGenerator {

  private final LoginLoadCommand loginLoadCommand;
  private final IFactory factory;
  private int exitCode;

  public CliRunner(LoginLoadCommand loginLoadCommand, IFactory factory) {
    this.loginLoadCommand = loginLoadCommand;
    this.factory = factory;
  }

  @Override
  public void run(String... args) {
    exitCode = new CommandLine(loginLoadCommand, factory).execute(args);
  }

  @Override
  public int getExitCode() {
    return exitCode;
  }
}
