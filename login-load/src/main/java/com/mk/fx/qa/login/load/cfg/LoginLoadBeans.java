package com.mk.fx.qa.login.load.cfg;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.mk.fx.qa.login.load.cancel.ProcessTerminator;
import com.mk.fx.qa.login.load.executors.BoundedLoginExecutor;
import com.mk.fx.qa.login.load.metrics.LoginStatisticsCalculator;
import com.mk.fx.qa.login.load.report.ConsoleSummaryPrinter;
import com.mk.fx.qa.login.load.report.LoginReportPublisher;
import com.mk.fx.qa.login.load.report.ResultsCsvWriter;
import com.mk.fx.qa.login.load.report.RunSummaryWriter;
import com.mk.fx.qa.login.load.service.LoginSessionDriverFactory;
import com.mk.fx.qa.login.load.session.HttpLoginSessionDriver;
import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import picocli.CommandLine.Help.Ansi;

/** Wires the run pipeline. */
@Configuration
public class LoginLoadBeans {

  @Bean
  public Clock clock() {
    return Clock.systemDefaultZone();
  }

  @Bean
  public LoginSessionDriverFactory loginSessionDriverFactory(Clock clock) {
    return navigationTimeout -> new HttpLoginSessionDriver(navigationTimeout, clock);
  }

  @Bean
  public BoundedLoginExecutor boundedLoginExecutor(Clock clock) {
    return new BoundedLoginExecutor(clock);
  }

  @Bean
  public LoginStatisticsCalculator loginStatisticsCalculator() {
    return new LoginStatisticsCalculator();
  }

  @Bean
  public ProcessTerminator processTerminator() {
    return ProcessTerminator.halting();
  }

  @Bean
  public ConsoleSummaryPrinter consoleSummaryPrinter() {
    return new ConsoleSummaryPrinter(System.out, Ansi.AUTO);
  }

  @Bean
  public LoginReportPublisher loginReportPublisher(
      CsvMapper csvMapper,
      ObjectMapper objectMapper,
      Clock clock,
      ConsoleSummaryPrinter consoleSummaryPrinter) {
    return new LoginReportPublisher(
        new ResultsCsvWriter(csvMapper, clock.getZone()),
        new RunSummaryWriter(objectMapper),
        consoleSummaryPrinter);
  }
}
