package com.mk.fx.qa.login.load.cli;

import com.mk.fx.qa.login.load.utils.LoadUtils;
import java.time.Duration;
import picocli.CommandLine.ITypeConverter;
import picocli.CommandLine.TypeConversionException;

/** Accepts {@code 500ms}, {@code 30s}, {@code 2m}, {@code 1h} or ISO-8601 such as {@code PT30S}. */
public class DurationConverter implements ITypeConverter<Duration> {

  @Override
  public Duration convert(String value) {
    try {
      if (value.trim().toUpperCase().startsWith("P")) {
        return Duration.parse(value.trim());
      }
      return LoadUtils.parseDuration(value);
    } catch (RuntimeException e) {
      throw new TypeConversionException("Invalid duration '" + value + "'");
    }
  }
}
