package com.clouddeploy.credentials;

import java.util.Map;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Name to value lookup standing in for the process environment, so resolution can be tested
 * without mutating real environment variables.
 */
@FunctionalInterface
public interface EnvironmentLookup {
  Pattern REFERENCE = Pattern.compile("\\$\\{([^}]+)}");

  /**
   * Returns the value of {@code name}, or null when it is not set.
   */
  String get(String name);

  /**
   * Returns the value of {@code name}, or {@code ""} when it is not set.
   */
  default String getOrEmpty(String name) {
    String value = get(name);
    return value == null ? "" : value;
  }

  /**
   * Replaces every {@code ${NAME}} reference in {@code value} with the looked-up value
   * (empty when unset).
   */
  default String expand(String value) {
    if (value == null || value.isEmpty()) {
      return value;
    }
    Matcher matcher = REFERENCE.matcher(value);
    StringBuilder expanded = new StringBuilder();
    while (matcher.find()) {
      matcher.appendReplacement(expanded, Matcher.quoteReplacement(getOrEmpty(matcher.group(1))));
    }
    matcher.appendTail(expanded);
    return expanded.toString();
  }

  static EnvironmentLookup system() {
    return System::getenv;
  }

  static EnvironmentLookup of(Map<String, String> values) {
    Map<String, String> copy = Map.copyOf(Objects.requireNonNull(values, "values"));
    return copy::get;
  }
}
