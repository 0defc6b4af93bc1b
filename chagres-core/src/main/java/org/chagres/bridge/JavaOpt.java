package org.chagres.bridge;

import java.util.Objects;

/**
 * A runtime option in JVM command-line syntax.
 *
 * <p>Only {@code -Dkey=value} has a meaning for an in-process runtime: it is applied as a system
 * property when the runtime is built. Other options are kept for inspection.
 */
public record JavaOpt(String value) {

  public JavaOpt {
    Objects.requireNonNull(value, "value");
  }

  public boolean isSystemProperty() {
    return value.startsWith("-D") && value.length() > 2 && value.charAt(2) != '=';
  }

  /** Property name of a {@code -Dkey=value} option. */
  public String propertyKey() {
    int eq = value.indexOf('=');
    return eq < 0 ? value.substring(2) : value.substring(2, eq);
  }

  /** Property value of a {@code -Dkey=value} option; {@code -Dkey} alone yields "". */
  public String propertyValue() {
    int eq = value.indexOf('=');
    return eq < 0 ? "" : value.substring(eq + 1);
  }
}
