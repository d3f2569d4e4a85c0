package io.treepath.parser;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parser configuration.
 *
 * <p>{@link #defaults()} resolves each setting in order from a system property, an environment
 * variable, then the built-in default:
 *
 * <ul>
 *   <li>{@code treepath.parser.mode} / {@code TREEPATH_PARSER_MODE}, default {@code FAST}
 *   <li>{@code treepath.parser.maxErrors} / {@code TREEPATH_PARSER_MAX_ERRORS}, default 10
 * </ul>
 *
 * @param mode recovery behaviour
 * @param maxErrors error budget for {@link ParserMode#STANDARD} and {@link ParserMode#VALIDATE}
 */
public record ParserOptions(ParserMode mode, int maxErrors) {

  private static final Logger log = LoggerFactory.getLogger(ParserOptions.class);

  public static final String MODE_PROPERTY = "treepath.parser.mode";
  public static final String MODE_ENV = "TREEPATH_PARSER_MODE";
  public static final String MAX_ERRORS_PROPERTY = "treepath.parser.maxErrors";
  public static final String MAX_ERRORS_ENV = "TREEPATH_PARSER_MAX_ERRORS";

  public static final int DEFAULT_MAX_ERRORS = 10;

  public ParserOptions {
    if (mode == null) {
      mode = ParserMode.FAST;
    }
    if (maxErrors < 1) {
      throw new IllegalArgumentException("maxErrors must be positive: " + maxErrors);
    }
  }

  /** Options for {@code mode} with the default error budget. */
  public static ParserOptions of(ParserMode mode) {
    return new ParserOptions(mode, DEFAULT_MAX_ERRORS);
  }

  /** Options resolved from system properties, environment and built-in defaults. */
  public static ParserOptions defaults() {
    ParserMode mode = ParserMode.FAST;
    String modeValue = lookup(MODE_PROPERTY, MODE_ENV);
    if (modeValue != null) {
      try {
        mode = ParserMode.fromName(modeValue);
      } catch (IllegalArgumentException e) {
        log.warn("Ignoring unknown parser mode '{}', using {}", modeValue, mode);
      }
    }
    int maxErrors = DEFAULT_MAX_ERRORS;
    String maxValue = lookup(MAX_ERRORS_PROPERTY, MAX_ERRORS_ENV);
    if (maxValue != null) {
      try {
        maxErrors = Math.max(1, Integer.parseInt(maxValue.trim()));
      } catch (NumberFormatException e) {
        log.warn("Ignoring invalid parser error limit '{}', using {}", maxValue, maxErrors);
      }
    }
    return new ParserOptions(mode, maxErrors);
  }

  public ParserOptions withMode(ParserMode value) {
    return new ParserOptions(value, maxErrors);
  }

  public ParserOptions withMaxErrors(int value) {
    return new ParserOptions(mode, value);
  }

  static String lookup(String property, String env) {
    String sysProp = System.getProperty(property);
    if (sysProp != null && !sysProp.isBlank()) {
      return sysProp;
    }
    String envVar = System.getenv(env);
    if (envVar != null && !envVar.isBlank()) {
      return envVar;
    }
    return null;
  }
}
