package com.leyline;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Command line arguments: {@code <command> [argument...] [--name value] [--flag]}.
 *
 * <p>Known flags ({@code --stats}, {@code --verbose}, {@code --json}, {@code --compress}) take no
 * value. Every other {@code --name} consumes the following token as its value.
 */
public class StartupParameters {

  static final Set<String> COMMANDS = Set.of("categories", "show", "search", "help");
  static final Set<String> FLAGS = Set.of("stats", "verbose", "json", "compress");

  final Map<String, Object> parameters = new HashMap<>();
  private final List<String> positional = new ArrayList<>();

  {
    parameters.put("config-file", "classpath:application.yaml");
    parameters.put("limit", "10");
  }

  public StartupParameters(String[] arguments) {
    parseArguments(arguments);
    this.validate();
  }

  private void parseArguments(String[] arguments) {
    for (int p = 0; p < arguments.length; p++) {
      String arg = arguments[p];
      if (!arg.startsWith("--")) {
        positional.add(arg);
        continue;
      }

      String paramName = arg.substring(2);
      if (FLAGS.contains(paramName)) {
        parameters.put(paramName, Boolean.TRUE);
        continue;
      }

      String paramValue = null;
      if (p < arguments.length - 1) {
        paramValue = arguments[p + 1];
        p++;
      }
      parameters.put(paramName, paramValue);
    }
  }

  private void validate() {
    String command = command();
    if (!COMMANDS.contains(command)) {
      throw new IllegalArgumentException("Unknown command: " + command);
    }

    if (parameters.get("config-file") == null
        || parameters.get("config-file").toString().isBlank()) {
      throw new IllegalArgumentException("Missing config file location");
    }

    String limit = String.valueOf(parameters.get("limit"));
    try {
      if (Integer.parseInt(limit) <= 0) {
        throw new IllegalArgumentException("--limit must be positive, got " + limit);
      }
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("--limit must be a number, got " + limit, e);
    }
  }

  /** First positional argument, {@code help} when none was given. */
  public String command() {
    return positional.isEmpty() ? "help" : positional.get(0);
  }

  /** Positional arguments after the command, joined with single spaces. */
  public Optional<String> argument() {
    if (positional.size() < 2) return Optional.empty();
    return Optional.of(String.join(" ", positional.subList(1, positional.size())));
  }

  /**
   * Configuration location, e.g. "classpath:application.yaml", "/etc/leyline.yaml" or
   * "config/local.yaml".
   */
  public String configFile() {
    return getOptionalParameter("config-file", String.class).orElse("classpath:application.yaml");
  }

  public Optional<String> corpusRoot() {
    return getOptionalParameter("corpus", String.class);
  }

  public int limit() {
    return Integer.parseInt(String.valueOf(parameters.get("limit")));
  }

  public boolean isFlagSet(String name) {
    return Boolean.TRUE.equals(parameters.get(name));
  }

  public <T> Optional<T> getOptionalParameter(String name, Class<T> type) {
    return Optional.ofNullable(type.cast(parameters.get(name)));
  }
}
