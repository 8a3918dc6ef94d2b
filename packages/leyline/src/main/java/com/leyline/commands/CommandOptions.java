package com.leyline.commands;

import com.leyline.StartupParameters;

/** Presentation switches shared by the discovery commands. None of them changes query results. */
public record CommandOptions(boolean stats, boolean verbose, boolean json, int limit) {

  public static final int DEFAULT_LIMIT = 10;

  public CommandOptions {
    if (limit <= 0) {
      throw new IllegalArgumentException("limit must be positive, got " + limit);
    }
  }

  public static CommandOptions defaults() {
    return new CommandOptions(false, false, false, DEFAULT_LIMIT);
  }

  public static CommandOptions from(StartupParameters params) {
    return new CommandOptions(
        params.isFlagSet("stats"),
        params.isFlagSet("verbose"),
        params.isFlagSet("json"),
        params.limit());
  }
}
