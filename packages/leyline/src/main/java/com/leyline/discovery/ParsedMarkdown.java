package com.leyline.discovery;

import java.util.Map;
import java.util.Optional;

/**
 * Result of splitting a markdown file into its front-matter and body.
 *
 * @param frontMatter parsed key/value pairs, empty when absent or unparseable
 * @param body everything after the closing front-matter marker
 * @param present whether the file opened a front-matter block at all
 * @param error description of why the block could not be used, if any
 */
public record ParsedMarkdown(
    Map<String, String> frontMatter, String body, boolean present, String error) {

  public ParsedMarkdown {
    frontMatter = frontMatter == null ? Map.of() : Map.copyOf(frontMatter);
    body = body == null ? "" : body;
  }

  public Optional<String> errorMessage() {
    return Optional.ofNullable(error);
  }

  public boolean hasError() {
    return error != null;
  }
}
