package com.leyline.discovery;

import com.leyline.exception.ScanException;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Finds tenets and bindings below a corpus root: {@code docs/tenets}, {@code docs/bindings/core}
 * and {@code docs/bindings/categories}, recursively. Index and overview pages are skipped.
 */
public class CorpusPathDiscovery implements DocumentPathDiscovery {
  private static final org.slf4j.Logger log =
      com.leyline.logging.LoggingService.getLogger(CorpusPathDiscovery.class);

  static final List<String> SEARCH_PATHS =
      List.of("docs/tenets", "docs/bindings/core", "docs/bindings/categories");
  static final Set<String> EXCLUDED_FILES = Set.of("index.md", "glance.md", "00-index.md");

  private final Path root;

  public CorpusPathDiscovery(Path root) {
    this.root = root.toAbsolutePath().normalize();
  }

  public Path root() {
    return root;
  }

  @Override
  public List<Path> discover() {
    if (!Files.isDirectory(root)) {
      throw new ScanException("Corpus root is not a readable directory", root, null);
    }
    List<Path> out = new ArrayList<>();
    for (String relative : SEARCH_PATHS) {
      Path dir = root.resolve(relative);
      if (!Files.isDirectory(dir)) {
        log.debug("Skipping missing corpus directory {}", dir);
        continue;
      }
      try (Stream<Path> walk = Files.walk(dir)) {
        out.addAll(
            walk.filter(Files::isRegularFile)
                .filter(p -> p.getFileName().toString().endsWith(".md"))
                .filter(p -> !EXCLUDED_FILES.contains(p.getFileName().toString()))
                .map(p -> p.toAbsolutePath().normalize())
                .sorted()
                .collect(Collectors.toList()));
      } catch (IOException | UncheckedIOException e) {
        throw new ScanException("Failed to list corpus directory", dir, e);
      }
    }
    return out;
  }
}
