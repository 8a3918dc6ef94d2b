package com.leyline.discovery;

import java.nio.file.Path;
import java.util.List;

/** Lists the markdown files that make up the corpus. Must not read file contents. */
@FunctionalInterface
public interface DocumentPathDiscovery {
  List<Path> discover();
}
