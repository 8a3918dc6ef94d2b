package com.leyline.discovery.cache;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;

/** Cheap change marker for a file: modification time and size, read without opening the file. */
record FileMarker(long lastModifiedMillis, long size) {

  /** @return the marker, or {@code null} when the file cannot be stat-ed */
  static FileMarker read(Path path) {
    try {
      BasicFileAttributes attrs = Files.readAttributes(path, BasicFileAttributes.class);
      return new FileMarker(attrs.lastModifiedTime().toMillis(), attrs.size());
    } catch (IOException e) {
      return null;
    }
  }
}
