package com.leyline.discovery;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable metadata for one markdown file of the corpus. {@code path} is the primary key of the
 * cache index.
 *
 * @param id front-matter {@code id}, or the file name without extension
 * @param title first heading, front-matter {@code title} or humanized file name
 * @param path absolute, normalized file path
 * @param category binding category, {@code core}, {@code tenets} or {@code unknown}
 * @param type tenet or binding, by directory placement
 * @param metadata front-matter scalars rendered as strings
 * @param contentPreview first ~200 characters of body text
 * @param contentHash SHA-256 hex digest of the raw file bytes
 * @param size file size in bytes
 * @param modifiedTime file modification time
 * @param scanTime when the scanner produced this record
 */
public record Document(
    String id,
    String title,
    String path,
    String category,
    DocumentType type,
    Map<String, String> metadata,
    String contentPreview,
    String contentHash,
    long size,
    Instant modifiedTime,
    Instant scanTime) {

  public Document {
    Objects.requireNonNull(path, "path");
    id = id == null ? "" : id;
    title = title == null ? "" : title;
    category = category == null ? "unknown" : category;
    type = type == null ? DocumentType.UNKNOWN : type;
    metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    contentPreview = contentPreview == null ? "" : contentPreview;
    contentHash = contentHash == null ? "" : contentHash;
    size = Math.max(0, size);
  }

  public Document withContentPreview(String preview) {
    return new Document(
        id, title, path, category, type, metadata, preview, contentHash, size, modifiedTime,
        scanTime);
  }
}
