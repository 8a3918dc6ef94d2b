package com.leyline.discovery.cache;

import com.leyline.discovery.Document;
import java.nio.charset.StandardCharsets;

/**
 * Immutable index entry. When stored compressed the wrapped document carries an empty preview and
 * the text lives in {@link CompressedContent}.
 */
final class CacheEntry {
  private final Document document;
  private final CompressedContent preview;
  private final long accountedSize;
  private final long originalPreviewBytes;

  private CacheEntry(
      Document document, CompressedContent preview, long accountedSize, long originalPreviewBytes) {
    this.document = document;
    this.preview = preview;
    this.accountedSize = accountedSize;
    this.originalPreviewBytes = originalPreviewBytes;
  }

  static CacheEntry plain(Document document) {
    long previewBytes = document.contentPreview().getBytes(StandardCharsets.UTF_8).length;
    return new CacheEntry(document, null, document.size(), previewBytes);
  }

  static CacheEntry compressed(Document document, ContentCompressor compressor) {
    CompressedContent packed = compressor.compress(document.contentPreview());
    return new CacheEntry(
        document.withContentPreview(""), packed, packed.storedLength(), packed.originalLength());
  }

  Document document(ContentCompressor compressor) {
    if (preview == null) {
      return document;
    }
    return document.withContentPreview(compressor.decompress(preview));
  }

  String path() {
    return document.path();
  }

  String id() {
    return document.id();
  }

  String category() {
    return document.category();
  }

  String title() {
    return document.title();
  }

  long accountedSize() {
    return accountedSize;
  }

  long originalPreviewBytes() {
    return originalPreviewBytes;
  }

  long storedPreviewBytes() {
    return preview == null ? originalPreviewBytes : preview.storedLength();
  }

  boolean isDeflated() {
    return preview != null && preview.isDeflated();
  }
}
