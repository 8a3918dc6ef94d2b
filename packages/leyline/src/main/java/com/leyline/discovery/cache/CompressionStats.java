package com.leyline.discovery.cache;

/**
 * Compression figures over the documents currently cached.
 *
 * @param compressionRatio {@code compressedBytes / originalBytes}, lower is better, 1.0 when
 *     nothing is stored or compression is off
 * @param compressedDocuments entries whose preview is actually stored deflated
 */
public record CompressionStats(
    boolean enabled,
    double compressionRatio,
    long compressedDocuments,
    long originalBytes,
    long compressedBytes) {

  static CompressionStats disabled() {
    return new CompressionStats(false, 1.0, 0, 0, 0);
  }
}
