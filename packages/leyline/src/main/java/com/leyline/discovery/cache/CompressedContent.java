package com.leyline.discovery.cache;

/**
 * Stored form of a content preview. {@code deflated} is false when deflating would not have saved
 * space and the UTF-8 bytes are kept as they are.
 */
public final class CompressedContent {
  private final byte[] data;
  private final int originalLength;
  private final boolean deflated;

  CompressedContent(byte[] data, int originalLength, boolean deflated) {
    this.data = data;
    this.originalLength = originalLength;
    this.deflated = deflated;
  }

  byte[] data() {
    return data;
  }

  public int storedLength() {
    return data.length;
  }

  /** UTF-8 length of the uncompressed text. */
  public int originalLength() {
    return originalLength;
  }

  public boolean isDeflated() {
    return deflated;
  }
}
