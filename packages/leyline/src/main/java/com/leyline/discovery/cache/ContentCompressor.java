package com.leyline.discovery.cache;

import com.leyline.exception.SerializationException;
import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.zip.DataFormatException;
import java.util.zip.Deflater;
import java.util.zip.Inflater;

/** Deflate-based compression of stored previews. Stateless and safe to share between threads. */
public class ContentCompressor {
  private static final int BUFFER_SIZE = 512;

  public CompressedContent compress(String text) {
    byte[] raw = text == null ? new byte[0] : text.getBytes(StandardCharsets.UTF_8);
    if (raw.length == 0) {
      return new CompressedContent(raw, 0, false);
    }
    Deflater deflater = new Deflater(Deflater.BEST_COMPRESSION);
    try {
      deflater.setInput(raw);
      deflater.finish();
      ByteArrayOutputStream out = new ByteArrayOutputStream(Math.min(raw.length, 4096));
      byte[] buffer = new byte[BUFFER_SIZE];
      while (!deflater.finished()) {
        int n = deflater.deflate(buffer);
        out.write(buffer, 0, n);
      }
      byte[] packed = out.toByteArray();
      if (packed.length >= raw.length) {
        return new CompressedContent(raw, raw.length, false);
      }
      return new CompressedContent(packed, raw.length, true);
    } finally {
      deflater.end();
    }
  }

  public String decompress(CompressedContent content) {
    if (!content.isDeflated()) {
      return new String(content.data(), StandardCharsets.UTF_8);
    }
    Inflater inflater = new Inflater();
    try {
      inflater.setInput(content.data());
      byte[] out = new byte[content.originalLength()];
      int offset = 0;
      while (!inflater.finished() && offset < out.length) {
        int n = inflater.inflate(out, offset, out.length - offset);
        if (n == 0 && (inflater.needsInput() || inflater.needsDictionary())) {
          break;
        }
        offset += n;
      }
      if (offset != out.length) {
        throw new SerializationException(
            "Compressed preview is truncated: expected "
                + out.length
                + " bytes, inflated "
                + offset);
      }
      return new String(out, StandardCharsets.UTF_8);
    } catch (DataFormatException e) {
      throw new SerializationException("Compressed preview is corrupted", e);
    } finally {
      inflater.end();
    }
  }
}
