package com.leyline.discovery;

import com.leyline.exception.ConfigException;
import org.apache.commons.configuration2.Configuration;

/**
 * Tuning knobs for the scanner and the metadata cache. Fixed for the lifetime of a cache instance.
 *
 * @param compressionEnabled store content previews deflated
 * @param maxMemoryBytes ceiling for the accounted size of all cached documents
 * @param parallelThreshold batch size from which scanning runs on a worker pool
 * @param maxThreads upper bound of scanner workers per batch
 */
public record DiscoveryConfig(
    boolean compressionEnabled, long maxMemoryBytes, int parallelThreshold, int maxThreads) {

  public static final long DEFAULT_MAX_MEMORY_BYTES = 10L * 1024 * 1024;
  public static final int DEFAULT_PARALLEL_THRESHOLD = 10;
  public static final int MIN_PARALLEL_THRESHOLD = 5;
  public static final int MAX_PARALLEL_THRESHOLD = 20;
  public static final int DEFAULT_MAX_THREADS = 4;
  public static final int MIN_THREADS = 1;
  public static final int MAX_THREADS = 8;

  public DiscoveryConfig {
    if (maxMemoryBytes <= 0) {
      throw new ConfigException("max-memory-bytes must be positive, got " + maxMemoryBytes);
    }
    if (parallelThreshold < MIN_PARALLEL_THRESHOLD || parallelThreshold > MAX_PARALLEL_THRESHOLD) {
      throw new ConfigException(
          "parallel-threshold must be within [%d, %d], got %d"
              .formatted(MIN_PARALLEL_THRESHOLD, MAX_PARALLEL_THRESHOLD, parallelThreshold));
    }
    if (maxThreads < MIN_THREADS || maxThreads > MAX_THREADS) {
      throw new ConfigException(
          "max-threads must be within [%d, %d], got %d"
              .formatted(MIN_THREADS, MAX_THREADS, maxThreads));
    }
  }

  public static DiscoveryConfig defaults() {
    return new DiscoveryConfig(
        false, DEFAULT_MAX_MEMORY_BYTES, DEFAULT_PARALLEL_THRESHOLD, DEFAULT_MAX_THREADS);
  }

  /**
   * Read {@code leyline.cache.*} and {@code leyline.scanner.*} keys; missing keys fall back to the
   * defaults.
   */
  public static DiscoveryConfig from(Configuration cfg) {
    if (cfg == null) return defaults();
    try {
      return new DiscoveryConfig(
          cfg.getBoolean("leyline.cache.compression", false),
          cfg.getLong("leyline.cache.max-memory-bytes", DEFAULT_MAX_MEMORY_BYTES),
          cfg.getInt("leyline.scanner.parallel-threshold", DEFAULT_PARALLEL_THRESHOLD),
          cfg.getInt("leyline.scanner.max-threads", DEFAULT_MAX_THREADS));
    } catch (ConfigException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new ConfigException("Invalid discovery configuration: " + e.getMessage(), e);
    }
  }

  public DiscoveryConfig withCompression(boolean enabled) {
    return new DiscoveryConfig(enabled, maxMemoryBytes, parallelThreshold, maxThreads);
  }

  public DiscoveryConfig withMaxMemoryBytes(long bytes) {
    return new DiscoveryConfig(compressionEnabled, bytes, parallelThreshold, maxThreads);
  }

  public DiscoveryConfig withScanner(int threshold, int threads) {
    return new DiscoveryConfig(compressionEnabled, maxMemoryBytes, threshold, threads);
  }
}
