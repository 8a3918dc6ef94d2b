package com.leyline.discovery;

/**
 * Snapshot of scanner counters.
 *
 * @param filesScanned scan attempts, including files that could not be read
 * @param parallelBatches batches that ran on the worker pool
 * @param sequentialBatches batches that ran on the calling thread
 * @param frontMatterErrors files whose front-matter could not be used
 * @param totalBytesProcessed bytes read from disk
 * @param averageScanTimeMicros mean time to read and parse one file
 */
public record ScanStatistics(
    long filesScanned,
    long parallelBatches,
    long sequentialBatches,
    long frontMatterErrors,
    long totalBytesProcessed,
    double averageScanTimeMicros) {}
