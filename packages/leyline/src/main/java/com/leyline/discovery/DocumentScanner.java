package com.leyline.discovery;

import com.leyline.utility.StringUtility;
import com.vladsch.flexmark.ast.Heading;
import com.vladsch.flexmark.parser.Parser;
import com.vladsch.flexmark.util.ast.Node;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HexFormat;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Reads markdown files into {@link Document} records.
 *
 * <p>Batches smaller than {@link DiscoveryConfig#parallelThreshold()} run on the calling thread;
 * larger ones run on a fixed pool of {@code min(maxThreads, batchSize)} workers created for the
 * batch and shut down when it completes. A file that cannot be read is logged and left out of the
 * result, it never fails the batch. {@code filesScanned} counts every attempted path.
 */
public class DocumentScanner {
  private static final org.slf4j.Logger log =
      com.leyline.logging.LoggingService.getLogger(DocumentScanner.class);

  public static final int CONTENT_PREVIEW_LENGTH = 200;

  private static final AtomicInteger POOL_SEQ = new AtomicInteger();

  private final DiscoveryConfig config;
  private final FrontMatterParser frontMatterParser = new FrontMatterParser();
  private final Parser markdownParser = Parser.builder().build();

  // Guarded by "this".
  private long filesScanned;
  private long parallelBatches;
  private long sequentialBatches;
  private long frontMatterErrors;
  private long totalBytesProcessed;
  private long timedScans;
  private long totalScanNanos;

  public DocumentScanner() {
    this(DiscoveryConfig.defaults());
  }

  public DocumentScanner(DiscoveryConfig config) {
    this.config = config;
  }

  public DiscoveryConfig config() {
    return config;
  }

  /** Scan one file. Never throws; an unreadable file yields an empty result. */
  public Optional<Document> scanDocument(Path path) {
    Optional<Document> result = scan(path);
    synchronized (this) {
      filesScanned++;
    }
    return result;
  }

  /**
   * Scan a batch of files, choosing the parallel strategy from the batch size. Blocks until every
   * file has been processed. Result order is unspecified for parallel batches.
   */
  public List<Document> scanDocuments(Collection<Path> paths) {
    if (paths == null || paths.isEmpty()) {
      return List.of();
    }
    List<Path> batch = List.copyOf(paths);
    List<Document> documents;
    if (batch.size() >= config.parallelThreshold()) {
      documents = scanParallel(batch);
      synchronized (this) {
        parallelBatches++;
      }
    } else {
      documents = new ArrayList<>();
      for (Path path : batch) {
        scan(path).ifPresent(documents::add);
      }
      synchronized (this) {
        sequentialBatches++;
      }
    }
    synchronized (this) {
      filesScanned += batch.size();
    }
    log.debug(
        "Scanned batch of {} file(s), {} document(s) produced", batch.size(), documents.size());
    return documents;
  }

  public synchronized ScanStatistics scanStatistics() {
    double avgMicros = timedScans == 0 ? 0.0 : (totalScanNanos / 1000.0) / timedScans;
    return new ScanStatistics(
        filesScanned,
        parallelBatches,
        sequentialBatches,
        frontMatterErrors,
        totalBytesProcessed,
        avgMicros);
  }

  public synchronized void resetStatistics() {
    filesScanned = 0;
    parallelBatches = 0;
    sequentialBatches = 0;
    frontMatterErrors = 0;
    totalBytesProcessed = 0;
    timedScans = 0;
    totalScanNanos = 0;
  }

  private List<Document> scanParallel(List<Path> batch) {
    int threads = Math.min(config.maxThreads(), batch.size());
    ExecutorService executor = Executors.newFixedThreadPool(threads, workerThreadFactory());
    try {
      List<CompletableFuture<Optional<Document>>> futures = new ArrayList<>(batch.size());
      for (Path path : batch) {
        futures.add(CompletableFuture.supplyAsync(() -> scan(path), executor));
      }
      CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

      List<Document> documents = new ArrayList<>(batch.size());
      for (CompletableFuture<Optional<Document>> future : futures) {
        future.join().ifPresent(documents::add);
      }
      return documents;
    } finally {
      executor.shutdown();
    }
  }

  private static ThreadFactory workerThreadFactory() {
    int pool = POOL_SEQ.incrementAndGet();
    AtomicInteger seq = new AtomicInteger();
    return r -> {
      Thread t = new Thread(r, "leyline-scan-" + pool + "-" + seq.incrementAndGet());
      t.setDaemon(true);
      return t;
    };
  }

  // Does not touch filesScanned; callers account for attempts.
  private Optional<Document> scan(Path path) {
    if (path == null) {
      return Optional.empty();
    }
    long start = System.nanoTime();
    try {
      byte[] raw = Files.readAllBytes(path);
      Instant modified = Files.getLastModifiedTime(path).toInstant();
      String content = new String(raw, StandardCharsets.UTF_8);

      ParsedMarkdown parsed = frontMatterParser.parse(content);
      if (parsed.hasError()) {
        log.warn("Unusable front-matter in {}: {}", path, parsed.error());
      }

      Document document = buildDocument(path, raw, content, parsed, modified);
      recordScan(raw.length, System.nanoTime() - start, parsed.hasError());
      return Optional.of(document);
    } catch (NoSuchFileException e) {
      log.debug("Skipping missing file {}", path);
      return Optional.empty();
    } catch (IOException | RuntimeException e) {
      log.warn("Document scan error for {}: {}", path, e.toString());
      return Optional.empty();
    }
  }

  private synchronized void recordScan(long bytes, long nanos, boolean frontMatterError) {
    totalBytesProcessed += bytes;
    timedScans++;
    totalScanNanos += nanos;
    if (frontMatterError) {
      frontMatterErrors++;
    }
  }

  private Document buildDocument(
      Path path, byte[] raw, String content, ParsedMarkdown parsed, Instant modified) {
    String pathString = path.toAbsolutePath().normalize().toString();
    String fileName = path.getFileName().toString();
    String baseName =
        fileName.toLowerCase(Locale.ROOT).endsWith(".md")
            ? fileName.substring(0, fileName.length() - 3)
            : fileName;
    Map<String, String> frontMatter = parsed.frontMatter();

    String id = frontMatter.getOrDefault("id", "");
    if (id.isBlank()) {
      id = baseName;
    }

    String title = firstHeading(parsed.body());
    if (title == null) {
      String declared = frontMatter.get("title");
      title = declared != null && !declared.isBlank() ? declared.strip() : null;
    }
    if (title == null) {
      title = StringUtility.humanize(baseName);
    }

    return new Document(
        id,
        title,
        pathString,
        categoryOf(pathString),
        DocumentType.fromPath(pathString),
        frontMatter,
        preview(parsed.body()),
        sha256(raw),
        raw.length,
        modified,
        Instant.now());
  }

  private String firstHeading(String body) {
    if (body.isBlank()) return null;
    Node root = markdownParser.parse(body);
    for (Node node = root.getFirstChild(); node != null; node = node.getNext()) {
      if (node instanceof Heading h) {
        String text = h.getText().toString().strip();
        if (!text.isEmpty()) {
          return text;
        }
      }
    }
    return null;
  }

  /** Segment after {@code categories/}, else {@code core}, else {@code tenets}, else unknown. */
  static String categoryOf(String path) {
    List<String> parts = List.of(path.replace('\\', '/').split("/"));
    int idx = parts.indexOf("categories");
    if (idx >= 0 && idx + 1 < parts.size() - 1) {
      return parts.get(idx + 1);
    }
    if (parts.contains("core")) return "core";
    if (parts.contains("tenets")) return "tenets";
    return "unknown";
  }

  /** Body lines that are neither blank nor headings, joined and cut on a word boundary. */
  static String preview(String body) {
    StringBuilder sb = new StringBuilder();
    for (String line : body.split("\n")) {
      String stripped = line.strip();
      if (stripped.isEmpty() || stripped.startsWith("#")) continue;
      if (sb.length() > 0) sb.append(' ');
      sb.append(stripped);
      if (sb.length() >= CONTENT_PREVIEW_LENGTH) break;
    }
    return StringUtility.truncateAtWord(sb.toString(), CONTENT_PREVIEW_LENGTH);
  }

  static String sha256(byte[] bytes) {
    try {
      return HexFormat.of().formatHex(MessageDigest.getInstance("SHA-256").digest(bytes));
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 not available", e);
    }
  }
}
