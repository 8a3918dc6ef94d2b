package com.leyline.discovery.cache;

import com.leyline.discovery.CorpusPathDiscovery;
import com.leyline.discovery.DiscoveryConfig;
import com.leyline.discovery.Document;
import com.leyline.discovery.DocumentPathDiscovery;
import com.leyline.discovery.DocumentScanner;
import com.leyline.discovery.search.FuzzyMatcher;
import com.leyline.discovery.search.RelevanceScorer;
import com.leyline.discovery.search.SearchResult;
import com.leyline.discovery.stats.OperationTimer;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-memory index of corpus documents with LRU eviction under a memory ceiling.
 *
 * <p>Every query first re-lists the corpus and compares each file's modification marker with the
 * one recorded when it was last scanned. Unchanged files count as hits, new or modified files as
 * misses and are rescanned, files gone from the listing are dropped. Listing and scanning run
 * without holding the index lock; only applying the results does. Refreshes themselves run one at a
 * time, so a query issued during warm-up waits for it and then finds every file unchanged.
 *
 * <p>Documents inserted through {@link #cacheDocument(Document)} carry no marker and are never
 * pruned by a refresh. Evicted documents keep their marker, so they come back only when their file
 * changes or after {@link #invalidate()}.
 */
public class MetadataCache implements AutoCloseable {
  private static final org.slf4j.Logger log =
      com.leyline.logging.LoggingService.getLogger(MetadataCache.class);

  public static final String OP_LIST_CATEGORIES = "list_categories";
  public static final String OP_SHOW_CATEGORY = "show_category";
  public static final String OP_SEARCH = "search_content";

  public static final int DEFAULT_SUGGESTION_LIMIT = 5;
  public static final int MIN_SUGGESTION_QUERY_LENGTH = 3;

  private final DiscoveryConfig config;
  private final DocumentPathDiscovery pathDiscovery;
  private final DocumentScanner scanner;
  private final ContentCompressor compressor = new ContentCompressor();
  private final OperationTimer timer = new OperationTimer();

  // Held across a whole refresh. Never acquired while holding lock.
  private final ReentrantLock refreshLock = new ReentrantLock();
  private final ReentrantLock lock = new ReentrantLock();
  // Guarded by lock. Access order: iteration starts at the least recently used entry.
  private final LinkedHashMap<String, CacheEntry> entries = new LinkedHashMap<>(64, 0.75f, true);
  private final Map<String, Set<String>> pathsByCategory = new HashMap<>();
  private long memoryUsage;
  private long hitCount;
  private long missCount;
  private long scanCount;
  private long evictionCount;
  private long indexServedQueries;
  private long rescanningQueries;
  private Instant lastScan;

  private final Map<String, FileMarker> fileMarkers = new ConcurrentHashMap<>();

  private final AtomicReference<WarmupState> warmupState =
      new AtomicReference<>(WarmupState.COLD);
  private final ExecutorService warmupExecutor;
  private volatile CompletableFuture<Void> warmupFuture = CompletableFuture.completedFuture(null);
  private volatile Throwable lastWarmupFailure;

  public MetadataCache(DocumentPathDiscovery pathDiscovery) {
    this(pathDiscovery, DiscoveryConfig.defaults());
  }

  public MetadataCache(DocumentPathDiscovery pathDiscovery, DiscoveryConfig config) {
    this(pathDiscovery, config, new DocumentScanner(config));
  }

  public MetadataCache(
      DocumentPathDiscovery pathDiscovery, DiscoveryConfig config, DocumentScanner scanner) {
    this.pathDiscovery = Objects.requireNonNull(pathDiscovery, "pathDiscovery");
    this.config = Objects.requireNonNull(config, "config");
    this.scanner = Objects.requireNonNull(scanner, "scanner");
    this.warmupExecutor =
        Executors.newSingleThreadExecutor(
            r -> {
              Thread t = new Thread(r, "leyline-cache-warmup");
              t.setDaemon(true);
              return t;
            });
  }

  /** Cache over the standard tenets and bindings layout below {@code corpusRoot}. */
  public static MetadataCache forCorpus(Path corpusRoot, DiscoveryConfig config) {
    return new MetadataCache(new CorpusPathDiscovery(corpusRoot), config);
  }

  public DiscoveryConfig config() {
    return config;
  }

  public DocumentScanner scanner() {
    return scanner;
  }

  public boolean isCompressionEnabled() {
    return config.compressionEnabled();
  }


  /** Distinct categories, sorted. */
  public List<String> categories() {
    return timer.time(
        OP_LIST_CATEGORIES,
        () -> {
          refresh();
          lock.lock();
          try {
            return new ArrayList<>(new TreeSet<>(pathsByCategory.keySet()));
          } finally {
            lock.unlock();
          }
        });
  }

  /** Documents of {@code category} sorted by title, or an empty list for an unknown category. */
  public List<Document> documentsForCategory(String category) {
    return timer.time(
        OP_SHOW_CATEGORY,
        () -> {
          refresh();
          if (category == null) {
            return List.of();
          }
          List<CacheEntry> found = new ArrayList<>();
          lock.lock();
          try {
            Set<String> paths = pathsByCategory.get(category);
            if (paths == null) {
              return List.of();
            }
            for (String path : paths) {
              CacheEntry entry = entries.get(path);
              if (entry != null) found.add(entry);
            }
          } finally {
            lock.unlock();
          }
          List<Document> out = new ArrayList<>(found.size());
          for (CacheEntry entry : found) {
            out.add(entry.document(compressor));
          }
          out.sort(Comparator.comparing(Document::title).thenComparing(Document::path));
          return out;
        });
  }

  /**
   * Ranked search over titles, ids, previews and categories. A blank or {@code null} query yields
   * an empty list.
   */
  public List<SearchResult> search(String query) {
    if (query == null || query.isBlank()) {
      return List.of();
    }
    return timer.time(
        OP_SEARCH,
        () -> {
          refresh();
          List<CacheEntry> snapshot = snapshot();
          List<SearchResult> results = new ArrayList<>();
          for (CacheEntry entry : snapshot) {
            RelevanceScorer.score(query, entry.document(compressor)).ifPresent(results::add);
          }
          results.sort(
              Comparator.comparingDouble(SearchResult::score)
                  .reversed()
                  .thenComparing(r -> r.document().path()));
          touch(results.stream().map(r -> r.document().path()).toList());
          log.debug("Search '{}' matched {} document(s)", query, results.size());
          return results;
        });
  }

  public List<String> suggestCorrections(String query) {
    return suggestCorrections(query, DEFAULT_SUGGESTION_LIMIT);
  }

  /**
   * Title words and titles within the fuzzy tolerance of {@code query}, closest first. Queries
   * shorter than {@link #MIN_SUGGESTION_QUERY_LENGTH} characters get no suggestions.
   */
  public List<String> suggestCorrections(String query, int limit) {
    if (query == null || limit <= 0) return List.of();
    String q = query.strip().toLowerCase(Locale.ROOT);
    if (q.length() < MIN_SUGGESTION_QUERY_LENGTH) return List.of();

    refresh();
    Set<String> vocabulary = new LinkedHashSet<>();
    for (CacheEntry entry : snapshot()) {
      String title = entry.title();
      if (title.isBlank()) continue;
      vocabulary.add(title.strip());
      for (String word : FuzzyMatcher.words(title)) {
        if (word.length() >= MIN_SUGGESTION_QUERY_LENGTH) vocabulary.add(word);
      }
    }

    int bound = FuzzyMatcher.maxDistance(q.length());
    Map<String, Suggestion> candidates = new HashMap<>();
    for (String term : vocabulary) {
      String lower = term.toLowerCase(Locale.ROOT);
      if (candidates.containsKey(lower)) continue;
      int d = FuzzyMatcher.distance(q, lower);
      if (d > 0 && d <= bound) {
        candidates.put(lower, new Suggestion(term, lower, d));
      }
    }
    return candidates.values().stream()
        .sorted(Comparator.comparingInt(Suggestion::distance).thenComparing(Suggestion::lower))
        .limit(limit)
        .map(Suggestion::term)
        .toList();
  }

  private record Suggestion(String term, String lower, int distance) {}

  /** Look a document up by path or id. */
  public Optional<Document> findDocument(String idOrPath) {
    if (idOrPath == null || idOrPath.isBlank()) return Optional.empty();
    refresh();
    CacheEntry match = null;
    lock.lock();
    try {
      match = entries.get(idOrPath);
      if (match == null) {
        for (CacheEntry entry : new ArrayList<>(entries.values())) {
          if (entry.id().equals(idOrPath)) {
            match = entries.get(entry.path());
            break;
          }
        }
      }
    } finally {
      lock.unlock();
    }
    return Optional.ofNullable(match).map(e -> e.document(compressor));
  }


  /**
   * Insert or replace the entry for {@code document.path()}. The previous entry's accounted size is
   * released first, then least recently used entries are evicted until the new one fits.
   */
  public void cacheDocument(Document document) {
    Objects.requireNonNull(document, "document");
    CacheEntry entry =
        config.compressionEnabled()
            ? CacheEntry.compressed(document, compressor)
            : CacheEntry.plain(document);
    lock.lock();
    try {
      insertLocked(entry);
    } finally {
      lock.unlock();
    }
  }

  /**
   * Drop every entry and marker, waiting for a running refresh to finish first. Hit, miss and scan
   * counters are cumulative and survive.
   */
  public void invalidate() {
    refreshLock.lock();
    lock.lock();
    try {
      entries.clear();
      pathsByCategory.clear();
      fileMarkers.clear();
      memoryUsage = 0;
    } finally {
      lock.unlock();
      refreshLock.unlock();
    }
    warmupState.compareAndSet(WarmupState.WARM, WarmupState.COLD);
    log.info("Metadata cache invalidated");
  }


  /**
   * Start populating the index on a background thread.
   *
   * @return true if this call started a warm-up, false if one is running or the cache is warm
   */
  public boolean warmCacheInBackground() {
    if (!warmupState.compareAndSet(WarmupState.COLD, WarmupState.WARMING)) {
      return false;
    }
    try {
      warmupFuture = CompletableFuture.runAsync(this::runWarmup, warmupExecutor);
      return true;
    } catch (RejectedExecutionException e) {
      warmupState.set(WarmupState.COLD);
      log.warn("Cache warm-up rejected, cache is closed");
      return false;
    }
  }

  public boolean isCacheWarm() {
    return warmupState.get() == WarmupState.WARM;
  }

  public WarmupState warmupState() {
    return warmupState.get();
  }

  public Optional<Throwable> lastWarmupFailure() {
    return Optional.ofNullable(lastWarmupFailure);
  }

  /** Wait up to {@code timeout} for a running warm-up to finish; returns {@link #isCacheWarm()}. */
  public boolean awaitWarm(Duration timeout) {
    try {
      warmupFuture.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    } catch (TimeoutException | ExecutionException e) {
      log.debug("Warm-up not finished within {}", timeout);
    }
    return isCacheWarm();
  }

  private void runWarmup() {
    long start = System.nanoTime();
    try {
      refresh();
      warmupState.set(WarmupState.WARM);
      lastWarmupFailure = null;
      log.info(
          "Cache warm-up finished: {} document(s) in {} ms",
          documentCount(),
          (System.nanoTime() - start) / 1_000_000);
    } catch (RuntimeException e) {
      lastWarmupFailure = e;
      warmupState.set(WarmupState.COLD);
      log.warn("Background cache warm-up failed: {}", e.getMessage(), e);
    }
  }


  public PerformanceStats performanceStats() {
    lock.lock();
    try {
      return new PerformanceStats(
          PerformanceStats.ratio(hitCount, missCount),
          hitCount,
          missCount,
          scanCount,
          entries.size(),
          pathsByCategory.size(),
          memoryUsage,
          config.maxMemoryBytes(),
          evictionCount,
          compressionStatsLocked(),
          indexServedQueries,
          rescanningQueries,
          PerformanceStats.ratio(indexServedQueries, rescanningQueries),
          lastScan,
          warmupState.get(),
          scanner.scanStatistics(),
          timer.metrics(),
          timer.summary());
    } finally {
      lock.unlock();
    }
  }

  public long memoryUsage() {
    lock.lock();
    try {
      return memoryUsage;
    } finally {
      lock.unlock();
    }
  }

  public int documentCount() {
    lock.lock();
    try {
      return entries.size();
    } finally {
      lock.unlock();
    }
  }

  @Override
  public void close() {
    warmupExecutor.shutdownNow();
  }


  private void refresh() {
    refreshLock.lock();
    try {
      refreshExclusively();
    } finally {
      refreshLock.unlock();
    }
  }

  private void refreshExclusively() {
    List<Path> listed = pathDiscovery.discover();

    Map<String, FileMarker> current = new HashMap<>();
    Map<String, Path> changed = new LinkedHashMap<>();
    long unchanged = 0;
    for (Path path : listed) {
      String key = path.toAbsolutePath().normalize().toString();
      FileMarker marker = FileMarker.read(path);
      if (marker == null) {
        continue;
      }
      current.put(key, marker);
      if (marker.equals(fileMarkers.get(key))) {
        unchanged++;
      } else {
        changed.put(key, path);
      }
    }
    List<String> removed = new ArrayList<>();
    for (String known : fileMarkers.keySet()) {
      if (!current.containsKey(known)) removed.add(known);
    }

    List<Document> scanned =
        changed.isEmpty() ? List.of() : scanner.scanDocuments(changed.values());

    lock.lock();
    try {
      hitCount += unchanged;
      missCount += changed.size();
      for (String path : removed) {
        fileMarkers.remove(path);
        removeLocked(path);
      }
      for (Document document : scanned) {
        FileMarker marker = current.get(document.path());
        if (marker != null) {
          fileMarkers.put(document.path(), marker);
        }
        insertLocked(
            config.compressionEnabled()
                ? CacheEntry.compressed(document, compressor)
                : CacheEntry.plain(document));
      }
      if (changed.isEmpty()) {
        indexServedQueries++;
      } else {
        scanCount++;
        rescanningQueries++;
        lastScan = Instant.now();
      }
    } finally {
      lock.unlock();
    }

    if (!changed.isEmpty() || !removed.isEmpty()) {
      log.debug(
          "Refreshed index: {} unchanged, {} rescanned, {} removed",
          unchanged,
          changed.size(),
          removed.size());
    }
    warmupState.compareAndSet(WarmupState.COLD, WarmupState.WARM);
  }

  private void insertLocked(CacheEntry entry) {
    removeLocked(entry.path());

    long size = entry.accountedSize();
    if (size > config.maxMemoryBytes()) {
      log.warn(
          "Document {} ({} bytes) exceeds the cache ceiling of {} bytes; admitting it alone",
          entry.path(),
          size,
          config.maxMemoryBytes());
    }
    Iterator<Map.Entry<String, CacheEntry>> eldest = entries.entrySet().iterator();
    while (memoryUsage + size > config.maxMemoryBytes() && eldest.hasNext()) {
      CacheEntry victim = eldest.next().getValue();
      eldest.remove();
      memoryUsage -= victim.accountedSize();
      unindexLocked(victim);
      evictionCount++;
      log.debug("Evicted {} ({} bytes)", victim.path(), victim.accountedSize());
    }

    entries.put(entry.path(), entry);
    memoryUsage += size;
    pathsByCategory.computeIfAbsent(entry.category(), k -> new TreeSet<>()).add(entry.path());
  }

  private void removeLocked(String path) {
    CacheEntry old = entries.remove(path);
    if (old != null) {
      memoryUsage -= old.accountedSize();
      unindexLocked(old);
    }
  }

  private void unindexLocked(CacheEntry entry) {
    Set<String> paths = pathsByCategory.get(entry.category());
    if (paths != null) {
      paths.remove(entry.path());
      if (paths.isEmpty()) pathsByCategory.remove(entry.category());
    }
  }

  private List<CacheEntry> snapshot() {
    lock.lock();
    try {
      return new ArrayList<>(entries.values());
    } finally {
      lock.unlock();
    }
  }

  private void touch(List<String> paths) {
    if (paths.isEmpty()) return;
    lock.lock();
    try {
      for (String path : paths) {
        entries.get(path);
      }
    } finally {
      lock.unlock();
    }
  }

  private CompressionStats compressionStatsLocked() {
    if (!config.compressionEnabled()) {
      return CompressionStats.disabled();
    }
    long original = 0;
    long stored = 0;
    long deflated = 0;
    for (CacheEntry entry : entries.values()) {
      original += entry.originalPreviewBytes();
      stored += entry.storedPreviewBytes();
      if (entry.isDeflated()) deflated++;
    }
    double ratio = original == 0 ? 1.0 : (double) stored / original;
    return new CompressionStats(true, ratio, deflated, original, stored);
  }
}
