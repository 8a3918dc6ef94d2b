package com.leyline.discovery.cache;

import static org.junit.jupiter.api.Assertions.*;

import com.leyline.discovery.DiscoveryConfig;
import com.leyline.discovery.Document;
import com.leyline.discovery.DocumentType;
import com.leyline.discovery.search.SearchResult;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("MetadataCache compression")
class MetadataCacheCompressionTest {

  private static final String REPETITIVE =
      "# Heading\n\n" + "This is repeated content. ".repeat(100);

  private MetadataCache cache;

  @AfterEach
  void tearDown() {
    if (cache != null) cache.close();
  }

  private static Document withPreview(String path, String preview) {
    return new Document(
        "doc-" + path.hashCode(),
        "Repetitive Document",
        path,
        "core",
        DocumentType.BINDING,
        Map.of(),
        preview,
        "hash",
        preview.getBytes(StandardCharsets.UTF_8).length,
        Instant.EPOCH,
        Instant.EPOCH);
  }

  @Test
  @DisplayName("Compressed storage accounts far less than the raw size")
  void compressionReducesAccountedMemory() {
    cache = new MetadataCache(List::of, DiscoveryConfig.defaults().withCompression(true));
    Document doc = withPreview("/docs/repeat.md", REPETITIVE);

    cache.cacheDocument(doc);

    long usage = cache.memoryUsage();
    assertTrue(usage > 0);
    assertTrue(usage <= doc.size());
    assertTrue(usage < doc.size() * 0.8);

    CompressionStats stats = cache.performanceStats().compressionStats();
    assertTrue(stats.enabled());
    assertEquals(1, stats.compressedDocuments());
    assertTrue(stats.compressionRatio() <= 0.5);
    assertEquals(doc.size(), stats.originalBytes());
  }

  @Test
  @DisplayName("Re-caching a compressed document keeps usage stable")
  void recacheIsStable() {
    cache = new MetadataCache(List::of, DiscoveryConfig.defaults().withCompression(true));
    Document doc = withPreview("/docs/repeat.md", REPETITIVE);

    cache.cacheDocument(doc);
    long first = cache.memoryUsage();
    cache.cacheDocument(doc);

    assertEquals(first, cache.memoryUsage());
  }

  @Test
  @DisplayName("Previews read back intact and stay searchable")
  void decompressionIsTransparent() {
    cache = new MetadataCache(List::of, DiscoveryConfig.defaults().withCompression(true));
    cache.cacheDocument(withPreview("/docs/repeat.md", REPETITIVE));

    Document stored = cache.documentsForCategory("core").get(0);
    assertEquals(REPETITIVE, stored.contentPreview());

    List<SearchResult> results = cache.search("repeated content");
    assertEquals(1, results.size());
    assertTrue(results.get(0).matches().contains("content"));
  }

  @Test
  @DisplayName("Short previews that do not shrink are stored raw")
  void incompressiblePreview() {
    cache = new MetadataCache(List::of, DiscoveryConfig.defaults().withCompression(true));
    Document doc = withPreview("/docs/tiny.md", "ok");

    cache.cacheDocument(doc);

    CompressionStats stats = cache.performanceStats().compressionStats();
    assertEquals(0, stats.compressedDocuments());
    assertEquals(1.0, stats.compressionRatio());
    assertEquals(2, cache.memoryUsage());
  }

  @Test
  @DisplayName("Disabled compression reports ratio 1.0 and raw sizes")
  void disabledCompression() {
    cache = new MetadataCache(List::of, DiscoveryConfig.defaults());
    Document doc = withPreview("/docs/repeat.md", REPETITIVE);

    cache.cacheDocument(doc);

    CompressionStats stats = cache.performanceStats().compressionStats();
    assertFalse(cache.isCompressionEnabled());
    assertFalse(stats.enabled());
    assertEquals(1.0, stats.compressionRatio());
    assertEquals(0, stats.compressedDocuments());
    assertEquals(doc.size(), cache.memoryUsage());
  }

  @Test
  @DisplayName("Empty cache with compression on reports ratio 1.0")
  void emptyCacheRatio() {
    cache = new MetadataCache(List::of, DiscoveryConfig.defaults().withCompression(true));

    assertEquals(1.0, cache.performanceStats().compressionStats().compressionRatio());
  }
}
