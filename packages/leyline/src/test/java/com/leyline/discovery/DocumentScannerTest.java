package com.leyline.discovery;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@DisplayName("DocumentScanner")
class DocumentScannerTest {

  @TempDir Path tempDir;

  private CorpusFixture corpus;
  private DocumentScanner scanner;

  @BeforeEach
  void setUp() {
    corpus = new CorpusFixture(tempDir);
    scanner = new DocumentScanner(DiscoveryConfig.defaults());
  }

  private List<Path> writeBindings(int count) throws Exception {
    List<Path> paths = new ArrayList<>();
    for (int i = 0; i < count; i++) {
      paths.add(
          corpus.binding(
              "go", "doc-" + i, "go-" + i, "Go Binding " + i, "Body text number " + i + "."));
    }
    return paths;
  }

  @Test
  @DisplayName("Extracts id, heading title, category, type and preview")
  void scansSingleDocument() throws Exception {
    Path file =
        corpus.binding(
            "typescript",
            "no-any",
            "no-any",
            "Integration Test",
            "Avoid the any type.\n\nPrefer unknown instead.");

    Document doc = scanner.scanDocument(file).orElseThrow();

    assertEquals("no-any", doc.id());
    assertEquals("Integration Test", doc.title());
    assertEquals("typescript", doc.category());
    assertEquals(DocumentType.BINDING, doc.type());
    assertEquals("Avoid the any type. Prefer unknown instead.", doc.contentPreview());
    assertEquals("2025-01-15", doc.metadata().get("last_modified"));
    assertEquals(64, doc.contentHash().length());
    assertTrue(doc.size() > 0);
    assertEquals(file.toAbsolutePath().normalize().toString(), doc.path());
  }

  @Test
  @DisplayName("Heading wins over front-matter title")
  void headingPreferredOverFrontMatterTitle() throws Exception {
    Path file =
        CorpusFixture.write(
            tempDir.resolve("docs/tenets/integration.md"),
            "---\nid: integration\ntitle: Integration Test Document\n---\n\n"
                + "# Integration Test\n\nBody.\n");

    Document doc = scanner.scanDocument(file).orElseThrow();

    assertEquals("Integration Test", doc.title());
    assertEquals("tenets", doc.category());
    assertEquals(DocumentType.TENET, doc.type());
  }

  @Test
  @DisplayName("Falls back to front-matter title, then to the file name")
  void titleFallbacks() throws Exception {
    Path withTitle =
        CorpusFixture.write(
            tempDir.resolve("docs/tenets/simplicity.md"),
            "---\nid: simplicity\ntitle: Keep It Simple\n---\n\nNo heading here.\n");
    Path bare =
        CorpusFixture.write(
            tempDir.resolve("docs/bindings/core/error-wrapping.md"), "Just some text.\n");

    assertEquals("Keep It Simple", scanner.scanDocument(withTitle).orElseThrow().title());
    Document fallback = scanner.scanDocument(bare).orElseThrow();
    assertEquals("Error wrapping", fallback.title());
    assertEquals("error-wrapping", fallback.id());
    assertEquals("core", fallback.category());
  }

  @Test
  @DisplayName("Headings inside fenced code are not titles")
  void ignoresHashInsideCodeFence() throws Exception {
    Path file =
        CorpusFixture.write(
            tempDir.resolve("docs/tenets/fenced.md"),
            "---\nid: fenced\n---\n\n```bash\n# not a title\n```\n\n## Real Title\n");

    assertEquals("Real Title", scanner.scanDocument(file).orElseThrow().title());
  }

  @Test
  @DisplayName("Preview is cut on a word boundary with an ellipsis")
  void previewTruncatedAtWordBoundary() throws Exception {
    String body = "word ".repeat(100);
    Path file = corpus.tenet("long", "long", "Long", body);

    String preview = scanner.scanDocument(file).orElseThrow().contentPreview();

    assertTrue(preview.endsWith("..."));
    assertTrue(preview.length() <= DocumentScanner.CONTENT_PREVIEW_LENGTH + 3);
    assertFalse(preview.contains("wor..."));
  }

  @Test
  @DisplayName("Corrupted front-matter degrades metadata instead of failing")
  void corruptedFrontMatterIsDegraded() throws Exception {
    Path file =
        CorpusFixture.write(
            tempDir.resolve("docs/bindings/core/broken.md"),
            "---\nid: [unclosed\nkey: : value\n---\n\n# Broken Doc\n\nStill readable.\n");

    Document doc = scanner.scanDocument(file).orElseThrow();

    assertEquals("broken", doc.id());
    assertEquals("Broken Doc", doc.title());
    assertTrue(doc.metadata().isEmpty());
    assertEquals(1, scanner.scanStatistics().frontMatterErrors());
  }

  @Test
  @DisplayName("Missing file yields empty result and still counts as an attempt")
  void missingFileIsSkipped() {
    Optional<Document> result = scanner.scanDocument(tempDir.resolve("nope.md"));

    assertTrue(result.isEmpty());
    assertEquals(1, scanner.scanStatistics().filesScanned());
  }

  @Test
  @DisplayName("Batches at or above the threshold run in parallel")
  void largeBatchRunsInParallel() throws Exception {
    List<Path> paths = writeBindings(15);

    List<Document> docs = scanner.scanDocuments(paths);

    ScanStatistics stats = scanner.scanStatistics();
    assertEquals(15, docs.size());
    assertEquals(15, stats.filesScanned());
    assertEquals(1, stats.parallelBatches());
    assertEquals(0, stats.sequentialBatches());
  }

  @Test
  @DisplayName("Batches below the threshold run sequentially")
  void smallBatchRunsSequentially() throws Exception {
    List<Path> paths = writeBindings(5);

    List<Document> docs = scanner.scanDocuments(paths);

    ScanStatistics stats = scanner.scanStatistics();
    assertEquals(5, docs.size());
    assertEquals(5, stats.filesScanned());
    assertEquals(0, stats.parallelBatches());
    assertEquals(1, stats.sequentialBatches());
  }

  @Test
  @DisplayName("Parallel and sequential scans produce the same documents")
  void parallelMatchesSequential() throws Exception {
    List<Path> paths = writeBindings(12);
    DocumentScanner sequential =
        new DocumentScanner(DiscoveryConfig.defaults().withScanner(20, 1));

    Comparator<Document> byPath = Comparator.comparing(Document::path);
    List<Document> a = new ArrayList<>(scanner.scanDocuments(paths));
    List<Document> b = new ArrayList<>(sequential.scanDocuments(paths));
    a.sort(byPath);
    b.sort(byPath);

    assertEquals(a.size(), b.size());
    for (int i = 0; i < a.size(); i++) {
      assertEquals(a.get(i).id(), b.get(i).id());
      assertEquals(a.get(i).contentHash(), b.get(i).contentHash());
    }
    assertEquals(1, sequential.scanStatistics().sequentialBatches());
  }

  @Test
  @DisplayName("Missing files inside a batch are excluded but counted")
  void batchWithMissingFile() throws Exception {
    List<Path> paths = new ArrayList<>(writeBindings(3));
    paths.add(tempDir.resolve("docs/bindings/categories/go/ghost.md"));

    List<Document> docs = scanner.scanDocuments(paths);

    assertEquals(3, docs.size());
    assertEquals(4, scanner.scanStatistics().filesScanned());
  }

  @Test
  @DisplayName("Single and batch scans both add to filesScanned")
  void singleThenBatchAccounting() throws Exception {
    Path file = writeBindings(1).get(0);

    scanner.scanDocument(file);
    scanner.scanDocuments(List.of(file));

    assertEquals(2, scanner.scanStatistics().filesScanned());
  }

  @Test
  @DisplayName("Bytes processed and average scan time are tracked; reset clears them")
  void statisticsAndReset() throws Exception {
    List<Path> paths = writeBindings(2);
    scanner.scanDocuments(paths);

    ScanStatistics stats = scanner.scanStatistics();
    assertTrue(stats.totalBytesProcessed() > 0);
    assertTrue(stats.averageScanTimeMicros() >= 0.0);

    scanner.resetStatistics();
    assertEquals(new ScanStatistics(0, 0, 0, 0, 0, 0.0), scanner.scanStatistics());
  }

  @Test
  @DisplayName("Empty batch does nothing")
  void emptyBatch() {
    assertTrue(scanner.scanDocuments(List.of()).isEmpty());
    assertEquals(0, scanner.scanStatistics().sequentialBatches());
  }

  @Test
  @DisplayName("Category derives from directory placement")
  void categoryFromPath() {
    assertEquals("go", DocumentScanner.categoryOf("/r/docs/bindings/categories/go/x.md"));
    assertEquals("core", DocumentScanner.categoryOf("/r/docs/bindings/core/x.md"));
    assertEquals("tenets", DocumentScanner.categoryOf("/r/docs/tenets/x.md"));
    assertEquals("unknown", DocumentScanner.categoryOf("/r/notes/x.md"));
  }
}
