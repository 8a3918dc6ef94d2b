package com.leyline.commands;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.JsonNode;
import com.leyline.discovery.CorpusFixture;
import com.leyline.discovery.DiscoveryConfig;
import com.leyline.discovery.cache.MetadataCache;
import com.leyline.exception.DiscoveryException;
import com.leyline.utility.JacksonUtility;
import java.nio.file.Path;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ShowCommandTest {

  @TempDir Path corpusRoot;

  private MetadataCache cache;
  private CommandTestSupport io;

  @BeforeEach
  void setUp() throws Exception {
    CorpusFixture.sample(corpusRoot);
    cache = MetadataCache.forCorpus(corpusRoot, DiscoveryConfig.defaults());
    io = new CommandTestSupport();
  }

  @AfterEach
  void tearDown() {
    cache.close();
  }

  @Test
  void showsDocumentsSortedByTitle() {
    int code =
        new ShowCommand(cache, CommandOptions.defaults(), io.out, "typescript").execute();

    assertEquals(0, code);
    String output = io.output();
    assertTrue(output.contains("Documents in 'typescript' (2):"));
    assertTrue(output.contains("  ID: no-any"));
    assertTrue(output.contains("  Type: binding"));
    assertTrue(output.indexOf("Avoid Any Type") < output.indexOf("Strict Mode"));
    assertFalse(output.contains("  Path: "));
  }

  @Test
  void verboseAddsPathAndDescription() {
    new ShowCommand(cache, new CommandOptions(false, true, false, 10), io.out, "tenets")
        .execute();

    String output = io.output();
    assertTrue(output.contains("  Path: "));
    assertTrue(output.contains("simplicity.md"));
    assertTrue(output.contains("  Description: Prefer the simplest design guideline."));
  }

  @Test
  void unknownCategoryListsAlternatives() {
    int code = new ShowCommand(cache, CommandOptions.defaults(), io.out, "rust").execute();

    assertEquals(0, code);
    String output = io.output();
    assertTrue(output.contains("No documents found in category 'rust'"));
    assertTrue(output.contains("Available categories: core, go, tenets, typescript"));
  }

  @Test
  void jsonOutput() throws Exception {
    new ShowCommand(cache, new CommandOptions(false, false, true, 10), io.out, "go").execute();

    JsonNode json = JacksonUtility.getJsonMapper().readTree(io.output());
    assertEquals("go", json.get("category").asText());
    assertEquals(1, json.get("document_count").asInt());
    JsonNode doc = json.get("documents").get(0);
    assertEquals("Error Wrapping", doc.get("title").asText());
    assertEquals("error-wrapping", doc.get("id").asText());
    assertEquals("binding", doc.get("type").asText());
    assertFalse(json.has("available_categories"));
  }

  @Test
  void blankCategoryIsRejected() {
    DiscoveryException e =
        assertThrows(
            DiscoveryException.class,
            () -> new ShowCommand(cache, CommandOptions.defaults(), io.out, "  "));
    assertEquals("Category parameter is required", e.getMessage());
    assertFalse(e.getSuggestions().isEmpty());
  }
}
