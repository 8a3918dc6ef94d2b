package com.leyline.discovery;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

class FrontMatterParserTest {

  private final FrontMatterParser parser = new FrontMatterParser();

  @Test
  void splitsFrontMatterAndBody() {
    ParsedMarkdown parsed =
        parser.parse("---\nid: ts-no-any\nenforced_by: eslint\n---\n# Title\n\nBody\n");

    assertTrue(parsed.present());
    assertFalse(parsed.hasError());
    assertEquals("ts-no-any", parsed.frontMatter().get("id"));
    assertEquals("eslint", parsed.frontMatter().get("enforced_by"));
    assertEquals("# Title\n\nBody\n", parsed.body());
  }

  @Test
  void flattensListsAndNumbers() {
    ParsedMarkdown parsed =
        parser.parse("---\nid: x\nversion: 2\napplies_to:\n  - go\n  - rust\n---\nBody");

    assertEquals("2", parsed.frontMatter().get("version"));
    assertEquals("go, rust", parsed.frontMatter().get("applies_to"));
  }

  @Test
  void handlesWindowsLineEndings() {
    ParsedMarkdown parsed = parser.parse("---\r\nid: crlf\r\n---\r\n# Heading\r\n");

    assertEquals("crlf", parsed.frontMatter().get("id"));
    assertEquals("# Heading\n", parsed.body());
  }

  @Test
  void noFrontMatterKeepsWholeBody() {
    ParsedMarkdown parsed = parser.parse("# Plain\n\ntext");

    assertFalse(parsed.present());
    assertTrue(parsed.frontMatter().isEmpty());
    assertEquals("# Plain\n\ntext", parsed.body());
  }

  @Test
  void unterminatedBlockIsAnError() {
    ParsedMarkdown parsed = parser.parse("---\nid: open\n# Heading\n");

    assertTrue(parsed.hasError());
    assertTrue(parsed.frontMatter().isEmpty());
  }

  @Test
  void oversizedBlockIsRejected() {
    String big = "key: " + "x".repeat(FrontMatterParser.MAX_FRONT_MATTER_BYTES + 1);
    ParsedMarkdown parsed = parser.parse("---\n" + big + "\n---\nBody\n");

    assertTrue(parsed.hasError());
    assertTrue(parsed.errorMessage().orElseThrow().contains("too large"));
    assertEquals("Body\n", parsed.body());
  }

  @Test
  void scalarFrontMatterIsNotAMapping() {
    ParsedMarkdown parsed = parser.parse("---\njust a string\n---\nBody");

    assertTrue(parsed.hasError());
    assertEquals("Body", parsed.body());
  }

  @Test
  void emptyInput() {
    ParsedMarkdown parsed = parser.parse("");

    assertFalse(parsed.present());
    assertEquals("", parsed.body());
  }
}
