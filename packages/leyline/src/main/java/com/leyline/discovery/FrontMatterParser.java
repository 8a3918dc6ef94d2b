package com.leyline.discovery;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.leyline.utility.JacksonUtility;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Splits a markdown document into a YAML front-matter block and a body.
 *
 * <p>The block must start on the first line with {@code ---} and end with a line containing only
 * {@code ---}. Blocks larger than {@link #MAX_FRONT_MATTER_BYTES} are not parsed. Nested values are
 * flattened: sequences are joined with {@code ", "}, mappings are rendered as JSON.
 */
public final class FrontMatterParser {
  public static final int MAX_FRONT_MATTER_BYTES = 8 * 1024;

  private static final String MARKER = "---";

  private final ObjectMapper yaml = JacksonUtility.getYamlMapper();

  public ParsedMarkdown parse(String content) {
    if (content == null || content.isEmpty()) {
      return new ParsedMarkdown(Map.of(), "", false, null);
    }
    String text = content.replace("\r\n", "\n");
    if (text.charAt(0) == '\uFEFF') {
      text = text.substring(1);
    }
    int firstLineEnd = text.indexOf('\n');
    String firstLine = firstLineEnd < 0 ? text : text.substring(0, firstLineEnd);
    if (!MARKER.equals(firstLine.strip())) {
      return new ParsedMarkdown(Map.of(), text, false, null);
    }
    if (firstLineEnd < 0) {
      return new ParsedMarkdown(Map.of(), "", true, "unterminated front-matter");
    }

    int start = firstLineEnd + 1;
    int close = findClosingMarker(text, start);
    if (close < 0) {
      return new ParsedMarkdown(Map.of(), text.substring(start), true, "unterminated front-matter");
    }

    String block = text.substring(start, close);
    int bodyStart = text.indexOf('\n', close);
    String body = bodyStart < 0 ? "" : text.substring(bodyStart + 1);

    int blockBytes = block.getBytes(StandardCharsets.UTF_8).length;
    if (blockBytes > MAX_FRONT_MATTER_BYTES) {
      return new ParsedMarkdown(
          Map.of(), body, true, "front-matter too large (" + blockBytes + " bytes)");
    }
    if (block.isBlank()) {
      return new ParsedMarkdown(Map.of(), body, true, null);
    }

    try {
      JsonNode root = yaml.readTree(block);
      if (root == null || root.isMissingNode() || root.isNull()) {
        return new ParsedMarkdown(Map.of(), body, true, null);
      }
      if (!root.isObject()) {
        return new ParsedMarkdown(
            Map.of(), body, true, "front-matter is not a mapping: " + root.getNodeType());
      }
      return new ParsedMarkdown(flatten(root), body, true, null);
    } catch (Exception e) {
      return new ParsedMarkdown(Map.of(), body, true, "YAML parse error: " + e.getMessage());
    }
  }

  // Returns the index of the first character of a line that is exactly "---", or -1.
  private static int findClosingMarker(String text, int from) {
    int lineStart = from;
    while (lineStart <= text.length()) {
      int lineEnd = text.indexOf('\n', lineStart);
      String line = lineEnd < 0 ? text.substring(lineStart) : text.substring(lineStart, lineEnd);
      if (MARKER.equals(line.stripTrailing())) {
        return lineStart;
      }
      if (lineEnd < 0) return -1;
      lineStart = lineEnd + 1;
    }
    return -1;
  }

  private static Map<String, String> flatten(JsonNode root) {
    Map<String, String> out = new LinkedHashMap<>();
    Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
    while (fields.hasNext()) {
      Map.Entry<String, JsonNode> field = fields.next();
      JsonNode value = field.getValue();
      if (value == null || value.isNull()) continue;
      out.put(field.getKey(), render(value));
    }
    return out;
  }

  private static String render(JsonNode value) {
    if (value.isValueNode()) {
      return value.asText();
    }
    if (value.isArray()) {
      List<String> items = new ArrayList<>();
      value.forEach(item -> items.add(render(item)));
      return String.join(", ", items);
    }
    return value.toString();
  }
}
