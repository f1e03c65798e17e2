package com.storyforge.backend.conversation.extract;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.storyforge.backend.shared.json.JsonRepair;
import java.io.IOException;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Turns a raw model reply into the narrative text shown to the reader. Models are asked to answer
 * with a small JSON envelope, which is frequently truncated or wrapped in a code fence; plain
 * prose passes through untouched.
 *
 * <p>The extraction is repeated until a pass no longer shortens the text, so applying it to its
 * own output is a no-op. It never throws: any failure returns the input.
 */
@Slf4j
@Component
public class ResponseContentExtractor {

  static final List<String> NARRATIVE_FIELDS =
      List.of("story", "nextStory", "nextStrory", "next_story", "output_schema");

  private static final Pattern FIELD_VALUE =
      Pattern.compile(
          "\"(story|nextStory|nextStrory|next_story|output_schema)\"\\s*:\\s*\""
              + "([^\"\\\\]*+(?:\\\\.[^\"\\\\]*+)*+)",
          Pattern.DOTALL);

  private static final Pattern OPENING_FENCE = Pattern.compile("^```[\\w-]*[ \\t]*\\R?");
  private static final Pattern CLOSING_FENCE = Pattern.compile("\\R?```\\s*$");

  private final ObjectMapper objectMapper;

  public ResponseContentExtractor(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  public String extract(String raw) {
    if (raw == null) {
      return "";
    }
    try {
      String current = raw;
      while (true) {
        String next = extractOnce(current);
        // every productive pass shortens the text; anything else is the fixpoint
        if (next.length() >= current.length()) {
          return current;
        }
        current = next;
      }
    } catch (RuntimeException exception) {
      log.debug("Content extraction degraded to raw text: {}", exception.getMessage());
      return raw;
    }
  }

  String extractOnce(String text) {
    String normalized = text.replace("&lt;", "<").replace("&gt;", ">");
    String unfenced = stripFence(normalized.strip());
    if (!unfenced.startsWith("{") || !mentionsNarrativeField(unfenced)) {
      return unfenced.equals(normalized.strip()) ? normalized : unfenced;
    }

    Matcher matcher = FIELD_VALUE.matcher(unfenced);
    if (matcher.find()) {
      return unescape(matcher.group(2));
    }

    return parseRepaired(unfenced).orElse(unfenced);
  }

  private Optional<String> parseRepaired(String json) {
    JsonNode root;
    try {
      root = objectMapper.readTree(JsonRepair.repair(json));
    } catch (IOException exception) {
      log.debug("Reply looked like JSON but could not be parsed: {}", exception.getMessage());
      return Optional.empty();
    }
    return findNarrative(root, 0);
  }

  private Optional<String> findNarrative(JsonNode node, int depth) {
    if (node == null || !node.isObject() || depth > 3) {
      return Optional.empty();
    }
    for (String field : NARRATIVE_FIELDS) {
      JsonNode value = node.get(field);
      if (value == null) {
        continue;
      }
      if (value.isTextual()) {
        return Optional.of(value.asText());
      }
      Optional<String> nested = findNarrative(value, depth + 1);
      if (nested.isPresent()) {
        return nested;
      }
    }
    return Optional.empty();
  }

  private static boolean mentionsNarrativeField(String text) {
    for (String field : NARRATIVE_FIELDS) {
      if (text.contains("\"" + field + "\"")) {
        return true;
      }
    }
    return false;
  }

  public static String stripFence(String text) {
    if (!text.startsWith("```")) {
      return text;
    }
    String withoutOpening = OPENING_FENCE.matcher(text).replaceFirst("");
    return CLOSING_FENCE.matcher(withoutOpening).replaceFirst("").strip();
  }

  /** Decodes JSON string escapes in one left-to-right pass; unknown escapes are kept verbatim. */
  public static String unescape(String value) {
    StringBuilder out = new StringBuilder(value.length());
    int i = 0;
    while (i < value.length()) {
      char ch = value.charAt(i);
      if (ch != '\\' || i + 1 >= value.length()) {
        if (ch != '\\') {
          out.append(ch);
        }
        i++;
        continue;
      }
      char next = value.charAt(i + 1);
      switch (next) {
        case 'n' -> out.append('\n');
        case 't' -> out.append('\t');
        case 'r' -> out.append('\r');
        case '"' -> out.append('"');
        case '\'' -> out.append('\'');
        case '\\' -> out.append('\\');
        case '/' -> out.append('/');
        case 'u' -> {
          if (i + 6 <= value.length() && isHex(value, i + 2, i + 6)) {
            out.append((char) Integer.parseInt(value.substring(i + 2, i + 6), 16));
            i += 6;
            continue;
          }
          out.append('\\').append(next);
        }
        default -> out.append('\\').append(next);
      }
      i += 2;
    }
    return out.toString();
  }

  private static boolean isHex(String value, int from, int to) {
    for (int i = from; i < to; i++) {
      if (Character.digit(value.charAt(i), 16) < 0) {
        return false;
      }
    }
    return true;
  }
}
