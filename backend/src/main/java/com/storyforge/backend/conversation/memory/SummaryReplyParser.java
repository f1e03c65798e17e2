package com.storyforge.backend.conversation.memory;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.storyforge.backend.conversation.extract.ResponseContentExtractor;
import com.storyforge.backend.shared.json.JsonRepair;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.springframework.util.StringUtils;

/**
 * Reads the {@code {summary, keyPlotPoints}} object returned by the summarizer model. Tries a
 * plain parse, then a repaired parse, then field-level regexes; a reply that is not JSON at all is
 * taken as the summary itself with no plot points.
 */
@Slf4j
public class SummaryReplyParser {

  private static final Pattern SUMMARY_FIELD =
      Pattern.compile("\"summary\"\\s*:\\s*\"([^\"\\\\]*+(?:\\\\.[^\"\\\\]*+)*+)", Pattern.DOTALL);
  private static final Pattern PLOT_POINTS_FIELD =
      Pattern.compile("\"keyPlotPoints\"\\s*:\\s*\\[(.*?)(?:]|$)", Pattern.DOTALL);
  private static final Pattern STRING_ITEM =
      Pattern.compile("\"([^\"\\\\]*+(?:\\\\.[^\"\\\\]*+)*+)\"");

  private final ObjectMapper objectMapper;

  public SummaryReplyParser(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  public SummaryReply parse(String reply) {
    if (!StringUtils.hasText(reply)) {
      return new SummaryReply("", List.of());
    }
    String text = ResponseContentExtractor.stripFence(reply.strip());
    int start = text.indexOf('{');
    if (start < 0) {
      return new SummaryReply(text, List.of());
    }
    String candidate = text.substring(start);
    int end = candidate.lastIndexOf('}');
    String closed = end >= 0 ? candidate.substring(0, end + 1) : candidate;

    Optional<SummaryReply> parsed = readObject(closed);
    if (parsed.isEmpty()) {
      parsed = readObject(JsonRepair.repair(candidate));
    }
    if (parsed.isEmpty()) {
      parsed = readFields(candidate);
    }
    return parsed.orElseGet(() -> new SummaryReply(text, List.of()));
  }

  private Optional<SummaryReply> readObject(String json) {
    JsonNode root;
    try {
      root = objectMapper.readTree(json);
    } catch (IOException exception) {
      log.debug("Summary reply is not valid JSON: {}", exception.getMessage());
      return Optional.empty();
    }
    if (root == null || !root.isObject() || !(root.has("summary") || root.has("keyPlotPoints"))) {
      return Optional.empty();
    }
    List<String> points = new ArrayList<>();
    JsonNode pointsNode = root.path("keyPlotPoints");
    if (pointsNode.isArray()) {
      pointsNode.forEach(
          node -> {
            if (node.isTextual() && StringUtils.hasText(node.asText())) {
              points.add(node.asText().strip());
            }
          });
    }
    return Optional.of(new SummaryReply(root.path("summary").asText("").strip(), points));
  }

  private Optional<SummaryReply> readFields(String text) {
    Matcher summaryMatcher = SUMMARY_FIELD.matcher(text);
    Matcher pointsMatcher = PLOT_POINTS_FIELD.matcher(text);
    boolean hasSummary = summaryMatcher.find();
    boolean hasPoints = pointsMatcher.find();
    if (!hasSummary && !hasPoints) {
      return Optional.empty();
    }
    String summary = hasSummary ? ResponseContentExtractor.unescape(summaryMatcher.group(1)).strip() : "";
    List<String> points = new ArrayList<>();
    if (hasPoints) {
      Matcher item = STRING_ITEM.matcher(pointsMatcher.group(1));
      while (item.find()) {
        String point = ResponseContentExtractor.unescape(item.group(1)).strip();
        if (!point.isEmpty()) {
          points.add(point);
        }
      }
    }
    return Optional.of(new SummaryReply(summary, points));
  }

  public record SummaryReply(String summary, List<String> keyPlotPoints) {

    public SummaryReply {
      summary = summary != null ? summary : "";
      keyPlotPoints = keyPlotPoints != null ? List.copyOf(keyPlotPoints) : List.of();
    }
  }
}
