package com.storyforge.backend.conversation.memory;

import com.storyforge.backend.conversation.config.ConversationMemoryProperties;
import com.storyforge.backend.conversation.credential.ProviderCredential;
import com.storyforge.backend.conversation.domain.ConversationTurn;
import com.storyforge.backend.conversation.domain.MemorySnapshot;
import com.storyforge.backend.conversation.error.ConversationErrorKind;
import com.storyforge.backend.conversation.error.ConversationException;
import com.storyforge.backend.conversation.memory.SummaryReplyParser.SummaryReply;
import com.storyforge.backend.conversation.provider.ProviderAdapterRegistry;
import com.storyforge.backend.conversation.provider.model.ProviderCompletion;
import com.storyforge.backend.conversation.provider.model.ProviderRequest;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.util.StringUtils;

/**
 * Folds a batch of assistant turns into the rolling summary and plot point list of a
 * conversation. Talks to the provider through the same adapters as the stream relay, using the
 * non-streaming call.
 */
@Slf4j
public class MemorySummarizer {

  static final String SYSTEM_PROMPT =
      "You maintain the long-term memory of an interactive story. Answer with a single JSON"
          + " object and nothing else. Write in the language of the story.";

  static final String DEFAULT_PROMPT_TEMPLATE =
      """
      Update the memory of the story below.

      [Current summary]
      {existingSummary}

      [Current key plot points]
      {existingPlotPoints}

      [Archived plot points]
      {archivedPlotPoints}

      [Latest {messageCount} narrator replies]
      {aiMessages}

      Return JSON of the form {"summary": "...", "keyPlotPoints": ["...", "..."]} where:
      - "summary" is the whole story so far in about {summaryCharacterTarget} characters, \
      merging the current summary, the archived plot points and the new replies;
      - "keyPlotPoints" lists only the notable new events of the latest replies, one short \
      sentence each, at most {maxPlotPoints} entries, without repeating current plot points.
      """;

  private static final String NONE = "(none)";

  private final ConversationMemoryProperties properties;
  private final ProviderAdapterRegistry adapterRegistry;
  private final SummaryReplyParser replyParser;

  public MemorySummarizer(
      ConversationMemoryProperties properties,
      ProviderAdapterRegistry adapterRegistry,
      SummaryReplyParser replyParser) {
    this.properties = properties;
    this.adapterRegistry = adapterRegistry;
    this.replyParser = replyParser;
  }

  /** Never throws; an empty result means the memory must be left as it is. */
  public Optional<CompactionResult> compact(
      List<ConversationTurn> turns, MemorySnapshot priorMemory, ProviderCredential credential) {
    try {
      return Optional.of(summarize(turns, priorMemory, credential));
    } catch (RuntimeException exception) {
      log.warn(
          "Compaction of conversation {} failed: {}",
          priorMemory != null ? priorMemory.conversationId() : null,
          exception.getMessage());
      return Optional.empty();
    }
  }

  /**
   * Same as {@link #compact} but reports the failure.
   *
   * @throws ConversationException of kind {@link ConversationErrorKind#COMPACTION_FAILED}
   */
  public CompactionResult summarize(
      List<ConversationTurn> turns, MemorySnapshot priorMemory, ProviderCredential credential) {
    List<String> aiMessages =
        turns == null
            ? List.of()
            : turns.stream()
                .filter(ConversationTurn::isAssistant)
                .map(ConversationTurn::getText)
                .filter(StringUtils::hasText)
                .toList();
    if (aiMessages.isEmpty()) {
      throw new ConversationException(
          ConversationErrorKind.COMPACTION_FAILED, "There are no narrator replies to summarize");
    }

    int maxPlotPoints = Math.max(1, properties.getMaxPlotPoints());
    List<String> prior = priorMemory.plotPoints();
    int overflow = Math.max(0, prior.size() - maxPlotPoints);
    List<String> archived = prior.subList(0, overflow);
    List<String> retained = prior.subList(overflow, prior.size());

    String prompt = buildPrompt(priorMemory.summaryText(), retained, archived, aiMessages);
    ProviderCompletion completion;
    try {
      completion =
          adapterRegistry
              .require(credential.providerId())
              .complete(request(credential, prompt))
              .block();
    } catch (RuntimeException exception) {
      throw new ConversationException(
          ConversationErrorKind.COMPACTION_FAILED,
          "Summary request failed: " + exception.getMessage(),
          exception);
    }
    if (completion == null || !StringUtils.hasText(completion.text())) {
      throw new ConversationException(
          ConversationErrorKind.COMPACTION_FAILED, "The model returned an empty summary");
    }

    SummaryReply reply = replyParser.parse(completion.text());
    String summary =
        StringUtils.hasText(reply.summary()) ? reply.summary() : priorMemory.summaryText();
    List<String> merged = mergePlotPoints(retained, reply.keyPlotPoints(), maxPlotPoints);
    log.debug(
        "Compacted {} replies of conversation {} into {} plot points",
        aiMessages.size(),
        priorMemory.conversationId(),
        merged.size());
    return new CompactionResult(summary, reply.summary(), merged, aiMessages.size());
  }

  private ProviderRequest request(ProviderCredential credential, String prompt) {
    ConversationMemoryProperties.SummarizationProperties summarization =
        properties.getSummarization();
    ProviderCredential effective =
        StringUtils.hasText(summarization.getModel())
            ? credential.withModel(summarization.getModel().trim())
            : credential;
    return new ProviderRequest(
        effective,
        SYSTEM_PROMPT,
        List.of(),
        prompt,
        summarization.getTemperature(),
        summarization.getMaxOutputTokens());
  }

  String buildPrompt(
      String existingSummary, List<String> retained, List<String> archived, List<String> aiMessages) {
    String template = properties.getSummarization().getPromptTemplate();
    if (!StringUtils.hasText(template)) {
      template = DEFAULT_PROMPT_TEMPLATE;
    }
    return template
        .replace("{existingSummary}", StringUtils.hasText(existingSummary) ? existingSummary : NONE)
        .replace("{existingPlotPoints}", bulletList(retained))
        .replace("{archivedPlotPoints}", bulletList(archived))
        .replace("{messageCount}", Integer.toString(aiMessages.size()))
        .replace("{maxPlotPoints}", Integer.toString(properties.getMaxPlotPoints()))
        .replace(
            "{summaryCharacterTarget}", Integer.toString(properties.getSummaryCharacterTarget()))
        .replace("{aiMessages}", String.join("\n\n", aiMessages));
  }

  /**
   * Appends proposed points that are not a case-insensitive substring of an existing point (or
   * the other way round), then keeps the most recent {@code maxPlotPoints}.
   */
  static List<String> mergePlotPoints(List<String> existing, List<String> proposed, int maxPlotPoints) {
    List<String> merged = new ArrayList<>();
    for (String point : existing) {
      if (StringUtils.hasText(point)) {
        merged.add(point.strip());
      }
    }
    if (proposed != null) {
      for (String point : proposed) {
        if (!StringUtils.hasText(point)) {
          continue;
        }
        String candidate = point.strip();
        if (!isDuplicate(merged, candidate)) {
          merged.add(candidate);
        }
      }
    }
    int from = Math.max(0, merged.size() - maxPlotPoints);
    return List.copyOf(merged.subList(from, merged.size()));
  }

  private static boolean isDuplicate(List<String> points, String candidate) {
    String normalized = candidate.toLowerCase(Locale.ROOT);
    for (String point : points) {
      String other = point.toLowerCase(Locale.ROOT);
      if (other.contains(normalized) || normalized.contains(other)) {
        return true;
      }
    }
    return false;
  }

  private static String bulletList(List<String> points) {
    if (points == null || points.isEmpty()) {
      return NONE;
    }
    return points.stream().map(point -> "- " + point).collect(Collectors.joining("\n"));
  }
}
