package com.storyforge.backend.conversation.memory;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.storyforge.backend.conversation.config.ConversationMemoryProperties;
import com.storyforge.backend.conversation.credential.CredentialResolver;
import com.storyforge.backend.conversation.credential.ProviderCredential;
import com.storyforge.backend.conversation.domain.ConversationTurn;
import com.storyforge.backend.conversation.domain.MemorySnapshot;
import com.storyforge.backend.conversation.domain.TurnRole;
import com.storyforge.backend.conversation.error.ConversationErrorKind;
import com.storyforge.backend.conversation.error.ConversationException;
import com.storyforge.backend.conversation.provider.ProviderId;
import com.storyforge.backend.conversation.service.CompactionBatch;
import com.storyforge.backend.conversation.service.ConversationTurnService;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class MemoryCompactionServiceTest {

  private static final UUID CONVERSATION_ID = UUID.randomUUID();
  private static final ProviderCredential CREDENTIAL =
      new ProviderCredential(ProviderId.GEMINI, "key", "gemini-2.5-flash");
  private static final CompactionResult RESULT =
      new CompactionResult("Summary", "Summary", List.of("Point"), 1);

  @Mock private MemorySummarizer summarizer;
  @Mock private ConversationTurnService turnService;
  @Mock private CredentialResolver credentialResolver;

  private ConversationMemoryProperties properties;
  private SimpleMeterRegistry meterRegistry;
  private MemoryCompactionService service;

  @BeforeEach
  void setUp() {
    properties = new ConversationMemoryProperties();
    meterRegistry = new SimpleMeterRegistry();
    service =
        new MemoryCompactionService(
            properties,
            new CompactionTrigger(),
            summarizer,
            turnService,
            credentialResolver,
            meterRegistry);
  }

  @AfterEach
  void tearDown() {
    service.shutdown();
  }

  @Test
  void doesNothingBeforeTheTriggerFires() {
    assertThat(service.onAssistantTurn(snapshot(9, 0), "gemini")).isFalse();
    assertThat(service.onAssistantTurn(snapshot(19, 10), "gemini")).isFalse();

    verifyNoInteractions(turnService, summarizer, credentialResolver);
  }

  @Test
  void doesNothingWhenBackgroundCompactionIsDisabled() {
    properties.getSummarization().setEnabled(false);

    assertThat(service.onAssistantTurn(snapshot(10, 0), "gemini")).isFalse();

    verifyNoInteractions(turnService, summarizer, credentialResolver);
  }

  @Test
  void compactsInBackgroundAndCommitsAgainstTheBatchSnapshot() {
    MemorySnapshot batchMemory = snapshot(11, 0);
    when(turnService.compactionBatch(CONVERSATION_ID, false))
        .thenReturn(new CompactionBatch(batchMemory, List.of(assistantTurn())));
    when(credentialResolver.resolve(CONVERSATION_ID, "gemini", null))
        .thenReturn(Optional.of(CREDENTIAL));
    when(summarizer.compact(any(), eq(batchMemory), eq(CREDENTIAL))).thenReturn(Optional.of(RESULT));

    assertThat(service.onAssistantTurn(snapshot(10, 0), "gemini")).isTrue();

    verify(turnService, timeout(2000)).commitCompaction(CONVERSATION_ID, RESULT, 11);
    awaitTrue(() -> meterRegistry.counter("conversation_compaction_runs_total").count() == 1d);
    assertThat(service.isRunning(CONVERSATION_ID)).isFalse();
  }

  @Test
  void failedCompactionLeavesMemoryUntouched() {
    when(turnService.compactionBatch(CONVERSATION_ID, false))
        .thenReturn(new CompactionBatch(snapshot(10, 0), List.of(assistantTurn())));
    when(credentialResolver.resolve(CONVERSATION_ID, "gemini", null))
        .thenReturn(Optional.of(CREDENTIAL));
    when(summarizer.compact(any(), any(), any())).thenReturn(Optional.empty());

    assertThat(service.onAssistantTurn(snapshot(10, 0), "gemini")).isTrue();

    awaitTrue(() -> meterRegistry.counter("conversation_compaction_failures_total").count() == 1d);
    awaitTrue(() -> !service.isRunning(CONVERSATION_ID));
    verify(turnService, never()).commitCompaction(any(), any(), anyInt());
  }

  @Test
  void secondRequestIsSkippedWhileOneIsRunning() throws InterruptedException {
    CountDownLatch started = new CountDownLatch(1);
    CountDownLatch release = new CountDownLatch(1);
    when(turnService.compactionBatch(CONVERSATION_ID, false))
        .thenReturn(new CompactionBatch(snapshot(10, 0), List.of(assistantTurn())));
    when(credentialResolver.resolve(CONVERSATION_ID, "gemini", null))
        .thenReturn(Optional.of(CREDENTIAL));
    when(summarizer.compact(any(), any(), any()))
        .thenAnswer(
            invocation -> {
              started.countDown();
              release.await(5, TimeUnit.SECONDS);
              return Optional.of(RESULT);
            });

    assertThat(service.onAssistantTurn(snapshot(10, 0), "gemini")).isTrue();
    assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();

    assertThat(service.onAssistantTurn(snapshot(11, 0), "gemini")).isFalse();
    assertThat(meterRegistry.counter("conversation_compaction_skipped_total").count()).isEqualTo(1d);
    assertThatThrownBy(() -> service.compactNow(CONVERSATION_ID, "gemini", null))
        .isInstanceOf(ConversationException.class)
        .extracting(error -> ((ConversationException) error).kind())
        .isEqualTo(ConversationErrorKind.COMPACTION_FAILED);

    release.countDown();
    verify(turnService, timeout(2000)).commitCompaction(CONVERSATION_ID, RESULT, 10);
  }

  @Test
  void compactNowSummarizesWholeHistoryWhenCaughtUp() {
    MemorySnapshot memory = snapshot(20, 20);
    when(turnService.compactionBatch(CONVERSATION_ID, true))
        .thenReturn(new CompactionBatch(memory, List.of(assistantTurn(), assistantTurn())));
    when(credentialResolver.resolve(CONVERSATION_ID, "gemini", "gemini-2.5-pro"))
        .thenReturn(Optional.of(CREDENTIAL));
    when(summarizer.summarize(any(), eq(memory), eq(CREDENTIAL))).thenReturn(RESULT);

    CompactionResult result = service.compactNow(CONVERSATION_ID, "gemini", "gemini-2.5-pro");

    assertThat(result).isEqualTo(RESULT);
    verify(turnService).commitCompaction(CONVERSATION_ID, RESULT, 20);
    assertThat(service.isRunning(CONVERSATION_ID)).isFalse();
  }

  @Test
  void compactNowRejectsConversationWithoutReplies() {
    when(turnService.compactionBatch(CONVERSATION_ID, true))
        .thenReturn(new CompactionBatch(snapshot(0, 0), List.of()));

    assertThatThrownBy(() -> service.compactNow(CONVERSATION_ID, null, null))
        .isInstanceOf(ConversationException.class)
        .extracting(error -> ((ConversationException) error).kind())
        .isEqualTo(ConversationErrorKind.INVALID_REQUEST);
    verifyNoInteractions(summarizer);
  }

  @Test
  void compactNowFailureIsReportedAndNothingIsCommitted() {
    when(turnService.compactionBatch(CONVERSATION_ID, true))
        .thenReturn(new CompactionBatch(snapshot(10, 0), List.of(assistantTurn())));
    when(credentialResolver.resolve(CONVERSATION_ID, null, null)).thenReturn(Optional.of(CREDENTIAL));
    when(summarizer.summarize(any(), any(), any()))
        .thenThrow(new ConversationException(ConversationErrorKind.COMPACTION_FAILED, "boom"));

    assertThatThrownBy(() -> service.compactNow(CONVERSATION_ID, null, null))
        .isInstanceOf(ConversationException.class)
        .hasMessage("boom");

    verify(turnService, never()).commitCompaction(any(), any(), anyInt());
    assertThat(meterRegistry.counter("conversation_compaction_failures_total").count()).isEqualTo(1d);
    assertThat(service.isRunning(CONVERSATION_ID)).isFalse();
  }

  @Test
  void compactNowWithoutCredentialFails() {
    when(turnService.compactionBatch(CONVERSATION_ID, true))
        .thenReturn(new CompactionBatch(snapshot(10, 0), List.of(assistantTurn())));
    when(credentialResolver.resolve(CONVERSATION_ID, "claude", null)).thenReturn(Optional.empty());

    assertThatThrownBy(() -> service.compactNow(CONVERSATION_ID, "claude", null))
        .isInstanceOf(ConversationException.class)
        .extracting(error -> ((ConversationException) error).kind())
        .isEqualTo(ConversationErrorKind.CREDENTIAL_MISSING);
  }

  @Test
  void summarizationProviderOverridesTheTurnProvider() {
    properties.getSummarization().setProvider("claude");
    when(turnService.compactionBatch(CONVERSATION_ID, true))
        .thenReturn(new CompactionBatch(snapshot(10, 0), List.of(assistantTurn())));
    when(credentialResolver.resolve(CONVERSATION_ID, "claude", null))
        .thenReturn(Optional.of(CREDENTIAL));
    when(summarizer.summarize(any(), any(), any())).thenReturn(RESULT);

    service.compactNow(CONVERSATION_ID, "gemini", null);

    verify(credentialResolver).resolve(CONVERSATION_ID, "claude", null);
  }

  private static MemorySnapshot snapshot(int completed, int lastCompacted) {
    return new MemorySnapshot(CONVERSATION_ID, null, List.of(), completed, lastCompacted);
  }

  private static ConversationTurn assistantTurn() {
    return new ConversationTurn(CONVERSATION_ID, TurnRole.ASSISTANT, "The gate opens.", null, 2);
  }

  private static void awaitTrue(BooleanSupplier condition) {
    long deadline = System.currentTimeMillis() + 2000;
    while (!condition.getAsBoolean()) {
      if (System.currentTimeMillis() > deadline) {
        throw new AssertionError("Condition not met within 2 seconds");
      }
      Thread.onSpinWait();
    }
  }
}
