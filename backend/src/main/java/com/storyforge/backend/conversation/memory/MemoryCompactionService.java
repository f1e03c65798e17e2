package com.storyforge.backend.conversation.memory;

import com.storyforge.backend.conversation.config.ConversationMemoryProperties;
import com.storyforge.backend.conversation.credential.CredentialResolver;
import com.storyforge.backend.conversation.credential.ProviderCredential;
import com.storyforge.backend.conversation.domain.MemorySnapshot;
import com.storyforge.backend.conversation.error.ConversationErrorKind;
import com.storyforge.backend.conversation.error.ConversationException;
import com.storyforge.backend.conversation.service.CompactionBatch;
import com.storyforge.backend.conversation.service.ConversationTurnService;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PreDestroy;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import lombok.extern.slf4j.Slf4j;
import org.springframework.util.StringUtils;

/**
 * Runs compactions after assistant turns on a bounded background pool, and on demand.
 *
 * <p>At most one compaction per conversation runs at a time. A request arriving while one is in
 * flight is dropped; the overdue rule of {@link CompactionTrigger} picks it up on a later turn.
 * A failed compaction leaves the memory untouched.
 */
@Slf4j
public class MemoryCompactionService {

  private static final String COMPACTION_RUNS_METRIC = "conversation_compaction_runs_total";
  private static final String COMPACTION_DURATION_METRIC = "conversation_compaction_duration_seconds";
  private static final String COMPACTION_FAILURE_METRIC = "conversation_compaction_failures_total";
  private static final String COMPACTION_ALERT_METRIC = "conversation_compaction_failure_alerts_total";
  private static final String COMPACTION_SKIPPED_METRIC = "conversation_compaction_skipped_total";
  private static final String COMPACTION_QUEUE_METRIC = "conversation_compaction_queue_size";
  private static final String COMPACTION_REJECTIONS_METRIC =
      "conversation_compaction_queue_rejections_total";
  private static final int FAILURE_ALERT_THRESHOLD = 3;
  private static final AtomicInteger WORKER_SEQUENCE = new AtomicInteger();

  private final ConversationMemoryProperties properties;
  private final CompactionTrigger trigger;
  private final MemorySummarizer summarizer;
  private final ConversationTurnService turnService;
  private final CredentialResolver credentialResolver;
  private final ThreadPoolExecutor compactionExecutor;
  private final Set<UUID> inFlight = ConcurrentHashMap.newKeySet();
  private final ConcurrentMap<UUID, AtomicInteger> failureCounts = new ConcurrentHashMap<>();
  private final Counter runCounter;
  private final Timer runTimer;
  private final Counter failureCounter;
  private final Counter failureAlertCounter;
  private final Counter skippedCounter;
  private final Counter queueRejectedCounter;

  public MemoryCompactionService(
      ConversationMemoryProperties properties,
      CompactionTrigger trigger,
      MemorySummarizer summarizer,
      ConversationTurnService turnService,
      CredentialResolver credentialResolver,
      MeterRegistry meterRegistry) {
    this.properties = Objects.requireNonNull(properties, "properties must not be null");
    this.trigger = Objects.requireNonNull(trigger, "trigger must not be null");
    this.summarizer = Objects.requireNonNull(summarizer, "summarizer must not be null");
    this.turnService = Objects.requireNonNull(turnService, "turnService must not be null");
    this.credentialResolver =
        Objects.requireNonNull(credentialResolver, "credentialResolver must not be null");

    ConversationMemoryProperties.SummarizationProperties summarization = properties.getSummarization();
    int concurrency = Math.max(1, summarization.getMaxConcurrentCompactions());
    int queueSize = Math.max(concurrency, summarization.getMaxQueueSize());
    this.compactionExecutor = buildExecutor(concurrency, queueSize);

    if (meterRegistry != null) {
      this.runCounter =
          Counter.builder(COMPACTION_RUNS_METRIC)
              .description("Number of successful conversation memory compactions")
              .register(meterRegistry);
      this.runTimer =
          Timer.builder(COMPACTION_DURATION_METRIC)
              .description("Latency of conversation memory compaction")
              .register(meterRegistry);
      this.failureCounter =
          Counter.builder(COMPACTION_FAILURE_METRIC)
              .description("Number of failed conversation memory compactions")
              .register(meterRegistry);
      this.failureAlertCounter =
          Counter.builder(COMPACTION_ALERT_METRIC)
              .description("Number of times compaction failures reached the alert threshold")
              .register(meterRegistry);
      this.skippedCounter =
          Counter.builder(COMPACTION_SKIPPED_METRIC)
              .description("Compaction requests dropped because one was already running")
              .register(meterRegistry);
      Gauge.builder(COMPACTION_QUEUE_METRIC, compactionExecutor, exec -> exec.getQueue().size())
          .description("Number of compactions waiting in queue")
          .register(meterRegistry);
      this.queueRejectedCounter =
          Counter.builder(COMPACTION_REJECTIONS_METRIC)
              .description("Number of compactions dropped due to a full queue")
              .register(meterRegistry);
    } else {
      this.runCounter = null;
      this.runTimer = null;
      this.failureCounter = null;
      this.failureAlertCounter = null;
      this.skippedCounter = null;
      this.queueRejectedCounter = null;
    }
  }

  @PreDestroy
  void shutdown() {
    compactionExecutor.shutdownNow();
  }

  private ThreadPoolExecutor buildExecutor(int concurrency, int queueSize) {
    BlockingQueue<Runnable> queue = new ArrayBlockingQueue<>(queueSize, true);
    ThreadFactory factory =
        runnable -> {
          Thread thread = new Thread(runnable);
          thread.setName("conversation-compaction-" + WORKER_SEQUENCE.incrementAndGet());
          thread.setDaemon(true);
          return thread;
        };
    return new ThreadPoolExecutor(concurrency, concurrency, 0L, TimeUnit.MILLISECONDS, queue, factory);
  }

  public boolean isEnabled() {
    return properties.getSummarization() != null && properties.getSummarization().isEnabled();
  }

  /**
   * Evaluates the trigger for the counters right after an assistant turn was stored and, when it
   * fires, queues a compaction. Returns immediately.
   *
   * @return whether a compaction was queued
   */
  public boolean onAssistantTurn(MemorySnapshot memory, String providerId) {
    if (!isEnabled() || memory == null) {
      return false;
    }
    if (!trigger.shouldCompact(memory.completedTurnCount(), memory.lastCompactedAtTurn())) {
      return false;
    }
    UUID conversationId = memory.conversationId();
    if (!inFlight.add(conversationId)) {
      log.debug("Compaction already running for conversation {}, skipping", conversationId);
      if (skippedCounter != null) {
        skippedCounter.increment();
      }
      return false;
    }
    log.info(
        "Compaction scheduled for conversation {} at turn {} (last compacted at {})",
        conversationId,
        memory.completedTurnCount(),
        memory.lastCompactedAtTurn());
    try {
      compactionExecutor.execute(() -> runInBackground(conversationId, providerId));
      return true;
    } catch (RejectedExecutionException rejectedExecutionException) {
      inFlight.remove(conversationId);
      if (queueRejectedCounter != null) {
        queueRejectedCounter.increment();
      }
      recordFailure(conversationId, "Compaction queue saturated", null);
      return false;
    }
  }

  /**
   * Compacts synchronously. Uses the turns since the last compaction, or the whole assistant
   * history when nothing is new.
   *
   * @throws ConversationException when the conversation is busy, empty, has no usable credential
   *     or the summarizer fails
   */
  public CompactionResult compactNow(UUID conversationId, String providerId, String modelId) {
    if (!inFlight.add(conversationId)) {
      throw new ConversationException(
          ConversationErrorKind.COMPACTION_FAILED,
          "A compaction is already running for this conversation");
    }
    try {
      CompactionBatch batch = turnService.compactionBatch(conversationId, true);
      if (batch.isEmpty()) {
        throw ConversationException.invalid("Conversation has no narrator replies to summarize");
      }
      ProviderCredential credential = resolveCredential(conversationId, providerId, modelId);
      long start = System.nanoTime();
      CompactionResult result;
      try {
        result = summarizer.summarize(batch.turns(), batch.memory(), credential);
      } catch (ConversationException exception) {
        recordFailure(conversationId, exception.getMessage(), exception);
        throw exception;
      }
      turnService.commitCompaction(conversationId, result, batch.memory().completedTurnCount());
      recordSuccess(conversationId, credential, result, System.nanoTime() - start);
      return result;
    } finally {
      inFlight.remove(conversationId);
    }
  }

  boolean isRunning(UUID conversationId) {
    return inFlight.contains(conversationId);
  }

  private void runInBackground(UUID conversationId, String providerId) {
    long start = System.nanoTime();
    try {
      CompactionBatch batch = turnService.compactionBatch(conversationId, false);
      if (batch.isEmpty()) {
        log.debug("Nothing to compact for conversation {}", conversationId);
        return;
      }
      ProviderCredential credential = resolveCredential(conversationId, providerId, null);
      Optional<CompactionResult> result =
          summarizer.compact(batch.turns(), batch.memory(), credential);
      if (result.isEmpty()) {
        recordFailure(conversationId, "Summarizer returned no result", null);
        return;
      }
      turnService.commitCompaction(
          conversationId, result.get(), batch.memory().completedTurnCount());
      recordSuccess(conversationId, credential, result.get(), System.nanoTime() - start);
    } catch (RuntimeException exception) {
      recordFailure(conversationId, exception.getMessage(), exception);
    } finally {
      inFlight.remove(conversationId);
    }
  }

  private ProviderCredential resolveCredential(
      UUID conversationId, String providerId, String modelId) {
    ConversationMemoryProperties.SummarizationProperties summarization = properties.getSummarization();
    String provider =
        StringUtils.hasText(summarization.getProvider()) ? summarization.getProvider() : providerId;
    return credentialResolver
        .resolve(conversationId, provider, modelId)
        .orElseThrow(
            () ->
                ConversationException.credentialMissing(
                    "No API key available to summarize conversation " + conversationId));
  }

  private void recordSuccess(
      UUID conversationId, ProviderCredential credential, CompactionResult result, long durationNanos) {
    failureCounts.remove(conversationId);
    if (runCounter != null) {
      runCounter.increment();
    }
    if (runTimer != null) {
      runTimer.record(durationNanos, TimeUnit.NANOSECONDS);
    }
    log.info(
        "Compacted conversation {} with {}:{} ({} replies, {} plot points, {} ms)",
        conversationId,
        credential.providerId().id(),
        credential.modelId(),
        result.messageCount(),
        result.plotPoints().size(),
        TimeUnit.NANOSECONDS.toMillis(durationNanos));
  }

  private void recordFailure(UUID conversationId, String reason, Exception exception) {
    if (failureCounter != null) {
      failureCounter.increment();
    }
    int current =
        failureCounts.computeIfAbsent(conversationId, key -> new AtomicInteger()).incrementAndGet();
    if (current >= FAILURE_ALERT_THRESHOLD) {
      if (failureAlertCounter != null) {
        failureAlertCounter.increment();
      }
      log.error(
          "Compaction repeatedly failed for conversation {} ({} consecutive errors): {}",
          conversationId,
          current,
          reason,
          exception);
    } else if (exception != null) {
      log.warn(
          "Compaction failed for conversation {} ({} consecutive errors, alert at {}): {}",
          conversationId,
          current,
          FAILURE_ALERT_THRESHOLD,
          reason,
          exception);
    } else {
      log.warn(
          "Compaction failed for conversation {} ({} consecutive errors, alert at {}): {}",
          conversationId,
          current,
          FAILURE_ALERT_THRESHOLD,
          reason);
    }
  }
}
