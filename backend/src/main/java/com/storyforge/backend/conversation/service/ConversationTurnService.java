package com.storyforge.backend.conversation.service;

import com.storyforge.backend.conversation.domain.ConversationMemory;
import com.storyforge.backend.conversation.domain.ConversationTurn;
import com.storyforge.backend.conversation.domain.MemorySnapshot;
import com.storyforge.backend.conversation.domain.TurnRole;
import com.storyforge.backend.conversation.error.ConversationException;
import com.storyforge.backend.conversation.memory.CompactionResult;
import com.storyforge.backend.conversation.persistence.ConversationMemoryRepository;
import com.storyforge.backend.conversation.persistence.ConversationTurnRepository;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

/**
 * Persistence of turns and of the memory counters. Every write that touches the counters holds
 * the memory row lock, so increments, deletions and compaction commits of one conversation are
 * applied one after the other.
 */
@Service
@Slf4j
public class ConversationTurnService {

  public static final int DEFAULT_LIST_LIMIT = 20;
  public static final int MAX_LIST_LIMIT = 1000;

  private final ConversationTurnRepository turnRepository;
  private final ConversationMemoryRepository memoryRepository;

  public ConversationTurnService(
      ConversationTurnRepository turnRepository, ConversationMemoryRepository memoryRepository) {
    this.turnRepository = turnRepository;
    this.memoryRepository = memoryRepository;
  }

  @Transactional
  public ConversationExchange registerUserMessage(
      UUID conversationId, String message, String speaker, int historyTurns) {
    if (!StringUtils.hasText(message)) {
      throw ConversationException.invalid("Message must not be empty");
    }
    ConversationMemory memory = lockMemory(conversationId);
    List<ConversationTurn> history = recent(conversationId, Math.max(0, historyTurns));
    ConversationTurn userTurn =
        turnRepository.save(
            new ConversationTurn(
                conversationId, TurnRole.USER, message, speaker, nextSequence(conversationId)));
    return new ConversationExchange(userTurn, history, memory.snapshot());
  }

  /** Stores the reply and counts it in the same transaction. */
  @Transactional
  public RecordedTurn registerAssistantReply(
      UUID conversationId, String text, String provider, String model) {
    ConversationMemory memory = lockMemory(conversationId);
    ConversationTurn turn =
        turnRepository.save(
            new ConversationTurn(
                conversationId,
                TurnRole.ASSISTANT,
                text,
                null,
                nextSequence(conversationId),
                provider,
                model));
    int count = memory.recordCompletedTurn();
    log.debug("Conversation {} completed assistant turn #{}", conversationId, count);
    return new RecordedTurn(turn, memory.snapshot());
  }

  @Transactional(readOnly = true)
  public List<ConversationTurn> listTurns(UUID conversationId, Integer limit) {
    return recent(conversationId, clampLimit(limit));
  }

  @Transactional(readOnly = true)
  public MemorySnapshot memory(UUID conversationId) {
    return memoryRepository
        .findById(conversationId)
        .map(ConversationMemory::snapshot)
        .orElseGet(() -> MemorySnapshot.empty(conversationId));
  }

  @Transactional
  public MemorySnapshot deleteTurn(UUID conversationId, UUID turnId) {
    ConversationMemory memory = lockMemory(conversationId);
    ConversationTurn turn =
        turnRepository
            .findByIdAndConversationId(turnId, conversationId)
            .orElseThrow(() -> ConversationException.notFound("Turn not found: " + turnId));
    remove(memory, turn);
    return memory.snapshot();
  }

  /** Deletes the trailing turn, or the trailing two turns when {@code pair} is set. */
  @Transactional
  public List<ConversationTurn> deleteLatest(UUID conversationId, boolean pair) {
    ConversationMemory memory = lockMemory(conversationId);
    List<ConversationTurn> trailing =
        turnRepository.findByConversationIdOrderBySequenceNumberDesc(
            conversationId, PageRequest.of(0, pair ? 2 : 1));
    if (trailing.isEmpty()) {
      throw ConversationException.notFound("Conversation has no turns: " + conversationId);
    }
    trailing.forEach(turn -> remove(memory, turn));
    List<ConversationTurn> deleted = new ArrayList<>(trailing);
    Collections.reverse(deleted);
    return deleted;
  }

  @Transactional
  public void reset(UUID conversationId) {
    ConversationMemory memory = lockMemory(conversationId);
    long deleted = turnRepository.deleteByConversationId(conversationId);
    memory.reset();
    log.info("Conversation {} reset, {} turns deleted", conversationId, deleted);
  }

  /**
   * Assistant turns written since the last compaction. When nothing is new and {@code
   * wholeHistoryWhenCaughtUp} is set, every assistant turn of the conversation is returned.
   */
  @Transactional(readOnly = true)
  public CompactionBatch compactionBatch(UUID conversationId, boolean wholeHistoryWhenCaughtUp) {
    MemorySnapshot memory = memory(conversationId);
    List<ConversationTurn> assistantTurns =
        turnRepository.findByConversationIdAndRoleOrderBySequenceNumberAsc(
            conversationId, TurnRole.ASSISTANT);
    int from = Math.min(memory.lastCompactedAtTurn(), assistantTurns.size());
    List<ConversationTurn> batch = assistantTurns.subList(from, assistantTurns.size());
    if (batch.isEmpty() && wholeHistoryWhenCaughtUp) {
      batch = assistantTurns;
    }
    return new CompactionBatch(memory, batch);
  }

  /**
   * Writes a compaction result. The marker is the counter value the batch was read at, clamped
   * to the current counter in case turns were deleted meanwhile.
   */
  @Transactional
  public MemorySnapshot commitCompaction(
      UUID conversationId, CompactionResult result, int compactedAtTurn) {
    ConversationMemory memory = lockMemory(conversationId);
    memory.applyCompaction(result.summary(), result.plotPoints(), compactedAtTurn);
    return memory.snapshot();
  }

  private void remove(ConversationMemory memory, ConversationTurn turn) {
    boolean compacted =
        turn.isAssistant() && assistantOrdinal(turn) <= memory.getLastCompactedAtTurn();
    turnRepository.delete(turn);
    if (turn.isAssistant()) {
      memory.forgetCompletedTurn(compacted);
    }
    log.debug(
        "Deleted {} turn {} of conversation {}",
        turn.getRole(),
        turn.getId(),
        turn.getConversationId());
  }

  /** 1-based position of an assistant turn among the assistant turns of its conversation. */
  private long assistantOrdinal(ConversationTurn turn) {
    return turnRepository.countByConversationIdAndRoleAndSequenceNumberLessThan(
            turn.getConversationId(), TurnRole.ASSISTANT, turn.getSequenceNumber())
        + 1;
  }

  private ConversationMemory lockMemory(UUID conversationId) {
    if (conversationId == null) {
      throw ConversationException.invalid("conversationId must not be null");
    }
    return memoryRepository
        .findForUpdate(conversationId)
        .orElseGet(() -> memoryRepository.saveAndFlush(new ConversationMemory(conversationId)));
  }

  private List<ConversationTurn> recent(UUID conversationId, int limit) {
    if (limit <= 0) {
      return List.of();
    }
    List<ConversationTurn> turns =
        new ArrayList<>(
            turnRepository.findByConversationIdOrderBySequenceNumberDesc(
                conversationId, PageRequest.of(0, limit)));
    Collections.reverse(turns);
    return turns;
  }

  private int nextSequence(UUID conversationId) {
    return turnRepository
        .findTopByConversationIdOrderBySequenceNumberDesc(conversationId)
        .map(turn -> turn.getSequenceNumber() + 1)
        .orElse(1);
  }

  static int clampLimit(Integer limit) {
    if (limit == null) {
      return DEFAULT_LIST_LIMIT;
    }
    return Math.max(1, Math.min(MAX_LIST_LIMIT, limit));
  }
}
