package com.storyforge.backend.conversation.persistence;

import com.storyforge.backend.conversation.domain.ConversationMemory;
import jakarta.persistence.LockModeType;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

@Repository
public interface ConversationMemoryRepository extends JpaRepository<ConversationMemory, UUID> {

  /** Row lock serializing counter updates, deletions and compaction commits per conversation. */
  @Lock(LockModeType.PESSIMISTIC_WRITE)
  @Query("select m from ConversationMemory m where m.conversationId = :conversationId")
  Optional<ConversationMemory> findForUpdate(@Param("conversationId") UUID conversationId);
}
