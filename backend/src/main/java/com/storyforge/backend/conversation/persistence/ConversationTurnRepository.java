package com.storyforge.backend.conversation.persistence;

import com.storyforge.backend.conversation.domain.ConversationTurn;
import com.storyforge.backend.conversation.domain.TurnRole;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface ConversationTurnRepository extends JpaRepository<ConversationTurn, UUID> {

  List<ConversationTurn> findByConversationIdOrderBySequenceNumberAsc(UUID conversationId);

  List<ConversationTurn> findByConversationIdAndRoleOrderBySequenceNumberAsc(
      UUID conversationId, TurnRole role);

  List<ConversationTurn> findByConversationIdOrderBySequenceNumberDesc(
      UUID conversationId, Pageable pageable);

  Optional<ConversationTurn> findTopByConversationIdOrderBySequenceNumberDesc(UUID conversationId);

  Optional<ConversationTurn> findByIdAndConversationId(UUID id, UUID conversationId);

  long countByConversationIdAndRole(UUID conversationId, TurnRole role);

  long countByConversationIdAndRoleAndSequenceNumberLessThan(
      UUID conversationId, TurnRole role, Integer sequenceNumber);

  long deleteByConversationId(UUID conversationId);
}
