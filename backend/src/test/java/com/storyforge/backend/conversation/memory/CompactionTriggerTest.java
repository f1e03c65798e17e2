package com.storyforge.backend.conversation.memory;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class CompactionTriggerTest {

  private final CompactionTrigger trigger = new CompactionTrigger();

  @ParameterizedTest
  @CsvSource({
    "0, 0, false",
    "9, 0, false",
    "10, 0, true",
    "11, 10, false",
    "15, 0, true",
    "19, 10, false",
    "20, 10, true",
    "20, 20, true",
    "21, 20, false",
    "25, 15, true",
    "30, 29, true"
  })
  void firesOnScheduleOrWhenOverdue(int completed, int lastCompacted, boolean expected) {
    assertThat(trigger.shouldCompact(completed, lastCompacted)).isEqualTo(expected);
  }

  @Test
  void matchesClosedFormForAllSmallCounters() {
    for (int completed = 0; completed <= 60; completed++) {
      for (int last = 0; last <= completed; last++) {
        boolean expected = completed >= 10 && (completed % 10 == 0 || completed - last >= 10);
        assertThat(trigger.shouldCompact(completed, last))
            .as("completed=%d last=%d", completed, last)
            .isEqualTo(expected);
        assertThat(trigger.shouldCompact(completed, last))
            .isEqualTo(trigger.shouldCompact(completed, last));
      }
    }
  }

  @Test
  void failedCompactionIsRetriedByLaterTurns() {
    int lastCompacted = 0;

    assertThat(trigger.shouldCompact(9, lastCompacted)).isFalse();
    assertThat(trigger.shouldCompact(10, lastCompacted)).isTrue();
    // the compaction at turn 10 failed, so the marker stays at 0
    for (int completed = 11; completed <= 19; completed++) {
      assertThat(trigger.isOverdue(completed, lastCompacted)).isTrue();
    }
    assertThat(trigger.isScheduled(20)).isTrue();
    assertThat(trigger.isOverdue(20, lastCompacted)).isTrue();
    assertThat(trigger.shouldCompact(20, lastCompacted)).isTrue();
  }

  @Test
  void honoursCustomInterval() {
    CompactionTrigger everyFive = new CompactionTrigger(5);

    assertThat(everyFive.shouldCompact(4, 0)).isFalse();
    assertThat(everyFive.shouldCompact(5, 0)).isTrue();
    assertThat(everyFive.shouldCompact(6, 5)).isFalse();
  }

  @Test
  void rejectsNonPositiveInterval() {
    assertThatThrownBy(() -> new CompactionTrigger(0)).isInstanceOf(IllegalArgumentException.class);
  }
}
