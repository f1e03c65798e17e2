package com.storyforge.backend.conversation.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "app.conversation.stream")
public class ConversationStreamProperties {

  /** Number of most recent turns sent to the provider alongside the compacted memory. */
  private int historyTurns = 20;

  /**
   * Maximum characters per forwarded partial event. Upstream chunks longer than this are split;
   * {@code 0} forwards chunks as received.
   */
  private int chunkSize = 0;

  /** Lifetime of the client event stream before it is closed as timed out. */
  private Duration emitterTimeout = Duration.ofMinutes(5);

  public int getHistoryTurns() {
    return historyTurns;
  }

  public void setHistoryTurns(int historyTurns) {
    this.historyTurns = historyTurns;
  }

  public int getChunkSize() {
    return chunkSize;
  }

  public void setChunkSize(int chunkSize) {
    this.chunkSize = chunkSize;
  }

  public Duration getEmitterTimeout() {
    return emitterTimeout;
  }

  public void setEmitterTimeout(Duration emitterTimeout) {
    this.emitterTimeout = emitterTimeout;
  }
}
