package com.storyforge.backend.conversation.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "app.conversation.memory")
public class ConversationMemoryProperties {

  /**
   * Number of assistant turns between scheduled compactions. The same value bounds how far the
   * compaction marker may lag behind before a compaction is forced.
   */
  private int compactionInterval = 10;

  /** Hard cap of the structured plot point list. */
  private int maxPlotPoints = 20;

  /** Soft length target for the rolling summary, communicated to the model only. */
  private int summaryCharacterTarget = 500;

  private SummarizationProperties summarization = new SummarizationProperties();

  public int getCompactionInterval() {
    return compactionInterval;
  }

  public void setCompactionInterval(int compactionInterval) {
    this.compactionInterval = compactionInterval;
  }

  public int getMaxPlotPoints() {
    return maxPlotPoints;
  }

  public void setMaxPlotPoints(int maxPlotPoints) {
    this.maxPlotPoints = maxPlotPoints;
  }

  public int getSummaryCharacterTarget() {
    return summaryCharacterTarget;
  }

  public void setSummaryCharacterTarget(int summaryCharacterTarget) {
    this.summaryCharacterTarget = summaryCharacterTarget;
  }

  public SummarizationProperties getSummarization() {
    return summarization;
  }

  public void setSummarization(SummarizationProperties summarization) {
    this.summarization = summarization;
  }

  public static class SummarizationProperties {

    /** Enables background compaction after assistant turns. Manual compaction is always available. */
    private boolean enabled = true;

    /**
     * Provider used for summaries. When blank the provider of the turn that triggered the
     * compaction is reused.
     */
    private String provider;

    /** Model used for summaries; falls back to the credential's model. */
    private String model;

    private double temperature = 0.5d;
    private int maxOutputTokens = 2048;

    /** Maximum number of compactions executed at the same time. */
    private int maxConcurrentCompactions = 2;

    /** Maximum number of compactions waiting in the queue before new ones are rejected. */
    private int maxQueueSize = 100;

    /**
     * Custom prompt. Supports {@code {existingSummary}}, {@code {messageCount}}, {@code
     * {aiMessages}}, {@code {archivedPlotPoints}}, {@code {existingPlotPoints}}, {@code
     * {maxPlotPoints}} and {@code {summaryCharacterTarget}} placeholders.
     */
    private String promptTemplate;

    public boolean isEnabled() {
      return enabled;
    }

    public void setEnabled(boolean enabled) {
      this.enabled = enabled;
    }

    public String getProvider() {
      return provider;
    }

    public void setProvider(String provider) {
      this.provider = provider;
    }

    public String getModel() {
      return model;
    }

    public void setModel(String model) {
      this.model = model;
    }

    public double getTemperature() {
      return temperature;
    }

    public void setTemperature(double temperature) {
      this.temperature = temperature;
    }

    public int getMaxOutputTokens() {
      return maxOutputTokens;
    }

    public void setMaxOutputTokens(int maxOutputTokens) {
      this.maxOutputTokens = maxOutputTokens;
    }

    public int getMaxConcurrentCompactions() {
      return maxConcurrentCompactions;
    }

    public void setMaxConcurrentCompactions(int maxConcurrentCompactions) {
      this.maxConcurrentCompactions = maxConcurrentCompactions;
    }

    public int getMaxQueueSize() {
      return maxQueueSize;
    }

    public void setMaxQueueSize(int maxQueueSize) {
      this.maxQueueSize = maxQueueSize;
    }

    public String getPromptTemplate() {
      return promptTemplate;
    }

    public void setPromptTemplate(String promptTemplate) {
      this.promptTemplate = promptTemplate;
    }
  }
}
