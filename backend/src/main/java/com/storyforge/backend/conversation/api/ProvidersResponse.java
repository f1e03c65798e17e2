package com.storyforge.backend.conversation.api;

import java.util.List;

public record ProvidersResponse(String defaultProvider, List<Provider> providers) {

  public record Provider(
      String id, String displayName, String defaultModel, boolean configured, List<Model> models) {}

  public record Model(String id, String displayName) {}
}
