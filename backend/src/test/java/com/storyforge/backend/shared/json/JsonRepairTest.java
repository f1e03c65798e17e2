package com.storyforge.backend.shared.json;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

class JsonRepairTest {

  private final ObjectMapper objectMapper = new ObjectMapper();

  @Test
  void leavesCompleteDocumentUntouched() {
    assertThat(JsonRepair.repair("{\"a\":[1,2],\"b\":\"x\"}")).isEqualTo("{\"a\":[1,2],\"b\":\"x\"}");
  }

  @Test
  void closesUnterminatedStringAndObject() throws Exception {
    String repaired = JsonRepair.repair("{\"story\": \"Once upon a time");

    assertThat(repaired).isEqualTo("{\"story\": \"Once upon a time\"}");
    assertThat(objectMapper.readTree(repaired).get("story").asText()).isEqualTo("Once upon a time");
  }

  @Test
  void closesNestedContainersInOrder() throws Exception {
    String repaired = JsonRepair.repair("{\"summary\":\"s\",\"keyPlotPoints\":[\"one\",\"tw");

    JsonNode root = objectMapper.readTree(repaired);
    assertThat(root.get("keyPlotPoints")).hasSize(2);
    assertThat(root.get("keyPlotPoints").get(1).asText()).isEqualTo("tw");
  }

  @Test
  void dropsDanglingEscapeAndTrailingComma() throws Exception {
    assertThat(objectMapper.readTree(JsonRepair.repair("{\"a\":\"x\\")).get("a").asText())
        .isEqualTo("x");
    assertThat(objectMapper.readTree(JsonRepair.repair("{\"a\":\"x\",")).get("a").asText())
        .isEqualTo("x");
    assertThat(objectMapper.readTree(JsonRepair.repair("{\"a\":")).get("a").isNull()).isTrue();
  }

  @Test
  void ignoresBracketsInsideStrings() {
    assertThat(JsonRepair.repair("{\"a\":\"[{\"")).isEqualTo("{\"a\":\"[{\"}");
  }

  @Test
  void nullBecomesEmpty() {
    assertThat(JsonRepair.repair(null)).isEmpty();
  }
}
