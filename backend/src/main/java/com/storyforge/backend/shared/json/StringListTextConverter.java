package com.storyforge.backend.shared.json;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.json.JsonMapper;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;
import java.util.ArrayList;
import java.util.List;
import org.springframework.util.StringUtils;

/** Stores a list of strings as a JSON array in a text column. */
@Converter
public class StringListTextConverter implements AttributeConverter<List<String>, String> {

  private static final TypeReference<List<String>> TYPE = new TypeReference<>() {};
  private final JsonMapper mapper = JsonMapper.builder().findAndAddModules().build();

  @Override
  public String convertToDatabaseColumn(List<String> attribute) {
    if (attribute == null || attribute.isEmpty()) {
      return "[]";
    }
    try {
      return mapper.writeValueAsString(attribute);
    } catch (JsonProcessingException exception) {
      throw new IllegalStateException("Failed to convert List<String> to JSON", exception);
    }
  }

  @Override
  public List<String> convertToEntityAttribute(String dbData) {
    if (!StringUtils.hasText(dbData)) {
      return new ArrayList<>();
    }
    try {
      List<String> values = mapper.readValue(dbData, TYPE);
      return values != null ? new ArrayList<>(values) : new ArrayList<>();
    } catch (JsonProcessingException exception) {
      throw new IllegalStateException("Failed to convert JSON to List<String>", exception);
    }
  }
}
