package com.linkedin.schemaregistry.utils;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;


/**
 * Mapper for records written one per line to the registry logs.
 *
 * Only properties annotated with {@code @JsonProperty} are written. On read, every creator property must be present,
 * unknown properties and primitive nulls are rejected, and nothing may follow the record on its line.
 */
public class ObjectMapperFactory {
  private static final ObjectMapper INSTANCE = JsonMapper.builder()
      .disable(MapperFeature.AUTO_DETECT_FIELDS)
      .disable(MapperFeature.AUTO_DETECT_GETTERS, MapperFeature.AUTO_DETECT_IS_GETTERS)
      .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
      .enable(DeserializationFeature.FAIL_ON_MISSING_CREATOR_PROPERTIES)
      .enable(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES)
      .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
      .build();

  private ObjectMapperFactory() {
  }

  public static ObjectMapper getInstance() {
    return INSTANCE;
  }
}
