package io.queuehive.monitor.runtime;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

/**
 * JSON encoding of values written to the state store.
 */
final class JsonCodec {

  private final ObjectMapper mapper;

  JsonCodec() {
    this(new ObjectMapper());
  }

  JsonCodec(ObjectMapper mapper) {
    this.mapper = mapper.copy()
        .findAndRegisterModules()
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
        .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
  }

  String write(Object value) {
    try {
      return mapper.writeValueAsString(value);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("Unable to encode " + value.getClass().getSimpleName(), ex);
    }
  }

  <T> T read(String json, Class<T> type) {
    try {
      return mapper.readValue(json, type);
    } catch (JsonProcessingException ex) {
      throw new IllegalArgumentException("Unable to decode " + type.getSimpleName(), ex);
    }
  }
}
