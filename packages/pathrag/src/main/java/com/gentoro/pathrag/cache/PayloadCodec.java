package com.gentoro.pathrag.cache;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.jsontype.NamedType;
import com.gentoro.pathrag.exception.SerializationException;
import com.gentoro.pathrag.utility.JacksonUtility;
import java.io.IOException;
import java.util.Map;

/** JSON encoding of {@link CachePayload}s; also the source of every entry's byte size. */
public class PayloadCodec {
  private final ObjectMapper mapper;

  /**
   * @param payloadTypes type name to payload class, written to the {@code kind} property
   */
  public PayloadCodec(Map<String, Class<? extends CachePayload>> payloadTypes) {
    this.mapper = JacksonUtility.getJsonMapper().copy();
    payloadTypes.forEach((name, type) -> mapper.registerSubtypes(new NamedType(type, name)));
  }

  public byte[] encode(CachePayload payload) {
    try {
      return mapper.writerFor(CachePayload.class).writeValueAsBytes(payload);
    } catch (IOException e) {
      throw new SerializationException(
          "Failed to encode cache payload " + payload.getClass().getSimpleName(), e);
    }
  }

  public CachePayload decode(byte[] bytes) {
    try {
      return mapper.readValue(bytes, CachePayload.class);
    } catch (IOException e) {
      throw new SerializationException("Failed to decode cache payload", e);
    }
  }

  public long sizeOf(CachePayload payload) {
    return encode(payload).length;
  }

  ObjectMapper mapper() {
    return mapper;
  }
}
