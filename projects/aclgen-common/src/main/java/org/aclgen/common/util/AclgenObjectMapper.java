package org.aclgen.common.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;
import javax.annotation.Nonnull;

/** Holds the {@link ObjectMapper} instances shared by every serializable model class. */
public final class AclgenObjectMapper {

  private static final ObjectMapper MAPPER = baseMapper();

  private static final ObjectWriter PRETTY_WRITER = MAPPER.writerWithDefaultPrettyPrinter();

  private static ObjectMapper baseMapper() {
    ObjectMapper mapper = new ObjectMapper();
    mapper.enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);
    mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    return mapper;
  }

  /** Returns the shared {@link ObjectMapper}. Callers must not reconfigure it. */
  public static @Nonnull ObjectMapper mapper() {
    return MAPPER;
  }

  /** Returns a pretty-printed JSON rendering of {@code o}. */
  public static String writePrettyString(Object o) throws JsonProcessingException {
    return PRETTY_WRITER.writeValueAsString(o);
  }

  private AclgenObjectMapper() {}
}
