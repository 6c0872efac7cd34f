package org.aclgen.datamodel;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.collect.ImmutableList.toImmutableList;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.collect.ImmutableList;
import java.io.IOException;
import java.io.InputStream;
import java.io.Serializable;
import java.util.List;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import org.aclgen.common.AclgenException;
import org.aclgen.common.util.AclgenObjectMapper;

/** A parsed policy: the ordered filters to render. */
public final class Policy implements Serializable {

  private static final long serialVersionUID = 1L;

  private static final String PROP_FILTERS = "filters";

  private final @Nonnull List<Filter> _filters;

  public Policy(List<Filter> filters) {
    _filters = ImmutableList.copyOf(filters);
  }

  @JsonCreator
  private static Policy jsonCreator(@Nullable @JsonProperty(PROP_FILTERS) List<Filter> filters) {
    checkArgument(filters != null, "Missing %s", PROP_FILTERS);
    return new Policy(filters);
  }

  /** Reads a policy from its JSON representation. */
  public static @Nonnull Policy fromJson(String json) {
    try {
      return AclgenObjectMapper.mapper().readValue(json, Policy.class);
    } catch (IOException e) {
      throw new AclgenException("Could not parse policy", e);
    }
  }

  /** Reads a policy from a stream holding its JSON representation. The stream is not closed. */
  public static @Nonnull Policy fromJson(InputStream json) {
    try {
      return AclgenObjectMapper.mapper().readValue(json, Policy.class);
    } catch (IOException e) {
      throw new AclgenException("Could not parse policy", e);
    }
  }

  @JsonProperty(PROP_FILTERS)
  @Nonnull
  public List<Filter> getFilters() {
    return _filters;
  }

  @JsonIgnore
  @Nonnull
  public List<FilterHeader> getHeaders() {
    return _filters.stream().map(Filter::getHeader).collect(toImmutableList());
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof Policy && _filters.equals(((Policy) o)._filters);
  }

  @Override
  public int hashCode() {
    return _filters.hashCode();
  }
}
