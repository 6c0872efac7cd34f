package org.aclgen.datamodel;

import static com.google.common.base.MoreObjects.firstNonNull;
import static com.google.common.base.Preconditions.checkArgument;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.collect.ImmutableList;
import java.io.Serializable;
import java.util.List;
import java.util.Objects;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/** A named ruleset: a {@link FilterHeader} and the ordered {@link Term}s it applies. */
public final class Filter implements Serializable {

  private static final long serialVersionUID = 1L;

  private static final String PROP_HEADER = "header";
  private static final String PROP_TERMS = "terms";

  private final @Nonnull FilterHeader _header;
  private final @Nonnull List<Term> _terms;

  public Filter(FilterHeader header, List<Term> terms) {
    _header = header;
    _terms = ImmutableList.copyOf(terms);
  }

  @JsonCreator
  private static Filter jsonCreator(
      @Nullable @JsonProperty(PROP_HEADER) FilterHeader header,
      @Nullable @JsonProperty(PROP_TERMS) List<Term> terms) {
    checkArgument(header != null, "Missing %s", PROP_HEADER);
    return new Filter(header, firstNonNull(terms, ImmutableList.of()));
  }

  @JsonProperty(PROP_HEADER)
  @Nonnull
  public FilterHeader getHeader() {
    return _header;
  }

  @JsonProperty(PROP_TERMS)
  @Nonnull
  public List<Term> getTerms() {
    return _terms;
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof Filter)) {
      return false;
    }
    Filter other = (Filter) o;
    return _header.equals(other._header) && _terms.equals(other._terms);
  }

  @Override
  public int hashCode() {
    return Objects.hash(_header, _terms);
  }
}
