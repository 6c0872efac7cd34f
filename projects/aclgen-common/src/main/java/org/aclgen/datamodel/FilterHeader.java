package org.aclgen.datamodel;

import static com.google.common.base.MoreObjects.firstNonNull;
import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.collect.ImmutableList.toImmutableList;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.collect.ImmutableList;
import java.io.Serializable;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/** The header of a {@link Filter}: which platforms it targets and its comment lines. */
public final class FilterHeader implements Serializable {

  private static final long serialVersionUID = 1L;

  private static final String PROP_COMMENT = "comment";
  private static final String PROP_TARGETS = "targets";

  private final @Nonnull List<FilterTarget> _targets;
  private final @Nonnull List<String> _comments;

  public FilterHeader(List<FilterTarget> targets, List<String> comments) {
    _targets = ImmutableList.copyOf(targets);
    _comments = ImmutableList.copyOf(comments);
  }

  @JsonCreator
  private static FilterHeader jsonCreator(
      @Nullable @JsonProperty(PROP_TARGETS) List<FilterTarget> targets,
      @Nullable @JsonProperty(PROP_COMMENT) List<String> comments) {
    checkArgument(targets != null, "Missing %s", PROP_TARGETS);
    return new FilterHeader(targets, firstNonNull(comments, ImmutableList.of()));
  }

  @JsonProperty(PROP_TARGETS)
  @Nonnull
  public List<FilterTarget> getTargets() {
    return _targets;
  }

  @JsonProperty(PROP_COMMENT)
  @Nonnull
  public List<String> getComments() {
    return _comments;
  }

  /** Names of all platforms this header targets, in declaration order. */
  @JsonIgnore
  @Nonnull
  public List<String> getPlatforms() {
    return _targets.stream().map(FilterTarget::getPlatform).collect(toImmutableList());
  }

  public boolean targets(String platform) {
    return target(platform).isPresent();
  }

  /**
   * Returns the options given to {@code platform}.
   *
   * @throws NoSuchElementException if this header does not target {@code platform}
   */
  @Nonnull
  public List<String> getFilterOptions(String platform) {
    return target(platform)
        .orElseThrow(
            () ->
                new NoSuchElementException(
                    String.format("Header does not target platform '%s'", platform)))
        .getOptions();
  }

  /**
   * Returns the filter name used on {@code platform}, which is its first option.
   *
   * @throws NoSuchElementException if this header does not target {@code platform}
   * @throws IllegalArgumentException if the target has no options
   */
  @Nonnull
  public String getFilterName(String platform) {
    List<String> options = getFilterOptions(platform);
    checkArgument(!options.isEmpty(), "No filter name given for platform '%s'", platform);
    return options.get(0);
  }

  private Optional<FilterTarget> target(String platform) {
    return _targets.stream().filter(t -> t.getPlatform().equals(platform)).findFirst();
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof FilterHeader)) {
      return false;
    }
    FilterHeader other = (FilterHeader) o;
    return _targets.equals(other._targets) && _comments.equals(other._comments);
  }

  @Override
  public int hashCode() {
    return Objects.hash(_targets, _comments);
  }

  @Override
  public String toString() {
    return _targets.toString();
  }
}
