package org.aclgen.datamodel;

import static com.google.common.base.MoreObjects.firstNonNull;
import static com.google.common.base.Preconditions.checkArgument;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import java.io.Serializable;
import java.util.List;
import java.util.Objects;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * One {@code target::} line of a filter header: the platform to render for and the options that
 * platform is given. By convention the first option is the filter name.
 */
public final class FilterTarget implements Serializable {

  private static final long serialVersionUID = 1L;

  private static final String PROP_OPTIONS = "options";
  private static final String PROP_PLATFORM = "platform";

  private final @Nonnull String _platform;
  private final @Nonnull List<String> _options;

  public FilterTarget(String platform, List<String> options) {
    _platform = platform;
    _options = ImmutableList.copyOf(options);
  }

  /** Creates a target from a platform name and its options, e.g. {@code of("cisco", "50")}. */
  public static FilterTarget of(String platform, String... options) {
    return new FilterTarget(platform, ImmutableList.copyOf(options));
  }

  @JsonCreator
  private static FilterTarget jsonCreator(
      @Nullable @JsonProperty(PROP_PLATFORM) String platform,
      @Nullable @JsonProperty(PROP_OPTIONS) List<String> options) {
    checkArgument(platform != null, "Missing %s", PROP_PLATFORM);
    return new FilterTarget(platform, firstNonNull(options, ImmutableList.of()));
  }

  @JsonProperty(PROP_PLATFORM)
  @Nonnull
  public String getPlatform() {
    return _platform;
  }

  @JsonProperty(PROP_OPTIONS)
  @Nonnull
  public List<String> getOptions() {
    return _options;
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof FilterTarget)) {
      return false;
    }
    FilterTarget other = (FilterTarget) o;
    return _platform.equals(other._platform) && _options.equals(other._options);
  }

  @Override
  public int hashCode() {
    return Objects.hash(_platform, _options);
  }

  @Override
  public String toString() {
    return Joiner.on(' ').join(ImmutableList.builder().add(_platform).addAll(_options).build());
  }
}
