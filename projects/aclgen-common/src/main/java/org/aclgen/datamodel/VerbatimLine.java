package org.aclgen.datamodel;

import static com.google.common.base.Preconditions.checkArgument;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.io.Serializable;
import java.util.Objects;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/** Raw configuration text that replaces the generated output of a term on one platform. */
public final class VerbatimLine implements Serializable {

  private static final long serialVersionUID = 1L;

  private static final String PROP_PLATFORM = "platform";
  private static final String PROP_TEXT = "text";

  private final @Nonnull String _platform;
  private final @Nonnull String _text;

  public VerbatimLine(String platform, String text) {
    _platform = platform;
    _text = text;
  }

  @JsonCreator
  private static VerbatimLine jsonCreator(
      @Nullable @JsonProperty(PROP_PLATFORM) String platform,
      @Nullable @JsonProperty(PROP_TEXT) String text) {
    checkArgument(platform != null, "Missing %s", PROP_PLATFORM);
    checkArgument(text != null, "Missing %s", PROP_TEXT);
    return new VerbatimLine(platform, text);
  }

  @JsonProperty(PROP_PLATFORM)
  @Nonnull
  public String getPlatform() {
    return _platform;
  }

  @JsonProperty(PROP_TEXT)
  @Nonnull
  public String getText() {
    return _text;
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof VerbatimLine)) {
      return false;
    }
    VerbatimLine other = (VerbatimLine) o;
    return _platform.equals(other._platform) && _text.equals(other._text);
  }

  @Override
  public int hashCode() {
    return Objects.hash(_platform, _text);
  }

  @Override
  public String toString() {
    return _platform + ": " + _text;
  }
}
