package org.aclgen.cisco;

import static com.google.common.base.MoreObjects.firstNonNull;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.collect.ImmutableSortedSet;
import java.io.IOException;
import java.io.InputStream;
import java.util.Collection;
import java.util.Locale;
import java.util.Set;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import javax.annotation.ParametersAreNonnullByDefault;
import org.aclgen.common.AclgenException;
import org.aclgen.common.util.AclgenObjectMapper;
import org.aclgen.datamodel.PortRange;

/** Settings that tune how {@link CiscoRenderer} renders a policy. */
@ParametersAreNonnullByDefault
public final class CiscoSettings {

  private static final String PROP_ESTABLISHED_PORT_RANGE = "establishedPortRange";
  private static final String PROP_FIRST_FILTER_ONLY = "firstFilterOnly";
  private static final String PROP_LITERAL_PROTOCOLS = "literalProtocols";
  private static final String PROP_REMARK_MAX_LENGTH = "remarkMaxLength";
  private static final String PROP_STRICT_PROTOCOLS = "strictProtocols";

  /** Longest remark text IOS accepts. */
  public static final int DEFAULT_REMARK_MAX_LENGTH = 100;

  /** Protocol keywords IOS understands and that are therefore not translated to numbers. */
  public static final Set<String> DEFAULT_LITERAL_PROTOCOLS =
      ImmutableSortedSet.of("icmp", "ip", "tcp", "udp");

  /** Return traffic of connections opened from behind a stateless filter arrives on these. */
  public static final PortRange DEFAULT_ESTABLISHED_PORT_RANGE = PortRange.of(1024, 65535);

  @ParametersAreNonnullByDefault
  public static final class Builder {

    private int _remarkMaxLength = DEFAULT_REMARK_MAX_LENGTH;
    private Set<String> _literalProtocols = DEFAULT_LITERAL_PROTOCOLS;
    private boolean _strictProtocols;
    private boolean _firstFilterOnly;
    private PortRange _establishedPortRange = DEFAULT_ESTABLISHED_PORT_RANGE;

    private Builder() {}

    /** @throws AclgenException if a setting is out of range */
    public CiscoSettings build() {
      if (_remarkMaxLength <= 0) {
        throw new AclgenException(
            String.format(
                "%s must be positive, not %d", PROP_REMARK_MAX_LENGTH, _remarkMaxLength));
      }
      return new CiscoSettings(this);
    }

    public Builder setRemarkMaxLength(int remarkMaxLength) {
      _remarkMaxLength = remarkMaxLength;
      return this;
    }

    public Builder setLiteralProtocols(Collection<String> literalProtocols) {
      _literalProtocols =
          literalProtocols.stream()
              .map(protocol -> protocol.toLowerCase(Locale.ROOT))
              .collect(ImmutableSortedSet.toImmutableSortedSet(String::compareTo));
      return this;
    }

    public Builder setStrictProtocols(boolean strictProtocols) {
      _strictProtocols = strictProtocols;
      return this;
    }

    public Builder setFirstFilterOnly(boolean firstFilterOnly) {
      _firstFilterOnly = firstFilterOnly;
      return this;
    }

    public Builder setEstablishedPortRange(PortRange establishedPortRange) {
      _establishedPortRange = establishedPortRange;
      return this;
    }
  }

  private static final CiscoSettings DEFAULTS = builder().build();

  private final int _remarkMaxLength;
  private final @Nonnull Set<String> _literalProtocols;
  private final boolean _strictProtocols;
  private final boolean _firstFilterOnly;
  private final @Nonnull PortRange _establishedPortRange;

  private CiscoSettings(Builder builder) {
    _remarkMaxLength = builder._remarkMaxLength;
    _literalProtocols = builder._literalProtocols;
    _strictProtocols = builder._strictProtocols;
    _firstFilterOnly = builder._firstFilterOnly;
    _establishedPortRange = builder._establishedPortRange;
  }

  public static Builder builder() {
    return new Builder();
  }

  public static CiscoSettings defaults() {
    return DEFAULTS;
  }

  @JsonCreator
  private static CiscoSettings jsonCreator(
      @Nullable @JsonProperty(PROP_REMARK_MAX_LENGTH) Integer remarkMaxLength,
      @Nullable @JsonProperty(PROP_LITERAL_PROTOCOLS) Set<String> literalProtocols,
      @Nullable @JsonProperty(PROP_STRICT_PROTOCOLS) Boolean strictProtocols,
      @Nullable @JsonProperty(PROP_FIRST_FILTER_ONLY) Boolean firstFilterOnly,
      @Nullable @JsonProperty(PROP_ESTABLISHED_PORT_RANGE) PortRange establishedPortRange) {
    return builder()
        .setRemarkMaxLength(firstNonNull(remarkMaxLength, DEFAULT_REMARK_MAX_LENGTH))
        .setLiteralProtocols(firstNonNull(literalProtocols, DEFAULT_LITERAL_PROTOCOLS))
        .setStrictProtocols(firstNonNull(strictProtocols, Boolean.FALSE))
        .setFirstFilterOnly(firstNonNull(firstFilterOnly, Boolean.FALSE))
        .setEstablishedPortRange(
            firstNonNull(establishedPortRange, DEFAULT_ESTABLISHED_PORT_RANGE))
        .build();
  }

  /** Reads settings from JSON. Properties that are absent keep their default value. */
  public static @Nonnull CiscoSettings fromJson(String json) {
    try {
      return AclgenObjectMapper.mapper().readValue(json, CiscoSettings.class);
    } catch (IOException e) {
      throw new AclgenException("Could not parse Cisco settings", e);
    }
  }

  /** Like {@link #fromJson(String)}, reading from a stream. The stream is not closed. */
  public static @Nonnull CiscoSettings load(InputStream json) {
    try {
      return AclgenObjectMapper.mapper().readValue(json, CiscoSettings.class);
    } catch (IOException e) {
      throw new AclgenException("Could not parse Cisco settings", e);
    }
  }

  /** Comment lines longer than this are cut before being written as remarks. */
  @JsonProperty(PROP_REMARK_MAX_LENGTH)
  public int getRemarkMaxLength() {
    return _remarkMaxLength;
  }

  /** Lower-case protocol names written as-is rather than as protocol numbers. */
  @JsonProperty(PROP_LITERAL_PROTOCOLS)
  @Nonnull
  public Set<String> getLiteralProtocols() {
    return _literalProtocols;
  }

  /** Whether a protocol name missing from the protocol table is an error. */
  @JsonProperty(PROP_STRICT_PROTOCOLS)
  public boolean getStrictProtocols() {
    return _strictProtocols;
  }

  /** Whether to stop after the first filter that targets the platform. */
  @JsonProperty(PROP_FIRST_FILTER_ONLY)
  public boolean getFirstFilterOnly() {
    return _firstFilterOnly;
  }

  /** Destination ports added to terms carrying the {@code established} option. */
  @JsonProperty(PROP_ESTABLISHED_PORT_RANGE)
  @Nonnull
  public PortRange getEstablishedPortRange() {
    return _establishedPortRange;
  }
}
