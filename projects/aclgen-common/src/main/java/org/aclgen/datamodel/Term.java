package org.aclgen.datamodel;

import static com.google.common.base.MoreObjects.firstNonNull;
import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;
import java.io.Serializable;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import javax.annotation.ParametersAreNonnullByDefault;

/**
 * A single match/action rule of a {@link Filter}.
 *
 * <p>Every match field is a list; an empty list means the field does not restrict the match.
 * Instances are immutable. Use {@link #builder()} or {@link #toBuilder()} to construct them.
 */
@ParametersAreNonnullByDefault
public final class Term implements Serializable {

  private static final long serialVersionUID = 1L;

  private static final String PROP_ACTION = "action";
  private static final String PROP_ADDRESS = "address";
  private static final String PROP_ADDRESS_FAMILY = "addressFamily";
  private static final String PROP_COMMENT = "comment";
  private static final String PROP_COUNTER = "counter";
  private static final String PROP_DESTINATION_ADDRESS = "destinationAddress";
  private static final String PROP_DESTINATION_ADDRESS_EXCLUDE = "destinationAddressExclude";
  private static final String PROP_DESTINATION_PORT = "destinationPort";
  private static final String PROP_LOGGING = "logging";
  private static final String PROP_NAME = "name";
  private static final String PROP_OPTION = "option";
  private static final String PROP_PROTOCOL = "protocol";
  private static final String PROP_SOURCE_ADDRESS = "sourceAddress";
  private static final String PROP_SOURCE_ADDRESS_EXCLUDE = "sourceAddressExclude";
  private static final String PROP_SOURCE_PORT = "sourcePort";
  private static final String PROP_VERBATIM = "verbatim";

  @ParametersAreNonnullByDefault
  public static final class Builder {

    private @Nullable String _name;
    private @Nullable TermAction _action;
    private List<String> _comments = ImmutableList.of();
    private List<String> _protocols = ImmutableList.of();
    private List<Address> _addresses = ImmutableList.of();
    private List<Address> _sourceAddresses = ImmutableList.of();
    private List<Address> _sourceAddressExcludes = ImmutableList.of();
    private List<Address> _destinationAddresses = ImmutableList.of();
    private List<Address> _destinationAddressExcludes = ImmutableList.of();
    private List<PortRange> _sourcePorts = ImmutableList.of();
    private List<PortRange> _destinationPorts = ImmutableList.of();
    private List<String> _options = ImmutableList.of();
    private boolean _logging;
    private @Nullable String _counter;
    private List<VerbatimLine> _verbatim = ImmutableList.of();
    private @Nullable AddressFamily _addressFamily;

    private Builder() {}

    public Term build() {
      checkState(_name != null, "Missing %s", PROP_NAME);
      checkState(_action != null, "Missing %s for term %s", PROP_ACTION, _name);
      return new Term(this);
    }

    public Builder setName(String name) {
      _name = name;
      return this;
    }

    public Builder setAction(TermAction action) {
      _action = action;
      return this;
    }

    public Builder setComments(Collection<String> comments) {
      _comments = ImmutableList.copyOf(comments);
      return this;
    }

    public Builder setProtocols(Collection<String> protocols) {
      _protocols = ImmutableList.copyOf(protocols);
      return this;
    }

    public Builder setAddresses(Collection<Address> addresses) {
      _addresses = ImmutableList.copyOf(addresses);
      return this;
    }

    public Builder setSourceAddresses(Collection<Address> sourceAddresses) {
      _sourceAddresses = ImmutableList.copyOf(sourceAddresses);
      return this;
    }

    public Builder setSourceAddressExcludes(Collection<Address> sourceAddressExcludes) {
      _sourceAddressExcludes = ImmutableList.copyOf(sourceAddressExcludes);
      return this;
    }

    public Builder setDestinationAddresses(Collection<Address> destinationAddresses) {
      _destinationAddresses = ImmutableList.copyOf(destinationAddresses);
      return this;
    }

    public Builder setDestinationAddressExcludes(Collection<Address> destinationAddressExcludes) {
      _destinationAddressExcludes = ImmutableList.copyOf(destinationAddressExcludes);
      return this;
    }

    public Builder setSourcePorts(Collection<PortRange> sourcePorts) {
      _sourcePorts = ImmutableList.copyOf(sourcePorts);
      return this;
    }

    public Builder setDestinationPorts(Collection<PortRange> destinationPorts) {
      _destinationPorts = ImmutableList.copyOf(destinationPorts);
      return this;
    }

    /** Appends {@code port} to the destination ports. */
    public Builder addDestinationPort(PortRange port) {
      _destinationPorts =
          ImmutableList.<PortRange>builder().addAll(_destinationPorts).add(port).build();
      return this;
    }

    public Builder setOptions(Collection<String> options) {
      _options = ImmutableList.copyOf(options);
      return this;
    }

    public Builder setLogging(boolean logging) {
      _logging = logging;
      return this;
    }

    public Builder setCounter(@Nullable String counter) {
      _counter = counter;
      return this;
    }

    public Builder setVerbatim(Collection<VerbatimLine> verbatim) {
      _verbatim = ImmutableList.copyOf(verbatim);
      return this;
    }

    public Builder setAddressFamily(@Nullable AddressFamily addressFamily) {
      _addressFamily = addressFamily;
      return this;
    }
  }

  private final @Nonnull String _name;
  private final @Nonnull TermAction _action;
  private final @Nonnull List<String> _comments;
  private final @Nonnull List<String> _protocols;
  private final @Nonnull List<Address> _addresses;
  private final @Nonnull List<Address> _sourceAddresses;
  private final @Nonnull List<Address> _sourceAddressExcludes;
  private final @Nonnull List<Address> _destinationAddresses;
  private final @Nonnull List<Address> _destinationAddressExcludes;
  private final @Nonnull List<PortRange> _sourcePorts;
  private final @Nonnull List<PortRange> _destinationPorts;
  private final @Nonnull List<String> _options;
  private final boolean _logging;
  private final @Nullable String _counter;
  private final @Nonnull List<VerbatimLine> _verbatim;
  private final @Nullable AddressFamily _addressFamily;

  private Term(Builder builder) {
    _name = builder._name;
    _action = builder._action;
    _comments = builder._comments;
    _protocols = builder._protocols;
    _addresses = builder._addresses;
    _sourceAddresses = builder._sourceAddresses;
    _sourceAddressExcludes = builder._sourceAddressExcludes;
    _destinationAddresses = builder._destinationAddresses;
    _destinationAddressExcludes = builder._destinationAddressExcludes;
    _sourcePorts = builder._sourcePorts;
    _destinationPorts = builder._destinationPorts;
    _options = builder._options;
    _logging = builder._logging;
    _counter = builder._counter;
    _verbatim = builder._verbatim;
    _addressFamily = builder._addressFamily;
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Returns a builder seeded with every field of this term. */
  public Builder toBuilder() {
    return builder()
        .setName(_name)
        .setAction(_action)
        .setComments(_comments)
        .setProtocols(_protocols)
        .setAddresses(_addresses)
        .setSourceAddresses(_sourceAddresses)
        .setSourceAddressExcludes(_sourceAddressExcludes)
        .setDestinationAddresses(_destinationAddresses)
        .setDestinationAddressExcludes(_destinationAddressExcludes)
        .setSourcePorts(_sourcePorts)
        .setDestinationPorts(_destinationPorts)
        .setOptions(_options)
        .setLogging(_logging)
        .setCounter(_counter)
        .setVerbatim(_verbatim)
        .setAddressFamily(_addressFamily);
  }

  @JsonCreator
  private static Term jsonCreator(
      @Nullable @JsonProperty(PROP_NAME) String name,
      @Nullable @JsonProperty(PROP_ACTION) TermAction action,
      @Nullable @JsonProperty(PROP_COMMENT) List<String> comments,
      @Nullable @JsonProperty(PROP_PROTOCOL) List<String> protocols,
      @Nullable @JsonProperty(PROP_ADDRESS) List<Address> addresses,
      @Nullable @JsonProperty(PROP_SOURCE_ADDRESS) List<Address> sourceAddresses,
      @Nullable @JsonProperty(PROP_SOURCE_ADDRESS_EXCLUDE) List<Address> sourceAddressExcludes,
      @Nullable @JsonProperty(PROP_DESTINATION_ADDRESS) List<Address> destinationAddresses,
      @Nullable @JsonProperty(PROP_DESTINATION_ADDRESS_EXCLUDE)
          List<Address> destinationAddressExcludes,
      @Nullable @JsonProperty(PROP_SOURCE_PORT) List<PortRange> sourcePorts,
      @Nullable @JsonProperty(PROP_DESTINATION_PORT) List<PortRange> destinationPorts,
      @Nullable @JsonProperty(PROP_OPTION) List<String> options,
      @Nullable @JsonProperty(PROP_LOGGING) Boolean logging,
      @Nullable @JsonProperty(PROP_COUNTER) String counter,
      @Nullable @JsonProperty(PROP_VERBATIM) List<VerbatimLine> verbatim,
      @Nullable @JsonProperty(PROP_ADDRESS_FAMILY) AddressFamily addressFamily) {
    checkArgument(name != null, "Missing %s", PROP_NAME);
    checkArgument(action != null, "Missing %s for term %s", PROP_ACTION, name);
    return builder()
        .setName(name)
        .setAction(action)
        .setComments(firstNonNull(comments, ImmutableList.of()))
        .setProtocols(firstNonNull(protocols, ImmutableList.of()))
        .setAddresses(firstNonNull(addresses, ImmutableList.of()))
        .setSourceAddresses(firstNonNull(sourceAddresses, ImmutableList.of()))
        .setSourceAddressExcludes(firstNonNull(sourceAddressExcludes, ImmutableList.of()))
        .setDestinationAddresses(firstNonNull(destinationAddresses, ImmutableList.of()))
        .setDestinationAddressExcludes(firstNonNull(destinationAddressExcludes, ImmutableList.of()))
        .setSourcePorts(firstNonNull(sourcePorts, ImmutableList.of()))
        .setDestinationPorts(firstNonNull(destinationPorts, ImmutableList.of()))
        .setOptions(firstNonNull(options, ImmutableList.of()))
        .setLogging(firstNonNull(logging, Boolean.FALSE))
        .setCounter(counter)
        .setVerbatim(firstNonNull(verbatim, ImmutableList.of()))
        .setAddressFamily(addressFamily)
        .build();
  }

  @JsonProperty(PROP_NAME)
  @Nonnull
  public String getName() {
    return _name;
  }

  @JsonProperty(PROP_ACTION)
  @Nonnull
  public TermAction getAction() {
    return _action;
  }

  @JsonProperty(PROP_COMMENT)
  @Nonnull
  public List<String> getComments() {
    return _comments;
  }

  @JsonProperty(PROP_PROTOCOL)
  @Nonnull
  public List<String> getProtocols() {
    return _protocols;
  }

  /** Addresses that apply to either direction, as used by standard access lists. */
  @JsonProperty(PROP_ADDRESS)
  @Nonnull
  public List<Address> getAddresses() {
    return _addresses;
  }

  @JsonProperty(PROP_SOURCE_ADDRESS)
  @Nonnull
  public List<Address> getSourceAddresses() {
    return _sourceAddresses;
  }

  @JsonProperty(PROP_SOURCE_ADDRESS_EXCLUDE)
  @Nonnull
  public List<Address> getSourceAddressExcludes() {
    return _sourceAddressExcludes;
  }

  @JsonProperty(PROP_DESTINATION_ADDRESS)
  @Nonnull
  public List<Address> getDestinationAddresses() {
    return _destinationAddresses;
  }

  @JsonProperty(PROP_DESTINATION_ADDRESS_EXCLUDE)
  @Nonnull
  public List<Address> getDestinationAddressExcludes() {
    return _destinationAddressExcludes;
  }

  @JsonProperty(PROP_SOURCE_PORT)
  @Nonnull
  public List<PortRange> getSourcePorts() {
    return _sourcePorts;
  }

  @JsonProperty(PROP_DESTINATION_PORT)
  @Nonnull
  public List<PortRange> getDestinationPorts() {
    return _destinationPorts;
  }

  @JsonProperty(PROP_OPTION)
  @Nonnull
  public List<String> getOptions() {
    return _options;
  }

  @JsonProperty(PROP_LOGGING)
  public boolean getLogging() {
    return _logging;
  }

  @JsonProperty(PROP_COUNTER)
  @Nullable
  public String getCounter() {
    return _counter;
  }

  @JsonProperty(PROP_VERBATIM)
  @Nonnull
  public List<VerbatimLine> getVerbatim() {
    return _verbatim;
  }

  /** Family the term was written for, if the policy said so. */
  @JsonProperty(PROP_ADDRESS_FAMILY)
  @Nullable
  public AddressFamily getAddressFamily() {
    return _addressFamily;
  }

  /** Whether one of the options starts with {@code prefix}. */
  public boolean hasOptionWithPrefix(String prefix) {
    return _options.stream().anyMatch(option -> option.startsWith(prefix));
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Term)) {
      return false;
    }
    Term other = (Term) o;
    return _name.equals(other._name)
        && _action == other._action
        && _comments.equals(other._comments)
        && _protocols.equals(other._protocols)
        && _addresses.equals(other._addresses)
        && _sourceAddresses.equals(other._sourceAddresses)
        && _sourceAddressExcludes.equals(other._sourceAddressExcludes)
        && _destinationAddresses.equals(other._destinationAddresses)
        && _destinationAddressExcludes.equals(other._destinationAddressExcludes)
        && _sourcePorts.equals(other._sourcePorts)
        && _destinationPorts.equals(other._destinationPorts)
        && _options.equals(other._options)
        && _logging == other._logging
        && Objects.equals(_counter, other._counter)
        && _verbatim.equals(other._verbatim)
        && _addressFamily == other._addressFamily;
  }

  @Override
  public int hashCode() {
    return Objects.hash(
        _name,
        _action,
        _comments,
        _protocols,
        _addresses,
        _sourceAddresses,
        _sourceAddressExcludes,
        _destinationAddresses,
        _destinationAddressExcludes,
        _sourcePorts,
        _destinationPorts,
        _options,
        _logging,
        _counter,
        _verbatim,
        _addressFamily);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(getClass())
        .omitNullValues()
        .add(PROP_NAME, _name)
        .add(PROP_ACTION, _action)
        .add(PROP_PROTOCOL, _protocols.isEmpty() ? null : _protocols)
        .add(PROP_SOURCE_ADDRESS, _sourceAddresses.isEmpty() ? null : _sourceAddresses)
        .add(
            PROP_DESTINATION_ADDRESS,
            _destinationAddresses.isEmpty() ? null : _destinationAddresses)
        .add(PROP_SOURCE_PORT, _sourcePorts.isEmpty() ? null : _sourcePorts)
        .add(PROP_DESTINATION_PORT, _destinationPorts.isEmpty() ? null : _destinationPorts)
        .add(PROP_OPTION, _options.isEmpty() ? null : _options)
        .toString();
  }
}
