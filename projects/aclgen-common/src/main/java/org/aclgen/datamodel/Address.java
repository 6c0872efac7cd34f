package org.aclgen.datamodel;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.JsonAutoDetect.Visibility;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.collect.ComparisonChain;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Ordering;
import com.google.common.net.InetAddresses;
import java.io.Serializable;
import java.math.BigInteger;
import java.net.Inet4Address;
import java.net.InetAddress;
import java.util.List;
import java.util.Objects;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * An IP network (address plus prefix length) as it appears in a policy, together with the
 * symbolic names it was resolved from.
 *
 * <p>The {@code token} is the name the address was defined under. The {@code parentToken} names the
 * group of sibling addresses that one source or destination field of a term refers to; platforms
 * with named object groups define each parent token once. When no parent token is given it defaults
 * to the token.
 *
 * <p>Host bits are masked off on construction, so {@code 10.1.1.1/24} is stored as {@code
 * 10.1.1.0/24}.
 */
@JsonAutoDetect(getterVisibility = Visibility.NONE, isGetterVisibility = Visibility.NONE)
public abstract class Address implements Comparable<Address>, Serializable {

  private static final long serialVersionUID = 1L;

  private static final String PROP_PARENT_TOKEN = "parentToken";
  private static final String PROP_PREFIX = "prefix";
  private static final String PROP_TOKEN = "token";

  private final @Nonnull BigInteger _network;
  private final int _prefixLength;
  private final @Nullable String _token;
  private final @Nullable String _parentToken;

  Address(
      BigInteger value, int prefixLength, @Nullable String token, @Nullable String parentToken) {
    int bits = getFamily().getBits();
    checkArgument(
        0 <= prefixLength && prefixLength <= bits,
        "Invalid prefix length %s for %s",
        prefixLength,
        getFamily());
    checkArgument(
        value.signum() >= 0 && value.bitLength() <= bits, "Address value out of range: %s", value);
    _prefixLength = prefixLength;
    _network = value.and(mask(bits, prefixLength));
    _token = token;
    _parentToken = parentToken != null ? parentToken : token;
  }

  /** Parses a CIDR string such as {@code 10.0.0.0/8} or {@code 2001:db8::/32}. */
  public static @Nonnull Address parse(String cidr) {
    return parse(cidr, null, null);
  }

  /**
   * Parses a CIDR string. A missing prefix length denotes a single host.
   *
   * @throws IllegalArgumentException if {@code cidr} is not a valid IPv4 or IPv6 network
   */
  public static @Nonnull Address parse(
      String cidr, @Nullable String token, @Nullable String parentToken) {
    String[] parts = cidr.trim().split("/", -1);
    checkArgument(parts.length <= 2, "Invalid network: %s", cidr);
    checkArgument(InetAddresses.isInetAddress(parts[0]), "Invalid IP address in: %s", cidr);
    InetAddress ip = InetAddresses.forString(parts[0]);
    BigInteger value = InetAddresses.toBigInteger(ip);
    int prefixLength;
    if (parts.length == 1) {
      prefixLength = ip instanceof Inet4Address ? 32 : 128;
    } else {
      try {
        prefixLength = Integer.parseInt(parts[1]);
      } catch (NumberFormatException e) {
        throw new IllegalArgumentException("Invalid prefix length in: " + cidr, e);
      }
    }
    return ip instanceof Inet4Address
        ? new Ip4Address(value, prefixLength, token, parentToken)
        : new Ip6Address(value, prefixLength, token, parentToken);
  }

  @JsonCreator
  private static Address jsonCreator(
      @Nullable @JsonProperty(PROP_PREFIX) String prefix,
      @Nullable @JsonProperty(PROP_TOKEN) String token,
      @Nullable @JsonProperty(PROP_PARENT_TOKEN) String parentToken) {
    checkArgument(prefix != null, "Missing %s", PROP_PREFIX);
    return parse(prefix, token, parentToken);
  }

  static BigInteger mask(int bits, int prefixLength) {
    BigInteger allOnes = BigInteger.ONE.shiftLeft(bits).subtract(BigInteger.ONE);
    return allOnes.shiftRight(bits - prefixLength).shiftLeft(bits - prefixLength);
  }

  /** Returns a copy of this address with a different network and prefix length. */
  abstract Address withNetwork(BigInteger network, int prefixLength);

  /** Formats a raw address value of this family. */
  abstract String formatIp(BigInteger value);

  @Nonnull
  public abstract AddressFamily getFamily();

  /** The network address, formatted for this family. */
  @Nonnull
  public String getIp() {
    return formatIp(_network);
  }

  @Nonnull
  public BigInteger getNetworkValue() {
    return _network;
  }

  @Nonnull
  public BigInteger getLastValue() {
    return _network.add(getNumHosts()).subtract(BigInteger.ONE);
  }

  public int getPrefixLength() {
    return _prefixLength;
  }

  /** Number of addresses covered by this network. */
  @Nonnull
  public BigInteger getNumHosts() {
    return BigInteger.ONE.shiftLeft(getFamily().getBits() - _prefixLength);
  }

  /** Whether this network covers exactly one address. */
  public boolean isHost() {
    return _prefixLength == getFamily().getBits();
  }

  @Nonnull
  public String getNetmask() {
    return formatIp(mask(getFamily().getBits(), _prefixLength));
  }

  @Nonnull
  public String getHostmask() {
    int bits = getFamily().getBits();
    return formatIp(mask(bits, _prefixLength).xor(mask(bits, bits)));
  }

  @JsonProperty(PROP_TOKEN)
  @Nullable
  public String getToken() {
    return _token;
  }

  @JsonProperty(PROP_PARENT_TOKEN)
  @Nullable
  public String getParentToken() {
    return _parentToken;
  }

  @JsonProperty(PROP_PREFIX)
  public String getPrefix() {
    return getIp() + "/" + _prefixLength;
  }

  /** Whether every address of {@code other} is also covered by this network. */
  public boolean contains(Address other) {
    return getFamily() == other.getFamily()
        && _prefixLength <= other._prefixLength
        && other._network.and(mask(getFamily().getBits(), _prefixLength)).equals(_network);
  }

  /** Whether the two networks share at least one address. */
  public boolean overlaps(Address other) {
    return contains(other) || other.contains(this);
  }

  /** Splits this network into its two halves, lower half first. */
  public List<Address> subnets() {
    int bits = getFamily().getBits();
    checkState(_prefixLength < bits, "Cannot split host address %s", this);
    int length = _prefixLength + 1;
    return ImmutableList.of(
        withNetwork(_network, length),
        withNetwork(_network.setBit(bits - length), length));
  }

  @Override
  public int compareTo(Address o) {
    return ComparisonChain.start()
        .compare(getFamily(), o.getFamily())
        .compare(_network, o._network)
        .compare(_prefixLength, o._prefixLength)
        .compare(_token, o._token, Ordering.natural().nullsFirst())
        .compare(_parentToken, o._parentToken, Ordering.natural().nullsFirst())
        .result();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Address)) {
      return false;
    }
    Address other = (Address) o;
    return getFamily() == other.getFamily()
        && _prefixLength == other._prefixLength
        && _network.equals(other._network)
        && Objects.equals(_token, other._token)
        && Objects.equals(_parentToken, other._parentToken);
  }

  @Override
  public int hashCode() {
    return Objects.hash(getFamily(), _network, _prefixLength, _token, _parentToken);
  }

  @Override
  public String toString() {
    return getPrefix();
  }
}
