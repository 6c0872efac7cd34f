package org.aclgen.cisco;

import com.google.common.base.Preconditions;
import java.util.Objects;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import org.aclgen.datamodel.Address;
import org.aclgen.datamodel.AddressFamily;

/** The address operand of an access-list statement: a concrete network, or {@code any}. */
public final class AclAddress {

  /** Matches every address of either family. */
  public static final AclAddress ANY = new AclAddress(null);

  private final @Nullable Address _address;

  private AclAddress(@Nullable Address address) {
    _address = address;
  }

  public static @Nonnull AclAddress of(Address address) {
    return new AclAddress(Preconditions.checkNotNull(address));
  }

  /** The network, or {@code null} for {@link #ANY}. */
  @Nullable
  public Address getAddress() {
    return _address;
  }

  public boolean isAny() {
    return _address == null;
  }

  /** Whether this operand can appear in an access list of {@code family}. */
  public boolean matches(AddressFamily family) {
    return _address == null || _address.getFamily() == family;
  }

  /**
   * Renders the operand: {@code any}, {@code host <ip>} for single hosts, {@code <network>
   * <hostmask>} for IPv4 networks and {@code <ip>/<length>} for IPv6 networks.
   */
  @Nonnull
  public String render() {
    if (_address == null) {
      return "any";
    }
    switch (_address.getFamily()) {
      case IPV4:
        return _address.isHost()
            ? "host " + _address.getIp()
            : _address.getIp() + " " + _address.getHostmask();
      case IPV6:
        return _address.isHost() ? "host " + _address.getIp() : _address.getPrefix();
      default:
        throw new IllegalStateException("Unsupported address family: " + _address.getFamily());
    }
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof AclAddress && Objects.equals(_address, ((AclAddress) o)._address);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(_address);
  }

  @Override
  public String toString() {
    return render();
  }
}
