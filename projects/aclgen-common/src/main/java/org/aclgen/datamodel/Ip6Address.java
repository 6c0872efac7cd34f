package org.aclgen.datamodel;

import com.google.common.net.InetAddresses;
import java.math.BigInteger;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/** An IPv6 network. Addresses are formatted in RFC 5952 compressed form. */
public final class Ip6Address extends Address {

  private static final long serialVersionUID = 1L;

  Ip6Address(
      BigInteger value, int prefixLength, @Nullable String token, @Nullable String parentToken) {
    super(value, prefixLength, token, parentToken);
  }

  @Override
  Address withNetwork(BigInteger network, int prefixLength) {
    return new Ip6Address(network, prefixLength, getToken(), getParentToken());
  }

  @Override
  String formatIp(BigInteger value) {
    return InetAddresses.toAddrString(InetAddresses.fromIPv6BigInteger(value));
  }

  @Nonnull
  @Override
  public AddressFamily getFamily() {
    return AddressFamily.IPV6;
  }
}
