package org.aclgen.datamodel;

import com.google.common.net.InetAddresses;
import java.math.BigInteger;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/** An IPv4 network. */
public final class Ip4Address extends Address {

  private static final long serialVersionUID = 1L;

  Ip4Address(
      BigInteger value, int prefixLength, @Nullable String token, @Nullable String parentToken) {
    super(value, prefixLength, token, parentToken);
  }

  @Override
  Address withNetwork(BigInteger network, int prefixLength) {
    return new Ip4Address(network, prefixLength, getToken(), getParentToken());
  }

  @Override
  String formatIp(BigInteger value) {
    return InetAddresses.toAddrString(InetAddresses.fromIPv4BigInteger(value));
  }

  @Nonnull
  @Override
  public AddressFamily getFamily() {
    return AddressFamily.IPV4;
  }
}
