package org.aclgen.datamodel;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import javax.annotation.Nullable;

/** IP address family of an {@link Address}. */
public enum AddressFamily {
  IPV4(4, 32),
  IPV6(6, 128);

  private final int _version;
  private final int _bits;

  AddressFamily(int version, int bits) {
    _version = version;
    _bits = bits;
  }

  /** Width of an address of this family, in bits. */
  public int getBits() {
    return _bits;
  }

  @JsonValue
  public int getVersion() {
    return _version;
  }

  @JsonCreator
  public static AddressFamily fromVersion(@Nullable Integer version) {
    if (version != null) {
      for (AddressFamily family : values()) {
        if (family._version == version) {
          return family;
        }
      }
    }
    throw new IllegalArgumentException("Unknown address family: " + version);
  }
}
