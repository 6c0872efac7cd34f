package org.aclgen.datamodel;

import static com.google.common.base.Preconditions.checkArgument;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.google.common.collect.ComparisonChain;
import java.io.Serializable;
import javax.annotation.Nullable;

/** A closed range of transport-layer ports. A single port {@code p} is the range {@code [p, p]}. */
public final class PortRange implements Comparable<PortRange>, Serializable {

  private static final long serialVersionUID = 1L;

  public static final int MAX_PORT = 65535;

  private final int _low;
  private final int _high;

  private PortRange(int low, int high) {
    checkArgument(0 <= low && low <= MAX_PORT, "Invalid port: %s", low);
    checkArgument(0 <= high && high <= MAX_PORT, "Invalid port: %s", high);
    checkArgument(low <= high, "Invalid port range: %s-%s", low, high);
    _low = low;
    _high = high;
  }

  public static PortRange of(int low, int high) {
    return new PortRange(low, high);
  }

  public static PortRange single(int port) {
    return new PortRange(port, port);
  }

  /** Parses {@code "80"} or {@code "1024-65535"}. */
  @JsonCreator
  public static PortRange parse(@Nullable String text) {
    checkArgument(text != null, "Missing port range");
    String[] parts = text.trim().split("-", -1);
    checkArgument(parts.length <= 2, "Invalid port range: %s", text);
    try {
      int low = Integer.parseInt(parts[0].trim());
      int high = parts.length == 2 ? Integer.parseInt(parts[1].trim()) : low;
      return new PortRange(low, high);
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Invalid port range: " + text, e);
    }
  }

  public int getLow() {
    return _low;
  }

  public int getHigh() {
    return _high;
  }

  public boolean isSinglePort() {
    return _low == _high;
  }

  @Override
  public int compareTo(PortRange o) {
    return ComparisonChain.start().compare(_low, o._low).compare(_high, o._high).result();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof PortRange)) {
      return false;
    }
    PortRange other = (PortRange) o;
    return _low == other._low && _high == other._high;
  }

  @Override
  public int hashCode() {
    return 31 * _low + _high;
  }

  @JsonValue
  @Override
  public String toString() {
    return isSinglePort() ? Integer.toString(_low) : _low + "-" + _high;
  }
}
