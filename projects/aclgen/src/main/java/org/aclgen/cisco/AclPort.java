package org.aclgen.cisco;

import com.google.common.base.Preconditions;
import java.util.Objects;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import org.aclgen.datamodel.PortRange;

/**
 * The port operand of an access-list statement. {@link #UNRESTRICTED} leaves the port out of the
 * statement altogether, which is not the same as matching port 0.
 */
public final class AclPort {

  public static final AclPort UNRESTRICTED = new AclPort(null);

  private final @Nullable PortRange _range;

  private AclPort(@Nullable PortRange range) {
    _range = range;
  }

  public static @Nonnull AclPort of(PortRange range) {
    return new AclPort(Preconditions.checkNotNull(range));
  }

  @Nullable
  public PortRange getRange() {
    return _range;
  }

  public boolean isUnrestricted() {
    return _range == null;
  }

  /** Renders {@code eq <port>}, {@code range <low> <high>}, or nothing when unrestricted. */
  @Nonnull
  public String render() {
    if (_range == null) {
      return "";
    }
    return _range.isSinglePort()
        ? "eq " + _range.getLow()
        : "range " + _range.getLow() + " " + _range.getHigh();
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof AclPort && Objects.equals(_range, ((AclPort) o)._range);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(_range);
  }

  @Override
  public String toString() {
    return _range == null ? "unrestricted" : _range.toString();
  }
}
