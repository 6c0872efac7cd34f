package org.aclgen.cisco;

import com.google.common.base.CharMatcher;
import com.google.common.collect.ImmutableList;
import com.google.common.primitives.Ints;
import java.util.Arrays;
import java.util.List;
import javax.annotation.Nonnull;

/** Access-list types a filter can ask for in the second option of its cisco target. */
public enum CiscoFilterType {
  EXTENDED("extended"),
  STANDARD("standard"),
  OBJECT_GROUP("object-group"),
  INET6("inet6"),
  /** an extended IPv4 access list followed by an IPv6 access list over the same terms */
  MIXED("mixed");

  private static final int MIN_STANDARD_NUMBER = 1;
  private static final int MAX_STANDARD_NUMBER = 99;

  private final String _name;

  CiscoFilterType(String name) {
    _name = name;
  }

  /**
   * Returns the type named {@code name}.
   *
   * @throws UnsupportedAccessListException if there is no such type
   */
  public static @Nonnull CiscoFilterType fromName(String name) {
    for (CiscoFilterType type : values()) {
      if (type._name.equals(name)) {
        return type;
      }
    }
    throw new UnsupportedAccessListException(
        String.format(
            "Unsupported access list type '%s', only %s are supported",
            name, Arrays.asList(values())));
  }

  public String getName() {
    return _name;
  }

  /** The concrete access-list types rendered for a filter of this type, in output order. */
  @Nonnull
  public List<CiscoFilterType> expand() {
    return this == MIXED ? ImmutableList.of(EXTENDED, INET6) : ImmutableList.of(this);
  }

  /**
   * Checks that {@code filterName} may name an access list of this type. Numbers 1 to 99 are
   * reserved for standard access lists, and standard access lists must use one of them.
   *
   * @throws UnsupportedAccessListException if it may not
   */
  public void checkFilterName(String filterName) {
    boolean standardNumber = isStandardNumber(filterName);
    switch (this) {
      case EXTENDED:
      case OBJECT_GROUP:
        if (standardNumber) {
          throw new UnsupportedAccessListException(
              String.format(
                  "Access lists %d-%d are reserved for standard ACLs, cannot use '%s' for %s",
                  MIN_STANDARD_NUMBER, MAX_STANDARD_NUMBER, filterName, _name));
        }
        return;
      case STANDARD:
        if (!standardNumber) {
          throw new UnsupportedAccessListException(
              String.format(
                  "Standard access lists must be numbered %d-%d, not '%s'",
                  MIN_STANDARD_NUMBER, MAX_STANDARD_NUMBER, filterName));
        }
        return;
      default:
        return;
    }
  }

  /** Statements that remove and then declare an access list of this type. */
  @Nonnull
  public List<String> preamble(String filterName) {
    switch (this) {
      case EXTENDED:
      case OBJECT_GROUP:
        return ImmutableList.of(
            "no ip access-list extended " + filterName, "ip access-list extended " + filterName);
      case STANDARD:
        return ImmutableList.of("no ip access-list " + filterName);
      case INET6:
        return ImmutableList.of(
            "no ipv6 access-list " + filterName, "ipv6 access-list " + filterName);
      default:
        throw new IllegalStateException(_name + " must be expanded before rendering");
    }
  }

  private static boolean isStandardNumber(String filterName) {
    if (filterName.isEmpty() || !CharMatcher.inRange('0', '9').matchesAllOf(filterName)) {
      return false;
    }
    Integer number = Ints.tryParse(filterName);
    return number != null && MIN_STANDARD_NUMBER <= number && number <= MAX_STANDARD_NUMBER;
  }

  @Override
  public String toString() {
    return _name;
  }
}
