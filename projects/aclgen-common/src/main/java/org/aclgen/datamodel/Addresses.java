package org.aclgen.datamodel;

import static com.google.common.collect.ImmutableList.toImmutableList;

import com.google.common.collect.ImmutableList;
import java.util.List;
import javax.annotation.Nonnull;

/** Utility functions over collections of {@link Address}. */
public final class Addresses {

  /**
   * Subtracts {@code excluded} from {@code addresses}.
   *
   * <p>Each input network is replaced by the smallest set of networks covering what remains of it
   * after removing every excluded network of the same family, lowest network first. Networks that
   * are entirely excluded disappear. Fragments keep the token and parent token of the network they
   * were cut from. The order of the input networks is preserved.
   */
  public static @Nonnull List<Address> exclude(List<Address> addresses, List<Address> excluded) {
    ImmutableList.Builder<Address> result = ImmutableList.builder();
    for (Address address : addresses) {
      List<Address> fragments = ImmutableList.of(address);
      for (Address exclusion : excluded) {
        if (exclusion.getFamily() != address.getFamily()) {
          continue;
        }
        fragments =
            fragments.stream()
                .flatMap(fragment -> subtract(fragment, exclusion).stream())
                .collect(toImmutableList());
      }
      result.addAll(fragments);
    }
    return result.build();
  }

  /** Returns only the addresses of the given family, preserving order. */
  public static @Nonnull List<Address> ofFamily(List<Address> addresses, AddressFamily family) {
    return addresses.stream()
        .filter(address -> address.getFamily() == family)
        .collect(toImmutableList());
  }

  private static List<Address> subtract(Address address, Address exclusion) {
    if (!address.overlaps(exclusion)) {
      return ImmutableList.of(address);
    }
    if (exclusion.contains(address)) {
      return ImmutableList.of();
    }
    // exclusion lies strictly inside address
    ImmutableList.Builder<Address> remainder = ImmutableList.builder();
    for (Address half : address.subnets()) {
      remainder.addAll(subtract(half, exclusion));
    }
    return remainder.build();
  }

  private Addresses() {}
}
