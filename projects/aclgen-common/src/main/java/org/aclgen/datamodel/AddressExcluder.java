package org.aclgen.datamodel;

import java.util.List;

/** Removes excluded networks from a list of networks. */
@FunctionalInterface
public interface AddressExcluder {

  /** The prefix-splitting implementation in {@link Addresses#exclude(List, List)}. */
  AddressExcluder DEFAULT = Addresses::exclude;

  /**
   * Returns the parts of {@code addresses} not covered by any of {@code excluded}, expressed as
   * networks.
   */
  List<Address> exclude(List<Address> addresses, List<Address> excluded);
}
