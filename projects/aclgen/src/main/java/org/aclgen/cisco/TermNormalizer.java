package org.aclgen.cisco;

import static com.google.common.collect.ImmutableList.toImmutableList;

import com.google.common.collect.ImmutableList;
import java.util.List;
import javax.annotation.Nonnull;
import org.aclgen.datamodel.Address;
import org.aclgen.datamodel.AddressExcluder;
import org.aclgen.datamodel.AddressFamily;
import org.aclgen.datamodel.Addresses;
import org.aclgen.datamodel.PortRange;
import org.aclgen.datamodel.Term;

/** Computes the address and port operands a term is expanded over. */
public final class TermNormalizer {

  private final AddressExcluder _excluder;

  public TermNormalizer() {
    this(AddressExcluder.DEFAULT);
  }

  public TermNormalizer(AddressExcluder excluder) {
    _excluder = excluder;
  }

  /**
   * Returns the networks of {@code family} the term matches in {@code direction}, with that
   * direction's exclusions removed. A term that names no addresses for the direction matches {@link
   * AclAddress#ANY}. A term whose addresses are all of the other family, or are all excluded,
   * yields nothing.
   */
  @Nonnull
  public List<AclAddress> effectiveAddresses(
      Term term, Direction direction, AddressFamily family) {
    List<Address> addresses = addresses(term, direction);
    if (addresses.isEmpty()) {
      return ImmutableList.of(AclAddress.ANY);
    }
    return exclude(
        Addresses.ofFamily(addresses, family),
        Addresses.ofFamily(exclusions(term, direction), family));
  }

  /**
   * Like {@link #effectiveAddresses(Term, Direction, AddressFamily)} over both families, in the
   * order the term lists them. Each exclusion only removes networks of its own family.
   */
  @Nonnull
  public List<AclAddress> effectiveAddresses(Term term, Direction direction) {
    List<Address> addresses = addresses(term, direction);
    if (addresses.isEmpty()) {
      return ImmutableList.of(AclAddress.ANY);
    }
    ImmutableList.Builder<AclAddress> remaining = ImmutableList.builder();
    for (Address address : addresses) {
      remaining.addAll(
          exclude(
              ImmutableList.of(address),
              Addresses.ofFamily(exclusions(term, direction), address.getFamily())));
    }
    return remaining.build();
  }

  private List<AclAddress> exclude(List<Address> addresses, List<Address> excluded) {
    List<Address> selected =
        excluded.isEmpty() ? addresses : _excluder.exclude(addresses, excluded);
    return selected.stream().map(AclAddress::of).collect(toImmutableList());
  }

  private static List<Address> addresses(Term term, Direction direction) {
    switch (direction) {
      case SOURCE:
        return term.getSourceAddresses();
      case DESTINATION:
        return term.getDestinationAddresses();
      default:
        throw new IllegalArgumentException("Unsupported direction: " + direction);
    }
  }

  private static List<Address> exclusions(Term term, Direction direction) {
    switch (direction) {
      case SOURCE:
        return term.getSourceAddressExcludes();
      case DESTINATION:
        return term.getDestinationAddressExcludes();
      default:
        throw new IllegalArgumentException("Unsupported direction: " + direction);
    }
  }

  /** Returns the port operands of {@code direction}, or {@link AclPort#UNRESTRICTED}. */
  @Nonnull
  public List<AclPort> effectivePorts(Term term, Direction direction) {
    List<PortRange> ports =
        direction == Direction.SOURCE ? term.getSourcePorts() : term.getDestinationPorts();
    if (ports.isEmpty()) {
      return ImmutableList.of(AclPort.UNRESTRICTED);
    }
    return ports.stream().map(AclPort::of).collect(toImmutableList());
  }
}
