package org.aclgen.cisco;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;

import com.google.common.collect.ImmutableList;
import org.aclgen.datamodel.Address;
import org.aclgen.datamodel.AddressFamily;
import org.aclgen.datamodel.PortRange;
import org.aclgen.datamodel.Term;
import org.aclgen.datamodel.TermAction;
import org.junit.Test;

public class TermNormalizerTest {

  private final TermNormalizer _normalizer = new TermNormalizer();

  private static Term.Builder term() {
    return Term.builder().setName("t").setAction(TermAction.ACCEPT);
  }

  private static AclAddress addr(String cidr) {
    return AclAddress.of(Address.parse(cidr));
  }

  @Test
  public void noAddressesMatchesAny() {
    Term term = term().build();

    assertThat(
        _normalizer.effectiveAddresses(term, Direction.SOURCE, AddressFamily.IPV4),
        contains(AclAddress.ANY));
    assertThat(
        _normalizer.effectiveAddresses(term, Direction.DESTINATION, AddressFamily.IPV6),
        contains(AclAddress.ANY));
  }

  @Test
  public void filtersByFamily() {
    Term term =
        term()
            .setSourceAddresses(
                ImmutableList.of(Address.parse("10.0.0.0/8"), Address.parse("2001:db8::/32")))
            .build();

    assertThat(
        _normalizer.effectiveAddresses(term, Direction.SOURCE, AddressFamily.IPV4),
        contains(addr("10.0.0.0/8")));
    assertThat(
        _normalizer.effectiveAddresses(term, Direction.SOURCE, AddressFamily.IPV6),
        contains(addr("2001:db8::/32")));
  }

  @Test
  public void otherFamilyOnlyYieldsNothing() {
    Term term =
        term().setDestinationAddresses(ImmutableList.of(Address.parse("2001:db8::/32"))).build();

    assertThat(
        _normalizer.effectiveAddresses(term, Direction.DESTINATION, AddressFamily.IPV4), empty());
  }

  @Test
  public void removesExclusions() {
    Term term =
        term()
            .setDestinationAddresses(ImmutableList.of(Address.parse("10.0.0.0/24")))
            .setDestinationAddressExcludes(ImmutableList.of(Address.parse("10.0.0.0/25")))
            .build();

    assertThat(
        _normalizer.effectiveAddresses(term, Direction.DESTINATION, AddressFamily.IPV4),
        contains(addr("10.0.0.128/25")));
    // exclusions of one direction leave the other alone
    assertThat(
        _normalizer.effectiveAddresses(term, Direction.SOURCE, AddressFamily.IPV4),
        contains(AclAddress.ANY));
  }

  @Test
  public void everythingExcluded() {
    Term term =
        term()
            .setSourceAddresses(ImmutableList.of(Address.parse("10.0.0.0/24")))
            .setSourceAddressExcludes(ImmutableList.of(Address.parse("10.0.0.0/8")))
            .build();

    assertThat(_normalizer.effectiveAddresses(term, Direction.SOURCE, AddressFamily.IPV4), empty());
  }

  @Test
  public void usesGivenExcluder() {
    TermNormalizer normalizer = new TermNormalizer((addresses, excluded) -> ImmutableList.of());
    Term term =
        term()
            .setSourceAddresses(ImmutableList.of(Address.parse("10.0.0.0/24")))
            .setSourceAddressExcludes(ImmutableList.of(Address.parse("192.168.0.0/16")))
            .build();

    assertThat(normalizer.effectiveAddresses(term, Direction.SOURCE, AddressFamily.IPV4), empty());
  }

  @Test
  public void ports() {
    Term term =
        term()
            .setDestinationPorts(ImmutableList.of(PortRange.single(80), PortRange.of(8000, 8080)))
            .build();

    assertThat(
        _normalizer.effectivePorts(term, Direction.SOURCE), contains(AclPort.UNRESTRICTED));
    assertThat(
        _normalizer.effectivePorts(term, Direction.DESTINATION),
        contains(AclPort.of(PortRange.single(80)), AclPort.of(PortRange.of(8000, 8080))));
  }

  @Test
  public void bothFamilies() {
    Term term =
        term()
            .setSourceAddresses(
                ImmutableList.of(
                    Address.parse("2001:db8::/32"),
                    Address.parse("10.0.0.0/24"),
                    Address.parse("192.168.0.0/16")))
            .setSourceAddressExcludes(
                ImmutableList.of(Address.parse("10.0.0.0/25"), Address.parse("192.168.0.0/16")))
            .build();

    assertThat(
        _normalizer.effectiveAddresses(term, Direction.SOURCE),
        contains(addr("2001:db8::/32"), addr("10.0.0.128/25")));
    assertThat(
        _normalizer.effectiveAddresses(term, Direction.DESTINATION), contains(AclAddress.ANY));
  }
}
