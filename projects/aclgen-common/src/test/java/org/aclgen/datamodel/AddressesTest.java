package org.aclgen.datamodel;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.equalTo;

import com.google.common.collect.ImmutableList;
import java.util.List;
import org.junit.Test;

/** Tests of {@link Addresses} */
public class AddressesTest {

  private static Address addr(String cidr) {
    return Address.parse(cidr);
  }

  @Test
  public void excludeLowerHalf() {
    assertThat(
        Addresses.exclude(
            ImmutableList.of(addr("10.0.0.0/24")), ImmutableList.of(addr("10.0.0.0/25"))),
        contains(addr("10.0.0.128/25")));
  }

  @Test
  public void excludeFragmentsIntoMinimalPrefixes() {
    assertThat(
        Addresses.exclude(
            ImmutableList.of(addr("10.0.0.0/24")), ImmutableList.of(addr("10.0.0.128/26"))),
        contains(addr("10.0.0.0/25"), addr("10.0.0.192/26")));

    assertThat(
        Addresses.exclude(
            ImmutableList.of(addr("10.0.0.0/24")), ImmutableList.of(addr("10.0.0.1/32"))),
        contains(
            addr("10.0.0.0/32"),
            addr("10.0.0.2/31"),
            addr("10.0.0.4/30"),
            addr("10.0.0.8/29"),
            addr("10.0.0.16/28"),
            addr("10.0.0.32/27"),
            addr("10.0.0.64/26"),
            addr("10.0.0.128/25")));
  }

  @Test
  public void excludeEverything() {
    assertThat(
        Addresses.exclude(
            ImmutableList.of(addr("10.0.0.0/8"), addr("10.1.0.0/16")),
            ImmutableList.of(addr("10.0.0.0/8"))),
        empty());
  }

  @Test
  public void excludeUnrelated() {
    List<Address> addresses = ImmutableList.of(addr("10.0.0.0/24"), addr("2001:db8::/32"));

    assertThat(
        Addresses.exclude(addresses, ImmutableList.of(addr("192.168.0.0/16"), addr("::1"))),
        equalTo(addresses));
  }

  @Test
  public void excludeSeveral() {
    assertThat(
        Addresses.exclude(
            ImmutableList.of(addr("10.0.0.0/24"), addr("172.16.0.0/12")),
            ImmutableList.of(addr("10.0.0.0/25"), addr("10.0.0.128/26"), addr("172.16.0.0/13"))),
        contains(addr("10.0.0.192/26"), addr("172.24.0.0/13")));
  }

  @Test
  public void excludeKeepsTokens() {
    List<Address> result =
        Addresses.exclude(
            ImmutableList.of(Address.parse("10.0.0.0/24", "INTERNAL", "CORP")),
            ImmutableList.of(addr("10.0.0.0/25")));

    assertThat(result, contains(Address.parse("10.0.0.128/25", "INTERNAL", "CORP")));
  }

  @Test
  public void ofFamily() {
    assertThat(
        Addresses.ofFamily(
            ImmutableList.of(addr("10.0.0.0/8"), addr("2001:db8::/32"), addr("192.168.0.0/16")),
            AddressFamily.IPV4),
        contains(addr("10.0.0.0/8"), addr("192.168.0.0/16")));
  }
}
