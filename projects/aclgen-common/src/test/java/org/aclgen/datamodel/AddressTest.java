package org.aclgen.datamodel;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.instanceOf;
import static org.hamcrest.Matchers.nullValue;

import java.io.IOException;
import java.math.BigInteger;
import org.aclgen.common.util.AclgenObjectMapper;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

public class AddressTest {

  @Rule public ExpectedException _thrown = ExpectedException.none();

  @Test
  public void parseIpv4Network() {
    Address address = Address.parse("10.1.1.1/24");

    assertThat(address, instanceOf(Ip4Address.class));
    assertThat(address.getFamily(), equalTo(AddressFamily.IPV4));
    // host bits are masked off
    assertThat(address.getIp(), equalTo("10.1.1.0"));
    assertThat(address.getPrefixLength(), equalTo(24));
    assertThat(address.getNetmask(), equalTo("255.255.255.0"));
    assertThat(address.getHostmask(), equalTo("0.0.0.255"));
    assertThat(address.getNumHosts(), equalTo(BigInteger.valueOf(256)));
    assertThat(address.isHost(), equalTo(false));
  }

  @Test
  public void parseIpv4Host() {
    Address address = Address.parse("192.168.0.1");

    assertThat(address.getPrefixLength(), equalTo(32));
    assertThat(address.isHost(), equalTo(true));
    assertThat(address.getHostmask(), equalTo("0.0.0.0"));
    assertThat(address.getNetmask(), equalTo("255.255.255.255"));
  }

  @Test
  public void parseDefaultRoute() {
    Address address = Address.parse("0.0.0.0/0");

    assertThat(address.getNetmask(), equalTo("0.0.0.0"));
    assertThat(address.getHostmask(), equalTo("255.255.255.255"));
  }

  @Test
  public void parseIpv6() {
    Address network = Address.parse("2001:db8::1/32");
    Address host = Address.parse("2001:db8::1");

    assertThat(network, instanceOf(Ip6Address.class));
    assertThat(network.getFamily(), equalTo(AddressFamily.IPV6));
    assertThat(network.getPrefix(), equalTo("2001:db8::/32"));
    assertThat(network.isHost(), equalTo(false));
    assertThat(host.getPrefixLength(), equalTo(128));
    assertThat(host.isHost(), equalTo(true));
    assertThat(host.getIp(), equalTo("2001:db8::1"));
  }

  @Test
  public void parentTokenDefaultsToToken() {
    assertThat(Address.parse("10.0.0.0/8", "RFC1918", null).getParentToken(), equalTo("RFC1918"));
    assertThat(
        Address.parse("10.0.0.0/8", "RFC1918", "INTERNAL").getParentToken(), equalTo("INTERNAL"));
    assertThat(Address.parse("10.0.0.0/8").getParentToken(), nullValue());
  }

  @Test
  public void containsAndOverlaps() {
    Address slash8 = Address.parse("10.0.0.0/8");
    Address slash16 = Address.parse("10.1.0.0/16");

    assertThat(slash8.contains(slash16), equalTo(true));
    assertThat(slash16.contains(slash8), equalTo(false));
    assertThat(slash16.overlaps(slash8), equalTo(true));
    assertThat(slash8.overlaps(Address.parse("11.0.0.0/8")), equalTo(false));
    assertThat(Address.parse("::/0").contains(slash16), equalTo(false));
  }

  @Test
  public void subnets() {
    assertThat(
        Address.parse("10.0.0.0/8", "NET", null).subnets(),
        contains(
            Address.parse("10.0.0.0/9", "NET", null), Address.parse("10.128.0.0/9", "NET", null)));
  }

  @Test
  public void subnetsOfHost() {
    _thrown.expect(IllegalStateException.class);
    _thrown.expectMessage("Cannot split host address");
    Address.parse("10.0.0.1").subnets();
  }

  @Test
  public void parsePrefixTooLong() {
    _thrown.expect(IllegalArgumentException.class);
    _thrown.expectMessage("Invalid prefix length 33 for IPV4");
    Address.parse("10.0.0.0/33");
  }

  @Test
  public void parseGarbage() {
    _thrown.expect(IllegalArgumentException.class);
    _thrown.expectMessage("Invalid IP address in: web-servers");
    Address.parse("web-servers");
  }

  @Test
  public void testJsonSerialization() throws IOException {
    Address address = Address.parse("2001:db8::/48", "V6NET", "SERVERS");
    String json = AclgenObjectMapper.mapper().writeValueAsString(address);

    assertThat(AclgenObjectMapper.mapper().readValue(json, Address.class), equalTo(address));
  }

  @Test
  public void testJsonDeserialization() throws IOException {
    assertThat(
        AclgenObjectMapper.mapper()
            .readValue("{\"prefix\": \"10.0.0.0/8\", \"token\": \"RFC1918\"}", Address.class),
        equalTo(Address.parse("10.0.0.0/8", "RFC1918", null)));
  }
}
