package org.aclgen.cisco;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.equalTo;

import com.google.common.collect.ImmutableList;
import java.util.List;
import org.aclgen.datamodel.Address;
import org.aclgen.datamodel.PortRange;
import org.aclgen.datamodel.Term;
import org.aclgen.datamodel.TermAction;
import org.junit.Test;

public class ObjectGroupTermTest {

  private static final CiscoSettings SETTINGS = CiscoSettings.defaults();

  private static List<String> render(Term term) {
    return new ObjectGroupTerm(
            term, SETTINGS, new ProtocolResolver(SETTINGS), new TermNormalizer())
        .render();
  }

  private static Term.Builder web() {
    return Term.builder()
        .setName("web")
        .setAction(TermAction.ACCEPT)
        .setProtocols(ImmutableList.of("tcp"))
        .setSourceAddresses(ImmutableList.of(Address.parse("10.0.0.0/24", "WEB", null)))
        .setDestinationPorts(ImmutableList.of(PortRange.single(80)));
  }

  @Test
  public void groupsAndAny() {
    assertThat(
        render(web().build()),
        contains("remark web", " permit tcp addrgroup WEB addrgroup ANY portgroup 80-80"));
  }

  @Test
  public void sourcePorts() {
    Term term = web().setSourcePorts(ImmutableList.of(PortRange.of(1024, 65535))).build();

    assertThat(
        render(term).get(1),
        equalTo(" permit tcp addrgroup WEB portgroup 1024-65535 addrgroup ANY portgroup 80-80"));
  }

  @Test
  public void protocolsInnermost() {
    Term term =
        web()
            .setProtocols(ImmutableList.of("tcp", "gre"))
            .setDestinationAddresses(
                ImmutableList.of(
                    Address.parse("192.168.0.0/24", "DB", "DATA"),
                    Address.parse("192.168.1.0/24", "BACKUP", null)))
            .setDestinationPorts(ImmutableList.of())
            .setAction(TermAction.DENY)
            .build();

    assertThat(
        render(term),
        contains(
            "remark web",
            " deny tcp addrgroup WEB addrgroup DATA",
            " deny 47 addrgroup WEB addrgroup DATA",
            " deny tcp addrgroup WEB addrgroup BACKUP",
            " deny 47 addrgroup WEB addrgroup BACKUP"));
  }

  @Test
  public void groupName() {
    assertThat(
        ObjectGroupTerm.groupName(Address.parse("10.0.0.0/8", "A", "B")), equalTo("B"));
    assertThat(ObjectGroupTerm.groupName(Address.parse("10.0.0.0/8")), equalTo("10.0.0.0/8"));
    assertThat(ObjectGroupTerm.portGroupName(PortRange.single(22)), equalTo("22-22"));
  }

  @Test
  public void siblingsShareOneEntry() {
    Term term =
        web()
            .setSourceAddresses(
                ImmutableList.of(
                    Address.parse("10.0.0.0/24", "WEB1", "WEB"),
                    Address.parse("10.0.1.0/24", "WEB2", "WEB"),
                    Address.parse("10.0.2.0/24", "WEB3", "WEB")))
            .setProtocols(ImmutableList.of())
            .setDestinationPorts(ImmutableList.of())
            .build();

    assertThat(render(term), contains("remark web", " permit ip addrgroup WEB addrgroup ANY"));
  }

  @Test
  public void fullyExcludedSourceWritesNothing() {
    Term term =
        web()
            .setSourceAddressExcludes(ImmutableList.of(Address.parse("10.0.0.0/8")))
            .build();

    assertThat(render(term), contains("remark web"));
  }
}
