package org.aclgen.datamodel;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.hasSize;

import java.io.IOException;
import java.io.InputStream;
import org.aclgen.common.AclgenException;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

public class PolicyTest {

  @Rule public ExpectedException _thrown = ExpectedException.none();

  private static Policy load(String resource) throws IOException {
    try (InputStream stream = PolicyTest.class.getResourceAsStream(resource)) {
      return Policy.fromJson(stream);
    }
  }

  @Test
  public void fromJson() throws IOException {
    Policy policy = load("policy.json");

    assertThat(policy.getFilters(), hasSize(2));
    assertThat(policy.getHeaders(), hasSize(2));

    Filter edge = policy.getFilters().get(0);
    assertThat(edge.getHeader().getFilterName("cisco"), equalTo("edge-inbound"));
    assertThat(edge.getHeader().getComments(), contains("Inbound edge filter"));
    assertThat(edge.getTerms(), hasSize(3));

    Term web = edge.getTerms().get(1);
    assertThat(web.getName(), equalTo("allow-web"));
    assertThat(web.getAction(), equalTo(TermAction.ACCEPT));
    assertThat(
        web.getDestinationAddresses(),
        contains(Address.parse("192.0.2.0/24", "WEB_SERVERS", "DMZ")));
    assertThat(web.getDestinationPorts(), contains(PortRange.single(80), PortRange.single(443)));

    Term deny = edge.getTerms().get(2);
    assertThat(deny.getAction(), equalTo(TermAction.DENY));
    assertThat(deny.getLogging(), equalTo(true));
  }

  @Test
  public void fromJsonMalformed() {
    _thrown.expect(AclgenException.class);
    _thrown.expectMessage("Could not parse policy");
    Policy.fromJson("{\"filters\": [{\"terms\": []}]}");
  }
}
