package org.aclgen.cisco;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.equalTo;

import java.io.IOException;
import java.io.InputStream;
import org.aclgen.common.AclgenException;
import org.aclgen.datamodel.PortRange;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

public class CiscoSettingsTest {

  @Rule public ExpectedException _thrown = ExpectedException.none();

  @Test
  public void defaults() {
    CiscoSettings settings = CiscoSettings.defaults();

    assertThat(settings.getRemarkMaxLength(), equalTo(100));
    assertThat(settings.getLiteralProtocols(), contains("icmp", "ip", "tcp", "udp"));
    assertThat(settings.getStrictProtocols(), equalTo(false));
    assertThat(settings.getFirstFilterOnly(), equalTo(false));
    assertThat(settings.getEstablishedPortRange(), equalTo(PortRange.of(1024, 65535)));
  }

  @Test
  public void fromJsonKeepsDefaults() {
    CiscoSettings settings = CiscoSettings.fromJson("{\"strictProtocols\": true}");

    assertThat(settings.getStrictProtocols(), equalTo(true));
    assertThat(settings.getRemarkMaxLength(), equalTo(100));
    assertThat(settings.getLiteralProtocols(), contains("icmp", "ip", "tcp", "udp"));
  }

  @Test
  public void load() throws IOException {
    CiscoSettings settings;
    try (InputStream stream = CiscoSettingsTest.class.getResourceAsStream("settings.json")) {
      settings = CiscoSettings.load(stream);
    }

    assertThat(settings.getRemarkMaxLength(), equalTo(60));
    assertThat(settings.getLiteralProtocols(), contains("icmp", "tcp", "udp"));
    assertThat(settings.getFirstFilterOnly(), equalTo(true));
    assertThat(settings.getEstablishedPortRange(), equalTo(PortRange.of(32768, 60999)));
  }

  @Test
  public void invalidRemarkLength() {
    _thrown.expect(AclgenException.class);
    _thrown.expectMessage("Could not parse Cisco settings");
    CiscoSettings.fromJson("{\"remarkMaxLength\": 0}");
  }

  @Test
  public void builderRejectsNonPositiveRemarkLength() {
    _thrown.expect(AclgenException.class);
    _thrown.expectMessage("remarkMaxLength must be positive, not -1");
    CiscoSettings.builder().setRemarkMaxLength(-1).build();
  }
}
