package org.aclgen.datamodel;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.equalTo;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

public class PortRangeTest {

  @Rule public ExpectedException _thrown = ExpectedException.none();

  @Test
  public void parse() {
    assertThat(PortRange.parse("80"), equalTo(PortRange.single(80)));
    assertThat(PortRange.parse("1024-65535"), equalTo(PortRange.of(1024, 65535)));
    assertThat(PortRange.parse(" 20 - 21 "), equalTo(PortRange.of(20, 21)));
  }

  @Test
  public void singlePort() {
    assertThat(PortRange.single(53).isSinglePort(), equalTo(true));
    assertThat(PortRange.of(53, 54).isSinglePort(), equalTo(false));
    assertThat(PortRange.single(53).toString(), equalTo("53"));
    assertThat(PortRange.of(53, 54).toString(), equalTo("53-54"));
  }

  @Test
  public void reversedRange() {
    _thrown.expect(IllegalArgumentException.class);
    _thrown.expectMessage("Invalid port range: 10-5");
    PortRange.of(10, 5);
  }

  @Test
  public void portTooLarge() {
    _thrown.expect(IllegalArgumentException.class);
    _thrown.expectMessage("Invalid port: 70000");
    PortRange.parse("70000");
  }

  @Test
  public void notANumber() {
    _thrown.expect(IllegalArgumentException.class);
    _thrown.expectMessage("Invalid port range: http");
    PortRange.parse("http");
  }
}
