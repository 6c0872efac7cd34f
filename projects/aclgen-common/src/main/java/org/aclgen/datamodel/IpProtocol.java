package org.aclgen.datamodel;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * IP protocol numbers assigned by IANA, with the names they are known by in the system protocol
 * table ({@code /etc/protocols}).
 */
public enum IpProtocol {
  HOPOPT(0, "hopopt", "ip"),
  ICMP(1, "icmp"),
  IGMP(2, "igmp"),
  GGP(3, "ggp"),
  IPENCAP(4, "ipencap"),
  ST(5, "st"),
  TCP(6, "tcp"),
  EGP(8, "egp"),
  IGP(9, "igp"),
  PUP(12, "pup"),
  UDP(17, "udp"),
  HMP(20, "hmp"),
  XNS_IDP(22, "xns-idp"),
  RDP(27, "rdp"),
  ISO_TP4(29, "iso-tp4"),
  DCCP(33, "dccp"),
  XTP(36, "xtp"),
  DDP(37, "ddp"),
  IDPR_CMTP(38, "idpr-cmtp"),
  IPV6(41, "ipv6"),
  IPV6_ROUTE(43, "ipv6-route"),
  IPV6_FRAG(44, "ipv6-frag"),
  IDRP(45, "idrp"),
  RSVP(46, "rsvp"),
  GRE(47, "gre"),
  ESP(50, "esp"),
  AH(51, "ah"),
  SKIP(57, "skip"),
  IPV6_ICMP(58, "ipv6-icmp", "icmpv6"),
  IPV6_NONXT(59, "ipv6-nonxt"),
  IPV6_OPTS(60, "ipv6-opts"),
  RSPF(73, "rspf"),
  VMTP(81, "vmtp"),
  EIGRP(88, "eigrp"),
  OSPF(89, "ospf", "ospfigp"),
  AX_25(93, "ax.25"),
  IPIP(94, "ipip"),
  ETHERIP(97, "etherip"),
  ENCAP(98, "encap"),
  PIM(103, "pim"),
  IPCOMP(108, "ipcomp"),
  VRRP(112, "vrrp"),
  L2TP(115, "l2tp"),
  ISIS(124, "isis"),
  SCTP(132, "sctp"),
  FC(133, "fc"),
  MOBILITY_HEADER(135, "mobility-header"),
  UDPLITE(136, "udplite"),
  MPLS_IN_IP(137, "mpls-in-ip"),
  MANET(138, "manet"),
  HIP(139, "hip"),
  SHIM6(140, "shim6"),
  WESP(141, "wesp"),
  ROHC(142, "rohc");

  private static final Map<String, IpProtocol> BY_NAME = computeByName();

  private final int _number;
  private final List<String> _names;

  IpProtocol(int number, String... names) {
    _number = number;
    _names = ImmutableList.copyOf(names);
  }

  private static Map<String, IpProtocol> computeByName() {
    ImmutableMap.Builder<String, IpProtocol> byName = ImmutableMap.builder();
    for (IpProtocol protocol : values()) {
      protocol._names.forEach(name -> byName.put(name, protocol));
    }
    return byName.build();
  }

  /** Looks up a protocol by any of its names, ignoring case. */
  public static @Nonnull Optional<IpProtocol> fromName(@Nullable String name) {
    if (name == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(BY_NAME.get(name.trim().toLowerCase(Locale.ROOT)));
  }

  public static @Nonnull Optional<IpProtocol> fromNumber(int number) {
    for (IpProtocol protocol : values()) {
      if (protocol._number == number) {
        return Optional.of(protocol);
      }
    }
    return Optional.empty();
  }

  public int number() {
    return _number;
  }

  /** The canonical name from the protocol table. */
  public String getName() {
    return _names.get(0);
  }
}
