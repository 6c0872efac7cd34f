package org.aclgen.cisco;

import static com.google.common.collect.ImmutableList.toImmutableList;

import com.google.common.collect.ImmutableList;
import java.util.List;
import javax.annotation.Nonnull;
import org.aclgen.datamodel.Address;
import org.aclgen.datamodel.PortRange;
import org.aclgen.datamodel.Term;

/**
 * A term of an extended access list that refers to addresses and ports through object groups,
 * e.g. {@code permit tcp addrgroup WEB_SERVERS addrgroup ANY portgroup 80-80}. The groups
 * themselves are defined by an {@link ObjectGroupCollector}.
 *
 * <p>Entries are written for every combination of source group, destination group, source port,
 * destination port and protocol, protocol innermost. Addresses are taken after their exclusions are
 * removed, and sibling addresses of one group yield a single entry.
 */
public final class ObjectGroupTerm extends CiscoTerm {

  /** Group name used when a term leaves source or destination open. */
  static final String ANY_TOKEN = "ANY";

  private final @Nonnull ProtocolResolver _protocolResolver;
  private final @Nonnull TermNormalizer _normalizer;

  public ObjectGroupTerm(
      Term term,
      CiscoSettings settings,
      ProtocolResolver protocolResolver,
      TermNormalizer normalizer) {
    super(term, settings);
    _protocolResolver = protocolResolver;
    _normalizer = normalizer;
  }

  /** The object group an address belongs to: its parent token, or the address itself. */
  static String groupName(Address address) {
    return address.getParentToken() != null ? address.getParentToken() : address.getPrefix();
  }

  @Override
  protected void renderStatements(ImmutableList.Builder<String> lines) {
    String action = CiscoActions.toCisco(_term.getAction());
    List<String> protocols = _protocolResolver.resolveAll(_term.getProtocols());
    List<String> sources = groupNames(_normalizer.effectiveAddresses(_term, Direction.SOURCE));
    List<String> destinations =
        groupNames(_normalizer.effectiveAddresses(_term, Direction.DESTINATION));
    List<AclPort> sourcePorts = _normalizer.effectivePorts(_term, Direction.SOURCE);
    List<AclPort> destinationPorts = _normalizer.effectivePorts(_term, Direction.DESTINATION);

    for (String source : sources) {
      for (String destination : destinations) {
        for (AclPort sourcePort : sourcePorts) {
          for (AclPort destinationPort : destinationPorts) {
            for (String protocol : protocols) {
              lines.add(
                  entry(
                      action,
                      protocol,
                      "addrgroup " + source,
                      portGroup(sourcePort),
                      "addrgroup " + destination,
                      portGroup(destinationPort)));
            }
          }
        }
      }
    }
  }

  /** Distinct group names of the operands, in first-use order. */
  private static List<String> groupNames(List<AclAddress> addresses) {
    return addresses.stream()
        .map(address -> address.isAny() ? ANY_TOKEN : groupName(address.getAddress()))
        .distinct()
        .collect(toImmutableList());
  }

  private static String portGroup(AclPort port) {
    PortRange range = port.getRange();
    return range == null ? "" : "portgroup " + portGroupName(range);
  }

  /** Port groups are named after the range they hold, e.g. {@code 1024-65535} or {@code 80-80}. */
  static String portGroupName(PortRange range) {
    return range.getLow() + "-" + range.getHigh();
  }
}
