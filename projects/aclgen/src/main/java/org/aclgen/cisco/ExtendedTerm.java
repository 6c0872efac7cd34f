package org.aclgen.cisco;

import com.google.common.collect.ImmutableList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import javax.annotation.Nonnull;
import org.aclgen.datamodel.AddressFamily;
import org.aclgen.datamodel.IpProtocol;
import org.aclgen.datamodel.Term;

/**
 * A term of an extended IPv4 or an IPv6 access list.
 *
 * <p>One entry is written for every combination of source address, destination address, source
 * port, destination port and protocol, iterated in that order with protocol innermost. Combinations
 * with an address of the other family are left out. The {@code established} keyword only goes on
 * TCP entries.
 */
public final class ExtendedTerm extends CiscoTerm {

  private final @Nonnull AddressFamily _family;
  private final @Nonnull ProtocolResolver _protocolResolver;
  private final @Nonnull TermNormalizer _normalizer;

  public ExtendedTerm(
      Term term,
      AddressFamily family,
      CiscoSettings settings,
      ProtocolResolver protocolResolver,
      TermNormalizer normalizer) {
    super(term, settings);
    _family = family;
    _protocolResolver = protocolResolver;
    _normalizer = normalizer;
  }

  @Override
  protected void renderStatements(ImmutableList.Builder<String> lines) {
    String action = CiscoActions.toCisco(_term.getAction());
    List<String> protocols = _protocolResolver.resolveAll(_term.getProtocols());
    List<AclAddress> sources = _normalizer.effectiveAddresses(_term, Direction.SOURCE, _family);
    List<AclAddress> destinations =
        _normalizer.effectiveAddresses(_term, Direction.DESTINATION, _family);
    List<AclPort> sourcePorts = _normalizer.effectivePorts(_term, Direction.SOURCE);
    List<AclPort> destinationPorts = _normalizer.effectivePorts(_term, Direction.DESTINATION);

    for (AclAddress source : sources) {
      for (AclAddress destination : destinations) {
        if (!source.matches(_family) || !destination.matches(_family)) {
          continue;
        }
        for (AclPort sourcePort : sourcePorts) {
          for (AclPort destinationPort : destinationPorts) {
            for (String protocol : protocols) {
              lines.add(
                  entry(
                      action,
                      protocol,
                      source.render(),
                      sourcePort.render(),
                      destination.render(),
                      destinationPort.render(),
                      options(protocol)));
            }
          }
        }
      }
    }
  }

  /** Keywords appended to the entry for {@code protocol}. */
  private String options(String protocol) {
    Set<String> options = new LinkedHashSet<>();
    boolean tcp =
        ProtocolResolver.number(protocol)
            .map(number -> number == IpProtocol.TCP.number())
            .orElse(false);
    boolean established =
        _term.hasOptionWithPrefix("established") || _term.hasOptionWithPrefix("tcp-established");
    // other protocols get the high destination ports instead, see EstablishedPortsNormalizer
    if (tcp && established) {
      options.add("established");
    }
    if (_term.getLogging()) {
      options.add("log");
    }
    return String.join(" ", options);
  }

  @Nonnull
  public AddressFamily getFamily() {
    return _family;
  }
}
