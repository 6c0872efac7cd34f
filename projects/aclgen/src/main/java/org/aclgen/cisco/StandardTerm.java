package org.aclgen.cisco;

import com.google.common.collect.ImmutableList;
import javax.annotation.Nonnull;
import org.aclgen.datamodel.Address;
import org.aclgen.datamodel.Term;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * A term of a numbered standard access list. Standard access lists only match on the IPv4 address
 * of the term, so a term using any other match field or option is rejected on construction.
 */
public final class StandardTerm extends CiscoTerm {

  private static final Logger LOGGER = LogManager.getLogger(StandardTerm.class);

  private final @Nonnull String _filterName;

  /**
   * @throws StandardAclTermException if the term sets a protocol, source or destination addresses,
   *     options, ports, a counter or logging
   */
  public StandardTerm(Term term, String filterName, CiscoSettings settings) {
    super(term, settings);
    _filterName = filterName;
    checkStandard(term);
  }

  private static void checkStandard(Term term) {
    if (!term.getProtocols().isEmpty()) {
      throw new StandardAclTermException(
          String.format("Standard ACLs cannot specify protocols (term '%s')", term.getName()));
    }
    if (!term.getSourceAddresses().isEmpty()
        || !term.getSourceAddressExcludes().isEmpty()
        || !term.getDestinationAddresses().isEmpty()
        || !term.getDestinationAddressExcludes().isEmpty()) {
      throw new StandardAclTermException(
          String.format(
              "Standard ACLs cannot use source or destination addresses (term '%s')",
              term.getName()));
    }
    if (!term.getOptions().isEmpty()) {
      throw new StandardAclTermException(
          String.format("Standard ACLs prohibit use of options (term '%s')", term.getName()));
    }
    if (!term.getSourcePorts().isEmpty() || !term.getDestinationPorts().isEmpty()) {
      throw new StandardAclTermException(
          String.format("Standard ACLs prohibit use of port numbers (term '%s')", term.getName()));
    }
    if (term.getCounter() != null) {
      throw new StandardAclTermException(
          String.format(
              "Counters are not implemented in standard ACLs (term '%s')", term.getName()));
    }
    if (term.getLogging()) {
      throw new StandardAclTermException(
          String.format(
              "Logging is not implemented in standard ACLs (term '%s')", term.getName()));
    }
  }

  @Override
  protected void renderStatements(ImmutableList.Builder<String> lines) {
    String action = CiscoActions.toCisco(_term.getAction());
    for (Address address : _term.getAddresses()) {
      switch (address.getFamily()) {
        case IPV4:
          lines.add(
              address.isHost()
                  ? String.format("access-list %s %s %s", _filterName, action, address.getIp())
                  : String.format(
                      "access-list %s %s %s %s",
                      _filterName, action, address.getIp(), address.getHostmask()));
          break;
        case IPV6:
          LOGGER.debug(
              "Ignoring unsupported IPv6 address {} in standard ACL term '{}'",
              address,
              _term.getName());
          break;
        default:
          throw new IllegalStateException("Unsupported address family: " + address.getFamily());
      }
    }
  }
}
