package org.aclgen.cisco;

import static com.google.common.collect.ImmutableList.toImmutableList;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.Iterables;
import com.google.common.collect.Multimaps;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import javax.annotation.Nonnull;
import org.aclgen.datamodel.Address;
import org.aclgen.datamodel.AddressFamily;
import org.aclgen.datamodel.PortRange;
import org.aclgen.datamodel.Term;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Collects the terms of object-group access lists and defines the address and port groups they
 * refer to. Each group is defined once, the first time a term uses it, no matter how many terms or
 * filters share it:
 *
 * <pre>
 * object-group ip address WEB_SERVERS
 *  10.0.0.0 255.255.255.0
 * exit
 *
 * object-group ip port 80-80
 *  eq 80
 * exit
 * </pre>
 *
 * <p>Groups hold the IPv4 networks a term matches after its exclusions are removed. A collector
 * accumulates the terms of one rendering and must not be reused for another.
 */
public final class ObjectGroupCollector {

  private static final Logger LOGGER = LogManager.getLogger(ObjectGroupCollector.class);

  private final TermNormalizer _normalizer;
  private final Set<String> _filterNames = new LinkedHashSet<>();
  private final List<Term> _terms = new ArrayList<>();

  public ObjectGroupCollector(TermNormalizer normalizer) {
    _normalizer = normalizer;
  }

  public void registerFilter(String filterName) {
    _filterNames.add(filterName);
  }

  public void addTerm(Term term) {
    _terms.add(term);
  }

  /** Whether any term was collected, i.e. whether there is anything to define. */
  public boolean isValid() {
    return !_terms.isEmpty();
  }

  @Nonnull
  public List<String> getFilterNames() {
    return ImmutableList.copyOf(_filterNames);
  }

  /** Returns the group definitions, in the order the collected terms first use them. */
  @Nonnull
  public List<String> render() {
    LOGGER.debug("Defining object groups for filters {}", _filterNames);
    Set<String> seenAddressGroups = new HashSet<>();
    Set<PortRange> seenPortGroups = new HashSet<>();
    ImmutableList.Builder<String> lines = ImmutableList.builder();
    for (Term term : _terms) {
      addressGroups(term, Direction.SOURCE, seenAddressGroups, lines);
      addressGroups(term, Direction.DESTINATION, seenAddressGroups, lines);
      for (PortRange port : Iterables.concat(term.getSourcePorts(), term.getDestinationPorts())) {
        if (!seenPortGroups.add(port)) {
          continue;
        }
        lines.add("object-group ip port " + ObjectGroupTerm.portGroupName(port));
        lines.add(
            port.isSinglePort()
                ? " eq " + port.getLow()
                : " range " + port.getLow() + " " + port.getHigh());
        lines.add("exit");
        lines.add("");
      }
    }
    return lines.build();
  }

  private void addressGroups(
      Term term, Direction direction, Set<String> seen, ImmutableList.Builder<String> lines) {
    // object groups only hold IPv4 networks; ANY needs no definition
    List<Address> addresses =
        _normalizer.effectiveAddresses(term, direction, AddressFamily.IPV4).stream()
            .filter(address -> !address.isAny())
            .map(AclAddress::getAddress)
            .collect(toImmutableList());
    ImmutableListMultimap<String, Address> groups =
        Multimaps.index(addresses, ObjectGroupTerm::groupName);
    for (String group : groups.keySet()) {
      if (!seen.add(group)) {
        continue;
      }
      lines.add("object-group ip address " + group);
      for (Address address : groups.get(group)) {
        lines.add(" " + address.getIp() + " " + address.getNetmask());
      }
      lines.add("exit");
      lines.add("");
    }
  }
}
