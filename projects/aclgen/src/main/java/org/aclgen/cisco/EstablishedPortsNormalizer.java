package org.aclgen.cisco;

import static com.google.common.collect.ImmutableList.toImmutableList;

import javax.annotation.Nonnull;
import org.aclgen.datamodel.Filter;
import org.aclgen.datamodel.Policy;
import org.aclgen.datamodel.PortRange;
import org.aclgen.datamodel.Term;

/**
 * Adds the high destination ports to every term with an {@code established} option. A stateless
 * filter cannot track connections, so return traffic is admitted by destination port instead.
 *
 * <p>Produces new terms; the input policy is left untouched.
 */
public final class EstablishedPortsNormalizer {

  static final String ESTABLISHED = "established";

  private final @Nonnull PortRange _highPorts;

  public EstablishedPortsNormalizer(PortRange highPorts) {
    _highPorts = highPorts;
  }

  @Nonnull
  public Policy normalize(Policy policy) {
    return new Policy(
        policy.getFilters().stream()
            .map(
                filter ->
                    new Filter(
                        filter.getHeader(),
                        filter.getTerms().stream().map(this::normalize).collect(toImmutableList())))
            .collect(toImmutableList()));
  }

  @Nonnull
  public Term normalize(Term term) {
    if (!term.hasOptionWithPrefix(ESTABLISHED)) {
      return term;
    }
    return term.toBuilder().addDestinationPort(_highPorts).build();
  }
}
