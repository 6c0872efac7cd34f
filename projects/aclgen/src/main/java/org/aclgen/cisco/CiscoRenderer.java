package org.aclgen.cisco;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Joiner;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import java.util.List;
import javax.annotation.Nonnull;
import org.aclgen.datamodel.AddressExcluder;
import org.aclgen.datamodel.AddressFamily;
import org.aclgen.datamodel.Filter;
import org.aclgen.datamodel.FilterHeader;
import org.aclgen.datamodel.Policy;
import org.aclgen.datamodel.Term;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Renders a {@link Policy} into Cisco IOS access-list configuration.
 *
 * <p>The document starts with two revision-control keyword lines. Object-group definitions, if any
 * filter is an object-group filter, come next, followed by one block per access list: the
 * statements removing and declaring it, the filter's comments as remarks, then its terms.
 *
 * <p>Filters are chosen by the {@code cisco} target of their header, whose options are the filter
 * name and, optionally, one of the {@link CiscoFilterType}s ({@code extended} when absent).
 */
public final class CiscoRenderer {

  private static final Logger LOGGER = LogManager.getLogger(CiscoRenderer.class);

  public static final String PLATFORM = "cisco";

  /** File suffix for rendered documents. */
  public static final String SUFFIX = ".acl";

  @VisibleForTesting
  static final List<String> DOCUMENT_HEADER = ImmutableList.of("! $Id:$", "! $Date:$");

  private static final Splitter LINE_SPLITTER = Splitter.on('\n');

  private final @Nonnull Policy _policy;
  private final @Nonnull CiscoSettings _settings;
  private final @Nonnull ProtocolResolver _protocolResolver;
  private final @Nonnull TermNormalizer _normalizer;

  public CiscoRenderer(Policy policy) {
    this(policy, CiscoSettings.defaults());
  }

  public CiscoRenderer(Policy policy, CiscoSettings settings) {
    this(policy, settings, AddressExcluder.DEFAULT);
  }

  /**
   * @throws NoPlatformPolicyException if no filter of {@code policy} targets {@value #PLATFORM}
   */
  public CiscoRenderer(Policy policy, CiscoSettings settings, AddressExcluder excluder) {
    if (policy.getHeaders().stream().noneMatch(header -> header.targets(PLATFORM))) {
      throw new NoPlatformPolicyException(
          String.format("No %s policy found in %s", PLATFORM, policy.getHeaders()));
    }
    _settings = settings;
    _policy = new EstablishedPortsNormalizer(settings.getEstablishedPortRange()).normalize(policy);
    _protocolResolver = new ProtocolResolver(settings);
    _normalizer = new TermNormalizer(excluder);
  }

  /** The policy as rendered, after the {@code established} ports were added. */
  @Nonnull
  public Policy getPolicy() {
    return _policy;
  }

  /**
   * Renders the whole document.
   *
   * @throws UnsupportedAccessListException if a filter has an unknown type or a name its type does
   *     not allow
   * @throws StandardAclTermException if a standard filter has a term standard ACLs cannot express
   */
  @Nonnull
  public String render() {
    return Joiner.on('\n').join(renderLines());
  }

  /** Like {@link #render()}, one element per line. */
  @Nonnull
  public List<String> renderLines() {
    ObjectGroupCollector objectGroups = new ObjectGroupCollector(_normalizer);
    ImmutableList.Builder<String> body = ImmutableList.builder();
    int rendered = 0;
    for (Filter filter : _policy.getFilters()) {
      if (!filter.getHeader().targets(PLATFORM)) {
        LOGGER.debug("Skipping filter not targeting {}: {}", PLATFORM, filter.getHeader());
        continue;
      }
      renderFilter(filter, objectGroups, body);
      rendered++;
      if (_settings.getFirstFilterOnly()) {
        LOGGER.info("Rendering only the first {} filter", PLATFORM);
        break;
      }
    }

    ImmutableList.Builder<String> document = ImmutableList.builder();
    document.addAll(DOCUMENT_HEADER);
    if (objectGroups.isValid()) {
      document.add("");
      document.addAll(objectGroups.render());
    }
    List<String> lines = document.addAll(body.build()).build();
    LOGGER.info("Rendered {} {} filter(s) into {} lines", rendered, PLATFORM, lines.size());
    return lines;
  }

  private void renderFilter(
      Filter filter, ObjectGroupCollector objectGroups, ImmutableList.Builder<String> out) {
    FilterHeader header = filter.getHeader();
    List<String> options = header.getFilterOptions(PLATFORM);
    String filterName = header.getFilterName(PLATFORM);
    CiscoFilterType declaredType =
        options.size() > 1 ? CiscoFilterType.fromName(options.get(1)) : CiscoFilterType.EXTENDED;

    for (CiscoFilterType type : declaredType.expand()) {
      LOGGER.debug("Rendering {} access list '{}'", type, filterName);
      type.checkFilterName(filterName);
      out.addAll(type.preamble(filterName));
      if (type == CiscoFilterType.OBJECT_GROUP) {
        objectGroups.registerFilter(filterName);
      }
      for (String comment : header.getComments()) {
        for (String line : LINE_SPLITTER.split(comment)) {
          out.add("remark " + line);
        }
      }
      for (Term term : filter.getTerms()) {
        out.add("");
        out.addAll(toCiscoTerm(type, filterName, term, objectGroups).render());
      }
      out.add("");
    }
  }

  private CiscoTerm toCiscoTerm(
      CiscoFilterType type, String filterName, Term term, ObjectGroupCollector objectGroups) {
    switch (type) {
      case EXTENDED:
        return new ExtendedTerm(
            term, AddressFamily.IPV4, _settings, _protocolResolver, _normalizer);
      case INET6:
        return new ExtendedTerm(
            term, AddressFamily.IPV6, _settings, _protocolResolver, _normalizer);
      case STANDARD:
        return new StandardTerm(term, filterName, _settings);
      case OBJECT_GROUP:
        objectGroups.addTerm(term);
        return new ObjectGroupTerm(term, _settings, _protocolResolver, _normalizer);
      default:
        throw new IllegalStateException(type + " must be expanded before rendering");
    }
  }
}
