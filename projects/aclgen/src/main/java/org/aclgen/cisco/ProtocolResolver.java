package org.aclgen.cisco;

import static com.google.common.collect.ImmutableList.toImmutableList;

import com.google.common.collect.ImmutableList;
import com.google.common.primitives.Ints;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import javax.annotation.Nonnull;
import org.aclgen.datamodel.IpProtocol;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Turns the protocols of a term into the form IOS expects. Names IOS has keywords for are kept, the
 * rest are replaced by their protocol number from the {@link IpProtocol} table.
 */
public final class ProtocolResolver {

  private static final Logger LOGGER = LogManager.getLogger(ProtocolResolver.class);

  /** IOS spelling of "any protocol". */
  static final String IP = "ip";

  private final Set<String> _literalProtocols;
  private final boolean _strict;

  public ProtocolResolver(CiscoSettings settings) {
    _literalProtocols = settings.getLiteralProtocols();
    _strict = settings.getStrictProtocols();
  }

  /**
   * Returns {@code protocol} as it should appear in a statement. Numbers, {@code ip} and names in
   * the literal keyword list come back unchanged. Names missing from the protocol table also come
   * back unchanged unless strict mode is on.
   *
   * @throws UnknownProtocolException in strict mode, for names missing from the protocol table
   */
  @Nonnull
  public String resolve(String protocol) {
    String name = protocol.trim().toLowerCase(Locale.ROOT);
    if (Ints.tryParse(name) != null || name.equals(IP) || _literalProtocols.contains(name)) {
      return protocol;
    }
    Optional<IpProtocol> known = IpProtocol.fromName(name);
    if (known.isPresent()) {
      return Integer.toString(known.get().number());
    }
    if (_strict) {
      throw new UnknownProtocolException(String.format("Unknown protocol '%s'", protocol));
    }
    LOGGER.warn("Unknown protocol '{}', writing it as given", protocol);
    return protocol;
  }

  /** Resolves every protocol of a term. A term without protocols matches {@code ip}. */
  @Nonnull
  public List<String> resolveAll(List<String> protocols) {
    if (protocols.isEmpty()) {
      return ImmutableList.of(IP);
    }
    return protocols.stream().map(this::resolve).collect(toImmutableList());
  }

  /** Returns the protocol number of a name or number, if it is known. */
  @Nonnull
  public static Optional<Integer> number(String protocol) {
    Integer number = Ints.tryParse(protocol.trim());
    if (number != null) {
      return Optional.of(number);
    }
    return IpProtocol.fromName(protocol).map(IpProtocol::number);
  }
}
