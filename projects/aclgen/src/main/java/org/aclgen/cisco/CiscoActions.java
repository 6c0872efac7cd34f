package org.aclgen.cisco;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;
import java.util.Map;
import org.aclgen.datamodel.TermAction;

/** IOS keywords for each {@link TermAction}. */
final class CiscoActions {

  // IOS cannot answer with a TCP reset, so reject-with-tcp-rst degrades to a plain deny
  private static final Map<TermAction, String> ACTIONS =
      Maps.immutableEnumMap(
          ImmutableMap.of(
              TermAction.ACCEPT, "permit",
              TermAction.DENY, "deny",
              TermAction.REJECT, "deny",
              TermAction.NEXT, "! next",
              TermAction.REJECT_WITH_TCP_RST, "deny"));

  static String toCisco(TermAction action) {
    return ACTIONS.get(action);
  }

  private CiscoActions() {}
}
