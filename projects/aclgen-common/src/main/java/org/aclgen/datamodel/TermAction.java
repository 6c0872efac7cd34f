package org.aclgen.datamodel;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import javax.annotation.Nullable;

/** What a filter does with traffic matched by a {@link Term}. */
public enum TermAction {
  ACCEPT("accept"),
  DENY("deny"),
  /** deny, telling the sender */
  REJECT("reject"),
  /** continue with the next term */
  NEXT("next"),
  REJECT_WITH_TCP_RST("reject-with-tcp-rst");

  private final String _name;

  TermAction(String name) {
    _name = name;
  }

  @JsonCreator
  public static TermAction fromName(@Nullable String name) {
    for (TermAction action : values()) {
      if (action._name.equalsIgnoreCase(name)) {
        return action;
      }
    }
    throw new IllegalArgumentException("Unknown term action: " + name);
  }

  @JsonValue
  public String getName() {
    return _name;
  }

  @Override
  public String toString() {
    return _name;
  }
}
