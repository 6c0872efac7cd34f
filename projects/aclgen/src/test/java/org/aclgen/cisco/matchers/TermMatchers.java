package org.aclgen.cisco.matchers;

import static org.hamcrest.Matchers.equalTo;

import java.util.List;
import javax.annotation.Nonnull;
import org.aclgen.cisco.matchers.TermMatchersImpl.HasDestinationPorts;
import org.aclgen.cisco.matchers.TermMatchersImpl.HasName;
import org.aclgen.cisco.matchers.TermMatchersImpl.HasOptions;
import org.aclgen.datamodel.PortRange;
import org.aclgen.datamodel.Term;
import org.hamcrest.Matcher;

public final class TermMatchers {

  /** Provides a matcher that matches if the {@link Term}'s name is {@code expectedName}. */
  public static @Nonnull Matcher<Term> hasName(@Nonnull String expectedName) {
    return new HasName(equalTo(expectedName));
  }

  /**
   * Provides a matcher that matches if the {@link Term}'s destination ports are matched by {@code
   * subMatcher}.
   */
  public static @Nonnull Matcher<Term> hasDestinationPorts(
      @Nonnull Matcher<? super List<PortRange>> subMatcher) {
    return new HasDestinationPorts(subMatcher);
  }

  public static @Nonnull Matcher<Term> hasOptions(
      @Nonnull Matcher<? super List<String>> subMatcher) {
    return new HasOptions(subMatcher);
  }

  private TermMatchers() {}
}
