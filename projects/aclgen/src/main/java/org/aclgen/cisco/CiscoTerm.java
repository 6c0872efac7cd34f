package org.aclgen.cisco;

import com.google.common.base.Ascii;
import com.google.common.base.Joiner;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.stream.Stream;
import javax.annotation.Nonnull;
import org.aclgen.datamodel.Term;
import org.aclgen.datamodel.VerbatimLine;

/**
 * Renders one {@link Term} into the lines of one access list.
 *
 * <p>Every term starts with a remark carrying its name and one remark per comment line. A term with
 * verbatim lines is replaced by the verbatim text meant for this platform and nothing else is
 * generated for it.
 */
public abstract class CiscoTerm {

  private static final Joiner FIELD_JOINER = Joiner.on(' ');

  private static final Splitter LINE_SPLITTER = Splitter.on('\n');

  protected final @Nonnull Term _term;

  private final int _remarkMaxLength;

  protected CiscoTerm(Term term, CiscoSettings settings) {
    _term = term;
    _remarkMaxLength = settings.getRemarkMaxLength();
  }

  @Nonnull
  public Term getTerm() {
    return _term;
  }

  /** Returns the rendered lines of the term. */
  @Nonnull
  public final List<String> render() {
    ImmutableList.Builder<String> lines = ImmutableList.builder();
    lines.add("remark " + _term.getName());
    for (String comment : _term.getComments()) {
      for (String line : LINE_SPLITTER.split(comment)) {
        lines.add("remark " + Ascii.truncate(line, _remarkMaxLength, ""));
      }
    }
    if (!_term.getVerbatim().isEmpty()) {
      for (VerbatimLine verbatim : _term.getVerbatim()) {
        if (verbatim.getPlatform().equals(CiscoRenderer.PLATFORM)) {
          lines.add(verbatim.getText());
        }
      }
      return lines.build();
    }
    renderStatements(lines);
    return lines.build();
  }

  /** Adds the match statements of the term, after its remarks. */
  protected abstract void renderStatements(ImmutableList.Builder<String> lines);

  /** Joins the non-empty fields of an access-list entry, indented by one space. */
  static String entry(String... fields) {
    return " " + FIELD_JOINER.join(Stream.of(fields).filter(field -> !field.isEmpty()).iterator());
  }
}
