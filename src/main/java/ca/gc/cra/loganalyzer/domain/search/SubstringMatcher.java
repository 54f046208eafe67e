package ca.gc.cra.loganalyzer.domain.search;

import java.util.Locale;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * Literal substring predicate applied to each log line by the search workers.
 *
 * <p>Matching is case-sensitive by default. With {@code ignoreCase} both sides are lower-cased using
 * {@link Locale#ROOT}. Instances are immutable and safe to share between workers.</p>
 *
 * @since 0.1.0
 */
public final class SubstringMatcher implements Predicate<String> {
  private final String term;
  private final boolean ignoreCase;
  private final String needle;

  /**
   * Creates a matcher for {@code term}.
   *
   * @param term literal to search for; must be non-empty
   * @param ignoreCase whether to compare case-insensitively
   */
  public SubstringMatcher(String term, boolean ignoreCase) {
    this.term = Objects.requireNonNull(term, "term");
    if (term.isEmpty()) {
      throw new IllegalArgumentException("term must not be empty");
    }
    this.ignoreCase = ignoreCase;
    this.needle = ignoreCase ? term.toLowerCase(Locale.ROOT) : term;
  }

  /**
   * Creates a case-sensitive matcher.
   *
   * @param term literal to search for
   * @return matcher for {@code term}
   */
  public static SubstringMatcher of(String term) {
    return new SubstringMatcher(term, false);
  }

  @Override
  public boolean test(String line) {
    if (line == null) {
      return false;
    }
    String haystack = ignoreCase ? line.toLowerCase(Locale.ROOT) : line;
    return haystack.contains(needle);
  }

  public String term() {
    return term;
  }

  public boolean ignoreCase() {
    return ignoreCase;
  }

  @Override
  public String toString() {
    return "SubstringMatcher[term=" + term + ", ignoreCase=" + ignoreCase + "]";
  }
}
