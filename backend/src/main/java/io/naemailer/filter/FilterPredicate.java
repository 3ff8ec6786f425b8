package io.naemailer.filter;

import java.util.List;
import java.util.Objects;
import org.springframework.util.PatternMatchUtils;

/**
 * One attribute condition: the value at {@code path} must equal one of {@code expected}. Expected
 * values may use {@code *} wildcards.
 *
 * @param path an attribute name, or {@code data.<key>} for a key of a structured payload
 */
public record FilterPredicate(String path, List<String> expected) {

  public FilterPredicate {
    Objects.requireNonNull(path, "path");
    expected = List.copyOf(expected);
  }

  boolean test(Object actual) {
    if (actual == null) {
      return false;
    }
    String value = String.valueOf(actual);
    for (String candidate : expected) {
      if (PatternMatchUtils.simpleMatch(candidate, value)) {
        return true;
      }
    }
    return false;
  }
}
