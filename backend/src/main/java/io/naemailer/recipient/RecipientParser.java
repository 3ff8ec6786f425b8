package io.naemailer.recipient;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;

/**
 * Parses a loosely typed recipient value into an ordered address list. Order and duplicates are
 * preserved; addresses are not validated.
 */
public final class RecipientParser {

  private RecipientParser() {}

  /**
   * Parses {@code value}.
   *
   * <ul>
   *   <li>{@code null} or {@code ""}: empty list
   *   <li>a collection or array: each element stringified and trimmed, blanks dropped
   *   <li>a string: split on commas, each segment trimmed, blanks dropped
   *   <li>anything else: empty list
   * </ul>
   */
  public static List<String> parse(Object value) {
    if (value == null) {
      return List.of();
    }
    if (value instanceof String text) {
      return parseDelimited(text);
    }
    if (value instanceof Collection<?> items) {
      return collect(items);
    }
    if (value instanceof Object[] array) {
      return collect(Arrays.asList(array));
    }
    return List.of();
  }

  private static List<String> parseDelimited(String text) {
    var result = new ArrayList<String>();
    for (String segment : text.split(",")) {
      String address = segment.strip();
      if (!address.isEmpty()) {
        result.add(address);
      }
    }
    return List.copyOf(result);
  }

  private static List<String> collect(Collection<?> items) {
    var result = new ArrayList<String>();
    for (Object item : items) {
      String address = String.valueOf(item).strip();
      if (!address.isEmpty()) {
        result.add(address);
      }
    }
    return List.copyOf(result);
  }
}
