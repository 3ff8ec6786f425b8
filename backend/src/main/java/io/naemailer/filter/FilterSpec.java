package io.naemailer.filter;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.ArrayList;
import java.util.List;

/**
 * Declarative predicate set, configured as a JSON object mapping attribute paths to the value (or
 * list of values) they must have:
 *
 * <pre>{@code
 * {"type": "com.example.order.*", "source": ["/billing", "/shop"], "data.priority": "high"}
 * }</pre>
 *
 * An empty spec matches every event.
 */
public record FilterSpec(List<FilterPredicate> predicates) {

  public static final FilterSpec EMPTY = new FilterSpec(List.of());

  public FilterSpec {
    predicates = List.copyOf(predicates);
  }

  public boolean isEmpty() {
    return predicates.isEmpty();
  }

  /**
   * Parses the JSON form.
   *
   * @throws IllegalArgumentException if {@code json} is not an object of scalars or scalar lists
   */
  public static FilterSpec parse(String json, ObjectMapper objectMapper) {
    if (json == null || json.isBlank()) {
      return EMPTY;
    }
    JsonNode root;
    try {
      root = objectMapper.readTree(json);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Filter specification is not valid JSON", e);
    }
    if (root == null || root.isNull()) {
      return EMPTY;
    }
    if (!root.isObject()) {
      throw new IllegalArgumentException("Filter specification must be a JSON object");
    }

    var predicates = new ArrayList<FilterPredicate>();
    var fields = root.fields();
    while (fields.hasNext()) {
      var field = fields.next();
      String path = field.getKey();
      predicates.add(new FilterPredicate(path, expectedValues(path, field.getValue())));
    }
    return new FilterSpec(predicates);
  }

  private static List<String> expectedValues(String path, JsonNode node) {
    if (node.isArray()) {
      var values = new ArrayList<String>();
      node.forEach(element -> values.add(scalar(path, element)));
      return values;
    }
    return List.of(scalar(path, node));
  }

  private static String scalar(String path, JsonNode node) {
    if (!node.isValueNode() || node.isNull()) {
      throw new IllegalArgumentException(
          "Filter value for '" + path + "' must be a string, number, boolean or a list of them");
    }
    return node.asText();
  }
}
