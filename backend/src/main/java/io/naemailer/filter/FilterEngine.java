package io.naemailer.filter;

import io.naemailer.event.EventContext;
import io.naemailer.event.PayloadDecoder;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Decides whether an event is worth a notification. Evaluation only reads the {@link
 * EventContext}; it never renders or sends anything.
 */
@Component
public class FilterEngine {

  private static final Logger log = LoggerFactory.getLogger(FilterEngine.class);
  private static final String DATA_PREFIX = "data.";

  private final PayloadDecoder payloadDecoder;

  public FilterEngine(PayloadDecoder payloadDecoder) {
    this.payloadDecoder = payloadDecoder;
  }

  public boolean matches(EventContext ctx, FilterSpec filterSpec, FilterMode mode) {
    if (filterSpec == null || filterSpec.isEmpty()) {
      return true;
    }
    boolean any = mode == FilterMode.ANY;
    for (FilterPredicate predicate : filterSpec.predicates()) {
      boolean matched = predicate.test(lookup(ctx, predicate.path()));
      log.trace("Filter predicate {} -> {}", predicate.path(), matched);
      if (any && matched) {
        return true;
      }
      if (!any && !matched) {
        return false;
      }
    }
    return !any;
  }

  private Object lookup(EventContext ctx, String path) {
    if (path.startsWith(DATA_PREFIX)) {
      String key = path.substring(DATA_PREFIX.length());
      Optional<Map<String, Object>> data = payloadDecoder.asMap(ctx.data());
      return data.map(values -> values.get(key)).orElse(null);
    }
    return ctx.attribute(path);
  }
}
