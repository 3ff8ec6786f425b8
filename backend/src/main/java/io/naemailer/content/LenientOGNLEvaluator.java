package io.naemailer.content;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.thymeleaf.context.IExpressionContext;
import org.thymeleaf.standard.expression.IStandardVariableExpression;
import org.thymeleaf.standard.expression.IStandardVariableExpressionEvaluator;
import org.thymeleaf.standard.expression.OGNLVariableExpressionEvaluator;
import org.thymeleaf.standard.expression.StandardExpressionExecutionContext;

/**
 * OGNL evaluation with unresolvable expressions mapped to {@code null}. OGNL reads {@code
 * map.key} natively, which is how templates walk the event attribute and payload maps.
 */
class LenientOGNLEvaluator implements IStandardVariableExpressionEvaluator {

  private static final Logger log = LoggerFactory.getLogger(LenientOGNLEvaluator.class);

  static final LenientOGNLEvaluator INSTANCE = new LenientOGNLEvaluator();

  private final OGNLVariableExpressionEvaluator delegate =
      new OGNLVariableExpressionEvaluator(true);

  @Override
  public Object evaluate(
      IExpressionContext context,
      IStandardVariableExpression expression,
      StandardExpressionExecutionContext expContext) {
    try {
      return delegate.evaluate(context, expression, expContext);
    } catch (RuntimeException e) {
      log.debug(
          "Template expression '{}' did not resolve, rendering empty: {}",
          expression.getExpression(),
          e.getMessage());
      return null;
    }
  }
}
