package io.naemailer.content;

import org.thymeleaf.standard.StandardDialect;
import org.thymeleaf.standard.expression.IStandardVariableExpressionEvaluator;

/**
 * Standard Thymeleaf dialect whose variable expressions never fail. Event payloads are loosely
 * structured, so a template navigating into a missing branch (e.g. {@code ${data.order.id}} when
 * {@code order} is absent) renders empty instead of aborting the notification.
 */
public class LenientStandardDialect extends StandardDialect {

  @Override
  public IStandardVariableExpressionEvaluator getVariableExpressionEvaluator() {
    return LenientOGNLEvaluator.INSTANCE;
  }
}
