package io.naemailer.content;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Screens templates that arrive inside events for Server-Side Template Injection. Only expression
 * bodies ({@code ${...}}, {@code *{...}}, {@code #{...}}, {@code @{...}}, {@code ~{...}}) are
 * inspected, so ordinary prose such as "Alert (prod)" is unaffected. Preprocessing ({@code
 * __...__}) is rejected wherever it appears.
 */
public final class TemplateSecurityValidator {

  private TemplateSecurityValidator() {}

  private static final Pattern EXPRESSION = Pattern.compile("[$*#@~]\\{[^}]*}");

  private static final Pattern PREPROCESSING = Pattern.compile("__\\s*[$*#@~]\\{");

  private static final List<DangerousPattern> DANGEROUS_PATTERNS =
      List.of(
          new DangerousPattern(
              Pattern.compile("\\bT\\s*\\("), "Type expressions (T()) are not allowed"),
          new DangerousPattern(
              Pattern.compile("\\bnew\\s+[A-Za-z_]"), "Object instantiation (new) is not allowed"),
          new DangerousPattern(
              Pattern.compile("^[$*]\\{\\s*#"), "Utility object access (${#...}) is not allowed"),
          new DangerousPattern(
              Pattern.compile(
                  "#(ctx|root|execInfo|vars|request|response|session|servletContext)\\b"),
              "Access to Thymeleaf context objects is not allowed"),
          new DangerousPattern(
              Pattern.compile("@[A-Za-z_]"), "Bean references (@bean) are not allowed"),
          new DangerousPattern(
              Pattern.compile("getClass\\s*\\(|\\.class\\b"), "Reflective access is not allowed"),
          new DangerousPattern(
              Pattern.compile(
                  "Runtime|ProcessBuilder|ClassLoader|System\\.", Pattern.CASE_INSENSITIVE),
              "Access to dangerous Java classes is not allowed"));

  /**
   * Validates every template of {@code templates}.
   *
   * @throws TemplateSecurityException naming the first violation found
   */
  public static void validate(TemplateSet templates) {
    validate("subject", templates.subject());
    validate("text", templates.text());
    validate("html", templates.html());
  }

  static void validate(String part, String content) {
    if (content == null || content.isBlank()) {
      return;
    }
    if (PREPROCESSING.matcher(content).find()) {
      throw new TemplateSecurityException(
          "Preprocessing expressions (__${...}__) are not allowed in the " + part + " template");
    }
    var expressions = EXPRESSION.matcher(content);
    while (expressions.find()) {
      String expression = expressions.group();
      for (var pattern : DANGEROUS_PATTERNS) {
        if (pattern.pattern().matcher(expression).find()) {
          throw new TemplateSecurityException(pattern.message() + " in the " + part + " template");
        }
      }
    }
  }

  private record DangerousPattern(Pattern pattern, String message) {}
}
