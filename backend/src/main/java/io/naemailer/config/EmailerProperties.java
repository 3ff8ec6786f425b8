package io.naemailer.config;

import io.naemailer.filter.FilterMode;
import io.naemailer.recipient.RecipientField;
import io.naemailer.recipient.RecipientParser;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Process-wide settings, bound once at startup. Relaxed binding maps the deployment's {@code NA_*}
 * environment variables onto these properties (e.g. {@code NA_EMAIL_TO} to {@code na.email.to}).
 */
@Validated
@ConfigurationProperties("na")
public record EmailerProperties(
    @DefaultValue("INFO") String logLevel,
    boolean dryRun,
    @Valid @DefaultValue Email email,
    String filtersJson,
    @DefaultValue("all") FilterMode filterMode,
    @Valid @DefaultValue Templates templates) {

  /**
   * Sender and static default recipients.
   *
   * @param to default To recipients, used when an event does not specify its own
   */
  public record Email(@NotBlank String from, List<String> to, List<String> cc, List<String> bcc) {

    public List<String> defaults(RecipientField field) {
      return RecipientParser.parse(
          switch (field) {
            case TO -> to;
            case CC -> cc;
            case BCC -> bcc;
          });
    }
  }

  /**
   * Configured template sources.
   *
   * @param inlineJson JSON object with {@code subject}, {@code text} and {@code html} templates;
   *     takes precedence over {@code location}
   * @param location resource location holding {@code subject.txt}, {@code text.txt} and {@code
   *     html.html}
   */
  public record Templates(
      String inlineJson, @DefaultValue("classpath:/templates/email/") String location) {}
}
