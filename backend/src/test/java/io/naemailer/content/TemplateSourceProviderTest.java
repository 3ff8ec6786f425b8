package io.naemailer.content;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.naemailer.config.EmailerProperties;
import io.naemailer.filter.FilterMode;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.DefaultResourceLoader;

class TemplateSourceProviderTest {

  private static TemplateSourceProvider provider(String inlineJson, String location) {
    var properties =
        new EmailerProperties(
            "INFO",
            false,
            new EmailerProperties.Email("na@example.com", null, null, null),
            null,
            FilterMode.ALL,
            new EmailerProperties.Templates(inlineJson, location));
    return new TemplateSourceProvider(properties, new ObjectMapper(), new DefaultResourceLoader());
  }

  @Test
  void loads_bundled_default_templates() {
    var configured = provider(null, "classpath:/templates/email/").configured();

    assertThat(configured.subject()).contains("event.type");
    assertThat(configured.text()).isNotBlank();
    assertThat(configured.html()).contains("<html");
  }

  @Test
  void missing_files_are_left_empty_and_location_slash_is_optional() {
    var configured = provider(null, "classpath:templates/text-only").configured();

    assertThat(configured.subject()).startsWith("Alert:");
    assertThat(configured.text()).startsWith("Event");
    assertThat(configured.html()).isNull();
  }

  @Test
  void inline_json_takes_precedence_over_location() {
    var configured =
        provider(
                "{\"subject\": \"Inline [[${event.type}]]\", \"html\": \"<b>hi</b>\"}",
                "classpath:/templates/email/")
            .configured();

    assertThat(configured)
        .isEqualTo(new TemplateSet("Inline [[${event.type}]]", null, "<b>hi</b>"));
  }

  @Test
  void invalid_inline_json_fails_startup() {
    assertThatThrownBy(() -> provider("{\"subject\": ", null))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("inline-json");
  }

  @Test
  void templates_without_subject_fail_startup() {
    assertThatThrownBy(() -> provider(null, "classpath:/templates/no-subject/"))
        .isInstanceOf(IllegalStateException.class);
    assertThatThrownBy(() -> provider(null, "classpath:/templates/does-not-exist/"))
        .isInstanceOf(IllegalStateException.class);
  }
}
