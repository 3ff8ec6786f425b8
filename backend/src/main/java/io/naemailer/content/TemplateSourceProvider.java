package io.naemailer.content;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.naemailer.config.EmailerProperties;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

/**
 * Loads the configured templates once at startup. {@code na.templates.inline-json} wins over
 * {@code na.templates.location}; the loaded set is read-only afterwards.
 */
@Component
public class TemplateSourceProvider {

  private static final Logger log = LoggerFactory.getLogger(TemplateSourceProvider.class);

  static final String SUBJECT_FILE = "subject.txt";
  static final String TEXT_FILE = "text.txt";
  static final String HTML_FILE = "html.html";

  private final TemplateSet configured;

  public TemplateSourceProvider(
      EmailerProperties properties, ObjectMapper objectMapper, ResourceLoader resourceLoader) {
    this.configured = load(properties.templates(), objectMapper, resourceLoader);
  }

  public TemplateSet configured() {
    return configured;
  }

  private static TemplateSet load(
      EmailerProperties.Templates templates,
      ObjectMapper objectMapper,
      ResourceLoader resourceLoader) {
    TemplateSet set;
    if (templates.inlineJson() != null && !templates.inlineJson().isBlank()) {
      try {
        set = TemplateSet.fromValue(templates.inlineJson(), objectMapper);
      } catch (IllegalArgumentException e) {
        throw new IllegalStateException("Invalid na.templates.inline-json: " + e.getMessage(), e);
      }
      log.info("Using inline templates from configuration");
    } else {
      String location = withTrailingSlash(templates.location());
      set =
          new TemplateSet(
              read(resourceLoader.getResource(location + SUBJECT_FILE)),
              read(resourceLoader.getResource(location + TEXT_FILE)),
              read(resourceLoader.getResource(location + HTML_FILE)));
      log.info(
          "Loaded templates from {}: subject={}, text={}, html={}",
          location,
          set.subject() != null,
          set.text() != null,
          set.html() != null);
    }

    if (set.subject() == null || !set.hasBody()) {
      throw new IllegalStateException(
          "Configured templates need a subject and at least one of text or html");
    }
    return set;
  }

  private static String read(Resource resource) {
    if (!resource.exists()) {
      return null;
    }
    try {
      return resource.getContentAsString(StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to read template " + resource.getDescription(), e);
    }
  }

  private static String withTrailingSlash(String location) {
    return location.endsWith("/") ? location : location + "/";
  }
}
