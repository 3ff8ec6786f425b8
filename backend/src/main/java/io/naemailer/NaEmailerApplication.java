package io.naemailer;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class NaEmailerApplication {

  public static void main(String[] args) {
    SpringApplication.run(NaEmailerApplication.class, args);
  }
}
