package com.delta.gapreview;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class GapReviewApplication {

  public static void main(String[] args) {
    SpringApplication.run(GapReviewApplication.class, args);
  }
}
