package com.autoria.tracker;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class AutoRiaTrackerApplication {

  public static void main(String[] args) {
    SpringApplication.run(AutoRiaTrackerApplication.class, args);
  }
}
