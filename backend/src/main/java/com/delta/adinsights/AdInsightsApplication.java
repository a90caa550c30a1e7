package com.delta.adinsights;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class AdInsightsApplication {

  public static void main(String[] args) {
    SpringApplication.run(AdInsightsApplication.class, args);
  }
}
