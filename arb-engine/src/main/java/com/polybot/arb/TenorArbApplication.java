package com.polybot.arb;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class TenorArbApplication {

  public static void main(String[] args) {
    SpringApplication.run(TenorArbApplication.class, args);
  }
}
