package com.attorneyroster;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class AttorneyRosterApplication {

  public static void main(String[] args) {
    SpringApplication.run(AttorneyRosterApplication.class, args);
  }
}
