package com.ospicorp.edacharts;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class EdaChartsApplication {

  public static void main(String[] args) {
    SpringApplication.run(EdaChartsApplication.class, args);
  }
}
