package com.flamingo.ai.olivia;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/** Entry point for the Olivia document Q&A backend. */
@SpringBootApplication
public class OliviaApplication {

  public static void main(String[] args) {
    SpringApplication.run(OliviaApplication.class, args);
  }
}
