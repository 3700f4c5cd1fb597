package com.flamingo.ai.museumguide;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/** Entry point of the museum guide retrieval service. */
@SpringBootApplication
public class MuseumGuideApplication {

  public static void main(String[] args) {
    SpringApplication.run(MuseumGuideApplication.class, args);
  }
}
