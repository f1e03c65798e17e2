package com.storyforge.backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class StoryforgeBackendApplication {

  public static void main(String[] args) {
    SpringApplication.run(StoryforgeBackendApplication.class, args);
  }
}
