package com.flamingo.ai.deconstructor;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PaperDeconstructorApplication {

  public static void main(String[] args) {
    SpringApplication.run(PaperDeconstructorApplication.class, args);
  }
}
