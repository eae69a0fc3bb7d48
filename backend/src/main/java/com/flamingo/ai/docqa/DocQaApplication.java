package com.flamingo.ai.docqa;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/** Main application class for the local document question-answering service. */
@SpringBootApplication
public class DocQaApplication {

  public static void main(String[] args) {
    SpringApplication.run(DocQaApplication.class, args);
  }
}
