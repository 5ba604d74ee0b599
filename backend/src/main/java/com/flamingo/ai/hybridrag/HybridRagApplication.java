package com.flamingo.ai.hybridrag;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/** Entry point for the hybrid vector + knowledge graph question answering service. */
@SpringBootApplication
public class HybridRagApplication {

  public static void main(String[] args) {
    SpringApplication.run(HybridRagApplication.class, args);
  }
}
