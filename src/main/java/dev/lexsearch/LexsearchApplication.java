package dev.lexsearch;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Entry point for the lexsearch hybrid retrieval service.
 *
 * <p>The default configuration uses PostgreSQL with pgvector and in-process ONNX models. The {@code
 * memory} profile runs without a database or model files.
 */
@SpringBootApplication
public class LexsearchApplication {
  public static void main(String[] args) {
    SpringApplication.run(LexsearchApplication.class, args);
  }
}
