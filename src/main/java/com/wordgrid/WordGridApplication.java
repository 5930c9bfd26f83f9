package com.wordgrid;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.web.context.WebServerApplicationContext;
import org.springframework.context.ConfigurableApplicationContext;

/**
 * Runs as a one-shot command by default. Start with
 * {@code --spring.main.web-application-type=servlet} to serve the REST API instead.
 */
@SpringBootApplication
public class WordGridApplication {
  public static void main(String[] args) {
    ConfigurableApplicationContext ctx = SpringApplication.run(WordGridApplication.class, args);
    if (!(ctx instanceof WebServerApplicationContext)) {
      System.exit(SpringApplication.exit(ctx));
    }
  }
}
