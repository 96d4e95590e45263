package org.waabox.qdb.example;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Spring Boot application entry point for the qdb example service.
 *
 * <p>This application demonstrates how to use the qdb client with Spring
 * Boot, including:
 * <ul>
 *   <li>the REST transport configured through {@code qdb.*} properties</li>
 *   <li>connection supervision with automatic reconnects</li>
 *   <li>a custom worker that subscribes to garage door state changes</li>
 * </ul>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@SpringBootApplication
public class ExampleApplication {

  /**
   * Launches the Spring Boot application.
   *
   * @param args the command-line arguments
   */
  public static void main(final String[] args) {
    SpringApplication.run(ExampleApplication.class, args);
  }
}
