package io.swapgate.backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SwapGateApplication {
  public static void main(String[] args) {
    SpringApplication.run(SwapGateApplication.class, args);
  }
}
