package io.b2mash.dashhub;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class DashhubApplication {

  public static void main(String[] args) {
    SpringApplication.run(DashhubApplication.class, args);
  }
}
