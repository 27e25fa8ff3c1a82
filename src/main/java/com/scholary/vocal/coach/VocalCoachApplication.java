package com.scholary.vocal.coach;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class VocalCoachApplication {

  public static void main(String[] args) {
    SpringApplication.run(VocalCoachApplication.class, args);
  }
}
