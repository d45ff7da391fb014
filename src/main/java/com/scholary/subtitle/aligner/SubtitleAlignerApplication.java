package com.scholary.subtitle.aligner;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SubtitleAlignerApplication {

  public static void main(String[] args) {
    SpringApplication.run(SubtitleAlignerApplication.class, args);
  }
}
