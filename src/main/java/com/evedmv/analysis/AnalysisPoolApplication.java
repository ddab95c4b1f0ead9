package com.evedmv.analysis;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class AnalysisPoolApplication {

  public static void main(String[] args) {
    SpringApplication.run(AnalysisPoolApplication.class, args);
  }
}
