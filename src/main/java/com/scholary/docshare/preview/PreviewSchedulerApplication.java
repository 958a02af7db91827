package com.scholary.docshare.preview;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class PreviewSchedulerApplication {

  public static void main(String[] args) {
    SpringApplication.run(PreviewSchedulerApplication.class, args);
  }
}
