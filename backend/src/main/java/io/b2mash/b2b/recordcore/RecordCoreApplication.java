package io.b2mash.b2b.recordcore;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class RecordCoreApplication {

  public static void main(String[] args) {
    SpringApplication.run(RecordCoreApplication.class, args);
  }
}
