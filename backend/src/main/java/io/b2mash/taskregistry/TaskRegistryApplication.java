package io.b2mash.taskregistry;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class TaskRegistryApplication {

  public static void main(String[] args) {
    SpringApplication.run(TaskRegistryApplication.class, args);
  }
}
