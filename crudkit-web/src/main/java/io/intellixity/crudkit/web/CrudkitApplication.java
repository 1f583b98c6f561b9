package io.intellixity.crudkit.web;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.mongo.MongoAutoConfiguration;

@SpringBootApplication(exclude = {MongoAutoConfiguration.class})
public class CrudkitApplication {
  public static void main(String[] args) {
    SpringApplication.run(CrudkitApplication.class, args);
  }
}
