package com.scholary.storage;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class StorageSyncApplication {

  public static void main(String[] args) {
    SpringApplication.run(StorageSyncApplication.class, args);
  }
}
