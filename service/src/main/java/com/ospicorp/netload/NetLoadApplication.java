package com.ospicorp.netload;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class NetLoadApplication {

  public static void main(String[] args) {
    SpringApplication.run(NetLoadApplication.class, args);
  }
}
