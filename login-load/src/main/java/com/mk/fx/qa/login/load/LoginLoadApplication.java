package com.mk.fx.qa.login.load;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class LoginLoadApplication {

  public static void main(String[] args) {
    System.exit(SpringApplication.exit(SpringApplication.run(LoginLoadApplication.class, args)));
  }
}
