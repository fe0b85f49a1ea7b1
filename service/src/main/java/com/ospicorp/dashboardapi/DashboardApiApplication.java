package com.ospicorp.dashboardapi;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class DashboardApiApplication {

  public static void main(String[] args) {
    SpringApplication.run(DashboardApiApplication.class, args);
  }
}
