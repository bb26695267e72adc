package io.b2mash.compliance;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.retry.annotation.EnableRetry;

@SpringBootApplication
@EnableRetry
public class ComplianceApplication {

  public static void main(String[] args) {
    SpringApplication.run(ComplianceApplication.class, args);
  }
}
