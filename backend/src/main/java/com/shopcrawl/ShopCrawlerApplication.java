package com.shopcrawl;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class ShopCrawlerApplication {

  public static void main(String[] args) {
    SpringApplication.run(ShopCrawlerApplication.class, args);
  }
}
