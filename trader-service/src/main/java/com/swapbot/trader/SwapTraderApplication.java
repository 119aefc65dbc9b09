package com.swapbot.trader;

import com.swapbot.config.SwapBotProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(SwapBotProperties.class)
public class SwapTraderApplication {

  public static void main(String[] args) {
    SpringApplication.run(SwapTraderApplication.class, args);
  }
}
