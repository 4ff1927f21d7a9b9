package com.ospicorp.netload.config;

import java.time.Duration;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

@Configuration
public class StoreClientConfig {

  // the store's timeout is the only one applied to range queries
  @Bean
  RestTemplate storeRestTemplate(RestTemplateBuilder builder,
      @Value("${load.store.timeout:PT30S}") Duration timeout) {
    return builder
        .setConnectTimeout(timeout)
        .setReadTimeout(timeout)
        .build();
  }
}
