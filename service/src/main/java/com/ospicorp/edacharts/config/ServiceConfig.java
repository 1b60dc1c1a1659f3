package com.ospicorp.edacharts.config;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ThreadPoolExecutor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.web.client.RestTemplate;

@Configuration
public class ServiceConfig {

  @Bean
  Clock clock() {
    return Clock.systemUTC();
  }

  @Bean
  RestTemplate restTemplate(RestTemplateBuilder builder,
      @Value("${eda.rendering.connect-timeout:5s}") Duration connectTimeout,
      @Value("${eda.rendering.read-timeout:60s}") Duration readTimeout) {
    return builder
        .setConnectTimeout(connectTimeout)
        .setReadTimeout(readTimeout)
        .build();
  }

  /** Bounded pool for renderer calls; a saturated queue runs work on the caller. */
  @Bean
  ThreadPoolTaskExecutor chartRenderExecutor(
      @Value("${eda.rendering.parallelism:4}") int parallelism,
      @Value("${eda.rendering.queue-capacity:64}") int queueCapacity) {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(parallelism);
    executor.setMaxPoolSize(parallelism);
    executor.setQueueCapacity(queueCapacity);
    executor.setThreadNamePrefix("chart-render-");
    executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
    executor.setWaitForTasksToCompleteOnShutdown(true);
    return executor;
  }
}
