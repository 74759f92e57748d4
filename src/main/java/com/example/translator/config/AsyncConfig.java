package com.example.translator.config;

import com.example.translator.properties.ApplicationProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Executors for work that must not run on the request thread: SSE relays and login
 * notifications. Each pool is isolated so a slow mail server cannot starve the relays.
 */
@Slf4j
@Configuration(proxyBeanMethods = false)
@RequiredArgsConstructor
public class AsyncConfig {

  private final ApplicationProperties properties;

  @Bean
  public ThreadPoolTaskExecutor relayTaskExecutor() {
    ApplicationProperties.RelayProperties relay = properties.relay();
    log.info("Configuring relay executor with {} workers", relay.workerThreads());
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setThreadNamePrefix("relay-");
    executor.setCorePoolSize(relay.workerThreads());
    executor.setMaxPoolSize(relay.workerThreads());
    executor.setQueueCapacity(relay.queueCapacity());
    executor.setWaitForTasksToCompleteOnShutdown(false);
    return executor;
  }

  @Bean
  public ThreadPoolTaskExecutor notificationTaskExecutor() {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setThreadNamePrefix("notify-");
    executor.setCorePoolSize(1);
    executor.setMaxPoolSize(2);
    executor.setQueueCapacity(32);
    executor.setWaitForTasksToCompleteOnShutdown(true);
    executor.setAwaitTerminationSeconds(10);
    return executor;
  }
}
