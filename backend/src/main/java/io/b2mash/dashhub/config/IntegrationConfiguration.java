package io.b2mash.dashhub.config;

import io.b2mash.dashhub.integration.IntegrationProperties;
import java.time.Clock;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
@EnableConfigurationProperties(IntegrationProperties.class)
public class IntegrationConfiguration {

  /** Bounded pool shared by every upstream sub-call fan-out. */
  @Bean(name = "integrationCallExecutor")
  public ThreadPoolTaskExecutor integrationCallExecutor(IntegrationProperties properties) {
    var settings = properties.executor();
    var executor = new ThreadPoolTaskExecutor();
    executor.setThreadNamePrefix("integration-call-");
    executor.setCorePoolSize(settings.corePoolSize());
    executor.setMaxPoolSize(settings.maxPoolSize());
    executor.setQueueCapacity(settings.queueCapacity());
    executor.setWaitForTasksToCompleteOnShutdown(false);
    return executor;
  }

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }
}
