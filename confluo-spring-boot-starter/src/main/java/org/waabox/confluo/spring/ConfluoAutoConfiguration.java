package org.waabox.confluo.spring;

import java.util.List;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.SmartLifecycle;
import org.springframework.context.annotation.Bean;
import org.waabox.confluo.Confluo;
import org.waabox.confluo.metrics.ConfluoMetrics;
import org.waabox.confluo.stream.ChangeStreamPort;

/**
 * Spring Boot auto-configuration for the Confluo subscription pool.
 *
 * <p>When the application context holds a {@link ChangeStreamPort} bean,
 * this configuration creates a singleton {@link Confluo} pool from
 * {@link ConfluoProperties}, wiring an optional {@link ConfluoMetrics}
 * bean. Without a port no pool is created.
 *
 * <p>The pool is shut down through a {@link SmartLifecycle}, so it stops
 * before the beans it delivers to.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@AutoConfiguration
@EnableConfigurationProperties(ConfluoProperties.class)
public class ConfluoAutoConfiguration {

  /** The class logger. */
  private static final Logger log = LoggerFactory.getLogger(
      ConfluoAutoConfiguration.class);

  /**
   * Creates the singleton {@link Confluo} bean.
   *
   * @param properties       the configuration properties, never null
   * @param changeStreamPort the transport, never null
   * @param metricsProvider  provider for an optional ConfluoMetrics bean
   *
   * @return the running pool, never null
   */
  @Bean
  @ConditionalOnBean(ChangeStreamPort.class)
  @ConditionalOnMissingBean
  public Confluo confluo(
      final ConfluoProperties properties,
      final ChangeStreamPort changeStreamPort,
      final ObjectProvider<ConfluoMetrics> metricsProvider) {

    requireAtMostOne(metricsProvider, ConfluoMetrics.class);

    final Confluo.Builder builder = Confluo.builder()
        .changeStreamPort(changeStreamPort)
        .batchPolicy(properties.toBatchPolicy())
        .circuitBreakerPolicy(properties.toCircuitBreakerPolicy())
        .retryPolicy(properties.toRetryPolicy())
        .defaultOptions(properties.getDefaults().toOptions());

    metricsProvider.ifAvailable(metrics -> {
      builder.metrics(metrics);
      log.info("Confluo using custom ConfluoMetrics: {}",
          metrics.getClass().getSimpleName());
    });

    log.info("Confluo configured with ChangeStreamPort {}, batch size {}",
        changeStreamPort.getClass().getSimpleName(),
        properties.getBatchSize());

    return builder.build();
  }

  /**
   * Creates a {@link SmartLifecycle} bean that shuts the pool down when the
   * context stops.
   *
   * <p>The lifecycle runs in phase {@code Integer.MAX_VALUE - 1}, so the
   * pool stops before the beans its listeners deliver to.
   *
   * @param confluo the pool to manage, never null
   *
   * @return the lifecycle bean, never null
   */
  @Bean
  @ConditionalOnBean(Confluo.class)
  public SmartLifecycle confluoLifecycle(final Confluo confluo) {
    return new SmartLifecycle() {

      /** Whether the lifecycle is currently running. */
      private volatile boolean running = false;

      @Override
      public void start() {
        running = !confluo.isShutdown();
        log.info("Confluo lifecycle started.");
      }

      @Override
      public void stop() {
        log.info("Stopping Confluo lifecycle...");
        confluo.shutdown();
        running = false;
        log.info("Confluo lifecycle stopped.");
      }

      @Override
      public boolean isRunning() {
        return running;
      }

      @Override
      public int getPhase() {
        return Integer.MAX_VALUE - 1;
      }
    };
  }

  /**
   * Validates that at most one bean of the given type is present in the
   * application context.
   *
   * @param provider the object provider to validate, never null
   * @param type     the bean type for error reporting, never null
   * @param <T>      the bean type
   *
   * @throws IllegalStateException if more than one bean of the given type
   *                               is present
   */
  private <T> void requireAtMostOne(final ObjectProvider<T> provider,
      final Class<T> type) {

    final List<String> beanNames = provider.orderedStream()
        .map(bean -> bean.getClass().getSimpleName())
        .collect(Collectors.toList());

    if (beanNames.size() > 1) {
      throw new IllegalStateException(
          "Confluo requires at most one " + type.getSimpleName()
              + " bean, but found " + beanNames.size() + ": "
              + String.join(", ", beanNames));
    }
  }
}
