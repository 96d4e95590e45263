package org.waabox.qdb.spring;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.SmartLifecycle;
import org.springframework.context.annotation.Bean;
import org.waabox.qdb.Application;
import org.waabox.qdb.Database;
import org.waabox.qdb.RetryPolicy;
import org.waabox.qdb.client.DatabaseClient;
import org.waabox.qdb.client.rest.RestClientConfig;
import org.waabox.qdb.client.rest.RestDatabaseClient;
import org.waabox.qdb.metrics.NoopQdbMetrics;
import org.waabox.qdb.metrics.QdbMetrics;
import org.waabox.qdb.worker.DatabaseWorker;
import org.waabox.qdb.worker.NetworkWorker;
import org.waabox.qdb.worker.SocketReachabilityProbe;
import org.waabox.qdb.worker.Worker;

/**
 * Spring Boot auto-configuration for the qdb client.
 *
 * <p>Creates the transport, the {@link Database}, the connection
 * supervising {@link DatabaseWorker} and the {@link Application} loop,
 * all from {@link QdbProperties}. A {@link DatabaseClient} or
 * {@link QdbMetrics} bean defined by the application replaces the
 * default one.
 *
 * <p>The loop runs in order: the optional {@link NetworkWorker}, the
 * {@link DatabaseWorker}, then every other {@link Worker} bean in bean
 * order.
 *
 * <p>The loop runs on its own thread, started and stopped through
 * Spring's {@link SmartLifecycle}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@AutoConfiguration
@EnableConfigurationProperties(QdbProperties.class)
public class QdbAutoConfiguration {

  /** The class logger. */
  private static final Logger log = LoggerFactory.getLogger(
      QdbAutoConfiguration.class);

  /** How long stop() waits for the loop to finish its tick. */
  private static final Duration STOP_TIMEOUT = Duration.ofSeconds(10);

  /**
   * Creates the REST transport unless the application defines one.
   *
   * @param properties the configuration properties, never null
   *
   * @return the transport, never null
   */
  @Bean
  @ConditionalOnMissingBean
  public DatabaseClient qdbDatabaseClient(final QdbProperties properties) {
    final RestClientConfig config = RestClientConfig.create(
        properties.getUrl(),
        properties.getRequestTimeout(),
        RetryPolicy.of(properties.getAuthAttempts(), Duration.ZERO));
    log.info("qdb using REST transport at {}", config.baseUrl());
    return new RestDatabaseClient(config);
  }

  /**
   * Creates the database facade.
   *
   * @param client          the transport, never null
   * @param metricsProvider provider for an optional QdbMetrics bean
   *
   * @return the database, never null
   */
  @Bean
  public Database qdbDatabase(final DatabaseClient client,
      final ObjectProvider<QdbMetrics> metricsProvider) {
    return new Database(client, metrics(metricsProvider));
  }

  /**
   * Creates the connection supervisor.
   *
   * @param metricsProvider provider for an optional QdbMetrics bean
   *
   * @return the worker, never null
   */
  @Bean
  public DatabaseWorker qdbDatabaseWorker(
      final ObjectProvider<QdbMetrics> metricsProvider) {
    return new DatabaseWorker(metrics(metricsProvider));
  }

  /**
   * Creates the TCP reachability monitor of the service host.
   *
   * @param properties the configuration properties, never null
   *
   * @return the worker, never null
   */
  @Bean
  @ConditionalOnProperty(prefix = "qdb.network-probe", name = "enabled",
      havingValue = "true")
  public NetworkWorker qdbNetworkWorker(final QdbProperties properties) {
    log.info("qdb probing network reachability of {}", properties.getUrl());
    return new NetworkWorker(SocketReachabilityProbe.forUrl(
        properties.getUrl(), properties.getNetworkProbe().getTimeout()));
  }

  /**
   * Creates the scheduler and registers every worker.
   *
   * @param properties       the configuration properties, never null
   * @param database         the database, never null
   * @param databaseWorker   the connection supervisor, never null
   * @param networkProvider  provider for the optional network monitor
   * @param metricsProvider  provider for an optional QdbMetrics bean
   * @param workers          every worker bean, never null
   *
   * @return the scheduler, never null
   */
  @Bean
  public Application qdbApplication(final QdbProperties properties,
      final Database database,
      final DatabaseWorker databaseWorker,
      final ObjectProvider<NetworkWorker> networkProvider,
      final ObjectProvider<QdbMetrics> metricsProvider,
      final List<Worker> workers) {

    final Application application = Application.builder()
        .database(database)
        .loopInterval(properties.getLoopInterval())
        .metrics(metrics(metricsProvider))
        .build();

    final NetworkWorker networkWorker = networkProvider.getIfAvailable();
    if (networkWorker != null) {
      databaseWorker.listenTo(networkWorker.networkStatus().connect());
      application.addWorker(networkWorker);
    }
    application.addWorker(databaseWorker);

    for (final Worker worker : workers) {
      if (worker != databaseWorker && worker != networkWorker) {
        application.addWorker(worker);
        log.debug("Registered worker: {}", worker.name());
      }
    }

    log.info("qdb application created with {} worker(s), ticking every {}",
        application.workers().size(), properties.getLoopInterval());

    return application;
  }

  /**
   * Creates a {@link SmartLifecycle} bean that runs the scheduler loop on
   * a dedicated thread.
   *
   * <p>The lifecycle starts late (phase {@code Integer.MAX_VALUE - 1}) so
   * the workers and their collaborators are ready, and stops early for
   * the same reason.
   *
   * @param application the scheduler, never null
   * @param properties  the configuration properties, never null
   *
   * @return the lifecycle bean, never null
   */
  @Bean
  public SmartLifecycle qdbLifecycle(final Application application,
      final QdbProperties properties) {
    return new SmartLifecycle() {

      /** The loop thread, null until started. */
      private final AtomicReference<Thread> thread = new AtomicReference<>();

      @Override
      public void start() {
        final Thread loop = new Thread(application::run, "qdb-application");
        if (!thread.compareAndSet(null, loop)) {
          log.warn("qdb application was already started");
          return;
        }
        log.info("Starting qdb application loop...");
        loop.start();
      }

      @Override
      public void stop() {
        final Thread loop = thread.get();
        if (loop == null) {
          return;
        }
        log.info("Stopping qdb application loop...");
        application.requestQuit();
        try {
          loop.join(STOP_TIMEOUT.toMillis());
        } catch (final InterruptedException e) {
          Thread.currentThread().interrupt();
          log.warn("Interrupted while waiting for the qdb loop to stop");
        }
        if (loop.isAlive()) {
          log.warn("qdb application loop did not stop within {}",
              STOP_TIMEOUT);
        } else {
          log.info("qdb application loop stopped.");
        }
      }

      @Override
      public boolean isRunning() {
        final Thread loop = thread.get();
        return loop != null && loop.isAlive();
      }

      @Override
      public boolean isAutoStartup() {
        return properties.isAutoStart();
      }

      @Override
      public int getPhase() {
        return Integer.MAX_VALUE - 1;
      }
    };
  }

  private static QdbMetrics metrics(
      final ObjectProvider<QdbMetrics> metricsProvider) {
    return metricsProvider.getIfAvailable(NoopQdbMetrics::new);
  }
}
