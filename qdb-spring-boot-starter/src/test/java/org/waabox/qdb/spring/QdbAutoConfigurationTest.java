package org.waabox.qdb.spring;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.SmartLifecycle;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.waabox.qdb.Application;
import org.waabox.qdb.ApplicationContext;
import org.waabox.qdb.client.DatabaseClient;
import org.waabox.qdb.client.rest.RestDatabaseClient;
import org.waabox.qdb.event.Receiver;
import org.waabox.qdb.model.Entity;
import org.waabox.qdb.model.Field;
import org.waabox.qdb.model.Notification;
import org.waabox.qdb.model.NotificationConfig;
import org.waabox.qdb.model.NotificationToken;
import org.waabox.qdb.worker.DatabaseWorker;
import org.waabox.qdb.worker.NetworkWorker;
import org.waabox.qdb.worker.Worker;

/**
 * Tests for {@link QdbAutoConfiguration}.
 *
 * <p>Uses {@link ApplicationContextRunner} for fast, isolated testing
 * of the auto-configuration without bootstrapping a full Spring Boot
 * application. The scheduler does not start unless a test asks for it.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class QdbAutoConfigurationTest {

  /** The application context runner configured with the auto-configuration. */
  private final ApplicationContextRunner runner = new ApplicationContextRunner()
      .withConfiguration(AutoConfigurations.of(QdbAutoConfiguration.class))
      .withPropertyValues("qdb.auto-start=false");

  @Test
  void whenContextLoads_givenNoProperties_shouldCreateRestClientWithDefaults() {
    runner.run(context -> {
      final DatabaseClient client = context.getBean(DatabaseClient.class);
      assertInstanceOf(RestDatabaseClient.class, client);
      assertEquals("http://localhost:8080",
          ((RestDatabaseClient) client).config().baseUrl());
      assertEquals(3,
          ((RestDatabaseClient) client).config().retryPolicy().maxAttempts());

      final Application application = context.getBean(Application.class);
      assertEquals(Duration.ofMillis(500), application.loopInterval());
      assertEquals(1, application.workers().size());
      assertInstanceOf(DatabaseWorker.class, application.workers().get(0));

      assertFalse(context.containsBean("qdbNetworkWorker"));
    });
  }

  @Test
  void whenContextLoads_givenProperties_shouldBindThem() {
    runner.withPropertyValues(
        "qdb.url=https://qdb.example.com:9443/",
        "qdb.loop-interval=100ms",
        "qdb.request-timeout=2s",
        "qdb.auth-attempts=5")
        .run(context -> {
          final QdbProperties properties = context.getBean(QdbProperties.class);
          assertFalse(properties.isAutoStart());
          assertEquals(Duration.ofSeconds(2), properties.getRequestTimeout());

          final RestDatabaseClient client =
              context.getBean(RestDatabaseClient.class);
          assertEquals("https://qdb.example.com:9443",
              client.config().baseUrl());
          assertEquals(5, client.config().retryPolicy().maxAttempts());

          final Application application = context.getBean(Application.class);
          assertEquals(Duration.ofMillis(100), application.loopInterval());

          final SmartLifecycle lifecycle =
              context.getBean("qdbLifecycle", SmartLifecycle.class);
          assertFalse(lifecycle.isAutoStartup());
          assertFalse(lifecycle.isRunning());
        });
  }

  @Test
  void whenContextLoads_givenNetworkProbeEnabled_shouldRunItFirst() {
    runner.withPropertyValues(
        "qdb.url=http://qdb.internal:8080",
        "qdb.network-probe.enabled=true",
        "qdb.network-probe.timeout=250ms")
        .run(context -> {
          final NetworkWorker network = context.getBean(NetworkWorker.class);
          final DatabaseWorker database = context.getBean(DatabaseWorker.class);

          final List<Worker> workers =
              context.getBean(Application.class).workers();
          assertEquals(2, workers.size());
          assertSame(network, workers.get(0));
          assertSame(database, workers.get(1));

          assertEquals(1, network.networkStatus().listenerCount());
        });
  }

  @Test
  void whenContextLoads_givenWorkerBean_shouldRunItAfterTheSupervisor() {
    runner.withUserConfiguration(StatusWorkerConfig.class)
        .run(context -> {
          final List<Worker> workers =
              context.getBean(Application.class).workers();

          assertEquals(2, workers.size());
          assertInstanceOf(DatabaseWorker.class, workers.get(0));
          assertSame(context.getBean(StatusWorker.class), workers.get(1));
        });
  }

  @Test
  void whenContextLoads_givenCustomClient_shouldUseItInsteadOfRest() {
    runner.withUserConfiguration(StubClientConfig.class)
        .run(context -> {
          assertInstanceOf(StubDatabaseClient.class,
              context.getBean(DatabaseClient.class));
          assertFalse(context.containsBean("qdbDatabaseClient"));
        });
  }

  @Test
  void whenContextStarts_givenAutoStart_shouldConnectAndStopWhenAsked() {
    new ApplicationContextRunner()
        .withConfiguration(AutoConfigurations.of(QdbAutoConfiguration.class))
        .withPropertyValues("qdb.loop-interval=20ms")
        .withUserConfiguration(StubClientConfig.class, StatusWorkerConfig.class)
        .run(context -> {
          final StatusWorker statusWorker = context.getBean(StatusWorker.class);
          assertTrue(statusWorker.connected.await(5, TimeUnit.SECONDS),
              "the supervisor should have reported the connection");

          final StubDatabaseClient client =
              context.getBean(StubDatabaseClient.class);
          assertTrue(client.connected());

          final SmartLifecycle lifecycle =
              context.getBean("qdbLifecycle", SmartLifecycle.class);
          assertTrue(lifecycle.isRunning());

          lifecycle.stop();
          assertFalse(lifecycle.isRunning());
          assertTrue(context.getBean(Application.class).quitRequested());
        });
  }

  /** Provides a client that connects without a server. */
  @Configuration(proxyBeanMethods = false)
  static class StubClientConfig {

    @Bean
    StubDatabaseClient stubDatabaseClient() {
      return new StubDatabaseClient();
    }
  }

  /** Provides a worker that listens to the supervisor. */
  @Configuration(proxyBeanMethods = false)
  static class StatusWorkerConfig {

    @Bean
    StatusWorker statusWorker(final DatabaseWorker databaseWorker) {
      return new StatusWorker(databaseWorker.connectionStatus().connect());
    }
  }

  /** Counts down once the supervisor reports a connection. */
  static class StatusWorker implements Worker {

    private final Receiver<Boolean> status;

    private final CountDownLatch connected = new CountDownLatch(1);

    StatusWorker(final Receiver<Boolean> theStatus) {
      status = theStatus;
    }

    @Override
    public void initialize(final ApplicationContext ctx) {
    }

    @Override
    public void doWork(final ApplicationContext ctx) {
    }

    @Override
    public void deinitialize(final ApplicationContext ctx) {
      status.close();
    }

    @Override
    public void processEvents() {
      for (final Boolean up : status.drain()) {
        if (up) {
          connected.countDown();
        }
      }
    }
  }

  /** A client that is always reachable and has nothing to report. */
  static class StubDatabaseClient implements DatabaseClient {

    private final AtomicBoolean connected = new AtomicBoolean(false);

    @Override
    public void connect() {
      connected.set(true);
    }

    @Override
    public boolean connected() {
      return connected.get();
    }

    @Override
    public boolean disconnect() {
      return connected.getAndSet(false);
    }

    @Override
    public Entity getEntity(final String entityId) {
      return new Entity(entityId, "Stub", entityId);
    }

    @Override
    public List<Entity> getEntities(final String entityType) {
      return Collections.emptyList();
    }

    @Override
    public void read(final List<Field> fields) {
    }

    @Override
    public void write(final List<Field> fields) {
    }

    @Override
    public NotificationToken registerNotification(
        final NotificationConfig config) {
      return new NotificationToken("stub-token");
    }

    @Override
    public void unregisterNotification(final NotificationToken token) {
    }

    @Override
    public List<Notification> getNotifications() {
      return Collections.emptyList();
    }
  }
}
