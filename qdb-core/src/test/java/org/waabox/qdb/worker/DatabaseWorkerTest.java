package org.waabox.qdb.worker;

import static org.easymock.EasyMock.anyObject;
import static org.easymock.EasyMock.createMock;
import static org.easymock.EasyMock.expect;
import static org.easymock.EasyMock.expectLastCall;
import static org.easymock.EasyMock.replay;
import static org.easymock.EasyMock.verify;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.waabox.qdb.ApplicationContext;
import org.waabox.qdb.Database;
import org.waabox.qdb.TransportException;
import org.waabox.qdb.client.DatabaseClient;
import org.waabox.qdb.event.Emitter;
import org.waabox.qdb.event.Receiver;
import org.waabox.qdb.metrics.QdbMetrics;
import org.waabox.qdb.model.NotificationConfig;
import org.waabox.qdb.model.NotificationToken;

/**
 * Tests for {@link DatabaseWorker}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class DatabaseWorkerTest {

  private static final NotificationConfig DOOR_STATE =
      NotificationConfig.builder()
          .entityType("GarageDoor")
          .field("DoorState")
          .build();

  private DatabaseClient client;

  private ApplicationContext ctx;

  @BeforeEach
  void setUp() {
    client = createMock(DatabaseClient.class);
    ctx = new ApplicationContext(new Database(client));
  }

  @Test
  void whenTicking_givenBackendDropsSession_shouldClearAndReconnect() {
    // tick 1: connect; tick 2: session lost then reconnect; tick 3: poll.
    expect(client.connected())
        .andReturn(false).andReturn(true)
        .andReturn(false).andReturn(true)
        .andReturn(true);
    expect(client.disconnect()).andReturn(false).times(2);
    client.connect();
    expectLastCall().times(2);
    expect(client.registerNotification(DOOR_STATE))
        .andReturn(new NotificationToken("t-1"));
    expect(client.getNotifications()).andReturn(List.of());
    replay(client);

    final DatabaseWorker worker = new DatabaseWorker();
    final Receiver<Boolean> status = worker.connectionStatus().connect();

    worker.doWork(ctx);
    assertTrue(worker.isConnected());
    ctx.database().subscribe(DOOR_STATE);

    worker.doWork(ctx);
    assertTrue(ctx.database().notifications().isEmpty());
    assertTrue(worker.isConnected());

    worker.doWork(ctx);

    assertEquals(List.of(true, false, true), status.drain());
    verify(client);
  }

  @Test
  void whenTicking_givenNetworkLoss_shouldDisconnectButKeepSubscriptions() {
    expect(client.connected()).andReturn(false).andReturn(true);
    expect(client.disconnect()).andReturn(false);
    client.connect();
    expectLastCall();
    expect(client.registerNotification(DOOR_STATE))
        .andReturn(new NotificationToken("t-1"));
    replay(client);

    final Emitter<Boolean> network = new Emitter<>();
    final DatabaseWorker worker = new DatabaseWorker();
    worker.listenTo(network.connect());
    final Receiver<Boolean> status = worker.connectionStatus().connect();

    worker.doWork(ctx);
    ctx.database().subscribe(DOOR_STATE);

    network.emit(false);
    worker.processEvents();
    worker.doWork(ctx);

    assertFalse(worker.isNetworkConnected());
    assertFalse(worker.isConnected());
    assertEquals(1, ctx.database().notifications().size());
    assertEquals(List.of(true, false), status.drain());

    // Still down: nothing else happens.
    worker.doWork(ctx);
    assertTrue(status.drain().isEmpty());

    verify(client);
  }

  @Test
  void whenTicking_givenNetworkComesBack_shouldReconnect() {
    expect(client.connected()).andReturn(false).andReturn(true);
    expect(client.disconnect()).andReturn(false);
    client.connect();
    expectLastCall();
    replay(client);

    final Emitter<Boolean> network = new Emitter<>();
    final DatabaseWorker worker = new DatabaseWorker();
    worker.listenTo(network.connect());

    network.emit(false);
    worker.processEvents();
    worker.doWork(ctx);
    assertFalse(worker.isConnected());

    network.emit(false);
    network.emit(true);
    worker.processEvents();
    worker.doWork(ctx);

    assertTrue(worker.isConnected());
    verify(client);
  }

  @Test
  void whenTicking_givenNetworkBackWithSessionStillValid_shouldReportConnected() {
    expect(client.connected()).andReturn(false).andReturn(true)
        .andReturn(true).andReturn(true);
    expect(client.disconnect()).andReturn(false);
    client.connect();
    expectLastCall();
    expect(client.registerNotification(DOOR_STATE))
        .andReturn(new NotificationToken("t-1"));
    expect(client.getNotifications()).andReturn(List.of()).times(2);
    replay(client);

    final Emitter<Boolean> network = new Emitter<>();
    final DatabaseWorker worker = new DatabaseWorker();
    worker.listenTo(network.connect());
    final Receiver<Boolean> status = worker.connectionStatus().connect();

    worker.doWork(ctx);
    final Receiver<?> doors = ctx.database().subscribe(DOOR_STATE);

    network.emit(false);
    worker.processEvents();
    worker.doWork(ctx);
    assertFalse(worker.isConnected());

    network.emit(true);
    worker.processEvents();
    worker.doWork(ctx);
    assertTrue(worker.isConnected());

    worker.doWork(ctx);

    assertEquals(List.of(true, false, true), status.drain());
    assertEquals(1, ctx.database().notifications().size());
    assertFalse(doors.isClosed());
    verify(client);
  }

  @Test
  void whenTicking_givenConnectFailure_shouldReportAndRetryLater() {
    final TransportException failure =
        new TransportException("Connection refused");

    expect(client.connected()).andReturn(false).times(2)
        .andReturn(true);
    expect(client.disconnect()).andReturn(false).times(2);
    client.connect();
    expectLastCall().andThrow(failure);
    client.connect();
    expectLastCall();
    replay(client);

    final QdbMetrics metrics = createMock(QdbMetrics.class);
    metrics.connectionAttemptFailed(anyObject(TransportException.class));
    expectLastCall();
    metrics.connectionChanged(true);
    expectLastCall();
    replay(metrics);

    final DatabaseWorker worker = new DatabaseWorker(metrics);
    final Receiver<Boolean> status = worker.connectionStatus().connect();

    worker.doWork(ctx);
    assertFalse(worker.isConnected());
    assertTrue(status.drain().isEmpty());

    worker.doWork(ctx);
    assertTrue(worker.isConnected());
    assertEquals(List.of(true), status.drain());

    verify(client, metrics);
  }

  @Test
  void whenProcessingEvents_givenNoNetworkSource_shouldAssumeReachable() {
    final DatabaseWorker worker = new DatabaseWorker();

    worker.processEvents();

    assertTrue(worker.isNetworkConnected());
    assertFalse(worker.isConnected());
  }
}
