package org.waabox.qdb.example.domain;

import static org.easymock.EasyMock.anyObject;
import static org.easymock.EasyMock.createMock;
import static org.easymock.EasyMock.expect;
import static org.easymock.EasyMock.replay;
import static org.easymock.EasyMock.verify;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.waabox.qdb.ApplicationContext;
import org.waabox.qdb.Database;
import org.waabox.qdb.TransportException;
import org.waabox.qdb.client.DatabaseClient;
import org.waabox.qdb.event.Emitter;
import org.waabox.qdb.model.Entity;
import org.waabox.qdb.model.Field;
import org.waabox.qdb.model.Notification;
import org.waabox.qdb.model.NotificationToken;

/**
 * Tests for {@link GarageDoorMonitor}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class GarageDoorMonitorTest {

  private static final Entity MAIN_DOOR =
      new Entity("door-1", "GarageDoor", "Main");

  private static final NotificationToken TOKEN =
      new NotificationToken("token-1");

  private DatabaseClient client;

  private ApplicationContext ctx;

  private Emitter<Boolean> connectionStatus;

  private GarageDoorMonitor monitor;

  @BeforeEach
  void setUp() {
    client = createMock(DatabaseClient.class);
    ctx = new ApplicationContext(new Database(client));
    connectionStatus = new Emitter<>();
    monitor = new GarageDoorMonitor(connectionStatus.connect(),
        "GarageDoor", "DoorState");
  }

  @Test
  void whenConnected_givenDoorStateChange_shouldTrackTheNewState() {
    expect(client.connected()).andReturn(true).anyTimes();
    expect(client.getEntities("GarageDoor")).andReturn(List.of(MAIN_DOOR));
    expect(client.registerNotification(anyObject())).andReturn(TOKEN);
    expect(client.getNotifications()).andReturn(List.of(
        doorChange("Closed", "Open")));
    replay(client);

    connectionStatus.emit(true);
    monitor.processEvents();
    monitor.doWork(ctx);
    assertEquals(1, monitor.subscriptionCount());

    ctx.database().processNotifications();
    monitor.doWork(ctx);

    assertEquals(Map.of("door-1", "Open"), monitor.doorStates());
    verify(client);
  }

  @Test
  void whenReconnected_givenPreviousSubscriptions_shouldSubscribeAgain() {
    expect(client.connected()).andReturn(true).anyTimes();
    expect(client.getEntities("GarageDoor"))
        .andReturn(List.of(MAIN_DOOR)).times(2);
    expect(client.registerNotification(anyObject()))
        .andReturn(TOKEN).times(2);
    replay(client);

    connectionStatus.emit(true);
    monitor.processEvents();
    monitor.doWork(ctx);

    // the supervisor clears the registry when the backend drops.
    ctx.database().clearNotifications();
    connectionStatus.emit(false);
    monitor.processEvents();
    assertEquals(0, monitor.subscriptionCount());

    connectionStatus.emit(true);
    monitor.processEvents();
    monitor.doWork(ctx);

    assertEquals(1, monitor.subscriptionCount());
    verify(client);
  }

  @Test
  void whenSubscribing_givenTransportFailure_shouldRetryOnNextTick() {
    expect(client.connected()).andReturn(true).anyTimes();
    expect(client.getEntities("GarageDoor"))
        .andThrow(new TransportException("down"));
    expect(client.getEntities("GarageDoor")).andReturn(List.of(MAIN_DOOR));
    expect(client.registerNotification(anyObject())).andReturn(TOKEN);
    replay(client);

    connectionStatus.emit(true);
    monitor.processEvents();
    monitor.doWork(ctx);
    assertEquals(0, monitor.subscriptionCount());

    monitor.doWork(ctx);
    assertEquals(1, monitor.subscriptionCount());
    verify(client);
  }

  @Test
  void whenTicking_givenNoConnectionEvent_shouldNotTouchTheDatabase() {
    replay(client);

    monitor.doWork(ctx);
    monitor.doWork(ctx);

    assertEquals(0, monitor.subscriptionCount());
    assertTrue(monitor.doorStates().isEmpty());
    verify(client);
  }

  private static Notification doorChange(final String from,
      final String to) {
    return new Notification(TOKEN,
        Field.of("door-1", "DoorState").setGarageDoorStateValue(to),
        Field.of("door-1", "DoorState").setGarageDoorStateValue(from),
        List.of());
  }
}
