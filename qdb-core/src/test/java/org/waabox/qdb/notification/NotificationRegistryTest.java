package org.waabox.qdb.notification;

import static org.easymock.EasyMock.createMock;
import static org.easymock.EasyMock.expect;
import static org.easymock.EasyMock.expectLastCall;
import static org.easymock.EasyMock.replay;
import static org.easymock.EasyMock.verify;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.waabox.qdb.NotificationException;
import org.waabox.qdb.TransportException;
import org.waabox.qdb.client.DatabaseClient;
import org.waabox.qdb.event.Receiver;
import org.waabox.qdb.metrics.QdbMetrics;
import org.waabox.qdb.model.Field;
import org.waabox.qdb.model.Notification;
import org.waabox.qdb.model.NotificationConfig;
import org.waabox.qdb.model.NotificationToken;

/**
 * Tests for {@link NotificationRegistry}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class NotificationRegistryTest {

  private static final NotificationToken TOKEN = new NotificationToken("t-1");

  private static final NotificationConfig DOOR_STATE =
      NotificationConfig.builder()
          .entityType("GarageDoor")
          .field("DoorState")
          .build();

  private DatabaseClient client;

  @BeforeEach
  void setUp() {
    client = createMock(DatabaseClient.class);
  }

  private static Notification doorNotification(final NotificationToken token,
      final String state) {
    return new Notification(token,
        Field.of("door-1", "DoorState").setGarageDoorStateValue(state),
        Field.of("door-1", "DoorState").setGarageDoorStateValue("Closed"),
        List.of());
  }

  @Test
  void whenSubscribing_givenEqualConfigsTwice_shouldRegisterOnce() {
    expect(client.registerNotification(DOOR_STATE)).andReturn(TOKEN);
    expect(client.getNotifications())
        .andReturn(List.of(doorNotification(TOKEN, "Open")));
    replay(client);

    final NotificationRegistry registry = new NotificationRegistry(client);
    final NotificationConfig equalConfig = NotificationConfig.builder()
        .entityType("GarageDoor")
        .field("DoorState")
        .build();

    final Receiver<Notification> first = registry.subscribe(DOOR_STATE);
    final Receiver<Notification> second = registry.subscribe(equalConfig);

    assertEquals(1, registry.size());
    assertEquals(2, registry.listenerCount(TOKEN));
    assertEquals(Optional.of(TOKEN), registry.tokenFor(equalConfig));

    registry.dispatch();

    assertEquals("Open", first.poll().orElseThrow().current().value()
        .asGarageDoorState());
    assertEquals("Open", second.poll().orElseThrow().current().value()
        .asGarageDoorState());

    verify(client);
  }

  @Test
  void whenDispatching_givenTwoListeners_shouldHandEachItsOwnCopy() {
    expect(client.registerNotification(DOOR_STATE)).andReturn(TOKEN);
    expect(client.getNotifications())
        .andReturn(List.of(doorNotification(TOKEN, "Open")));
    replay(client);

    final NotificationRegistry registry = new NotificationRegistry(client);
    final Receiver<Notification> first = registry.subscribe(DOOR_STATE);
    final Receiver<Notification> second = registry.subscribe(DOOR_STATE);

    registry.dispatch();

    final Notification a = first.poll().orElseThrow();
    final Notification b = second.poll().orElseThrow();
    a.current().value().updateGarageDoorState("Stuck");

    assertEquals("Open", b.current().value().asGarageDoorState());
    verify(client);
  }

  @Test
  void whenClosingOneListener_givenSiblings_shouldKeepTokenRegistered() {
    expect(client.registerNotification(DOOR_STATE)).andReturn(TOKEN);
    expect(client.getNotifications())
        .andReturn(List.of(doorNotification(TOKEN, "Open")));
    replay(client);

    final NotificationRegistry registry = new NotificationRegistry(client);
    final Receiver<Notification> closed = registry.subscribe(DOOR_STATE);
    final Receiver<Notification> kept = registry.subscribe(DOOR_STATE);

    closed.close();
    registry.dispatch();

    assertEquals(1, registry.size());
    assertEquals(1, registry.listenerCount(TOKEN));
    assertEquals(1, kept.drain().size());
    verify(client);
  }

  @Test
  void whenDispatching_givenAllListenersClosed_shouldUnregisterToken() {
    expect(client.registerNotification(DOOR_STATE)).andReturn(TOKEN);
    client.unregisterNotification(TOKEN);
    expectLastCall();
    expect(client.getNotifications()).andReturn(List.of());
    replay(client);

    final NotificationRegistry registry = new NotificationRegistry(client);
    registry.subscribe(DOOR_STATE).close();

    registry.dispatch();

    assertTrue(registry.isEmpty());
    assertTrue(registry.tokenFor(DOOR_STATE).isEmpty());
    verify(client);
  }

  @Test
  void whenDispatching_givenIdleReleaseFails_shouldRetryNextTime() {
    expect(client.registerNotification(DOOR_STATE)).andReturn(TOKEN);
    client.unregisterNotification(TOKEN);
    expectLastCall().andThrow(new TransportException("unreachable"));
    client.unregisterNotification(TOKEN);
    expectLastCall();
    expect(client.getNotifications()).andReturn(List.of()).times(2);
    replay(client);

    final NotificationRegistry registry = new NotificationRegistry(client);
    registry.subscribe(DOOR_STATE).close();

    registry.dispatch();
    assertEquals(1, registry.size());

    registry.dispatch();
    assertTrue(registry.isEmpty());

    verify(client);
  }

  @Test
  void whenSubscribing_givenTransportFailure_shouldLeaveRegistryUntouched() {
    expect(client.registerNotification(DOOR_STATE))
        .andThrow(new TransportException("Failed to authenticate"));
    replay(client);

    final NotificationRegistry registry = new NotificationRegistry(client);

    assertThrows(TransportException.class,
        () -> registry.subscribe(DOOR_STATE));

    assertTrue(registry.isEmpty());
    assertTrue(registry.tokenFor(DOOR_STATE).isEmpty());
    verify(client);
  }

  @Test
  void whenUnsubscribing_givenUnknownToken_shouldThrowWithoutCallingClient() {
    replay(client);

    final NotificationRegistry registry = new NotificationRegistry(client);

    assertThrows(NotificationException.class,
        () -> registry.unsubscribe(new NotificationToken("missing")));

    verify(client);
  }

  @Test
  void whenUnsubscribing_givenKnownToken_shouldDropAllMappings() {
    expect(client.registerNotification(DOOR_STATE)).andReturn(TOKEN);
    client.unregisterNotification(TOKEN);
    expectLastCall();
    replay(client);

    final NotificationRegistry registry = new NotificationRegistry(client);
    final Receiver<Notification> receiver = registry.subscribe(DOOR_STATE);

    registry.unsubscribe(TOKEN);

    assertTrue(registry.isEmpty());
    assertTrue(registry.tokenFor(DOOR_STATE).isEmpty());
    assertEquals(0, registry.listenerCount(TOKEN));
    assertTrue(receiver.drain().isEmpty());
    verify(client);
  }

  @Test
  void whenUnsubscribing_givenTransportFailure_shouldKeepMappings() {
    expect(client.registerNotification(DOOR_STATE)).andReturn(TOKEN);
    client.unregisterNotification(TOKEN);
    expectLastCall().andThrow(new TransportException("boom"));
    replay(client);

    final NotificationRegistry registry = new NotificationRegistry(client);
    registry.subscribe(DOOR_STATE);

    assertThrows(TransportException.class, () -> registry.unsubscribe(TOKEN));

    assertEquals(Optional.of(TOKEN), registry.tokenFor(DOOR_STATE));
    assertEquals(1, registry.listenerCount(TOKEN));
    verify(client);
  }

  @Test
  void whenDispatching_givenUnknownToken_shouldDeliverRestAndThrow() {
    final QdbMetrics metrics = createMock(QdbMetrics.class);
    metrics.notificationsDispatched(1, 1);
    expectLastCall();
    replay(metrics);

    final NotificationToken stranger = new NotificationToken("t-unknown");
    expect(client.registerNotification(DOOR_STATE)).andReturn(TOKEN);
    expect(client.getNotifications()).andReturn(List.of(
        doorNotification(stranger, "Open"),
        doorNotification(TOKEN, "Open")));
    replay(client);

    final NotificationRegistry registry =
        new NotificationRegistry(client, metrics);
    final Receiver<Notification> receiver = registry.subscribe(DOOR_STATE);

    final NotificationException e = assertThrows(
        NotificationException.class, registry::dispatch);

    assertTrue(e.getMessage().contains("t-unknown"));
    assertEquals(1, receiver.drain().size());
    verify(client, metrics);
  }

  @Test
  void whenClearing_shouldForgetEverythingWithoutCallingClient() {
    expect(client.registerNotification(DOOR_STATE)).andReturn(TOKEN);
    replay(client);

    final NotificationRegistry registry = new NotificationRegistry(client);
    final Receiver<Notification> receiver = registry.subscribe(DOOR_STATE);

    registry.clear();

    assertTrue(registry.isEmpty());
    assertTrue(registry.tokenFor(DOOR_STATE).isEmpty());
    assertTrue(!receiver.isClosed());
    verify(client);
  }

  @Test
  void whenDispatching_givenClearedRegistry_shouldDeliverNothingAndReleaseNothing() {
    expect(client.registerNotification(DOOR_STATE)).andReturn(TOKEN);
    expect(client.getNotifications()).andReturn(List.of());
    replay(client);

    final NotificationRegistry registry = new NotificationRegistry(client);
    final Receiver<Notification> receiver = registry.subscribe(DOOR_STATE);

    registry.clear();
    registry.dispatch();

    assertTrue(receiver.drain().isEmpty());
    assertTrue(registry.isEmpty());
    verify(client);
  }

  @Test
  void whenSubscribingAgain_givenClearedRegistry_shouldRegisterAgain() {
    final NotificationToken renewed = new NotificationToken("t-2");
    expect(client.registerNotification(DOOR_STATE)).andReturn(TOKEN);
    expect(client.registerNotification(DOOR_STATE)).andReturn(renewed);
    replay(client);

    final NotificationRegistry registry = new NotificationRegistry(client);
    registry.subscribe(DOOR_STATE);
    registry.clear();
    registry.subscribe(DOOR_STATE);

    assertEquals(Optional.of(renewed), registry.tokenFor(DOOR_STATE));
    verify(client);
  }
}
