package org.waabox.qdb.example.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import org.waabox.qdb.example.domain.GarageDoorMonitor;
import org.waabox.qdb.worker.DatabaseWorker;

/**
 * Spring configuration that defines the example workers.
 *
 * <p>Every {@link org.waabox.qdb.worker.Worker} bean is picked up by the
 * qdb-spring-boot-starter auto-configuration and scheduled after the
 * connection supervisor.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@Configuration
public class GarageDoorConfig {

  /**
   * Creates the garage door monitor, listening to the supervisor.
   *
   * @param databaseWorker the connection supervisor, never null
   * @param entityType the entity type of the doors, never null
   * @param stateField the field holding the door state, never null
   *
   * @return the monitor, never null
   */
  @Bean
  public GarageDoorMonitor garageDoorMonitor(
      final DatabaseWorker databaseWorker,
      @Value("${garage.entity-type:GarageDoor}") final String entityType,
      @Value("${garage.state-field:DoorState}") final String stateField) {
    return new GarageDoorMonitor(databaseWorker.connectionStatus().connect(),
        entityType, stateField);
  }
}
