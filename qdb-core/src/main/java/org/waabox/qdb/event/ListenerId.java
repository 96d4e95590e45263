package org.waabox.qdb.event;

/**
 * Identifies one listener connected to an {@link Emitter}.
 *
 * <p>Ids are unique within the emitter that issued them only.
 *
 * @param value the sequence number assigned by the emitter
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record ListenerId(long value) {
}
