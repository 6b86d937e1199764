package io.github.drompincen.noject.runtime.outline;

import io.github.drompincen.noject.protocol.event.OutlineEvent;

/**
 * Fans committed outline changes out to the collaborators connected to the
 * event's project. Callers hand events over only after the mutation has
 * committed and the project lock is released.
 */
public interface OutlineBroadcaster {

    /**
     * @param originId connection that caused the change and already has the
     *                 result, or {@code null} to reach every subscriber
     */
    void broadcast(OutlineEvent event, String originId);
}
