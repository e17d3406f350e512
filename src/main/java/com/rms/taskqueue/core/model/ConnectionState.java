package com.rms.taskqueue.core.model;

/**
 * Connection lifecycle as seen by the owning {@code BrokerConnection}.
 *
 * <p>Only the connection itself transitions between these states; every other component
 * reads readiness and asks for a (re)connect when it needs one.</p>
 */
public enum ConnectionState {
    DISCONNECTED,
    CONNECTING,
    READY
}
