package org.learningjava.flowc.application.port;

/**
 * Pushes a message to every connected observer.
 */
public interface BroadcastPort {

    void broadcast(Object message);

    int subscribers();
}
