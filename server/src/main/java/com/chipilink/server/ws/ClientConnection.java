package com.chipilink.server.ws;

import java.io.IOException;

/**
 * Transport handle of one live client, as seen by the {@link ConnectionRegistry}.
 */
public interface ClientConnection {

    /** Unique for the life of the process; never reused. */
    String id();

    /** Sends one JSON text frame. May block; the registry bounds the wait. */
    void send(String text) throws IOException;

    /** Closes the transport. Must not throw. */
    void close();
}
