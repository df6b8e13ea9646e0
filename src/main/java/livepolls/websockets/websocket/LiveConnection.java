package livepolls.websockets.websocket;

import java.io.IOException;

/**
 * A live duplex channel to one client.
 */
public interface LiveConnection {

    String id();

    void send(String payload) throws IOException;

    boolean isOpen();

    /**
     * Closes the channel, best effort. Calling it on a closed channel does nothing.
     */
    void close();
}
