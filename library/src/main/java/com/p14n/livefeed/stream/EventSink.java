package com.p14n.livefeed.stream;

import java.io.IOException;

/**
 * The transport side of one client stream.
 */
public interface EventSink {

    /**
     * Writes one complete frame. Implementations must keep frames in call order.
     *
     * @param frame a frame produced by {@link WireFormat}
     * @throws IOException if the stream is closed or the write fails
     */
    void send(String frame) throws IOException;

    /**
     * Ends the stream. Calling it on an already closed sink does nothing.
     */
    void close();
}
