package visconnect.viewer;

import visconnect.protocol.Request;

/**
 * Where a viewer sends its requests.
 */
public interface RequestSink {

    void send(Request request);

    default void close() {
    }
}
