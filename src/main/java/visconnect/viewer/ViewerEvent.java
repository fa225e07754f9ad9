package visconnect.viewer;

import visconnect.protocol.Response;

/**
 * Something the viewer loop has to react to.
 */
public sealed interface ViewerEvent permits ViewerEvent.CommandLine, ViewerEvent.Incoming, ViewerEvent.Disconnected {

    /** A line typed by the user. */
    record CommandLine(String line) implements ViewerEvent {
    }

    /** A message from the server. */
    record Incoming(Response response) implements ViewerEvent {
    }

    /** The server connection closed. */
    record Disconnected() implements ViewerEvent {
    }
}
