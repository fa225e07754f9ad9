package visconnect.core;

import visconnect.protocol.Response;

/**
 * A response to be written to one connection.
 *
 * @param connection the transport's key for the connection
 * @param response what to send
 */
public record Delivery(String connection, Response response) {
}
