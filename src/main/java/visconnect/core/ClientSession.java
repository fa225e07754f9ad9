package visconnect.core;

import visconnect.protocol.Request;

/**
 * What the server knows about one connection.
 */
public class ClientSession {

    private final String connection;
    private String clientId;
    private String username;
    private Request pendingCompute;

    public ClientSession(String connection) {
        this.connection = connection;
    }

    public String connection() {
        return connection;
    }

    /**
     * The id the client last sent, or null before its first request.
     */
    public String clientId() {
        return clientId;
    }

    void setClientId(String clientId) {
        this.clientId = clientId;
    }

    public String username() {
        return username;
    }

    void setUsername(String username) {
        this.username = username;
    }

    public boolean hasUsername() {
        return username != null;
    }

    /**
     * A compute request held back until the client supplies a username.
     */
    Request pendingCompute() {
        return pendingCompute;
    }

    void setPendingCompute(Request pendingCompute) {
        this.pendingCompute = pendingCompute;
    }

    @Override
    public String toString() {
        return "ClientSession{" + connection + ", id=" + clientId + ", user=" + username + "}";
    }
}
