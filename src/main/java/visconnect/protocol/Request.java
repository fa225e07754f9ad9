package visconnect.protocol;

import java.util.Objects;

/**
 * A message from a viewer to the server.
 *
 * @param type what is being asked for
 * @param clientId the sender's identifier
 * @param username set only for {@link RequestType#SUPPLY_USERNAME}
 * @param selection set only for {@link RequestType#COMPUTE_VISDATA}
 * @param mjd the requested time, used only for {@link RequestType#SPECTRUM_MJD}
 */
public record Request(RequestType type, String clientId, String username, OptionsSelection selection, double mjd) {

    public Request {
        Objects.requireNonNull(type, "type cannot be null");
        Objects.requireNonNull(clientId, "clientId cannot be null");
        if (type == RequestType.COMPUTE_VISDATA && selection == null) {
            throw new IllegalArgumentException("A compute request needs an options selection");
        }
        if (type == RequestType.SUPPLY_USERNAME && (username == null || username.isBlank())) {
            throw new IllegalArgumentException("A username request needs a username");
        }
    }

    public static Request of(RequestType type, String clientId) {
        return new Request(type, clientId, null, null, 0);
    }

    public static Request compute(String clientId, OptionsSelection selection) {
        return new Request(RequestType.COMPUTE_VISDATA, clientId, null, selection, 0);
    }

    public static Request spectrumAt(String clientId, double mjd) {
        return new Request(RequestType.SPECTRUM_MJD, clientId, null, null, mjd);
    }

    public static Request username(String clientId, String username) {
        return new Request(RequestType.SUPPLY_USERNAME, clientId, username, null, 0);
    }
}
