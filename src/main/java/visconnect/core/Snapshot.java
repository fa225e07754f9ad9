package visconnect.core;

import visconnect.domain.AmpPhaseOptions;
import visconnect.domain.VisData;

/**
 * The authoritative options, the data computed with them, and the client
 * that last set them (empty for the server's own defaults).
 */
public record Snapshot(AmpPhaseOptions options, VisData visData, String author) {
}
