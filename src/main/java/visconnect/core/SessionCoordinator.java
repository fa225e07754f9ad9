package visconnect.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import visconnect.archive.ArchiveIndex;
import visconnect.domain.AmpPhaseOptions;
import visconnect.domain.SpectrumData;
import visconnect.domain.VisData;
import visconnect.processor.CycleReducer;
import visconnect.processor.ReduceMode;
import visconnect.processor.ReductionResult;
import visconnect.protocol.OptionsSelection;
import visconnect.protocol.Request;
import visconnect.protocol.RequestType;
import visconnect.protocol.Response;
import visconnect.protocol.ResponseType;
import visconnect.protocol.ServerType;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Serves viewer requests and keeps every viewer's options in step.
 * <p>
 * Exactly one options set is authoritative. A client that sends a full
 * options set becomes its author: the data is recomputed, the author is told
 * the result is ready, and every other client is told to recompute with the
 * authoritative options. Those clients answer with a request that names no
 * options, which is served from the current snapshot.
 * <p>
 * This class does no I/O. Each call returns the responses to write, and all
 * calls are serialised, so the snapshot has a single writer and is swapped
 * atomically after each recompute.
 */
public class SessionCoordinator {
    private static final Logger logger = LoggerFactory.getLogger(SessionCoordinator.class);

    private final ServerType serverType;
    private final List<Path> files;
    private final CycleReducer reducer;
    private final boolean requireUsername;

    private final Map<String, ClientSession> sessions = new LinkedHashMap<>();
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicReference<Snapshot> snapshot = new AtomicReference<>();
    private final CoordinatorStatistics statistics = new CoordinatorStatistics();
    private ArchiveIndex index = ArchiveIndex.empty();

    public SessionCoordinator(ServerType serverType, List<Path> files, CycleReducer reducer,
                              boolean requireUsername) {
        this.serverType = Objects.requireNonNull(serverType, "serverType cannot be null");
        this.files = List.copyOf(Objects.requireNonNull(files, "files cannot be null"));
        this.reducer = Objects.requireNonNull(reducer, "reducer cannot be null");
        this.requireUsername = requireUsername;
        this.snapshot.set(new Snapshot(new AmpPhaseOptions(), VisData.empty(), ""));
    }

    /**
     * Index the archive files and compute the initial data with default options.
     */
    public synchronized void start() {
        if (!running.compareAndSet(false, true)) {
            return;
        }
        ReductionResult result = reducer.reduce(
                EnumSet.of(ReduceMode.READ_SCAN_METADATA, ReduceMode.COMPUTE_VIS_PRODUCTS),
                files, null, 0, new AmpPhaseOptions());
        index = result.index();
        snapshot.set(new Snapshot(result.options(), result.visData(), ""));
        statistics.recordStart();
        statistics.recordRecompute();
        for (String line : index.summaryLines()) {
            logger.info(line);
        }
        logger.info("Session coordinator started: {} files, {} scans, {} cycles",
                index.files().size(), index.numScans(), result.visData().numCycles());
    }

    public boolean isRunning() {
        return running.get();
    }

    public synchronized void connect(String connection) {
        sessions.put(connection, new ClientSession(connection));
        logger.info("Client connected: {} ({} connected)", connection, sessions.size());
    }

    public synchronized void disconnect(String connection) {
        ClientSession removed = sessions.remove(connection);
        if (removed != null) {
            logger.info("Client disconnected: {} ({} connected)", removed, sessions.size());
        }
    }

    /**
     * Handle one request from a connection.
     *
     * @return the responses to write, in order
     */
    public synchronized List<Delivery> handle(String connection, Request request) {
        ClientSession session = sessions.computeIfAbsent(connection, ClientSession::new);
        session.setClientId(request.clientId());
        statistics.recordRequest(request);
        logger.debug("{} from {}", request.type(), session);

        List<Delivery> out = new ArrayList<>();
        Snapshot current = snapshot.get();
        switch (request.type()) {
            case SERVERTYPE -> out.add(reply(session, Response.serverType(request.clientId(), serverType)));
            case CURRENT_VISDATA -> out.add(reply(session, Response.visData(ResponseType.CURRENT_VISDATA,
                    request.clientId(), current.options(), current.visData())));
            case COMPUTED_VISDATA -> out.add(reply(session, Response.visData(ResponseType.COMPUTED_VISDATA,
                    request.clientId(), current.options(), current.visData())));
            case COMPUTE_VISDATA -> compute(session, request, out);
            case CURRENT_SPECTRUM -> out.add(spectrum(session, request, index.latestMjd()));
            case SPECTRUM_MJD -> out.add(spectrum(session, request, request.mjd()));
            case SUPPLY_USERNAME -> {
                session.setUsername(request.username());
                logger.info("Connection {} identified as {}", connection, request.username());
                Request pending = session.pendingCompute();
                if (pending != null) {
                    session.setPendingCompute(null);
                    compute(session, pending, out);
                }
            }
        }
        statistics.recordResponses(out.size());
        return out;
    }

    private void compute(ClientSession session, Request request, List<Delivery> out) {
        OptionsSelection selection = request.selection();
        if (selection instanceof OptionsSelection.UseProvided provided) {
            if (requireUsername && !session.hasUsername()) {
                session.setPendingCompute(request);
                out.add(reply(session, Response.notice(ResponseType.USERNAME_REQUESTED, request.clientId())));
                return;
            }
            ReductionResult result = reducer.reduce(EnumSet.of(ReduceMode.COMPUTE_VIS_PRODUCTS),
                    files, null, 0, provided.options());
            VisData data = result.visData();
            snapshot.set(new Snapshot(result.options(), data, request.clientId()));
            statistics.recordRecompute();
            logger.info("Options changed by {} ({}), recomputed {} cycles",
                    request.clientId(), session.username(), data.numCycles());

            out.add(reply(session, Response.notice(ResponseType.VISDATA_COMPUTED, request.clientId())));
            for (ClientSession other : sessions.values()) {
                if (other != session) {
                    out.add(new Delivery(other.connection(),
                            Response.notice(ResponseType.OPTIONS_CHANGED, request.clientId())));
                    statistics.recordBroadcast();
                }
            }
        } else {
            // The snapshot already holds data for the authoritative options.
            out.add(reply(session, Response.notice(ResponseType.VISDATA_COMPUTED, request.clientId())));
        }
    }

    private Delivery spectrum(ClientSession session, Request request, double mjd) {
        AmpPhaseOptions options = snapshot.get().options();
        SpectrumData data = reducer.grabSpectrum(files, index, mjd, options);
        if (data.isEmpty()) {
            logger.debug("No cycle within half a cycle time of MJD {}", mjd);
        }
        return reply(session, Response.spectrum(request.clientId(), options, data));
    }

    private static Delivery reply(ClientSession session, Response response) {
        return new Delivery(session.connection(), response);
    }

    /**
     * Stop serving and tell every client to quit.
     *
     * @return a shutdown notice for every connection
     */
    public synchronized List<Delivery> shutdown() {
        if (!running.compareAndSet(true, false)) {
            return List.of();
        }
        List<Delivery> out = new ArrayList<>();
        for (ClientSession session : sessions.values()) {
            out.add(new Delivery(session.connection(), Response.notice(ResponseType.SHUTDOWN, "")));
        }
        statistics.recordStop();
        logger.info("Session coordinator stopped. Statistics: {}", statistics);
        return out;
    }

    public Snapshot getSnapshot() {
        return snapshot.get();
    }

    public synchronized ArchiveIndex getIndex() {
        return index;
    }

    public synchronized List<ClientSession> getSessions() {
        return List.copyOf(sessions.values());
    }

    public CoordinatorStatistics getStatistics() {
        return statistics;
    }

    /**
     * Counters for requests, recomputations and broadcasts.
     */
    public static class CoordinatorStatistics {
        private long startTime;
        private long stopTime;
        private long requestsServed;
        private long responsesSent;
        private long recomputations;
        private long broadcasts;
        private final Map<RequestType, Long> byType =
                new EnumMap<>(RequestType.class);

        synchronized void recordStart() {
            startTime = System.currentTimeMillis();
        }

        synchronized void recordStop() {
            stopTime = System.currentTimeMillis();
        }

        synchronized void recordRequest(Request request) {
            requestsServed++;
            byType.merge(request.type(), 1L, Long::sum);
        }

        synchronized void recordResponses(int count) {
            responsesSent += count;
        }

        synchronized void recordRecompute() {
            recomputations++;
        }

        synchronized void recordBroadcast() {
            broadcasts++;
        }

        public synchronized long getUptime() {
            if (startTime == 0) return 0;
            return (stopTime > 0 ? stopTime : System.currentTimeMillis()) - startTime;
        }

        public synchronized long getRequestsServed() {
            return requestsServed;
        }

        public synchronized long getResponsesSent() {
            return responsesSent;
        }

        public synchronized long getRecomputations() {
            return recomputations;
        }

        public synchronized long getBroadcasts() {
            return broadcasts;
        }

        public synchronized long getRequests(RequestType type) {
            return byType.getOrDefault(type, 0L);
        }

        @Override
        public synchronized String toString() {
            return String.format("CoordinatorStatistics{uptime=%dms, requests=%d, responses=%d, " +
                            "recomputations=%d, broadcasts=%d, byType=%s}",
                    getUptime(), requestsServed, responsesSent, recomputations, broadcasts, byType);
        }
    }
}
