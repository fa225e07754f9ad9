package visconnect.viewer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import visconnect.protocol.Response;

import java.io.PrintStream;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Drives a {@link ViewerSession} from one thread.
 * <p>
 * Typed lines and server messages arrive on other threads and are queued;
 * the loop takes them one at a time, then carries out the pending actions
 * and prints the status lines before waiting again. Resize and interrupt
 * requests only set flags, which are checked once per iteration.
 */
public class ViewerEventLoop {
    private static final Logger logger = LoggerFactory.getLogger(ViewerEventLoop.class);

    private static final long POLL_MILLIS = 200;

    private final ViewerSession session;
    private final PrintStream console;
    private final BlockingQueue<ViewerEvent> events = new LinkedBlockingQueue<>();
    private final AtomicBoolean resizeRequested = new AtomicBoolean(false);
    private final AtomicBoolean interruptRequested = new AtomicBoolean(false);

    public ViewerEventLoop(ViewerSession session, PrintStream console) {
        this.session = Objects.requireNonNull(session, "session cannot be null");
        this.console = Objects.requireNonNull(console, "console cannot be null");
    }

    public void submitCommand(String line) {
        events.add(new ViewerEvent.CommandLine(line));
    }

    public void submitResponse(Response response) {
        events.add(new ViewerEvent.Incoming(response));
    }

    public void submitDisconnect() {
        events.add(new ViewerEvent.Disconnected());
    }

    public void requestResize() {
        resizeRequested.set(true);
    }

    public void requestInterrupt() {
        interruptRequested.set(true);
    }

    /**
     * Run until the session quits or the thread is interrupted.
     */
    public void run() {
        logger.info("Viewer {} running", session.getClientId());
        try {
            while (!session.isQuitRequested()) {
                runOnce(POLL_MILLIS);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.info("Viewer loop interrupted");
        }
        logger.info("Viewer {} stopped", session.getClientId());
    }

    /**
     * Wait up to {@code timeoutMillis} for one event, handle it together with
     * anything else already queued, then act on the session's pending work.
     *
     * @return whether the session is still running
     */
    public boolean runOnce(long timeoutMillis) throws InterruptedException {
        ViewerEvent event = events.poll(timeoutMillis, TimeUnit.MILLISECONDS);
        while (event != null) {
            dispatch(event);
            event = events.poll();
        }
        if (resizeRequested.getAndSet(false)) {
            session.onResize();
        }
        if (interruptRequested.getAndSet(false)) {
            session.onInterrupt();
        }
        session.processPending();
        for (String line : session.drainStatus()) {
            console.println(line);
        }
        return !session.isQuitRequested();
    }

    private void dispatch(ViewerEvent event) {
        if (event instanceof ViewerEvent.CommandLine command) {
            session.onCommand(command.line());
        } else if (event instanceof ViewerEvent.Incoming incoming) {
            session.onResponse(incoming.response());
        } else if (event instanceof ViewerEvent.Disconnected) {
            session.onDisconnect();
        }
    }
}
