package visconnect.viewer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import visconnect.calibration.CalibrationException;
import visconnect.calibration.ClosurePhaseCalculator;
import visconnect.calibration.DelayCalibrator;
import visconnect.calibration.DelayScope;
import visconnect.codec.DumpFiles;
import visconnect.config.DumpFormat;
import visconnect.domain.AmpPhaseOptions;
import visconnect.domain.AveragingMethod;
import visconnect.domain.DelayModifier;
import visconnect.domain.IfWindow;
import visconnect.domain.ScanHeader;
import visconnect.domain.SpectrumData;
import visconnect.domain.TsysCorrection;
import visconnect.domain.VisData;
import visconnect.output.PanelType;
import visconnect.output.PlotModel;
import visconnect.output.Renderer;
import visconnect.output.VisPlotBuilder;
import visconnect.protocol.MessageCodec;
import visconnect.protocol.OptionsSelection;
import visconnect.protocol.Request;
import visconnect.protocol.RequestType;
import visconnect.protocol.Response;
import visconnect.protocol.ServerType;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.function.BiFunction;

/**
 * The state of one viewer: the data last received, what the user has chosen
 * to display, and the actions waiting to be carried out.
 * <p>
 * Commands and server responses only record what needs doing; the work is
 * done by {@link #processPending()} in {@link PendingAction} order. Command
 * errors never escape: they become status lines collected by
 * {@link #drainStatus()}.
 */
public class ViewerSession {
    private static final Logger logger = LoggerFactory.getLogger(ViewerSession.class);

    /** Blank answers tolerated while asking for a username. */
    public static final int MAX_USERNAME_ATTEMPTS = 5;

    private final String clientId;
    private final RequestSink sink;
    private final Renderer renderer;
    private final BiFunction<Path, DumpFormat, Renderer> hardcopies;
    private final DumpFormat dumpFormat;
    private final CommandParser parser = new CommandParser();
    private final DisplayState display = new DisplayState();
    private final VisPlotBuilder plotBuilder = new VisPlotBuilder();
    private final DelayCalibrator delayCalibrator = new DelayCalibrator();
    private final ClosurePhaseCalculator closureCalculator = new ClosurePhaseCalculator();

    private final EnumSet<PendingAction> pending = EnumSet.noneOf(PendingAction.class);
    private final List<String> status = new ArrayList<>();

    private AmpPhaseOptions options = new AmpPhaseOptions();
    private VisData originalData = VisData.empty();
    private VisData displayData = VisData.empty();
    private SpectrumData spectrum;
    private ServerType serverType;
    private String username;
    private boolean awaitingUsername;
    private int usernameAttempts;
    private boolean replaying;
    private boolean quit;
    private DelayScope delayScope = DelayScope.ALL;
    private Path hardcopyFile;
    private int hardcopyCount;

    public ViewerSession(String clientId, RequestSink sink, Renderer renderer, String username,
                         DumpFormat dumpFormat, BiFunction<Path, DumpFormat, Renderer> hardcopies) {
        this.clientId = Objects.requireNonNull(clientId, "clientId cannot be null");
        this.sink = Objects.requireNonNull(sink, "sink cannot be null");
        this.renderer = Objects.requireNonNull(renderer, "renderer cannot be null");
        this.username = username;
        this.dumpFormat = Objects.requireNonNull(dumpFormat, "dumpFormat cannot be null");
        this.hardcopies = Objects.requireNonNull(hardcopies, "hardcopies cannot be null");
    }

    /**
     * Ask the server what it is and for its current data.
     */
    public void start() {
        sink.send(Request.of(RequestType.SERVERTYPE, clientId));
        sink.send(Request.of(RequestType.CURRENT_VISDATA, clientId));
    }

    /**
     * Show the contents of a dump file instead of talking to a server.
     * Option changes cannot be applied while replaying.
     */
    public void replay(DumpFiles.Dump dump) {
        replaying = true;
        options = dump.options().copy();
        if (dump.kind() == DumpFiles.Kind.SPECTRUM) {
            spectrum = dump.spectrum();
            display.setShowSpectrum(true);
        } else {
            originalData = dump.visData();
        }
        pending.add(PendingAction.NEW_DATA);
        logger.info("Replaying {} dump", dump.kind());
    }

    /**
     * Handle one line typed by the user.
     */
    public void onCommand(String line) {
        if (awaitingUsername) {
            captureUsername(line);
            return;
        }
        Command command = parser.parse(line).orElse(null);
        if (command == null) {
            if (!CommandParser.tokenize(line).isEmpty()) {
                pending.add(PendingAction.UNKNOWN_COMMAND);
            }
            return;
        }
        try {
            execute(command);
        } catch (IllegalArgumentException e) {
            status(command.word().word() + ": " + e.getMessage());
        } catch (IndexOutOfBoundsException e) {
            status(command.word().word() + ": missing argument");
        }
    }

    /**
     * Handle one message from the server.
     */
    public void onResponse(Response response) {
        if (!response.isFor(clientId)) {
            logger.debug("Ignoring {} for {}", response.type(), response.clientId());
            return;
        }
        switch (response.type()) {
            case SERVERTYPE -> {
                serverType = response.serverType();
                status("Connected to " + serverType.name().toLowerCase() + " server");
            }
            case CURRENT_VISDATA, COMPUTED_VISDATA -> {
                options = response.options().copy();
                originalData = response.visData();
                pending.add(PendingAction.NEW_DATA);
            }
            case CURRENT_SPECTRUM -> {
                spectrum = response.spectrum();
                if (spectrum.isEmpty()) {
                    status("No spectrum at the requested time");
                }
                pending.add(PendingAction.NEW_DATA);
            }
            case VISDATA_COMPUTED -> sink.send(Request.of(RequestType.COMPUTED_VISDATA, clientId));
            case OPTIONS_CHANGED -> {
                if (!response.clientId().equals(clientId)) {
                    status("Options changed by another viewer");
                    sink.send(Request.compute(clientId, OptionsSelection.authoritative()));
                }
            }
            case USERNAME_REQUESTED -> pending.add(PendingAction.USERNAME_REQUESTED);
            case SHUTDOWN -> {
                status("Server is shutting down");
                pending.add(PendingAction.QUIT);
            }
        }
    }

    /**
     * The connection closed without a shutdown notice.
     */
    public void onDisconnect() {
        if (!quit && !pending.contains(PendingAction.QUIT)) {
            status("Connection to server lost");
            pending.add(PendingAction.QUIT);
        }
    }

    public void onResize() {
        pending.add(PendingAction.REFRESH);
    }

    public void onInterrupt() {
        pending.add(PendingAction.QUIT);
    }

    /**
     * Carry out every queued action in order. Actions may queue later ones,
     * which run in the same pass.
     */
    public void processPending() {
        for (PendingAction action : PendingAction.values()) {
            if (pending.remove(action)) {
                perform(action);
            }
        }
    }

    public Set<PendingAction> getPending() {
        return pending.clone();
    }

    /**
     * Status lines produced since the last call, oldest first.
     */
    public List<String> drainStatus() {
        List<String> lines = List.copyOf(status);
        status.clear();
        return lines;
    }

    public boolean isQuitRequested() {
        return quit;
    }

    public boolean isAwaitingUsername() {
        return awaitingUsername;
    }

    public String getClientId() {
        return clientId;
    }

    public ServerType getServerType() {
        return serverType;
    }

    public AmpPhaseOptions getOptions() {
        return options;
    }

    public VisData getOriginalData() {
        return originalData;
    }

    public VisData getDisplayData() {
        return displayData;
    }

    public SpectrumData getSpectrum() {
        return spectrum;
    }

    public DisplayState getDisplay() {
        return display;
    }

    private void execute(Command command) {
        switch (command.word()) {
            case SELECT -> {
                if (!command.hasArgs()) {
                    status("Selected: " + String.join(" ", display.getProducts()));
                    return;
                }
                display.setProducts(command.args());
                pending.add(PendingAction.REFRESH);
            }
            case ARRAY -> {
                Set<Integer> antennas = new LinkedHashSet<>();
                for (String arg : command.args()) {
                    if (!arg.equalsIgnoreCase("all")) {
                        antennas.add(Integer.parseInt(arg));
                    }
                }
                display.setAntennas(antennas);
                pending.add(PendingAction.REFRESH);
            }
            case HISTORY -> {
                double minutes = Double.parseDouble(command.arg(0));
                double offset = command.args().size() > 1 ? Double.parseDouble(command.arg(1)) : 0;
                display.setHistory(minutes, offset);
                pending.add(PendingAction.REFRESH);
            }
            case SCALE -> {
                PanelType panel = PanelType.fromWord(command.arg(0));
                if (panel == null) {
                    throw new IllegalArgumentException("unknown panel " + command.arg(0));
                }
                float[] limits = command.args().size() >= 3
                        ? new float[]{Float.parseFloat(command.arg(1)), Float.parseFloat(command.arg(2))}
                        : null;
                display.setScale(panel, limits);
                pending.add(PendingAction.REFRESH);
            }
            case CALBAND -> {
                int primary = resolveWindow(command.arg(0));
                int secondary = command.args().size() > 1 ? resolveWindow(command.arg(1)) : display.getSecondaryBand();
                display.setCalibrationBands(primary, secondary);
                pending.add(PendingAction.VISBANDS_CHANGED);
            }
            case SORT -> {
                String how = command.hasArgs() ? command.arg(0).toLowerCase() : "";
                if (how.startsWith("len")) {
                    display.setSortByLength(true);
                } else if (how.startsWith("num")) {
                    display.setSortByLength(false);
                } else {
                    throw new IllegalArgumentException("sort by length or number");
                }
                pending.add(PendingAction.REFRESH);
            }
            case REFANT -> {
                int refant = Integer.parseInt(command.arg(0));
                ScanHeader header = currentHeader();
                if (header != null && !header.hasAntenna(refant)) {
                    throw new IllegalArgumentException("antenna " + refant + " not in current scan");
                }
                display.setRefant(refant);
                if (display.isClosurePhase()) {
                    pending.add(PendingAction.CLOSURE_PHASE);
                }
            }
            case CLOSURE -> {
                display.setClosurePhase(!command.hasArgs() || command.arg(0).equalsIgnoreCase("on"));
                pending.add(PendingAction.CLOSURE_PHASE);
            }
            case NNCAL -> display.setNncal(Integer.parseInt(command.arg(0)));
            case DCAL -> {
                DelayScope scope = command.hasArgs() ? DelayScope.fromWord(command.arg(0)) : DelayScope.ALL;
                if (scope == null) {
                    throw new IllegalArgumentException("scope must be before, after or all");
                }
                delayScope = scope;
                pending.add(PendingAction.DELAY_CALCULATION);
            }
            case RESET -> {
                if (!command.hasArgs() || !command.arg(0).toLowerCase().startsWith("del")) {
                    throw new IllegalArgumentException("usage: reset delays");
                }
                options.clearDelayModifiers();
                status("Delay corrections removed");
                pending.add(PendingAction.OPTIONS_CHANGED);
            }
            case DUMP -> {
                hardcopyFile = command.hasArgs() ? Path.of(command.arg(0)) : null;
                pending.add(PendingAction.HARDCOPY);
            }
            case SPECTRUM -> requestSpectrum(command);
            case TVCHANNELS -> {
                int window = resolveWindow(command.arg(0));
                options.setTvChannels(window, Integer.parseInt(command.arg(1)), Integer.parseInt(command.arg(2)));
                pending.add(PendingAction.TVCHANNELS_CHANGED);
            }
            case TSYSCORR -> {
                options.setTsysCorrection(parseTsysCorrection(command.arg(0)));
                pending.add(PendingAction.TSYSCORR_CHANGED);
            }
            case AVERAGE -> {
                int window = resolveWindow(command.arg(0));
                AveragingMethod current = options.getAveragingMethod(window);
                AveragingMethod.Statistic statistic = current.statistic();
                AveragingMethod.Combination combination = current.combination();
                for (String arg : command.args().subList(1, command.args().size())) {
                    switch (arg.toLowerCase()) {
                        case "mean" -> statistic = AveragingMethod.Statistic.MEAN;
                        case "median" -> statistic = AveragingMethod.Statistic.MEDIAN;
                        case "scalar" -> combination = AveragingMethod.Combination.SCALAR;
                        case "vector" -> combination = AveragingMethod.Combination.VECTOR;
                        default -> throw new IllegalArgumentException("unknown averaging " + arg);
                    }
                }
                options.setAveragingMethod(window, new AveragingMethod(statistic, combination));
                pending.add(PendingAction.OPTIONS_CHANGED);
            }
            case DELAVG -> {
                options.setDelayAveraging(resolveWindow(command.arg(0)), Integer.parseInt(command.arg(1)));
                pending.add(PendingAction.OPTIONS_CHANGED);
            }
            case PHASE -> {
                String units = command.arg(0).toLowerCase();
                if (units.startsWith("deg")) {
                    options.setPhaseInDegrees(true);
                } else if (units.startsWith("rad")) {
                    options.setPhaseInDegrees(false);
                } else {
                    throw new IllegalArgumentException("phase in degrees or radians");
                }
                pending.add(PendingAction.OPTIONS_CHANGED);
            }
            case INCLUDE, EXCLUDE -> {
                if (!command.hasArgs() || !command.arg(0).toLowerCase().startsWith("flag")) {
                    throw new IllegalArgumentException("usage: " + command.word().word() + " flagged");
                }
                options.setIncludeFlaggedData(command.word() == CommandWord.INCLUDE);
                pending.add(PendingAction.OPTIONS_CHANGED);
            }
            case PRINT -> pending.add(PendingAction.PRINT_OPTIONS);
            case DESCRIBE -> pending.add(PendingAction.DESCRIBE);
            case EXIT, QUIT -> pending.add(PendingAction.QUIT);
        }
    }

    private void requestSpectrum(Command command) {
        if (command.hasArgs() && command.arg(0).equalsIgnoreCase("off")) {
            display.setShowSpectrum(false);
            pending.add(PendingAction.REFRESH);
            return;
        }
        display.setShowSpectrum(true);
        if (replaying) {
            pending.add(PendingAction.REFRESH);
            return;
        }
        if (command.hasArgs()) {
            sink.send(Request.spectrumAt(clientId, Double.parseDouble(command.arg(0))));
        } else {
            sink.send(Request.of(RequestType.CURRENT_SPECTRUM, clientId));
        }
    }

    private void perform(PendingAction action) {
        switch (action) {
            case NEW_DATA -> {
                displayData = originalData;
                if (display.isClosurePhase()) {
                    pending.add(PendingAction.CLOSURE_PHASE);
                }
                pending.add(PendingAction.REFRESH);
            }
            case CLOSURE_PHASE -> {
                displayData = display.isClosurePhase()
                        ? closureCalculator.apply(originalData, display.getRefant())
                        : originalData;
                pending.add(PendingAction.REFRESH);
            }
            case DELAY_CALCULATION -> calibrateDelays();
            case DESCRIBE -> describe();
            case VISBANDS_CHANGED -> {
                status("Calibration bands: " + windowName(display.getPrimaryBand()) + " and "
                        + windowName(display.getSecondaryBand()));
                pending.add(PendingAction.REFRESH);
            }
            case HARDCOPY -> hardcopy();
            case REFRESH -> draw(renderer);
            case PRINT_OPTIONS -> options.describe(currentHeader()).forEach(this::status);
            case TVCHANNELS_CHANGED -> {
                status("Tv channels changed");
                pending.add(PendingAction.OPTIONS_CHANGED);
            }
            case TSYSCORR_CHANGED -> {
                status("Tsys correction set to " + options.getTsysCorrection().name().toLowerCase());
                pending.add(PendingAction.OPTIONS_CHANGED);
            }
            case OPTIONS_CHANGED -> sendOptions();
            case USERNAME_REQUESTED -> {
                if (username != null && !username.isBlank()) {
                    sink.send(Request.username(clientId, username));
                } else {
                    awaitingUsername = true;
                    usernameAttempts = 0;
                    status("The server needs a username before it accepts option changes. Username:");
                }
            }
            case UNKNOWN_COMMAND -> status("unknown command");
            case QUIT -> {
                quit = true;
                pending.clear();
            }
        }
    }

    private void captureUsername(String line) {
        String name = line == null ? "" : line.trim();
        if (name.isEmpty() || name.length() > MessageCodec.USERNAME_LENGTH) {
            usernameAttempts++;
            if (usernameAttempts >= MAX_USERNAME_ATTEMPTS) {
                awaitingUsername = false;
                status("No username given, option change not applied");
            } else {
                status("Username:");
            }
            return;
        }
        awaitingUsername = false;
        username = name;
        sink.send(Request.username(clientId, name));
    }

    private void sendOptions() {
        if (replaying) {
            status("Options cannot be changed while replaying a file");
            return;
        }
        sink.send(Request.compute(clientId, OptionsSelection.provided(options.copy())));
    }

    private void calibrateDelays() {
        try {
            DelayCalibrator.Solution solution = delayCalibrator.solve(originalData, display.getRefant(),
                    display.getNncal(), display.getPrimaryBand(), display.getSecondaryBand());
            List<DelayModifier> modifiers = solution.toModifiers(delayScope);
            options.addDelayModifiers(modifiers);
            status("Computed " + modifiers.size() + " delay corrections against antenna " + display.getRefant());
            pending.add(PendingAction.OPTIONS_CHANGED);
        } catch (CalibrationException e) {
            status(e.getMessage());
        }
    }

    private void describe() {
        ScanHeader header = currentHeader();
        if (header == null) {
            status("No data");
            return;
        }
        status(String.format("Source %s, %s, %s UT %.0fs, cycle time %ds, %d antennas",
                header.sourceName().trim(), header.obsType().trim(), header.obsDate().trim(),
                header.utSeconds(), header.cycleTime(), header.numAntennas()));
        for (int i = 0; i < header.numWindows(); i++) {
            IfWindow w = header.window(i);
            status(String.format("  %s (%s): %.1f MHz, %.1f MHz bandwidth, %d channels, %s",
                    w.label(), String.join("/", w.names()), w.centreFreqMhz(), w.bandwidthMhz(),
                    w.numChannels(), String.join(" ", w.stokesNames())));
        }
    }

    private void hardcopy() {
        Path file = hardcopyFile;
        if (file == null) {
            hardcopyCount++;
            file = Path.of("visconnect_" + hardcopyCount + "." + dumpFormat.extension());
        }
        hardcopyFile = null;
        Renderer device = hardcopies.apply(file, dumpFormat);
        try {
            if (draw(device)) {
                status("Plot written to " + file);
            }
        } finally {
            device.close();
        }
    }

    private boolean draw(Renderer device) {
        PlotModel model = display.isShowSpectrum() && spectrum != null
                ? plotBuilder.spectra(spectrum, display.toPlotSelection())
                : plotBuilder.timeSeries(displayData, display.toPlotSelection());
        try {
            device.render(model);
            return true;
        } catch (RuntimeException e) {
            logger.warn("Rendering failed", e);
            status("Plot failed: " + e.getMessage());
            return false;
        }
    }

    private ScanHeader currentHeader() {
        if (display.isShowSpectrum() && spectrum != null && !spectrum.isEmpty()) {
            return spectrum.header();
        }
        return originalData.latestHeader();
    }

    /**
     * @throws IllegalArgumentException if the current scan has no window of that name
     */
    private int resolveWindow(String name) {
        ScanHeader header = currentHeader();
        int window = header == null ? -1 : header.findWindow(name);
        if (window < 0) {
            throw new IllegalArgumentException("unknown IF " + name);
        }
        return window;
    }

    private String windowName(int window) {
        ScanHeader header = currentHeader();
        return header != null && window < header.numWindows() ? header.window(window).label() : "IF " + (window + 1);
    }

    private static TsysCorrection parseTsysCorrection(String word) {
        String w = word.toLowerCase();
        if (w.startsWith("on")) {
            return TsysCorrection.ONLINE;
        } else if (w.startsWith("rev") || w.startsWith("off")) {
            return TsysCorrection.REVERSE_ONLINE;
        } else if (w.startsWith("comp")) {
            return TsysCorrection.COMPUTED;
        }
        throw new IllegalArgumentException("unknown tsys correction " + word);
    }

    private void status(String line) {
        status.add(line);
    }
}
