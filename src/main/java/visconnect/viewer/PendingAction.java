package visconnect.viewer;

/**
 * Work a viewer has queued for its next loop iteration.
 * <p>
 * Actions accumulate between iterations and are then carried out in
 * declaration order, so new data is in place before it is redrawn and
 * option changes are sent once after every local setting has been applied.
 */
public enum PendingAction {
    NEW_DATA,
    CLOSURE_PHASE,
    DELAY_CALCULATION,
    DESCRIBE,
    VISBANDS_CHANGED,
    HARDCOPY,
    REFRESH,
    PRINT_OPTIONS,
    TVCHANNELS_CHANGED,
    TSYSCORR_CHANGED,
    OPTIONS_CHANGED,
    USERNAME_REQUESTED,
    UNKNOWN_COMMAND,
    QUIT
}
