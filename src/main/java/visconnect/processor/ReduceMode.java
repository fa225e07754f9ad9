package visconnect.processor;

/**
 * What a reduction pass produces. Modes can be combined in one pass.
 */
public enum ReduceMode {
    /** Rebuild the archive time index. */
    READ_SCAN_METADATA,
    /** Reduce every cycle of every file to averaged products. */
    COMPUTE_VIS_PRODUCTS,
    /** Return the raw spectra of the one cycle at a requested time. */
    GRAB_SPECTRUM
}
