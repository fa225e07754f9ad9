package visconnect.processor;

import visconnect.archive.ArchiveIndex;
import visconnect.domain.AmpPhaseOptions;
import visconnect.domain.SpectrumData;
import visconnect.domain.VisData;

/**
 * Output of one reduction pass. The data fields are set only when their mode
 * was requested. {@code options} are the settings the pass actually used,
 * with every window it met filled in.
 */
public record ReductionResult(ArchiveIndex index, VisData visData, SpectrumData spectrum, AmpPhaseOptions options) {
}
