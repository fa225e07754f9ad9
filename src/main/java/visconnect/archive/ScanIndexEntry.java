package visconnect.archive;

import visconnect.domain.ScanHeader;

/**
 * Where one scan sits in time.
 *
 * @param header the scan header
 * @param startMjd time of the scan header
 * @param endMjd time of the last cycle, or the header time if there are none
 * @param numCycles cycles in the scan
 */
public record ScanIndexEntry(ScanHeader header, double startMjd, double endMjd, int numCycles) {

    /**
     * Whether a time falls within this scan, allowing half a cycle time of
     * slack on both ends.
     */
    public boolean covers(double mjd) {
        double slack = header.halfCycleDays();
        return mjd >= startMjd - slack && mjd <= endMjd + slack;
    }

    public String summary() {
        return String.format("%-16s %-16s MJD %.6f - %.6f (%d cycles)",
                header.sourceName(), header.obsType(), startMjd, endMjd, numCycles);
    }
}
