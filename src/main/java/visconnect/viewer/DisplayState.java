package visconnect.viewer;

import visconnect.domain.Polarisation;
import visconnect.output.PanelType;
import visconnect.output.PlotProduct;
import visconnect.output.PlotSelection;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * What one viewer shows. Local to the viewer and never sent to the server.
 * <p>
 * Products are named by two letters: {@code aa bb ab ba} are the XX, YY, XY
 * and YX products of the primary calibration band, {@code cc dd cd dc} the
 * same products of the secondary band.
 */
public class DisplayState {

    public static final List<String> PRODUCT_CODES = List.of("aa", "bb", "ab", "ba", "cc", "dd", "cd", "dc");

    private static final double DEFAULT_HISTORY_MINUTES = 20;

    private final List<String> products = new ArrayList<>(List.of("aa", "bb"));
    private final Set<Integer> antennas = new LinkedHashSet<>();
    private final Map<PanelType, float[]> scales = new EnumMap<>(PanelType.class);
    private final List<PanelType> panels = new ArrayList<>(List.of(PanelType.AMPLITUDE, PanelType.PHASE, PanelType.DELAY));
    private double historyMinutes = DEFAULT_HISTORY_MINUTES;
    private double historyOffsetMinutes;
    private boolean sortByLength;
    private int primaryBand;
    private int secondaryBand = 1;
    private int refant = 1;
    private int nncal = 3;
    private boolean closurePhase;
    private boolean showSpectrum;

    public static boolean isProductCode(String code) {
        return PRODUCT_CODES.contains(code.toLowerCase());
    }

    /**
     * The polarisation a product code names.
     */
    static Polarisation polarisationOf(String code) {
        return switch (code.toLowerCase()) {
            case "aa", "cc" -> Polarisation.XX;
            case "bb", "dd" -> Polarisation.YY;
            case "ab", "cd" -> Polarisation.XY;
            case "ba", "dc" -> Polarisation.YX;
            default -> throw new IllegalArgumentException("Unknown product " + code);
        };
    }

    static boolean isSecondaryBand(String code) {
        char c = Character.toLowerCase(code.charAt(0));
        return c == 'c' || c == 'd';
    }

    /**
     * Resolve the chosen products against the calibration bands.
     */
    public PlotSelection toPlotSelection() {
        List<PlotProduct> resolved = new ArrayList<>();
        for (String code : products) {
            int window = isSecondaryBand(code) ? secondaryBand : primaryBand;
            resolved.add(new PlotProduct(window, polarisationOf(code), code));
        }
        return new PlotSelection(resolved, antennas, historyMinutes, historyOffsetMinutes, panels,
                scales, sortByLength);
    }

    public List<String> getProducts() {
        return List.copyOf(products);
    }

    public void setProducts(List<String> codes) {
        for (String code : codes) {
            if (!isProductCode(code)) {
                throw new IllegalArgumentException("Unknown product " + code);
            }
        }
        products.clear();
        for (String code : codes) {
            String lower = code.toLowerCase();
            if (!products.contains(lower)) {
                products.add(lower);
            }
        }
    }

    public Set<Integer> getAntennas() {
        return Set.copyOf(antennas);
    }

    /**
     * @param selected antennas to show; empty to show all
     */
    public void setAntennas(Set<Integer> selected) {
        antennas.clear();
        antennas.addAll(selected);
    }

    public double getHistoryMinutes() {
        return historyMinutes;
    }

    public double getHistoryOffsetMinutes() {
        return historyOffsetMinutes;
    }

    public void setHistory(double minutes, double offsetMinutes) {
        if (minutes <= 0 || offsetMinutes < 0) {
            throw new IllegalArgumentException("Invalid history " + minutes + " offset " + offsetMinutes);
        }
        historyMinutes = minutes;
        historyOffsetMinutes = offsetMinutes;
    }

    public float[] getScale(PanelType panel) {
        float[] limits = scales.get(panel);
        return limits == null ? null : limits.clone();
    }

    /**
     * Fix the limits of a panel, or return it to automatic scaling when {@code limits} is null.
     */
    public void setScale(PanelType panel, float[] limits) {
        if (limits == null) {
            scales.remove(panel);
            return;
        }
        if (limits.length != 2 || !(limits[0] < limits[1])) {
            throw new IllegalArgumentException("Scale needs a minimum below the maximum");
        }
        scales.put(panel, limits.clone());
    }

    public boolean isSortByLength() {
        return sortByLength;
    }

    public void setSortByLength(boolean sortByLength) {
        this.sortByLength = sortByLength;
    }

    public int getPrimaryBand() {
        return primaryBand;
    }

    public int getSecondaryBand() {
        return secondaryBand;
    }

    public void setCalibrationBands(int primary, int secondary) {
        if (primary < 0 || secondary < 0) {
            throw new IllegalArgumentException("Invalid calibration bands " + primary + ", " + secondary);
        }
        primaryBand = primary;
        secondaryBand = secondary;
    }

    public int getRefant() {
        return refant;
    }

    public void setRefant(int refant) {
        if (refant < 1) {
            throw new IllegalArgumentException("Invalid reference antenna " + refant);
        }
        this.refant = refant;
    }

    public int getNncal() {
        return nncal;
    }

    public void setNncal(int nncal) {
        if (nncal < 1) {
            throw new IllegalArgumentException("nncal must be at least 1");
        }
        this.nncal = nncal;
    }

    public boolean isClosurePhase() {
        return closurePhase;
    }

    public void setClosurePhase(boolean closurePhase) {
        this.closurePhase = closurePhase;
    }

    public boolean isShowSpectrum() {
        return showSpectrum;
    }

    public void setShowSpectrum(boolean showSpectrum) {
        this.showSpectrum = showSpectrum;
    }
}
