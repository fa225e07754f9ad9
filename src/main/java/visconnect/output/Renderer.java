package visconnect.output;

/**
 * Draws finished numeric series. Implementations own the output device.
 */
public interface Renderer {

    /**
     * Draw one set of panels.
     *
     * @throws RuntimeException if drawing fails
     */
    void render(PlotModel model);

    /**
     * Release the device. Should be idempotent.
     */
    default void close() {
    }
}
