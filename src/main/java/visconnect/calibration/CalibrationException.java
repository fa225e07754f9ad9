package visconnect.calibration;

/**
 * A calibration request that cannot be satisfied. The message is meant for
 * the user.
 */
public class CalibrationException extends Exception {

    public CalibrationException(String message) {
        super(message);
    }
}
