package visconnect.domain;

/**
 * Earth-centred Cartesian antenna position in metres.
 */
public record AntennaPosition(double x, double y, double z) {

    public double distanceTo(AntennaPosition other) {
        double dx = x - other.x;
        double dy = y - other.y;
        double dz = z - other.z;
        return Math.sqrt(dx * dx + dy * dy + dz * dz);
    }
}
