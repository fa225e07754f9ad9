package visconnect.domain;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;

/**
 * Modified Julian Date helpers. Archive timestamps are an observation date
 * plus seconds of UT on that date.
 */
public final class Mjd {

    public static final double SECONDS_PER_DAY = 86400.0;

    private Mjd() {
    }

    /**
     * Convert a calendar date and UT seconds into an MJD.
     *
     * @return the MJD, or 0 if the date is invalid
     */
    public static double fromCalendar(int day, int month, int year, double utSeconds) {
        if (month < 1 || month > 12 || day < 1 || day > LocalDate.of(year, month, 1).lengthOfMonth()) {
            return 0;
        }
        int m;
        int y;
        if (month <= 2) {
            m = month + 9;
            y = year - 1;
        } else {
            m = month - 3;
            y = year;
        }
        int c = y / 100;
        y -= c * 100;
        int x1 = (int) (146097.0 * c / 4.0);
        int x2 = (int) (1461.0 * y / 4.0);
        int x3 = (int) ((153.0 * m + 2.0) / 5.0);
        return (x1 + x2 + x3 + day - 678882) + utSeconds / SECONDS_PER_DAY;
    }

    /**
     * Convert an archive observation date ("yyyy-MM-dd") and UT seconds into an MJD.
     *
     * @return the MJD, or 0 if the date cannot be parsed
     */
    public static double fromObsDate(String obsDate, double utSeconds) {
        if (obsDate == null) {
            return 0;
        }
        try {
            LocalDate date = LocalDate.parse(obsDate.trim());
            return fromCalendar(date.getDayOfMonth(), date.getMonthValue(), date.getYear(), utSeconds);
        } catch (DateTimeParseException e) {
            return 0;
        }
    }

    public static double secondsToDays(double seconds) {
        return seconds / SECONDS_PER_DAY;
    }

    public static double daysToSeconds(double days) {
        return days * SECONDS_PER_DAY;
    }
}
