package io.ridetrack.gpx;

import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

final class GpxFormat {

    static final String GPX_NAMESPACE = "http://www.topografix.com/GPX/1/1";
    static final String EXTENSION_NAMESPACE = "https://ridetrack.io/gpx/1";
    static final String EXTENSION_PREFIX = "ridetrack";
    static final String CREATOR = "RideTrack";

    static final String TRKPT = "trkpt";
    static final String LAT = "lat";
    static final String LON = "lon";
    static final String ELE = "ele";
    static final String TIME = "time";
    static final String SPEED = "speed";
    static final String LEAN = "lean";
    static final String ACCEL = "accel";

    static final DateTimeFormatter TIME_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss'Z'").withZone(ZoneOffset.UTC);
    static final DateTimeFormatter NAME_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd_HH-mm-ss").withZone(ZoneOffset.UTC);

    private GpxFormat() {
        // hidden constructor
    }
}
