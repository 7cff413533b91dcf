package io.ridetrack.gpx;

import io.ridetrack.model.TrackPoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.xml.stream.XMLInputFactory;
import javax.xml.stream.XMLStreamConstants;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamReader;
import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

import static io.ridetrack.gpx.GpxFormat.*;

/**
 * Reads the track points of a GPX file. Tolerant: points without coordinates are skipped and a
 * malformed document yields whatever was read before the error.
 */
public class GpxReader {
    private static final Logger LOG = LoggerFactory.getLogger(GpxReader.class);

    private final XMLInputFactory inputFactory;

    public GpxReader() {
        inputFactory = XMLInputFactory.newInstance();
        inputFactory.setProperty(XMLInputFactory.SUPPORT_DTD, false);
        inputFactory.setProperty(XMLInputFactory.IS_SUPPORTING_EXTERNAL_ENTITIES, false);
    }

    public List<TrackPoint> read(Path file) throws IOException {
        List<TrackPoint> points = new ArrayList<>();
        try (InputStream in = new BufferedInputStream(Files.newInputStream(file))) {
            XMLStreamReader xml = inputFactory.createXMLStreamReader(in);
            try {
                readPoints(xml, points);
            } finally {
                xml.close();
            }
        } catch (XMLStreamException e) {
            LOG.warn("Malformed GPX {}, keeping {} points read so far: {}", file, points.size(), e.getMessage());
        }
        return points;
    }

    private void readPoints(XMLStreamReader xml, List<TrackPoint> points) throws XMLStreamException {
        PointBuilder current = null;
        while (xml.hasNext()) {
            int event = xml.next();
            if (event == XMLStreamConstants.START_ELEMENT) {
                String name = xml.getLocalName();
                if (TRKPT.equals(name)) {
                    current = new PointBuilder(xml.getAttributeValue(null, LAT), xml.getAttributeValue(null, LON));
                } else if (current != null) {
                    switch (name) {
                        case ELE:
                            current.elevation = parseDouble(xml.getElementText(), 0.0);
                            break;
                        case TIME:
                            current.timestampMs = parseTime(xml.getElementText());
                            break;
                        case SPEED:
                            current.speed = (float) parseDouble(xml.getElementText(), 0.0);
                            break;
                        case LEAN:
                            current.lean = (float) parseDouble(xml.getElementText(), Double.NaN);
                            break;
                        case ACCEL:
                            current.accel = (float) parseDouble(xml.getElementText(), Double.NaN);
                            break;
                        default:
                            break;
                    }
                }
            } else if (event == XMLStreamConstants.END_ELEMENT && TRKPT.equals(xml.getLocalName()) && current != null) {
                TrackPoint point = current.build();
                if (point != null) {
                    points.add(point);
                }
                current = null;
            }
        }
    }

    static long parseTime(String text) {
        String trimmed = text.trim();
        if (trimmed.isEmpty()) {
            return 0L;
        }
        try {
            return OffsetDateTime.parse(trimmed).toInstant().toEpochMilli();
        } catch (DateTimeParseException e) {
            try {
                return Instant.parse(trimmed).toEpochMilli();
            } catch (DateTimeParseException ignored) {
                return 0L;
            }
        }
    }

    private static double parseDouble(String text, double fallback) {
        if (text == null || text.isBlank()) {
            return fallback;
        }
        try {
            return Double.parseDouble(text.trim());
        } catch (NumberFormatException e) {
            return fallback;
        }
    }

    private static final class PointBuilder {
        private final String lat;
        private final String lon;
        private double elevation;
        private long timestampMs;
        private float speed;
        private float lean = Float.NaN;
        private float accel = Float.NaN;

        private PointBuilder(String lat, String lon) {
            this.lat = lat;
            this.lon = lon;
        }

        private TrackPoint build() {
            double latitude = parseDouble(lat, Double.NaN);
            double longitude = parseDouble(lon, Double.NaN);
            if (Double.isNaN(latitude) || Double.isNaN(longitude)) {
                return null;
            }
            return new TrackPoint(latitude, longitude, elevation, speed, timestampMs, lean, accel);
        }
    }
}
