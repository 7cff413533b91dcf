package io.ridetrack.gpx;

import io.ridetrack.model.TrackPoint;

import javax.xml.stream.XMLOutputFactory;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamWriter;
import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Locale;

import static io.ridetrack.gpx.GpxFormat.*;

/**
 * Writes one track with one segment as a GPX 1.1 document. Lean and acceleration go into vendor
 * extensions and are omitted for points that carry neither.
 */
public class GpxWriter {

    private static final XMLOutputFactory OUTPUT_FACTORY = XMLOutputFactory.newInstance();

    public void write(Path file, List<TrackPoint> points) throws IOException {
        if (points.isEmpty()) {
            throw new IllegalArgumentException("Refusing to write an empty track to " + file);
        }
        try (OutputStream out = new BufferedOutputStream(Files.newOutputStream(file))) {
            XMLStreamWriter xml = OUTPUT_FACTORY.createXMLStreamWriter(out, "UTF-8");
            try {
                writeDocument(xml, points);
                xml.flush();
            } finally {
                xml.close();
            }
        } catch (XMLStreamException e) {
            throw new IOException("Failed to write GPX to " + file, e);
        }
    }

    private void writeDocument(XMLStreamWriter xml, List<TrackPoint> points) throws XMLStreamException {
        xml.writeStartDocument("UTF-8", "1.0");
        xml.writeCharacters("\n");
        xml.writeStartElement("gpx");
        xml.writeDefaultNamespace(GPX_NAMESPACE);
        xml.writeNamespace(EXTENSION_PREFIX, EXTENSION_NAMESPACE);
        xml.writeAttribute("version", "1.1");
        xml.writeAttribute("creator", CREATOR);

        indent(xml, 1);
        xml.writeStartElement("trk");
        indent(xml, 2);
        simpleElement(xml, "name", "Track " + NAME_FORMAT.format(Instant.ofEpochMilli(points.get(0).getTimestampMs())));
        indent(xml, 2);
        xml.writeStartElement("trkseg");

        for (TrackPoint point : points) {
            writePoint(xml, point);
        }

        indent(xml, 2);
        xml.writeEndElement();
        indent(xml, 1);
        xml.writeEndElement();
        xml.writeCharacters("\n");
        xml.writeEndElement();
        xml.writeCharacters("\n");
        xml.writeEndDocument();
    }

    private void writePoint(XMLStreamWriter xml, TrackPoint point) throws XMLStreamException {
        indent(xml, 3);
        xml.writeStartElement(TRKPT);
        xml.writeAttribute(LAT, Double.toString(point.getLatitude()));
        xml.writeAttribute(LON, Double.toString(point.getLongitude()));
        indent(xml, 4);
        simpleElement(xml, ELE, Double.toString(point.getElevation()));
        indent(xml, 4);
        simpleElement(xml, TIME, TIME_FORMAT.format(Instant.ofEpochMilli(point.getTimestampMs())));
        indent(xml, 4);
        simpleElement(xml, SPEED, Float.toString(point.getSpeedMps()));

        if (point.hasLeanAngle() || point.hasLongitudinalAccel()) {
            indent(xml, 4);
            xml.writeStartElement("extensions");
            if (point.hasLeanAngle()) {
                indent(xml, 5);
                extensionElement(xml, LEAN, String.format(Locale.US, "%.2f", point.getLeanAngleDeg()));
            }
            if (point.hasLongitudinalAccel()) {
                indent(xml, 5);
                extensionElement(xml, ACCEL, String.format(Locale.US, "%.3f", point.getLongitudinalAccelMps2()));
            }
            indent(xml, 4);
            xml.writeEndElement();
        }

        indent(xml, 3);
        xml.writeEndElement();
    }

    private static void simpleElement(XMLStreamWriter xml, String name, String text) throws XMLStreamException {
        xml.writeStartElement(name);
        xml.writeCharacters(text);
        xml.writeEndElement();
    }

    private static void extensionElement(XMLStreamWriter xml, String name, String text) throws XMLStreamException {
        xml.writeStartElement(EXTENSION_PREFIX, name, EXTENSION_NAMESPACE);
        xml.writeCharacters(text);
        xml.writeEndElement();
    }

    private static void indent(XMLStreamWriter xml, int depth) throws XMLStreamException {
        xml.writeCharacters("\n" + "  ".repeat(depth));
    }
}
