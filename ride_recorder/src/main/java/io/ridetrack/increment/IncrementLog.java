package io.ridetrack.increment;

import io.ridetrack.gpx.GpxWriter;
import io.ridetrack.model.TrackPoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.channels.FileChannel;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Append-only store of in-flight track points as {@code increments/{token}_{seq}.inc} segments.
 */
public class IncrementLog {
    private static final Logger LOG = LoggerFactory.getLogger(IncrementLog.class);

    public static final String SEGMENT_DIR_NAME = "increments";
    public static final String SEGMENT_EXTENSION = ".inc";
    public static final String TEMP_EXTENSION = ".tmp";
    public static final String TRACK_PREFIX = "track_";
    public static final String TRACK_EXTENSION = ".gpx";

    private final Path storageDir;
    private final Path segmentDir;
    private final GpxWriter gpxWriter;

    public IncrementLog(Path storageDir) {
        this(storageDir, new GpxWriter());
    }

    public IncrementLog(Path storageDir, GpxWriter gpxWriter) {
        this.storageDir = storageDir;
        this.segmentDir = storageDir.resolve(SEGMENT_DIR_NAME);
        this.gpxWriter = gpxWriter;
    }

    public Path getStorageDir() {
        return storageDir;
    }

    public Path getSegmentDir() {
        return segmentDir;
    }

    public static String segmentFileName(String token, int sequenceNumber) {
        return String.format("%s_%04d%s", token, sequenceNumber, SEGMENT_EXTENSION);
    }

    public static String trackFileName(String token) {
        return TRACK_PREFIX + token + TRACK_EXTENSION;
    }

    public Path trackFile(String token) {
        return storageDir.resolve(trackFileName(token));
    }

    public boolean hasTrack(String token) {
        return Files.exists(trackFile(token));
    }

    public boolean writeSegment(String token, int sequenceNumber, List<TrackPoint> points) {
        if (points.isEmpty()) {
            return true;
        }
        String finalName = segmentFileName(token, sequenceNumber);
        Path finalFile = segmentDir.resolve(finalName);
        Path tempFile = segmentDir.resolve(finalName + TEMP_EXTENSION);
        try {
            Files.createDirectories(segmentDir);
            try (BufferedWriter writer = Files.newBufferedWriter(tempFile, StandardCharsets.UTF_8)) {
                for (TrackPoint point : points) {
                    writer.write(SegmentCodec.encode(point));
                    writer.write('\n');
                }
            }
            syncToDisk(tempFile);
            Files.move(tempFile, finalFile, StandardCopyOption.ATOMIC_MOVE);
            LOG.debug("Wrote segment {} with {} points", finalName, points.size());
            return true;
        } catch (IOException e) {
            LOG.warn("Failed to write segment {}: {}", finalName, e.toString());
            deleteQuietly(tempFile);
            return false;
        }
    }

    public Map<String, List<Path>> listSegments() throws IOException {
        Map<String, List<Path>> byToken = new TreeMap<>();
        if (!Files.isDirectory(segmentDir)) {
            return byToken;
        }
        try (Stream<Path> files = Files.list(segmentDir)) {
            for (Path file : files.collect(Collectors.toList())) {
                String name = file.getFileName().toString();
                if (!name.endsWith(SEGMENT_EXTENSION)) {
                    continue;
                }
                String token = tokenOf(name);
                if (token == null) {
                    LOG.warn("Ignoring segment file with unexpected name {}", name);
                    continue;
                }
                byToken.computeIfAbsent(token, key -> new ArrayList<>()).add(file);
            }
        }
        for (List<Path> group : byToken.values()) {
            group.sort(Comparator.comparingInt(file -> sequenceOf(file.getFileName().toString())));
        }
        return byToken;
    }

    // Segments without a finalized track
    public List<OrphanSession> listOrphanSessions() throws IOException {
        List<OrphanSession> orphans = new ArrayList<>();
        for (Map.Entry<String, List<Path>> entry : listSegments().entrySet()) {
            if (!hasTrack(entry.getKey())) {
                orphans.add(new OrphanSession(entry.getKey(), entry.getValue()));
            }
        }
        return orphans;
    }

    // Track written, segments not yet deleted
    public List<String> listFinalizedLeftovers() throws IOException {
        return listSegments().keySet().stream()
                .filter(this::hasTrack)
                .collect(Collectors.toList());
    }

    public List<Path> segmentFiles(String token) throws IOException {
        return listSegments().getOrDefault(token, new ArrayList<>());
    }

    public boolean hasSegments(String token) throws IOException {
        return !segmentFiles(token).isEmpty();
    }

    public List<TrackPoint> readSegments(List<Path> files) {
        List<TrackPoint> points = new ArrayList<>();
        for (Path file : files) {
            // Invalid bytes decode to U+FFFD so only the damaged line fails to parse
            try (BufferedReader reader = new BufferedReader(new InputStreamReader(Files.newInputStream(file),
                    StandardCharsets.UTF_8.newDecoder()
                            .onMalformedInput(CodingErrorAction.REPLACE)
                            .onUnmappableCharacter(CodingErrorAction.REPLACE)))) {
                int skipped = 0;
                String line;
                while ((line = reader.readLine()) != null) {
                    if (line.isBlank()) {
                        continue;
                    }
                    TrackPoint point = SegmentCodec.decode(line);
                    if (point == null) {
                        skipped++;
                    } else {
                        points.add(point);
                    }
                }
                if (skipped > 0) {
                    LOG.warn("Skipped {} corrupt lines in {}", skipped, file.getFileName());
                }
            } catch (IOException | UncheckedIOException e) {
                LOG.warn("Skipping unreadable segment {}: {}", file.getFileName(), e.toString());
            }
        }
        return points;
    }

    public Optional<Path> mergeToFinalTrack(String token, List<Path> files) throws IOException {
        return mergeToFinalTrack(token, files, new ArrayList<>());
    }

    public Optional<Path> mergeToFinalTrack(String token, List<Path> files, List<TrackPoint> trailing)
            throws IOException {
        List<TrackPoint> points = readSegments(files);
        points.addAll(trailing);
        if (points.isEmpty()) {
            return Optional.empty();
        }
        Files.createDirectories(storageDir);
        Path trackFile = trackFile(token);
        Path tempFile = storageDir.resolve(trackFileName(token) + TEMP_EXTENSION);
        try {
            gpxWriter.write(tempFile, points);
            syncToDisk(tempFile);
            Files.move(tempFile, trackFile, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            deleteQuietly(tempFile);
            throw e;
        }
        LOG.info("Merged {} segments ({} points) into {}", files.size(), points.size(), trackFile.getFileName());
        return Optional.of(trackFile);
    }

    public void deleteSegments(String token) throws IOException {
        if (!Files.isDirectory(segmentDir)) {
            return;
        }
        String prefix = token + "_";
        List<Path> doomed;
        try (Stream<Path> files = Files.list(segmentDir)) {
            doomed = files.filter(file -> {
                String name = file.getFileName().toString();
                return name.startsWith(prefix)
                        && (name.endsWith(SEGMENT_EXTENSION) || name.endsWith(TEMP_EXTENSION));
            }).collect(Collectors.toList());
        }
        for (Path file : doomed) {
            Files.deleteIfExists(file);
        }
        try (Stream<Path> remaining = Files.list(segmentDir)) {
            if (remaining.findAny().isEmpty()) {
                Files.deleteIfExists(segmentDir);
            }
        }
        LOG.debug("Deleted {} segment files of {}", doomed.size(), token);
    }

    // Includes a first segment that never got renamed, which listSegments() cannot see
    public int deleteStrayTemporaryFiles() throws IOException {
        List<Path> doomed = new ArrayList<>();
        for (Path dir : new Path[] {segmentDir, storageDir}) {
            if (!Files.isDirectory(dir)) {
                continue;
            }
            try (Stream<Path> files = Files.list(dir)) {
                files.filter(file -> file.getFileName().toString().endsWith(TEMP_EXTENSION)
                                && Files.isRegularFile(file))
                        .forEach(doomed::add);
            }
        }
        for (Path file : doomed) {
            Files.deleteIfExists(file);
            LOG.info("Removed stray temporary file {}", file.getFileName());
        }
        return doomed.size();
    }

    static String tokenOf(String fileName) {
        String stem = fileName.substring(0, fileName.length() - SEGMENT_EXTENSION.length());
        int separator = stem.lastIndexOf('_');
        if (separator <= 0 || sequenceOf(fileName) < 0) {
            return null;
        }
        return stem.substring(0, separator);
    }

    static int sequenceOf(String fileName) {
        String stem = fileName.endsWith(SEGMENT_EXTENSION)
                ? fileName.substring(0, fileName.length() - SEGMENT_EXTENSION.length())
                : fileName;
        int separator = stem.lastIndexOf('_');
        if (separator < 0) {
            return -1;
        }
        try {
            return Integer.parseInt(stem.substring(separator + 1));
        } catch (NumberFormatException e) {
            return -1;
        }
    }

    private static void syncToDisk(Path file) throws IOException {
        try (FileChannel channel = FileChannel.open(file, StandardOpenOption.WRITE)) {
            channel.force(true);
        }
    }

    private static void deleteQuietly(Path file) {
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            LOG.warn("Could not remove temporary file {}: {}", file, e.toString());
        }
    }
}
