package io.ridetrack.session;

import io.ridetrack.RecorderConfig;
import io.ridetrack.gpx.GpxReader;
import io.ridetrack.gpx.GpxWriter;
import io.ridetrack.increment.IncrementLog;
import io.ridetrack.model.InertialSample;
import io.ridetrack.model.LocationFix;
import io.ridetrack.model.TrackPoint;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

public class SessionEngineTest {

    /** 2024-05-01T08:30:00Z */
    private static final long T0 = 1_714_552_200_000L;
    private static final String TOKEN = "2024-05-01_08-30-00";

    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    private Path storageDir;
    private RecorderConfig config;

    @Before
    public void setUp() throws IOException {
        storageDir = folder.newFolder("storage").toPath();
        config = new RecorderConfig();
        config.setFlushIntervalMs(10_000L);
        config.setStatsIntervalMs(1_000L);
        config.setFinalizeTimeoutMs(60_000L);
    }

    private SessionEngine engine() {
        return new SessionEngine(config, new IncrementLog(storageDir));
    }

    private static SessionEvent fix(double lat, double lon, Float accuracy, long at) {
        return SessionEvent.locationFix(at, new LocationFix(lat, lon, 10f, 500.0, accuracy, at));
    }

    private static List<SessionEffect.Type> types(List<SessionEffect> effects) {
        return effects.stream().map(SessionEffect::getType).collect(Collectors.toList());
    }

    private static SessionEffect only(List<SessionEffect> effects, SessionEffect.Type type) {
        List<SessionEffect> matching = effects.stream().filter(e -> e.getType() == type).collect(Collectors.toList());
        Assert.assertEquals("effects of type " + type + " in " + effects, 1, matching.size());
        return matching.get(0);
    }

    private static float[] roll(double degrees) {
        float c = (float) Math.cos(Math.toRadians(degrees));
        float s = (float) Math.sin(Math.toRadians(degrees));
        return new float[]{1, 0, 0, 0, c, -s, 0, s, c};
    }

    @Test
    public void startPauseResumeStopProducesOneTrack() throws IOException {
        SessionEngine engine = engine();
        Assert.assertEquals(SessionState.IDLE, engine.state());

        List<SessionEffect> started = engine.apply(SessionEvent.start(T0));
        Assert.assertEquals(Arrays.asList(SessionEffect.Type.SESSION_STARTED), types(started));
        Assert.assertEquals(TOKEN, started.get(0).getToken());
        Assert.assertEquals(SessionState.RECORDING, engine.state());

        engine.apply(fix(48.0, 11.0, 5f, T0 + 1_000L));
        engine.apply(fix(48.001, 11.0, 5f, T0 + 2_000L));
        Assert.assertEquals(2, engine.bufferedPointCount());

        List<SessionEffect> paused = engine.apply(SessionEvent.pause(T0 + 3_000L));
        Assert.assertEquals(Arrays.asList(SessionEffect.Type.SESSION_PAUSED), types(paused));
        Assert.assertEquals(SessionState.PENDING_FINALIZE, engine.state());
        Assert.assertEquals(0, engine.bufferedPointCount());
        Assert.assertTrue(Files.exists(storageDir.resolve("increments").resolve(TOKEN + "_0000.inc")));

        engine.apply(fix(48.002, 11.0, 5f, T0 + 4_000L));
        Assert.assertEquals("fixes while paused are ignored", 0, engine.bufferedPointCount());

        List<SessionEffect> resumed = engine.apply(SessionEvent.start(T0 + 10_000L));
        Assert.assertEquals(Arrays.asList(SessionEffect.Type.SESSION_RESUMED), types(resumed));
        Assert.assertEquals(TOKEN, resumed.get(0).getToken());

        engine.apply(fix(48.002, 11.0, 5f, T0 + 11_000L));
        List<SessionEffect> stopped = engine.apply(SessionEvent.stop(T0 + 12_000L));

        SessionEffect finalized = only(stopped, SessionEffect.Type.SESSION_FINALIZED);
        Assert.assertEquals(TOKEN, finalized.getToken());
        Assert.assertEquals(storageDir.resolve("track_" + TOKEN + ".gpx"), finalized.getTrackFile());
        Assert.assertEquals(3, finalized.getSummary().getPointCount());
        Assert.assertEquals(SessionState.IDLE, engine.state());
        Assert.assertFalse(engine.currentToken().isPresent());
        Assert.assertFalse(Files.exists(storageDir.resolve("increments")));

        List<TrackPoint> track = new GpxReader().read(finalized.getTrackFile());
        Assert.assertEquals(3, track.size());
        Assert.assertEquals(48.002, track.get(2).getLatitude(), 1e-9);
    }

    @Test
    public void startWhileRecordingIsIgnored() {
        SessionEngine engine = engine();
        engine.apply(SessionEvent.start(T0));
        Assert.assertTrue(engine.apply(SessionEvent.start(T0 + 500L)).isEmpty());
        Assert.assertEquals(TOKEN, engine.currentToken().get());
    }

    @Test
    public void pauseAndStopWithoutSessionAreIgnored() {
        SessionEngine engine = engine();
        Assert.assertTrue(engine.apply(SessionEvent.pause(T0)).isEmpty());
        Assert.assertTrue(engine.apply(SessionEvent.stop(T0)).isEmpty());
        Assert.assertTrue(engine.apply(SessionEvent.tick(T0)).isEmpty());
        Assert.assertEquals(SessionState.IDLE, engine.state());
    }

    @Test
    public void pendingSessionFinalizesAfterTimeout() {
        SessionEngine engine = engine();
        engine.apply(SessionEvent.start(T0));
        engine.apply(fix(48.0, 11.0, 5f, T0 + 500L));
        engine.apply(SessionEvent.pause(T0 + 1_000L));

        List<SessionEffect> early = engine.apply(SessionEvent.tick(T0 + 30_000L));
        Assert.assertFalse(types(early).contains(SessionEffect.Type.SESSION_FINALIZED));
        Assert.assertEquals(SessionState.PENDING_FINALIZE, engine.state());

        List<SessionEffect> due = engine.apply(SessionEvent.tick(T0 + 61_000L));
        SessionEffect finalized = only(due, SessionEffect.Type.SESSION_FINALIZED);
        Assert.assertNotNull(finalized.getTrackFile());
        Assert.assertFalse(types(due).contains(SessionEffect.Type.STATISTICS));
        Assert.assertEquals(SessionState.IDLE, engine.state());
    }

    @Test
    public void resumeCancelsFinalizeTimeout() {
        SessionEngine engine = engine();
        engine.apply(SessionEvent.start(T0));
        engine.apply(SessionEvent.pause(T0 + 1_000L));
        engine.apply(SessionEvent.start(T0 + 2_000L));

        List<SessionEffect> later = engine.apply(SessionEvent.tick(T0 + 120_000L));
        Assert.assertFalse(types(later).contains(SessionEffect.Type.SESSION_FINALIZED));
        Assert.assertEquals(SessionState.RECORDING, engine.state());
    }

    @Test
    public void stopCancelsEveryTimer() {
        SessionEngine engine = engine();
        engine.apply(SessionEvent.start(T0));
        engine.apply(fix(48.0, 11.0, 5f, T0 + 500L));
        engine.apply(SessionEvent.pause(T0 + 1_000L));
        engine.apply(SessionEvent.stop(T0 + 2_000L));

        Assert.assertTrue(engine.apply(SessionEvent.tick(T0 + 10_000L)).isEmpty());
        Assert.assertTrue(engine.apply(SessionEvent.tick(T0 + 100_000L)).isEmpty());
    }

    @Test
    public void stopWithoutPointsFinalizesWithoutTrack() {
        SessionEngine engine = engine();
        engine.apply(SessionEvent.start(T0));
        SessionEffect finalized = only(engine.apply(SessionEvent.stop(T0 + 1_000L)), SessionEffect.Type.SESSION_FINALIZED);
        Assert.assertNull(finalized.getTrackFile());
        Assert.assertNull(finalized.getSummary());
        Assert.assertFalse(Files.exists(storageDir.resolve("track_" + TOKEN + ".gpx")));
    }

    @Test
    public void periodicFlushWritesNumberedSegments() {
        SessionEngine engine = engine();
        engine.apply(SessionEvent.start(T0));
        engine.apply(fix(48.0, 11.0, 5f, T0 + 1_000L));
        engine.apply(SessionEvent.tick(T0 + 10_000L));
        engine.apply(fix(48.001, 11.0, 5f, T0 + 11_000L));
        engine.apply(SessionEvent.tick(T0 + 20_000L));

        Path increments = storageDir.resolve("increments");
        Assert.assertTrue(Files.exists(increments.resolve(TOKEN + "_0000.inc")));
        Assert.assertTrue(Files.exists(increments.resolve(TOKEN + "_0001.inc")));
        Assert.assertEquals(0, engine.bufferedPointCount());
    }

    @Test
    public void failedFlushKeepsPointsForTheNextAttempt() {
        FlakyIncrementLog log = new FlakyIncrementLog(storageDir);
        SessionEngine engine = new SessionEngine(config, log);
        engine.apply(SessionEvent.start(T0));
        engine.apply(fix(48.0, 11.0, 5f, T0 + 1_000L));
        engine.apply(fix(48.001, 11.0, 5f, T0 + 2_000L));

        SessionEffect failure = only(engine.apply(SessionEvent.tick(T0 + 10_000L)), SessionEffect.Type.FLUSH_FAILED);
        Assert.assertEquals(2, failure.getCount());
        Assert.assertEquals(2, engine.bufferedPointCount());

        log.failing = false;
        List<SessionEffect> retried = engine.apply(SessionEvent.tick(T0 + 20_000L));
        Assert.assertFalse(types(retried).contains(SessionEffect.Type.FLUSH_FAILED));
        Assert.assertEquals(0, engine.bufferedPointCount());
        Assert.assertEquals(Arrays.asList(0), log.writtenSequences);
    }

    @Test
    public void unflushablePointsStillReachTheTrack() throws IOException {
        FlakyIncrementLog log = new FlakyIncrementLog(storageDir);
        SessionEngine engine = new SessionEngine(config, log);
        engine.apply(SessionEvent.start(T0));
        engine.apply(fix(48.0, 11.0, 5f, T0 + 1_000L));
        engine.apply(fix(48.001, 11.0, 5f, T0 + 2_000L));

        List<SessionEffect> stopped = engine.apply(SessionEvent.stop(T0 + 3_000L));
        Assert.assertEquals(Arrays.asList(SessionEffect.Type.FLUSH_FAILED, SessionEffect.Type.SESSION_FINALIZED),
                types(stopped));
        Path track = stopped.get(1).getTrackFile();
        Assert.assertNotNull(track);
        Assert.assertEquals(2, new GpxReader().read(track).size());
    }

    @Test
    public void failedMergeIsRetriedOnTicksUntilTheTrackIsWritten() throws IOException {
        FailingGpxWriter writer = new FailingGpxWriter();
        FlakyIncrementLog log = new FlakyIncrementLog(storageDir, writer);
        SessionEngine engine = new SessionEngine(config, log);
        engine.apply(SessionEvent.start(T0));
        engine.apply(fix(48.0, 11.0, 5f, T0 + 1_000L));
        engine.apply(fix(48.001, 11.0, 5f, T0 + 2_000L));

        List<SessionEffect> stopped = engine.apply(SessionEvent.stop(T0 + 3_000L));
        Assert.assertEquals(Arrays.asList(SessionEffect.Type.FLUSH_FAILED), types(stopped));
        Assert.assertEquals(SessionState.IDLE, engine.state());
        Assert.assertEquals(1, engine.unfinalizedSessionCount());
        Assert.assertFalse(log.hasTrack(TOKEN));

        List<SessionEffect> stillFailing = engine.apply(SessionEvent.tick(T0 + 4_000L));
        Assert.assertFalse(types(stillFailing).contains(SessionEffect.Type.SESSION_FINALIZED));
        Assert.assertEquals(1, engine.unfinalizedSessionCount());

        log.failing = false;
        writer.failing = false;
        SessionEffect finalized = only(engine.apply(SessionEvent.tick(T0 + 5_000L)), SessionEffect.Type.SESSION_FINALIZED);
        Assert.assertEquals(TOKEN, finalized.getToken());
        Assert.assertEquals(2, new GpxReader().read(finalized.getTrackFile()).size());
        Assert.assertEquals(0, engine.unfinalizedSessionCount());
        Assert.assertFalse(log.hasSegments(TOKEN));

        Assert.assertTrue(engine.apply(SessionEvent.tick(T0 + 6_000L)).isEmpty());
    }

    @Test
    public void pendingFinalizationDoesNotBlockTheNextSession() throws IOException {
        FailingGpxWriter writer = new FailingGpxWriter();
        SessionEngine engine = new SessionEngine(config, new IncrementLog(storageDir, writer));
        engine.apply(SessionEvent.start(T0));
        engine.apply(fix(48.0, 11.0, 5f, T0 + 1_000L));
        Assert.assertTrue(engine.apply(SessionEvent.stop(T0 + 2_000L)).isEmpty());
        Assert.assertTrue(Files.exists(storageDir.resolve("increments").resolve(TOKEN + "_0000.inc")));

        List<SessionEffect> next = engine.apply(SessionEvent.start(T0 + 3_000L));
        Assert.assertEquals("2024-05-01_08-30-03", only(next, SessionEffect.Type.SESSION_STARTED).getToken());

        writer.failing = false;
        SessionEffect finalized = only(engine.apply(SessionEvent.tick(T0 + 4_000L)), SessionEffect.Type.SESSION_FINALIZED);
        Assert.assertEquals(TOKEN, finalized.getToken());
        Assert.assertEquals(1, finalized.getSummary().getPointCount());
        Assert.assertEquals(SessionState.RECORDING, engine.state());
        Assert.assertEquals("2024-05-01_08-30-03", engine.currentToken().get());
    }

    @Test
    public void recoveryIsRetriedAfterTheStoreFailsToList() throws IOException {
        IncrementLog previousRun = new IncrementLog(storageDir);
        previousRun.writeSegment("2024-05-01_07-00-00", 0, Arrays.asList(new TrackPoint(48.0, 11.0, 500.0, 10f, T0 - 60_000L)));

        UnlistableIncrementLog log = new UnlistableIncrementLog(storageDir);
        SessionEngine engine = new SessionEngine(config, log);
        Assert.assertEquals(Arrays.asList(SessionEffect.Type.SESSION_STARTED), types(engine.apply(SessionEvent.start(T0))));
        Assert.assertFalse(log.hasTrack("2024-05-01_07-00-00"));

        engine.apply(fix(48.0, 11.0, 5f, T0 + 1_000L));
        // the periodic flush puts the live session on disk while listing still fails
        engine.apply(SessionEvent.tick(T0 + 10_000L));
        Assert.assertFalse(log.hasTrack("2024-05-01_07-00-00"));

        log.listingFails = false;
        List<SessionEffect> effects = engine.apply(SessionEvent.tick(T0 + 10_500L));
        SessionEffect recovered = only(effects, SessionEffect.Type.SESSION_FINALIZED);
        Assert.assertEquals("2024-05-01_07-00-00", recovered.getToken());
        Assert.assertEquals(1, only(effects, SessionEffect.Type.SESSIONS_RECOVERED).getCount());
        Assert.assertTrue(log.hasTrack("2024-05-01_07-00-00"));
        Assert.assertTrue(engine.recoverOrphans(T0 + 11_000L).isEmpty());

        Assert.assertEquals(SessionState.RECORDING, engine.state());
        Assert.assertTrue(log.hasSegments(TOKEN));
        Assert.assertFalse(log.hasTrack(TOKEN));
    }

    @Test
    public void orphansAreRecoveredBeforeTheFirstEvent() throws IOException {
        IncrementLog previousRun = new IncrementLog(storageDir);
        List<TrackPoint> points = Arrays.asList(
                new TrackPoint(48.0, 11.0, 500.0, 10f, T0 - 60_000L),
                new TrackPoint(48.001, 11.0, 500.0, 10f, T0 - 59_000L));
        previousRun.writeSegment("2024-05-01_07-00-00", 0, points);
        previousRun.writeSegment("2024-05-01_07-00-00", 1, points);
        previousRun.writeSegment("2024-05-01_08-00-00", 0, points);

        SessionEngine engine = engine();
        List<SessionEffect> effects = engine.apply(SessionEvent.start(T0));

        Assert.assertEquals(Arrays.asList(
                SessionEffect.Type.SESSION_FINALIZED,
                SessionEffect.Type.SESSION_FINALIZED,
                SessionEffect.Type.SESSIONS_RECOVERED,
                SessionEffect.Type.SESSION_STARTED), types(effects));
        Assert.assertEquals(2, effects.get(2).getCount());
        Assert.assertEquals(4, effects.get(0).getSummary().getPointCount());
        Assert.assertTrue(Files.exists(storageDir.resolve("track_2024-05-01_07-00-00.gpx")));
        Assert.assertTrue(Files.exists(storageDir.resolve("track_2024-05-01_08-00-00.gpx")));
        Assert.assertTrue(previousRun.listSegments().isEmpty());

        Assert.assertTrue(engine.recoverOrphans(T0 + 1_000L).isEmpty());
    }

    @Test
    public void leftoversOfFinalizedSessionsAreDiscarded() throws IOException {
        IncrementLog previousRun = new IncrementLog(storageDir);
        String token = "2024-05-01_07-00-00";
        previousRun.writeSegment(token, 0, Arrays.asList(new TrackPoint(48.0, 11.0, 500.0, 10f, T0)));
        previousRun.mergeToFinalTrack(token, previousRun.segmentFiles(token));

        List<SessionEffect> effects = engine().recoverOrphans(T0);

        Assert.assertTrue(effects.isEmpty());
        Assert.assertFalse(previousRun.hasSegments(token));
        Assert.assertTrue(previousRun.hasTrack(token));
    }

    @Test
    public void statisticsReportDistanceAndGpsQuality() {
        SessionEngine engine = engine();
        engine.apply(SessionEvent.start(T0));
        engine.apply(fix(48.0, 11.0, 4f, T0 + 1_000L));
        engine.apply(fix(48.001, 11.0, 6f, T0 + 2_000L));

        SessionStatistics stats = only(engine.apply(SessionEvent.tick(T0 + 2_000L)), SessionEffect.Type.STATISTICS)
                .getStatistics();
        Assert.assertEquals(111.19, stats.getDistanceMeters(), 0.01);
        Assert.assertEquals(2_000L, stats.getDurationMs());
        Assert.assertTrue(stats.isRecording());
        Assert.assertEquals("track_" + TOKEN + ".gpx", stats.getFileName());
        Assert.assertEquals(6f, stats.getCurrentAccuracy(), 0f);
        Assert.assertEquals(5f, stats.getAvgAccuracy(), 1e-6f);
        Assert.assertEquals(1f, stats.getCurrentUpdateRateHz(), 1e-6f);
        Assert.assertEquals(1f, stats.getAvgUpdateRateHz(), 1e-6f);

        Assert.assertTrue("statistics wait for the next interval",
                engine.apply(SessionEvent.tick(T0 + 2_500L)).isEmpty());
    }

    @Test
    public void statisticsWhilePausedShowCountdown() {
        SessionEngine engine = engine();
        engine.apply(SessionEvent.start(T0));
        engine.apply(SessionEvent.pause(T0 + 3_000L));

        SessionStatistics stats = only(engine.apply(SessionEvent.tick(T0 + 5_000L)), SessionEffect.Type.STATISTICS)
                .getStatistics();
        Assert.assertFalse(stats.isRecording());
        Assert.assertEquals(58_000L, stats.getPauseTimeoutRemainingMs());
        Assert.assertEquals(2_000L, stats.getPausedForMs());
    }

    @Test
    public void durationAfterResumeCountsFromOriginalStart() {
        SessionEngine engine = engine();
        engine.apply(SessionEvent.start(T0));
        engine.apply(SessionEvent.pause(T0 + 5_000L));
        engine.apply(SessionEvent.start(T0 + 10_000L));

        SessionStatistics stats = only(engine.apply(SessionEvent.tick(T0 + 12_000L)), SessionEffect.Type.STATISTICS)
                .getStatistics();
        Assert.assertEquals(12_000L, stats.getDurationMs());
        Assert.assertTrue(stats.isRecording());
    }

    @Test
    public void inaccurateFixesAreDropped() {
        SessionEngine engine = engine();
        engine.apply(SessionEvent.start(T0));
        engine.apply(fix(48.0, 11.0, 50f, T0 + 1_000L));
        Assert.assertEquals(0, engine.bufferedPointCount());
        engine.apply(fix(48.0, 11.0, null, T0 + 2_000L));
        Assert.assertEquals(1, engine.bufferedPointCount());
    }

    @Test
    public void accuracyFilterCanBeDisabled() {
        config.setMaxAccuracyMeters(0f);
        SessionEngine engine = engine();
        engine.apply(SessionEvent.start(T0));
        engine.apply(fix(48.0, 11.0, 500f, T0 + 1_000L));
        Assert.assertEquals(1, engine.bufferedPointCount());
    }

    @Test
    public void closeFixesAreDroppedByMinimumDistance() {
        config.setMinDistanceMeters(50f);
        SessionEngine engine = engine();
        engine.apply(SessionEvent.start(T0));
        engine.apply(fix(48.0, 11.0, 5f, T0 + 1_000L));
        engine.apply(fix(48.0001, 11.0, 5f, T0 + 2_000L));
        engine.apply(fix(48.001, 11.0, 5f, T0 + 3_000L));
        Assert.assertEquals(2, engine.bufferedPointCount());
        Assert.assertEquals(111.19, engine.distanceMeters(), 0.01);
    }

    @Test
    public void tokenCollisionGetsSuffix() throws IOException {
        Files.write(storageDir.resolve("track_" + TOKEN + ".gpx"), new byte[0]);
        SessionEngine engine = engine();
        List<SessionEffect> started = engine.apply(SessionEvent.start(T0));
        Assert.assertEquals(TOKEN + "-1", started.get(0).getToken());
    }

    @Test
    public void pointsCarryFusedSensorValues() throws IOException {
        SessionEngine engine = engine();
        engine.apply(SessionEvent.start(T0));
        long ts = 0L;
        engine.apply(SessionEvent.inertialSample(T0, InertialSample.rotationMatrix(ts, roll(0))));
        for (int i = 0; i < 100; i++) {
            ts += 20_000_000L;
            engine.apply(SessionEvent.inertialSample(T0, InertialSample.rotationMatrix(ts, roll(30))));
        }
        engine.apply(SessionEvent.inertialSample(T0, InertialSample.linearAcceleration(ts, 0f, 1.5f, 0f)));
        engine.apply(fix(48.0, 11.0, 5f, T0 + 1_000L));

        SessionEffect finalized = only(engine.apply(SessionEvent.stop(T0 + 2_000L)), SessionEffect.Type.SESSION_FINALIZED);
        Assert.assertTrue(finalized.getSummary().isLeanFromSensor());
        Assert.assertTrue(finalized.getSummary().isAccelFromSensor());

        TrackPoint point = new GpxReader().read(finalized.getTrackFile()).get(0);
        Assert.assertEquals(30f, point.getLeanAngleDeg(), 0.1f);
        // forward axis tilts with the device, so only the cos(30°) share of Y acceleration is horizontal
        Assert.assertEquals((float) (1.5 * Math.cos(Math.toRadians(30))), point.getLongitudinalAccelMps2(), 2e-3f);
    }

    @Test
    public void missingSensorRecordsPlainPoints() {
        SessionEngine engine = engine();
        engine.setInertialAvailability(true, false);
        engine.apply(SessionEvent.start(T0));
        engine.apply(SessionEvent.inertialSample(T0, InertialSample.rotationMatrix(0L, roll(0))));
        engine.apply(fix(48.0, 11.0, 5f, T0 + 1_000L));

        Assert.assertFalse(engine.sensorFusion().isActive());
        SessionEffect finalized = only(engine.apply(SessionEvent.stop(T0 + 2_000L)), SessionEffect.Type.SESSION_FINALIZED);
        Assert.assertFalse(finalized.getSummary().isLeanFromSensor());
    }

    @Test(expected = IllegalArgumentException.class)
    public void fixEventRequiresFix() {
        SessionEvent.locationFix(T0, null);
    }

    private static final class FlakyIncrementLog extends IncrementLog {
        private boolean failing = true;
        private final List<Integer> writtenSequences = new ArrayList<>();

        private FlakyIncrementLog(Path storageDir) {
            super(storageDir);
        }

        private FlakyIncrementLog(Path storageDir, GpxWriter writer) {
            super(storageDir, writer);
        }

        @Override
        public boolean writeSegment(String token, int sequenceNumber, List<TrackPoint> points) {
            if (failing) {
                return false;
            }
            writtenSequences.add(sequenceNumber);
            return super.writeSegment(token, sequenceNumber, points);
        }
    }

    private static final class FailingGpxWriter extends GpxWriter {
        private boolean failing = true;

        @Override
        public void write(Path file, List<TrackPoint> points) throws IOException {
            if (failing) {
                throw new IOException("disk full");
            }
            super.write(file, points);
        }
    }

    private static final class UnlistableIncrementLog extends IncrementLog {
        private boolean listingFails = true;

        private UnlistableIncrementLog(Path storageDir) {
            super(storageDir);
        }

        @Override
        public Map<String, List<Path>> listSegments() throws IOException {
            if (listingFails) {
                throw new IOException("directory unavailable");
            }
            return super.listSegments();
        }
    }
}
