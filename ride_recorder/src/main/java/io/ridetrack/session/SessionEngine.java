package io.ridetrack.session;

import io.ridetrack.RecorderConfig;
import io.ridetrack.analytics.GeoMath;
import io.ridetrack.analytics.MotionAnalytics;
import io.ridetrack.analytics.TrackSummary;
import io.ridetrack.fusion.SensorFusion;
import io.ridetrack.gpx.GpxReader;
import io.ridetrack.increment.IncrementLog;
import io.ridetrack.increment.OrphanSession;
import io.ridetrack.model.InertialSample;
import io.ridetrack.model.LocationFix;
import io.ridetrack.model.TrackPoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;

/**
 * Recording lifecycle of one device: {@code IDLE -> RECORDING -> PENDING_FINALIZE -> (RECORDING | IDLE)}.
 *
 * <p>All mutation happens in {@link #apply}, one event at a time. Timers are deadlines stored on the
 * session and checked on {@code TICK}. A session whose final merge fails is parked with its buffer
 * and retried on every tick until its track is written.
 */
public class SessionEngine {
    private static final Logger LOG = LoggerFactory.getLogger(SessionEngine.class);

    static final DateTimeFormatter TOKEN_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd_HH-mm-ss").withZone(ZoneOffset.UTC);

    private final RecorderConfig config;
    private final IncrementLog incrementLog;
    private final SensorFusion sensorFusion;
    private final GpxReader gpxReader;

    private boolean orientationAvailable;
    private boolean accelerationAvailable;
    private boolean recoveryAttempted;
    private boolean recovered;
    private Session session;
    private final List<Session> unfinalized = new ArrayList<>();

    public SessionEngine(RecorderConfig config, IncrementLog incrementLog) {
        this(config, incrementLog, new SensorFusion(), new GpxReader());
    }

    public SessionEngine(RecorderConfig config, IncrementLog incrementLog, SensorFusion sensorFusion,
                         GpxReader gpxReader) {
        this.config = config;
        this.incrementLog = incrementLog;
        this.sensorFusion = sensorFusion;
        this.gpxReader = gpxReader;
        this.orientationAvailable = config.isSensorRecording();
        this.accelerationAvailable = config.isSensorRecording();
    }

    // Takes effect on the next start or resume
    public void setInertialAvailability(boolean orientation, boolean acceleration) {
        this.orientationAvailable = config.isSensorRecording() && orientation;
        this.accelerationAvailable = config.isSensorRecording() && acceleration;
    }

    public SessionState state() {
        return session == null ? SessionState.IDLE : session.state;
    }

    public boolean isSessionActive() {
        return session != null;
    }

    public Optional<String> currentToken() {
        return session == null ? Optional.empty() : Optional.of(session.token);
    }

    public int bufferedPointCount() {
        return session == null ? 0 : session.buffer.size();
    }

    public double distanceMeters() {
        return session == null ? 0.0 : session.distanceMeters;
    }

    public SensorFusion sensorFusion() {
        return sensorFusion;
    }

    public int unfinalizedSessionCount() {
        return unfinalized.size();
    }

    /**
     * Finalizes every orphaned session found in the store. Once a pass completes later calls return
     * nothing; a pass that fails on I/O is repeated on the next tick.
     */
    public List<SessionEffect> recoverOrphans(long nowMs) {
        List<SessionEffect> effects = new ArrayList<>();
        if (recovered) {
            return effects;
        }
        recoveryAttempted = true;
        try {
            incrementLog.deleteStrayTemporaryFiles();
            for (String token : incrementLog.listFinalizedLeftovers()) {
                LOG.info("Removing leftover segments of already finalized session {}", token);
                incrementLog.deleteSegments(token);
            }

            int count = 0;
            for (OrphanSession orphan : incrementLog.listOrphanSessions()) {
                if (isLive(orphan.getToken())) {
                    continue;
                }
                Optional<Path> track = incrementLog.mergeToFinalTrack(orphan.getToken(), orphan.getSegments());
                if (track.isPresent()) {
                    incrementLog.deleteSegments(orphan.getToken());
                    effects.add(SessionEffect.finalized(orphan.getToken(), nowMs, track.get(), summarize(track.get())));
                    count++;
                } else {
                    LOG.warn("Orphaned session {} has no readable points, keeping its segments", orphan.getToken());
                }
            }
            if (count > 0) {
                LOG.info("Recovered {} interrupted sessions", count);
                effects.add(SessionEffect.recovered(nowMs, count));
            }
            recovered = true;
        } catch (IOException e) {
            LOG.warn("Recovery of orphaned sessions failed, retrying on the next tick: {}", e.toString());
        }
        return effects;
    }

    public List<SessionEffect> apply(SessionEvent event) {
        long at = event.getOccurredAtMs();
        List<SessionEffect> effects = new ArrayList<>();
        if (!recovered && (!recoveryAttempted || event.getType() == SessionEvent.Type.TICK)) {
            effects.addAll(recoverOrphans(at));
        }
        switch (event.getType()) {
            case START:
                onStart(at, effects);
                break;
            case PAUSE:
                onPause(at, effects);
                break;
            case STOP:
                onStop(at, effects);
                break;
            case LOCATION_FIX:
                onLocationFix(at, event.getFix());
                break;
            case INERTIAL_SAMPLE:
                onInertialSample(event.getSample());
                break;
            case TICK:
                onTick(at, effects);
                break;
            default:
                throw new IllegalArgumentException("Unhandled event type " + event.getType());
        }
        return effects;
    }

    private void onStart(long at, List<SessionEffect> effects) {
        if (session == null) {
            session = new Session(allocateToken(at), at);
            session.nextFlushMs = at + config.getFlushIntervalMs();
            session.nextStatsMs = at + config.getStatsIntervalMs();
            sensorFusion.start(orientationAvailable, accelerationAvailable);
            LOG.info("Recording started, session {}", session.token);
            effects.add(SessionEffect.lifecycle(SessionEffect.Type.SESSION_STARTED, session.token, at));
        } else if (session.state == SessionState.PENDING_FINALIZE) {
            session.state = SessionState.RECORDING;
            session.pausedAtMs = Session.UNSCHEDULED;
            session.finalizeDeadlineMs = Session.UNSCHEDULED;
            session.nextFlushMs = at + config.getFlushIntervalMs();
            sensorFusion.start(orientationAvailable, accelerationAvailable);
            LOG.info("Recording resumed, session {}", session.token);
            effects.add(SessionEffect.lifecycle(SessionEffect.Type.SESSION_RESUMED, session.token, at));
        } else {
            LOG.debug("Start ignored, session {} is already recording", session.token);
        }
    }

    private void onPause(long at, List<SessionEffect> effects) {
        if (session == null || session.state != SessionState.RECORDING) {
            LOG.debug("Pause ignored in state {}", state());
            return;
        }
        flush(session, at, effects);
        sensorFusion.stop();
        session.gps.breakInterval();
        session.state = SessionState.PENDING_FINALIZE;
        session.pausedAtMs = at;
        session.finalizeDeadlineMs = at + config.getFinalizeTimeoutMs();
        session.nextFlushMs = Session.UNSCHEDULED;
        LOG.info("Recording paused, session {} finalizes in {} ms unless resumed",
                session.token, config.getFinalizeTimeoutMs());
        effects.add(SessionEffect.lifecycle(SessionEffect.Type.SESSION_PAUSED, session.token, at));
    }

    private void onStop(long at, List<SessionEffect> effects) {
        if (session == null) {
            LOG.debug("Stop ignored, no session");
            return;
        }
        finalizeSession(at, effects);
    }

    private void onLocationFix(long at, LocationFix fix) {
        if (session == null || session.state != SessionState.RECORDING) {
            return;
        }
        long fixTimeMs = fix.getTimeMs() > 0 ? fix.getTimeMs() : at;
        session.gps.onFix(fix.getAccuracyMeters(), fixTimeMs);

        float maxAccuracy = config.getMaxAccuracyMeters();
        if (maxAccuracy > 0 && fix.hasAccuracy() && fix.getAccuracyMeters() > maxAccuracy) {
            LOG.debug("Dropping fix with accuracy {} m", fix.getAccuracyMeters());
            return;
        }

        TrackPoint point = new TrackPoint(
                fix.getLatitude(),
                fix.getLongitude(),
                fix.getAltitude() != null ? fix.getAltitude() : 0.0,
                fix.getSpeedMps() != null ? fix.getSpeedMps() : 0f,
                fixTimeMs,
                sensorFusion.leanAngleDeg(),
                sensorFusion.longitudinalAccelMps2());

        double step = session.lastPoint == null ? 0.0 : GeoMath.distanceMeters(session.lastPoint, point);
        if (session.lastPoint != null && step < config.getMinDistanceMeters()) {
            LOG.debug("Dropping fix {} m from the previous point", step);
            return;
        }
        session.buffer.add(point);
        session.distanceMeters += step;
        session.lastPoint = point;
    }

    private void onInertialSample(InertialSample sample) {
        if (session == null || session.state != SessionState.RECORDING) {
            return;
        }
        float[] values = sample.getValues();
        switch (sample.getKind()) {
            case ROTATION_MATRIX:
                sensorFusion.onOrientation(sample.getTimestampNs(), values);
                break;
            case ROTATION_VECTOR:
                sensorFusion.onRotationVector(sample.getTimestampNs(), values);
                break;
            case LINEAR_ACCELERATION:
                sensorFusion.onAcceleration(sample.getTimestampNs(), values[0], values[1], values[2]);
                break;
            default:
                throw new IllegalArgumentException("Unhandled sample kind " + sample.getKind());
        }
    }

    private void onTick(long at, List<SessionEffect> effects) {
        retryUnfinalized(at, effects);
        if (session == null) {
            return;
        }
        if (session.state == SessionState.RECORDING && at >= session.nextFlushMs) {
            flush(session, at, effects);
            session.nextFlushMs = at + config.getFlushIntervalMs();
        }
        if (session.state == SessionState.PENDING_FINALIZE && at >= session.finalizeDeadlineMs) {
            LOG.info("Finalize timeout elapsed for session {}", session.token);
            finalizeSession(at, effects);
            return;
        }
        if (at >= session.nextStatsMs) {
            effects.add(SessionEffect.statistics(session.token, at, statistics(at)));
            session.nextStatsMs = at + config.getStatsIntervalMs();
        }
    }

    // On failure the buffer is kept for the next attempt
    private boolean flush(Session target, long at, List<SessionEffect> effects) {
        if (target.buffer.isEmpty()) {
            return true;
        }
        int size = target.buffer.size();
        if (incrementLog.writeSegment(target.token, target.sequenceNumber, new ArrayList<>(target.buffer))) {
            target.buffer.clear();
            target.sequenceNumber++;
            target.consecutiveFlushFailures = 0;
            return true;
        }
        target.consecutiveFlushFailures++;
        LOG.warn("Flush of {} points failed for session {} ({} in a row), keeping them in memory",
                size, target.token, target.consecutiveFlushFailures);
        effects.add(SessionEffect.flushFailed(target.token, at, size));
        return false;
    }

    private void finalizeSession(long at, List<SessionEffect> effects) {
        Session finishing = session;
        sensorFusion.stop();
        session = null;
        if (!writeTrack(finishing, at, effects)) {
            unfinalized.add(finishing);
            LOG.warn("Session {} could not be finalized, retrying with {} points held in memory",
                    finishing.token, finishing.buffer.size());
        }
    }

    private void retryUnfinalized(long at, List<SessionEffect> effects) {
        Iterator<Session> pending = unfinalized.iterator();
        while (pending.hasNext()) {
            Session finishing = pending.next();
            if (writeTrack(finishing, at, effects)) {
                pending.remove();
            }
        }
    }

    // false if the merge failed and must be retried
    private boolean writeTrack(Session finishing, long at, List<SessionEffect> effects) {
        List<TrackPoint> trailing = new ArrayList<>();
        if (!flush(finishing, at, effects)) {
            trailing.addAll(finishing.buffer);
        }

        Path trackFile = null;
        TrackSummary summary = null;
        try {
            List<Path> segments = incrementLog.segmentFiles(finishing.token);
            Optional<Path> track = incrementLog.mergeToFinalTrack(finishing.token, segments, trailing);
            if (track.isPresent()) {
                trackFile = track.get();
                LOG.info("Session {} finalized to {}", finishing.token, trackFile.getFileName());
            } else if (segments.isEmpty()) {
                LOG.info("Session {} recorded no points, nothing to finalize", finishing.token);
            } else {
                LOG.warn("Session {} has no readable points, keeping its segments for recovery", finishing.token);
            }
        } catch (IOException e) {
            LOG.warn("Merging session {} failed: {}", finishing.token, e.toString());
            return false;
        }
        finishing.buffer.clear();

        if (trackFile != null) {
            try {
                incrementLog.deleteSegments(finishing.token);
            } catch (IOException e) {
                LOG.warn("Segments of session {} stay until the next recovery: {}", finishing.token, e.toString());
            }
            summary = summarize(trackFile);
        }
        effects.add(SessionEffect.finalized(finishing.token, at, trackFile, summary));
        return true;
    }

    private TrackSummary summarize(Path trackFile) {
        try {
            return MotionAnalytics.summarize(gpxReader.read(trackFile));
        } catch (IOException e) {
            LOG.warn("Could not read back {} for its summary: {}", trackFile.getFileName(), e.toString());
            return null;
        }
    }

    private SessionStatistics statistics(long at) {
        SessionStatistics stats = new SessionStatistics();
        stats.setDistanceMeters(session.distanceMeters);
        stats.setDurationMs(Math.max(0L, at - session.startMs));
        stats.setRecording(session.state == SessionState.RECORDING);
        stats.setFileName(IncrementLog.trackFileName(session.token));
        if (session.state == SessionState.PENDING_FINALIZE) {
            stats.setPauseTimeoutRemainingMs(Math.max(0L, session.finalizeDeadlineMs - at));
            stats.setPausedForMs(Math.max(0L, at - session.pausedAtMs));
        }
        stats.setCurrentAccuracy(session.gps.currentAccuracy());
        stats.setAvgAccuracy(session.gps.avgAccuracy());
        stats.setCurrentUpdateRateHz(session.gps.currentUpdateRateHz());
        stats.setAvgUpdateRateHz(session.gps.avgUpdateRateHz());
        return stats;
    }

    private String allocateToken(long at) {
        String base = TOKEN_FORMAT.format(Instant.ofEpochMilli(at));
        String candidate = base;
        int suffix = 1;
        try {
            while (isLive(candidate) || incrementLog.hasTrack(candidate) || incrementLog.hasSegments(candidate)) {
                candidate = base + "-" + suffix++;
            }
        } catch (IOException e) {
            LOG.warn("Could not check token {} for collisions: {}", candidate, e.toString());
        }
        return candidate;
    }

    private boolean isLive(String token) {
        if (session != null && session.token.equals(token)) {
            return true;
        }
        for (Session finishing : unfinalized) {
            if (finishing.token.equals(token)) {
                return true;
            }
        }
        return false;
    }
}
