package io.ridetrack;

import io.ridetrack.increment.IncrementLog;
import io.ridetrack.model.InertialSample;
import io.ridetrack.model.LocationFix;
import io.ridetrack.session.SessionEffect;
import io.ridetrack.session.SessionEngine;
import io.ridetrack.session.SessionEvent;
import io.ridetrack.trigger.TriggerSignal;
import io.ridetrack.trigger.TriggerSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/**
 * Recorder of a single device: translates telemetry records into trigger signals and session
 * events, and session effects into output records.
 *
 * <p>Timers fire in processing time but the engine runs on the device's clock. A timer is
 * translated by advancing the newest {@code occurred_at_ms} by the processing time that passed
 * since that record arrived, so ingest lag does not read as stillness.
 */
public class DeviceRecorder {
    private static final Logger LOG = LoggerFactory.getLogger(DeviceRecorder.class);

    private static final long NO_EVENT = Long.MIN_VALUE;

    private final String deviceId;
    private final SessionEngine engine;
    private final TriggerSource triggerSource;

    private long lastEventMs = NO_EVENT;
    private long lastEventReceivedMs;

    public DeviceRecorder(String deviceId, SessionEngine engine, TriggerSource triggerSource) {
        this.deviceId = deviceId;
        this.engine = engine;
        this.triggerSource = triggerSource;
    }

    public static DeviceRecorder create(String deviceId, RecorderConfig config) {
        Path storageDir = Paths.get(config.getStorageDir(), directoryName(deviceId));
        SessionEngine engine = new SessionEngine(config, new IncrementLog(storageDir));
        return new DeviceRecorder(deviceId, engine, TriggerSource.forConfig(config));
    }

    static String directoryName(String deviceId) {
        return deviceId.replaceAll("[^A-Za-z0-9._-]", "_");
    }

    public String getDeviceId() {
        return deviceId;
    }

    public SessionEngine getEngine() {
        return engine;
    }

    public boolean isSessionActive() {
        return engine.isSessionActive();
    }

    public List<RecorderOutput> recover(long nowMs) {
        return toOutputs(engine.recoverOrphans(nowMs));
    }

    public List<RecorderOutput> handle(TelemetryRecord record, long receivedAtMs) {
        List<SessionEffect> effects = new ArrayList<>();
        long at = record.getOccurredAtMs();
        if (lastEventMs == NO_EVENT || at >= lastEventMs) {
            lastEventMs = at;
            lastEventReceivedMs = receivedAtMs;
        }
        String type = record.getEventType() == null ? "" : record.getEventType();
        switch (type) {
            case TelemetryRecord.LOCATION_FIX:
                handleLocation(record, effects);
                break;
            case TelemetryRecord.ORIENTATION:
                handleOrientation(record, effects);
                break;
            case TelemetryRecord.LINEAR_ACCELERATION:
                handleAcceleration(record, effects);
                break;
            case TelemetryRecord.POWER_STATE:
                if (record.getPower() == null) {
                    LOG.warn("Dropping power record without payload from {}", deviceId);
                } else {
                    signal(triggerSource.onPowerState(record.getPower().isConnected(), at), at, effects);
                }
                break;
            case TelemetryRecord.USER_START:
                triggerSource.onUserCommand(true, at);
                effects.addAll(engine.apply(SessionEvent.start(at)));
                break;
            case TelemetryRecord.USER_STOP:
                triggerSource.onUserCommand(false, at);
                effects.addAll(engine.apply(SessionEvent.stop(at)));
                break;
            case TelemetryRecord.CAPABILITIES:
                TelemetryRecord.Capabilities capabilities = record.getCapabilities();
                if (capabilities == null) {
                    LOG.warn("Dropping capabilities record without payload from {}", deviceId);
                } else {
                    LOG.info("Device {} reports orientation={} linear_acceleration={}", deviceId,
                            capabilities.isOrientation(), capabilities.isLinearAcceleration());
                    engine.setInertialAvailability(capabilities.isOrientation(), capabilities.isLinearAcceleration());
                }
                break;
            default:
                LOG.warn("Dropping record of unknown type '{}' from {}", type, deviceId);
                break;
        }
        return toOutputs(effects);
    }

    public List<RecorderOutput> onTimer(long processingTimeMs) {
        long nowMs = deviceTimeAt(processingTimeMs);
        List<SessionEffect> effects = new ArrayList<>();
        signal(triggerSource.onTick(nowMs), nowMs, effects);
        effects.addAll(engine.apply(SessionEvent.tick(nowMs)));
        return toOutputs(effects);
    }

    long deviceTimeAt(long processingTimeMs) {
        if (lastEventMs == NO_EVENT) {
            return processingTimeMs;
        }
        return lastEventMs + Math.max(0L, processingTimeMs - lastEventReceivedMs);
    }

    private void handleLocation(TelemetryRecord record, List<SessionEffect> effects) {
        TelemetryRecord.Location location = record.getLocation();
        if (location == null) {
            LOG.warn("Dropping location record without payload from {}", deviceId);
            return;
        }
        LocationFix fix = new LocationFix(
                location.getLatitude(),
                location.getLongitude(),
                location.getSpeed(),
                location.getAltitude(),
                location.getAccuracy(),
                location.getTimeMs() > 0 ? location.getTimeMs() : record.getOccurredAtMs());
        effects.addAll(engine.apply(SessionEvent.locationFix(record.getOccurredAtMs(), fix)));
    }

    private void handleOrientation(TelemetryRecord record, List<SessionEffect> effects) {
        TelemetryRecord.Orientation orientation = record.getOrientation();
        if (orientation == null) {
            LOG.warn("Dropping orientation record without payload from {}", deviceId);
            return;
        }
        InertialSample sample;
        try {
            if (orientation.getRotationMatrix() != null) {
                sample = InertialSample.rotationMatrix(orientation.getTimestampNs(), orientation.getRotationMatrix());
            } else if (orientation.getRotationVector() != null) {
                sample = InertialSample.rotationVector(orientation.getTimestampNs(), orientation.getRotationVector());
            } else {
                LOG.warn("Dropping orientation record without matrix or vector from {}", deviceId);
                return;
            }
        } catch (IllegalArgumentException e) {
            LOG.warn("Dropping orientation record from {}: {}", deviceId, e.getMessage());
            return;
        }
        effects.addAll(engine.apply(SessionEvent.inertialSample(record.getOccurredAtMs(), sample)));
    }

    private void handleAcceleration(TelemetryRecord record, List<SessionEffect> effects) {
        TelemetryRecord.Acceleration acceleration = record.getAcceleration();
        if (acceleration == null) {
            LOG.warn("Dropping acceleration record without payload from {}", deviceId);
            return;
        }
        long at = record.getOccurredAtMs();
        float x = acceleration.getX();
        float y = acceleration.getY();
        float z = acceleration.getZ();
        signal(triggerSource.onLinearAcceleration(x, y, z, at), at, effects);
        InertialSample sample = InertialSample.linearAcceleration(acceleration.getTimestampNs(), x, y, z);
        effects.addAll(engine.apply(SessionEvent.inertialSample(at, sample)));
    }

    private void signal(TriggerSignal signal, long at, List<SessionEffect> effects) {
        switch (signal) {
            case START:
                effects.addAll(engine.apply(SessionEvent.start(at)));
                break;
            case PAUSE:
                effects.addAll(engine.apply(SessionEvent.pause(at)));
                break;
            default:
                break;
        }
    }

    private List<RecorderOutput> toOutputs(List<SessionEffect> effects) {
        List<RecorderOutput> outputs = new ArrayList<>(effects.size());
        for (SessionEffect effect : effects) {
            outputs.add(new RecorderOutput(deviceId, effect));
        }
        return outputs;
    }
}
