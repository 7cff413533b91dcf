package io.ridetrack.session;

import io.ridetrack.model.InertialSample;
import io.ridetrack.model.LocationFix;

/**
 * Input to {@link SessionEngine#apply}. Every event carries the time it happened at; the engine has
 * no other clock.
 */
public final class SessionEvent {

    public enum Type {
        START,
        PAUSE,
        STOP,
        LOCATION_FIX,
        INERTIAL_SAMPLE,
        TICK
    }

    private final Type type;
    private final long occurredAtMs;
    private final LocationFix fix;
    private final InertialSample sample;

    private SessionEvent(Type type, long occurredAtMs, LocationFix fix, InertialSample sample) {
        this.type = type;
        this.occurredAtMs = occurredAtMs;
        this.fix = fix;
        this.sample = sample;
    }

    public static SessionEvent start(long occurredAtMs) {
        return new SessionEvent(Type.START, occurredAtMs, null, null);
    }

    public static SessionEvent pause(long occurredAtMs) {
        return new SessionEvent(Type.PAUSE, occurredAtMs, null, null);
    }

    public static SessionEvent stop(long occurredAtMs) {
        return new SessionEvent(Type.STOP, occurredAtMs, null, null);
    }

    public static SessionEvent tick(long occurredAtMs) {
        return new SessionEvent(Type.TICK, occurredAtMs, null, null);
    }

    public static SessionEvent locationFix(long occurredAtMs, LocationFix fix) {
        if (fix == null) {
            throw new IllegalArgumentException("fix must not be null");
        }
        return new SessionEvent(Type.LOCATION_FIX, occurredAtMs, fix, null);
    }

    public static SessionEvent inertialSample(long occurredAtMs, InertialSample sample) {
        if (sample == null) {
            throw new IllegalArgumentException("sample must not be null");
        }
        return new SessionEvent(Type.INERTIAL_SAMPLE, occurredAtMs, null, sample);
    }

    public Type getType() { return type; }
    public long getOccurredAtMs() { return occurredAtMs; }
    public LocationFix getFix() { return fix; }
    public InertialSample getSample() { return sample; }

    public String toString() {
        return String.format(">> %s at %s", type, occurredAtMs);
    }
}
