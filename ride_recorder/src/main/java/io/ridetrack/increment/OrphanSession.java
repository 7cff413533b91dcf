package io.ridetrack.increment;

import java.nio.file.Path;
import java.util.Collections;
import java.util.List;

public final class OrphanSession {

    private final String token;
    private final List<Path> segments;

    public OrphanSession(String token, List<Path> segments) {
        this.token = token;
        this.segments = Collections.unmodifiableList(segments);
    }

    public String getToken() { return token; }
    public List<Path> getSegments() { return segments; }

    public String toString() {
        return String.format(">> token: %s, segments: %s", token, segments.size());
    }
}
