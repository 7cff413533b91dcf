package io.ridetrack;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.flink.api.common.serialization.DeserializationSchema;
import org.apache.flink.api.common.typeinfo.TypeInformation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

public class TelemetryRecordDeserializationSchema implements DeserializationSchema<TelemetryRecord> {
    private static final Logger LOG = LoggerFactory.getLogger(TelemetryRecordDeserializationSchema.class);

    private static final ObjectMapper mapper = new ObjectMapper();

    /**
     * @return the parsed record, or null for malformed input, which Flink drops
     */
    @Override
    public TelemetryRecord deserialize(byte[] message) {
        if (message == null) {
            return null;
        }
        try {
            return mapper.readValue(message, TelemetryRecord.class);
        } catch (IOException e) {
            LOG.warn("Dropping malformed telemetry record: {}", new String(message, StandardCharsets.UTF_8), e);
            return null;
        }
    }

    @Override
    public boolean isEndOfStream(TelemetryRecord nextElement) {
        return false;
    }

    @Override
    public TypeInformation<TelemetryRecord> getProducedType() {
        return TypeInformation.of(TelemetryRecord.class);
    }
}
