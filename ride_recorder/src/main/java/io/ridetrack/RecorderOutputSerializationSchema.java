package io.ridetrack;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.flink.api.common.serialization.SerializationSchema;

public class RecorderOutputSerializationSchema implements SerializationSchema<RecorderOutput> {

    private static final ObjectMapper mapper = new ObjectMapper();

    @Override
    public byte[] serialize(RecorderOutput record) {
        try {
            return mapper.writeValueAsBytes(record);
        } catch (Exception e) {
            throw new RuntimeException("Failed to serialize RecorderOutput to JSON", e);
        }
    }
}
