package io.ridetrack;

import org.apache.flink.api.common.eventtime.WatermarkStrategy;
import org.apache.flink.connector.kafka.sink.KafkaRecordSerializationSchema;
import org.apache.flink.connector.kafka.sink.KafkaSink;
import org.apache.flink.connector.kafka.source.KafkaSource;
import org.apache.flink.connector.kafka.source.enumerator.initializer.OffsetsInitializer;
import org.apache.flink.streaming.api.datastream.DataStream;
import org.apache.flink.streaming.api.environment.StreamExecutionEnvironment;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class RideRecorderJob {
    private static final Logger LOG = LoggerFactory.getLogger(RideRecorderJob.class);

    public static void main(String[] args) throws Exception {
        final StreamExecutionEnvironment env = StreamExecutionEnvironment.getExecutionEnvironment();

        RecorderConfig config = RecorderConfig.fromEnvironment();
        if (config.getBootstrapServers() == null) {
            System.out.println("BOOTSTRAP_SERVERS environment variable is not set.");
            return;
        }
        LOG.info("Recording telemetry from {} into {} (trigger mode {}, storage {})",
                config.getInputTopic(), config.getOutputTopic(), config.getTriggerMode(), config.getStorageDir());

        KafkaSource<TelemetryRecord> telemetrySource = KafkaSource.<TelemetryRecord>builder()
                .setBootstrapServers(config.getBootstrapServers())
                .setTopics(config.getInputTopic())
                .setGroupId(config.getGroupId())
                .setValueOnlyDeserializer(new TelemetryRecordDeserializationSchema())
                .setStartingOffsets(OffsetsInitializer.latest())
                .build();

        DataStream<RecorderOutput> outputStream = env
                .fromSource(telemetrySource, WatermarkStrategy.noWatermarks(), "Telemetry Source")
                .filter(record -> record.getDeviceId() != null && !record.getDeviceId().isBlank())
                .keyBy(TelemetryRecord::getDeviceId)
                .process(new RecorderProcessFunction(config))
                .name("Ride Recorder");

        KafkaRecordSerializationSchema<RecorderOutput> serializer = KafkaRecordSerializationSchema.builder()
                .setTopic(config.getOutputTopic())
                .setValueSerializationSchema(new RecorderOutputSerializationSchema())
                .build();

        KafkaSink<RecorderOutput> kafkaSink = KafkaSink.<RecorderOutput>builder()
                .setBootstrapServers(config.getBootstrapServers())
                .setRecordSerializer(serializer)
                .build();

        outputStream.sinkTo(kafkaSink);

        env.execute("Ride Recorder Job");
    }
}
