package io.ridetrack;

import org.apache.flink.api.common.state.ValueState;
import org.apache.flink.api.common.state.ValueStateDescriptor;
import org.apache.flink.api.common.typeinfo.BasicTypeInfo;
import org.apache.flink.configuration.Configuration;
import org.apache.flink.streaming.api.functions.KeyedProcessFunction;
import org.apache.flink.util.Collector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Drives one {@link DeviceRecorder} per device key. Crash safety comes from the recorder's own
 * segment files, so recorders live in plain task memory. A recorder created after a restart
 * starts with orphan recovery.
 */
public class RecorderProcessFunction extends KeyedProcessFunction<String, TelemetryRecord, RecorderOutput> {
    private static final Logger LOG = LoggerFactory.getLogger(RecorderProcessFunction.class);

    private final RecorderConfig config;

    private transient Map<String, DeviceRecorder> recorders;
    private transient ValueState<Long> nextTickState;

    public RecorderProcessFunction(RecorderConfig config) {
        this.config = config;
    }

    @Override
    public void open(Configuration parameters) {
        recorders = new HashMap<>();
        nextTickState = getRuntimeContext().getState(
                new ValueStateDescriptor<>("nextTick", BasicTypeInfo.LONG_TYPE_INFO));
    }

    @Override
    public void processElement(TelemetryRecord record, Context ctx, Collector<RecorderOutput> out) throws Exception {
        String deviceId = ctx.getCurrentKey();
        long now = ctx.timerService().currentProcessingTime();
        DeviceRecorder recorder = recorderFor(deviceId, now, out);
        emit(recorder.handle(record, now), out);

        if (nextTickState.value() == null) {
            long next = now + config.getStatsIntervalMs();
            ctx.timerService().registerProcessingTimeTimer(next);
            nextTickState.update(next);
        }
    }

    @Override
    public void onTimer(long timestamp, OnTimerContext ctx, Collector<RecorderOutput> out) throws Exception {
        DeviceRecorder recorder = recorderFor(ctx.getCurrentKey(), timestamp, out);
        emit(recorder.onTimer(timestamp), out);

        long next = timestamp + config.getStatsIntervalMs();
        ctx.timerService().registerProcessingTimeTimer(next);
        nextTickState.update(next);
    }

    private DeviceRecorder recorderFor(String deviceId, long nowMs, Collector<RecorderOutput> out) {
        DeviceRecorder recorder = recorders.get(deviceId);
        if (recorder == null) {
            LOG.info("Opening recorder for device {}", deviceId);
            recorder = DeviceRecorder.create(deviceId, config);
            recorders.put(deviceId, recorder);
            emit(recorder.recover(nowMs), out);
        }
        return recorder;
    }

    private static void emit(List<RecorderOutput> outputs, Collector<RecorderOutput> out) {
        for (RecorderOutput output : outputs) {
            out.collect(output);
        }
    }
}
