package io.ridetrack.trigger;

/**
 * Records while the charger is connected: plugging in starts or resumes, unplugging pauses.
 */
public class PowerTriggerSource implements TriggerSource {

    private Boolean lastConnected;

    @Override
    public TriggerSignal onPowerState(boolean connected, long atMs) {
        if (lastConnected != null && lastConnected == connected) {
            return TriggerSignal.NONE;
        }
        lastConnected = connected;
        return connected ? TriggerSignal.START : TriggerSignal.PAUSE;
    }
}
