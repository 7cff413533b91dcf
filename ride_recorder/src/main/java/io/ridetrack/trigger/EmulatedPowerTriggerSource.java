package io.ridetrack.trigger;

/**
 * Acts as if the charger were always connected: starts once and never pauses on its own. A user
 * stop silences it until the next user start.
 */
public class EmulatedPowerTriggerSource implements TriggerSource {

    private boolean armed = true;

    @Override
    public TriggerSignal onTick(long atMs) {
        if (armed) {
            armed = false;
            return TriggerSignal.START;
        }
        return TriggerSignal.NONE;
    }

    @Override
    public void onUserCommand(boolean start, long atMs) {
        armed = false;
    }
}
