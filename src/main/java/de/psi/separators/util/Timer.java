package de.psi.separators.util;

/**
 * Wall-clock budget accumulated over several start/stop spans. A timer does not
 * interrupt anything by itself; callers look at {@link #expired()} between steps
 * and hand {@link #remaining()} to solvers as their own timeout.
 */
public class Timer {
    public static final long UNLIMITED = Long.MAX_VALUE;

    private final long limitMillis;
    private long elapsedMillis = 0;
    private long startedAt = -1;

    public Timer(long limitMillis) {
        if (limitMillis < 0) throw new IllegalArgumentException("negative time limit");
        this.limitMillis = limitMillis;
    }

    public static Timer unlimited() {
        return new Timer(UNLIMITED);
    }

    public boolean isUnlimited() {
        return limitMillis == UNLIMITED;
    }

    public void start() {
        if (startedAt >= 0) throw new IllegalStateException("timer already running");
        startedAt = System.currentTimeMillis();
    }

    public void stop() {
        if (startedAt < 0) throw new IllegalStateException("timer not running");
        elapsedMillis += System.currentTimeMillis() - startedAt;
        startedAt = -1;
    }

    public boolean isRunning() {
        return startedAt >= 0;
    }

    public long elapsed() {
        return startedAt < 0 ? elapsedMillis : elapsedMillis + System.currentTimeMillis() - startedAt;
    }

    /** Milliseconds left, {@link #UNLIMITED} for an unlimited timer, never negative. */
    public long remaining() {
        if (isUnlimited()) return UNLIMITED;
        return Math.max(0, limitMillis - elapsed());
    }

    public boolean expired() {
        return !isUnlimited() && elapsed() >= limitMillis;
    }

    @Override
    public String toString() {
        return isUnlimited() ? elapsed() + "ms" : elapsed() + "ms of " + limitMillis + "ms";
    }
}
