package edu.mcw.rgd.dataload.patientvariants;

/**
 * @since 10/7/26
 * enforces a minimum delay between successive calls to one external service
 */
public class Throttle {

    private long delayMs;
    private long lastCallNanos;
    private boolean firstCall = true;
    private int callCount;

    /**
     * block until at least 'delayMs' has passed since the previous call, then register a new call
     * @throws InterruptedException if interrupted while waiting
     */
    synchronized public void acquire() throws InterruptedException {

        if( !firstCall && delayMs>0 ) {
            long elapsedMs = (System.nanoTime() - lastCallNanos) / 1_000_000;
            long waitMs = delayMs - elapsedMs;
            if( waitMs>0 ) {
                Thread.sleep(waitMs);
            }
        }
        firstCall = false;
        lastCallNanos = System.nanoTime();
        callCount++;
    }

    /**
     * @return number of calls let through so far
     */
    synchronized public int getCallCount() {
        return callCount;
    }

    synchronized public void setDelayMs(long delayMs) {
        this.delayMs = delayMs;
    }

    synchronized public long getDelayMs() {
        return delayMs;
    }
}
