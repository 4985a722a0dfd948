package net.quantuminvestor.fetch.retry;

/**
 * Blocks the calling thread. Swapped for a recording fake in tests.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper THREAD = Thread::sleep;

    void sleep(long millis) throws InterruptedException;
}
