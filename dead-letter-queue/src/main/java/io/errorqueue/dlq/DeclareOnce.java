package io.errorqueue.dlq;

import java.util.concurrent.locks.ReentrantLock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One-shot initialization cell for a broker-side declaration.
 *
 * The first caller runs the declaration while holding the cell's lock; concurrent
 * callers wait and then observe the result. The cell latches only when the
 * declaration completes normally, so a failed attempt is retried by the next caller.
 */
final class DeclareOnce {

    private static final Logger log = LoggerFactory.getLogger(DeclareOnce.class);

    private final String name;
    private final ReentrantLock lock = new ReentrantLock();
    private volatile boolean declared;

    DeclareOnce(String name) {
        this.name = name;
    }

    /**
     * Runs the declaration unless it has already succeeded.
     *
     * @return true if this call performed the declaration
     */
    boolean runOnce(Runnable declaration) {
        if (declared) {
            return false;
        }
        lock.lock();
        try {
            if (declared) {
                return false;
            }
            declaration.run();
            declared = true;
            log.debug("Declared {}", name);
            return true;
        } finally {
            lock.unlock();
        }
    }

    boolean isDeclared() {
        return declared;
    }
}
