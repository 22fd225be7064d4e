package com.brixo.tronbyt.device.sync;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Optional;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Base de los waiters: cola de avisos protegida por un lock y una condición.
 * Las subclases deciden qué liberar al cerrar.
 */
public abstract class AbstractWaiter implements Waiter {

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition signal = lock.newCondition();
    private final Deque<SyncPayload> pending = new ArrayDeque<>();
    private boolean woken;
    private boolean closed;

    /** Encola un aviso y despierta a quien espera. Se ignora si ya se cerró. */
    public void deliver(SyncPayload payload) {
        lock.lock();
        try {
            if (closed) {
                return;
            }
            pending.addLast(payload);
            signal.signalAll();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<SyncPayload> await(Duration timeout) throws InterruptedException {
        long nanos = timeout.toNanos();
        lock.lockInterruptibly();
        try {
            while (pending.isEmpty() && !woken && !closed) {
                if (nanos <= 0) {
                    return Optional.empty();
                }
                nanos = signal.awaitNanos(nanos);
            }
            woken = false;
            return Optional.ofNullable(pending.pollFirst());
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void wakeUp() {
        lock.lock();
        try {
            woken = true;
            signal.signalAll();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public final void close() {
        lock.lock();
        try {
            if (closed) {
                return;
            }
            closed = true;
            pending.clear();
            signal.signalAll();
        } finally {
            lock.unlock();
        }
        onClose();
    }

    public boolean isClosed() {
        lock.lock();
        try {
            return closed;
        } finally {
            lock.unlock();
        }
    }

    protected abstract void onClose();
}
