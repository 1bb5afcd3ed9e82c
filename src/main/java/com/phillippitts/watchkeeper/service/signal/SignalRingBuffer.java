package com.phillippitts.watchkeeper.service.signal;

import java.util.concurrent.atomic.AtomicIntegerArray;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Fixed-capacity ring of raw signal numbers between the signal handler and the control loop.
 *
 * <p>Many producers, one consumer. {@link #offer(int)} is the only method called from signal
 * context and is restricted to CAS and plain atomic stores on preallocated state: it allocates
 * nothing, takes no lock, never logs and never throws. Everything else about a signal happens in
 * {@link SignalDispatcher} on the control loop.
 *
 * <p>0 marks an empty slot (signal numbers are positive). A producer first claims a slot by
 * advancing {@code tail}, then publishes the number into it; the consumer treats a claimed but
 * unpublished slot as empty until the next poll.
 */
public final class SignalRingBuffer {

    private final AtomicIntegerArray slots;
    private final int capacity;
    private final AtomicLong head = new AtomicLong();
    private final AtomicLong tail = new AtomicLong();
    private final AtomicLong dropped = new AtomicLong();

    public SignalRingBuffer(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be >= 1, got " + capacity);
        }
        this.capacity = capacity;
        this.slots = new AtomicIntegerArray(capacity);
    }

    /**
     * Signal-context safe enqueue.
     *
     * @return false if the ring was full (the drop is counted) or {@code signo} is not positive
     */
    public boolean offer(int signo) {
        if (signo <= 0) {
            return false;
        }
        for (;;) {
            long t = tail.get();
            if (t - head.get() >= capacity) {
                dropped.incrementAndGet();
                return false;
            }
            if (tail.compareAndSet(t, t + 1)) {
                slots.set((int) (t % capacity), signo);
                return true;
            }
        }
    }

    /**
     * Consumer side; must only be called from one thread.
     *
     * @return next signal number, or 0 if nothing is ready
     */
    public int poll() {
        long h = head.get();
        if (h >= tail.get()) {
            return 0;
        }
        int index = (int) (h % capacity);
        int signo = slots.get(index);
        if (signo == 0) {
            return 0;
        }
        slots.set(index, 0);
        head.set(h + 1);
        return signo;
    }

    /** Returns and resets the number of signals lost to overflow since the last call. */
    public long drainDropped() {
        return dropped.getAndSet(0);
    }

    public int size() {
        return (int) (tail.get() - head.get());
    }

    public int capacity() {
        return capacity;
    }
}
