package com.phillippitts.watchkeeper.service.stream;

import org.springframework.stereotype.Component;

import java.util.BitSet;

/**
 * Hands out output descriptor numbers the way the OS does: lowest free number first, starting
 * after stdin/stdout/stderr.
 *
 * <p>A number is released as soon as the pipe behind it is gone, whatever the handler ledger
 * says, so numbers are reused immediately. {@link HandlerRegistry} must cope with a reused number
 * whose previous binding was never confirmed removed.
 */
@Component
public class DescriptorTable {

    static final int FIRST_DESCRIPTOR = 3;

    private final BitSet inUse = new BitSet();

    public synchronized int allocate() {
        int fd = inUse.nextClearBit(FIRST_DESCRIPTOR);
        inUse.set(fd);
        return fd;
    }

    public synchronized void release(int fd) {
        inUse.clear(fd);
    }

    public synchronized boolean isAllocated(int fd) {
        return inUse.get(fd);
    }

    public synchronized int allocatedCount() {
        return inUse.cardinality();
    }
}
