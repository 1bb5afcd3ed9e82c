package com.phillippitts.watchkeeper.service.signal;

import sun.misc.Signal;
import sun.misc.SignalHandler;

import java.util.Objects;

/**
 * Handler installed for every configured signal. Writes the raw number into the ring and does
 * nothing else.
 */
final class SignalCapture implements SignalHandler {

    private final SignalRingBuffer ring;

    SignalCapture(SignalRingBuffer ring) {
        this.ring = Objects.requireNonNull(ring, "ring");
    }

    @Override
    public void handle(Signal signal) {
        ring.offer(signal.getNumber());
    }
}
