package com.phillippitts.watchkeeper.domain;

/** Observed health of one supervised OS process. */
public enum ProcessHealth {
    ALIVE,
    EXITED
}
