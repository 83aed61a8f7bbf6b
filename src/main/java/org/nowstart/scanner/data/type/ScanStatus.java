package org.nowstart.scanner.data.type;

public enum ScanStatus {
    SIGNALS,
    NO_SIGNAL,
    INSUFFICIENT_DATA,
    NO_DATA,
    FAILED,
    TIMED_OUT
}
