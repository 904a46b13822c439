package com.numaansystems.crmedge.resilience;

public enum CircuitState {
    CLOSED,
    OPEN,
    HALF_OPEN
}
