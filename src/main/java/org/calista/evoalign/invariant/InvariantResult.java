package org.calista.evoalign.invariant;

public enum InvariantResult {
    PASS,
    FAIL,
    WARN,
    SKIP
}
