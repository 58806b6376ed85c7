package com.logprog.ast;

/**
 * Kinds of exported metric a program can declare.
 *
 * Only COUNTER, GAUGE and TIMER have a declaration keyword in program text;
 * the unparser omits the keyword for the others.
 */
public enum MetricKind {
    COUNTER,
    GAUGE,
    TIMER,
    TEXT,
    HISTOGRAM
}
