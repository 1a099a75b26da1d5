package io.rndr.core.events;

/** An event as stored: its position in the global log plus the payload. */
public record RecordedEvent(long sequence, LedgerEvent event) {}
