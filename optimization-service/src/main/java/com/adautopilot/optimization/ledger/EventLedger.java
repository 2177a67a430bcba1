package com.adautopilot.optimization.ledger;

/**
 * Append-only audit sink.
 *
 * <p>Implementations must be fire-and-forget: {@link #publish} returns immediately and
 * never throws, so a ledger outage cannot fail the operation that produced the event.
 */
public interface EventLedger {

    void publish(LedgerEvent event);
}
