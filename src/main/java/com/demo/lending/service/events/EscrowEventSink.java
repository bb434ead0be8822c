package com.demo.lending.service.events;

/**
 * Fire-and-forget notification port. Implementations must not throw back into the engine.
 */
public interface EscrowEventSink {

    /**
     * @param escrowId escrow identity
     * @param id       request id the event refers to
     * @param kind     what happened
     */
    void notify(String escrowId, long id, EscrowEvent kind);
}
