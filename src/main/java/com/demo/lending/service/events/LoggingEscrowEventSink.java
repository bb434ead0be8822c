package com.demo.lending.service.events;

import lombok.extern.slf4j.Slf4j;

@Slf4j
public class LoggingEscrowEventSink implements EscrowEventSink {

    @Override
    public void notify(String escrowId, long id, EscrowEvent kind) {
        log.info("escrow event {} escrow={} request={}", kind, escrowId, id);
    }
}
