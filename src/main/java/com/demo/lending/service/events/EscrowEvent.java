package com.demo.lending.service.events;

public enum EscrowEvent {
    REQUESTED,
    RESCINDED,
    CLEARED
}
