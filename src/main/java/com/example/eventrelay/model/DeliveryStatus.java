package com.example.eventrelay.model;

public enum DeliveryStatus {
    PENDING,
    DELIVERED,
    FAILED;

    public boolean isTerminal() {
        return this != PENDING;
    }
}
