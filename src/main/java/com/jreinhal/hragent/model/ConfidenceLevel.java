package com.jreinhal.hragent.model;

public enum ConfidenceLevel {
    HIGH,
    MEDIUM,
    LOW,
    VERY_LOW
}
