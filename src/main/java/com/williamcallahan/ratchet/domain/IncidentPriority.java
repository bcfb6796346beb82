package com.williamcallahan.ratchet.domain;

public enum IncidentPriority {
    HIGH,
    LOW
}
