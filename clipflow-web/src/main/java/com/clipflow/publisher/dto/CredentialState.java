package com.clipflow.publisher.dto;

public enum CredentialState {
    ABSENT,
    ACTIVE,
    EXPIRING_SOON,
    EXPIRED,
    INVALID
}
