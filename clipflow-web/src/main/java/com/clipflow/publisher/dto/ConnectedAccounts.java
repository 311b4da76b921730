package com.clipflow.publisher.dto;

import com.clipflow.publisher.model.Platform;

import java.util.Map;

/** Account names stored per platform by the connection handshake. */
public record ConnectedAccounts(Map<Platform, String> accounts) {
}
