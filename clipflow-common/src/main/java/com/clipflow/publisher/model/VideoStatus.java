package com.clipflow.publisher.model;

public enum VideoStatus {
    UPLOADED,
    TRANSCRIBING,
    GENERATING,
    READY,
    PUBLISHING,
    POSTED,
    FAILED,
    ERROR;

    /** Statuses in which a background step owns the video. */
    public boolean isInProgress() {
        return this == TRANSCRIBING || this == GENERATING || this == PUBLISHING;
    }
}
