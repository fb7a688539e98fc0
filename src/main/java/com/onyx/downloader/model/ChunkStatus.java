package com.onyx.downloader.model;

public enum ChunkStatus {
    PENDING,
    CONNECTING,
    STREAMING,
    COMPLETE,
    FAILED;

    public boolean isActive() {
        return this == CONNECTING || this == STREAMING;
    }

    public boolean isTerminal() {
        return this == COMPLETE || this == FAILED;
    }
}
