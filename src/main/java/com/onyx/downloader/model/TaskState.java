package com.onyx.downloader.model;

public enum TaskState {
    PENDING,
    PLANNING,
    TRANSFERRING,
    VERIFYING,
    DONE,
    FAILED
}
