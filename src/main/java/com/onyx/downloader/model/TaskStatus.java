package com.onyx.downloader.model;

public enum TaskStatus {
    SUCCESS,
    FAILED,
    ABORTED
}
