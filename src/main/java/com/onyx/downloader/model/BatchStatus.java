package com.onyx.downloader.model;

public enum BatchStatus {
    COMPLETED,
    ABORTED
}
