package com.onyx.downloader.service;

import com.onyx.downloader.model.ProgressEvent;

@FunctionalInterface
public interface ProgressListener {

    ProgressListener NONE = event -> { };

    void onProgress(ProgressEvent event);
}
