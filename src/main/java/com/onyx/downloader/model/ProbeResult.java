package com.onyx.downloader.model;

import lombok.Value;

@Value
public class ProbeResult {
    Long size;
    boolean supportsRange;
    String suggestedName;
    String finalUrl;

    public boolean hasKnownSize() {
        return size != null;
    }

    public ProbeResult withoutRangeSupport() {
        return new ProbeResult(size, false, suggestedName, finalUrl);
    }
}
