package com.onyx.downloader.service;

import com.onyx.downloader.config.DownloadProperties;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;

class BackoffPolicyTest {

    @Test
    void doublesDelayUpToCap() {
        DownloadProperties properties = new DownloadProperties();
        properties.setBackoffBase(Duration.ofMillis(500));
        properties.setBackoffMax(Duration.ofSeconds(8));
        BackoffPolicy policy = new BackoffPolicy(properties);

        assertEquals(500, policy.waitTime(1));
        assertEquals(1000, policy.waitTime(2));
        assertEquals(2000, policy.waitTime(3));
        assertEquals(4000, policy.waitTime(4));
        assertEquals(8000, policy.waitTime(5));
        assertEquals(8000, policy.waitTime(6));
        assertEquals(8000, policy.waitTime(200));
    }

    @Test
    void waitIsCutShortByCancellation() throws Exception {
        BackoffPolicy policy = new BackoffPolicy(new DownloadProperties());
        CancellationToken token = CancellationToken.create();
        token.cancel();

        assertFalse(policy.waitForRetry(3, token));
    }
}
