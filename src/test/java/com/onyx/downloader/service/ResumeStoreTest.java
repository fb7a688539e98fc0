package com.onyx.downloader.service;

import com.onyx.downloader.model.ChecksumAlgorithm;
import com.onyx.downloader.model.Chunk;
import com.onyx.downloader.model.ChunkStatus;
import com.onyx.downloader.model.ResumeRecord;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DataJpaTest
@Import(ResumeStore.class)
class ResumeStoreTest {

    private static final String URL = "http://example.com/big.iso";
    private static final Path DESTINATION = Path.of("build", "downloads", "big.iso");

    @Autowired
    private ResumeStore resumeStore;

    @Test
    void storesAndLoadsPlan() {
        resumeStore.create(URL, DESTINATION, 300L, ChecksumAlgorithm.SHA256, 3, plan());

        ResumeRecord record = resumeStore.load(URL, DESTINATION).orElseThrow();

        assertEquals(URL, record.getUrl());
        assertEquals(300L, record.getExpectedSize());
        assertEquals(ChecksumAlgorithm.SHA256, record.getChecksumAlgorithm());
        assertEquals(3, record.getWorkerCount());
        assertEquals(3, record.getChunks().size());
        assertEquals(200L, record.getChunks().get(2).getStartOffset());
        assertEquals(DESTINATION.toAbsolutePath().normalize().toString(), record.getDestinationPath());
        assertTrue(resumeStore.exists(URL, DESTINATION));
    }

    @Test
    void progressOnlyMovesForward() {
        ResumeRecord created = resumeStore.create(URL, DESTINATION, 300L, null, 3, plan());
        Chunk chunk = Chunk.of(1, 100, 200);

        chunk.setBytesWritten(60);
        chunk.setStatus(ChunkStatus.STREAMING);
        resumeStore.updateProgress(created.getKey(), chunk);
        chunk.setBytesWritten(20);
        resumeStore.updateProgress(created.getKey(), chunk);

        Chunk stored = resumeStore.load(URL, DESTINATION).orElseThrow().getChunks().get(1);
        assertEquals(60L, stored.getBytesWritten());
        assertEquals(160L, resumeStore.load(URL, DESTINATION).orElseThrow().highestWrittenOffset());
    }

    @Test
    void completedChunkStaysComplete() {
        ResumeRecord created = resumeStore.create(URL, DESTINATION, 300L, null, 3, plan());
        Chunk chunk = Chunk.of(0, 0, 100);
        chunk.setBytesWritten(100);
        chunk.setStatus(ChunkStatus.COMPLETE);
        resumeStore.updateProgress(created.getKey(), chunk);

        chunk.setStatus(ChunkStatus.FAILED);
        resumeStore.updateProgress(created.getKey(), chunk);

        assertEquals(ChunkStatus.COMPLETE, resumeStore.load(URL, DESTINATION).orElseThrow().getChunks().get(0).getStatus());
    }

    @Test
    void createReplacesPreviousPlan() {
        resumeStore.create(URL, DESTINATION, 300L, null, 3, plan());
        resumeStore.create(URL, DESTINATION, 300L, null, 1, List.of(Chunk.of(0, 0, 300)));

        ResumeRecord record = resumeStore.load(URL, DESTINATION).orElseThrow();
        assertEquals(1, record.getWorkerCount());
        assertEquals(1, record.getChunks().size());
    }

    @Test
    void updateForUnknownChunkIsIgnored() {
        ResumeRecord created = resumeStore.create(URL, DESTINATION, 300L, null, 3, plan());
        Chunk stray = Chunk.of(7, 0, 10);
        stray.setBytesWritten(5);

        resumeStore.updateProgress(created.getKey(), stray);

        assertEquals(0L, resumeStore.load(URL, DESTINATION).orElseThrow().totalBytesWritten());
    }

    @Test
    void deleteRemovesRecordAndChunks() {
        ResumeRecord created = resumeStore.create(URL, DESTINATION, 300L, null, 3, plan());

        resumeStore.delete(created.getKey());

        assertFalse(resumeStore.exists(URL, DESTINATION));
        assertTrue(resumeStore.load(URL, DESTINATION).isEmpty());
    }

    @Test
    void keyDependsOnUrlAndAbsoluteDestination() {
        String key = ResumeStore.recordKey(URL, DESTINATION);

        assertEquals(key, ResumeStore.recordKey(URL, DESTINATION.toAbsolutePath()));
        assertNotEquals(key, ResumeStore.recordKey(URL, Path.of("other.iso")));
        assertNotEquals(key, ResumeStore.recordKey(URL + "?v=2", DESTINATION));
        assertEquals(64, key.length());
    }

    private static List<Chunk> plan() {
        return List.of(Chunk.of(0, 0, 100), Chunk.of(1, 100, 200), Chunk.of(2, 200, 300));
    }
}
