package com.filehub.api.service;

import com.filehub.api.dto.UploadResult;
import com.filehub.api.exception.ReferencesExistException;
import com.filehub.api.model.StoredFile;
import com.filehub.api.repository.FileReferenceRepository;
import com.filehub.api.repository.FileRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.core.io.ByteArrayResource;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

@SpringBootTest(properties = "app.dedup.max-attempts=10")
class ConcurrentUploadTest {

    private static final Logger log = LoggerFactory.getLogger(ConcurrentUploadTest.class);

    private static final int UPLOADERS = 8;

    @Autowired
    private DeduplicationService deduplicationService;

    @Autowired
    private FileLifecycleService lifecycleService;

    @Autowired
    private FileRepository fileRepository;

    @Autowired
    private FileReferenceRepository referenceRepository;

    @BeforeEach
    void clean() {
        referenceRepository.deleteAllInBatch();
        fileRepository.deleteAllInBatch();
    }

    @Test
    void parallelIdenticalUploadsProduceOneFile() throws Exception {
        byte[] bytes = "the same payload, uploaded in parallel".getBytes(StandardCharsets.UTF_8);

        List<UploadResult> results = runConcurrently(UPLOADERS, i ->
                deduplicationService.submit(new ByteArrayResource(bytes), "parallel-" + i + ".txt", "text/plain", bytes.length));

        long originals = results.stream().filter(r -> r.getType() == UploadResult.Type.ORIGINAL).count();
        log.info("{} uploads resolved as {} original(s)", results.size(), originals);

        assertEquals(1, originals);
        assertEquals(1, fileRepository.count());
        assertEquals(UPLOADERS - 1, referenceRepository.count());

        StoredFile file = fileRepository.findAll().get(0);
        assertEquals(UPLOADERS, file.getReferenceCount());
        assertEquals(bytes.length * (long) (UPLOADERS - 1), file.getStorageSaved());
        assertTrue(results.stream().allMatch(r -> r.getOwningFile().getId().equals(file.getId())));
    }

    @Test
    void parallelReferenceDeletesLeaveConsistentCount() throws Exception {
        byte[] bytes = "shared".getBytes(StandardCharsets.UTF_8);
        String fileId = deduplicationService.submit(new ByteArrayResource(bytes), "shared.txt", "text/plain", bytes.length)
                .getFile().getId();
        List<String> referenceIds = new ArrayList<>();
        for (int i = 0; i < UPLOADERS; i++) {
            referenceIds.add(deduplicationService
                    .submit(new ByteArrayResource(bytes), "shared-" + i + ".txt", "text/plain", bytes.length)
                    .getReference().getId());
        }

        runConcurrently(UPLOADERS, i -> {
            lifecycleService.deleteReference(referenceIds.get(i));
            return Boolean.TRUE;
        });

        StoredFile file = fileRepository.findById(fileId).orElseThrow();
        assertEquals(1, file.getReferenceCount());
        assertEquals(0, file.getStorageSaved());
        assertEquals(0, referenceRepository.count());
    }

    @Test
    void deleteRacingDuplicateUploadsKeepsCountsConsistent() throws Exception {
        int rounds = 20;
        int uploaders = 3;
        for (int round = 0; round < rounds; round++) {
            byte[] bytes = ("contested content " + round).getBytes(StandardCharsets.UTF_8);
            StoredFile original = deduplicationService
                    .submit(new ByteArrayResource(bytes), "contested-" + round + ".txt", "text/plain", bytes.length)
                    .getFile();
            String digest = original.getContentHash();
            int currentRound = round;

            List<String> outcomes = runConcurrently(uploaders + 1, i -> {
                if (i == 0) {
                    try {
                        lifecycleService.deleteFile(original.getId());
                        return "deleted";
                    } catch (ReferencesExistException e) {
                        return "refused";
                    }
                }
                return deduplicationService.submit(new ByteArrayResource(bytes),
                        "contested-" + currentRound + "-" + i + ".txt", "text/plain", bytes.length).getType().name();
            });
            boolean deleted = "deleted".equals(outcomes.get(0));

            List<StoredFile> withDigest = fileRepository.findAll().stream()
                    .filter(f -> digest.equals(f.getContentHash()))
                    .collect(Collectors.toList());
            assertEquals(1, withDigest.size(), "round " + round + " outcomes " + outcomes);
            StoredFile survivor = withDigest.get(0);
            assertEquals(deleted, !survivor.getId().equals(original.getId()));
            // Every upload is held by the survivor, and the original too unless it was deleted
            assertEquals(uploaders + (deleted ? 0 : 1), survivor.getReferenceCount(), "round " + round);
            assertEquals(bytes.length * (survivor.getReferenceCount() - 1), survivor.getStorageSaved());
        }

        for (StoredFile file : fileRepository.findAll()) {
            assertEquals(1 + referenceRepository.countByOriginalFileId(file.getId()), file.getReferenceCount(),
                    "file " + file.getOriginalFilename());
        }
    }

    private interface IndexedTask<T> {
        T run(int index) throws Exception;
    }

    private static <T> List<T> runConcurrently(int threads, IndexedTask<T> task) throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<T>> futures = new ArrayList<>();
            for (int i = 0; i < threads; i++) {
                int index = i;
                Callable<T> callable = () -> {
                    start.await();
                    return task.run(index);
                };
                futures.add(pool.submit(callable));
            }
            start.countDown();

            List<T> results = new ArrayList<>();
            for (Future<T> future : futures) {
                results.add(future.get(60, TimeUnit.SECONDS));
            }
            return results;
        } finally {
            pool.shutdownNow();
        }
    }
}
