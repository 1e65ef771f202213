package com.contact.resolution.sync;

import com.contact.resolution.config.SyncOptions;
import com.contact.resolution.core.model.ContactRecord;
import com.contact.resolution.core.model.DuplicateGroup;
import com.contact.resolution.logging.LogContext;
import com.contact.resolution.metrics.MetricsService;
import com.contact.resolution.metrics.NoOpMetricsService;
import com.contact.resolution.store.ContactRepository;
import com.contact.resolution.store.EmailRepository;
import com.contact.resolution.store.PhoneRepository;
import com.contact.resolution.store.StoreConnection;
import com.contact.resolution.store.SyncState;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Hash-gated incremental sync from an upstream {@link ContactPageSource} into the local store.
 *
 * <p>Pages are fetched concurrently, at most {@link SyncOptions#maxConcurrency()} at a time,
 * in chunks of {@link SyncOptions#chunkSize()} pages. A chunk's fetches all complete before
 * its pages are applied, in offset order, on the calling thread, so store writes never
 * overlap. A failed fetch is logged and counted without stopping the run.</p>
 *
 * <p>Each record is canonicalized and hashed. A record whose hash matches the stored one is
 * not written at all. Otherwise the contact row is upserted with its stored duplicate group
 * carried forward, and its email and phone rows are replaced, all in one transaction.</p>
 */
public class ContactSyncEngine implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ContactSyncEngine.class);

    private final ContactPageSource source;
    private final StoreConnection connection;
    private final ContactRepository contactRepository;
    private final EmailRepository emailRepository;
    private final PhoneRepository phoneRepository;
    private final SyncOptions options;
    private final MetricsService metricsService;
    private final Clock clock;
    private final RecordHasher hasher = new RecordHasher();
    private final ContactRecordMapper mapper = new ContactRecordMapper();
    private final ExecutorService executor;
    private final Semaphore fetchPermits;
    private final AtomicBoolean stopRequested = new AtomicBoolean(false);

    public ContactSyncEngine(ContactPageSource source, StoreConnection connection, SyncOptions options) {
        this(source, connection, options, new NoOpMetricsService(), Clock.systemUTC());
    }

    public ContactSyncEngine(ContactPageSource source, StoreConnection connection, SyncOptions options,
                             MetricsService metricsService, Clock clock) {
        this.source = source;
        this.connection = connection;
        this.contactRepository = new ContactRepository(connection);
        this.emailRepository = new EmailRepository(connection);
        this.phoneRepository = new PhoneRepository(connection);
        this.options = options;
        this.metricsService = metricsService;
        this.clock = clock;
        this.executor = Executors.newFixedThreadPool(options.chunkSize(), fetchThreadFactory());
        this.fetchPermits = new Semaphore(options.maxConcurrency());
    }

    public SyncResult sync() {
        return sync(ProgressCallback.NOOP);
    }

    /**
     * Runs one sync pass over every upstream page.
     */
    public SyncResult sync(ProgressCallback progress) {
        try (LogContext logCtx = LogContext.forSync(LogContext.generateCorrelationId())) {
            return runPass(progress);
        } finally {
            stopRequested.set(false);
        }
    }

    private SyncResult runPass(ProgressCallback progress) {
        if (stopRequested.get()) {
            log.warn("sync.interrupted stop requested before the first page");
            return finish(new Tally(), true);
        }
        log.info("sync.starting pageSize={} maxConcurrency={} chunkSize={}",
                options.pageSize(), options.maxConcurrency(), options.chunkSize());

        ContactPage discovery;
        try {
            discovery = source.fetchPage(0, 1);
        } catch (RuntimeException e) {
            log.error("sync.discovery_failed error={}", e.getMessage());
            metricsService.incrementPageFailure();
            return new SyncResult(0, 0, 0, 1, false);
        }

        Tally tally = new Tally();
        long total = discovery.total();
        if (total <= 0) {
            if (!discovery.contacts().isEmpty()) {
                log.warn("sync.fallback source reported total=0 but returned {} contacts",
                        discovery.contacts().size());
                applyPage(discovery.contacts(), tally);
            } else {
                log.info("sync.empty no contacts to sync");
            }
            return finish(tally, false);
        }

        List<Long> offsets = new ArrayList<>();
        for (long offset = 0; offset < total; offset += options.pageSize()) {
            offsets.add(offset);
        }
        log.info("sync.planned total={} pages={}", total, offsets.size());

        boolean interrupted = false;
        long pagesDone = 0;
        for (int i = 0; i < offsets.size(); i += options.chunkSize()) {
            if (stopRequested.get() || Thread.currentThread().isInterrupted()) {
                log.warn("sync.interrupted pagesDone={} pagesPlanned={}", pagesDone, offsets.size());
                interrupted = true;
                break;
            }
            List<Long> chunk = offsets.subList(i, Math.min(i + options.chunkSize(), offsets.size()));
            List<CompletableFuture<ContactPage>> futures = chunk.stream()
                    .map(offset -> CompletableFuture.supplyAsync(() -> fetchGuarded(offset), executor))
                    .toList();
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

            for (CompletableFuture<ContactPage> future : futures) {
                ContactPage page = future.join();
                if (page == null) {
                    tally.failedPages++;
                } else {
                    applyPage(page.contacts(), tally);
                }
                pagesDone++;
                progress.onProgress(pagesDone, offsets.size(), tally.summary());
            }
        }
        return finish(tally, interrupted);
    }

    /**
     * Asks the running sync, or the next one if none is running, to stop before its next chunk.
     * Fetches already in flight complete and their pages are applied. The request is consumed
     * when that sync returns.
     */
    public void requestStop() {
        stopRequested.set(true);
    }

    /**
     * Applies one upstream record to the store.
     *
     * @return the outcome, or empty if the record has no id
     */
    public Optional<SyncOutcome> applyRecord(JsonNode contact) {
        String id = mapper.idOf(contact);
        if (id == null) {
            log.debug("sync.record_skipped reason=missing id");
            return Optional.empty();
        }

        String canonicalJson = hasher.canonicalJson(contact);
        String hash = hasher.hash(canonicalJson);
        Optional<SyncState> existing = contactRepository.findSyncState(id);
        if (existing.isPresent() && hash.equals(existing.get().recordHash())) {
            metricsService.incrementSyncRecord(SyncOutcome.UNCHANGED);
            return Optional.of(SyncOutcome.UNCHANGED);
        }

        DuplicateGroup carriedGroup = existing.map(SyncState::duplicateGroup).orElse(DuplicateGroup.none());
        ContactRecord record = mapper.toRecord(contact, canonicalJson, hash,
                Instant.now(clock).toString(), carriedGroup);
        connection.inTransaction(() -> {
            contactRepository.upsert(record);
            emailRepository.replaceForContact(id, record.getEmails());
            phoneRepository.replaceForContact(id, record.getPhones());
            return null;
        });

        SyncOutcome outcome = existing.isPresent() ? SyncOutcome.UPDATED : SyncOutcome.ADDED;
        metricsService.incrementSyncRecord(outcome);
        log.debug("sync.record_applied contactId={} outcome={}", id, outcome.tagValue());
        return Optional.of(outcome);
    }

    private void applyPage(List<JsonNode> contacts, Tally tally) {
        for (JsonNode contact : contacts) {
            applyRecord(contact).ifPresent(tally::count);
        }
    }

    private ContactPage fetchGuarded(long offset) {
        try {
            fetchPermits.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("sync.page_failed offset={} error=interrupted while waiting for a fetch slot", offset);
            metricsService.incrementPageFailure();
            return null;
        }
        try {
            return source.fetchPage(offset, options.pageSize());
        } catch (RuntimeException e) {
            log.warn("sync.page_failed offset={} error={}", offset, e.getMessage());
            metricsService.incrementPageFailure();
            return null;
        } finally {
            fetchPermits.release();
        }
    }

    private SyncResult finish(Tally tally, boolean interrupted) {
        SyncResult result = new SyncResult(tally.added, tally.updated, tally.unchanged, tally.failedPages, interrupted);
        log.info("sync.completed added={} updated={} unchanged={} failedPages={} interrupted={}",
                result.added(), result.updated(), result.unchanged(), result.failedPages(), interrupted);
        return result;
    }

    private static ThreadFactory fetchThreadFactory() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "contact-sync-fetch-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static final class Tally {
        private long added;
        private long updated;
        private long unchanged;
        private long failedPages;

        void count(SyncOutcome outcome) {
            switch (outcome) {
                case ADDED -> added++;
                case UPDATED -> updated++;
                case UNCHANGED -> unchanged++;
            }
        }

        String summary() {
            return "Add:" + added + " Upd:" + updated + " Skp:" + unchanged + " Err:" + failedPages;
        }
    }
}
