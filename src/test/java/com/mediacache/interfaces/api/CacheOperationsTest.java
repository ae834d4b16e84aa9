package com.mediacache.interfaces.api;

import com.mediacache.application.IntegrityReport;
import com.mediacache.application.RelocationHandle;
import com.mediacache.application.RelocationOutcome;
import com.mediacache.application.RelocationSettings;
import com.mediacache.application.exceptions.ErrorCode;
import com.mediacache.domain.model.CacheStatistics;
import com.mediacache.domain.model.CachedFileRecord;
import com.mediacache.domain.model.CachedFilesFilter;
import com.mediacache.domain.model.RecordState;
import com.mediacache.domain.model.SecurityEvent;
import com.mediacache.domain.model.SecurityEventFilter;
import com.mediacache.domain.model.TriggerReason;
import com.mediacache.infrastructure.filesystem.FilesystemOperations;
import com.mediacache.interfaces.api.dto.CacheDecision;
import com.mediacache.interfaces.api.dto.DecisionOutcome;
import com.mediacache.interfaces.api.dto.OperationResult;
import com.mediacache.support.EngineFixture;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static com.mediacache.support.EngineFixture.admin;
import static com.mediacache.support.EngineFixture.anonymous;
import static com.mediacache.support.EngineFixture.user;
import static org.junit.jupiter.api.Assertions.*;

class CacheOperationsTest {

    @TempDir
    Path tempDir;

    EngineFixture fixture;

    @AfterEach
    void tearDown() {
        if (fixture != null) {
            fixture.close();
        }
    }

    private EngineFixture start(EngineFixture.Builder builder) {
        fixture = builder.build();
        return fixture;
    }

    @Test
    void public_caller_cannot_request_cache() throws IOException {
        start(EngineFixture.builder(tempDir));
        Path original = fixture.media("a.mkv", "payload");

        OperationResult<RelocationOutcome> result =
            fixture.operations.requestCache(original.toString(), TriggerReason.MANUAL, anonymous());

        assertFalse(result.isSuccess());
        assertEquals(ErrorCode.AUTHORIZATION, result.getErrorCode());
        assertTrue(result.getError().isRetryableAfterCorrection());
        assertFalse(Files.exists(fixture.cachedPathOf(original)));
        assertEquals(0, fixture.countRows("cached_files"));
        assertTrue(fixture.auditEventTypes().contains("authorization_failure"));
    }

    @Test
    void user_requests_cache_and_reads_status() throws IOException {
        start(EngineFixture.builder(tempDir));
        Path original = fixture.media("movies/a.mkv", "payload");

        OperationResult<RelocationOutcome> cached =
            fixture.operations.requestCache(original.toString(), TriggerReason.WATCHLIST, user());
        assertTrue(cached.isSuccess(), cached.toString());

        OperationResult<Optional<CachedFileRecord>> status =
            fixture.operations.getStatus(original.toString(), anonymous());
        assertTrue(status.isSuccess(), status.toString());
        assertEquals(RecordState.COMMITTED, status.getValue().orElseThrow().getState());
        assertEquals("bob", status.getValue().orElseThrow().getAddedBy());
    }

    @Test
    void status_of_an_unknown_path_is_empty() throws IOException {
        start(EngineFixture.builder(tempDir));
        Path original = fixture.media("a.mkv", "payload");

        OperationResult<Optional<CachedFileRecord>> status = fixture.operations.getStatus(original.toString(), user());

        assertTrue(status.isSuccess());
        assertTrue(status.getValue().isEmpty());
    }

    @Test
    void hundred_and_first_request_in_a_window_is_rate_limited() {
        start(EngineFixture.builder(tempDir));

        for (int i = 0; i < 100; i++) {
            assertTrue(fixture.operations.getStatistics(user()).isSuccess(), "request " + (i + 1));
        }
        OperationResult<CacheStatistics> rejected = fixture.operations.getStatistics(user());

        assertEquals(ErrorCode.RATE_LIMITED, rejected.getErrorCode());
        assertTrue(rejected.getError().isRetryableAfterCorrection());
        assertEquals(1.0, fixture.meterRegistry.counter("mediacache.rate_limit.rejected").count());
        assertTrue(fixture.operations.getStatistics(admin()).isSuccess(), "other callers are unaffected");

        fixture.clock.advance(Duration.ofSeconds(61));
        assertTrue(fixture.operations.getStatistics(user()).isSuccess());
    }

    @Test
    void denied_calls_do_not_consume_quota() {
        start(EngineFixture.builder(tempDir));

        fixture.operations.verifyIntegrity(user());

        assertEquals(100, fixture.rateLimiter.remaining("bob"));
    }

    @Test
    void security_events_are_admin_only() {
        start(EngineFixture.builder(tempDir));
        fixture.operations.verifyIntegrity(user());

        OperationResult<List<SecurityEvent>> denied =
            fixture.operations.getSecurityEvents(SecurityEventFilter.all(), user());
        OperationResult<List<SecurityEvent>> granted =
            fixture.operations.getSecurityEvents(SecurityEventFilter.all(), admin());

        assertEquals(ErrorCode.AUTHORIZATION, denied.getErrorCode());
        assertTrue(granted.isSuccess());
        assertFalse(granted.getValue().isEmpty());
    }

    @Test
    void invalid_search_term_is_a_validation_error() {
        start(EngineFixture.builder(tempDir));

        OperationResult<List<CachedFileRecord>> result = fixture.operations.getStatus(
            CachedFilesFilter.builder().search("a'; DROP TABLE cached_files; --").build(), user());

        assertEquals(ErrorCode.VALIDATION, result.getErrorCode());
        assertEquals(0, fixture.countRows("cached_files"));
    }

    @Test
    void listing_filters_by_search_term() throws IOException {
        start(EngineFixture.builder(tempDir));
        Path first = fixture.media("movies/Alien (1979).mkv", "one");
        Path second = fixture.media("shows/Dark S01E01.mkv", "two");
        assertTrue(fixture.operations.requestCache(first.toString(), TriggerReason.WATCHLIST, user()).isSuccess());
        assertTrue(fixture.operations.requestCache(second.toString(), TriggerReason.ONDECK, user()).isSuccess());

        OperationResult<List<CachedFileRecord>> result = fixture.operations.getStatus(
            CachedFilesFilter.builder().search("Alien").build(), user());

        assertTrue(result.isSuccess(), result.toString());
        assertEquals(1, result.getValue().size());
        assertEquals(first, result.getValue().get(0).getOriginalPath());
    }

    @Test
    void traversal_is_reported_without_leaking_paths() {
        start(EngineFixture.builder(tempDir));

        OperationResult<RelocationOutcome> result = fixture.operations.requestCache(
            fixture.originRoot.resolve("../../etc/passwd").toString(), TriggerReason.MANUAL, user());

        assertEquals(ErrorCode.VALIDATION, result.getErrorCode());
        assertFalse(result.getError().getMessage().contains(tempDir.toString()));
        assertFalse(result.getError().getMessage().contains("/etc/passwd"));
        assertNotNull(result.getError().getRequestId());
    }

    @Test
    void filesystem_failure_is_reported_generically() throws IOException {
        Path cacheRoot = tempDir.toRealPath().resolve("cache");
        FilesystemOperations failing = new FilesystemOperations() {
            @Override
            public void moveAtomically(Path source, Path target) throws IOException {
                if (target.startsWith(cacheRoot)) {
                    throw new IOException("simulated rename failure at " + target);
                }
                super.moveAtomically(source, target);
            }
        };
        start(EngineFixture.builder(tempDir).filesystem(failing));
        Path original = fixture.media("a.mkv", "payload");

        OperationResult<RelocationOutcome> result =
            fixture.operations.requestCache(original.toString(), TriggerReason.WATCHLIST, user());

        assertEquals(ErrorCode.FILESYSTEM, result.getErrorCode());
        assertEquals("Filesystem operation failed; changes were rolled back", result.getError().getMessage());
        assertFalse(result.getError().isRetryableAfterCorrection());
        assertEquals("payload", Files.readString(original));
    }

    @Test
    void user_cannot_release() throws IOException {
        start(EngineFixture.builder(tempDir));
        Path original = fixture.media("a.mkv", "payload");
        assertTrue(fixture.operations.requestCache(original.toString(), TriggerReason.WATCHLIST, user()).isSuccess());

        OperationResult<RelocationOutcome> denied = fixture.operations.requestRelease(original.toString(), user());
        OperationResult<RelocationOutcome> released = fixture.operations.requestRelease(original.toString(), admin());

        assertEquals(ErrorCode.AUTHORIZATION, denied.getErrorCode());
        assertTrue(released.isSuccess(), released.toString());
        assertEquals(RecordState.REMOVED, released.getValue().getRecord().getState());
        assertFalse(Files.exists(fixture.cachedPathOf(original)));
    }

    @Test
    void submit_returns_a_handle_that_completes() throws IOException {
        start(EngineFixture.builder(tempDir));
        Path original = fixture.media("a.mkv", "payload");

        OperationResult<RelocationHandle> submitted =
            fixture.operations.submitCache(original.toString(), TriggerReason.CONTINUE_WATCHING, user());

        assertTrue(submitted.isSuccess(), submitted.toString());
        RelocationOutcome outcome = submitted.getValue().await(Duration.ofSeconds(30));
        assertFalse(outcome.isNoop());
        assertEquals(RecordState.COMMITTED, outcome.getRecord().getState());
        assertTrue(submitted.getValue().isDone());
    }

    @Test
    void decisions_report_one_result_per_item() throws IOException {
        start(EngineFixture.builder(tempDir));
        Path present = fixture.media("movies/a.mkv", "payload");
        Path uncached = fixture.media("movies/b.mkv", "other");
        Path missing = fixture.originRoot.resolve("movies/gone.mkv");
        List<CacheDecision> decisions = List.of(
            CacheDecision.cache(present.toString(), TriggerReason.WATCHLIST),
            CacheDecision.cache(missing.toString(), TriggerReason.WATCHLIST),
            CacheDecision.release(uncached.toString()),
            CacheDecision.cache(fixture.originRoot.resolve("../outside.mkv").toString(), TriggerReason.TRAKT));

        OperationResult<List<DecisionOutcome>> result = fixture.operations.applyDecisions(decisions, admin());

        assertTrue(result.isSuccess(), result.toString());
        List<DecisionOutcome> outcomes = result.getValue();
        assertEquals(4, outcomes.size());
        assertEquals(DecisionOutcome.Status.APPLIED, outcomes.get(0).getStatus());
        assertEquals(DecisionOutcome.Status.SKIPPED, outcomes.get(1).getStatus());
        assertNull(outcomes.get(1).getError());
        assertEquals(DecisionOutcome.Status.FAILED, outcomes.get(2).getStatus());
        assertEquals(ErrorCode.VALIDATION, outcomes.get(2).getError().getCode());
        assertEquals(DecisionOutcome.Status.FAILED, outcomes.get(3).getStatus());
        assertEquals(ErrorCode.VALIDATION, outcomes.get(3).getError().getCode());
        assertTrue(Files.exists(fixture.cachedPathOf(present)));
        assertEquals(99, fixture.rateLimiter.remaining("alice"));

        OperationResult<List<DecisionOutcome>> again = fixture.operations.applyDecisions(decisions.subList(0, 1),
            admin());
        assertEquals(DecisionOutcome.Status.NOOP, again.getValue().get(0).getStatus());
    }

    @Test
    void subtitle_sidecars_follow_their_media() throws IOException {
        start(EngineFixture.builder(tempDir));
        Path media = fixture.media("movies/Film.mkv", "video");
        Path english = fixture.media("movies/Film.en.srt", "subs");
        Path french = fixture.media("movies/Film.fr.ass", "subs");
        fixture.media("movies/Film.nfo", "metadata");

        OperationResult<List<DecisionOutcome>> cached = fixture.operations.applyDecisions(
            List.of(CacheDecision.cache(media.toString(), TriggerReason.ONDECK),
                CacheDecision.cache(french.toString(), TriggerReason.ONDECK)), admin());

        assertTrue(cached.isSuccess(), cached.toString());
        assertEquals(3, cached.getValue().size());
        assertEquals(english.toString(), cached.getValue().get(2).getOriginalPath());
        cached.getValue().forEach(o -> assertEquals(DecisionOutcome.Status.APPLIED, o.getStatus(), o.toString()));
        assertTrue(Files.exists(fixture.cachedPathOf(english)));
        assertTrue(Files.exists(fixture.cachedPathOf(french)));
        assertEquals(TriggerReason.ONDECK, fixture.repository.findByOriginalPath(english, admin())
            .orElseThrow().getTriggerReason());
        assertEquals(3, fixture.repository.listByState(RecordState.COMMITTED, admin()).size());

        OperationResult<List<DecisionOutcome>> released = fixture.operations.applyDecisions(
            List.of(CacheDecision.release(media.toString())), admin());

        assertEquals(3, released.getValue().size());
        released.getValue().forEach(o -> assertEquals(DecisionOutcome.Status.APPLIED, o.getStatus(), o.toString()));
        assertFalse(Files.exists(fixture.cachedPathOf(english)));
        assertEquals(3, fixture.repository.listByState(RecordState.REMOVED, admin()).size());
        assertEquals("subs", Files.readString(english));
    }

    @Test
    void subtitles_can_be_left_out() throws IOException {
        start(EngineFixture.builder(tempDir).settings(RelocationSettings.builder().includeSubtitles(false).build()));
        Path media = fixture.media("movies/Film.mkv", "video");
        Path english = fixture.media("movies/Film.en.srt", "subs");

        OperationResult<List<DecisionOutcome>> result = fixture.operations.applyDecisions(
            List.of(CacheDecision.cache(media.toString(), TriggerReason.ONDECK)), admin());

        assertEquals(1, result.getValue().size());
        assertFalse(Files.exists(fixture.cachedPathOf(english)));
    }

    @Test
    void removed_records_are_purged_after_retention() throws IOException {
        start(EngineFixture.builder(tempDir));
        Path original = fixture.media("a.mkv", "payload");
        assertTrue(fixture.operations.requestCache(original.toString(), TriggerReason.MANUAL, admin()).isSuccess());
        assertTrue(fixture.operations.requestRelease(original.toString(), admin()).isSuccess());

        assertEquals(0, fixture.operations.purgeRemoved(Duration.ofDays(30), admin()).getValue());
        fixture.clock.advance(Duration.ofDays(31));
        assertEquals(1, fixture.operations.purgeRemoved(Duration.ofDays(30), admin()).getValue());
        assertEquals(0, fixture.countRows("cached_files"));
        assertEquals(ErrorCode.AUTHORIZATION, fixture.operations.purgeRemoved(Duration.ZERO, user()).getErrorCode());
    }

    @Test
    void oversized_decision_batch_is_rejected() {
        start(EngineFixture.builder(tempDir));
        List<CacheDecision> decisions = new ArrayList<>();
        for (int i = 0; i <= CacheOperations.MAX_DECISIONS; i++) {
            decisions.add(CacheDecision.cache(fixture.originRoot.resolve("f" + i + ".mkv").toString(),
                TriggerReason.WATCHLIST));
        }

        OperationResult<List<DecisionOutcome>> result = fixture.operations.applyDecisions(decisions, admin());

        assertEquals(ErrorCode.VALIDATION, result.getErrorCode());
        assertEquals(0, fixture.countRows("cached_files"));
    }

    @Test
    void integrity_and_cleanup_through_the_facade() throws IOException {
        start(EngineFixture.builder(tempDir));
        Path original = fixture.media("a.mkv", "payload");
        assertTrue(fixture.operations.requestCache(original.toString(), TriggerReason.WATCHLIST, user()).isSuccess());

        OperationResult<IntegrityReport> clean = fixture.operations.verifyIntegrity(admin());
        assertTrue(clean.isSuccess(), clean.toString());
        assertTrue(clean.getValue().isClean());
        assertEquals(1, clean.getValue().getChecked());

        Files.delete(fixture.cachedPathOf(original));
        OperationResult<IntegrityReport> dirty = fixture.operations.verifyIntegrity(admin());
        assertFalse(dirty.getValue().isClean());

        OperationResult<Integer> cleaned = fixture.operations.cleanupOrphans(admin());
        assertEquals(1, cleaned.getValue());
        assertEquals(1, fixture.repository.listByState(RecordState.REMOVED, admin()).size());
        assertEquals(ErrorCode.AUTHORIZATION, fixture.operations.cleanupOrphans(user()).getErrorCode());
    }
}
