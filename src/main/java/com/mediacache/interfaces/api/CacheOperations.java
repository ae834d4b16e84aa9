package com.mediacache.interfaces.api;

import com.mediacache.application.AtomicRelocator;
import com.mediacache.application.IntegrityChecker;
import com.mediacache.application.IntegrityReport;
import com.mediacache.application.RelocationHandle;
import com.mediacache.application.RelocationMetrics;
import com.mediacache.application.RelocationOutcome;
import com.mediacache.application.RelocationSettings;
import com.mediacache.application.exceptions.RateLimitException;
import com.mediacache.application.exceptions.ValidationException;
import com.mediacache.domain.model.CacheStatistics;
import com.mediacache.domain.model.CachedFileRecord;
import com.mediacache.domain.model.CachedFilesFilter;
import com.mediacache.domain.model.Permission;
import com.mediacache.domain.model.RecordState;
import com.mediacache.domain.model.SecurityEvent;
import com.mediacache.domain.model.SecurityEventFilter;
import com.mediacache.domain.model.TriggerReason;
import com.mediacache.domain.model.UserContext;
import com.mediacache.domain.repository.CacheRepository;
import com.mediacache.domain.repository.SecurityEventRepository;
import com.mediacache.infrastructure.filesystem.PathExistenceOracle;
import com.mediacache.infrastructure.filesystem.SubtitleFinder;
import com.mediacache.infrastructure.security.AuthorizationManager;
import com.mediacache.infrastructure.security.RateLimiter;
import com.mediacache.interfaces.api.dto.CacheDecision;
import com.mediacache.interfaces.api.dto.DecisionOutcome;
import com.mediacache.interfaces.api.dto.DesiredState;
import com.mediacache.interfaces.api.dto.OperationResult;
import com.mediacache.interfaces.api.exception.ErrorTranslator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;
import java.util.regex.Pattern;

/**
 * The engine's public operation surface for the scheduler and the dashboard.
 *
 * <p>Every operation authorizes the caller, then consumes one unit of the caller's rate
 * limit, then runs. Nothing here throws: failures come back as typed
 * {@link OperationResult} errors.
 */
@RequiredArgsConstructor
@Slf4j
public class CacheOperations {

    static final int MAX_DECISIONS = 1000;
    private static final Pattern SEARCH_TERM = Pattern.compile("[A-Za-z0-9._\\- ()\\[\\]/]{1,255}");

    private final AtomicRelocator relocator;
    private final CacheRepository repository;
    private final SecurityEventRepository securityEvents;
    private final IntegrityChecker integrityChecker;
    private final AuthorizationManager authorization;
    private final RateLimiter rateLimiter;
    private final PathExistenceOracle existence;
    private final SubtitleFinder subtitles;
    private final RelocationSettings settings;
    private final RelocationMetrics metrics;
    private final ErrorTranslator errors;

    public OperationResult<RelocationOutcome> requestCache(String path, TriggerReason reason, UserContext context) {
        return execute("requestCache", context, Permission.WRITE,
            () -> relocator.cache(path, reason, context));
    }

    /**
     * Queue a cache request and return at once. The handle reports progress and allows
     * cancellation until staging begins.
     */
    public OperationResult<RelocationHandle> submitCache(String path, TriggerReason reason, UserContext context) {
        return execute("submitCache", context, Permission.WRITE,
            () -> relocator.submitCache(path, reason, context));
    }

    public OperationResult<RelocationOutcome> requestRelease(String path, UserContext context) {
        return execute("requestRelease", context, Permission.DELETE,
            () -> relocator.release(path, context));
    }

    public OperationResult<Optional<CachedFileRecord>> getStatus(String path, UserContext context) {
        return execute("getStatus", context, Permission.READ, () -> {
            Path original = relocator.validateOriginal(path, context, "getStatus");
            return repository.findByOriginalPath(original, context);
        });
    }

    public OperationResult<List<CachedFileRecord>> getStatus(CachedFilesFilter filter, UserContext context) {
        return execute("listStatus", context, Permission.READ, () -> {
            CachedFilesFilter effective = filter != null ? filter : CachedFilesFilter.all();
            if (effective.getSearch() != null && !effective.getSearch().isEmpty()
                && !SEARCH_TERM.matcher(effective.getSearch()).matches()) {
                throw new ValidationException("Search term contains invalid characters");
            }
            return repository.search(effective, context);
        });
    }

    public OperationResult<CacheStatistics> getStatistics(UserContext context) {
        return execute("getStatistics", context, Permission.READ, () -> repository.statistics(context));
    }

    public OperationResult<IntegrityReport> verifyIntegrity(UserContext context) {
        return execute("verifyIntegrity", context, Permission.ADMIN, () -> integrityChecker.verify(context));
    }

    public OperationResult<Integer> cleanupOrphans(UserContext context) {
        return execute("cleanupOrphans", context, Permission.ADMIN, () -> integrityChecker.cleanupOrphans(context));
    }

    /**
     * Delete REMOVED records last updated longer than {@code olderThan} ago.
     */
    public OperationResult<Integer> purgeRemoved(Duration olderThan, UserContext context) {
        return execute("purgeRemoved", context, Permission.ADMIN, () -> repository.purgeRemoved(olderThan, context));
    }

    public OperationResult<List<SecurityEvent>> getSecurityEvents(SecurityEventFilter filter, UserContext context) {
        return execute("getSecurityEvents", context, Permission.ADMIN, () -> securityEvents.find(filter, context));
    }

    /**
     * Execute a batch of catalog decisions on the relocation pool. Absent paths are skipped.
     * The batch as a whole consumes one rate-limit unit; each item reports its own result.
     *
     * <p>When subtitles are included, the sidecars of each media file follow its decision.
     * Their outcomes are appended after the outcomes of the submitted decisions. A sidecar is
     * only released when it has a committed record.
     */
    public OperationResult<List<DecisionOutcome>> applyDecisions(List<CacheDecision> decisions, UserContext context) {
        return execute("applyDecisions", context, Permission.WRITE, () -> {
            if (decisions == null) {
                throw new ValidationException("Decisions are required");
            }
            if (decisions.size() > MAX_DECISIONS) {
                throw new ValidationException("At most " + MAX_DECISIONS + " decisions per batch");
            }

            List<CacheDecision> items = new ArrayList<>(decisions);
            Set<String> seen = new HashSet<>();
            decisions.forEach(decision -> seen.add(decision.getOriginalPath()));
            List<DecisionOutcome> outcomes = new ArrayList<>(items.size());
            List<RelocationHandle> handles = new ArrayList<>(items.size());
            for (int index = 0; index < items.size(); index++) {
                CacheDecision decision = items.get(index);
                handles.add(null);
                outcomes.add(null);
                try {
                    Path original = relocator.validateOriginal(decision.getOriginalPath(), context, "applyDecisions");
                    if (!existence.exists(original)) {
                        outcomes.set(index, outcome(decision, DecisionOutcome.Status.SKIPPED));
                        continue;
                    }
                    if (index < decisions.size() && settings.isIncludeSubtitles()) {
                        for (CacheDecision sidecar : sidecarDecisions(decision, original, context)) {
                            if (seen.add(sidecar.getOriginalPath())) {
                                items.add(sidecar);
                            }
                        }
                    }
                    handles.set(index, decision.getDesiredState() == DesiredState.RELEASED
                        ? relocator.submitRelease(original.toString(), context)
                        : relocator.submitCache(original.toString(), decision.getReason(), context));
                } catch (RuntimeException e) {
                    outcomes.set(index, failed(decision, e, context));
                }
            }

            for (int i = 0; i < items.size(); i++) {
                RelocationHandle handle = handles.get(i);
                if (handle == null) {
                    continue;
                }
                CacheDecision decision = items.get(i);
                try {
                    RelocationOutcome result = handle.await(settings.getOperationTimeout());
                    outcomes.set(i, outcome(decision, result.isCancelled() ? DecisionOutcome.Status.CANCELLED
                        : result.isNoop() ? DecisionOutcome.Status.NOOP : DecisionOutcome.Status.APPLIED));
                } catch (RuntimeException e) {
                    outcomes.set(i, failed(decision, e, context));
                }
            }
            log.info("Applied {} catalog decisions ({} subtitle sidecars)", decisions.size(),
                items.size() - decisions.size());
            return outcomes;
        });
    }

    private List<CacheDecision> sidecarDecisions(CacheDecision decision, Path media, UserContext context) {
        List<CacheDecision> sidecars = new ArrayList<>();
        for (Path subtitle : subtitles.findSubtitles(media)) {
            if (decision.getDesiredState() == DesiredState.RELEASED) {
                boolean committed = repository.findByOriginalPath(subtitle, context)
                    .map(record -> record.getState() == RecordState.COMMITTED)
                    .orElse(false);
                if (committed) {
                    sidecars.add(CacheDecision.release(subtitle.toString()));
                }
            } else {
                sidecars.add(CacheDecision.cache(subtitle.toString(), decision.getReason()));
            }
        }
        return sidecars;
    }

    private <T> OperationResult<T> execute(String operation, UserContext context, Permission permission,
                                           Supplier<T> work) {
        try {
            authorization.authorize(context, permission, operation);
            try {
                rateLimiter.acquire(context, operation);
            } catch (RateLimitException e) {
                metrics.recordRateLimited();
                throw e;
            }
            return OperationResult.success(work.get());
        } catch (RuntimeException e) {
            return OperationResult.failure(errors.translate(e, context, operation));
        }
    }

    private static DecisionOutcome outcome(CacheDecision decision, DecisionOutcome.Status status) {
        return new DecisionOutcome(decision.getOriginalPath(), decision.getDesiredState(), status, null);
    }

    private DecisionOutcome failed(CacheDecision decision, RuntimeException e, UserContext context) {
        return new DecisionOutcome(decision.getOriginalPath(), decision.getDesiredState(),
            DecisionOutcome.Status.FAILED, errors.translate(e, context, "applyDecisions"));
    }
}
