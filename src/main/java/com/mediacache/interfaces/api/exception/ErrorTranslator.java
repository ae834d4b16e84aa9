package com.mediacache.interfaces.api.exception;

import com.mediacache.application.exceptions.CacheEngineException;
import com.mediacache.application.exceptions.ErrorCode;
import com.mediacache.domain.model.UserContext;
import com.mediacache.interfaces.api.dto.OperationError;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.owasp.encoder.Encode;

import java.time.Clock;
import java.time.Instant;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Central mapping from exceptions to {@link OperationError}s.
 *
 * Provides:
 * - Security-aware messages (no paths, SQL or stack traces leave the engine)
 * - One log line per failure, tagged with the request id
 * - INTERNAL with a generic message for anything unexpected
 */
@RequiredArgsConstructor
@Slf4j
public class ErrorTranslator {

    static final int MAX_MESSAGE_LENGTH = 200;
    private static final Pattern ABSOLUTE_PATH = Pattern.compile("(?:[A-Za-z]:)?[/\\\\][^\\s:;,'\"]+");
    private static final Pattern CONTROL_CHARACTERS = Pattern.compile("\\p{Cntrl}");

    private final Clock clock;

    public OperationError translate(Throwable failure, UserContext context, String operation) {
        UUID requestId = context != null ? context.getRequestId() : UUID.randomUUID();
        ErrorCode code;
        String message;

        if (failure instanceof CacheEngineException) {
            code = ((CacheEngineException) failure).getCode();
            message = messageFor(code, failure.getMessage());
            if (code == ErrorCode.FILESYSTEM || code == ErrorCode.INTEGRITY || code == ErrorCode.RESOURCE_EXHAUSTED) {
                log.warn("Operation {} failed [{}]: {} - {}", operation, requestId, code,
                    Encode.forJava(String.valueOf(failure.getMessage())));
            } else if (log.isDebugEnabled()) {
                log.debug("Operation {} rejected [{}]: {} - {}", operation, requestId, code,
                    Encode.forJava(String.valueOf(failure.getMessage())));
            }
        } else {
            code = ErrorCode.INTERNAL;
            message = "Internal error; quote request id " + requestId;
            log.error("Unexpected error in {} [{}]", operation, requestId, failure);
        }

        return OperationError.builder()
            .requestId(requestId)
            .timestamp(Instant.now(clock))
            .operation(operation)
            .code(code)
            .message(message)
            .build();
    }

    String messageFor(ErrorCode code, String raw) {
        if (code == ErrorCode.FILESYSTEM) {
            return "Filesystem operation failed; changes were rolled back";
        }
        return sanitize(raw);
    }

    static String sanitize(String raw) {
        if (raw == null || raw.isBlank()) {
            return "Operation failed";
        }
        String cleaned = CONTROL_CHARACTERS.matcher(raw).replaceAll(" ");
        cleaned = ABSOLUTE_PATH.matcher(cleaned).replaceAll("<path>");
        if (cleaned.length() > MAX_MESSAGE_LENGTH) {
            cleaned = cleaned.substring(0, MAX_MESSAGE_LENGTH);
        }
        return cleaned;
    }
}
