package com.mediacache.interfaces.api.exception;

import com.mediacache.application.exceptions.ErrorCode;
import com.mediacache.application.exceptions.FilesystemException;
import com.mediacache.application.exceptions.IntegrityException;
import com.mediacache.application.exceptions.OperationCancelledException;
import com.mediacache.application.exceptions.ValidationException;
import com.mediacache.domain.model.Role;
import com.mediacache.domain.model.UserContext;
import com.mediacache.interfaces.api.dto.OperationError;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

class ErrorTranslatorTest {

    private static final Instant NOW = Instant.parse("2026-01-01T12:00:00Z");

    private final ErrorTranslator translator = new ErrorTranslator(Clock.fixed(NOW, ZoneOffset.UTC));
    private final UserContext context = UserContext.of("bob", Role.USER);

    @Test
    void engine_exception_keeps_its_code_and_request_id() {
        OperationError error = translator.translate(new ValidationException("Filename too long"), context, "requestCache");

        assertEquals(ErrorCode.VALIDATION, error.getCode());
        assertEquals("Filename too long", error.getMessage());
        assertEquals(context.getRequestId(), error.getRequestId());
        assertEquals("requestCache", error.getOperation());
        assertEquals(NOW, error.getTimestamp());
        assertTrue(error.isRetryableAfterCorrection());
    }

    @Test
    void absolute_paths_are_masked() {
        OperationError error = translator.translate(
            new IntegrityException("Checksum mismatch for /mnt/cache/media/secret.mkv"), context, "verify");

        assertEquals("Checksum mismatch for <path>", error.getMessage());
        assertFalse(error.isRetryableAfterCorrection());
    }

    @Test
    void filesystem_failures_get_a_generic_message() {
        OperationError error = translator.translate(
            new FilesystemException("rename /media/a.mkv failed: EXDEV"), context, "requestCache");

        assertEquals(ErrorCode.FILESYSTEM, error.getCode());
        assertEquals("Filesystem operation failed; changes were rolled back", error.getMessage());
    }

    @Test
    void unexpected_exceptions_become_internal() {
        OperationError error = translator.translate(
            new IllegalStateException("SQLITE_CORRUPT at /var/db/media-cache.db"), context, "getStatistics");

        assertEquals(ErrorCode.INTERNAL, error.getCode());
        assertEquals("Internal error; quote request id " + context.getRequestId(), error.getMessage());
        assertFalse(error.getMessage().contains("SQLITE"));
    }

    @Test
    void cancellation_maps_to_cancelled() {
        OperationError error = translator.translate(
            new OperationCancelledException("Interrupted while waiting"), context, "requestCache");

        assertEquals(ErrorCode.CANCELLED, error.getCode());
    }

    @Test
    void missing_context_still_gets_a_request_id() {
        OperationError error = translator.translate(new ValidationException("bad"), null, "getStatus");

        assertNotNull(error.getRequestId());
    }

    @Test
    void control_characters_are_flattened_and_length_capped() {
        assertEquals("line one line two", ErrorTranslator.sanitize("line one\nline two"));
        assertEquals("a b", ErrorTranslator.sanitize("a\u0000b"));
        assertEquals(ErrorTranslator.MAX_MESSAGE_LENGTH, ErrorTranslator.sanitize("x".repeat(500)).length());
        assertEquals("Operation failed", ErrorTranslator.sanitize("  "));
        assertEquals("Operation failed", ErrorTranslator.sanitize(null));
    }
}
