package com.mediacache.infrastructure.crypto;

import com.mediacache.domain.model.CachedFileRecord;
import lombok.extern.slf4j.Slf4j;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.io.ByteArrayOutputStream;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.util.HexFormat;

/**
 * HMAC-SHA256 record checksums.
 *
 * <p>Every field is written as a 4-byte length followed by its UTF-8 bytes, so no two
 * distinct field tuples share an encoding. Null fields are written with length -1.
 * The key never leaves this class and is never logged.
 */
@Slf4j
public class HmacChecksumService implements ChecksumService {

    public static final int MIN_KEY_LENGTH = 32;
    private static final String ALGORITHM = "HmacSHA256";
    private static final HexFormat HEX = HexFormat.of();

    private final SecretKeySpec key;

    public HmacChecksumService(String secret) {
        if (secret == null || secret.length() < MIN_KEY_LENGTH) {
            throw new IllegalArgumentException(
                "Checksum key must be at least " + MIN_KEY_LENGTH + " characters");
        }
        this.key = new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), ALGORITHM);
        log.info("Record checksums use {}", ALGORITHM);
    }

    @Override
    public String compute(CachedFileRecord record) {
        try {
            Mac mac = Mac.getInstance(ALGORITHM);
            mac.init(key);
            return HEX.formatHex(mac.doFinal(canonicalBytes(record)));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HMAC computation failed", e);
        }
    }

    @Override
    public boolean verify(CachedFileRecord record) {
        String stored = record.getChecksum();
        if (stored == null || stored.isEmpty()) {
            return false;
        }
        byte[] expected = compute(record).getBytes(StandardCharsets.US_ASCII);
        byte[] actual = stored.getBytes(StandardCharsets.US_ASCII);
        return MessageDigest.isEqual(expected, actual);
    }

    private static byte[] canonicalBytes(CachedFileRecord record) {
        ByteArrayOutputStream out = new ByteArrayOutputStream(256);
        writeField(out, record.getId());
        writeField(out, record.getOriginalPath() == null ? null : record.getOriginalPath().toString());
        writeField(out, record.getCachedPath() == null ? null : record.getCachedPath().toString());
        writeField(out, record.getFilename());
        writeField(out, record.getMethod() == null ? null : record.getMethod().getDbValue());
        writeField(out, Long.toString(record.getSizeBytes()));
        writeField(out, record.getState() == null ? null : record.getState().name());
        writeField(out, record.getTriggerReason() == null ? null : record.getTriggerReason().getDbValue());
        writeField(out, record.getAddedBy());
        writeField(out, record.getCreatedAt() == null ? null : Long.toString(record.getCreatedAt().toEpochMilli()));
        writeField(out, record.getFailureReason());
        return out.toByteArray();
    }

    private static void writeField(ByteArrayOutputStream out, String value) {
        if (value == null) {
            out.writeBytes(ByteBuffer.allocate(4).putInt(-1).array());
            return;
        }
        byte[] bytes = value.getBytes(StandardCharsets.UTF_8);
        out.writeBytes(ByteBuffer.allocate(4).putInt(bytes.length).array());
        out.writeBytes(bytes);
    }
}
