package com.mediacache.application.exceptions;

/**
 * I/O failure during relocation. Always raised after rollback has been attempted.
 */
public class FilesystemException extends CacheEngineException {

    public FilesystemException(String message) {
        super(ErrorCode.FILESYSTEM, message);
    }

    public FilesystemException(String message, Throwable cause) {
        super(ErrorCode.FILESYSTEM, message, cause);
    }
}
