package com.example.acgarden.exception;

/**
 * Base type for every failure that aborts an archive run.
 */
public class ArchiveException extends RuntimeException {
    public ArchiveException(String msg) { super(msg); }
    public ArchiveException(String msg, Throwable cause) { super(msg, cause); }
}
