package com.example.acgarden.exception;

/**
 * Malformed JSON, either from the submissions API or from a persisted submission.json.
 */
public class DecodeException extends ArchiveException {
    public DecodeException(String msg) { super(msg); }
    public DecodeException(String msg, Throwable cause) { super(msg, cause); }
}
