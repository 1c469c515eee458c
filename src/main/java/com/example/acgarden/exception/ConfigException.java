package com.example.acgarden.exception;

/**
 * Missing, unreadable or malformed settings record.
 */
public class ConfigException extends ArchiveException {
    public ConfigException(String msg) { super(msg); }
    public ConfigException(String msg, Throwable cause) { super(msg, cause); }
}
