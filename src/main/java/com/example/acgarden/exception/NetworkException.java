package com.example.acgarden.exception;

/**
 * Transport failure or unexpected HTTP status talking to the judge or the submissions API.
 */
public class NetworkException extends ArchiveException {
    public NetworkException(String msg) { super(msg); }
    public NetworkException(String msg, Throwable cause) { super(msg, cause); }
}
