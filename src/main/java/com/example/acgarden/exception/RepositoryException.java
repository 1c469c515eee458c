package com.example.acgarden.exception;

/**
 * Failure opening, staging into or committing to the git repository.
 */
public class RepositoryException extends ArchiveException {
    public RepositoryException(String msg) { super(msg); }
    public RepositoryException(String msg, Throwable cause) { super(msg, cause); }
}
