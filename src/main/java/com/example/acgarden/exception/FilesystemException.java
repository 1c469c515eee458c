package com.example.acgarden.exception;

/**
 * Directory or file creation, read or write failure under the archive root.
 */
public class FilesystemException extends ArchiveException {
    public FilesystemException(String msg) { super(msg); }
    public FilesystemException(String msg, Throwable cause) { super(msg, cause); }
}
