package com.photocheck.sdk.storage;

/** The storage collaborator could not persist a captured frame. */
public class StorageException extends Exception {
    public StorageException(String msg, Throwable cause) { super(msg, cause); }
    public StorageException(String msg) { super(msg); }
}
