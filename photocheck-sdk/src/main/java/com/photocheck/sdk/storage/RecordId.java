package com.photocheck.sdk.storage;

/** Opaque id returned by the storage collaborator for a persisted capture. */
public final class RecordId {

    public final String value;

    public RecordId(String value) {
        if (value == null || value.isEmpty()) {
            throw new IllegalArgumentException("record id must not be empty");
        }
        this.value = value;
    }

    @Override public boolean equals(Object o) {
        return o instanceof RecordId && value.equals(((RecordId) o).value);
    }

    @Override public int hashCode() { return value.hashCode(); }

    @Override public String toString() { return value; }
}
