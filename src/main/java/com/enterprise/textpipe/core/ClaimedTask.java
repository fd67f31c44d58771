package com.enterprise.textpipe.core;

import java.util.Objects;

/**
 * A task handed to exactly one worker by a claim: its id and the submitted document
 */
public final class ClaimedTask {

    private final String id;
    private final String document;

    public ClaimedTask(String id, String document) {
        this.id = Objects.requireNonNull(id, "id");
        this.document = Objects.requireNonNull(document, "document");
    }

    public String getId() { return id; }
    public String getDocument() { return document; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ClaimedTask that = (ClaimedTask) o;
        return id.equals(that.id) && document.equals(that.document);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, document);
    }

    @Override
    public String toString() {
        return "ClaimedTask{id='" + id + "', length=" + document.length() + "}";
    }
}
