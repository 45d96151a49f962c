package com.emtech.scan.model;

import java.util.Arrays;
import java.util.Objects;
import java.util.UUID;

/**
 * A document submitted for scanning. Immutable once ingested; the content is defensively copied
 * on the way in and out.
 */
public final class Document {

    private final String id;
    private final String name;
    private final byte[] content;

    public Document(String id, String name, byte[] content) {
        this.id = Objects.requireNonNull(id, "id");
        this.name = name == null || name.isBlank() ? "document" : name;
        this.content = Objects.requireNonNull(content, "content").clone();
    }

    public static Document of(String name, byte[] content) {
        return new Document(UUID.randomUUID().toString(), name, content);
    }

    public String id() {
        return id;
    }

    public String name() {
        return name;
    }

    public byte[] content() {
        return content.clone();
    }

    public int size() {
        return content.length;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof Document document)) {
            return false;
        }
        return id.equals(document.id) && name.equals(document.name) && Arrays.equals(content, document.content);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, name, Arrays.hashCode(content));
    }

    @Override
    public String toString() {
        return "Document[id=" + id + ", name=" + name + ", bytes=" + content.length + "]";
    }
}
