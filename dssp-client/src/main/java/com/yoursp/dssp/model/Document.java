package com.yoursp.dssp.model;

import lombok.Getter;

import java.io.IOException;
import java.io.InputStream;
import java.util.Objects;

/**
 * A document exchanged with the signing service: content, MIME type and an
 * optional identifier.
 * <p>
 * The content is copied on construction and on read, so a document never
 * shares its buffer with the caller.
 * </p>
 */
@Getter
public class Document {

    private final String id;
    private final String mimeType;
    private final byte[] content;

    public Document(String mimeType, byte[] content) {
        this(null, mimeType, content);
    }

    public Document(String id, String mimeType, byte[] content) {
        this.id = id;
        this.mimeType = Objects.requireNonNull(mimeType, "mimeType");
        this.content = Objects.requireNonNull(content, "content").clone();
    }

    /**
     * Reads the stream to its end. The stream is not closed.
     */
    public static Document of(String mimeType, InputStream content) throws IOException {
        Objects.requireNonNull(content, "content");
        return new Document(mimeType, content.readAllBytes());
    }

    public byte[] getContent() {
        return content.clone();
    }

    public int getSize() {
        return content.length;
    }
}
