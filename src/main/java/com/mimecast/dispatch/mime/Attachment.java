package com.mimecast.dispatch.mime;

/**
 * Message attachment.
 *
 * @param filename    File name.
 * @param contentType MIME type.
 * @param content     Raw bytes.
 */
public record Attachment(String filename, String contentType, byte[] content) {

    public Attachment {
        contentType = contentType != null ? contentType : "application/octet-stream";
        content = content != null ? content.clone() : new byte[0];
    }

    @Override
    public byte[] content() {
        return content.clone();
    }

    @Override
    public String toString() {
        return "Attachment{" + filename + ", " + contentType + ", " + content.length + " bytes}";
    }
}
