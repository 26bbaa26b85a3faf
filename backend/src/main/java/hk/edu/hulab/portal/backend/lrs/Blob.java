package hk.edu.hulab.portal.backend.lrs;

/**
 * Stored blob content with the store's opaque version tag.
 */
public record Blob(byte[] content, String etag) {
}
