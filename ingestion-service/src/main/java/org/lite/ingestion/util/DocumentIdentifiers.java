package org.lite.ingestion.util;

/**
 * Keys of documents in the content index.
 */
public final class DocumentIdentifiers {

    private DocumentIdentifiers() {
    }

    /**
     * Identifier of a document in the content index: {@code <contractId>_<filename>}.
     * Depends only on where the document belongs, never on its content.
     */
    public static String of(String contractId, String filename) {
        if (contractId == null || contractId.isBlank()) {
            throw new IllegalArgumentException("contractId is required");
        }
        if (filename == null || filename.isBlank()) {
            throw new IllegalArgumentException("filename is required");
        }
        return contractId + "_" + filename;
    }

    /**
     * Filename for a document discovered on a contract: {@code <noticeId>_<last URL segment>}.
     */
    public static String filenameFor(String noticeId, String url) {
        String path = url;
        int query = path.indexOf('?');
        if (query >= 0) {
            path = path.substring(0, query);
        }
        while (path.endsWith("/")) {
            path = path.substring(0, path.length() - 1);
        }
        String segment = path.substring(path.lastIndexOf('/') + 1);
        if (segment.isBlank()) {
            segment = "document";
        }
        return noticeId + "_" + segment;
    }
}
