package com.delta.gapreview.collab;

public interface DocumentSource {

    /**
     * @throws com.delta.gapreview.error.DocumentNotFoundException when the reference is unknown
     * @throws com.delta.gapreview.error.DocumentSizeExceededException when the text is too large
     */
    String fetchSourceText(String documentRef);
}
