package com.delta.gapreview.collab;

public interface TargetSpecResolver {

    /**
     * Inline text wins over the reference. Fails with {@code not_found} when neither yields text.
     */
    String fetchTargetSpec(String targetRef, String inlineText);
}
