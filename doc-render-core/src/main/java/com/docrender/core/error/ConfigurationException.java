package com.docrender.core.error;

/**
 * The render orchestrator is configured in a way that cannot produce output, e.g. without any
 * format or without any writer. Raised before any work begins.
 */
public class ConfigurationException extends DocRenderException {

    private static final long serialVersionUID = 1L;

    public ConfigurationException(String message) {
        super(message);
    }
}
