package com.adobe.daiji.exception;

/**
 * Exception thrown when a daiji unit-name or glyph table is rejected.
 * 
 * <p>Raised synchronously while a {@link com.adobe.daiji.converter.DaijiConfiguration}
 * is being built, so a misconfigured application fails at startup rather
 * than on the first request.</p>
 *
 * @author Adobe AEM Engineering Assessment
 * @version 1.0.0
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }
}
