package com.xpdustry.lexicon.common.config;

@SuppressWarnings("serial")
public final class ConfigLoadingException extends RuntimeException {

    public ConfigLoadingException(final String message, final Exception cause) {
        super(message, cause);
    }
}
