package com.xpdustry.lexicon.common.factory;

@SuppressWarnings("serial")
public final class ObjectFactoryInitializationException extends RuntimeException {

    public ObjectFactoryInitializationException(final String message, final Exception cause) {
        super(message, cause);
    }
}
