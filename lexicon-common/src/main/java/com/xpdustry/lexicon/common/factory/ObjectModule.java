package com.xpdustry.lexicon.common.factory;

@FunctionalInterface
public interface ObjectModule {

    void configure(final ObjectBinder binder);
}
