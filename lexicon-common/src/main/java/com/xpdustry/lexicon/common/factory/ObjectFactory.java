package com.xpdustry.lexicon.common.factory;

import java.util.List;
import org.jspecify.annotations.Nullable;

public interface ObjectFactory {

    static ObjectFactory create(final ObjectModule... modules) {
        return new GuiceObjectFactory(modules);
    }

    <T> T get(final Class<T> type, final @Nullable String name);

    default <T> T get(final Class<T> type) {
        return get(type, null);
    }

    /**
     * Returns the eagerly created singletons assignable to the given type, in creation order.
     */
    <T> List<T> collect(final Class<T> type);
}
