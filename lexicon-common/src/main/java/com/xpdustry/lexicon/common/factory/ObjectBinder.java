package com.xpdustry.lexicon.common.factory;

import jakarta.inject.Provider;
import org.jspecify.annotations.Nullable;

/**
 * Declares the objects an {@link ObjectModule} contributes to the factory. Every binding is visible to the other
 * modules, and bindings to an implementation or a provider are eager singletons, so they show up in
 * {@link ObjectFactory#collect(Class)}.
 */
public interface ObjectBinder {

    <T> BindingBuilder<T> bind(final Class<T> type);

    interface BindingBuilder<T> {

        /** Qualifies the binding with {@code @Named(name)}, or removes the qualifier when {@code null}. */
        BindingBuilder<T> named(final @Nullable String name);

        void toImpl(final Class<? extends T> impl);

        void toInst(final T inst);

        void toProv(final Class<? extends Provider<? extends T>> prov);

        void toProv(final Provider<? extends T> prov);
    }
}
