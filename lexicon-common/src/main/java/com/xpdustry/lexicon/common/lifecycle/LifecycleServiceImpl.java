package com.xpdustry.lexicon.common.lifecycle;

import com.google.common.collect.Lists;
import com.xpdustry.lexicon.common.factory.ObjectFactory;
import jakarta.inject.Inject;
import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

final class LifecycleServiceImpl implements LifecycleService {

    private static final Logger LOGGER = LoggerFactory.getLogger(LifecycleServiceImpl.class);

    private final Deque<LifecycleListener> toLoad = new ArrayDeque<>();
    private final Deque<LifecycleListener> loaded = new ArrayDeque<>();
    private final AtomicBoolean exited = new AtomicBoolean(false);

    private final ObjectFactory factory;

    @Inject
    public LifecycleServiceImpl(final ObjectFactory factory) {
        this.factory = factory;
    }

    @Override
    public void addListener(final LifecycleListener listener) {
        this.toLoad.add(listener);
    }

    @Override
    public void load() {
        for (final var listener : Lists.reverse(this.factory.collect(LifecycleListener.class))) {
            if (!this.loaded.contains(listener) && !this.toLoad.contains(listener)) {
                this.toLoad.addFirst(listener);
            }
        }
        try {
            while (!this.toLoad.isEmpty()) {
                final var listener = this.toLoad.removeFirst();
                listener.onLexiconInit();
                this.loaded.addFirst(listener);
            }
            LOGGER.debug("Loaded {} lifecycle listeners", this.loaded.size());
        } catch (final RuntimeException exception) {
            this.exit();
            throw exception;
        }
    }

    @Override
    public boolean exit() {
        if (this.exited.getAndSet(true)) {
            return true;
        }

        var clean = true;
        for (final var listener : this.loaded) {
            try {
                listener.onLexiconExit();
            } catch (final Exception e) {
                LOGGER.error("Failed to exit listener {}", listener.getClass().getSimpleName(), e);
                clean = false;
            }
        }
        return clean;
    }

    @Override
    public Collection<LifecycleListener> listeners() {
        return Collections.unmodifiableCollection(this.loaded);
    }
}
