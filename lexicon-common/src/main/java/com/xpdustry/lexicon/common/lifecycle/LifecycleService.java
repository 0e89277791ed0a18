package com.xpdustry.lexicon.common.lifecycle;

import java.util.Collection;

public interface LifecycleService {

    void addListener(final LifecycleListener listener);

    void load();

    /**
     * Exits the loaded listeners in reverse loading order. Only the first call has an effect.
     *
     * @return {@code true} if every listener exited cleanly
     */
    boolean exit();

    Collection<LifecycleListener> listeners();
}
