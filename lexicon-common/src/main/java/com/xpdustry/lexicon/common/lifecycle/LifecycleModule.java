package com.xpdustry.lexicon.common.lifecycle;

import com.xpdustry.lexicon.common.factory.ObjectBinder;
import com.xpdustry.lexicon.common.factory.ObjectModule;

public final class LifecycleModule implements ObjectModule {

    @Override
    public void configure(final ObjectBinder binder) {
        binder.bind(LifecycleService.class).toImpl(LifecycleServiceImpl.class);
    }
}
