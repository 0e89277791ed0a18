package com.xpdustry.lexicon.common.bulk;

import com.xpdustry.lexicon.common.factory.ObjectBinder;
import com.xpdustry.lexicon.common.factory.ObjectModule;

public final class BulkInsertModule implements ObjectModule {

    @Override
    public void configure(final ObjectBinder binder) {
        binder.bind(BulkInsertWorker.class).toImpl(ExecutorBulkInsertWorker.class);
        binder.bind(BulkInsertService.class).toImpl(BulkInsertServiceImpl.class);
    }
}
