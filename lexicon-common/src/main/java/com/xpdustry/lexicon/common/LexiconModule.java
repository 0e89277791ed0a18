package com.xpdustry.lexicon.common;

import com.xpdustry.lexicon.common.config.LexiconConfig;
import com.xpdustry.lexicon.common.config.LexiconConfigProvider;
import com.xpdustry.lexicon.common.factory.ObjectBinder;
import com.xpdustry.lexicon.common.factory.ObjectModule;
import java.nio.file.Path;

public final class LexiconModule implements ObjectModule {

    private final Path directory;

    public LexiconModule(final Path directory) {
        this.directory = directory;
    }

    @Override
    public void configure(final ObjectBinder binder) {
        binder.bind(Path.class).named("directory").toInst(this.directory);
        binder.bind(LexiconConfig.class).toProv(LexiconConfigProvider.class);
    }
}
