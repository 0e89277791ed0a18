package com.xpdustry.lexicon.common.config;

import com.google.common.base.Preconditions;
import org.spongepowered.configurate.objectmapping.ConfigSerializable;

/** The root of {@code lexicon.yml}. */
@ConfigSerializable
public record LexiconConfig(BulkInsertConfig bulk) {

    public static final LexiconConfig DEFAULT = new LexiconConfig(BulkInsertConfig.DEFAULT);

    public LexiconConfig {
        Preconditions.checkNotNull(bulk, "bulk");
    }
}
