package com.xpdustry.lexicon.common.lifecycle;

public interface LifecycleListener {

    default void onLexiconInit() {}

    default void onLexiconExit() {}
}
