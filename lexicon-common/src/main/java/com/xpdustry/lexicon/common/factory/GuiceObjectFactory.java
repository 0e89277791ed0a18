package com.xpdustry.lexicon.common.factory;

import com.google.inject.AbstractModule;
import com.google.inject.CreationException;
import com.google.inject.Guice;
import com.google.inject.Injector;
import com.google.inject.Key;
import com.google.inject.PrivateBinder;
import com.google.inject.PrivateModule;
import com.google.inject.Stage;
import com.google.inject.binder.LinkedBindingBuilder;
import com.google.inject.matcher.Matchers;
import com.google.inject.name.Names;
import com.google.inject.spi.ProvisionListener;
import jakarta.inject.Provider;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import org.jspecify.annotations.Nullable;

final class GuiceObjectFactory implements ObjectFactory, ProvisionListener {

    private final Injector injector;
    private final List<Object> provisioned = new CopyOnWriteArrayList<>();

    @SuppressWarnings("UnusedAssignment")
    private boolean initialized = false;

    GuiceObjectFactory(final ObjectModule... modules) {
        try {
            this.injector = Guice.createInjector(Stage.PRODUCTION, new InternalObjectFactoryModule(List.of(modules)));
        } catch (final CreationException e) {
            throw new ObjectFactoryInitializationException(
                    "Failed to create the object graph of " + modules.length + " modules", e);
        }
        this.initialized = true;
    }

    @Override
    public <T> T get(final Class<T> type, final @Nullable String name) {
        return this.injector.getInstance(name == null ? Key.get(type) : Key.get(type, Names.named(name)));
    }

    @Override
    public <T> List<T> collect(final Class<T> type) {
        if (!this.initialized) {
            throw new IllegalStateException("You cannot collect objects while initializing");
        }
        return this.provisioned.stream()
                .filter(type::isInstance)
                .map(type::cast)
                .distinct()
                .toList();
    }

    @Override
    public <T> void onProvision(final ProvisionInvocation<T> provision) {
        if (!this.initialized) {
            this.provisioned.add(provision.provision());
        }
    }

    private final class InternalObjectFactoryModule extends AbstractModule {

        private final List<ObjectModule> modules;

        private InternalObjectFactoryModule(final List<ObjectModule> modules) {
            this.modules = modules;
        }

        @Override
        protected void configure() {
            this.binder().skipSources(InternalObjectFactoryModule.class, ObjectModuleAdapter.class);
            this.binder().bindListener(Matchers.any(), GuiceObjectFactory.this);
            this.binder().disableCircularProxies();
            this.binder().bind(ObjectFactory.class).toInstance(GuiceObjectFactory.this);
            for (final var module : this.modules) {
                this.install(new ObjectModuleAdapter(module));
            }
        }
    }

    private static final class ObjectModuleAdapter extends PrivateModule {

        private final ObjectModule module;

        private ObjectModuleAdapter(final ObjectModule module) {
            this.module = module;
        }

        @Override
        protected void configure() {
            this.module.configure(new GuiceObjectBinder(this.binder()));
        }
    }

    private record GuiceObjectBinder(PrivateBinder binder) implements ObjectBinder {

        @Override
        public <T> BindingBuilder<T> bind(final Class<T> type) {
            return new GuiceBindingBuilder<>(type);
        }

        private final class GuiceBindingBuilder<T> implements BindingBuilder<T> {

            private Key<T> key;

            private GuiceBindingBuilder(final Class<T> type) {
                this.key = Key.get(type);
            }

            @Override
            public BindingBuilder<T> named(final @Nullable String name) {
                this.key = name == null ? this.key.withoutAttributes() : this.key.withAnnotation(Names.named(name));
                return this;
            }

            @Override
            public void toImpl(final Class<? extends T> type) {
                this.exposed().to(type).asEagerSingleton();
            }

            @Override
            public void toInst(final T instance) {
                this.exposed().toInstance(instance);
            }

            @Override
            public void toProv(final Class<? extends Provider<? extends T>> prov) {
                this.exposed().toProvider(prov).asEagerSingleton();
            }

            @Override
            public void toProv(final Provider<? extends T> prov) {
                this.exposed().toProvider(prov).asEagerSingleton();
            }

            // Each module is private, the key is exposed so other modules can inject it
            private LinkedBindingBuilder<T> exposed() {
                final var builder = GuiceObjectBinder.this.binder.bind(this.key);
                GuiceObjectBinder.this.binder.expose(this.key);
                return builder;
            }
        }
    }
}
