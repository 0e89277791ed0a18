package com.xpdustry.lexicon.common.config;

import java.lang.reflect.Type;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.function.Predicate;
import org.spongepowered.configurate.serialize.ScalarSerializer;
import org.spongepowered.configurate.serialize.SerializationException;

/** Reads and writes durations in their ISO-8601 form, such as {@code PT30S}. */
final class DurationSerializer extends ScalarSerializer<Duration> {

    static final DurationSerializer INSTANCE = new DurationSerializer();

    private DurationSerializer() {
        super(Duration.class);
    }

    @Override
    public Duration deserialize(final Type type, final Object obj) throws SerializationException {
        try {
            return Duration.parse(obj.toString().trim());
        } catch (final DateTimeParseException ignored) {
            throw new SerializationException("Expected an ISO-8601 duration such as PT30S, got " + obj);
        }
    }

    @Override
    protected Object serialize(final Duration item, final Predicate<Class<?>> typeSupported) {
        return item.toString();
    }
}
