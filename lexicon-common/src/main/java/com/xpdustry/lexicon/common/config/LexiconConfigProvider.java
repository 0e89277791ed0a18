package com.xpdustry.lexicon.common.config;

import jakarta.inject.Inject;
import jakarta.inject.Named;
import jakarta.inject.Provider;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.spongepowered.configurate.CommentedConfigurationNode;
import org.spongepowered.configurate.ConfigurateException;
import org.spongepowered.configurate.ConfigurationOptions;
import org.spongepowered.configurate.objectmapping.ObjectMapper;
import org.spongepowered.configurate.util.NamingSchemes;
import org.spongepowered.configurate.yaml.NodeStyle;
import org.spongepowered.configurate.yaml.YamlConfigurationLoader;

/**
 * Loads the configuration from {@code lexicon.yml} in the working directory. The bundled {@code lexicon.yml} is
 * merged in as the default node, so the file only needs the keys it changes.
 */
public final class LexiconConfigProvider implements Provider<LexiconConfig> {

    static final String FILE_NAME = "lexicon.yml";

    private static final Logger LOGGER = LoggerFactory.getLogger(LexiconConfigProvider.class);
    private static final String DEFAULTS = "/com/xpdustry/lexicon/common/config/" + FILE_NAME;
    private static final ObjectMapper.Factory MAPPER = ObjectMapper.factoryBuilder()
            .defaultNamingScheme(NamingSchemes.LOWER_CASE_DASHED)
            .build();

    private final Path directory;

    @Inject
    public LexiconConfigProvider(final @Named("directory") Path directory) {
        this.directory = directory;
    }

    @Override
    public LexiconConfig get() {
        final CommentedConfigurationNode defaults;
        try {
            defaults = YamlConfigurationLoader.builder()
                    .url(Objects.requireNonNull(
                            LexiconConfigProvider.class.getResource(DEFAULTS), "Missing bundled lexicon defaults"))
                    .defaultOptions(LexiconConfigProvider::options)
                    .build()
                    .load();
        } catch (final ConfigurateException e) {
            throw new ConfigLoadingException("Failed to load bundled defaults", e);
        }

        final var file = this.directory.resolve(FILE_NAME);
        try {
            final CommentedConfigurationNode root;
            if (Files.exists(file)) {
                root = YamlConfigurationLoader.builder()
                        .path(file)
                        .nodeStyle(NodeStyle.BLOCK)
                        .defaultOptions(LexiconConfigProvider::options)
                        .build()
                        .load()
                        .mergeFrom(defaults);
                LOGGER.info("Loaded configuration from {}", file);
            } else {
                LOGGER.debug("No configuration found at {}, using defaults", file);
                root = defaults;
            }
            return Objects.requireNonNull(root.get(LexiconConfig.class), "Empty lexicon configuration");
        } catch (final ConfigurateException e) {
            throw new ConfigLoadingException("Invalid configuration in " + file, e);
        } catch (final IllegalArgumentException e) {
            // Values rejected by the config records themselves
            throw new ConfigLoadingException("Invalid configuration in " + file + ": " + e.getMessage(), e);
        }
    }

    private static ConfigurationOptions options(final ConfigurationOptions options) {
        return options.serializers(builder -> builder.register(Duration.class, DurationSerializer.INSTANCE)
                .registerAnnotatedObjects(MAPPER));
    }
}
