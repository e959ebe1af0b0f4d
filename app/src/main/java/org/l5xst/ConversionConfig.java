package org.l5xst;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;

import com.google.gson.Gson;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Immutable settings shared by every translator and emitter of one run.
 *
 * <p>Defaults come from {@code l5xst-defaults.json} on the classpath; a user file may
 * override any top-level key.
 */
public record ConversionConfig(
    String programName,
    String configurationName,
    String resourceName,
    String resourceTarget,
    String taskName,
    String taskInterval,
    int taskPriority,
    String programInstance,
    String sourceProgramName,
    String sourceRoutineName,
    String sourceTaskName,
    Map<String, String> reservedWords,
    Map<String, Integer> channels,
    List<String> moduleChannels,
    int maxRenameAttempts,
    double fidelityThreshold,
    boolean parallel
) {
    static final String DEFAULTS_RESOURCE = "/l5xst-defaults.json";

    /*
     * Logger
     */
    private static final Logger log = LogManager.getLogger("config");

    private static final Gson gson = new Gson();

    public ConversionConfig {
        reservedWords = Collections.unmodifiableMap(new LinkedHashMap<>(reservedWords));
        channels = Collections.unmodifiableMap(new LinkedHashMap<>(channels));
        moduleChannels = List.copyOf(moduleChannels);
        if (maxRenameAttempts < 1) {
            throw new IllegalArgumentException("maxRenameAttempts must be positive: " + maxRenameAttempts);
        }
    }

    public static ConversionConfig defaults() {
        return gson.fromJson(readDefaults(), ConversionConfig.class);
    }

    /**
     * Defaults with the keys of {@code overrideFile} laid on top.
     */
    public static ConversionConfig load(Path overrideFile) throws IOException {
        var merged = readDefaults();
        JsonObject override;
        try (Reader reader = Files.newBufferedReader(overrideFile, StandardCharsets.UTF_8)) {
            override = JsonParser.parseReader(reader).getAsJsonObject();
        } catch (JsonParseException | IllegalStateException e) {
            throw new IOException("invalid configuration file " + overrideFile + ": " + e.getMessage(), e);
        }
        for (var entry : override.entrySet()) {
            if (!merged.has(entry.getKey())) {
                log.warn("ignoring unknown configuration key '{}'", entry.getKey());
                continue;
            }
            merged.add(entry.getKey(), entry.getValue());
        }
        log.debug("configuration loaded from {}", overrideFile);
        return gson.fromJson(merged, ConversionConfig.class);
    }

    public ConversionConfig withParallel(boolean value) {
        return new ConversionConfig(
            programName, configurationName, resourceName, resourceTarget,
            taskName, taskInterval, taskPriority, programInstance,
            sourceProgramName, sourceRoutineName, sourceTaskName,
            reservedWords, channels, moduleChannels,
            maxRenameAttempts, fidelityThreshold, value
        );
    }

    /** Controller index a message channel is routed to, if the channel is mapped. */
    public Optional<Integer> controllerForChannel(String channel) {
        for (var entry : channels.entrySet()) {
            if (entry.getKey().equalsIgnoreCase(channel)) {
                return Optional.of(entry.getValue());
            }
        }
        return Optional.empty();
    }

    private static JsonObject readDefaults() {
        try (InputStream in = ConversionConfig.class.getResourceAsStream(DEFAULTS_RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("missing classpath resource " + DEFAULTS_RESOURCE);
            }
            return JsonParser.parseReader(new InputStreamReader(in, StandardCharsets.UTF_8)).getAsJsonObject();
        } catch (IOException e) {
            throw new IllegalStateException("cannot read " + DEFAULTS_RESOURCE, e);
        }
    }
}
