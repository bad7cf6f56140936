package com.phillippitts.callagent.service.library;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.phillippitts.callagent.config.properties.AudioLibraryProperties;
import com.phillippitts.callagent.domain.AudioSnippet;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * In-memory library of pre-recorded mu-law snippets.
 *
 * <p>The JSON manifest maps each category to {@code filename → transcript}; the special
 * {@code quick_responses} category maps a caller phrase to a filename. Every referenced file is
 * read once into memory at {@link #load()}; manifest names ending in the source extension
 * ({@code .mp3}) are resolved to payload files with the payload extension ({@code .ulaw}) but are
 * still addressed by their manifest name.
 *
 * <p><b>Thread Safety:</b> after loading, all lookups read immutable maps published through
 * volatile fields, so serving needs no locks. {@link #load()}, {@link #reload()} and
 * {@link #clear()} are synchronized against each other.
 */
public class AudioLibrary {

    private static final Logger LOG = LogManager.getLogger(AudioLibrary.class);

    static final String QUICK_RESPONSES = "quick_responses";

    private final AudioLibraryProperties properties;
    private final ObjectMapper mapper = new ObjectMapper();

    private volatile Map<String, AudioSnippet> snippets = Map.of();
    private volatile Map<String, Map<String, String>> catalog = Map.of();
    private volatile Map<String, String> quickResponses = Map.of();
    private volatile List<String> missing = List.of();
    private volatile boolean loaded;

    public AudioLibrary(AudioLibraryProperties properties) {
        this.properties = Objects.requireNonNull(properties, "properties must not be null");
    }

    /**
     * Reads the manifest and every referenced payload into memory.
     *
     * <p>A missing or malformed manifest leaves the library empty; missing payload files are
     * logged and skipped. Neither is fatal.
     */
    public synchronized void load() {
        Path manifestPath = Path.of(properties.getManifestPath());
        Path audioDir = Path.of(properties.getAudioDirectory());

        Map<String, Map<String, String>> parsedCatalog = new LinkedHashMap<>();
        Map<String, String> parsedQuick = new LinkedHashMap<>();
        readManifest(manifestPath, parsedCatalog, parsedQuick);

        Map<String, AudioSnippet> loadedSnippets = new LinkedHashMap<>();
        List<String> missingKeys = new ArrayList<>();
        long totalBytes = 0;

        for (Map.Entry<String, Map<String, String>> category : parsedCatalog.entrySet()) {
            for (Map.Entry<String, String> file : category.getValue().entrySet()) {
                String key = file.getKey();
                if (loadedSnippets.containsKey(key)) {
                    continue;
                }
                Optional<byte[]> audio = readPayload(audioDir, key);
                if (audio.isPresent()) {
                    loadedSnippets.put(key, new AudioSnippet(key, audio.get(), file.getValue(), category.getKey()));
                    totalBytes += audio.get().length;
                } else {
                    missingKeys.add(key);
                }
            }
        }
        for (String key : parsedQuick.values()) {
            if (!loadedSnippets.containsKey(key) && !missingKeys.contains(key)) {
                Optional<byte[]> audio = readPayload(audioDir, key);
                if (audio.isPresent()) {
                    loadedSnippets.put(key, new AudioSnippet(key, audio.get(), "", QUICK_RESPONSES));
                    totalBytes += audio.get().length;
                } else {
                    missingKeys.add(key);
                }
            }
        }

        this.catalog = Collections.unmodifiableMap(parsedCatalog);
        this.quickResponses = Collections.unmodifiableMap(parsedQuick);
        this.snippets = Collections.unmodifiableMap(loadedSnippets);
        this.missing = List.copyOf(missingKeys);
        this.loaded = true;

        LOG.info("Audio library loaded: {} snippets ({} KB), {} quick responses, {} missing",
                loadedSnippets.size(), totalBytes / 1024, parsedQuick.size(), missingKeys.size());
    }

    /**
     * Loads the library unless it is already loaded.
     */
    public synchronized void reload() {
        if (!loaded) {
            load();
        } else {
            LOG.debug("Audio library already loaded; reload skipped");
        }
    }

    /**
     * Drops every cached payload; the next {@link #reload()} reads the manifest again.
     */
    public synchronized void clear() {
        int count = snippets.size();
        long bytes = totalBytes();
        this.snippets = Map.of();
        this.catalog = Map.of();
        this.quickResponses = Map.of();
        this.missing = List.of();
        this.loaded = false;
        LOG.info("Audio library cleared: {} snippets, {} KB freed", count, bytes / 1024);
    }

    /**
     * Returns the cached mu-law bytes for a key. The returned array is shared and must not be modified.
     *
     * @param key manifest filename; a legacy {@code a.mp3 + b.mp3} chain resolves to its first file
     * @return the payload, or empty when the key is unknown or its file was missing
     */
    public Optional<byte[]> serve(String key) {
        return snippet(key).map(AudioSnippet::audio);
    }

    public Optional<AudioSnippet> snippet(String key) {
        String normalized = normalizeKey(key);
        if (normalized.isEmpty()) {
            return Optional.empty();
        }
        return Optional.ofNullable(snippets.get(normalized));
    }

    public boolean contains(String key) {
        return snippet(key).isPresent();
    }

    /**
     * Finds the first quick-response phrase, in manifest order, contained in the utterance.
     *
     * @return the snippet key for the matching phrase, or empty
     */
    public Optional<String> quickResponse(String utterance) {
        if (utterance == null || utterance.isBlank()) {
            return Optional.empty();
        }
        String lower = utterance.toLowerCase(Locale.ROOT);
        for (Map.Entry<String, String> entry : quickResponses.entrySet()) {
            if (lower.contains(entry.getKey().toLowerCase(Locale.ROOT))) {
                LOG.debug("Quick response hit: '{}' -> {}", entry.getKey(), entry.getValue());
                return Optional.of(entry.getValue());
            }
        }
        return Optional.empty();
    }

    public Optional<String> transcriptFor(String key) {
        String normalized = normalizeKey(key);
        for (Map<String, String> files : catalog.values()) {
            String transcript = files.get(normalized);
            if (transcript != null) {
                return Optional.of(transcript);
            }
        }
        return Optional.empty();
    }

    /**
     * Formats the library for a response-generation prompt, one {@code filename | transcript} line per
     * snippet grouped under upper-case category headings. Quick responses are left out.
     */
    public String promptCatalog() {
        StringBuilder sb = new StringBuilder("Available audio files:\n\n");
        for (Map.Entry<String, Map<String, String>> category : catalog.entrySet()) {
            sb.append("# ").append(category.getKey().replace('_', ' ').toUpperCase(Locale.ROOT)).append('\n');
            for (Map.Entry<String, String> file : category.getValue().entrySet()) {
                sb.append(file.getKey()).append(" | ").append(file.getValue()).append('\n');
            }
            sb.append('\n');
        }
        return sb.toString();
    }

    public int size() {
        return snippets.size();
    }

    public long totalBytes() {
        long total = 0;
        for (AudioSnippet snippet : snippets.values()) {
            total += snippet.size();
        }
        return total;
    }

    public Set<String> keys() {
        return snippets.keySet();
    }

    public List<String> missingKeys() {
        return missing;
    }

    public int quickResponseCount() {
        return quickResponses.size();
    }

    public boolean isLoaded() {
        return loaded;
    }

    /**
     * Trims a snippet key; a legacy {@code a.mp3 + b.mp3} chain resolves to its first file.
     */
    public static String normalizeKey(String key) {
        if (key == null) {
            return "";
        }
        String trimmed = key.trim();
        int plus = trimmed.indexOf('+');
        if (plus >= 0) {
            String first = trimmed.substring(0, plus).trim();
            LOG.warn("Chained audio key '{}' resolved to first file '{}'", trimmed, first);
            return first;
        }
        return trimmed;
    }

    private void readManifest(Path manifestPath,
                              Map<String, Map<String, String>> catalogOut,
                              Map<String, String> quickOut) {
        if (!Files.isRegularFile(manifestPath)) {
            LOG.warn("Audio manifest not found at {}; using empty library", manifestPath);
            return;
        }
        JsonNode root;
        try {
            root = mapper.readTree(manifestPath.toFile());
        } catch (IOException e) {
            LOG.error("Failed to parse audio manifest {}: {}", manifestPath, e.getMessage());
            return;
        }
        if (root == null || !root.isObject()) {
            LOG.error("Audio manifest {} is not a JSON object; using empty library", manifestPath);
            return;
        }

        Iterator<Map.Entry<String, JsonNode>> categories = root.fields();
        while (categories.hasNext()) {
            Map.Entry<String, JsonNode> category = categories.next();
            if (!category.getValue().isObject()) {
                LOG.warn("Skipping manifest category '{}': not an object", category.getKey());
                continue;
            }
            Map<String, String> entries = new LinkedHashMap<>();
            Iterator<Map.Entry<String, JsonNode>> files = category.getValue().fields();
            while (files.hasNext()) {
                Map.Entry<String, JsonNode> file = files.next();
                entries.put(file.getKey(), file.getValue().asText(""));
            }
            if (QUICK_RESPONSES.equals(category.getKey())) {
                quickOut.putAll(entries);
            } else {
                catalogOut.put(category.getKey(), Collections.unmodifiableMap(entries));
            }
        }
    }

    private Optional<byte[]> readPayload(Path audioDir, String key) {
        Path file = audioDir.resolve(payloadName(key));
        if (!Files.isRegularFile(file)) {
            LOG.warn("Missing audio payload for '{}': {}", key, file);
            return Optional.empty();
        }
        try {
            return Optional.of(Files.readAllBytes(file));
        } catch (IOException e) {
            LOG.warn("Failed to read audio payload {}: {}", file, e.getMessage());
            return Optional.empty();
        }
    }

    String payloadName(String key) {
        String source = properties.getSourceExtension();
        if (!source.isEmpty() && key.endsWith(source)) {
            return key.substring(0, key.length() - source.length()) + properties.getPayloadExtension();
        }
        return key;
    }
}
