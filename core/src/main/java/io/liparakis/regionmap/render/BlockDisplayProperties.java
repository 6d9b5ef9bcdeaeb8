package io.liparakis.regionmap.render;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import com.google.gson.annotations.SerializedName;
import com.google.gson.reflect.TypeToken;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;

/**
 * Immutable table of block display properties, keyed by block name and kept
 * in file order.
 * <p>
 * Loaded once from JSON and passed to every {@link Compositor} that needs it:
 * <pre>{@code
 * {
 *   "Soil_Grass": { "TintUp": ["#5B9E28"], "BiomeTintUp": 100, "ParticleColor": "#5B9E28" },
 *   ...
 * }
 * }</pre>
 * Safe to share between threads.
 */
public final class BlockDisplayProperties {
    private static final Logger LOGGER = LoggerFactory.getLogger(BlockDisplayProperties.class);
    private static final Gson GSON = new Gson();
    private static final BlockDisplayProperties EMPTY = new BlockDisplayProperties(Collections.emptyMap());

    private final Map<String, BlockProperties> entries;

    private BlockDisplayProperties(Map<String, BlockProperties> entries) {
        this.entries = Collections.unmodifiableMap(entries);
    }

    public static BlockDisplayProperties empty() {
        return EMPTY;
    }

    /**
     * Builds a table from already parsed entries; iteration order is preserved.
     */
    public static BlockDisplayProperties of(Map<String, BlockProperties> entries) {
        return new BlockDisplayProperties(new LinkedHashMap<>(entries));
    }

    /**
     * Loads the table from a JSON file. A missing file yields an empty table.
     *
     * @throws IOException if the file cannot be read or is not valid JSON
     */
    public static BlockDisplayProperties load(Path file) throws IOException {
        if (!Files.exists(file)) {
            LOGGER.warn("Block properties file {} not found, using fallback colours only", file);
            return EMPTY;
        }
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            BlockDisplayProperties table = read(reader);
            LOGGER.info("Loaded display properties for {} blocks from {}", table.size(), file);
            return table;
        }
    }

    /**
     * Reads the table from JSON.
     *
     * @throws IOException if the JSON is malformed
     */
    public static BlockDisplayProperties read(Reader reader) throws IOException {
        Map<String, JsonEntry> raw;
        try {
            raw = GSON.fromJson(reader, new TypeToken<LinkedHashMap<String, JsonEntry>>() {
            }.getType());
        } catch (JsonParseException e) {
            throw new IOException("Invalid block properties JSON: " + e.getMessage(), e);
        }
        if (raw == null) {
            return EMPTY;
        }

        Map<String, BlockProperties> entries = new LinkedHashMap<>(raw.size());
        for (Map.Entry<String, JsonEntry> entry : raw.entrySet()) {
            if (entry.getValue() != null) {
                entries.put(entry.getKey(), entry.getValue().toProperties(entry.getKey()));
            }
        }
        return new BlockDisplayProperties(entries);
    }

    /**
     * @return the entry stored under exactly this name, or {@code null}
     */
    public BlockProperties get(String blockName) {
        return entries.get(blockName);
    }

    /**
     * @return all entries in file order
     */
    public Map<String, BlockProperties> entries() {
        return entries;
    }

    public int size() {
        return entries.size();
    }

    /**
     * JSON shape of one entry.
     */
    static final class JsonEntry {
        @SerializedName("TintUp")
        List<String> tintUp;

        @SerializedName("BiomeTintUp")
        Integer biomeTintUp;

        @SerializedName("ParticleColor")
        String particleColor;

        BlockProperties toProperties(String name) {
            IntArrayList tints = new IntArrayList();
            if (tintUp != null) {
                for (String hex : tintUp) {
                    try {
                        tints.add(Rgb.parseHex(hex));
                    } catch (IllegalArgumentException e) {
                        LOGGER.warn("Ignoring invalid tint {} for block {}", hex, name);
                    }
                }
            }

            OptionalInt particle = OptionalInt.empty();
            if (particleColor != null) {
                try {
                    particle = OptionalInt.of(Rgb.parseHex(particleColor));
                } catch (IllegalArgumentException e) {
                    LOGGER.warn("Ignoring invalid particle colour {} for block {}", particleColor, name);
                }
            }

            int percent = biomeTintUp != null ? biomeTintUp : (tints.isEmpty() ? 0 : 100);
            return new BlockProperties(tints, percent, particle);
        }
    }
}
