package io.liparakis.regionmap.tool;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Builds the block display properties table from a game asset tree.
 * <p>
 * Every {@code Server/Item/Items/**}{@code /*.json} item definition with a
 * {@code BlockType} object contributes one entry named after the file:
 * <ul>
 *     <li>{@code TintUp} from {@code BlockType.Tint}, else {@code BlockType.TintUp}, else empty</li>
 *     <li>{@code BiomeTintUp} from {@code BlockType.BiomeTintUp}, else 100 if tinted, else 0</li>
 *     <li>{@code ParticleColor} from {@code BlockType.ParticleColor}, else null</li>
 * </ul>
 * Files that are not valid JSON are skipped.
 */
public final class BlockPropertiesExtractor {
    private static final Logger LOGGER = LoggerFactory.getLogger(BlockPropertiesExtractor.class);

    private static final Gson GSON = new GsonBuilder()
            .setPrettyPrinting()
            .serializeNulls()
            .create();

    private static final String JSON_SUFFIX = ".json";

    private BlockPropertiesExtractor() {
    }

    /**
     * @return the directory holding item definitions under an asset root
     */
    public static Path itemsDir(Path assetsRoot) {
        return assetsRoot.resolve("Server").resolve("Item").resolve("Items");
    }

    /**
     * Scans an asset tree.
     *
     * @param assetsRoot the asset root containing {@code Server/Item/Items}
     * @return entries keyed by block name, in path order
     * @throws IOException if the items directory is missing or cannot be walked
     */
    public static Map<String, Map<String, Object>> extract(Path assetsRoot) throws IOException {
        Path items = itemsDir(assetsRoot);
        if (!Files.isDirectory(items)) {
            throw new IOException("Items directory not found: " + items);
        }

        List<Path> files;
        try (Stream<Path> walk = Files.walk(items)) {
            files = walk.filter(Files::isRegularFile)
                    .filter(path -> path.getFileName().toString().endsWith(JSON_SUFFIX))
                    .sorted()
                    .collect(Collectors.toList());
        }

        Map<String, Map<String, Object>> table = new LinkedHashMap<>();
        for (Path file : files) {
            JsonObject blockType = readBlockType(file);
            if (blockType != null) {
                String name = file.getFileName().toString();
                name = name.substring(0, name.length() - JSON_SUFFIX.length());
                table.put(name, toEntry(blockType));
            }
        }

        LOGGER.info("Found {} blocks with BlockType data in {} item files", table.size(), files.size());
        return table;
    }

    /**
     * Extracts an asset tree and writes the table as JSON.
     *
     * @return number of entries written
     */
    public static int extractTo(Path assetsRoot, Path output) throws IOException {
        Map<String, Map<String, Object>> table = extract(assetsRoot);
        Path parent = output.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try (Writer writer = Files.newBufferedWriter(output, StandardCharsets.UTF_8)) {
            GSON.toJson(table, writer);
        }
        LOGGER.info("Saved block properties to {}", output);
        return table.size();
    }

    private static JsonObject readBlockType(Path file) throws IOException {
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            JsonElement root = JsonParser.parseReader(reader);
            if (!root.isJsonObject()) {
                return null;
            }
            JsonElement blockType = root.getAsJsonObject().get("BlockType");
            return blockType != null && blockType.isJsonObject() ? blockType.getAsJsonObject() : null;
        } catch (JsonParseException e) {
            LOGGER.debug("Skipping {}: {}", file, e.getMessage());
            return null;
        }
    }

    private static Map<String, Object> toEntry(JsonObject blockType) {
        List<String> tint = colours(blockType.get("Tint"));
        if (tint.isEmpty()) {
            tint = colours(blockType.get("TintUp"));
        }

        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("TintUp", tint);

        JsonElement biomeTint = blockType.get("BiomeTintUp");
        if (biomeTint != null && biomeTint.isJsonPrimitive() && biomeTint.getAsJsonPrimitive().isNumber()) {
            entry.put("BiomeTintUp", biomeTint.getAsInt());
        } else {
            entry.put("BiomeTintUp", tint.isEmpty() ? 0 : 100);
        }

        JsonElement particle = blockType.get("ParticleColor");
        entry.put("ParticleColor", particle != null && particle.isJsonPrimitive() ? particle.getAsString() : null);
        return entry;
    }

    /**
     * Accepts either a single colour string or an array of them.
     */
    private static List<String> colours(JsonElement element) {
        List<String> colours = new ArrayList<>();
        if (element == null || element.isJsonNull()) {
            return colours;
        }
        if (element.isJsonArray()) {
            JsonArray array = element.getAsJsonArray();
            for (JsonElement colour : array) {
                if (colour.isJsonPrimitive()) {
                    colours.add(colour.getAsString());
                }
            }
        } else if (element.isJsonPrimitive()) {
            colours.add(element.getAsString());
        }
        return colours;
    }
}
