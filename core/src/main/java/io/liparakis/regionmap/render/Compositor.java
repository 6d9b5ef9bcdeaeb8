package io.liparakis.regionmap.render;

import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.OptionalInt;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Resolves the final colour of a map pixel from the surface block, biome tint,
 * slope shading and any fluid on top.
 * <p>
 * Base colours come from the {@link BlockDisplayProperties} table: exact name,
 * then the first entry (in table order) whose name prefixes the block name,
 * then a keyword table, then gray. Resolutions are cached per block name.
 * Thread-safe.
 */
public final class Compositor {
    private static final Logger LOGGER = LoggerFactory.getLogger(Compositor.class);

    public static final int DEFAULT_COLOR = Rgb.of(128, 128, 128);
    public static final int WATER_COLOR = Rgb.of(25, 131, 217);
    public static final int LAVA_COLOR = Rgb.of(249, 78, 17);

    private static final String[][] KEYWORDS = {
            {"Grass", "Plant"},
            {"Leaves"},
            {"Stone", "Rock"},
            {"Wood", "Trunk"},
            {"Soil", "Dirt"},
            {"Sand"},
            {"Water"},
    };

    private static final int[] KEYWORD_COLORS = {
            Rgb.of(80, 180, 60),
            Rgb.of(34, 139, 34),
            Rgb.of(120, 120, 120),
            Rgb.of(139, 90, 43),
            Rgb.of(139, 90, 43),
            Rgb.of(238, 214, 175),
            Rgb.of(63, 118, 228),
    };

    private final BlockDisplayProperties properties;
    private final Map<String, BaseColor> resolved = new ConcurrentHashMap<>();
    private final Set<String> reportedUnknown = ConcurrentHashMap.newKeySet();

    public Compositor(BlockDisplayProperties properties) {
        this.properties = properties;
    }

    /**
     * Resolves the base colour of a block.
     */
    public BaseColor resolveBaseColor(String blockName) {
        return resolved.computeIfAbsent(blockName, this::lookup);
    }

    private BaseColor lookup(String blockName) {
        BlockProperties exact = properties.get(blockName);
        BaseColor fromTable = exact == null ? null : fromProperties(exact);
        if (fromTable != null) {
            return fromTable;
        }

        for (Map.Entry<String, BlockProperties> entry : properties.entries().entrySet()) {
            if (blockName.startsWith(entry.getKey())) {
                fromTable = fromProperties(entry.getValue());
                if (fromTable != null) {
                    return fromTable;
                }
            }
        }

        for (int i = 0; i < KEYWORDS.length; i++) {
            for (String keyword : KEYWORDS[i]) {
                if (blockName.contains(keyword)) {
                    return BaseColor.plain(KEYWORD_COLORS[i]);
                }
            }
        }

        if (reportedUnknown.add(blockName)) {
            LOGGER.debug("No display colour for block {}, using default", blockName);
        }
        return BaseColor.plain(DEFAULT_COLOR);
    }

    /**
     * First tint colour wins; without tints the particle colour becomes the base
     * and is not multiplied in again. Entries with neither yield {@code null}.
     */
    private static @Nullable BaseColor fromProperties(BlockProperties props) {
        if (!props.tintColors().isEmpty()) {
            return new BaseColor(props.tintColors().getInt(0), props.biomeTintPercent(), props.particleColor());
        }
        if (props.particleColor().isPresent()) {
            return BaseColor.plain(props.particleColor().getAsInt());
        }
        return null;
    }

    /**
     * Linear blend {@code base * (1 - p) + tint * p} with {@code p = percent / 100}.
     */
    public static int applyBiomeTint(int base, int biomeTint, int percent) {
        double p = percent / 100.0;
        return Rgb.of(
                (int) (Rgb.red(base) * (1 - p) + Rgb.red(biomeTint) * p),
                (int) (Rgb.green(base) * (1 - p) + Rgb.green(biomeTint) * p),
                (int) (Rgb.blue(base) * (1 - p) + Rgb.blue(biomeTint) * p));
    }

    /**
     * Per-channel multiply {@code color * particle / 255}.
     */
    public static int applyParticleMultiply(int color, int particleColor) {
        return Rgb.of(
                Rgb.red(color) * Rgb.red(particleColor) / 255,
                Rgb.green(color) * Rgb.green(particleColor) / 255,
                Rgb.blue(color) * Rgb.blue(particleColor) / 255);
    }

    /**
     * Blends a fluid colour over terrain.
     * <p>
     * The terrain weight is {@code min(1, 1 / max(1, depth))}: one block of
     * fluid leaves the terrain colour as is, deeper fluid tends to the pure
     * fluid colour. Unknown fluid types leave the terrain unchanged.
     */
    public static int blendFluid(int terrain, @Nullable String fluidType, int fluidDepth) {
        if (fluidType == null || fluidDepth == 0) {
            return terrain;
        }
        int fluid;
        if (fluidType.contains("Water")) {
            fluid = WATER_COLOR;
        } else if (fluidType.contains("Lava")) {
            fluid = LAVA_COLOR;
        } else {
            return terrain;
        }

        double factor = Math.min(1.0, 1.0 / Math.max(1, fluidDepth));
        return Rgb.of(
                blendChannel(Rgb.red(fluid), Rgb.red(terrain), factor),
                blendChannel(Rgb.green(fluid), Rgb.green(terrain), factor),
                blendChannel(Rgb.blue(fluid), Rgb.blue(terrain), factor));
    }

    private static int blendChannel(int fluid, int terrain, double factor) {
        return (int) Math.max(0.0, Math.min(255.0, fluid + (terrain - fluid) * factor));
    }

    /**
     * Runs the full pixel pipeline: base colour, biome tint, particle multiply,
     * shading, fluid overlay.
     *
     * @param blockName surface block name
     * @param biomeTint column biome tint, or {@code null} if the chunk has none
     * @param shade     multiplier from {@link Shader#shade}
     * @param fluid     fluid resting on the surface
     * @return the pixel colour, {@code 0xRRGGBB}
     */
    public int composite(String blockName, @Nullable Integer biomeTint, double shade, FluidColumn fluid) {
        BaseColor base = resolveBaseColor(blockName);
        int color = base.rgb();

        boolean tinted = false;
        if (biomeTint != null && base.biomeTintPercent() > 0) {
            color = applyBiomeTint(color, biomeTint, base.biomeTintPercent());
            tinted = true;
        }

        OptionalInt particle = base.particleColor();
        if (particle.isPresent() && particle.getAsInt() != base.rgb()
                && (!tinted || base.biomeTintPercent() < 100)) {
            color = applyParticleMultiply(color, particle.getAsInt());
        }

        color = Shader.apply(color, shade);
        return blendFluid(color, fluid.type(), fluid.depth());
    }

    /**
     * A block's resolved base colour.
     *
     * @param rgb              base colour
     * @param biomeTintPercent share of the biome tint to blend in (0-100)
     * @param particleColor    colour to multiply in afterwards, if any
     */
    public record BaseColor(int rgb, int biomeTintPercent, OptionalInt particleColor) {

        static BaseColor plain(int rgb) {
            return new BaseColor(rgb, 0, OptionalInt.empty());
        }
    }
}
