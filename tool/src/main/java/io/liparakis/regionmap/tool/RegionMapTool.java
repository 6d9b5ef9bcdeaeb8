package io.liparakis.regionmap.tool;

import io.liparakis.regionmap.core.ChunkPos;
import io.liparakis.regionmap.core.PaletteEntry;
import io.liparakis.regionmap.core.RegionPos;
import io.liparakis.regionmap.render.BlockDisplayProperties;
import io.liparakis.regionmap.render.ChunkRange;
import io.liparakis.regionmap.render.ChunkRenderer;
import io.liparakis.regionmap.render.Compositor;
import io.liparakis.regionmap.render.MapRenderer;
import io.liparakis.regionmap.render.Rgb;
import io.liparakis.regionmap.render.RgbRaster;
import io.liparakis.regionmap.spi.ImageSink;
import io.liparakis.regionmap.storage.ChunkDocument;
import io.liparakis.regionmap.storage.ChunkNotFoundException;
import io.liparakis.regionmap.storage.RegionFileReader;
import io.liparakis.regionmap.storage.RegionMapConstants;
import io.liparakis.regionmap.storage.SectionDocument;
import io.liparakis.regionmap.storage.WorldReader;
import io.liparakis.regionmap.storage.codec.BlockChunkData;
import io.liparakis.regionmap.storage.codec.BlockChunkDataDecoder;
import io.liparakis.regionmap.storage.codec.BlockSection;
import io.liparakis.regionmap.storage.codec.FluidCell;
import io.liparakis.regionmap.storage.codec.FluidSection;
import io.liparakis.regionmap.storage.codec.SectionPaletteCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Command-line front end.
 * <pre>
 * render-chunk CX CZ [OUT]                  chunk_CX_CZ.png
 * render-map SX SZ EX EZ [OUT]              map_SX_SZ_to_EX_EZ.png
 * block-at X Y Z                            block name at world coordinates
 * fluid-at X Y Z                            fluid type and level at world coordinates
 * dump-section CX CZ SECTION                header fields and palettes of one section, plus the column blob
 * list-chunks RX RZ                         chunks stored in a region
 * extract-properties ASSETS [OUT]           block_properties.json from an asset tree
 * </pre>
 */
public final class RegionMapTool {
    private static final Logger LOGGER = LoggerFactory.getLogger(RegionMapTool.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE = 2;

    private static final String USAGE = String.join(System.lineSeparator(),
            "Usage: region-map [--world DIR] [--properties FILE] [--scale N] [--threads N] COMMAND ARGS",
            "  render-chunk CX CZ [OUT]",
            "  render-map SX SZ EX EZ [OUT]",
            "  block-at X Y Z",
            "  fluid-at X Y Z",
            "  dump-section CX CZ SECTION",
            "  list-chunks RX RZ",
            "  extract-properties ASSETS [OUT]");

    private final ToolOptions options;
    private final ImageSink imageSink;
    private final PrintStream out;
    private final WorldReader world;

    public RegionMapTool(ToolOptions options, ImageSink imageSink, PrintStream out) {
        this.options = options;
        this.imageSink = imageSink;
        this.out = out;
        this.world = new WorldReader(options.world());
    }

    public static void main(String[] args) {
        int code = run(args, new PngImageSink(), System.out, System.err);
        if (code != EXIT_OK) {
            System.exit(code);
        }
    }

    /**
     * Parses the arguments and runs one command.
     *
     * @return the process exit code
     */
    static int run(String[] args, ImageSink imageSink, PrintStream out, PrintStream err) {
        ToolOptions options;
        try {
            options = ToolOptions.parse(args);
        } catch (IllegalArgumentException e) {
            err.println(e.getMessage());
            err.println(USAGE);
            return EXIT_USAGE;
        }

        try {
            return new RegionMapTool(options, imageSink, out).execute();
        } catch (IllegalArgumentException e) {
            err.println(e.getMessage());
            err.println(USAGE);
            return EXIT_USAGE;
        } catch (ChunkNotFoundException e) {
            err.println(e.getMessage());
            return EXIT_FAILURE;
        } catch (IOException e) {
            LOGGER.error("Command {} failed", options.command(), e);
            return EXIT_FAILURE;
        }
    }

    /**
     * Runs the parsed command.
     *
     * @return the process exit code
     * @throws IllegalArgumentException if the command or its arguments are invalid
     * @throws IOException              if reading the world or writing output fails
     */
    public int execute() throws IOException {
        switch (options.command()) {
            case "render-chunk" -> renderChunk();
            case "render-map" -> renderMap();
            case "block-at" -> blockAt();
            case "fluid-at" -> fluidAt();
            case "dump-section" -> dumpSection();
            case "list-chunks" -> listChunks();
            case "extract-properties" -> extractProperties();
            default -> throw new IllegalArgumentException("Unknown command: " + options.command());
        }
        return EXIT_OK;
    }

    private void renderChunk() throws IOException {
        int chunkX = options.intArgument(0, "chunk x");
        int chunkZ = options.intArgument(1, "chunk z");
        Path output = Path.of(options.argumentOr(2, String.format("chunk_%d_%d.png", chunkX, chunkZ)));

        ChunkPos pos = new ChunkPos(chunkX, chunkZ);
        LOGGER.info("Rendering chunk {}", pos);
        ChunkDocument document = world.readChunk(pos);
        RgbRaster raster = chunkRenderer().render(document);
        imageSink.write(raster, output);
        out.println("Saved " + output);
    }

    private void renderMap() throws IOException {
        ChunkRange range = new ChunkRange(
                options.intArgument(0, "start x"), options.intArgument(1, "start z"),
                options.intArgument(2, "end x"), options.intArgument(3, "end z"));
        Path output = Path.of(options.argumentOr(4, String.format("map_%d_%d_to_%d_%d.png",
                range.startX(), range.startZ(), range.endX(), range.endZ())));

        MapRenderer.MapResult result = new MapRenderer(world, chunkRenderer()).render(range);
        imageSink.write(result.raster(), output);
        out.printf("Saved %s (%d chunks rendered, %d skipped)%n", output, result.rendered(), result.skipped());
    }

    private void blockAt() throws IOException {
        int x = options.intArgument(0, "x");
        int y = options.intArgument(1, "y");
        int z = options.intArgument(2, "z");
        out.println(world.blockAt(x, y, z));
    }

    private void fluidAt() throws IOException {
        int x = options.intArgument(0, "x");
        int y = options.intArgument(1, "y");
        int z = options.intArgument(2, "z");
        FluidCell cell = world.fluidAt(x, y, z);
        if (cell.isEmpty()) {
            out.println(RegionMapConstants.EMPTY);
        } else {
            out.printf("%s level=%d%n", cell.type(), cell.level());
        }
    }

    private void dumpSection() throws IOException {
        int chunkX = options.intArgument(0, "chunk x");
        int chunkZ = options.intArgument(1, "chunk z");
        int index = options.intArgument(2, "section");
        if (index < 0 || index >= RegionMapConstants.SECTIONS_PER_CHUNK) {
            throw new IllegalArgumentException("Section index out of range: " + index);
        }

        ChunkDocument document = world.readChunk(new ChunkPos(chunkX, chunkZ));
        SectionDocument section = document.section(index);
        out.printf("Section %d of chunk [%d, %d]%n", index, chunkX, chunkZ);

        Optional<SectionDocument.BlockComponent> block = section.block();
        if (block.isPresent()) {
            BlockSection blocks = SectionPaletteCodec.decodeBlockSection(block.get().data());
            out.printf("Block version=%d leading=0x%08X encoding=%s trailing=0x%02X%n",
                    block.get().version(), blocks.unknownLeading(), blocks.encoding(),
                    blocks.unknownTrailing() & 0xFF);
            printPalette(blocks.palette().entries());
        } else {
            out.println("Block: none");
        }

        Optional<SectionDocument.FluidComponent> fluid = section.fluid();
        if (fluid.isPresent()) {
            FluidSection fluids = SectionPaletteCodec.decodeFluidSection(fluid.get().data());
            out.printf("Fluid encoding=%s data=%s%n", fluids.encoding(), fluids.hasFluidData());
            printPalette(fluids.palette().entries());
        } else {
            out.println("Fluid: none");
        }

        printColumns(document);
    }

    private void printColumns(ChunkDocument document) throws IOException {
        Optional<byte[]> blob = document.blockChunkData();
        if (blob.isEmpty()) {
            out.println("BlockChunk: none");
            return;
        }
        BlockChunkData columns = BlockChunkDataDecoder.decode(blob.get());
        int min = Integer.MAX_VALUE;
        int max = Integer.MIN_VALUE;
        for (int z = 0; z < RegionMapConstants.SECTION_SIZE; z++) {
            for (int x = 0; x < RegionMapConstants.SECTION_SIZE; x++) {
                min = Math.min(min, columns.heightAt(x, z));
                max = Math.max(max, columns.heightAt(x, z));
            }
        }
        out.printf("BlockChunk needsPhysics=%s heights=%d..%d tint(0,0)=%s%n",
                columns.needsPhysics(), min, max, Rgb.toHex(columns.tintAt(0, 0)));
    }

    private void printPalette(List<PaletteEntry> entries) {
        for (int i = 0; i < entries.size(); i++) {
            PaletteEntry entry = entries.get(i);
            out.printf("  %3d  %-40s %d%n", i, entry.name(), entry.count());
        }
    }

    private void listChunks() throws IOException {
        RegionPos region = new RegionPos(options.intArgument(0, "region x"), options.intArgument(1, "region z"));
        List<RegionFileReader.ChunkEntry> chunks = world.listChunks(region);
        for (RegionFileReader.ChunkEntry entry : chunks) {
            out.println(entry);
        }
        out.printf("%d chunks in %s%n", chunks.size(), region);
    }

    private void extractProperties() throws IOException {
        if (options.arguments().isEmpty()) {
            throw new IllegalArgumentException("Missing argument <assets> for " + options.command());
        }
        Path assets = Path.of(options.arguments().get(0));
        Path output = Path.of(options.argumentOr(1, ToolOptions.DEFAULT_PROPERTIES.toString()));
        int count = BlockPropertiesExtractor.extractTo(assets, output);
        out.printf("Saved %d block properties to %s%n", count, output);
    }

    private ChunkRenderer chunkRenderer() throws IOException {
        BlockDisplayProperties properties = BlockDisplayProperties.load(options.properties());
        return new ChunkRenderer(new Compositor(properties), options.settings());
    }
}
