package io.liparakis.regionmap.render;

import io.liparakis.regionmap.storage.ChunkDocument;
import io.liparakis.regionmap.storage.CorruptFormatException;
import io.liparakis.regionmap.storage.RegionMapConstants;
import io.liparakis.regionmap.storage.SectionDocument;
import io.liparakis.regionmap.storage.codec.BlockSection;
import io.liparakis.regionmap.storage.codec.FluidCell;
import io.liparakis.regionmap.storage.codec.FluidSection;
import io.liparakis.regionmap.storage.codec.SectionPaletteCodec;

import java.util.Optional;

import static io.liparakis.regionmap.storage.RegionMapConstants.SECTION_SIZE;
import static io.liparakis.regionmap.storage.RegionMapConstants.SECTIONS_PER_CHUNK;

/**
 * Finds the topmost solid block and the fluid above it for columns of one
 * chunk.
 * <p>
 * Section blobs are decoded on first use and kept for the lifetime of the
 * extractor. Not thread-safe; use one extractor per chunk and thread.
 */
public final class SurfaceExtractor {
    private static final String NON_SOLID_PREFIX = "*";

    private final ChunkDocument document;
    private final BlockSection[] blockSections = new BlockSection[SECTIONS_PER_CHUNK];
    private final boolean[] blockDecoded = new boolean[SECTIONS_PER_CHUNK];
    private final FluidSection[] fluidSections = new FluidSection[SECTIONS_PER_CHUNK];
    private final boolean[] fluidDecoded = new boolean[SECTIONS_PER_CHUNK];

    public SurfaceExtractor(ChunkDocument document) {
        this.document = document;
    }

    /**
     * Scans a column from the top of section 9 down to the bottom of section 0.
     * Sections without block data are skipped, as are cells named
     * {@code "Empty"} or starting with {@code "*"}.
     *
     * @param x local column X (0-31)
     * @param z local column Z (0-31)
     * @return the first solid block, or {@link SurfaceHit#NONE}
     * @throws CorruptFormatException if a block section blob is malformed
     */
    public SurfaceHit findSurfaceHeight(int x, int z) throws CorruptFormatException {
        for (int sectionIndex = SECTIONS_PER_CHUNK - 1; sectionIndex >= 0; sectionIndex--) {
            BlockSection section = blockSection(sectionIndex);
            if (section == null || !section.hasBlocks()) {
                continue;
            }
            for (int localY = SECTION_SIZE - 1; localY >= 0; localY--) {
                String name = section.blockAt(x, localY, z);
                if (isSolid(name)) {
                    return new SurfaceHit(sectionIndex * SECTION_SIZE + localY, name, sectionIndex);
                }
            }
        }
        return SurfaceHit.NONE;
    }

    /**
     * Finds the fluid run resting above a surface.
     * <p>
     * Scans from Y 319 down to {@code surfaceY + 1}. The first non-empty fluid
     * sets the type and the top of the run; the scan stops when the type
     * changes or, once inside the run, at the first empty cell. Sections
     * without fluid data are skipped.
     *
     * @param x        local column X (0-31)
     * @param z        local column Z (0-31)
     * @param surfaceY world Y of the solid surface
     * @return the fluid type and its depth above the surface, or {@link FluidColumn#NONE}
     */
    public FluidColumn findSurfaceFluid(int x, int z, int surfaceY) {
        String topType = null;
        int topY = 0;

        for (int worldY = RegionMapConstants.MAX_Y; worldY > surfaceY; worldY--) {
            FluidSection section = fluidSection(worldY / SECTION_SIZE);
            if (section == null || !section.hasFluidData()) {
                continue;
            }
            FluidCell cell = section.fluidAt(x, worldY % SECTION_SIZE, z);

            if (!cell.isEmpty()) {
                if (topType == null) {
                    topType = cell.type();
                    topY = worldY;
                } else if (!topType.equals(cell.type())) {
                    break;
                }
            } else if (topType != null) {
                break;
            }
        }

        return topType == null ? FluidColumn.NONE : new FluidColumn(topType, topY - surfaceY);
    }

    /**
     * Extracts the surface and fluid of all 32x32 columns.
     *
     * @throws CorruptFormatException if a block section blob is malformed
     */
    public ColumnSurfaceData extract() throws CorruptFormatException {
        int[][] heights = new int[SECTION_SIZE][SECTION_SIZE];
        String[][] names = new String[SECTION_SIZE][SECTION_SIZE];
        FluidColumn[][] fluids = new FluidColumn[SECTION_SIZE][SECTION_SIZE];

        for (int z = 0; z < SECTION_SIZE; z++) {
            for (int x = 0; x < SECTION_SIZE; x++) {
                SurfaceHit hit = findSurfaceHeight(x, z);
                heights[z][x] = hit.worldY();
                names[z][x] = hit.blockName();
                fluids[z][x] = findSurfaceFluid(x, z, hit.worldY());
            }
        }
        return new ColumnSurfaceData(heights, names, fluids);
    }

    /**
     * Returns the block name at local column coordinates and world Y.
     *
     * @throws CorruptFormatException if the section blob is malformed
     */
    public String blockAt(int x, int worldY, int z) throws CorruptFormatException {
        if (worldY < 0 || worldY > RegionMapConstants.MAX_Y) {
            return RegionMapConstants.EMPTY;
        }
        BlockSection section = blockSection(worldY / SECTION_SIZE);
        return section == null ? RegionMapConstants.EMPTY : section.blockAt(x, worldY % SECTION_SIZE, z);
    }

    /**
     * Returns the fluid at local column coordinates and world Y.
     */
    public FluidCell fluidAt(int x, int worldY, int z) {
        if (worldY < 0 || worldY > RegionMapConstants.MAX_Y) {
            return FluidCell.NONE;
        }
        FluidSection section = fluidSection(worldY / SECTION_SIZE);
        return section == null ? FluidCell.NONE : section.fluidAt(x, worldY % SECTION_SIZE, z);
    }

    /**
     * @return the decoded block section, or {@code null} if the section has no block component
     */
    public BlockSection blockSection(int index) throws CorruptFormatException {
        if (!blockDecoded[index]) {
            Optional<SectionDocument.BlockComponent> block = document.section(index).block();
            blockSections[index] = block.isPresent()
                    ? SectionPaletteCodec.decodeBlockSection(block.get().data())
                    : null;
            blockDecoded[index] = true;
        }
        return blockSections[index];
    }

    /**
     * @return the decoded fluid section, or {@code null} if the section has no fluid component
     */
    public FluidSection fluidSection(int index) {
        if (!fluidDecoded[index]) {
            fluidSections[index] = document.section(index).fluid()
                    .map(fluid -> SectionPaletteCodec.decodeFluidSection(fluid.data()))
                    .orElse(null);
            fluidDecoded[index] = true;
        }
        return fluidSections[index];
    }

    static boolean isSolid(String name) {
        return !RegionMapConstants.EMPTY.equals(name) && !name.startsWith(NON_SOLID_PREFIX);
    }
}
