package io.liparakis.regionmap.render;

import io.liparakis.regionmap.storage.RegionMapConstants;

/**
 * Topmost solid block of a column.
 *
 * @param worldY       world Y of the block (0-319)
 * @param blockName    palette name of the block
 * @param sectionIndex section holding the block (0-9)
 */
public record SurfaceHit(int worldY, String blockName, int sectionIndex) {

    /** Result for a column without any solid block. */
    public static final SurfaceHit NONE = new SurfaceHit(0, RegionMapConstants.EMPTY, 0);
}
