package io.liparakis.regionmap.storage;

import org.jetbrains.annotations.Nullable;

import java.util.Optional;

/**
 * One 32-block-tall section of a chunk column as stored in the chunk document.
 * Either component may be absent, meaning the section holds no blocks or no
 * fluids.
 */
public final class SectionDocument {
    private static final SectionDocument EMPTY = new SectionDocument(null, null);

    private final @Nullable BlockComponent block;
    private final @Nullable FluidComponent fluid;

    public SectionDocument(@Nullable BlockComponent block, @Nullable FluidComponent fluid) {
        this.block = block;
        this.fluid = fluid;
    }

    public static SectionDocument empty() {
        return EMPTY;
    }

    public Optional<BlockComponent> block() {
        return Optional.ofNullable(block);
    }

    public Optional<FluidComponent> fluid() {
        return Optional.ofNullable(fluid);
    }

    /**
     * The {@code Block} component: a format version and the packed section blob.
     */
    public record BlockComponent(int version, byte[] data) {
    }

    /**
     * The {@code Fluid} component: the packed fluid section blob.
     */
    public record FluidComponent(byte[] data) {
    }
}
