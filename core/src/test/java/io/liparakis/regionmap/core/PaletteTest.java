package io.liparakis.regionmap.core;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link Palette}.
 */
class PaletteTest {

    private Palette<String> palette;

    @BeforeEach
    void setUp() {
        palette = new Palette<>();
    }

    // ========== append Tests ==========

    @Test
    void append_assignsPositionalIds() {
        assertThat(palette.append("Empty")).isEqualTo(0);
        assertThat(palette.append("Rock_Stone")).isEqualTo(1);
        assertThat(palette.append("Empty")).isEqualTo(2);

        assertThat(palette.get(2)).isEqualTo("Empty");
        assertThat(palette.size()).isEqualTo(3);
    }

    @Test
    void append_nullEntry_throwsIllegalArgumentException() {
        assertThatThrownBy(() -> palette.append(null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Cannot add null to Palette");
    }

    // ========== put Tests ==========

    @Test
    void put_explicitIds_areSparse() {
        palette.put(7, "Water");
        palette.put(300, "Lava");

        assertThat(palette.get(7)).isEqualTo("Water");
        assertThat(palette.get(300)).isEqualTo("Lava");
        assertThat(palette.contains(0)).isFalse();
        assertThat(palette.get(0)).isNull();
        assertThat(palette.entries()).containsExactly("Water", "Lava");
    }

    @Test
    void put_duplicateId_laterEntryWins() {
        palette.put(1, "Water");
        palette.put(1, "Lava");

        assertThat(palette.get(1)).isEqualTo("Lava");
        assertThat(palette.size()).isEqualTo(2);
    }

    @Test
    void entries_isUnmodifiable() {
        palette.append("Sand");

        assertThatThrownBy(() -> palette.entries().add("Dirt"))
                .isInstanceOf(UnsupportedOperationException.class);
    }
}
