package io.liparakis.regionmap.render;

/**
 * Helpers for colours packed as {@code 0xRRGGBB} ints.
 */
public final class Rgb {
    public static final int WHITE = 0xFFFFFF;
    public static final int BLACK = 0x000000;

    private Rgb() {
    }

    public static int of(int r, int g, int b) {
        return (clamp(r) << 16) | (clamp(g) << 8) | clamp(b);
    }

    public static int red(int rgb) {
        return (rgb >> 16) & 0xFF;
    }

    public static int green(int rgb) {
        return (rgb >> 8) & 0xFF;
    }

    public static int blue(int rgb) {
        return rgb & 0xFF;
    }

    public static int clamp(int channel) {
        return Math.max(0, Math.min(255, channel));
    }

    /**
     * Parses {@code #RRGGBB} (the leading {@code #} is optional).
     *
     * @throws IllegalArgumentException if the value is not six hex digits
     */
    public static int parseHex(String value) {
        String hex = value.startsWith("#") ? value.substring(1) : value;
        if (hex.length() != 6) {
            throw new IllegalArgumentException("Not a #RRGGBB colour: " + value);
        }
        try {
            return Integer.parseInt(hex, 16);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Not a #RRGGBB colour: " + value, e);
        }
    }

    public static String toHex(int rgb) {
        return String.format("#%06X", rgb & 0xFFFFFF);
    }
}
