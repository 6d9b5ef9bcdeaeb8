package io.liparakis.regionmap.render;

/**
 * Slope shading for top-down terrain.
 * <p>
 * The height gradient at a sub-cell position is estimated twice: along the
 * axes (W-centre-E, N-centre-S) and along the diagonals (NW-centre-SE,
 * NE-centre-SW). The axis estimate counts double. The resulting normal is lit
 * by a fixed directional light with 40% ambient and 60% diffuse.
 */
public final class Shader {
    /** Vertical scale of the surface normal. */
    static final double NORMAL_Y = 3.0;

    static final double AMBIENT = 0.4;
    static final double DIFFUSE = 0.6;

    private static final double[] LIGHT = normalize(-0.2, 0.8, 0.5);

    private static final double AXIS_WEIGHT = 2.0;

    private Shader() {
    }

    /**
     * Computes the shading multiplier.
     *
     * @param center       height of the centre column
     * @param neighborhood heights of the surrounding columns
     * @param u            sub-cell position along X, 0-1
     * @param v            sub-cell position along Z, 0-1
     * @return {@code 0.4 + 0.6 * max(0, normal . light)}
     */
    public static double shade(int center, Neighborhood neighborhood, double u, double v) {
        double axisX = lerp(center - neighborhood.w(), neighborhood.e() - center, u);
        double axisZ = lerp(center - neighborhood.n(), neighborhood.s() - center, v);

        // NW->SE runs along (+x, +z), NE->SW along (-x, +z).
        double ud = (u + v) / 2.0;
        double vd = (1.0 - u + v) / 2.0;
        double slopeDown = lerp(center - neighborhood.nw(), neighborhood.se() - center, ud);
        double slopeUp = lerp(center - neighborhood.ne(), neighborhood.sw() - center, vd);
        double diagX = (slopeDown - slopeUp) / 2.0;
        double diagZ = (slopeDown + slopeUp) / 2.0;

        double dhdx = axisX * AXIS_WEIGHT + diagX;
        double dhdz = axisZ * AXIS_WEIGHT + diagZ;

        double[] normal = normalize(dhdx, NORMAL_Y, dhdz);
        double lambert = Math.max(0.0,
                normal[0] * LIGHT[0] + normal[1] * LIGHT[1] + normal[2] * LIGHT[2]);
        return AMBIENT + DIFFUSE * lambert;
    }

    /**
     * Multiplies each channel by {@code shade}, capping at 255 and truncating.
     */
    public static int apply(int rgb, double shade) {
        int r = (int) Math.min(255.0, Rgb.red(rgb) * shade);
        int g = (int) Math.min(255.0, Rgb.green(rgb) * shade);
        int b = (int) Math.min(255.0, Rgb.blue(rgb) * shade);
        return Rgb.of(r, g, b);
    }

    private static double lerp(double a, double b, double t) {
        return a + (b - a) * t;
    }

    private static double[] normalize(double x, double y, double z) {
        double length = Math.sqrt(x * x + y * y + z * z);
        if (length == 0.0) {
            return new double[] {0.0, 0.0, 0.0};
        }
        return new double[] {x / length, y / length, z / length};
    }
}
