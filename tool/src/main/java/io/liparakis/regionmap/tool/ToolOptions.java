package io.liparakis.regionmap.tool;

import io.liparakis.regionmap.render.RenderSettings;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Parsed command line: a command, its positional arguments and the global
 * options.
 * <pre>
 * --world DIR          chunks directory holding *.region.bin files (default: chunks)
 * --properties FILE    block display properties JSON (default: block_properties.json)
 * --scale N            pixels per block (default: 1)
 * --threads N          chunks rendered in parallel (default: 1)
 * </pre>
 */
public record ToolOptions(String command, List<String> arguments, Path world, Path properties,
                          RenderSettings settings) {
    public static final Path DEFAULT_WORLD = Path.of("chunks");
    public static final Path DEFAULT_PROPERTIES = Path.of("block_properties.json");

    public ToolOptions {
        arguments = List.copyOf(arguments);
    }

    /**
     * @throws IllegalArgumentException if an option is unknown, lacks its value or is not a valid number
     */
    public static ToolOptions parse(String[] args) {
        Path world = DEFAULT_WORLD;
        Path properties = DEFAULT_PROPERTIES;
        RenderSettings settings = RenderSettings.defaults();
        List<String> positional = new ArrayList<>();

        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            switch (arg) {
                case "--world" -> world = Path.of(value(args, ++i, arg));
                case "--properties" -> properties = Path.of(value(args, ++i, arg));
                case "--scale" -> settings = settings.withPixelsPerBlock(intValue(args, ++i, arg));
                case "--threads" -> settings = settings.withThreads(intValue(args, ++i, arg));
                default -> {
                    if (arg.startsWith("--")) {
                        throw new IllegalArgumentException("Unknown option: " + arg);
                    }
                    positional.add(arg);
                }
            }
        }

        if (positional.isEmpty()) {
            throw new IllegalArgumentException("Missing command");
        }
        return new ToolOptions(positional.get(0), positional.subList(1, positional.size()),
                world, properties, settings);
    }

    /**
     * @return the positional argument at {@code index} parsed as an int
     * @throws IllegalArgumentException if it is missing or not a number
     */
    public int intArgument(int index, String name) {
        if (index >= arguments.size()) {
            throw new IllegalArgumentException("Missing argument <" + name + "> for " + command);
        }
        return parseInt(arguments.get(index), name);
    }

    /**
     * @return the positional argument at {@code index}, or {@code fallback} if absent
     */
    public String argumentOr(int index, String fallback) {
        return index < arguments.size() ? arguments.get(index) : fallback;
    }

    private static String value(String[] args, int index, String option) {
        if (index >= args.length) {
            throw new IllegalArgumentException("Missing value for " + option);
        }
        return args[index];
    }

    private static int intValue(String[] args, int index, String option) {
        return parseInt(value(args, index, option), option);
    }

    private static int parseInt(String value, String name) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Not a number for " + name + ": " + value, e);
        }
    }
}
