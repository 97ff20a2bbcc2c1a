package com.specstructure.cli;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * {@code --name=value} options, bare {@code --flag}s and positional arguments of one subcommand.
 * Options may repeat; {@link #value} returns the last occurrence.
 */
final class CliOptions {

    private final List<String> positionals = new ArrayList<>();
    private final Map<String, List<String>> values = new LinkedHashMap<>();

    private CliOptions() {
    }

    /**
     * @param args     arguments after the subcommand name
     * @param valued   option names that take a value
     * @param flags    option names that take none
     */
    static CliOptions parse(List<String> args, Set<String> valued, Set<String> flags) {
        CliOptions options = new CliOptions();
        for (String arg : args) {
            if (arg == null || arg.isBlank()) {
                continue;
            }
            if (!arg.startsWith("--")) {
                options.positionals.add(arg);
                continue;
            }
            int separator = arg.indexOf('=');
            String name = separator < 0 ? arg.substring(2) : arg.substring(2, separator);
            if (flags.contains(name)) {
                if (separator >= 0) {
                    throw new IllegalArgumentException("--" + name + " does not take a value");
                }
                options.values.computeIfAbsent(name, key -> new ArrayList<>()).add("true");
                continue;
            }
            if (!valued.contains(name)) {
                throw new IllegalArgumentException("unknown option: " + arg);
            }
            String value = separator < 0 ? "" : arg.substring(separator + 1).trim();
            if (value.isEmpty()) {
                throw new IllegalArgumentException("--" + name + " requires a value");
            }
            options.values.computeIfAbsent(name, key -> new ArrayList<>()).add(value);
        }
        return options;
    }

    List<String> positionals() {
        return Collections.unmodifiableList(positionals);
    }

    String value(String name) {
        List<String> all = values.get(name);
        return all == null ? null : all.get(all.size() - 1);
    }

    List<String> all(String name) {
        return values.getOrDefault(name, List.of());
    }

    boolean flag(String name) {
        return values.containsKey(name);
    }

    /**
     * The named option, or the first positional argument when the option is absent.
     */
    String valueOrPositional(String name) {
        String value = value(name);
        if (value != null) {
            return value;
        }
        return positionals.isEmpty() ? null : positionals.get(0);
    }
}
