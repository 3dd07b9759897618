package io.github.yok.prismlink.cli;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.BooleanUtils;

/**
 * Parsed command line: {@code <group> <action> [arguments...] [--option value] [--flag]}.
 *
 * <p>
 * Options taking a value and flags are recognized by their long name only. Unknown options are
 * logged and ignored.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@Getter
public final class CliArguments {

    // Options followed by a value
    static final Set<String> VALUE_OPTIONS = ImmutableSet.of("--limit", "--offset", "--type",
            "--operation", "--table-id", "--table-name", "--display-name", "--description",
            "--documentation", "--enable-for-analysis", "--source-id", "--source-name",
            "--bucket-name", "--schema", "--container");

    // Options without a value
    static final Set<String> FLAG_OPTIONS =
            ImmutableSet.of("--is-name", "--search", "--compact", "--truncate");

    private final String group;

    private final String action;

    private final List<String> positionals;

    private final Map<String, String> options;

    private final Set<String> flags;

    private CliArguments(String group, String action, List<String> positionals,
            Map<String, String> options, Set<String> flags) {
        this.group = group;
        this.action = action;
        this.positionals = ImmutableList.copyOf(positionals);
        this.options = ImmutableMap.copyOf(options);
        this.flags = ImmutableSet.copyOf(flags);
    }

    /**
     * Parses command-line arguments.
     *
     * @param args raw arguments
     * @return parsed arguments; group and action are null when missing
     */
    public static CliArguments parse(String... args) {
        List<String> words = new ArrayList<>();
        Map<String, String> options = new LinkedHashMap<>();
        Set<String> flags = new HashSet<>();
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if (VALUE_OPTIONS.contains(arg)) {
                if (i + 1 < args.length) {
                    options.put(arg, args[++i]);
                } else {
                    log.warn("Option {} requires a value", arg);
                }
            } else if (FLAG_OPTIONS.contains(arg)) {
                flags.add(arg);
            } else if (arg.startsWith("--")) {
                log.warn("Unknown argument: {}", arg);
            } else {
                words.add(arg);
            }
        }
        String group = words.isEmpty() ? null : words.remove(0);
        String action = words.isEmpty() ? null : words.remove(0);
        return new CliArguments(group, action, words, options, flags);
    }

    /**
     * Returns the value of an option.
     *
     * @param name long option name, e.g. {@code --limit}
     * @return value, or null if absent
     */
    public String option(String name) {
        return options.get(name);
    }

    /**
     * Returns an option parsed as an integer.
     *
     * @param name long option name
     * @return value, or null if absent
     * @throws IllegalArgumentException if the value is not an integer
     */
    public Integer intOption(String name) {
        String value = options.get(name);
        if (value == null) {
            return null;
        }
        try {
            return Integer.valueOf(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(name + " expects an integer but was: " + value, e);
        }
    }

    /**
     * Returns an option parsed as a boolean ({@code true/false}, {@code yes/no}, {@code on/off}).
     *
     * @param name long option name
     * @return value, or null if absent
     * @throws IllegalArgumentException if the value is not a boolean
     */
    public Boolean booleanOption(String name) {
        String value = options.get(name);
        if (value == null) {
            return null;
        }
        Boolean parsed = BooleanUtils.toBooleanObject(value.trim());
        if (parsed == null) {
            throw new IllegalArgumentException(name + " expects true or false but was: " + value);
        }
        return parsed;
    }

    /**
     * Returns whether a flag was given.
     *
     * @param name long flag name, e.g. {@code --search}
     * @return {@code true} if present
     */
    public boolean flag(String name) {
        return flags.contains(name);
    }

    /**
     * Returns a positional argument.
     *
     * @param index zero-based index after group and action
     * @return value, or null if absent
     */
    public String positional(int index) {
        return index < positionals.size() ? positionals.get(index) : null;
    }

    /**
     * Returns the positional arguments from {@code index} on as paths.
     *
     * @param index zero-based index of the first path
     * @return paths, possibly empty
     */
    public List<Path> paths(int index) {
        if (index >= positionals.size()) {
            return ImmutableList.of();
        }
        return positionals.subList(index, positionals.size()).stream().map(Paths::get)
                .collect(Collectors.toList());
    }
}
