package com.tzbucket.cli;

import org.springframework.boot.ApplicationArguments;

import java.util.List;

/**
 * Typed access to {@code --name=value} options of a command.
 */
public class CommandOptions {

    private final ApplicationArguments arguments;

    public CommandOptions(ApplicationArguments arguments) {
        this.arguments = arguments;
    }

    /**
     * Returns the last value given for {@code name}, or {@code defaultValue} if the option is absent.
     */
    public String value(String name, String defaultValue) {
        List<String> values = arguments.getOptionValues(name);
        if (values == null || values.isEmpty()) {
            return defaultValue;
        }
        return values.get(values.size() - 1);
    }

    /**
     * Returns the value of a mandatory option.
     *
     * @throws IllegalArgumentException if the option is absent or blank
     */
    public String required(String name) {
        String value = value(name, null);
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(String.format("Missing required option --%s", name));
        }
        return value;
    }

    /** Returns true if {@code --name} was given, with or without a value. */
    public boolean flag(String name) {
        return arguments.containsOption(name);
    }
}
