package com.securefile.core.process;

import java.util.List;
import java.util.Objects;

/**
 * Executable path followed by its positional arguments.
 */
public record Command(List<String> arguments) {

    public Command {
        Objects.requireNonNull(arguments, "arguments");
        if (arguments.isEmpty()) {
            throw new IllegalArgumentException("command needs an executable");
        }
        arguments = List.copyOf(arguments);
    }

    public static Command of(String executable, String... args) {
        String[] all = new String[args.length + 1];
        all[0] = executable;
        System.arraycopy(args, 0, all, 1, args.length);
        return new Command(List.of(all));
    }

    public String executable() {
        return arguments.get(0);
    }

    @Override
    public String toString() {
        return String.join(" ", arguments);
    }
}
