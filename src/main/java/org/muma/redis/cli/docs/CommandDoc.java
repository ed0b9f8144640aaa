package org.muma.redis.cli.docs;

import java.util.List;
import java.util.stream.Collectors;

public record CommandDoc(String name, String summary, List<Argument> arguments) {

    public CommandDoc {
        arguments = List.copyOf(arguments);
    }

    public static CommandDoc empty(String name) {
        return new CommandDoc(name, "No documentation for " + name, List.of());
    }

    /**
     * 单行提示，例如 "Get the value of a key - Arguments: &lt;key&gt;"
     */
    public String hint() {
        if (arguments.isEmpty()) {
            return summary;
        }
        String args = arguments.stream()
                .map(arg -> arg.optional() ? "[" + arg.name() + "]" : "<" + arg.name() + ">")
                .collect(Collectors.joining(" "));
        return summary + " - Arguments: " + args;
    }

    public record Argument(String name, String type, boolean optional) {
    }
}
