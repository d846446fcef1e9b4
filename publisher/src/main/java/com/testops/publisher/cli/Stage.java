package com.testops.publisher.cli;

import java.util.Arrays;
import java.util.Optional;

/** CI stages selectable as the first command-line argument. */
public enum Stage {
    PUBLISH("publish"),
    IMPORT_RESULTS("import-results"),
    ATTACH_REPORTS("attach-reports"),
    CREATE_EXECUTION("create-execution");

    private final String command;

    Stage(String command) {
        this.command = command;
    }

    public String command() {
        return command;
    }

    public static Optional<Stage> fromCommand(String command) {
        return Arrays.stream(values())
                .filter(s -> s.command.equalsIgnoreCase(command))
                .findFirst();
    }
}
