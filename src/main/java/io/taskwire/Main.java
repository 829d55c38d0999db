package io.taskwire;

import io.taskwire.cli.TaskWireCommand;
import picocli.CommandLine;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = new CommandLine(new TaskWireCommand()).execute(args);
        System.exit(code);
    }
}
