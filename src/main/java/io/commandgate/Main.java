package io.commandgate;

import io.commandgate.cli.CommandGateCommand;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = CommandGateCommand.commandLine().execute(args);
        System.exit(code);
    }
}
