package io.laneboard;

import io.laneboard.cli.LaneBoardCommand;
import picocli.CommandLine;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = new CommandLine(new LaneBoardCommand()).execute(args);
        System.exit(code);
    }
}
