package io.relaywatch;

import io.relaywatch.cli.RelayWatchCommand;
import picocli.CommandLine;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = new CommandLine(new RelayWatchCommand()).execute(args);
        System.exit(code);
    }
}
