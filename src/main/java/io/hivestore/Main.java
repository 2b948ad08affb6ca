package io.hivestore;

import io.hivestore.cli.HiveStoreCommand;
import picocli.CommandLine;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = new CommandLine(new HiveStoreCommand()).execute(args);
        System.exit(code);
    }
}
