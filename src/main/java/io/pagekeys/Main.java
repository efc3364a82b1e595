package io.pagekeys;

import io.pagekeys.cli.PageKeysCommand;
import picocli.CommandLine;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = new CommandLine(new PageKeysCommand()).execute(args);
        System.exit(code);
    }
}
