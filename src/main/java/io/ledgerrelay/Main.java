package io.ledgerrelay;

import io.ledgerrelay.cli.LedgerRelayCommand;
import picocli.CommandLine;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = new CommandLine(new LedgerRelayCommand()).execute(args);
        System.exit(code);
    }
}
