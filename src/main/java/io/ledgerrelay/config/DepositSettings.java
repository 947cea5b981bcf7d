package io.ledgerrelay.config;

import com.fasterxml.jackson.annotation.JsonIgnore;

public record DepositSettings(
        String networkPassphrase,
        @JsonIgnore String distributionSeed,
        String issuerAccount,
        String startingBalance
) {
    public static final String TESTNET_PASSPHRASE = "Test SDF Network ; September 2015";

    public static DepositSettings defaults() {
        return new DepositSettings(TESTNET_PASSPHRASE, "", "", "2.01");
    }

    @JsonIgnore
    public boolean configured() {
        return !distributionSeed.isBlank() && !issuerAccount.isBlank();
    }

    static DepositSettings fromFile(Section raw, DepositSettings defaults) {
        if (raw == null) {
            return defaults;
        }
        return new DepositSettings(
                blankToDefault(raw.networkPassphrase(), defaults.networkPassphrase()),
                blankToDefault(raw.distributionSeed(), defaults.distributionSeed()),
                blankToDefault(raw.issuerAccount(), defaults.issuerAccount()),
                blankToDefault(raw.startingBalance(), defaults.startingBalance())
        );
    }

    private static String blankToDefault(String raw, String fallback) {
        return raw == null || raw.isBlank() ? fallback : raw.trim();
    }

    public record Section(
            String networkPassphrase,
            String distributionSeed,
            String issuerAccount,
            String startingBalance
    ) {
    }
}
