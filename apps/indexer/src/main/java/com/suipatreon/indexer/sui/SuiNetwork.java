package com.suipatreon.indexer.sui;

import java.util.Locale;

public enum SuiNetwork {
    MAINNET("https://fullnode.mainnet.sui.io:443"),
    TESTNET("https://fullnode.testnet.sui.io:443"),
    DEVNET("https://fullnode.devnet.sui.io:443"),
    LOCALNET("http://127.0.0.1:9000");

    private final String fullnodeUrl;

    SuiNetwork(String fullnodeUrl) {
        this.fullnodeUrl = fullnodeUrl;
    }

    public String getFullnodeUrl() {
        return fullnodeUrl;
    }

    public static SuiNetwork fromName(String name) {
        if (name == null || name.isBlank()) {
            return TESTNET;
        }
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown Sui network: " + name, e);
        }
    }
}
