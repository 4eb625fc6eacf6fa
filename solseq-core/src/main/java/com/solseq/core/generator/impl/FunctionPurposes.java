package com.solseq.core.generator.impl;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Short descriptions for well-known function names, shown as notes above user calls
 * and contract-to-contract calls.
 *
 * <p>A name matches the first key it contains, ignoring case, so {@code withdrawAll}
 * reads as a withdrawal and {@code safeTransferFrom} as a transfer. Keys are tried in
 * list order, longer keys before the keys they contain.
 */
final class FunctionPurposes {

    private static final List<Map.Entry<String, String>> PURPOSES = List.of(
        Map.entry("constructor", "Contract initialization"),
        Map.entry("transfer", "Transfer tokens or ETH"),
        Map.entry("approve", "Approve token spending"),
        Map.entry("mint", "Create new tokens"),
        Map.entry("burn", "Destroy tokens"),
        Map.entry("deposit", "Deposit funds"),
        Map.entry("withdraw", "Withdraw funds"),
        Map.entry("claim", "Claim rewards or tokens"),
        Map.entry("unstake", "Unstake tokens"),
        Map.entry("stake", "Stake tokens"),
        Map.entry("vote", "Cast vote"),
        Map.entry("execute", "Execute operation"),
        Map.entry("deploy", "Deploy new contract instance"),
        Map.entry("predictAddress", "Calculate deterministic address"),
        Map.entry("airdropToAddresses", "Send ETH to multiple addresses"),
        Map.entry("airdropToKeyIds", "Send ETH to wallets identified by public keys"),
        Map.entry("airdrop", "Distribute tokens to addresses")
    );

    private FunctionPurposes() {
        throw new AssertionError("Utility class should not be instantiated");
    }

    static Optional<String> describe(String functionName) {
        if (functionName == null || functionName.isEmpty()) {
            return Optional.empty();
        }
        String name = functionName.toLowerCase(Locale.ROOT);
        return PURPOSES.stream()
            .filter(entry -> name.contains(entry.getKey().toLowerCase(Locale.ROOT)))
            .map(Map.Entry::getValue)
            .findFirst();
    }
}
