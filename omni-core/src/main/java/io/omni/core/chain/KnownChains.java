// SPDX-License-Identifier: MIT OR Apache-2.0
package io.omni.core.chain;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Chain ids of the networks the wallet talks to, and the keyword table used
 * to map a legacy RPC URL onto one of them.
 *
 * <p>
 * Keywords are matched as case-insensitive substrings of the URL, in table
 * order; the first match wins. A URL that matches nothing maps to
 * {@link #ETHEREUM}.
 *
 * <pre>{@code
 * long chainId = KnownChains.fromRpcUrl("https://polygon-rpc.com"); // 137
 * }</pre>
 */
public final class KnownChains {
    private KnownChains() {}

    public static final long ETHEREUM = 1L;
    public static final long OPTIMISM = 10L;
    public static final long BSC = 56L;
    public static final long POLYGON = 137L;
    public static final long BASE = 8453L;
    public static final long ARBITRUM = 42161L;
    public static final long AVALANCHE = 43114L;

    private record Keywords(long chainId, List<String> words) {}

    private static final List<Keywords> TABLE = List.of(
            new Keywords(POLYGON, List.of("polygon", "matic")),
            new Keywords(BSC, List.of("bsc", "binance")),
            new Keywords(AVALANCHE, List.of("avalanche", "avax")),
            new Keywords(ARBITRUM, List.of("arbitrum")),
            new Keywords(OPTIMISM, List.of("optimism")),
            new Keywords(BASE, List.of("base")));

    /**
     * Maps an RPC URL to a chain id by keyword.
     *
     * @param rpcUrl the legacy RPC URL
     * @return the matched chain id, or {@link #ETHEREUM} if no keyword matches
     * @throws NullPointerException if rpcUrl is null
     */
    public static long fromRpcUrl(final String rpcUrl) {
        Objects.requireNonNull(rpcUrl, "rpcUrl");
        final String lower = rpcUrl.toLowerCase(Locale.ROOT);
        for (Keywords entry : TABLE) {
            for (String word : entry.words()) {
                if (lower.contains(word)) {
                    return entry.chainId();
                }
            }
        }
        return ETHEREUM;
    }
}
