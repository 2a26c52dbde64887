package com.blockscope.explorer;

import java.util.List;

/**
 * Derived addresses of an xpub with their indexed activity, plus totals over all of them.
 */
public record XpubDetails(
        String xpub,
        String network,
        int gapLimit,
        Totals totals,
        List<XpubAddress> addresses
) {

    public record Totals(long balanceSat, long totalReceivedSat, long totalSentSat) {
    }

    public record XpubAddress(
            int branch,
            int index,
            String address,
            long balanceSat,
            long totalReceivedSat,
            long totalSentSat,
            long txCount
    ) {
    }
}
