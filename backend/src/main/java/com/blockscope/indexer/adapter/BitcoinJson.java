package com.blockscope.indexer.adapter;

import com.fasterxml.jackson.databind.JsonNode;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;

/**
 * Helpers for reading verbose block and transaction JSON returned by Bitcoin Core.
 */
public final class BitcoinJson {

    private BitcoinJson() {
    }

    /**
     * BTC decimal amount to satoshis, rounding half-up. Missing or non-numeric values give 0.
     */
    public static long toSatoshis(JsonNode btc) {
        if (btc == null || btc.isMissingNode() || btc.isNull()) {
            return 0L;
        }
        BigDecimal value;
        if (btc.isNumber()) {
            value = btc.decimalValue();
        } else if (btc.isTextual()) {
            try {
                value = new BigDecimal(btc.asText().trim());
            } catch (NumberFormatException e) {
                return 0L;
            }
        } else {
            return 0L;
        }
        return value.movePointRight(8).setScale(0, RoundingMode.HALF_UP).longValueExact();
    }

    /**
     * Addresses paid by a scriptPubKey: the single "address" field on current nodes, or the legacy
     * "addresses" array.
     */
    public static List<String> addressesOf(JsonNode scriptPubKey) {
        List<String> out = new ArrayList<>(1);
        if (scriptPubKey == null || scriptPubKey.isMissingNode()) {
            return out;
        }
        JsonNode single = scriptPubKey.path("address");
        if (single.isTextual() && !single.asText().isEmpty()) {
            out.add(single.asText());
            return out;
        }
        for (JsonNode a : scriptPubKey.path("addresses")) {
            if (a.isTextual() && !a.asText().isEmpty()) {
                out.add(a.asText());
            }
        }
        return out;
    }

    /** Output with the given n, or null. Falls back to array position when "n" is absent. */
    public static JsonNode findOutput(JsonNode tx, int vout) {
        JsonNode outputs = tx.path("vout");
        for (int i = 0; i < outputs.size(); i++) {
            JsonNode o = outputs.get(i);
            int n = o.has("n") ? o.path("n").asInt() : i;
            if (n == vout) {
                return o;
            }
        }
        return null;
    }

    public static boolean isCoinbase(JsonNode input) {
        return input.hasNonNull("coinbase") || !input.hasNonNull("txid");
    }

    public static String txid(JsonNode tx) {
        return tx.path("txid").asText(null);
    }
}
