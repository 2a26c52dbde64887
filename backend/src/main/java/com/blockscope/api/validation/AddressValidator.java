package com.blockscope.api.validation;

import org.springframework.stereotype.Component;

import java.util.regex.Pattern;

/**
 * Shape check for Bitcoin addresses and extended public keys before they reach the index.
 * Checksums are not verified; an address that passes but was never seen is simply not found.
 */
@Component
public class AddressValidator {

    /** Legacy P2PKH/P2SH on mainnet, testnet and regtest. */
    private static final Pattern BASE58_ADDRESS = Pattern.compile("^[123mn][1-9A-HJ-NP-Za-km-z]{25,34}$");
    private static final Pattern BECH32_ADDRESS = Pattern.compile("^(bc|tb|bcrt)1[02-9ac-hj-np-z]{8,87}$");
    /** xpub/tpub/ypub/zpub/upub/vpub. */
    private static final Pattern EXTENDED_KEY = Pattern.compile("^[xtyzuv]pub[1-9A-HJ-NP-Za-km-z]{100,112}$");

    public boolean isValidAddress(String address) {
        if (address == null || address.isBlank()) return false;
        String a = address.trim();
        return BASE58_ADDRESS.matcher(a).matches() || BECH32_ADDRESS.matcher(a.toLowerCase()).matches()
                && (a.equals(a.toLowerCase()) || a.equals(a.toUpperCase()));
    }

    public boolean isValidXpub(String xpub) {
        if (xpub == null || xpub.isBlank()) return false;
        return EXTENDED_KEY.matcher(xpub.trim()).matches();
    }
}
