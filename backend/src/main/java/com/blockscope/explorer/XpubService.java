package com.blockscope.explorer;

import com.blockscope.domain.AddressSummary;
import com.blockscope.domain.DerivedAddress;
import com.blockscope.domain.XpubRecord;
import com.blockscope.indexer.config.AddressIndexProperties;
import com.blockscope.indexer.engine.AddressIndexer;
import lombok.extern.slf4j.Slf4j;
import org.bitcoinj.core.NetworkParameters;
import org.bitcoinj.core.SegwitAddress;
import org.bitcoinj.crypto.ChildNumber;
import org.bitcoinj.crypto.DeterministicKey;
import org.bitcoinj.crypto.HDKeyDerivation;
import org.bitcoinj.params.MainNetParams;
import org.bitcoinj.params.RegTestParams;
import org.bitcoinj.params.TestNet3Params;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Derives native segwit (P2WPKH) addresses from an extended public key and reports their indexed activity.
 * Both branches (0 receive, 1 change) are scanned until gapLimit consecutive addresses have no activity.
 */
@Slf4j
@Service
public class XpubService {

    static final Map<String, NetworkParameters> NETWORKS = new LinkedHashMap<>();

    static {
        NETWORKS.put("mainnet", MainNetParams.get());
        NETWORKS.put("regtest", RegTestParams.get());
        NETWORKS.put("testnet", TestNet3Params.get());
    }

    private final AddressIndexer indexer;
    private final AddressIndexProperties properties;

    public XpubService(AddressIndexer indexer, AddressIndexProperties properties) {
        this.indexer = indexer;
        this.properties = properties;
    }

    public XpubDetails getXpubDetails(String xpub) {
        if (xpub == null || xpub.isBlank()) {
            throw new BadRequestException("xpub is required");
        }
        String key = xpub.trim();
        int gapLimit = Math.max(1, properties.getXpubGapLimit());
        Optional<XpubRecord> known = indexer.findXpub(key);
        Map<String, DeterministicKey> parsed = parse(key);
        if (parsed.isEmpty()) {
            throw new BadRequestException("Invalid xpub");
        }

        String network = known.map(XpubRecord::network).filter(parsed::containsKey).orElse(null);
        Map<Long, String> cached = new HashMap<>();
        if (network != null) {
            for (DerivedAddress d : indexer.loadDerivedAddresses(key)) {
                cached.put(slot(d.branch(), d.index()), d.address());
            }
        } else {
            network = detectNetwork(parsed, gapLimit);
        }

        NetworkParameters params = NETWORKS.get(network);
        DeterministicKey root = parsed.get(network);
        List<DerivedAddress> derived = new ArrayList<>();
        int[] lastUsed = new int[]{-1, -1};
        for (int branch = 0; branch <= 1; branch++) {
            DeterministicKey branchKey = HDKeyDerivation.deriveChildKey(root, new ChildNumber(branch, false));
            int unused = 0;
            for (int index = 0; unused < gapLimit; index++) {
                String address = cached.get(slot(branch, index));
                if (address == null) {
                    address = deriveAddress(branchKey, index, params);
                }
                derived.add(new DerivedAddress(branch, index, address));
                if (indexer.hasAddressActivity(address)) {
                    lastUsed[branch] = index;
                    unused = 0;
                } else {
                    unused++;
                }
            }
        }

        indexer.saveXpub(new XpubRecord(key, network, gapLimit, lastUsed[0], lastUsed[1], System.currentTimeMillis()),
                derived);
        log.debug("xpub scanned network={} addresses={} lastReceive={} lastChange={}",
                network, derived.size(), lastUsed[0], lastUsed[1]);
        return summarize(key, network, gapLimit, derived);
    }

    private XpubDetails summarize(String xpub, String network, int gapLimit, List<DerivedAddress> derived) {
        List<XpubDetails.XpubAddress> rows = new ArrayList<>(derived.size());
        long balance = 0;
        long received = 0;
        long sent = 0;
        for (DerivedAddress d : derived) {
            Optional<AddressSummary> summary = indexer.getAddressSummary(d.address());
            if (summary.isPresent()) {
                AddressSummary s = summary.get();
                rows.add(new XpubDetails.XpubAddress(d.branch(), d.index(), d.address(),
                        s.balanceSat(), s.totalReceivedSat(), s.totalSentSat(), s.txCount()));
                balance += s.balanceSat();
                received += s.totalReceivedSat();
                sent += s.totalSentSat();
            } else {
                rows.add(new XpubDetails.XpubAddress(d.branch(), d.index(), d.address(), 0, 0, 0, 0));
            }
        }
        return new XpubDetails(xpub, network, gapLimit, new XpubDetails.Totals(balance, received, sent), rows);
    }

    /** First network whose receive branch has indexed activity within the gap limit, else the first that parses. */
    private String detectNetwork(Map<String, DeterministicKey> parsed, int gapLimit) {
        for (Map.Entry<String, DeterministicKey> e : parsed.entrySet()) {
            NetworkParameters params = NETWORKS.get(e.getKey());
            DeterministicKey receive = HDKeyDerivation.deriveChildKey(e.getValue(), new ChildNumber(0, false));
            for (int i = 0; i < gapLimit; i++) {
                if (indexer.hasAddressActivity(deriveAddress(receive, i, params))) {
                    return e.getKey();
                }
            }
        }
        return parsed.keySet().iterator().next();
    }

    static Map<String, DeterministicKey> parse(String xpub) {
        Map<String, DeterministicKey> out = new LinkedHashMap<>();
        for (Map.Entry<String, NetworkParameters> e : NETWORKS.entrySet()) {
            try {
                DeterministicKey key = DeterministicKey.deserializeB58(xpub, e.getValue());
                out.put(e.getKey(), key.dropPrivateBytes());
            } catch (IllegalArgumentException ex) {
                log.trace("xpub does not parse for {}: {}", e.getKey(), ex.getMessage());
            }
        }
        return out;
    }

    static String deriveAddress(DeterministicKey branchKey, int index, NetworkParameters params) {
        DeterministicKey child = HDKeyDerivation.deriveChildKey(branchKey, new ChildNumber(index, false));
        return SegwitAddress.fromKey(params, child).toBech32();
    }

    private static long slot(int branch, int index) {
        return ((long) branch << 32) | (index & 0xffffffffL);
    }
}
