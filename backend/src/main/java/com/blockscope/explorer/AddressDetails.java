package com.blockscope.explorer;

import com.blockscope.domain.AddressSummary;
import com.blockscope.domain.AddressTransaction;
import com.blockscope.domain.AddressUtxo;
import com.blockscope.domain.Pagination;

import java.util.List;

public record AddressDetails(
        AddressSummary summary,
        List<AddressUtxo> utxos,
        List<AddressTransaction> transactions,
        Pagination pagination
) {
}
