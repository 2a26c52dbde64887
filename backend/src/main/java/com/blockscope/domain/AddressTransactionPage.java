package com.blockscope.domain;

import java.util.List;

public record AddressTransactionPage(List<AddressTransaction> rows, Pagination pagination) {
}
