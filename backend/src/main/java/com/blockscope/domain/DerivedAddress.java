package com.blockscope.domain;

/**
 * Address derived from an xpub at branch/index. branch 0 is receive, 1 is change.
 */
public record DerivedAddress(int branch, int index, String address) {
}
