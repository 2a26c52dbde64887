package com.blockscope.explorer;

public class AddressNotFoundException extends RuntimeException {

    public AddressNotFoundException(String address) {
        super("Address not found in local index: " + address);
    }
}
