package com.farmket.marketplace.model;

public enum UserType {
    BUYER,
    SELLER
}
