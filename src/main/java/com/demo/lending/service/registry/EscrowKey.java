package com.demo.lending.service.registry;

public record EscrowKey(String owner, String collateralAsset, String debtAsset) {}
