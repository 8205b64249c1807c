package com.skillswap.billing.gateway;

public record PaymentLink(String link) {}
