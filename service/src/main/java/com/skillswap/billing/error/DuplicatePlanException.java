package com.skillswap.billing.error;

public class DuplicatePlanException extends RuntimeException {
    public DuplicatePlanException(String name) {
        super("Subscription plan with name '" + name + "' already exists");
    }
}
