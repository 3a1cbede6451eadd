package com.transferhub.pricing.exception;

public class PricingException extends RuntimeException {

    private final String code;

    public PricingException(String code, String message) {
        super(message);
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
