package com.hcltech.rebac.service.messages;

/** Grant and Revoke reply with an empty message. */
public record EmptyResponse() {
    public static final EmptyResponse INSTANCE = new EmptyResponse();
}
