package com.linkvault.sync.aggregator;

public record LinkToken(String linkToken, String expiration) {
}
