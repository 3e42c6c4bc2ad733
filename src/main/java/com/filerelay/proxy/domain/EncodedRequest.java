package com.filerelay.proxy.domain;

public record EncodedRequest(String name, TransactionRecord record) {
}
