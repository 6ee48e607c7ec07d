package dev.goodone.rabbit;

public enum ExchangeType {
    direct,
    topic,
    fanout
}
