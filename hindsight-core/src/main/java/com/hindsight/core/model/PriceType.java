package com.hindsight.core.model;

public enum PriceType {
    BID,
    ASK,
    MID
}
