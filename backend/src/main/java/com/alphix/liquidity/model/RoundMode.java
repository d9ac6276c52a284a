package com.alphix.liquidity.model;

public enum RoundMode {
    UP,
    DOWN
}
