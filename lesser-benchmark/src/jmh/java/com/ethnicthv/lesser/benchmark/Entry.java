package com.ethnicthv.lesser.benchmark;

public record Entry(String s, int i) {
}
