package com.jasmin.threatguard.controllers;

final class Params {
    static final int MAX_LIMIT = 1000;

    private Params() {
    }

    static int checkRange(String name, int value, int min, int max) {
        if (value < min || value > max) {
            throw new IllegalArgumentException(name + " must be between " + min + " and " + max);
        }
        return value;
    }

    static int checkLimit(int limit) {
        return checkRange("limit", limit, 1, MAX_LIMIT);
    }
}
