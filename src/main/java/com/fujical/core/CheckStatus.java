package com.fujical.core;

public enum CheckStatus {
    OK,
    WARN,
    FAIL
}
