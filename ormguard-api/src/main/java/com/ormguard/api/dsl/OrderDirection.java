package com.ormguard.api.dsl;

public enum OrderDirection {
    ASC,
    DESC
}
