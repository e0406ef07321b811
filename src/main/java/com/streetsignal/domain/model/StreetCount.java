package com.streetsignal.domain.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

@Getter
@EqualsAndHashCode
@ToString
public class StreetCount {
    private final String name;
    private final int count;

    public StreetCount(String name, int count) {
        this.name = name;
        this.count = count;
    }
}
