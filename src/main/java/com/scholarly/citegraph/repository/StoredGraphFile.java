package com.scholarly.citegraph.repository;

import lombok.Value;

import java.time.Instant;

@Value
public class StoredGraphFile {
    String name;
    long sizeBytes;
    Instant modifiedAt;
}
