package com.scholarly.citegraph.repository;

import lombok.Value;

import java.nio.file.Path;

/**
 * A {@code <ISSN>_<year>.json} file of the local shard dataset.
 */
@Value
public class ShardFile {
    String issn;
    int year;
    Path path;
}
