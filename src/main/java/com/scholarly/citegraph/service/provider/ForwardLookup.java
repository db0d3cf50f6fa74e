package com.scholarly.citegraph.service.provider;

import com.scholarly.citegraph.model.FetchStatus;
import com.scholarly.citegraph.model.PaperMetadata;
import lombok.Value;

import java.util.List;
import java.util.Objects;

/**
 * Metadata and reference list of one work. A missing status reads as UNAVAILABLE and missing or
 * null reference entries are dropped.
 */
@Value
public class ForwardLookup {

    FetchStatus status;
    PaperMetadata metadata;
    List<String> references;

    public ForwardLookup(FetchStatus status, PaperMetadata metadata, List<String> references) {
        this.status = status != null ? status : FetchStatus.UNAVAILABLE;
        this.metadata = metadata;
        this.references = references == null ? List.of() : references.stream().filter(Objects::nonNull).toList();
    }

    public static ForwardLookup found(PaperMetadata metadata, List<String> references) {
        return new ForwardLookup(FetchStatus.OK, metadata, references);
    }

    public static ForwardLookup notFound() {
        return new ForwardLookup(FetchStatus.NOT_FOUND, null, List.of());
    }

    public static ForwardLookup unavailable() {
        return new ForwardLookup(FetchStatus.UNAVAILABLE, null, List.of());
    }

    public boolean isOk() {
        return status == FetchStatus.OK;
    }
}
