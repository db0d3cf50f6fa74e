package com.scholarly.citegraph.service.provider;

import com.scholarly.citegraph.model.FetchStatus;
import lombok.Value;

import java.util.List;
import java.util.Objects;

@Value
public class BackwardLookup {

    FetchStatus status;
    List<String> citers;

    public BackwardLookup(FetchStatus status, List<String> citers) {
        this.status = status != null ? status : FetchStatus.UNAVAILABLE;
        this.citers = citers == null ? List.of() : citers.stream().filter(Objects::nonNull).toList();
    }

    public static BackwardLookup found(List<String> citers) {
        return new BackwardLookup(FetchStatus.OK, citers);
    }

    public static BackwardLookup notFound() {
        return new BackwardLookup(FetchStatus.NOT_FOUND, List.of());
    }

    public static BackwardLookup unavailable() {
        return new BackwardLookup(FetchStatus.UNAVAILABLE, List.of());
    }

    public boolean isOk() {
        return status == FetchStatus.OK;
    }
}
