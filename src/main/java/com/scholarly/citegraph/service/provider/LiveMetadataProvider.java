package com.scholarly.citegraph.service.provider;

import lombok.RequiredArgsConstructor;

@RequiredArgsConstructor
public class LiveMetadataProvider implements MetadataProvider {

    private final CrossRefClient crossRefClient;
    private final OpenCitationsClient openCitationsClient;

    @Override
    public ForwardLookup fetchForward(String id) {
        return crossRefClient.fetchWork(id);
    }

    @Override
    public BackwardLookup fetchBackward(String id) {
        return openCitationsClient.fetchCiters(id);
    }
}
