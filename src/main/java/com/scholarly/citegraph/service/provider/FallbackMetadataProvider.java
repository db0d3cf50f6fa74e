package com.scholarly.citegraph.service.provider;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Asks the primary provider first and the secondary one whenever the primary answer is not OK.
 */
@Slf4j
@RequiredArgsConstructor
public class FallbackMetadataProvider implements MetadataProvider {

    private final MetadataProvider primary;
    private final MetadataProvider secondary;

    @Override
    public ForwardLookup fetchForward(String id) {
        ForwardLookup lookup = primary.fetchForward(id);
        if (lookup.isOk()) {
            return lookup;
        }
        log.debug("Primary forward lookup for {} returned {}, falling back", id, lookup.getStatus());
        return secondary.fetchForward(id);
    }

    @Override
    public BackwardLookup fetchBackward(String id) {
        BackwardLookup lookup = primary.fetchBackward(id);
        if (lookup.isOk()) {
            return lookup;
        }
        log.debug("Primary backward lookup for {} returned {}, falling back", id, lookup.getStatus());
        return secondary.fetchBackward(id);
    }
}
