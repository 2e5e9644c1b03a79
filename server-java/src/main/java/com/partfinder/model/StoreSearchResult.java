package com.partfinder.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class StoreSearchResult {
    @Singular
    List<RankedStore> stores;
    @Singular
    List<StoreTypeTag> storeTypes;
    String advisory;
    boolean degraded;

    public boolean isEmpty() {
        return stores.isEmpty();
    }
}
