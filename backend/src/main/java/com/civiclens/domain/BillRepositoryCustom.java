package com.civiclens.domain;

import java.time.Instant;
import java.util.List;

public interface BillRepositoryCustom {

    /**
     * Bills never synced or last synced before {@code cutoff}; never-synced first, then oldest, then highest priority.
     */
    List<Bill> findStale(Instant cutoff, int limit);
}
