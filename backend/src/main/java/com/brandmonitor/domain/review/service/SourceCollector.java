package com.brandmonitor.domain.review.service;

import com.brandmonitor.domain.review.model.ReviewItem;

import java.util.List;

/**
 * A platform-specific source of raw review items. Treated as unreliable: callers isolate
 * each collector's failure and carry on with the others.
 */
public interface SourceCollector {

    /**
     * Stable identifier used in collection outcomes and logs (e.g. {@code "dcard"}).
     */
    String sourceId();

    /**
     * Collects items mentioning the brand. May return an empty list.
     *
     * @throws Exception any fetch or parse failure; the caller counts it as zero items from this source
     */
    List<ReviewItem> collect(String brandName) throws Exception;
}
