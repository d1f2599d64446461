package com.phillippitts.podcaster.service.fetch;

import com.phillippitts.podcaster.domain.SourceReference;

/**
 * Retrieves the raw content a podcast is generated from.
 */
public interface ContentFetcher {

    /**
     * @return page content, never blank
     * @throws com.phillippitts.podcaster.exception.ContentFetchException if nothing usable was retrieved
     */
    String fetch(SourceReference source);
}
