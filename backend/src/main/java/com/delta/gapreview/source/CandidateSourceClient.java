package com.delta.gapreview.source;

import java.util.List;

/**
 * External candidate lookup. Both calls are metered: callers consume quota under
 * {@link #resourceName()} before each attempt.
 */
public interface CandidateSourceClient {

    String resourceName();

    List<RawCatalogItem> search(String query, int maxResults);

    List<RawCatalogItem> fetchDetails(List<String> ids);
}
