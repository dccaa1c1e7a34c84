package com.delta.gapreview.source;

import com.delta.gapreview.ranking.Candidate;
import com.delta.gapreview.ranking.IsoDurations;

import java.time.Instant;

/**
 * Item as returned by a candidate source. Search listings carry only identity and snippet fields;
 * detail lookups fill in counts and duration.
 */
public record RawCatalogItem(
    String id,
    String title,
    String description,
    String channelTitle,
    String channelId,
    Instant publishedAt,
    String durationIso,
    Long viewCount,
    Long likeCount,
    Long commentCount,
    String url
) {
    public Candidate toCandidate() {
        return new Candidate(
            id,
            title,
            description,
            channelTitle,
            channelId,
            likeCount,
            viewCount,
            IsoDurations.parseSeconds(durationIso),
            publishedAt,
            url
        );
    }

    /**
     * Details win; the listing fills whatever the detail lookup left out.
     */
    public RawCatalogItem mergeListing(RawCatalogItem listing) {
        if (listing == null) {
            return this;
        }
        return new RawCatalogItem(
            id,
            title != null ? title : listing.title(),
            description != null ? description : listing.description(),
            channelTitle != null ? channelTitle : listing.channelTitle(),
            channelId != null ? channelId : listing.channelId(),
            publishedAt != null ? publishedAt : listing.publishedAt(),
            durationIso != null ? durationIso : listing.durationIso(),
            viewCount != null ? viewCount : listing.viewCount(),
            likeCount != null ? likeCount : listing.likeCount(),
            commentCount != null ? commentCount : listing.commentCount(),
            url != null ? url : listing.url()
        );
    }
}
