package hk.edu.hulab.portal.backend.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;

/**
 * One page cut out of a fully materialized, sorted listing.
 */
@Schema(description = "Paged listing")
public record PagedResult<T>(
        @Schema(description = "Items on this page") List<T> items,
        @Schema(description = "Number of items across all pages") int totalCount,
        @Schema(description = "Offset of the first item") int offset,
        @Schema(description = "Requested page size") int limit,
        @Schema(description = "Whether more items follow this page") boolean hasMore) {

    public static <T> PagedResult<T> slice(List<T> all, int offset, int limit) {
        int from = Math.min(Math.max(offset, 0), all.size());
        int to = (int) Math.min((long) from + Math.max(limit, 0), all.size());
        return new PagedResult<>(List.copyOf(all.subList(from, to)), all.size(), from, limit, to < all.size());
    }
}
