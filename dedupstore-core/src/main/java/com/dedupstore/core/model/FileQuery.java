package com.dedupstore.core.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Optional listing filters. Null fields do not constrain the result.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FileQuery {
    private String search; // case-insensitive filename substring
    private String fileType; // case-insensitive declared type substring
    private Long minSize;
    private Long maxSize;
    private Instant startDate;
    private Instant endDate;
}
