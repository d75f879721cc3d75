package com.enterprise.sheetconvert.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * One page of the caller's jobs. Pass {@code nextPageToken} back to get the next page;
 * it is absent on the last one.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobListResponse {
    private List<JobView> jobs;
    private String nextPageToken;
}
