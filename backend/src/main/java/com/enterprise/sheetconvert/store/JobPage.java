package com.enterprise.sheetconvert.store;

import com.enterprise.sheetconvert.model.JobRecord;
import lombok.Value;

import java.util.List;

/**
 * One page of an owner's jobs. {@code next} is null on the last page.
 */
@Value
public class JobPage {
    List<JobRecord> jobs;
    JobCursor next;
}
