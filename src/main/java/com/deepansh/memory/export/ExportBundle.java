package com.deepansh.memory.export;

import com.deepansh.memory.model.CategorySummary;
import com.deepansh.memory.model.MemoryRecord;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExportBundle {

    private String ownerId;

    private Instant exportedAt;

    @Builder.Default
    private List<MemoryRecord> records = new ArrayList<>();

    @Builder.Default
    private List<CategorySummary> summaries = new ArrayList<>();

    /** PRIVATE records left out of this bundle. */
    private int privateRecordsWithheld;
}
