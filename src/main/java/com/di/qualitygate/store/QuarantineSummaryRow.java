package com.di.qualitygate.store;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QuarantineSummaryRow {

    private String sourceTable;
    private String rejectedReason;
    private long rejectedCount;
}
