package com.commissionaudit.reconciliation.model;

import lombok.Builder;
import lombok.Value;

/**
 * The two sheets a reconciliation needs, already decoded into memory.
 */
@Value
@Builder
public class WorkbookGrids {

    String fileName;
    TabularGrid detail;
    TabularGrid summary;
}
