package com.commissionaudit.common.dto.reconciliation;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * One row of the active commission tier table.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CommissionTierDto {

    private String name;
    private BigDecimal min;
    private BigDecimal max;             // null = unbounded
    private BigDecimal repeatRate;
    private BigDecimal newRate;
    private BigDecimal incentiveRate;
    private BigDecimal bonus;
}
