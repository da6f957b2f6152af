package com.whalewatch.domain.model;

import java.math.BigDecimal;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class WindowSample {

    private String sourceId;
    private BigDecimal amount;
    private long occurredAt;
}
