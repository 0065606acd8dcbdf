package com.fantasygolf.engine.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OverBudgetRoster {
    private String rosterId;
    private String userId;
    private List<String> golferIds;
    private long totalCost;
    private long salaryCap;
    private long overBy;
}
