package com.dayloop.timeline.dto;

import jakarta.validation.constraints.NotEmpty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ReprocessBatchesRequest {
    @NotEmpty(message = "At least one batch id required")
    private List<Long> batchIds;
}
