package com.dayloop.timeline.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ChunkRegistrationRequest {
    // Both optional: the store picks a timestamped file name and "now" when absent
    private String filePath;
    private Long startTs;
}
