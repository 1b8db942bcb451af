package com.nightlifemap.directory.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ZoneOccupancyDTO {

    private String zone;
    private String displayName;
    private int cellCount;
    private int placedCount;
    private int detachedCount;
    private int unplacedCount;
}
