package com.nightlifemap.directory.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Zone catalogue entry. {@code columnRanges} holds the {min, max} valid columns of each row, top to bottom.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ZoneLayoutDTO {

    private String id;
    private String displayName;
    private int rows;
    private int maxCols;
    private int cellCount;
    private List<int[]> columnRanges;
}
