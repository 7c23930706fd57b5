package com.shuking.ojjudge.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 资源限制覆盖项，字段为 null 表示沿用上一层的值
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LimitOverride {

    private Long wallClockMs;

    private Long cpuTimeMs;

    private Integer memoryMb;

    private Integer stackMb;

    private Integer fileSizeMb;

    private Integer openFiles;

    private Integer processes;
}
