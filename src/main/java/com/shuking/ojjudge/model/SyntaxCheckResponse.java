package com.shuking.ojjudge.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SyntaxCheckResponse {

    private boolean valid;

    /**
     * 是否包含必要结构，如 include 与 main 入口
     */
    private boolean structureValid;

    private String message;

    private String language;
}
