package com.shuking.ojjudge.service;


import com.shuking.ojjudge.model.ExecuteCodeRequest;
import com.shuking.ojjudge.model.ExecuteCodeResponse;
import com.shuking.ojjudge.model.SyntaxCheckResponse;

import java.util.List;

public interface CodeSandBox {
    // 使用接口定义执行方法提高通用性
    ExecuteCodeResponse executeCode(ExecuteCodeRequest request);

    /**
     * 只检查语法与结构，不运行
     */
    SyntaxCheckResponse checkSyntax(String language, String code);

    /**
     * 语言的入门模板
     *
     * @return 模板代码，不支持的语言返回 null
     */
    String getTemplate(String language);

    List<String> supportedLanguages();
}
