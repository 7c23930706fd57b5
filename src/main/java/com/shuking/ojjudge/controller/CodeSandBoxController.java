package com.shuking.ojjudge.controller;

import com.shuking.ojjudge.model.ExecuteCodeRequest;
import com.shuking.ojjudge.model.ExecuteCodeResponse;
import com.shuking.ojjudge.model.SyntaxCheckResponse;
import com.shuking.ojjudge.service.CodeSandBox;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import javax.annotation.Resource;
import java.util.List;

@RestController
@RequestMapping("/sandbox")
public class CodeSandBoxController {

    @Resource
    private CodeSandBox codeSandBox;

    /**
     * 心跳检测
     *
     * @return  ok
     */
    @GetMapping("/health")
    public String healthCheck() {
        return "ok";
    }

    /**
     * 执行代码沙箱
     * @param codeRequest   包含提交信息的对象
     * @return  判题结果
     */
    @PostMapping("/execute")
    public ExecuteCodeResponse doExecute(@RequestBody ExecuteCodeRequest codeRequest) {
        if (codeRequest == null)
            throw new IllegalArgumentException("请求参数为空");
        return codeSandBox.executeCode(codeRequest);
    }

    /**
     * 语法检查
     */
    @PostMapping("/syntax")
    public SyntaxCheckResponse checkSyntax(@RequestBody ExecuteCodeRequest codeRequest) {
        if (codeRequest == null)
            throw new IllegalArgumentException("请求参数为空");
        return codeSandBox.checkSyntax(codeRequest.getLanguage(), codeRequest.getCode());
    }

    @GetMapping("/template/{language}")
    public ResponseEntity<String> getTemplate(@PathVariable("language") String language) {
        String template = codeSandBox.getTemplate(language);
        if (template == null) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(template);
    }

    @GetMapping("/languages")
    public List<String> listLanguages() {
        return codeSandBox.supportedLanguages();
    }
}
