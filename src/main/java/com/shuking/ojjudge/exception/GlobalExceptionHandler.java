package com.shuking.ojjudge.exception;

import cn.hutool.core.util.IdUtil;
import com.shuking.ojjudge.model.ExecuteCodeResponse;
import com.shuking.ojjudge.model.JudgeInfo;
import com.shuking.ojjudge.model.enums.Verdict;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.ArrayList;

/**
 * 全局异常处理器，控制器外抛出的异常统一转换为 IE 响应
 *
 * @author shu
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    /**
     * 请求体无法解析
     *
     * @param e 异常
     * @return IE 响应
     */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public ExecuteCodeResponse messageNotReadableHandler(HttpMessageNotReadableException e) {
        log.error("HttpMessageNotReadableException {}", e.getMessage());
        return getErrorResponse("Malformed request: " + e.getMostSpecificCause().getMessage());
    }

    /**
     * 请求参数非法
     */
    @ExceptionHandler(IllegalArgumentException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public ExecuteCodeResponse illegalArgumentHandler(IllegalArgumentException e) {
        log.error("IllegalArgumentException {}", e.getMessage());
        return getErrorResponse(e.getMessage());
    }

    /**
     * 沙箱自身异常
     *
     * @param e 异常
     * @return IE 响应
     */
    @ExceptionHandler(RuntimeException.class)
    @ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
    public ExecuteCodeResponse runtimeExceptionHandler(RuntimeException e) {
        log.error("RuntimeException", e);
        return getErrorResponse(e.getMessage());
    }

    private static ExecuteCodeResponse getErrorResponse(String errMsg) {
        return ExecuteCodeResponse.builder()
                .submissionId(IdUtil.fastSimpleUUID())
                .verdict(Verdict.IE)
                .judgeInfo(JudgeInfo.builder().message(errMsg).build())
                .message(errMsg)
                .results(new ArrayList<>())
                .build();
    }
}
