package com.shuking.ojjudge.service.enforcer;

import com.shuking.ojjudge.model.ResourceLimits;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.io.File;
import java.util.List;
import java.util.Map;

/**
 * 一次受限进程启动所需的全部参数
 */
@Value
@Builder
public class LaunchRequest {

    /**
     * 目标命令，不经过 shell
     */
    @Singular("arg")
    List<String> command;

    File workDir;

    /**
     * 额外环境变量，叠加在基础环境之上
     */
    @Singular("env")
    Map<String, String> environment;

    /**
     * 标准输入文件，为空时使用空输入
     */
    File stdinFile;

    File stdoutFile;

    File stderrFile;

    ResourceLimits limits;

    /**
     * 虚拟内存上限在 memoryMb 之外额外放宽的部分
     */
    int addressSpaceHeadroomMb;
}
