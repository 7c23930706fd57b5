package com.shuking.ojjudge.service.adapter;

import com.shuking.ojjudge.model.CompileResult;
import com.shuking.ojjudge.model.ResourceLimits;
import com.shuking.ojjudge.model.RunResult;
import com.shuking.ojjudge.model.enums.LanguageEnum;

import java.io.File;

/**
 * 语言适配器，只决定运行什么命令，进程一律交给 ResourceLimitEnforcer 启动
 */
public interface LanguageAdapter {

    LanguageEnum language();

    /**
     * 源文件名，如 main.py、Main.java
     */
    String entryFileName();

    /**
     * 语言默认资源限制，已合并配置文件中的覆盖项
     */
    ResourceLimits defaultLimits();

    boolean requiresCompilation();

    /**
     * 虚拟内存上限额外放宽的 MB 数
     */
    int addressSpaceHeadroomMb();

    /**
     * 编译工作目录中的源文件，每次提交调用一次
     *
     * @param workDir 提交的临时目录
     * @return 编译结果，源文件缺失或编译失败时 success 为 false
     */
    CompileResult compile(File workDir);

    /**
     * 只做语法检查，不产生可执行文件
     *
     * @param workDir 临时目录
     * @return 检查结果
     */
    CompileResult checkSyntax(File workDir);

    /**
     * 运行一次程序
     *
     * @param workDir    临时目录
     * @param stdinFile  标准输入文件
     * @param stdoutFile 标准输出文件，错误输出写入同名的 .err 文件
     * @param limits     本次运行的资源限制
     * @return 运行结果
     */
    RunResult run(File workDir, File stdinFile, File stdoutFile, ResourceLimits limits);

    /**
     * 入门模板代码
     */
    String templateContent();

    /**
     * 结构检查，如是否包含 main 入口
     *
     * @param workDir 临时目录
     * @return 是否通过
     */
    boolean validateSolution(File workDir);
}
