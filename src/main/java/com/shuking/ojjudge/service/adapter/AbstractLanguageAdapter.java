package com.shuking.ojjudge.service.adapter;

import cn.hutool.core.io.FileUtil;
import cn.hutool.core.io.IORuntimeException;
import cn.hutool.core.io.file.FileNameUtil;
import cn.hutool.core.io.resource.NoResourceException;
import cn.hutool.core.io.resource.ResourceUtil;
import cn.hutool.core.util.StrUtil;
import com.shuking.ojjudge.config.JudgeProperties;
import com.shuking.ojjudge.exception.SandboxException;
import com.shuking.ojjudge.exception.ToolchainNotFoundException;
import com.shuking.ojjudge.model.CompileResult;
import com.shuking.ojjudge.model.ResourceLimits;
import com.shuking.ojjudge.model.RunResult;
import com.shuking.ojjudge.model.enums.RunStatus;
import com.shuking.ojjudge.service.enforcer.LaunchRequest;
import com.shuking.ojjudge.service.enforcer.ResourceLimitEnforcer;
import com.shuking.ojjudge.util.ProcessUtils;
import lombok.extern.slf4j.Slf4j;

import java.io.File;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * 语言适配器模板：编译、语法检查、运行的流程固定，子类只提供命令和默认限制
 */
@Slf4j
public abstract class AbstractLanguageAdapter implements LanguageAdapter {

    /**
     * 编译超时沿用 timeout(1) 的退出码
     */
    static final int COMPILE_TIMEOUT_EXIT_CODE = 124;

    private static final String TEMPLATE_DIR = "templates/";

    private static final String COMPILE_OUT = "compile.out";

    private static final String COMPILE_ERR = "compile.err";

    private static final int COMPILE_STACK_MB = 64;

    private static final int COMPILE_FILE_SIZE_MB = 256;

    private static final int COMPILE_OPEN_FILES = 256;

    protected final ResourceLimitEnforcer enforcer;

    protected final JudgeProperties judgeProperties;

    protected AbstractLanguageAdapter(ResourceLimitEnforcer enforcer, JudgeProperties judgeProperties) {
        this.enforcer = enforcer;
        this.judgeProperties = judgeProperties;
    }

    /**
     * 内置默认限制，可被 judge.languages.&lt;id&gt; 覆盖
     */
    protected abstract ResourceLimits builtinLimits();

    /**
     * 内置的虚拟内存余量
     */
    protected int builtinAddressSpaceHeadroomMb() {
        return 0;
    }

    /**
     * 编译命令，为空表示无需编译
     */
    protected abstract List<String> compileCommand();

    /**
     * 语法检查命令，默认与编译相同
     */
    protected List<String> syntaxCheckCommand() {
        return compileCommand();
    }

    /**
     * 编译器或解释器的可执行文件名，用于启动前检查
     */
    protected abstract String compileToolchain();

    /**
     * 运行时可执行文件名，直接运行编译产物时返回 null
     */
    protected abstract String runToolchain();

    protected abstract List<String> runCommand(ResourceLimits limits);

    protected Map<String, String> runEnvironment() {
        return Collections.emptyMap();
    }

    /**
     * 源码结构检查
     *
     * @param code 源码
     * @return 是否通过
     */
    protected boolean validateSource(String code) {
        return StrUtil.isNotBlank(code);
    }

    /**
     * 解释器自己报告的内存不足标志，出现时 RE 归为 MLE
     */
    protected List<String> outOfMemoryMarkers() {
        return Collections.emptyList();
    }

    @Override
    public ResourceLimits defaultLimits() {
        return builtinLimits().override(judgeProperties.getLanguages().get(language().getValue()));
    }

    @Override
    public int addressSpaceHeadroomMb() {
        Integer configured = judgeProperties.getAddressSpaceHeadroomMb().get(language().getValue());
        return configured == null ? builtinAddressSpaceHeadroomMb() : configured;
    }

    @Override
    public CompileResult compile(File workDir) {
        return runToolchainStep(workDir, compileCommand(), "compile");
    }

    @Override
    public CompileResult checkSyntax(File workDir) {
        return runToolchainStep(workDir, syntaxCheckCommand(), "syntax check");
    }

    @Override
    public RunResult run(File workDir, File stdinFile, File stdoutFile, ResourceLimits limits) {
        String runtime = runToolchain();
        if (runtime != null) {
            requireToolchain(runtime);
        }
        LaunchRequest launchRequest = LaunchRequest.builder()
                .command(runCommand(limits))
                .workDir(workDir)
                .environment(runEnvironment())
                .stdinFile(stdinFile)
                .stdoutFile(stdoutFile)
                .stderrFile(stderrFileOf(stdoutFile))
                .limits(limits)
                .addressSpaceHeadroomMb(addressSpaceHeadroomMb())
                .build();
        return refineOutOfMemory(enforcer.execute(launchRequest));
    }

    @Override
    public String templateContent() {
        try {
            return ResourceUtil.readUtf8Str(TEMPLATE_DIR + entryFileName());
        } catch (NoResourceException e) {
            throw new SandboxException("template not found for " + language().getValue(), e);
        }
    }

    @Override
    public boolean validateSolution(File workDir) {
        File sourceFile = new File(workDir, entryFileName());
        if (!FileUtil.isFile(sourceFile)) {
            return false;
        }
        try {
            return validateSource(FileUtil.readString(sourceFile, StandardCharsets.UTF_8));
        } catch (IORuntimeException e) {
            log.error("read source error, path = {}", sourceFile.getAbsolutePath(), e);
            return false;
        }
    }

    /**
     * RE 且错误输出带有解释器的内存不足标志时归为 MLE
     */
    RunResult refineOutOfMemory(RunResult runResult) {
        if (runResult.getStatus() != RunStatus.RE) {
            return runResult;
        }
        String stderr = StrUtil.nullToEmpty(runResult.getStderr());
        for (String marker : outOfMemoryMarkers()) {
            if (stderr.contains(marker)) {
                runResult.setStatus(RunStatus.MLE);
                runResult.setKilledByLimit("memory");
                return runResult;
            }
        }
        return runResult;
    }

    /**
     * 编译、语法检查阶段使用的限制，与用例时限无关
     */
    ResourceLimits compileLimits() {
        return ResourceLimits.builder()
                .wallClockMs(judgeProperties.getCompileTimeoutMs())
                .cpuTimeMs(judgeProperties.getCompileTimeoutMs())
                .memoryMb(judgeProperties.getCompileMemoryMb())
                .stackMb(COMPILE_STACK_MB)
                .fileSizeMb(COMPILE_FILE_SIZE_MB)
                .openFiles(COMPILE_OPEN_FILES)
                .processes(judgeProperties.getCompileProcesses())
                .build();
    }

    private CompileResult runToolchainStep(File workDir, List<String> command, String stage) {
        File sourceFile = new File(workDir, entryFileName());
        if (!FileUtil.isFile(sourceFile)) {
            return CompileResult.failed("Source file not found: " + entryFileName(), 1, 0L);
        }
        if (command == null || command.isEmpty()) {
            return CompileResult.skipped();
        }
        String toolchain = compileToolchain();
        requireToolchain(toolchain);

        ResourceLimits limits = compileLimits();
        LaunchRequest launchRequest = LaunchRequest.builder()
                .command(command)
                .workDir(workDir)
                .stdoutFile(new File(workDir, COMPILE_OUT))
                .stderrFile(new File(workDir, COMPILE_ERR))
                .limits(limits)
                .addressSpaceHeadroomMb(addressSpaceHeadroomMb())
                .build();
        RunResult runResult = enforcer.execute(launchRequest);
        String stderr = StrUtil.nullToEmpty(runResult.getStderr());

        if (runResult.getStatus() == RunStatus.TIMEOUT || runResult.getStatus() == RunStatus.TLE) {
            log.info("{} {} timed out after {} ms", language().getValue(), stage, runResult.getTimeMs());
            return CompileResult.failed(String.format("Compilation timed out after %d ms", limits.getWallClockMs()),
                    COMPILE_TIMEOUT_EXIT_CODE, runResult.getTimeMs());
        }
        if (runResult.getStatus() == RunStatus.RE && stderr.startsWith(ResourceLimitEnforcer.LAUNCH_FAILURE_PREFIX)) {
            // 启动前检查过，这里说明工具链在检查之后消失或不可执行
            throw new ToolchainNotFoundException(toolchain);
        }
        if (runResult.getStatus() != RunStatus.OK) {
            log.info("{} {} failed, exitCode = {}", language().getValue(), stage, runResult.getExitCode());
            return CompileResult.failed(stderr, runResult.getExitCode(), runResult.getTimeMs());
        }
        return CompileResult.builder()
                .success(true)
                .stdout(runResult.getStdout())
                .stderr(stderr)
                .exitCode(0)
                .compileTimeMs(runResult.getTimeMs())
                .build();
    }

    private static void requireToolchain(String toolchain) {
        if (!ProcessUtils.which(toolchain).isPresent()) {
            throw new ToolchainNotFoundException(toolchain);
        }
    }

    static File stderrFileOf(File stdoutFile) {
        return new File(stdoutFile.getParentFile(), FileNameUtil.mainName(stdoutFile) + ".err");
    }
}
