package com.shuking.ojjudge.service.adapter;

import cn.hutool.core.io.FileUtil;
import com.shuking.ojjudge.config.JudgeProperties;
import com.shuking.ojjudge.exception.ToolchainNotFoundException;
import com.shuking.ojjudge.model.CompileResult;
import com.shuking.ojjudge.model.LimitOverride;
import com.shuking.ojjudge.model.ResourceLimits;
import com.shuking.ojjudge.model.RunResult;
import com.shuking.ojjudge.model.enums.LanguageEnum;
import com.shuking.ojjudge.model.enums.RunStatus;
import com.shuking.ojjudge.service.enforcer.LaunchRequest;
import com.shuking.ojjudge.service.enforcer.ResourceLimitEnforcer;
import com.shuking.ojjudge.util.ProcessUtils;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;

import java.io.File;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assumptions.assumeTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class LanguageAdapterTest {

    @TempDir
    File workDir;

    private ResourceLimitEnforcer enforcer;

    private JudgeProperties judgeProperties;

    @BeforeEach
    void setUp() {
        enforcer = mock(ResourceLimitEnforcer.class);
        judgeProperties = new JudgeProperties();
    }

    @Test
    void pythonRunsWithoutBytecodeAndFixedHashSeed() {
        PythonLanguageAdapter adapter = new PythonLanguageAdapter(enforcer, judgeProperties);

        assertThat(adapter.requiresCompilation()).isFalse();
        assertThat(adapter.runCommand(adapter.defaultLimits())).containsExactly("python3", "-B", "-s", "main.py");
        assertThat(adapter.runEnvironment())
                .containsEntry("PYTHONHASHSEED", "0")
                .containsEntry("PYTHONDONTWRITEBYTECODE", "1")
                .containsEntry("PYTHONIOENCODING", "utf-8");
        assertThat(adapter.compileCommand()).startsWith("python3", "-B", "-c").endsWith("main.py");
    }

    @Test
    void managedRuntimesSizeHeapFromLimits() {
        ResourceLimits limits = ResourceLimits.builder()
                .wallClockMs(1000L).cpuTimeMs(1000L).memoryMb(256).stackMb(32)
                .fileSizeMb(10).openFiles(64).processes(64)
                .build();

        JavaLanguageAdapter java = new JavaLanguageAdapter(enforcer, judgeProperties);
        assertThat(java.runCommand(limits)).contains("-Xmx256m", "-Xss32m", "-XX:+UseSerialGC").endsWith("-cp", ".", "Main");
        assertThat(java.defaultLimits().getMemoryMb()).isEqualTo(512);
        assertThat(java.runCommand(java.defaultLimits())).contains("-Xmx512m", "-Xss64m");

        JavaScriptLanguageAdapter node = new JavaScriptLanguageAdapter(enforcer, judgeProperties);
        assertThat(node.runCommand(limits)).containsExactly("node", "--max-old-space-size=256", "main.js");
        assertThat(node.addressSpaceHeadroomMb()).isEqualTo(2048);
    }

    @Test
    void nativeAdaptersCompileToApp() {
        CppLanguageAdapter cpp = new CppLanguageAdapter(enforcer, judgeProperties);
        assertThat(cpp.compileCommand()).containsExactly("g++", "-O2", "-std=c++17", "main.cpp", "-o", "app");
        assertThat(cpp.syntaxCheckCommand()).containsExactly("g++", "-fsyntax-only", "-std=c++17", "main.cpp");
        assertThat(cpp.runToolchain()).isNull();

        CLanguageAdapter c = new CLanguageAdapter(enforcer, judgeProperties);
        assertThat(c.compileCommand()).containsExactly("gcc", "-O2", "-std=c11", "main.c", "-o", "app", "-lm");
        assertThat(c.syntaxCheckCommand()).contains("-fsyntax-only");
        assertThat(c.runCommand(c.defaultLimits())).containsExactly("./app");
    }

    @Test
    void defaultLimitsAndHeadroomFollowProperties() {
        judgeProperties.getLanguages().put("py", LimitOverride.builder().wallClockMs(4000L).memoryMb(128).build());
        judgeProperties.getAddressSpaceHeadroomMb().put("py", 16);
        PythonLanguageAdapter adapter = new PythonLanguageAdapter(enforcer, judgeProperties);

        ResourceLimits limits = adapter.defaultLimits();

        assertThat(limits.getWallClockMs()).isEqualTo(4000L);
        assertThat(limits.getCpuTimeMs()).isEqualTo(2000L);
        assertThat(limits.getMemoryMb()).isEqualTo(128);
        assertThat(adapter.addressSpaceHeadroomMb()).isEqualTo(16);
        assertThat(new CppLanguageAdapter(enforcer, judgeProperties).addressSpaceHeadroomMb()).isEqualTo(32);
    }

    @Test
    void validateSolutionChecksProgramStructure() {
        CppLanguageAdapter cpp = new CppLanguageAdapter(enforcer, judgeProperties);
        assertThat(cpp.validateSolution(workDir)).isFalse();

        writeSource("main.cpp", "#include <cstdio>\nint main() { return 0; }\n");
        assertThat(cpp.validateSolution(workDir)).isTrue();

        writeSource("main.cpp", "int solve() { return 0; }\n");
        assertThat(cpp.validateSolution(workDir)).isFalse();

        JavaLanguageAdapter java = new JavaLanguageAdapter(enforcer, judgeProperties);
        writeSource("Main.java", "public class Main { public static void main(String[] args) {} }\n");
        assertThat(java.validateSolution(workDir)).isTrue();
        writeSource("Main.java", "public class Solution { public static void main(String[] args) {} }\n");
        assertThat(java.validateSolution(workDir)).isFalse();

        PythonLanguageAdapter python = new PythonLanguageAdapter(enforcer, judgeProperties);
        writeSource("main.py", "   \n");
        assertThat(python.validateSolution(workDir)).isFalse();
        writeSource("main.py", "print(1)\n");
        assertThat(python.validateSolution(workDir)).isTrue();
    }

    @Test
    void interpreterOutOfMemoryBecomesMle() {
        PythonLanguageAdapter python = new PythonLanguageAdapter(enforcer, judgeProperties);

        RunResult refined = python.refineOutOfMemory(RunResult.builder()
                .status(RunStatus.RE).exitCode(1).stderr("Traceback ...\nMemoryError\n").build());
        assertThat(refined.getStatus()).isEqualTo(RunStatus.MLE);
        assertThat(refined.getKilledByLimit()).isEqualTo("memory");

        RunResult plain = python.refineOutOfMemory(RunResult.builder()
                .status(RunStatus.RE).exitCode(1).stderr("ZeroDivisionError").build());
        assertThat(plain.getStatus()).isEqualTo(RunStatus.RE);

        CLanguageAdapter c = new CLanguageAdapter(enforcer, judgeProperties);
        RunResult cResult = c.refineOutOfMemory(RunResult.builder()
                .status(RunStatus.RE).exitCode(1).stderr("MemoryError").build());
        assertThat(cResult.getStatus()).isEqualTo(RunStatus.RE);
    }

    @Test
    void missingSourceFailsWithoutLaunching() {
        CppLanguageAdapter cpp = new CppLanguageAdapter(enforcer, judgeProperties);

        CompileResult compileResult = cpp.compile(workDir);

        assertThat(compileResult.isSuccess()).isFalse();
        assertThat(compileResult.getStderr()).isEqualTo("Source file not found: main.cpp");
        verifyNoInteractions(enforcer);
    }

    @Test
    void runPassesLimitsAndSiblingStderrFile() {
        when(enforcer.execute(any())).thenReturn(RunResult.builder().status(RunStatus.OK).stdout("3").stderr("").build());
        CLanguageAdapter c = new CLanguageAdapter(enforcer, judgeProperties);
        File stdin = new File(workDir, "test-0-abc.in");
        File stdout = new File(workDir, "test-0-abc.out");

        RunResult runResult = c.run(workDir, stdin, stdout, c.defaultLimits());

        assertThat(runResult.getStatus()).isEqualTo(RunStatus.OK);
        ArgumentCaptor<LaunchRequest> captor = ArgumentCaptor.forClass(LaunchRequest.class);
        verify(enforcer).execute(captor.capture());
        LaunchRequest request = captor.getValue();
        assertThat(request.getCommand()).containsExactly("./app");
        assertThat(request.getStdinFile()).isEqualTo(stdin);
        assertThat(request.getStderrFile()).isEqualTo(new File(workDir, "test-0-abc.err"));
        assertThat(request.getAddressSpaceHeadroomMb()).isEqualTo(32);
        assertThat(request.getLimits()).isEqualTo(c.defaultLimits());
    }

    @Test
    void compileTimeoutReportsExitCode124() {
        assumeTrue(ProcessUtils.which("sh").isPresent());
        judgeProperties.setCompileTimeoutMs(1500L);
        when(enforcer.execute(any())).thenReturn(RunResult.builder()
                .status(RunStatus.TIMEOUT).exitCode(-1).timeMs(1510L).stderr("").build());
        StubAdapter adapter = new StubAdapter(enforcer, judgeProperties, "sh");
        writeSource(adapter.entryFileName(), "stub");

        CompileResult compileResult = adapter.compile(workDir);

        assertThat(compileResult.isSuccess()).isFalse();
        assertThat(compileResult.getExitCode()).isEqualTo(AbstractLanguageAdapter.COMPILE_TIMEOUT_EXIT_CODE);
        assertThat(compileResult.getStderr()).isEqualTo("Compilation timed out after 1500 ms");
        ArgumentCaptor<LaunchRequest> captor = ArgumentCaptor.forClass(LaunchRequest.class);
        verify(enforcer).execute(captor.capture());
        assertThat(captor.getValue().getLimits().getCpuTimeMs()).isEqualTo(1500L);
        assertThat(captor.getValue().getStderrFile().getName()).isEqualTo("compile.err");
    }

    @Test
    void compilerErrorsAreReturnedVerbatim() {
        assumeTrue(ProcessUtils.which("sh").isPresent());
        when(enforcer.execute(any())).thenReturn(RunResult.builder()
                .status(RunStatus.RE).exitCode(1).stderr("main.stub:1: error: expected ';'\n").build());
        StubAdapter adapter = new StubAdapter(enforcer, judgeProperties, "sh");
        writeSource(adapter.entryFileName(), "stub");

        CompileResult compileResult = adapter.compile(workDir);

        assertThat(compileResult.isSuccess()).isFalse();
        assertThat(compileResult.getExitCode()).isEqualTo(1);
        assertThat(compileResult.getStderr()).contains("expected ';'");
    }

    @Test
    void missingToolchainIsReported() {
        StubAdapter adapter = new StubAdapter(enforcer, judgeProperties, "no-such-compiler-4f1c");
        writeSource(adapter.entryFileName(), "stub");

        assertThatThrownBy(() -> adapter.compile(workDir))
                .isInstanceOf(ToolchainNotFoundException.class)
                .hasMessageContaining("no-such-compiler-4f1c");
        verifyNoInteractions(enforcer);
    }

    @Test
    void launchFailureDuringCompileIsToolchainError() {
        assumeTrue(ProcessUtils.which("sh").isPresent());
        when(enforcer.execute(any())).thenReturn(RunResult.builder()
                .status(RunStatus.RE).exitCode(127)
                .stderr(ResourceLimitEnforcer.LAUNCH_FAILURE_PREFIX + "prlimit: failed to execute sh").build());
        StubAdapter adapter = new StubAdapter(enforcer, judgeProperties, "sh");
        writeSource(adapter.entryFileName(), "stub");

        assertThatThrownBy(() -> adapter.compile(workDir)).isInstanceOf(ToolchainNotFoundException.class);
    }

    @Test
    void everyAdapterShipsATemplate() {
        List<AbstractLanguageAdapter> adapters = Arrays.asList(
                new PythonLanguageAdapter(enforcer, judgeProperties),
                new CppLanguageAdapter(enforcer, judgeProperties),
                new CLanguageAdapter(enforcer, judgeProperties),
                new JavaScriptLanguageAdapter(enforcer, judgeProperties),
                new JavaLanguageAdapter(enforcer, judgeProperties));

        for (AbstractLanguageAdapter adapter : adapters) {
            assertThat(adapter.templateContent()).as(adapter.language().getValue()).isNotBlank();
        }
        LanguageAdapterRegistry registry = new LanguageAdapterRegistry(Collections.unmodifiableList(adapters));
        assertThat(registry.supportedLanguages()).hasSize(LanguageEnum.values().length);
        assertThat(registry.get("python3")).isInstanceOf(PythonLanguageAdapter.class);
        assertThat(registry.get("ruby")).isNull();
    }

    private void writeSource(String fileName, String code) {
        FileUtil.writeString(code, new File(workDir, fileName), StandardCharsets.UTF_8);
    }

    /**
     * 编译器可替换的最小适配器
     */
    private static class StubAdapter extends AbstractLanguageAdapter {

        private final String toolchain;

        StubAdapter(ResourceLimitEnforcer enforcer, JudgeProperties judgeProperties, String toolchain) {
            super(enforcer, judgeProperties);
            this.toolchain = toolchain;
        }

        @Override
        public LanguageEnum language() {
            return LanguageEnum.C;
        }

        @Override
        public String entryFileName() {
            return "main.stub";
        }

        @Override
        public boolean requiresCompilation() {
            return true;
        }

        @Override
        protected ResourceLimits builtinLimits() {
            return ResourceLimits.builder()
                    .wallClockMs(1000L).cpuTimeMs(1000L).memoryMb(64).stackMb(8)
                    .fileSizeMb(1).openFiles(16).processes(16)
                    .build();
        }

        @Override
        protected List<String> compileCommand() {
            return Arrays.asList(toolchain, entryFileName());
        }

        @Override
        protected String compileToolchain() {
            return toolchain;
        }

        @Override
        protected String runToolchain() {
            return null;
        }

        @Override
        protected List<String> runCommand(ResourceLimits limits) {
            return Collections.singletonList("./main.stub");
        }
    }
}
