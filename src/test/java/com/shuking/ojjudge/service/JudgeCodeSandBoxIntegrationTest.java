package com.shuking.ojjudge.service;

import cn.hutool.system.OsInfo;
import cn.hutool.system.SystemUtil;
import com.shuking.ojjudge.config.JudgeProperties;
import com.shuking.ojjudge.model.ExecuteCodeRequest;
import com.shuking.ojjudge.model.ExecuteCodeResponse;
import com.shuking.ojjudge.model.TestCase;
import com.shuking.ojjudge.model.TestCaseResult;
import com.shuking.ojjudge.model.enums.ComparisonType;
import com.shuking.ojjudge.model.enums.Verdict;
import com.shuking.ojjudge.service.adapter.CppLanguageAdapter;
import com.shuking.ojjudge.service.adapter.LanguageAdapterRegistry;
import com.shuking.ojjudge.service.adapter.PythonLanguageAdapter;
import com.shuking.ojjudge.service.enforcer.ProcessMemorySampler;
import com.shuking.ojjudge.service.enforcer.ResourceLimitEnforcer;
import com.shuking.ojjudge.util.ProcessUtils;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.util.Arrays;
import java.util.Collections;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

/**
 * 真实启动编译器和解释器，缺少工具链的环境自动跳过
 */
class JudgeCodeSandBoxIntegrationTest {

    private static final String TWO_SUM =
            "import sys, json\n"
                    + "lines = sys.stdin.read().split('\\n')\n"
                    + "nums = json.loads(lines[0])\n"
                    + "target = int(lines[1])\n"
                    + "seen = {}\n"
                    + "for i, n in enumerate(nums):\n"
                    + "    if target - n in seen:\n"
                    + "        print(json.dumps([seen[target - n], i]).replace(' ', ''))\n"
                    + "        break\n"
                    + "    seen[n] = i\n";

    @TempDir
    File rootDir;

    private ExecutorService executor;

    private JudgeCodeSandBox sandBox;

    @BeforeEach
    void setUp() {
        OsInfo osInfo = SystemUtil.getOsInfo();
        assumeTrue(osInfo.isLinux(), "kernel limits need Linux");
        assumeTrue(ProcessUtils.which("setsid").isPresent() && ProcessUtils.which("prlimit").isPresent(), "util-linux missing");

        JudgeProperties judgeProperties = new JudgeProperties();
        judgeProperties.setWorkDir(rootDir.getAbsolutePath());
        judgeProperties.setCompileProcesses(4096);
        ResourceLimitEnforcer enforcer = new ResourceLimitEnforcer(judgeProperties, new ProcessMemorySampler());
        LanguageAdapterRegistry registry = new LanguageAdapterRegistry(Arrays.asList(
                new PythonLanguageAdapter(enforcer, judgeProperties),
                new CppLanguageAdapter(enforcer, judgeProperties)));
        executor = Executors.newFixedThreadPool(2);
        sandBox = new JudgeCodeSandBox(registry, judgeProperties, executor);
    }

    @AfterEach
    void tearDown() {
        if (executor != null) {
            executor.shutdownNow();
        }
    }

    @Test
    void pythonTwoSumIsAccepted() {
        assumeTrue(ProcessUtils.which("python3").isPresent(), "python3 missing");
        TestCase testCase = TestCase.builder()
                .id("two-sum")
                .input("[2,7,11,15]\n9")
                .expectedOutput("[0,1]")
                .comparisonType(ComparisonType.ARRAY)
                .build();

        ExecuteCodeResponse response = sandBox.executeCode(ExecuteCodeRequest.builder()
                .language("python")
                .code(TWO_SUM)
                .testCases(Collections.singletonList(testCase))
                .build());

        assertThat(response.getVerdict()).as(response.getMessage()).isEqualTo(Verdict.OK);
        TestCaseResult result = response.getResults().get(0);
        assertThat(result.getActualOutput().trim()).isEqualTo("[0,1]");
        assertThat(result.getSimilarityScore()).isEqualTo(1.0);
        assertThat(rootDir.listFiles()).isEmpty();
    }

    @Test
    void cppSyntaxErrorIsCompileError() {
        assumeTrue(ProcessUtils.which("g++").isPresent(), "g++ missing");
        String code = "#include <cstdio>\nint main() {\n    int x = 1\n    return x;\n}\n";

        ExecuteCodeResponse response = sandBox.executeCode(ExecuteCodeRequest.builder()
                .language("cpp")
                .code(code)
                .testCases(Collections.singletonList(TestCase.builder().id("1").input("").expectedOutput("").build()))
                .build());

        assertThat(response.getVerdict()).isEqualTo(Verdict.CE);
        assertThat(response.getResults()).isEmpty();
        assertThat(response.getCompileLog()).isNotBlank();
        assertThat(rootDir.listFiles()).isEmpty();
    }

    @Test
    void infiniteLoopHitsWallClock() {
        assumeTrue(ProcessUtils.which("python3").isPresent(), "python3 missing");
        TestCase testCase = TestCase.builder().id("loop").input("").expectedOutput("never").timeLimitMs(1000L).build();

        ExecuteCodeResponse response = sandBox.executeCode(ExecuteCodeRequest.builder()
                .language("py")
                .code("while True:\n    pass\n")
                .testCases(Collections.singletonList(testCase))
                .build());

        assertThat(response.getVerdict()).isEqualTo(Verdict.TIMEOUT);
        TestCaseResult result = response.getResults().get(0);
        assertThat(result.getTimeMs()).isGreaterThanOrEqualTo(1000L);
        assertThat(result.getRunResult().getKilledByLimit()).isEqualTo("wall_clock_timeout");
        assertThat(rootDir.listFiles()).isEmpty();
    }

    @Test
    void selfRewritingProgramIsJudgedConsistently() {
        assumeTrue(ProcessUtils.which("python3").isPresent(), "python3 missing");
        String code = "open('main.py', 'w').write('print(42)\\n')\nprint(input())\n";

        ExecuteCodeResponse response = sandBox.executeCode(ExecuteCodeRequest.builder()
                .language("python")
                .code(code)
                .testCases(Arrays.asList(
                        TestCase.builder().id("1").input("7").expectedOutput("7").build(),
                        TestCase.builder().id("2").input("9").expectedOutput("9").build()))
                .build());

        assertThat(response.getVerdict()).as(response.getMessage()).isEqualTo(Verdict.OK);
        assertThat(response.getResults()).extracting(TestCaseResult::getActualOutput).containsExactly("7\n", "9\n");
        assertThat(rootDir.listFiles()).isEmpty();
    }

    @Test
    void testTimeLimitAlsoRaisesCpuLimit() {
        assumeTrue(ProcessUtils.which("python3").isPresent(), "python3 missing");
        String code = "import time\n"
                + "start = time.process_time()\n"
                + "while time.process_time() - start < 2.5:\n"
                + "    pass\n"
                + "print(1)\n";
        TestCase testCase = TestCase.builder().id("burn").input("").expectedOutput("1").timeLimitMs(6000L).build();

        ExecuteCodeResponse response = sandBox.executeCode(ExecuteCodeRequest.builder()
                .language("python")
                .code(code)
                .testCases(Collections.singletonList(testCase))
                .build());

        assertThat(response.getVerdict()).as(response.getResults().get(0).getError()).isEqualTo(Verdict.OK);
    }
}
