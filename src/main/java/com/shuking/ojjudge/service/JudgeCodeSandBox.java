package com.shuking.ojjudge.service;

import cn.hutool.core.util.IdUtil;
import cn.hutool.core.util.StrUtil;
import com.shuking.ojjudge.config.JudgeProperties;
import com.shuking.ojjudge.model.ComparisonDetails;
import com.shuking.ojjudge.model.CompileResult;
import com.shuking.ojjudge.model.ExecuteCodeRequest;
import com.shuking.ojjudge.model.ExecuteCodeResponse;
import com.shuking.ojjudge.model.JudgeInfo;
import com.shuking.ojjudge.model.ResourceLimits;
import com.shuking.ojjudge.model.RunResult;
import com.shuking.ojjudge.model.SyntaxCheckResponse;
import com.shuking.ojjudge.model.TestCase;
import com.shuking.ojjudge.model.TestCaseResult;
import com.shuking.ojjudge.model.enums.ComparisonType;
import com.shuking.ojjudge.model.enums.Verdict;
import com.shuking.ojjudge.service.adapter.LanguageAdapter;
import com.shuking.ojjudge.service.adapter.LanguageAdapterRegistry;
import com.shuking.ojjudge.service.comparator.ComparatorFactory;
import com.shuking.ojjudge.service.comparator.OutputComparator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import org.springframework.util.StopWatch;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.stream.Collectors;

/**
 * 判题流程：保存代码、编译一次、逐个用例运行并比较输出、汇总结果、清理临时目录
 */
@Slf4j
@Service
public class JudgeCodeSandBox implements CodeSandBox {

    private final LanguageAdapterRegistry adapterRegistry;

    private final JudgeProperties judgeProperties;

    private final Executor judgeTaskExecutor;

    public JudgeCodeSandBox(LanguageAdapterRegistry adapterRegistry, JudgeProperties judgeProperties,
                            @Qualifier("judgeTaskExecutor") Executor judgeTaskExecutor) {
        this.adapterRegistry = adapterRegistry;
        this.judgeProperties = judgeProperties;
        this.judgeTaskExecutor = judgeTaskExecutor;
    }

    // 完整流程调用
    @Override
    public ExecuteCodeResponse executeCode(ExecuteCodeRequest request) {
        if (request == null) {
            return getErrorResponse(IdUtil.fastSimpleUUID(), "请求参数为空", Collections.emptyList());
        }
        List<TestCase> testCases = request.getTestCases() == null ? Collections.emptyList() : request.getTestCases();

        // 1. 选择语言适配器
        LanguageAdapter adapter = adapterRegistry.get(request.getLanguage());
        if (adapter == null) {
            return getErrorResponse(IdUtil.fastSimpleUUID(), "Unsupported language: " + request.getLanguage(), testCases);
        }

        // 2. 合并资源限制，非法值在分配任何资源之前拒绝
        ResourceLimits limits;
        try {
            limits = adapter.defaultLimits().override(request.getLimits());
        } catch (IllegalArgumentException e) {
            return getErrorResponse(IdUtil.fastSimpleUUID(), "Invalid resource limits: " + e.getMessage(), testCases);
        }

        StopWatch stopWatch = new StopWatch();
        stopWatch.start();
        String submissionId = null;
        try (SubmissionWorkspace workspace = SubmissionWorkspace.create(judgeProperties.getWorkDir())) {
            submissionId = workspace.getId();

            // 3. 把用户的代码保存为文件
            workspace.writeSource(adapter.entryFileName(), StrUtil.nullToEmpty(request.getCode()));

            // 4. 编译代码，每次提交只编译一次
            CompileResult compileResult = adapter.compile(workspace.getDir());
            if (!compileResult.isSuccess()) {
                log.info("submission {} compile error, exitCode = {}", submissionId, compileResult.getExitCode());
                return getCompileErrorResponse(submissionId, compileResult, testCases.size());
            }

            // 5. 固定编译产物，每个用例在独立目录中从快照还原后执行，得到与输入顺序一致的结果
            workspace.sealArtifacts();
            List<TestCaseResult> results = runTestCases(adapter, workspace, limits, testCases);

            // 6. 收集整理输出结果
            ExecuteCodeResponse response = getOutputResponse(submissionId, results);
            if (request.isVerbose()) {
                response.setCompileLog(compileResult.getStderr());
            }
            return response;
        } catch (Exception e) {
            log.error("executeCode error, submissionId = {}", submissionId, e);
            return getErrorResponse(StrUtil.blankToDefault(submissionId, IdUtil.fastSimpleUUID()), e.getMessage(), testCases);
        } finally {
            stopWatch.stop();
            log.info("submission {} ({}) finished in {} ms", submissionId, adapter.language().getValue(), stopWatch.getTotalTimeMillis());
        }
    }

    /**
     * 在有界线程池上运行全部用例，全部完成后按原顺序汇总
     */
    List<TestCaseResult> runTestCases(LanguageAdapter adapter, SubmissionWorkspace workspace,
                                      ResourceLimits limits, List<TestCase> testCases) {
        List<CompletableFuture<TestCaseResult>> futures = new ArrayList<>(testCases.size());
        for (int i = 0; i < testCases.size(); i++) {
            final int index = i;
            final TestCase testCase = testCases.get(i);
            futures.add(CompletableFuture.supplyAsync(
                    () -> runTestCase(adapter, workspace, limits, testCase, index), judgeTaskExecutor));
        }
        return futures.stream().map(CompletableFuture::join).collect(Collectors.toList());
    }

    /**
     * 运行单个用例并比较输出，任何异常只影响当前用例
     */
    TestCaseResult runTestCase(LanguageAdapter adapter, SubmissionWorkspace workspace,
                               ResourceLimits limits, TestCase testCase, int index) {
        TestCaseResult.TestCaseResultBuilder builder = TestCaseResult.builder().testCase(testCase);
        try {
            ResourceLimits testLimits = limits.override(testCase);
            RunResult runResult;
            try (SubmissionWorkspace.TestFiles testFiles = workspace.prepareTestFiles(index, testCase.getInput())) {
                runResult = adapter.run(testFiles.getDir(), testFiles.getStdin(), testFiles.getStdout(), testLimits);
            }
            builder.runResult(runResult);

            Verdict verdict = Verdict.fromRunStatus(runResult.getStatus());
            if (verdict != Verdict.OK) {
                return builder.status(verdict).similarityScore(0.0).build();
            }

            String expected = StrUtil.trim(StrUtil.nullToEmpty(testCase.getExpectedOutput()));
            String actual = StrUtil.trim(StrUtil.nullToEmpty(runResult.getStdout()));
            OutputComparator comparator = resolveComparator(testCase, expected, actual);
            ComparisonDetails details = comparator.compare(expected, actual);
            builder.comparator(comparator.getName()).similarityScore(details.getSimilarityScore());
            if (details.isMatch()) {
                return builder.status(Verdict.OK).build();
            }
            return builder.status(Verdict.WA)
                    .diff(StrUtil.blankToDefault(details.getDiff(), details.getMessage()))
                    .build();
        } catch (Exception e) {
            log.error("test case {} error, id = {}", index, testCase.getId(), e);
            return builder.runResult(RunResult.internalError(e.getMessage()))
                    .status(Verdict.IE)
                    .similarityScore(0.0)
                    .build();
        }
    }

    private static OutputComparator resolveComparator(TestCase testCase, String expected, String actual) {
        ComparisonType type = testCase.getComparisonType();
        if (type == null || type == ComparisonType.AUTO) {
            return ComparatorFactory.autoDetect(expected, actual);
        }
        return ComparatorFactory.create(type, testCase.getComparisonConfig());
    }

    /**
     * 汇总用例结果，整体结果取第一个非 OK 的用例
     *
     * @param submissionId 提交编号
     * @param results      用例结果
     * @return 返回给判题服务的结果
     */
    ExecuteCodeResponse getOutputResponse(String submissionId, List<TestCaseResult> results) {
        Verdict verdict = Verdict.OK;
        int failedIndex = -1;
        int passedCount = 0;
        long totalTime = 0L;
        for (int i = 0; i < results.size(); i++) {
            TestCaseResult result = results.get(i);
            totalTime += result.getTimeMs();
            if (result.isPassed()) {
                passedCount++;
            } else if (failedIndex < 0) {
                failedIndex = i;
                verdict = result.getStatus();
            }
        }
        int totalCount = results.size();
        String message = failedIndex < 0
                ? String.format("%s: %d/%d test cases passed", verdict.getText(), passedCount, totalCount)
                : String.format("%s on test %d: %d/%d test cases passed", verdict.getText(), failedIndex + 1, passedCount, totalCount);
        return ExecuteCodeResponse.builder()
                .submissionId(submissionId)
                .verdict(verdict)
                .message(message)
                .passedCount(passedCount)
                .totalCount(totalCount)
                .totalTimeMs(totalTime)
                .averageTimeMs(totalCount == 0 ? 0.0 : (double) totalTime / totalCount)
                .results(results)
                .judgeInfo(getJudgeInfo(verdict, results))
                .build();
    }

    /**
     * 本次提交的耗时、内存、通过率统计
     */
    static JudgeInfo getJudgeInfo(Verdict verdict, List<TestCaseResult> results) {
        if (results.isEmpty()) {
            return JudgeInfo.builder().message(verdict.getText()).build();
        }
        List<Long> times = results.stream().map(TestCaseResult::getTimeMs).sorted().collect(Collectors.toList());
        int size = times.size();
        double median = size % 2 == 1 ? times.get(size / 2) : (times.get(size / 2 - 1) + times.get(size / 2)) / 2.0;
        long passed = results.stream().filter(TestCaseResult::isPassed).count();
        return JudgeInfo.builder()
                .message(verdict.getText())
                .memory(results.stream().mapToDouble(TestCaseResult::getMemoryMb).max().orElse(0.0))
                .time(times.get(size - 1))
                .minTime(times.get(0))
                .medianTime(median)
                .averageTime(times.stream().mapToLong(Long::longValue).average().orElse(0.0))
                .passRate((double) passed / size)
                .averageSimilarity(results.stream().mapToDouble(TestCaseResult::getSimilarityScore).average().orElse(0.0))
                .build();
    }

    private static ExecuteCodeResponse getCompileErrorResponse(String submissionId, CompileResult compileResult, int totalCount) {
        return ExecuteCodeResponse.builder()
                .submissionId(submissionId)
                .verdict(Verdict.CE)
                .message(String.format("%s: 0/%d test cases passed", Verdict.CE.getText(), totalCount))
                .passedCount(0)
                .totalCount(totalCount)
                .results(new ArrayList<>())
                .compileLog(compileResult.getStderr())
                .judgeInfo(JudgeInfo.builder().message(Verdict.CE.getText()).build())
                .build();
    }

    /**
     * 获取错误响应，每个用例都记为 IE
     *
     * @param submissionId 提交编号
     * @param errMsg       错误信息
     * @param testCases    用例
     * @return IE 响应
     */
    static ExecuteCodeResponse getErrorResponse(String submissionId, String errMsg, List<TestCase> testCases) {
        List<TestCaseResult> results = testCases.stream()
                .map(testCase -> TestCaseResult.builder()
                        .testCase(testCase)
                        .runResult(RunResult.internalError(errMsg))
                        .status(Verdict.IE)
                        .build())
                .collect(Collectors.toList());
        return ExecuteCodeResponse.builder()
                .submissionId(submissionId)
                .verdict(Verdict.IE)
                .message(errMsg)
                .totalCount(results.size())
                .results(results)
                .judgeInfo(JudgeInfo.builder().message(errMsg).build())
                .build();
    }

    @Override
    public SyntaxCheckResponse checkSyntax(String language, String code) {
        LanguageAdapter adapter = adapterRegistry.get(language);
        if (adapter == null) {
            return SyntaxCheckResponse.builder().valid(false).structureValid(false)
                    .message("Unsupported language: " + language).language(language).build();
        }
        String languageId = adapter.language().getValue();
        try (SubmissionWorkspace workspace = SubmissionWorkspace.create(judgeProperties.getWorkDir())) {
            workspace.writeSource(adapter.entryFileName(), StrUtil.nullToEmpty(code));
            CompileResult compileResult = adapter.checkSyntax(workspace.getDir());
            boolean structureValid = adapter.validateSolution(workspace.getDir());
            String message;
            if (!compileResult.isSuccess()) {
                message = compileResult.getStderr();
            } else if (!structureValid) {
                message = "Syntax OK, but required program structure is missing";
            } else {
                message = "Syntax OK";
            }
            return SyntaxCheckResponse.builder()
                    .valid(compileResult.isSuccess())
                    .structureValid(structureValid)
                    .message(message)
                    .language(languageId)
                    .build();
        } catch (Exception e) {
            log.error("checkSyntax error, language = {}", languageId, e);
            return SyntaxCheckResponse.builder().valid(false).structureValid(false)
                    .message(e.getMessage()).language(languageId).build();
        }
    }

    @Override
    public String getTemplate(String language) {
        LanguageAdapter adapter = adapterRegistry.get(language);
        return adapter == null ? null : adapter.templateContent();
    }

    @Override
    public List<String> supportedLanguages() {
        return adapterRegistry.supportedLanguages();
    }
}
