package com.shuking.ojjudge.service.adapter;

import com.shuking.ojjudge.config.JudgeProperties;
import com.shuking.ojjudge.model.ResourceLimits;
import com.shuking.ojjudge.model.enums.LanguageEnum;
import com.shuking.ojjudge.service.enforcer.ResourceLimitEnforcer;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.regex.Pattern;

/**
 * C++17，g++ 编译为 app 后直接运行
 */
@Component
public class CppLanguageAdapter extends AbstractLanguageAdapter {

    static final Pattern MAIN_PATTERN = Pattern.compile("\\bmain\\s*\\(");

    private static final String COMPILER = "g++";

    private static final String ENTRY_FILE = "main.cpp";

    static final String EXECUTABLE = "app";

    public CppLanguageAdapter(ResourceLimitEnforcer enforcer, JudgeProperties judgeProperties) {
        super(enforcer, judgeProperties);
    }

    @Override
    public LanguageEnum language() {
        return LanguageEnum.CPP;
    }

    @Override
    public String entryFileName() {
        return ENTRY_FILE;
    }

    @Override
    public boolean requiresCompilation() {
        return true;
    }

    @Override
    protected ResourceLimits builtinLimits() {
        return ResourceLimits.builder()
                .wallClockMs(2000L)
                .cpuTimeMs(2000L)
                .memoryMb(256)
                .stackMb(64)
                .fileSizeMb(10)
                .openFiles(64)
                .processes(64)
                .build();
    }

    @Override
    protected int builtinAddressSpaceHeadroomMb() {
        return 32;
    }

    @Override
    protected List<String> compileCommand() {
        return Arrays.asList(COMPILER, "-O2", "-std=c++17", ENTRY_FILE, "-o", EXECUTABLE);
    }

    @Override
    protected List<String> syntaxCheckCommand() {
        return Arrays.asList(COMPILER, "-fsyntax-only", "-std=c++17", ENTRY_FILE);
    }

    @Override
    protected String compileToolchain() {
        return COMPILER;
    }

    @Override
    protected String runToolchain() {
        return null;
    }

    @Override
    protected List<String> runCommand(ResourceLimits limits) {
        return Collections.singletonList("./" + EXECUTABLE);
    }

    @Override
    protected boolean validateSource(String code) {
        return code.contains("#include") && MAIN_PATTERN.matcher(code).find();
    }

    @Override
    protected List<String> outOfMemoryMarkers() {
        return Collections.singletonList("std::bad_alloc");
    }
}
