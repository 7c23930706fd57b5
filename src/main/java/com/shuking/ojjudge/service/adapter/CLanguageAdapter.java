package com.shuking.ojjudge.service.adapter;

import com.shuking.ojjudge.config.JudgeProperties;
import com.shuking.ojjudge.model.ResourceLimits;
import com.shuking.ojjudge.model.enums.LanguageEnum;
import com.shuking.ojjudge.service.enforcer.ResourceLimitEnforcer;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * C11，链接 libm
 */
@Component
public class CLanguageAdapter extends AbstractLanguageAdapter {

    private static final String COMPILER = "gcc";

    private static final String ENTRY_FILE = "main.c";

    public CLanguageAdapter(ResourceLimitEnforcer enforcer, JudgeProperties judgeProperties) {
        super(enforcer, judgeProperties);
    }

    @Override
    public LanguageEnum language() {
        return LanguageEnum.C;
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
        return Arrays.asList(COMPILER, "-O2", "-std=c11", ENTRY_FILE, "-o", CppLanguageAdapter.EXECUTABLE, "-lm");
    }

    @Override
    protected List<String> syntaxCheckCommand() {
        return Arrays.asList(COMPILER, "-fsyntax-only", "-std=c11", ENTRY_FILE);
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
        return Collections.singletonList("./" + CppLanguageAdapter.EXECUTABLE);
    }

    @Override
    protected boolean validateSource(String code) {
        return code.contains("#include") && CppLanguageAdapter.MAIN_PATTERN.matcher(code).find();
    }
}
