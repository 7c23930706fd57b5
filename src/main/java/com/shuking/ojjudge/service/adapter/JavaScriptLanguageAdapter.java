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
 * Node.js，V8 需要较大的虚拟地址空间余量
 */
@Component
public class JavaScriptLanguageAdapter extends AbstractLanguageAdapter {

    private static final String NODE = "node";

    private static final String ENTRY_FILE = "main.js";

    public JavaScriptLanguageAdapter(ResourceLimitEnforcer enforcer, JudgeProperties judgeProperties) {
        super(enforcer, judgeProperties);
    }

    @Override
    public LanguageEnum language() {
        return LanguageEnum.JAVASCRIPT;
    }

    @Override
    public String entryFileName() {
        return ENTRY_FILE;
    }

    @Override
    public boolean requiresCompilation() {
        return false;
    }

    @Override
    protected ResourceLimits builtinLimits() {
        return ResourceLimits.builder()
                .wallClockMs(2000L)
                .cpuTimeMs(2000L)
                .memoryMb(256)
                .stackMb(64)
                .fileSizeMb(10)
                .openFiles(256)
                .processes(256)
                .build();
    }

    @Override
    protected int builtinAddressSpaceHeadroomMb() {
        return 2048;
    }

    @Override
    protected List<String> compileCommand() {
        return Arrays.asList(NODE, "--check", ENTRY_FILE);
    }

    @Override
    protected String compileToolchain() {
        return NODE;
    }

    @Override
    protected String runToolchain() {
        return NODE;
    }

    @Override
    protected List<String> runCommand(ResourceLimits limits) {
        return Arrays.asList(NODE, "--max-old-space-size=" + limits.getMemoryMb(), ENTRY_FILE);
    }

    @Override
    protected List<String> outOfMemoryMarkers() {
        return Collections.singletonList("JavaScript heap out of memory");
    }
}
