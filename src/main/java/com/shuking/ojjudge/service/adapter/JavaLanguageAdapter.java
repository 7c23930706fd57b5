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
 * Java，源文件固定为 Main.java
 */
@Component
public class JavaLanguageAdapter extends AbstractLanguageAdapter {

    private static final String ENTRY_FILE = "Main.java";

    private static final Pattern MAIN_CLASS_PATTERN = Pattern.compile("\\bclass\\s+Main\\b");

    public JavaLanguageAdapter(ResourceLimitEnforcer enforcer, JudgeProperties judgeProperties) {
        super(enforcer, judgeProperties);
    }

    @Override
    public LanguageEnum language() {
        return LanguageEnum.JAVA;
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
                .wallClockMs(5000L)
                .cpuTimeMs(5000L)
                .memoryMb(512)
                .stackMb(64)
                .fileSizeMb(10)
                .openFiles(512)
                .processes(512)
                .build();
    }

    @Override
    protected int builtinAddressSpaceHeadroomMb() {
        return 1024;
    }

    @Override
    protected List<String> compileCommand() {
        // javac 自身也是 JVM，限制堆和保留区以适应虚拟内存上限
        return Arrays.asList("javac", "-J-Xmx512m", "-J-XX:CompressedClassSpaceSize=64m",
                "-J-XX:ReservedCodeCacheSize=64m", "-encoding", "UTF-8", "-d", ".", ENTRY_FILE);
    }

    @Override
    protected String compileToolchain() {
        return "javac";
    }

    @Override
    protected String runToolchain() {
        return "java";
    }

    @Override
    protected List<String> runCommand(ResourceLimits limits) {
        return Arrays.asList("java",
                "-Xmx" + limits.getMemoryMb() + "m",
                "-Xss" + limits.getStackMb() + "m",
                "-XX:+UseSerialGC",
                "-XX:CompressedClassSpaceSize=64m",
                "-XX:ReservedCodeCacheSize=64m",
                "-Dfile.encoding=UTF-8",
                "-cp", ".", "Main");
    }

    @Override
    protected boolean validateSource(String code) {
        return MAIN_CLASS_PATTERN.matcher(code).find() && code.contains("main(");
    }

    @Override
    protected List<String> outOfMemoryMarkers() {
        return Collections.singletonList("java.lang.OutOfMemoryError");
    }
}
