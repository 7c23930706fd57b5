package com.shuking.ojjudge.service.adapter;

import com.shuking.ojjudge.config.JudgeProperties;
import com.shuking.ojjudge.model.ResourceLimits;
import com.shuking.ojjudge.model.enums.LanguageEnum;
import com.shuking.ojjudge.service.enforcer.ResourceLimitEnforcer;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Python 3，编译阶段只用 ast 做语法解析
 */
@Component
public class PythonLanguageAdapter extends AbstractLanguageAdapter {

    private static final String PYTHON = "python3";

    private static final String ENTRY_FILE = "main.py";

    private static final String PARSE_SCRIPT =
            "import ast,sys\n"
                    + "with open(sys.argv[1], 'rb') as f:\n"
                    + "    ast.parse(f.read(), sys.argv[1])\n";

    public PythonLanguageAdapter(ResourceLimitEnforcer enforcer, JudgeProperties judgeProperties) {
        super(enforcer, judgeProperties);
    }

    @Override
    public LanguageEnum language() {
        return LanguageEnum.PYTHON;
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
                .openFiles(64)
                .processes(64)
                .build();
    }

    @Override
    protected int builtinAddressSpaceHeadroomMb() {
        return 64;
    }

    @Override
    protected List<String> compileCommand() {
        return Arrays.asList(PYTHON, "-B", "-c", PARSE_SCRIPT, ENTRY_FILE);
    }

    @Override
    protected String compileToolchain() {
        return PYTHON;
    }

    @Override
    protected String runToolchain() {
        return PYTHON;
    }

    @Override
    protected List<String> runCommand(ResourceLimits limits) {
        return Arrays.asList(PYTHON, "-B", "-s", ENTRY_FILE);
    }

    @Override
    protected Map<String, String> runEnvironment() {
        Map<String, String> environment = new LinkedHashMap<>();
        environment.put("PYTHONHASHSEED", "0");
        environment.put("PYTHONDONTWRITEBYTECODE", "1");
        environment.put("PYTHONIOENCODING", "utf-8");
        return environment;
    }

    @Override
    protected List<String> outOfMemoryMarkers() {
        return Collections.singletonList("MemoryError");
    }
}
