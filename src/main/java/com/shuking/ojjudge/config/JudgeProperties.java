package com.shuking.ojjudge.config;

import com.shuking.ojjudge.model.LimitOverride;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.io.File;
import java.util.HashMap;
import java.util.Map;

/**
 * 判题沙箱配置
 */
@Data
@ConfigurationProperties(prefix = "judge")
public class JudgeProperties {

    /**
     * 所有提交临时目录的父目录
     */
    private String workDir = System.getProperty("java.io.tmpdir") + File.separator + "oj-judge";

    /**
     * 编译的墙钟与 CPU 时间上限，与用例时限无关
     */
    private long compileTimeoutMs = 30000L;

    private int compileMemoryMb = 2048;

    private int compileProcesses = 512;

    /**
     * 判题线程池大小，1 表示用例顺序执行
     */
    private int testParallelism = 1;

    /**
     * 错误输出与编译日志的截断长度
     */
    private int maxLogBytes = 64 * 1024;

    /**
     * 运行期间内存采样间隔
     */
    private long sampleIntervalMs = 20L;

    /**
     * 语言级别默认资源限制，key 为语言标识
     */
    private Map<String, LimitOverride> languages = new HashMap<>();

    /**
     * 托管运行时（JVM、V8）需要额外的虚拟地址空间，key 为语言标识
     */
    private Map<String, Integer> addressSpaceHeadroomMb = new HashMap<>();
}
