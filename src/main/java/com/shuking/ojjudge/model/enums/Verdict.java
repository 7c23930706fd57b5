package com.shuking.ojjudge.model.enums;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 判题结果，既用于单个用例也用于整次提交
 */
public enum Verdict {
    OK("Accepted", "OK"),
    WA("Wrong Answer", "WA"),
    TIMEOUT("Time Limit Exceeded (wall clock)", "TIMEOUT"),
    TLE("Time Limit Exceeded", "TLE"),
    MLE("Memory Limit Exceeded", "MLE"),
    OLE("Output Limit Exceeded", "OLE"),
    RE("Runtime Error", "RE"),
    CE("Compile Error", "CE"),
    IE("Internal Error", "IE");

    private final String text;

    private final String value;

    Verdict(String text, String value) {
        this.text = text;
        this.value = value;
    }

    public static List<String> getValues() {
        return Arrays.stream(values()).map(item -> item.value).collect(Collectors.toList());
    }

    /**
     * 运行状态对应的判题结果，OK 仍需经过输出比较
     *
     * @param runStatus 运行状态
     * @return 判题结果
     */
    public static Verdict fromRunStatus(RunStatus runStatus) {
        if (runStatus == null) {
            return IE;
        }
        switch (runStatus) {
            case OK:
                return OK;
            case TIMEOUT:
                return TIMEOUT;
            case TLE:
                return TLE;
            case MLE:
                return MLE;
            case OLE:
                return OLE;
            case RE:
                return RE;
            default:
                return IE;
        }
    }

    public String getValue() {
        return value;
    }

    public String getText() {
        return text;
    }
}
