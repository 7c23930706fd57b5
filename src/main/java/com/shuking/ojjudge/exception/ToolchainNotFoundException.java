package com.shuking.ojjudge.exception;

/**
 * 编译器或解释器不存在，不能当作编译错误返回给用户
 */
public class ToolchainNotFoundException extends SandboxException {

    private final String toolchain;

    public ToolchainNotFoundException(String toolchain) {
        super(String.format("toolchain not found: %s", toolchain));
        this.toolchain = toolchain;
    }

    public String getToolchain() {
        return toolchain;
    }
}
