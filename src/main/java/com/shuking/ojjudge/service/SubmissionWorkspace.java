package com.shuking.ojjudge.service;

import cn.hutool.core.io.FileUtil;
import cn.hutool.core.io.IORuntimeException;
import cn.hutool.core.util.IdUtil;
import cn.hutool.core.util.RandomUtil;
import com.shuking.ojjudge.exception.SandboxException;
import lombok.extern.slf4j.Slf4j;

import java.io.Closeable;
import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 一次提交独占的临时目录，关闭时整体删除。
 * <p>
 * 编译完成后 {@link #sealArtifacts()} 把源码与编译产物读入内存，
 * 每个用例在自己的子目录中运行，子目录由内存快照重新生成，用例对目录的任何写入都不会影响其他用例
 */
@Slf4j
public class SubmissionWorkspace implements Closeable {

    private final String id;

    private final File dir;

    /**
     * 相对路径到文件内容的快照，编译后不再变化
     */
    private volatile Map<String, Artifact> artifacts;

    private SubmissionWorkspace(String id, File dir) {
        this.id = id;
        this.dir = dir;
    }

    /**
     * 在根目录下原子地创建仅属主可访问的子目录
     *
     * @param rootDir 所有提交的父目录
     * @return 工作区
     * @throws SandboxException 目录创建失败
     */
    public static SubmissionWorkspace create(String rootDir) {
        String id = IdUtil.fastSimpleUUID();
        try {
            File root = FileUtil.mkdir(rootDir);
            Path path = root.toPath().resolve(id);
            if (FileSystems.getDefault().supportedFileAttributeViews().contains("posix")) {
                Files.createDirectory(path, PosixFilePermissions.asFileAttribute(PosixFilePermissions.fromString("rwx------")));
            } else {
                Files.createDirectory(path);
            }
            return new SubmissionWorkspace(id, path.toFile());
        } catch (IOException | IORuntimeException e) {
            throw new SandboxException("failed to create workspace under " + rootDir, e);
        }
    }

    public String getId() {
        return id;
    }

    public File getDir() {
        return dir;
    }

    /**
     * 把用户代码写入源文件
     *
     * @param fileName 源文件名
     * @param code     用户代码
     * @return 源文件
     */
    public File writeSource(String fileName, String code) {
        return FileUtil.writeString(code, new File(dir, fileName), StandardCharsets.UTF_8);
    }

    /**
     * 读取目录下的全部文件作为运行快照，编译成功后调用一次
     *
     * @throws SandboxException 读取失败
     */
    public void sealArtifacts() {
        Path root = dir.toPath();
        Map<String, Artifact> snapshot = new LinkedHashMap<>();
        try {
            for (File file : FileUtil.loopFiles(dir)) {
                String relativePath = root.relativize(file.toPath()).toString();
                snapshot.put(relativePath, new Artifact(FileUtil.readBytes(file), file.canExecute()));
            }
        } catch (IORuntimeException e) {
            throw new SandboxException("failed to snapshot artifacts in " + dir.getAbsolutePath(), e);
        }
        artifacts = Collections.unmodifiableMap(snapshot);
    }

    /**
     * 为一个测试用例创建独立的运行目录：还原源码与编译产物，写入标准输入。
     * 目录名带随机后缀，并发执行时互不冲突
     *
     * @param index 用例序号
     * @param input 标准输入内容
     * @return 运行目录与输入输出文件，用完后关闭即删除
     * @throws IllegalStateException 尚未调用 {@link #sealArtifacts()}
     */
    public TestFiles prepareTestFiles(int index, String input) {
        Map<String, Artifact> snapshot = artifacts;
        if (snapshot == null) {
            throw new IllegalStateException("artifacts are not sealed, workspace = " + id);
        }
        String prefix = String.format("test-%d-%s", index, RandomUtil.randomString(8));
        File testDir = FileUtil.mkdir(new File(dir, prefix));
        for (Map.Entry<String, Artifact> entry : snapshot.entrySet()) {
            File target = FileUtil.writeBytes(entry.getValue().content, new File(testDir, entry.getKey()));
            if (entry.getValue().executable && !target.setExecutable(true, true)) {
                throw new SandboxException("failed to mark executable: " + target.getAbsolutePath());
            }
        }
        File stdinFile = FileUtil.writeString(input == null ? "" : input, new File(testDir, prefix + ".in"), StandardCharsets.UTF_8);
        return new TestFiles(testDir, stdinFile, new File(testDir, prefix + ".out"), new File(testDir, prefix + ".err"));
    }

    @Override
    public void close() {
        boolean del = FileUtil.del(dir);
        if (!del || dir.exists()) {
            log.error("deleteFile error, workspace = {}", dir.getAbsolutePath());
        }
    }

    /**
     * 单个用例的运行目录与标准输入、输出、错误文件，关闭时删除运行目录
     */
    public static final class TestFiles implements Closeable {

        private final File dir;

        private final File stdin;

        private final File stdout;

        private final File stderr;

        TestFiles(File dir, File stdin, File stdout, File stderr) {
            this.dir = dir;
            this.stdin = stdin;
            this.stdout = stdout;
            this.stderr = stderr;
        }

        public File getDir() {
            return dir;
        }

        public File getStdin() {
            return stdin;
        }

        public File getStdout() {
            return stdout;
        }

        public File getStderr() {
            return stderr;
        }

        @Override
        public void close() {
            if (!FileUtil.del(dir)) {
                log.error("deleteFile error, testDir = {}", dir.getAbsolutePath());
            }
        }
    }

    private static final class Artifact {

        private final byte[] content;

        private final boolean executable;

        private Artifact(byte[] content, boolean executable) {
            this.content = content;
            this.executable = executable;
        }
    }
}
