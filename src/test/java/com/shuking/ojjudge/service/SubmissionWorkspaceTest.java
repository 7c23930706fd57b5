package com.shuking.ojjudge.service;

import cn.hutool.core.io.FileUtil;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.attribute.PosixFilePermissions;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SubmissionWorkspaceTest {

    @TempDir
    File rootDir;

    @Test
    void createsPrivateDirectoryAndDeletesOnClose() throws Exception {
        File dir;
        try (SubmissionWorkspace workspace = SubmissionWorkspace.create(new File(rootDir, "nested").getAbsolutePath())) {
            dir = workspace.getDir();
            assertThat(dir).isDirectory();
            assertThat(dir.getName()).isEqualTo(workspace.getId());
            if (FileSystems.getDefault().supportedFileAttributeViews().contains("posix")) {
                assertThat(PosixFilePermissions.toString(Files.getPosixFilePermissions(dir.toPath()))).isEqualTo("rwx------");
            }
            File source = workspace.writeSource("main.py", "print(1)\n");
            assertThat(FileUtil.readString(source, StandardCharsets.UTF_8)).isEqualTo("print(1)\n");
        }
        assertThat(dir).doesNotExist();
    }

    @Test
    void testFilesAreUniquePerCall() {
        try (SubmissionWorkspace workspace = SubmissionWorkspace.create(rootDir.getAbsolutePath())) {
            workspace.sealArtifacts();
            SubmissionWorkspace.TestFiles first = workspace.prepareTestFiles(0, "1 2\n");
            SubmissionWorkspace.TestFiles second = workspace.prepareTestFiles(0, null);

            assertThat(first.getDir().getName()).startsWith("test-0-");
            assertThat(first.getDir().getParentFile()).isEqualTo(workspace.getDir());
            assertThat(first.getStdin().getParentFile()).isEqualTo(first.getDir());
            assertThat(first.getStdin().getName()).endsWith(".in");
            assertThat(first.getStdout().getName()).endsWith(".out");
            assertThat(first.getStderr().getName()).endsWith(".err");
            assertThat(first.getDir()).isNotEqualTo(second.getDir());
            assertThat(FileUtil.readString(first.getStdin(), StandardCharsets.UTF_8)).isEqualTo("1 2\n");
            assertThat(second.getStdin()).exists().hasContent("");

            first.close();
            assertThat(first.getDir()).doesNotExist();
            assertThat(second.getDir()).isDirectory();
        }
    }

    @Test
    void eachTestStartsFromSealedArtifacts() {
        try (SubmissionWorkspace workspace = SubmissionWorkspace.create(rootDir.getAbsolutePath())) {
            workspace.writeSource("main.py", "print(input())\n");
            File binary = FileUtil.writeString("#!/bin/sh\n", new File(workspace.getDir(), "app"), StandardCharsets.UTF_8);
            assertThat(binary.setExecutable(true, true)).isTrue();
            workspace.sealArtifacts();

            try (SubmissionWorkspace.TestFiles first = workspace.prepareTestFiles(0, "7")) {
                File source = new File(first.getDir(), "main.py");
                assertThat(source).hasContent("print(input())\n");
                assertThat(new File(first.getDir(), "app").canExecute()).isTrue();
                // 运行中的程序改写自身和工作区根目录中的文件
                FileUtil.writeString("print(42)\n", source, StandardCharsets.UTF_8);
                FileUtil.writeString("print(42)\n", new File(workspace.getDir(), "main.py"), StandardCharsets.UTF_8);
                FileUtil.del(new File(workspace.getDir(), "app"));
            }

            try (SubmissionWorkspace.TestFiles second = workspace.prepareTestFiles(1, "9")) {
                assertThat(new File(second.getDir(), "main.py")).hasContent("print(input())\n");
                assertThat(new File(second.getDir(), "app")).exists();
                assertThat(new File(second.getDir(), "app").canExecute()).isTrue();
            }
        }
    }

    @Test
    void testFilesRequireSealedArtifacts() {
        try (SubmissionWorkspace workspace = SubmissionWorkspace.create(rootDir.getAbsolutePath())) {
            assertThatThrownBy(() -> workspace.prepareTestFiles(0, "1"))
                    .isInstanceOf(IllegalStateException.class);
        }
    }

    @Test
    void workspacesDoNotCollide() {
        try (SubmissionWorkspace a = SubmissionWorkspace.create(rootDir.getAbsolutePath());
             SubmissionWorkspace b = SubmissionWorkspace.create(rootDir.getAbsolutePath())) {
            assertThat(a.getDir()).isNotEqualTo(b.getDir());
        }
        assertThat(rootDir.listFiles()).isEmpty();
    }
}
