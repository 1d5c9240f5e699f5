package com.plagiarism.intake.compile;

import com.plagiarism.intake.config.IntakeProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.FileSystemUtils;
import org.springframework.util.StringUtils;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * 调用 Keil C51 ({@code BIN/C51.exe}) 把 C 文件编译为列表文件，再提取汇编指令。
 * <p>
 * 每次编译在独立的临时目录中进行，结束后删除。
 */
@Slf4j
@Component
public class KeilC51Compiler implements AssemblyCompiler {

    private static final List<String> COMMON_PATHS = List.of(
            "C:\\Keil_v5\\C51",
            "C:\\Keil\\C51",
            "C:\\Program Files\\Keil_v5\\C51",
            "C:\\Program Files (x86)\\Keil_v5\\C51",
            "C:\\Program Files\\Keil\\C51",
            "C:\\Program Files (x86)\\Keil\\C51");

    private final IntakeProperties.CompilerConfig config;
    private final Path compilerExecutable;

    public KeilC51Compiler(IntakeProperties properties) {
        this.config = properties.getCompiler();
        this.compilerExecutable = config.isEnabled() ? locate().orElse(null) : null;
        if (config.isEnabled()) {
            if (compilerExecutable == null) {
                log.warn("已启用 C51 编译，但未找到 Keil C51 (BIN/C51.exe)，C 文件将按源码比对");
            } else {
                log.info("C51 编译器: {}", compilerExecutable);
            }
        }
    }

    @Override
    public boolean isAvailable() {
        return compilerExecutable != null;
    }

    @Override
    public CompilationResult compile(String fileName, String source) {
        if (compilerExecutable == null) {
            return CompilationResult.failure("Keil C51 编译器不可用");
        }
        Path workDir = null;
        try {
            workDir = Files.createTempDirectory("c51-");
            String baseName = StringUtils.stripFilenameExtension(Paths.get(fileName).getFileName().toString());
            Path cFile = workDir.resolve(baseName + ".c");
            Files.writeString(cFile, source, StandardCharsets.UTF_8);

            List<String> command = new ArrayList<>();
            command.add(compilerExecutable.toString());
            command.add(cFile.getFileName().toString());
            command.add("CODE");
            command.add("LISTINCLUDE");
            command.add("OBJECT(" + baseName + ".obj)");
            command.add("PRINT(" + baseName + ".lst)");
            command.add("OPTIMIZE(" + config.getOptimizeLevel() + ")");

            Path output = workDir.resolve("c51.out");
            Process process = new ProcessBuilder(command)
                    .directory(workDir.toFile())
                    .redirectErrorStream(true)
                    .redirectOutput(output.toFile())
                    .start();

            if (!process.waitFor(config.getTimeoutSeconds(), TimeUnit.SECONDS)) {
                process.destroyForcibly();
                return CompilationResult.failure("编译超时 (" + config.getTimeoutSeconds() + " 秒)");
            }
            // C51 退出码 0 为成功，1 为仅有警告
            if (process.exitValue() > 1) {
                String message = Files.exists(output) ? readLenient(output) : "";
                return CompilationResult.failure("编译失败 (退出码 " + process.exitValue() + "): " + message.trim());
            }

            Path listing = workDir.resolve(baseName + ".lst");
            if (!Files.exists(listing)) {
                return CompilationResult.failure("编译后未找到列表文件: " + listing.getFileName());
            }
            return CompilationResult.ok(KeilListingExtractor.extract(readLenient(listing)));
        } catch (IOException e) {
            log.warn("编译 {} 出错: {}", fileName, e.getMessage());
            return CompilationResult.failure("编译出错: " + e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return CompilationResult.failure("编译被中断");
        } finally {
            if (workDir != null) {
                try {
                    FileSystemUtils.deleteRecursively(workDir);
                } catch (IOException e) {
                    log.warn("清理临时目录失败: {}", workDir);
                }
            }
        }
    }

    /**
     * 查找顺序：配置的安装目录、环境变量 C51ROOT / KEIL_C51、常见安装位置。
     */
    Optional<Path> locate() {
        List<String> candidates = new ArrayList<>();
        if (StringUtils.hasText(config.getKeilPath())) {
            candidates.add(config.getKeilPath());
        }
        for (String env : List.of("C51ROOT", "KEIL_C51")) {
            String value = System.getenv(env);
            if (StringUtils.hasText(value)) {
                candidates.add(value);
            }
        }
        candidates.addAll(COMMON_PATHS);

        for (String candidate : candidates) {
            Path exe = Paths.get(candidate, "BIN", "C51.exe");
            if (Files.isRegularFile(exe)) {
                return Optional.of(exe);
            }
        }
        return Optional.empty();
    }

    private static String readLenient(Path file) throws IOException {
        return new String(Files.readAllBytes(file), StandardCharsets.ISO_8859_1);
    }
}
