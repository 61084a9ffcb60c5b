package com.photo.panogroup.core.stitcher;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

/**
 * 调用外部拼接工具链（如 Hugin 的 pto_gen / cpfind / nona / enblend）
 * <p>
 * 每个步骤是一条命令行，按空白切分为参数，支持占位符：
 * {inputs} 展开为全部输入图像，{output} 为输出文件，{workdir} 为本次拼接的临时工作目录。
 * 每步单独起一个进程并限时；任一步非零退出、超时或最终没有输出文件都视为失败。
 */
public class ExternalCommandStitcher implements Stitcher {
    private static final Logger logger = LoggerFactory.getLogger(ExternalCommandStitcher.class);

    static final String INPUTS = "{inputs}";
    static final String OUTPUT = "{output}";
    static final String WORKDIR = "{workdir}";

    private static final int LOG_TAIL_CHARS = 400;

    private final List<String> steps;
    private final Duration stepTimeout;

    public ExternalCommandStitcher(List<String> steps, Duration stepTimeout) {
        this.steps = steps != null ? List.copyOf(steps) : List.of();
        this.stepTimeout = stepTimeout;
    }

    @Override
    public StitchOutcome stitch(List<Path> orderedImages, Path output) throws InterruptedException {
        if (orderedImages == null || orderedImages.size() < 2) {
            throw new IllegalArgumentException("Stitching needs at least 2 images");
        }
        if (steps.isEmpty()) {
            return StitchOutcome.failure(orderedImages, output, "No stitch steps configured");
        }

        Path workDir = null;
        try {
            workDir = Files.createTempDirectory("pano-group-");
            Path parent = output.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }

            for (int i = 0; i < steps.size(); i++) {
                List<String> command = expand(steps.get(i), orderedImages, output, workDir);
                String failure = runStep(i + 1, command, workDir);
                if (failure != null) {
                    return StitchOutcome.failure(orderedImages, output, failure);
                }
            }

            if (!Files.isRegularFile(output)) {
                return StitchOutcome.failure(orderedImages, output, "Stitcher produced no output file " + output);
            }
            logger.info("Stitched {} image(s) into {}", orderedImages.size(), output);
            return StitchOutcome.success(orderedImages, output);
        } catch (IOException e) {
            logger.warn("Stitching into {} failed: {}", output, e.getMessage());
            return StitchOutcome.failure(orderedImages, output, "I/O error: " + e.getMessage());
        } finally {
            deleteRecursively(workDir);
        }
    }

    /**
     * 运行一个步骤
     * @return 失败原因，成功时返回 null
     */
    private String runStep(int index, List<String> command, Path workDir) throws IOException, InterruptedException {
        Path log = workDir.resolve("step-" + index + ".log");
        logger.debug("Stitch step {}: {}", index, command);

        ProcessBuilder pb = new ProcessBuilder(command);
        pb.directory(workDir.toFile());
        pb.redirectErrorStream(true);
        pb.redirectOutput(log.toFile());

        Process process;
        try {
            process = pb.start();
        } catch (IOException e) {
            return "Step " + index + " could not start (" + command.get(0) + "): " + e.getMessage();
        }

        boolean completed;
        try {
            completed = process.waitFor(stepTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            process.destroyForcibly();
            throw e;
        }
        if (!completed) {
            process.destroyForcibly();
            return "Step " + index + " timed out after " + stepTimeout;
        }
        if (process.exitValue() != 0) {
            return "Step " + index + " exited with code " + process.exitValue() + ": " + tail(log);
        }
        return null;
    }

    static List<String> expand(String step, List<Path> inputs, Path output, Path workDir) {
        List<String> command = new ArrayList<>();
        for (String token : step.trim().split("\\s+")) {
            if (token.isEmpty()) {
                continue;
            }
            if (token.equals(INPUTS)) {
                inputs.forEach(p -> command.add(p.toAbsolutePath().toString()));
            } else {
                command.add(token
                        .replace(OUTPUT, output.toAbsolutePath().toString())
                        .replace(WORKDIR, workDir.toAbsolutePath().toString()));
            }
        }
        if (command.isEmpty()) {
            throw new IllegalArgumentException("Empty stitch step");
        }
        return command;
    }

    private static String tail(Path log) {
        try {
            String text = new String(Files.readAllBytes(log), StandardCharsets.UTF_8).trim();
            return text.length() <= LOG_TAIL_CHARS ? text : "..." + text.substring(text.length() - LOG_TAIL_CHARS);
        } catch (IOException e) {
            return "(no output)";
        }
    }

    private static void deleteRecursively(Path dir) {
        if (dir == null) {
            return;
        }
        try (Stream<Path> walk = Files.walk(dir)) {
            walk.sorted(Comparator.reverseOrder()).forEach(p -> {
                try {
                    Files.deleteIfExists(p);
                } catch (IOException e) {
                    logger.debug("Could not delete {}: {}", p, e.getMessage());
                }
            });
        } catch (IOException e) {
            logger.debug("Could not clean up {}: {}", dir, e.getMessage());
        }
    }
}
