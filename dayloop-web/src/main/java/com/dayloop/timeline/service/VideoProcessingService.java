package com.dayloop.timeline.service;

import com.dayloop.timeline.exception.VideoProcessingException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

/**
 * FFmpeg operations on recorded chunks. Every method blocks until ffmpeg exits.
 */
@Service
@Slf4j
public class VideoProcessingService {

    public Path stitch(List<Path> inputs, Path output) {
        if (inputs.isEmpty()) {
            throw new VideoProcessingException("Nothing to stitch");
        }
        Path listFile = output.resolveSibling(output.getFileName() + ".txt");
        try {
            Files.createDirectories(output.toAbsolutePath().getParent());
            Files.write(listFile, inputs.stream().map(FFmpegCommandBuilder::concatListEntry).toList());
        } catch (IOException e) {
            throw new VideoProcessingException("Could not prepare stitch list: " + e.getMessage(), e);
        }

        log.info("Stitching {} chunks into {}", inputs.size(), output.getFileName());
        run(FFmpegCommandBuilder.buildConcatCommand(listFile, output), "Stitch");
        return output;
    }

    public Path timelapse(Path input, Path output, int speedup, int fps) {
        try {
            Files.createDirectories(output.toAbsolutePath().getParent());
        } catch (IOException e) {
            throw new VideoProcessingException("Could not create " + output.getParent() + ": " + e.getMessage(), e);
        }
        run(FFmpegCommandBuilder.buildTimelapseCommand(input, output, speedup, fps), "Timelapse");
        return output;
    }

    /**
     * One JPEG every {@code intervalSeconds}; frame {@code i} (0-based) sits at offset
     * {@code i * intervalSeconds}.
     */
    public List<Path> sampleFrames(Path input, int intervalSeconds, Path outputDir) {
        try {
            Files.createDirectories(outputDir);
        } catch (IOException e) {
            throw new VideoProcessingException("Could not create " + outputDir + ": " + e.getMessage(), e);
        }
        run(FFmpegCommandBuilder.buildFrameSampleCommand(input, intervalSeconds, outputDir.resolve("frame_%04d.jpg")), "Frames");

        try (Stream<Path> files = Files.list(outputDir)) {
            return files.filter(p -> p.getFileName().toString().startsWith("frame_"))
                    .sorted()
                    .toList();
        } catch (IOException e) {
            throw new VideoProcessingException("Could not list frames: " + e.getMessage(), e);
        }
    }

    private void run(List<String> command, String label) {
        try {
            Process process = new ProcessBuilder(command).redirectErrorStream(true).start();

            try (BufferedReader reader = new BufferedReader(new InputStreamReader(process.getInputStream()))) {
                String line;
                while ((line = reader.readLine()) != null) {
                    log.debug("[FFmpeg {}] {}", label, line);
                }
            }

            int exitCode = process.waitFor();
            if (exitCode != 0) {
                throw new VideoProcessingException(label + " failed (ffmpeg exit code " + exitCode + ")");
            }
        } catch (IOException e) {
            throw new VideoProcessingException(label + " failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new VideoProcessingException(label + " interrupted", e);
        }
    }
}
