package com.dayloop.timeline.service;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

public class FFmpegCommandBuilder {

    public static List<String> buildConcatCommand(Path listFile, Path output) {
        // Chunks share codec settings, so the concat demuxer can copy streams as-is
        return List.of(
                "ffmpeg",
                "-f",
                "concat",
                "-safe",
                "0",
                "-i",
                listFile.toString(),
                "-c",
                "copy",
                "-y",
                output.toString()
        );
    }

    public static List<String> buildTimelapseCommand(Path input, Path output, int speedup, int fps) {
        List<String> command = new ArrayList<>();
        command.add("nice");
        command.add("-n");
        command.add("19");
        command.add("ffmpeg");
        command.add("-threads");
        command.add("1");
        command.add("-i");
        command.add(input.toString());
        command.add("-vf");
        command.add("setpts=PTS/" + speedup);
        command.add("-r");
        command.add(String.valueOf(fps));
        command.add("-an");

        command.add("-c:v");
        command.add("libx264");
        command.add("-preset");
        command.add("veryfast");
        command.add("-pix_fmt");
        command.add("yuv420p");
        command.add("-movflags");
        command.add("+faststart");

        command.add("-y");
        command.add(output.toString());
        return command;
    }

    public static List<String> buildFrameSampleCommand(Path input, int intervalSeconds, Path outputPattern) {
        List<String> command = new ArrayList<>();
        command.add("ffmpeg");
        command.add("-i");
        command.add(input.toString());
        command.add("-vf");
        command.add("fps=1/" + intervalSeconds + ",scale=1280:-2");
        command.add("-q:v");
        command.add("3");
        command.add("-y");
        command.add(outputPattern.toString());
        return command;
    }

    public static String concatListEntry(Path file) {
        // concat demuxer quoting: close quote, escaped quote, reopen
        return "file '" + file.toAbsolutePath().toString().replace("'", "'\\''") + "'";
    }
}
