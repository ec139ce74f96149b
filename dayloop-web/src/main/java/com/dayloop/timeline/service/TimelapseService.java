package com.dayloop.timeline.service;

import com.dayloop.timeline.model.RecordingChunk;
import com.dayloop.timeline.model.TimelineCard;
import com.dayloop.timeline.util.FileCleanup;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.attribute.FileTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;

/**
 * Sped-up summary videos for cards. Runs after the cards are committed; a failure only
 * leaves the card without a video.
 */
@Service
@Slf4j
public class TimelapseService {

    private final ChunkStore chunkStore;
    private final TimelineStore timelineStore;
    private final VideoProcessingService videoProcessingService;
    private final Path timelapseRoot;
    private final int speedup;
    private final int fps;
    private final boolean enabled;
    private final long quotaBytes;

    public TimelapseService(ChunkStore chunkStore,
                            TimelineStore timelineStore,
                            VideoProcessingService videoProcessingService,
                            @Value("${dayloop.storage.timelapse-root:data/timelapses}") String timelapseRoot,
                            @Value("${dayloop.timelapse.speedup:20}") int speedup,
                            @Value("${dayloop.timelapse.fps:24}") int fps,
                            @Value("${dayloop.timelapse.enabled:true}") boolean enabled,
                            @Value("${dayloop.storage.timelapse-quota-bytes:10737418240}") long quotaBytes) {
        this.chunkStore = chunkStore;
        this.timelineStore = timelineStore;
        this.videoProcessingService = videoProcessingService;
        this.timelapseRoot = Paths.get(timelapseRoot);
        this.speedup = speedup;
        this.fps = fps;
        this.enabled = enabled;
        this.quotaBytes = quotaBytes;
    }

    @Async
    public void generateTimelapses(List<TimelineCard> cards) {
        if (!enabled) {
            return;
        }
        for (TimelineCard card : cards) {
            generateForCard(card);
        }
    }

    public void generateForCard(TimelineCard card) {
        List<RecordingChunk> chunks = chunkStore.completedChunksOverlapping(card.getStartTs(), card.getEndTs());
        if (chunks.isEmpty()) {
            log.debug("No recordings left for card {}, skipping timelapse", card.getId());
            return;
        }

        Path workDir = null;
        try {
            workDir = Files.createTempDirectory("timelapse_" + card.getId() + "_");
            List<Path> inputs = chunks.stream().map(c -> Paths.get(c.getFilePath())).toList();
            Path stitched = videoProcessingService.stitch(inputs, workDir.resolve("source.mp4"));

            Path output = timelapseRoot.resolve(card.getDay()).resolve("card-" + card.getId() + ".mp4");
            videoProcessingService.timelapse(stitched, output, speedup, fps);

            if (timelineStore.attachTimelapse(card.getId(), output.toString())) {
                log.info("Timelapse ready for card {}: {}", card.getId(), output);
                purgeIfNeeded(output);
            } else {
                // card was replaced while rendering
                FileCleanup.deleteQuietly(List.of(output.toString()));
            }
        } catch (Exception e) {
            log.warn("Timelapse for card {} failed: {}", card.getId(), e.getMessage());
        } finally {
            FileCleanup.deleteTree(workDir);
        }
    }

    /**
     * Evicts the oldest timelapses until the timelapse root is back under quota. Cards lose
     * their link before the file goes. The file just rendered is never evicted.
     *
     * @return number of files evicted
     */
    synchronized int purgeIfNeeded(Path justRendered) {
        List<Path> files = timelapsesOldestFirst();
        long used = files.stream().mapToLong(TimelapseService::sizeOf).sum();
        if (used <= quotaBytes) {
            return 0;
        }

        List<String> victims = new ArrayList<>();
        for (Path file : files) {
            if (used <= quotaBytes) {
                break;
            }
            if (file.equals(justRendered)) {
                continue;
            }
            victims.add(file.toString());
            used -= sizeOf(file);
        }
        int unlinked = timelineStore.detachTimelapses(victims);
        int deleted = FileCleanup.deleteQuietly(victims);
        log.info("Timelapses over quota of {} MB; evicted {} files, unlinked {} cards",
                quotaBytes / (1024 * 1024), deleted, unlinked);
        return deleted;
    }

    private List<Path> timelapsesOldestFirst() {
        if (!Files.isDirectory(timelapseRoot)) {
            return List.of();
        }
        try (Stream<Path> walk = Files.walk(timelapseRoot)) {
            return walk.filter(Files::isRegularFile)
                    .sorted(Comparator.comparing(TimelapseService::modifiedAt).thenComparing(Path::toString))
                    .toList();
        } catch (IOException | UncheckedIOException e) {
            log.warn("Could not list {}: {}", timelapseRoot, e.getMessage());
            return List.of();
        }
    }

    private static FileTime modifiedAt(Path file) {
        try {
            return Files.getLastModifiedTime(file);
        } catch (IOException e) {
            return FileTime.fromMillis(0);
        }
    }

    private static long sizeOf(Path file) {
        try {
            return Files.size(file);
        } catch (IOException e) {
            return 0; // removed mid-walk
        }
    }
}
