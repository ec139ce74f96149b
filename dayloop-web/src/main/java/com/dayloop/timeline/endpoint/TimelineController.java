package com.dayloop.timeline.endpoint;

import com.dayloop.timeline.service.TimelineStore;
import com.dayloop.timeline.util.LogicalDay;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Clock;
import java.time.LocalDate;

@RestController
@RequestMapping("/api/cards")
@RequiredArgsConstructor
public class TimelineController {

    private final TimelineStore timelineStore;
    private final LogicalDay logicalDay;
    private final Clock clock;

    // Defaults to the current logical day
    @GetMapping
    public ResponseEntity<?> cardsForDay(@RequestParam(required = false)
                                         @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate day) {
        String label = day != null ? day.toString() : logicalDay.labelOf(clock.instant().getEpochSecond());
        return ResponseEntity.ok(timelineStore.cardsForDay(label));
    }
}
