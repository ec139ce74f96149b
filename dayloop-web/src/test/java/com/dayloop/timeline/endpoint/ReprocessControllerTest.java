package com.dayloop.timeline.endpoint;

import com.dayloop.timeline.exception.GlobalExceptionHandler;
import com.dayloop.timeline.service.ReprocessJob;
import com.dayloop.timeline.service.ReprocessingService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.Mockito;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
public class ReprocessControllerTest {

    private MockMvc mockMvc;

    @Mock
    private ReprocessingService reprocessingService;

    @InjectMocks
    private ReprocessController reprocessController;

    @BeforeEach
    public void setup() {
        mockMvc = MockMvcBuilders.standaloneSetup(reprocessController)
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    public void testReprocessDay() throws Exception {
        ReprocessJob job = new ReprocessJob("day 2024-03-10");
        Mockito.when(reprocessingService.submitDay(LocalDate.of(2024, 3, 10))).thenReturn(job);

        mockMvc.perform(post("/api/reprocess/day/2024-03-10"))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.data.jobId").value(job.getId()))
                .andExpect(jsonPath("$.data.done").value(false));
    }

    @Test
    public void testReprocessBatchesRequiresIds() throws Exception {
        mockMvc.perform(post("/api/reprocess/batches")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"batchIds\":[]}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("At least one batch id required"));
    }

    @Test
    public void testJobProgress() throws Exception {
        ReprocessJob job = new ReprocessJob("batches [1, 2]");
        job.addProgress("Processing batch 1 of 2... (Total elapsed: 0s)");
        Mockito.when(reprocessingService.findJob(job.getId())).thenReturn(Optional.of(job));

        mockMvc.perform(get("/api/reprocess/" + job.getId()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.progress[0]").value("Processing batch 1 of 2... (Total elapsed: 0s)"));
    }

    @Test
    public void testUnknownJob() throws Exception {
        Mockito.when(reprocessingService.findJob("nope")).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/reprocess/nope"))
                .andExpect(status().isNotFound());
    }

    @Test
    public void testBatchesSubmitted() throws Exception {
        ReprocessJob job = new ReprocessJob("batches [4]");
        Mockito.when(reprocessingService.submitBatches(List.of(4L))).thenReturn(job);

        mockMvc.perform(post("/api/reprocess/batches")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"batchIds\":[4]}"))
                .andExpect(status().isAccepted());
    }
}
