package com.dayloop.timeline.endpoint;

import com.dayloop.timeline.exception.GlobalExceptionHandler;
import com.dayloop.timeline.exception.ResourceNotFoundException;
import com.dayloop.timeline.model.RecordingChunk;
import com.dayloop.timeline.service.ChunkStore;
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

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
public class RecordingControllerTest {

    private MockMvc mockMvc;

    @Mock
    private ChunkStore chunkStore;

    @InjectMocks
    private RecordingController recordingController;

    @BeforeEach
    public void setup() {
        mockMvc = MockMvcBuilders.standaloneSetup(recordingController)
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    public void testRegisterChunk() throws Exception {
        RecordingChunk chunk = new RecordingChunk(1_000, 1_060, "/rec/a.mp4", RecordingChunk.ChunkStatus.RECORDING);
        chunk.setId(5L);
        Mockito.when(chunkStore.registerChunk("/rec/a.mp4", 1_000L)).thenReturn(chunk);

        mockMvc.perform(post("/api/chunks")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"filePath\":\"/rec/a.mp4\",\"startTs\":1000}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.data.id").value(5))
                .andExpect(jsonPath("$.data.status").value("RECORDING"));
    }

    @Test
    public void testRegisterChunkWithoutBody() throws Exception {
        RecordingChunk chunk = new RecordingChunk(1_000, 1_060, "/rec/generated.mp4", RecordingChunk.ChunkStatus.RECORDING);
        Mockito.when(chunkStore.registerChunk(null, null)).thenReturn(chunk);

        mockMvc.perform(post("/api/chunks"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.filePath").value("/rec/generated.mp4"));
    }

    @Test
    public void testCompleteTwiceIsBadRequest() throws Exception {
        Mockito.when(chunkStore.markChunkCompleted(5L, 1_045L))
                .thenThrow(new IllegalStateException("Chunk 5 is already COMPLETED"));

        mockMvc.perform(post("/api/chunks/5/complete")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"endTs\":1045}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.message").value("Chunk 5 is already COMPLETED"));
    }

    @Test
    public void testFailUnknownChunk() throws Exception {
        Mockito.doThrow(new ResourceNotFoundException("Chunk not found: 9")).when(chunkStore).markChunkFailed(9L);

        mockMvc.perform(post("/api/chunks/9/fail"))
                .andExpect(status().isNotFound());
    }
}
