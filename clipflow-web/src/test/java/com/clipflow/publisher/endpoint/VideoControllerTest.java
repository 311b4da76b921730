package com.clipflow.publisher.endpoint;

import com.clipflow.publisher.dto.PublishPlan;
import com.clipflow.publisher.exception.GlobalExceptionHandler;
import com.clipflow.publisher.exception.InvalidStateException;
import com.clipflow.publisher.exception.NoCredentialsException;
import com.clipflow.publisher.exception.ResourceNotFoundException;
import com.clipflow.publisher.model.Platform;
import com.clipflow.publisher.model.PlatformCaption;
import com.clipflow.publisher.model.Video;
import com.clipflow.publisher.model.VideoStatus;
import com.clipflow.publisher.service.VideoLifecycleService;
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

import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
public class VideoControllerTest {

    private MockMvc mockMvc;

    @Mock
    private VideoLifecycleService lifecycleService;

    @InjectMocks
    private VideoController videoController;

    @BeforeEach
    public void setup() {
        mockMvc = MockMvcBuilders.standaloneSetup(videoController)
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    private static Video video(VideoStatus status) {
        Video video = new Video("Demo", "https://cdn.example.com/demo.mp4");
        video.setId(1L);
        video.setStatus(status);
        return video;
    }

    @Test
    public void testRegisterVideo() throws Exception {
        Mockito.when(lifecycleService.registerUpload("Demo", "https://cdn.example.com/demo.mp4"))
                .thenReturn(video(VideoStatus.UPLOADED));

        mockMvc.perform(post("/api/videos")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"title\":\"Demo\",\"fileUrl\":\"https://cdn.example.com/demo.mp4\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.data.id").value(1))
                .andExpect(jsonPath("$.data.status").value("UPLOADED"));
    }

    @Test
    public void testRegisterVideoWithoutFileUrl() throws Exception {
        mockMvc.perform(post("/api/videos")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"title\":\"Demo\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success").value(false));
    }

    @Test
    public void testGetVideoNotFound() throws Exception {
        Mockito.when(lifecycleService.getVideo(42L)).thenThrow(ResourceNotFoundException.video(42L));

        mockMvc.perform(get("/api/videos/42"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.message").value("Video not found: 42"));
    }

    @Test
    public void testStartTranscription() throws Exception {
        Mockito.when(lifecycleService.startTranscription(1L)).thenReturn(video(VideoStatus.TRANSCRIBING));

        mockMvc.perform(post("/api/videos/1/transcribe"))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.data.status").value("TRANSCRIBING"));
    }

    @Test
    public void testGenerateCaptionsConflict() throws Exception {
        Mockito.when(lifecycleService.startCaptionGeneration(1L))
                .thenThrow(new InvalidStateException("Video 1 has no transcript; transcribe it first"));

        mockMvc.perform(post("/api/videos/1/captions"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.success").value(false));
    }

    @Test
    public void testReviseCaption() throws Exception {
        Video video = video(VideoStatus.READY);
        video.getCaptions().put(Platform.TIKTOK, PlatformCaption.of("New caption", List.of("#fyp")));
        Mockito.when(lifecycleService.reviseCaption(eq(1L), eq(Platform.TIKTOK), eq("New caption"), any()))
                .thenReturn(video);

        mockMvc.perform(put("/api/videos/1/captions/tiktok")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"caption\":\"New caption\",\"hashtags\":[\"#fyp\"]}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.captions.TIKTOK.caption").value("New caption"));
    }

    @Test
    public void testPublishReportsSkippedPlatforms() throws Exception {
        Mockito.when(lifecycleService.startPublish(1L, List.of("facebook", "tiktok")))
                .thenReturn(new PublishPlan(List.of(Platform.FACEBOOK), List.of(Platform.TIKTOK)));

        mockMvc.perform(post("/api/videos/1/publish")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"platforms\":[\"facebook\",\"tiktok\"]}"))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.data.available[0]").value("FACEBOOK"))
                .andExpect(jsonPath("$.data.skipped[0]").value("TIKTOK"));
    }

    @Test
    public void testPublishWithoutCredentials() throws Exception {
        Mockito.when(lifecycleService.startPublish(1L, List.of("facebook")))
                .thenThrow(new NoCredentialsException(List.of(Platform.FACEBOOK)));

        mockMvc.perform(post("/api/videos/1/publish")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"platforms\":[\"facebook\"]}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("No credentials configured for any selected platform: Facebook"));
    }

    @Test
    public void testTranscriptionCallback() throws Exception {
        mockMvc.perform(post("/api/transcriptions/callback")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"transcript_id\":\"tr_1\",\"status\":\"completed\"}"))
                .andExpect(status().isOk());

        Mockito.verify(lifecycleService).handleTranscriptionWebhook("tr_1");
    }
}
