package com.playbackadvisor.integration;

import com.playbackadvisor.model.ClientProfile;
import com.playbackadvisor.store.ClientProfileStore;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.hamcrest.Matchers.containsString;
import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * End to end over HTTP: register, advise, start, stop, learn, recalibrate, report.
 */
@SpringBootTest(properties = {
    "advisor.enable-dynamic-policies=true",
    "advisor.enable-learning=true",
    "advisor.conservative-mode=false"
})
@AutoConfigureMockMvc
class PlaybackAdvisorIntegrationTest {

    @Autowired MockMvc mvc;
    @Autowired ClientProfileStore clientStore;

    @Test
    @DisplayName("Web client asking for HEVC in MKV is steered away from direct play")
    void policyForWebClient() throws Exception {
        mvc.perform(put("/v1/clients/browser-1")
                .contentType(MediaType.APPLICATION_JSON)
                .content("""
                    {"device_name": "Laptop", "client_name": "Jellyfin Web", "category": "web_browser",
                     "codec_confidence": {"HEVC": 0.2, "h264": 0.95}}
                    """))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.device_id").value("browser-1"))
            .andExpect(jsonPath("$.category").value("web_browser"))
            .andExpect(jsonPath("$.codec_confidence.hevc").value(0.2));

        mvc.perform(post("/v1/policies")
                .contentType(MediaType.APPLICATION_JSON)
                .content("""
                    {"device_id": "BROWSER-1",
                     "media": {"media_source_id": "m-1", "video_codec": "hevc", "container": "mkv"}}
                    """))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.allow_direct_play").value(false))
            .andExpect(jsonPath("$.allow_transcoding").value(true))
            .andExpect(jsonPath("$.is_default").value(false));
    }

    @Test
    void sessionLifecycleFeedsLearning() throws Exception {
        mvc.perform(post("/v1/playback/start")
                .contentType(MediaType.APPLICATION_JSON)
                .content("""
                    {"device_id": "shield-1", "client_name": "Android TV", "category": "android_tv",
                     "play_session_id": "ps-1", "play_method": "DirectPlay",
                     "media": {"media_source_id": "m-2", "video_codec": "h264", "audio_codec": "aac",
                               "container": "mp4", "bitrate": 8000000}}
                    """))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.allow_direct_play").value(true));

        mvc.perform(post("/v1/playback/stop")
                .contentType(MediaType.APPLICATION_JSON)
                .content("""
                    {"play_session_id": "ps-1", "played_ticks": 5000, "total_ticks": 10000}
                    """))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("recorded"))
            .andExpect(jsonPath("$.outcome.result").value("SUCCESS"));

        ClientProfile learned = clientStore.findByDeviceId("shield-1").orElseThrow();
        assertEquals(0.012, learned.codecConfidence("h264").getAsDouble(), 1e-9);

        mvc.perform(post("/v1/clients/shield-1/recalibrate"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.device_id").value("shield-1"));

        mvc.perform(get("/v1/dashboard/summary"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.config.enable_learning").value(true));

        mvc.perform(get("/v1/dashboard/outcomes").param("hours", "1"))
            .andExpect(status().isOk());
    }

    @Test
    void stopForUnknownSession_isUnmatched() throws Exception {
        mvc.perform(post("/v1/playback/stop")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"play_session_id\": \"missing\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("unmatched"));
    }

    @Test
    void unknownClient_is404() throws Exception {
        mvc.perform(get("/v1/clients/nobody"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.error_code").value("UNKNOWN_CLIENT"));

        mvc.perform(post("/v1/policies")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"device_id\": \"nobody\", \"media\": {\"video_codec\": \"h264\"}}"))
            .andExpect(status().isNotFound());
    }

    @Test
    void invalidRequests_are400() throws Exception {
        mvc.perform(put("/v1/clients/bad")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"category\": \"toaster\"}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error_code").value("BAD_REQUEST"));

        mvc.perform(post("/v1/playback/start")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"device_id\": \"x\"}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error_code").value("INVALID_ARGUMENT"));
    }

    @Test
    @DisplayName("Error bodies carry the code, a message naming the offending input, and a timestamp")
    void errorBodyShape() throws Exception {
        mvc.perform(get("/v1/dashboard/outcomes").param("hours", "soon"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error_code").value("BAD_REQUEST"))
            .andExpect(jsonPath("$.message").value(containsString("hours")))
            .andExpect(jsonPath("$.timestamp").exists());

        mvc.perform(post("/v1/clients/nobody/recalibrate"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.error_code").value("UNKNOWN_CLIENT"))
            .andExpect(jsonPath("$.message").value(containsString("nobody")));
    }
}
