package com.project.sketch.scoring;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.web.servlet.MockMvc;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Base64;
import static org.hamcrest.Matchers.closeTo;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.lessThan;
import static org.hamcrest.Matchers.startsWith;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;
@SpringBootTest
@AutoConfigureMockMvc
@TestPropertySource(properties = {
        "app.upload.dir=target/test-uploads",
        "app.reference.dir=target/test-references"
})
class ScoringApiControllerTest {
    private static final String REFERENCE_URL = "/generated-images/curated/easy-apple.png";

    @Autowired MockMvc mvc;

    private byte[] rectanglePng;

    @BeforeEach
    void setup() throws Exception {
        rectanglePng = TestImages.png(TestImages.rectangle());
        Path curated = Path.of("target/test-references/curated");
        Files.createDirectories(curated);
        Files.write(curated.resolve("easy-apple.png"), rectanglePng);
    }

    @Test
    void compute_scoresUploadedSketch() throws Exception {
        MockMultipartFile sketch = new MockMultipartFile("sketch", "sketch.png", "image/png", rectanglePng);

        mvc.perform(multipart("/api/scoring/compute")
                        .file(sketch)
                        .param("referenceUrl", REFERENCE_URL)
                        .param("difficulty", "easy"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.score").value(closeTo(100.0, 0.01)))
                .andExpect(jsonPath("$.difficulty").value("easy"))
                .andExpect(jsonPath("$.referenceSubstituted").value(false))
                .andExpect(jsonPath("$.breakdown.contourScore").value(100.0))
                .andExpect(jsonPath("$.details.inkPenalty").value(1.0))
                .andExpect(jsonPath("$.heatmap").value(startsWith("data:image/png;base64,")))
                .andExpect(jsonPath("$.submissionUrl").value(startsWith("/uploads/submissions/")));
    }

    @Test
    void compute_withoutSketch_isBadRequest() throws Exception {
        mvc.perform(multipart("/api/scoring/compute").param("referenceUrl", REFERENCE_URL))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("No sketch file uploaded"));
    }

    @Test
    void compute_withUnknownDifficulty_isBadRequest() throws Exception {
        MockMultipartFile sketch = new MockMultipartFile("sketch", "sketch.png", "image/png", rectanglePng);

        mvc.perform(multipart("/api/scoring/compute")
                        .file(sketch)
                        .param("referenceUrl", REFERENCE_URL)
                        .param("difficulty", "extreme"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Invalid difficulty: extreme"));
    }

    @Test
    void compute_withCorruptImage_isBadRequest() throws Exception {
        MockMultipartFile sketch = new MockMultipartFile("sketch", "sketch.png", "image/png", new byte[]{(byte) 0x89, 'P', 'N', 'G'});

        mvc.perform(multipart("/api/scoring/compute")
                        .file(sketch)
                        .param("referenceUrl", REFERENCE_URL))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Invalid image"));
    }

    @Test
    void computeBase64_scoresDataUri() throws Exception {
        String sketch = "data:image/png;base64," + Base64.getEncoder().encodeToString(TestImages.png(TestImages.rectangle(40, 0)));
        String body = "{\"sketch\":\"" + sketch + "\",\"referenceUrl\":\"" + REFERENCE_URL + "\",\"difficulty\":\"hard\"}";

        mvc.perform(post("/api/scoring/compute-base64")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.difficulty").value("hard"))
                .andExpect(jsonPath("$.score").value(lessThan(100.0)));
    }

    @Test
    void computeBase64_withMissingReference_scoresAgainstItself() throws Exception {
        String sketch = Base64.getEncoder().encodeToString(rectanglePng);
        String body = "{\"sketch\":\"" + sketch + "\",\"referenceUrl\":\"/generated-images/curated/gone.png\"}";

        mvc.perform(post("/api/scoring/compute-base64")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.referenceSubstituted").value(true))
                .andExpect(jsonPath("$.difficulty").value("medium"));
    }

    @Test
    void computeBase64_overTenMegabytes_isRejectedAndNotStored() throws Exception {
        String sketch = "data:image/png;base64," + Base64.getEncoder().encodeToString(new byte[10 * 1024 * 1024 + 1]);
        String body = "{\"sketch\":\"" + sketch + "\",\"referenceUrl\":\"" + REFERENCE_URL + "\"}";
        Path submissions = Path.of("target/test-uploads/submissions");
        long before;
        try (var files = Files.list(submissions)) {
            before = files.count();
        }

        mvc.perform(post("/api/scoring/compute-base64")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("The sketch is too large. Maximum size: 10MB"));

        try (var files = Files.list(submissions)) {
            org.assertj.core.api.Assertions.assertThat(files.count()).isEqualTo(before);
        }
    }

    @Test
    void computeBase64_withoutFields_isBadRequest() throws Exception {
        mvc.perform(post("/api/scoring/compute-base64")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Missing sketch or referenceUrl"));
    }

    @Test
    void computeBase64_withMalformedJson_isBadRequest() throws Exception {
        mvc.perform(post("/api/scoring/compute-base64")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"sketch\":"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void references_areListedPerDifficulty() throws Exception {
        mvc.perform(get("/api/references/hard"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(3)))
                .andExpect(jsonPath("$[0].url").value(startsWith("/generated-images/curated/hard-")));
    }

    @Test
    void references_forUnknownDifficulty_isBadRequest() throws Exception {
        mvc.perform(get("/api/references/extreme"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void difficulties_areListed() throws Exception {
        mvc.perform(get("/api/difficulties"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(3)))
                .andExpect(jsonPath("$[1].id").value("medium"));
    }

    @Test
    void health_isPublic() throws Exception {
        mvc.perform(get("/api/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("ok"));
    }
}
