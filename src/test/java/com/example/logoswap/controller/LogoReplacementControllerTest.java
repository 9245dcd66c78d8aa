package com.example.logoswap.controller;

import com.example.logoswap.TestImages;
import com.example.logoswap.image.RasterBuffer;
import com.example.logoswap.image.RasterCodec;
import com.jayway.jsonpath.JsonPath;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
class LogoReplacementControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Test
    void replaceReturnsModifiedImageWithOccurrences() throws Exception {
        RasterBuffer scene = TestImages.withOldLogo(TestImages.noise(480, 360, 7L), 1.0, 200, 150);

        MvcResult result = mockMvc.perform(multipart("/api/v1/logos/replace")
                        .file(png("image", "scene.png", scene))
                        .file(png("oldLogo", "old.png", TestImages.oldLogo().raster()))
                        .file(png("newLogo", "new.png", TestImages.newLogo().raster())))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.fileName").value("scene.png"))
                .andExpect(jsonPath("$.replaced").value(true))
                .andExpect(jsonPath("$.format").value("png"))
                .andExpect(jsonPath("$.occurrences.length()").value(1))
                .andExpect(jsonPath("$.occurrences[0].x").value(200))
                .andExpect(jsonPath("$.occurrences[0].y").value(150))
                .andReturn();

        String encoded = JsonPath.read(result.getResponse().getContentAsString(), "$.image");
        RasterBuffer modified = RasterCodec.decode(Base64.getDecoder().decode(encoded));
        assertThat(modified.width()).isEqualTo(480);
        assertThat(modified.height()).isEqualTo(360);
    }

    @Test
    void replaceReportsNoMatchAsRegularResponse() throws Exception {
        mockMvc.perform(multipart("/api/v1/logos/replace")
                        .file(png("image", "plain.png", TestImages.noise(240, 180, 8L)))
                        .file(png("oldLogo", "old.png", TestImages.oldLogo().raster()))
                        .file(png("newLogo", "new.png", TestImages.newLogo().raster()))
                        .param("format", "jpeg"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.replaced").value(false))
                .andExpect(jsonPath("$.format").value("jpeg"))
                .andExpect(jsonPath("$.occurrences").isEmpty());
    }

    @Test
    void undecodableImageIsBadRequest() throws Exception {
        MockMultipartFile garbage = new MockMultipartFile("image", "broken.png", MediaType.IMAGE_PNG_VALUE,
                "not an image".getBytes(StandardCharsets.UTF_8));

        mockMvc.perform(multipart("/api/v1/logos/replace")
                        .file(garbage)
                        .file(png("oldLogo", "old.png", TestImages.oldLogo().raster()))
                        .file(png("newLogo", "new.png", TestImages.newLogo().raster())))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.status").value(400))
                .andExpect(jsonPath("$.path").value("/api/v1/logos/replace"));
    }

    @Test
    void unsupportedFormatIsBadRequest() throws Exception {
        mockMvc.perform(multipart("/api/v1/logos/replace")
                        .file(png("image", "scene.png", TestImages.noise(64, 64, 9L)))
                        .param("format", "gif"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void missingTemplatesAreServiceUnavailable() throws Exception {
        mockMvc.perform(multipart("/api/v1/logos/replace")
                        .file(png("image", "scene.png", TestImages.noise(64, 64, 10L))))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.message").value("Old logo template is not configured"));
    }

    @Test
    void templatesEndpointShowsUnconfiguredTemplates() throws Exception {
        mockMvc.perform(get("/api/v1/logos/templates"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.enabled").value(true))
                .andExpect(jsonPath("$.oldLogo").doesNotExist())
                .andExpect(jsonPath("$.newLogo").doesNotExist());
    }

    private static MockMultipartFile png(String part, String fileName, RasterBuffer raster) {
        return new MockMultipartFile(part, fileName, MediaType.IMAGE_PNG_VALUE, TestImages.png(raster));
    }
}
