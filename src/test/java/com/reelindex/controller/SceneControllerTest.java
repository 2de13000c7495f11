package com.reelindex.controller;

import com.reelindex.exception.NotFoundException;
import com.reelindex.service.LibraryQueryService;
import com.reelindex.service.ThumbnailService;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(controllers = SceneController.class)
@AutoConfigureMockMvc(addFilters = false)
class SceneControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private LibraryQueryService libraryQueryService;

    @MockitoBean
    private ThumbnailService thumbnailService;

    @TempDir
    Path posters;

    @Test
    void pageSizeIsCapped() throws Exception {
        when(libraryQueryService.listScenes(SceneController.MAX_PAGE, 0)).thenReturn(Map.of("total", 0));

        mockMvc.perform(get("/api/scenes").param("limit", "5000").param("offset", "-3"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.total").value(0));

        verify(libraryQueryService).listScenes(SceneController.MAX_PAGE, 0);
    }

    @Test
    void thumbnailFallsBackToPoster() throws Exception {
        Path poster = Files.write(posters.resolve("3_0000.webp"), new byte[]{1, 2, 3});
        when(libraryQueryService.posterPath(3L)).thenReturn(poster.toString());
        when(thumbnailService.thumbnailFor(poster)).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/scenes/3/thumbnail"))
                .andExpect(status().isOk())
                .andExpect(content().contentType("image/webp"))
                .andExpect(header().string("Cache-Control", "max-age=3600"))
                .andExpect(content().bytes(new byte[]{1, 2, 3}));
    }

    @Test
    void missingPosterFileIsNotFound() throws Exception {
        when(libraryQueryService.posterPath(4L)).thenReturn(posters.resolve("absent.jpg").toString());

        mockMvc.perform(get("/api/scenes/4/poster"))
                .andExpect(status().isNotFound());
    }

    @Test
    void sceneWithoutPosterIsNotFound() throws Exception {
        when(libraryQueryService.posterPath(5L)).thenThrow(new NotFoundException("Scene 5 has no poster"));

        mockMvc.perform(get("/api/scenes/5/poster"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.message").value("Scene 5 has no poster"));
    }

    @Test
    void imageTypeFollowsExtension() {
        assertThat(SceneController.imageType(Path.of("a.WEBP")).toString()).isEqualTo("image/webp");
        assertThat(SceneController.imageType(Path.of("a.png"))).isEqualTo(MediaType.IMAGE_PNG);
        assertThat(SceneController.imageType(Path.of("a.jpg"))).isEqualTo(MediaType.IMAGE_JPEG);
    }
}
