package com.reelindex.controller;

import com.reelindex.dto.SceneQuery;
import com.reelindex.dto.SceneResult;
import com.reelindex.exception.NotFoundException;
import com.reelindex.service.SceneSearchService;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(controllers = SearchController.class)
@AutoConfigureMockMvc(addFilters = false)
class SearchControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private SceneSearchService searchService;

    @Test
    void mapsQueryParametersOntoSceneQuery() throws Exception {
        when(searchService.search(any(SceneQuery.class))).thenReturn(List.of(new SceneResult(), new SceneResult()));

        mockMvc.perform(get("/api/search")
                        .param("q", "red car at night")
                        .param("face", "12")
                        .param("face_threshold", "0.4")
                        .param("path", "B-roll")
                        .param("width_min", "1920")
                        .param("limit", "20"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.count").value(2))
                .andExpect(jsonPath("$.results.length()").value(2));

        ArgumentCaptor<SceneQuery> captor = ArgumentCaptor.forClass(SceneQuery.class);
        verify(searchService).search(captor.capture());
        SceneQuery query = captor.getValue();
        assertThat(query.getVisualText()).isEqualTo("red car at night");
        assertThat(query.getFaceId()).isEqualTo(12L);
        assertThat(query.getFaceThreshold()).isEqualTo(0.4);
        assertThat(query.getPathContains()).isEqualTo("B-roll");
        assertThat(query.getWidthMin()).isEqualTo(1920);
        assertThat(query.getLimit()).isEqualTo(20);
        assertThat(query.getMatchSceneId()).isNull();
    }

    @Test
    void malformedNumberIsBadRequest() throws Exception {
        mockMvc.perform(get("/api/search").param("tc_min", "soon"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void unknownReferenceSceneIsNotFound() throws Exception {
        when(searchService.search(any(SceneQuery.class))).thenThrow(NotFoundException.of("Scene", 5));

        mockMvc.perform(get("/api/search").param("match_scene", "5"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.message").value("Scene not found: 5"));
    }
}
