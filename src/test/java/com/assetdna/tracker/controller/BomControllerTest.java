package com.assetdna.tracker.controller;

import com.assetdna.tracker.exception.AssetNotFoundException;
import com.assetdna.tracker.exception.NonMonotonicSnapshotException;
import com.assetdna.tracker.model.BomItem;
import com.assetdna.tracker.model.BomSnapshot;
import com.assetdna.tracker.service.bom.SnapshotStore;
import com.assetdna.tracker.service.hierarchy.AssetHierarchyService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.http.converter.json.Jackson2ObjectMapperBuilder;
import org.springframework.http.converter.json.MappingJackson2HttpMessageConverter;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class BomControllerTest {

    private static final Instant MAY = Instant.parse("2024-05-01T00:00:00Z");

    @Mock
    private SnapshotStore snapshotStore;

    @Mock
    private AssetHierarchyService hierarchyService;

    @InjectMocks
    private BomController controller;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2024-06-01T00:00:00Z"), ZoneOffset.UTC);
        mockMvc = MockMvcBuilders.standaloneSetup(controller)
                .setControllerAdvice(new RestErrorHandler(clock))
                .setMessageConverters(new MappingJackson2HttpMessageConverter(Jackson2ObjectMapperBuilder.json().build()))
                .build();
    }

    @Test
    void appendRespondsCreatedWithStoredSnapshot() throws Exception {
        BomSnapshot stored = BomSnapshot.builder()
                .id("snap-1")
                .assetId("router-1")
                .timestamp(MAY)
                .sequence(1)
                .items(List.of(BomItem.builder().partId("cpu-x").quantity(2).build()))
                .build();
        when(snapshotStore.append(eq("router-1"), eq(MAY), anyList(), eq("erp"))).thenReturn("snap-1");
        when(snapshotStore.get("snap-1")).thenReturn(stored);

        mockMvc.perform(post("/api/assets/router-1/bom")
                        .contentType(MediaType.APPLICATION_JSON)
                        .accept(MediaType.APPLICATION_JSON)
                        .content("""
                                {"timestamp": "2024-05-01T00:00:00Z", "source": "erp",
                                 "items": [{"partId": "cpu-x", "quantity": 2}]}
                                """))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.id").value("snap-1"))
                .andExpect(jsonPath("$.items[0].partId").value("cpu-x"))
                .andExpect(jsonPath("$.items[0].quantity").value(2));
    }

    @Test
    void outOfOrderAppendIsAConflict() throws Exception {
        when(snapshotStore.append(eq("router-1"), any(), anyList(), any()))
                .thenThrow(new NonMonotonicSnapshotException("Snapshot timestamp is not after the latest snapshot"));

        mockMvc.perform(post("/api/assets/router-1/bom")
                        .contentType(MediaType.APPLICATION_JSON)
                        .accept(MediaType.APPLICATION_JSON)
                        .content("{\"timestamp\": \"2023-01-01T00:00:00Z\", \"items\": []}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("NON_MONOTONIC_SNAPSHOT"))
                .andExpect(jsonPath("$.path").value("/api/assets/router-1/bom"));
    }

    @Test
    void missingTimestampFailsValidation() throws Exception {
        mockMvc.perform(post("/api/assets/router-1/bom")
                        .contentType(MediaType.APPLICATION_JSON)
                        .accept(MediaType.APPLICATION_JSON)
                        .content("{\"items\": []}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_FAILED"))
                .andExpect(jsonPath("$.details[0]").value("timestamp: timestamp is required"));

        verifyNoInteractions(snapshotStore);
    }

    @Test
    void latestOfAssetWithoutSnapshotsIsNotFound() throws Exception {
        when(snapshotStore.latest("router-1")).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/assets/router-1/bom/latest").accept(MediaType.APPLICATION_JSON))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("NOT_FOUND"));
    }

    @Test
    void historyOfUnknownAssetIsNotFound() throws Exception {
        when(snapshotStore.history("ghost")).thenThrow(AssetNotFoundException.forId("ghost"));

        mockMvc.perform(get("/api/assets/ghost/bom/history").accept(MediaType.APPLICATION_JSON))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.message").value("Asset not found with id: ghost"))
                .andExpect(jsonPath("$.timestamp").value("2024-06-01T00:00:00Z"));
    }
}
