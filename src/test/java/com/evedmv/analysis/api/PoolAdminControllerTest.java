package com.evedmv.analysis.api;

import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.evedmv.analysis.pool.AnalysisWorkerPool;
import com.evedmv.analysis.pool.InvalidPoolSizeException;
import com.evedmv.analysis.pool.PoolStats;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@ExtendWith(MockitoExtension.class)
class PoolAdminControllerTest {

  @Mock private AnalysisWorkerPool pool;

  private MockMvc mockMvc;

  @BeforeEach
  void setUp() {
    mockMvc =
        MockMvcBuilders.standaloneSetup(new PoolAdminController(pool))
            .setControllerAdvice(new PoolExceptionHandler())
            .build();
  }

  @Test
  void stats_shouldReturnPoolSnapshot() throws Exception {
    when(pool.stats()).thenReturn(new PoolStats(3, 3, 1, 2, 4, 57, 2.0 / 3));

    mockMvc
        .perform(get("/pool/stats"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.poolSize").value(3))
        .andExpect(jsonPath("$.busy").value(2))
        .andExpect(jsonPath("$.queueLength").value(4))
        .andExpect(jsonPath("$.totalProcessed").value(57));
  }

  @Test
  void scale_shouldResizePool() throws Exception {
    when(pool.scaleTo(5)).thenReturn(new PoolStats(5, 5, 5, 0, 0, 0, 0.0));

    mockMvc
        .perform(
            put("/pool/size").contentType(MediaType.APPLICATION_JSON).content("{\"size\":5}"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.targetSize").value(5));

    verify(pool).scaleTo(5);
  }

  @Test
  void scale_shouldMapInvalidSizeToBadRequest() throws Exception {
    when(pool.scaleTo(10)).thenThrow(new InvalidPoolSizeException(10, 1, 8));

    mockMvc
        .perform(
            put("/pool/size").contentType(MediaType.APPLICATION_JSON).content("{\"size\":10}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.error").value("invalid_size"));
  }

  @Test
  void clearQueue_shouldReturnDroppedCount() throws Exception {
    when(pool.clearQueue()).thenReturn(7);

    mockMvc
        .perform(delete("/pool/queue"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.dropped").value(7));
  }
}
