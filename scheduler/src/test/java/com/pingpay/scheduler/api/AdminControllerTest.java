package com.pingpay.scheduler.api;

import com.pingpay.scheduler.service.QueueReconciler;
import com.pingpay.scheduler.service.ReconcileReport;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(AdminController.class)
class AdminControllerTest {

    @Autowired MockMvc           mockMvc;
    @MockitoBean QueueReconciler reconciler;

    @Test
    void reconcile_returnsCounts() throws Exception {
        when(reconciler.reconcileAll()).thenReturn(new ReconcileReport(2, 1, 5, 0, 3));

        mockMvc.perform(post("/admin/reconcile"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.armed").value(2))
                .andExpect(jsonPath("$.parked").value(1))
                .andExpect(jsonPath("$.unchanged").value(5))
                .andExpect(jsonPath("$.orphans").value(3));
    }
}
