package com.pingpay.scheduler.api;

import com.pingpay.scheduler.service.QueueReconciler;
import com.pingpay.scheduler.service.ReconcileReport;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * POST /admin/reconcile - rebuild both queue lanes from the jobs table.
 */
@RestController
@RequestMapping("/admin")
public class AdminController {

    private final QueueReconciler reconciler;

    public AdminController(QueueReconciler reconciler) {
        this.reconciler = reconciler;
    }

    @PostMapping("/reconcile")
    public ReconcileReport reconcile() {
        return reconciler.reconcileAll();
    }
}
