package com.devseo.audit.api;

import com.devseo.audit.pipeline.AuditWorkerPool;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/worker")
public class WorkerController {
    private final AuditWorkerPool workerPool;

    public WorkerController(AuditWorkerPool workerPool) {
        this.workerPool = workerPool;
    }

    @PostMapping("/start")
    public AuditWorkerPool.WorkerStatus start() {
        workerPool.start();
        return workerPool.status();
    }

    @PostMapping("/stop")
    public AuditWorkerPool.WorkerStatus stop() {
        workerPool.stop();
        return workerPool.status();
    }

    @GetMapping("/status")
    public AuditWorkerPool.WorkerStatus status() {
        return workerPool.status();
    }
}
