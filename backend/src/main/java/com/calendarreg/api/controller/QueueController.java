package com.calendarreg.api.controller;

import com.calendarreg.api.queue.QueueStatus;
import com.calendarreg.api.queue.RefreshQueue;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/queue")
@CrossOrigin(origins = "*")
public class QueueController {

    private final RefreshQueue refreshQueue;

    public QueueController(RefreshQueue refreshQueue) {
        this.refreshQueue = refreshQueue;
    }

    @GetMapping("/status")
    public QueueStatus status() {
        return refreshQueue.status();
    }
}
