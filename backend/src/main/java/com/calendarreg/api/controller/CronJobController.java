package com.calendarreg.api.controller;

import com.calendarreg.api.dto.CronJobRequest;
import com.calendarreg.api.dto.CronJobResponse;
import com.calendarreg.api.service.CronJobService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/api/v1/cronjobs")
@CrossOrigin(origins = "*")
public class CronJobController {

    private final CronJobService cronJobService;

    public CronJobController(CronJobService cronJobService) {
        this.cronJobService = cronJobService;
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public CronJobResponse create(@Valid @RequestBody CronJobRequest request) {
        return CronJobResponse.from(cronJobService.create(request.toEntity()));
    }

    @GetMapping
    public List<CronJobResponse> list() {
        return cronJobService.list().stream().map(CronJobResponse::from).collect(Collectors.toList());
    }

    @GetMapping("/{id}")
    public CronJobResponse get(@PathVariable Long id) {
        return CronJobResponse.from(cronJobService.get(id));
    }

    @PutMapping("/{id}")
    public CronJobResponse update(@PathVariable Long id, @Valid @RequestBody CronJobRequest request) {
        return CronJobResponse.from(cronJobService.update(id, request.toEntity()));
    }

    @DeleteMapping("/{id}")
    public Map<String, String> delete(@PathVariable Long id) {
        cronJobService.delete(id);
        return Map.of("message", "cron job " + id + " deleted");
    }

    @PostMapping("/{id}/trigger")
    @ResponseStatus(HttpStatus.ACCEPTED)
    public Map<String, String> trigger(@PathVariable Long id) {
        cronJobService.trigger(id);
        return Map.of("message", "cron job " + id + " triggered");
    }
}
