package com.calendarreg.api.controller;

import com.calendarreg.api.dto.CourseRequest;
import com.calendarreg.api.dto.CourseResponse;
import com.calendarreg.api.dto.CourseSummaryDTO;
import com.calendarreg.api.model.Course;
import com.calendarreg.api.service.CourseLookup;
import com.calendarreg.api.service.CourseService;
import com.calendarreg.api.service.PagedResult;
import jakarta.validation.Valid;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.Map;

@RestController
@RequestMapping("/api/v1/courses")
@CrossOrigin(origins = "*")
public class CourseController {

    static final String RETRY_AFTER_SECONDS = "3";

    private final CourseService courseService;

    public CourseController(CourseService courseService) {
        this.courseService = courseService;
    }

    @GetMapping
    public PagedResult<CourseSummaryDTO> list(@RequestParam(value = "page", required = false, defaultValue = "1") int page,
                                              @RequestParam(value = "limit", required = false, defaultValue = "10") int limit) {
        return courseService.listCourses(page, limit).map(CourseSummaryDTO::from);
    }

    /**
     * 200 with the course, 404 when the catalog does not know it, 202 while the first fetch is still
     * running (clients retry after {@code Retry-After} seconds).
     */
    @GetMapping("/{code}")
    public ResponseEntity<?> get(@PathVariable String code,
                                 @RequestParam("acadyear") int acadyear,
                                 @RequestParam("semester") int semester) {
        CourseLookup lookup = courseService.getCourse(code, acadyear, semester);
        switch (lookup.status()) {
            case FOUND:
                return ResponseEntity.ok(CourseResponse.from(lookup.course()));
            case PENDING:
                return ResponseEntity.status(HttpStatus.ACCEPTED)
                        .header(HttpHeaders.RETRY_AFTER, RETRY_AFTER_SECONDS)
                        .body(Map.of("status", "PENDING",
                                "message", "course " + code + " is being fetched, retry shortly"));
            default:
                throw new ResponseStatusException(HttpStatus.NOT_FOUND,
                        "course " + code + " not found for " + acadyear + "/" + semester);
        }
    }

    @PostMapping
    public ResponseEntity<CourseResponse> create(@Valid @RequestBody CourseRequest request) {
        Course saved = courseService.createCourse(request.toEntity());
        return ResponseEntity.status(HttpStatus.CREATED).body(CourseResponse.from(saved));
    }

    @DeleteMapping("/{code}")
    public Map<String, String> delete(@PathVariable String code,
                                      @RequestParam("acadyear") int acadyear,
                                      @RequestParam("semester") int semester) {
        courseService.deleteCourse(code, acadyear, semester);
        return Map.of("message", "course " + code + " deleted");
    }
}
