package com.calendarreg.api.integration;

import com.calendarreg.api.exception.CourseFetchException;
import com.calendarreg.api.model.ClassMeeting;
import com.calendarreg.api.model.Course;
import com.calendarreg.api.model.CourseSection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;
import java.time.LocalTime;
import java.time.format.DateTimeParseException;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registrar catalog over HTTP/JSON. The read timeout of each call equals the requested fetch
 * timeout; one {@link RestTemplate} is kept per distinct timeout.
 */
public class HttpCourseCatalogClient implements CourseCatalogClient {

    private static final Logger log = LoggerFactory.getLogger(HttpCourseCatalogClient.class);

    private final RestTemplateBuilder builder;
    private final String baseUrl;
    private final Map<Duration, RestTemplate> templates = new ConcurrentHashMap<>();

    public HttpCourseCatalogClient(RestTemplateBuilder builder, String baseUrl) {
        if (baseUrl == null || baseUrl.isBlank()) throw new IllegalArgumentException("catalog base url is required");
        this.builder = builder;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
    }

    @Override
    public Course fetchByCode(String code, int acadyear, int semester, Duration timeout) throws CourseFetchException {
        RestTemplate rest = restTemplate(timeout);
        CatalogCourseResponse body;
        try {
            body = rest.getForObject("/courses/{code}?acadyear={acadyear}&semester={semester}",
                    CatalogCourseResponse.class, code, acadyear, semester);
        } catch (HttpClientErrorException.NotFound e) {
            throw new CourseFetchException("course " + code + " not found in catalog for " + acadyear + "/" + semester);
        } catch (RestClientException e) {
            throw new CourseFetchException("catalog request for " + code + " failed: " + e.getMessage(), e);
        }
        if (body == null) {
            throw new CourseFetchException("catalog returned an empty body for " + code);
        }
        Course course = toCourse(body);
        course.setCode(code);
        log.debug("[Catalog] fetched {} with {} section(s)", code, course.getSections().size());
        return course;
    }

    RestTemplate restTemplate(Duration timeout) {
        return templates.computeIfAbsent(timeout, t -> builder
                .rootUri(baseUrl)
                .setConnectTimeout(t)
                .setReadTimeout(t)
                .build());
    }

    static Course toCourse(CatalogCourseResponse r) {
        Course course = new Course(r.code, r.acadyear, r.semester);
        course.setNameEn(r.nameEn);
        course.setNameTh(r.nameTh);
        course.setFaculty(r.faculty);
        course.setDepartment(r.department);
        course.setCredits(r.credits);
        course.setPrerequisite(r.prerequisite);
        course.setProgram(r.program);
        if (r.sections != null) {
            for (CatalogCourseResponse.Section s : r.sections) {
                course.addSection(toSection(s));
            }
        }
        return course;
    }

    private static CourseSection toSection(CatalogCourseResponse.Section s) {
        CourseSection section = new CourseSection(s.number, s.seats, s.instructor);
        section.setNote(s.note);
        section.setCampus(s.campus);
        section.setProgram(s.program);
        section.setReservedFor(s.reservedFor);
        if (s.examDate != null && !s.examDate.isBlank()) {
            try {
                ThaiExamDateParser.ExamPeriod exam = ThaiExamDateParser.parse(s.examDate);
                section.setExamStart(exam.start());
                section.setExamEnd(exam.end());
            } catch (IllegalArgumentException e) {
                log.warn("[Catalog] section {}: cannot parse exam date '{}': {}", s.number, s.examDate, e.getMessage());
            }
        }
        if (s.midtermDate != null && !s.midtermDate.isBlank()) {
            try {
                ThaiExamDateParser.ExamPeriod midterm = ThaiExamDateParser.parse(s.midtermDate);
                section.setMidtermStart(midterm.start());
                section.setMidtermEnd(midterm.end());
            } catch (IllegalArgumentException e) {
                log.warn("[Catalog] section {}: cannot parse midterm date '{}': {}", s.number, s.midtermDate, e.getMessage());
            }
        }
        if (s.schedules != null) {
            for (CatalogCourseResponse.Schedule sc : s.schedules) {
                section.getMeetings().add(toMeeting(s.number, sc));
            }
        }
        return section;
    }

    private static ClassMeeting toMeeting(String sectionNumber, CatalogCourseResponse.Schedule sc) {
        LocalTime start = null;
        LocalTime end = null;
        if (sc.time != null) {
            String[] parts = sc.time.split("-");
            if (parts.length == 2) {
                try {
                    start = LocalTime.parse(parts[0].trim());
                    end = LocalTime.parse(parts[1].trim());
                } catch (DateTimeParseException e) {
                    start = null;
                    log.warn("[Catalog] section {}: cannot parse class time '{}'", sectionNumber, sc.time);
                }
            } else if (!sc.time.isBlank()) {
                log.warn("[Catalog] section {}: unexpected class time '{}'", sectionNumber, sc.time);
            }
        }
        return new ClassMeeting(sc.day, start, end, sc.room, sc.type);
    }
}
