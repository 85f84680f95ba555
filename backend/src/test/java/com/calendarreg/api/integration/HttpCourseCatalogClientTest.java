package com.calendarreg.api.integration;

import com.calendarreg.api.exception.CourseFetchException;
import com.calendarreg.api.model.Course;
import com.calendarreg.api.model.CourseSection;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.web.client.MockServerRestTemplateCustomizer;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;

import java.time.Duration;
import java.time.LocalDateTime;
import java.time.LocalTime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class HttpCourseCatalogClientTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(5);
    private static final String URL = "http://catalog.test/courses/CS101?acadyear=2568&semester=1";

    private MockServerRestTemplateCustomizer customizer;
    private HttpCourseCatalogClient client;

    @BeforeEach
    void setup() {
        customizer = new MockServerRestTemplateCustomizer();
        client = new HttpCourseCatalogClient(new RestTemplateBuilder(customizer), "http://catalog.test/");
    }

    // Templates are built lazily per timeout; building one binds it to the mock server.
    private MockRestServiceServer server() {
        client.restTemplate(TIMEOUT);
        return customizer.getServer();
    }

    @Test
    void mapsCatalogPayloadToCourse() throws Exception {
        MockRestServiceServer server = server();
        server.expect(requestTo(URL))
                .andExpect(method(HttpMethod.GET))
                .andRespond(withSuccess("""
                        {
                          "code": "CS101",
                          "name_en": "Computer Programming",
                          "name_th": "การเขียนโปรแกรมคอมพิวเตอร์",
                          "faculty": "Science",
                          "credits": "3 (2-2-5)",
                          "acadyear": 2568,
                          "semester": 1,
                          "sections": [
                            {
                              "number": "01",
                              "seats": 40,
                              "instructor": "A. Somchai",
                              "exam_date": "31 มี.ค. 2569 เวลา 13:00 - 16:00",
                              "midterm_date": "not announced",
                              "reserved_for": ["CS year 1"],
                              "schedules": [
                                {"day": "MO", "time": "09:00-12:00", "room": "SC-201", "type": "lecture"},
                                {"day": "TU", "time": "TBA", "room": "LAB-1", "type": "lab"}
                              ]
                            }
                          ]
                        }
                        """, MediaType.APPLICATION_JSON));

        Course course = client.fetchByCode("CS101", 2568, 1, TIMEOUT);

        assertThat(course.getId()).isNull();
        assertThat(course.getCode()).isEqualTo("CS101");
        assertThat(course.getNameEn()).isEqualTo("Computer Programming");
        assertThat(course.getCredits()).isEqualTo("3 (2-2-5)");
        assertThat(course.getSections()).hasSize(1);
        CourseSection section = course.getSections().get(0);
        assertThat(section.getCourse()).isSameAs(course);
        assertThat(section.getSeats()).isEqualTo(40);
        assertThat(section.getExamStart()).isEqualTo(LocalDateTime.of(2026, 3, 31, 13, 0));
        assertThat(section.getExamEnd()).isEqualTo(LocalDateTime.of(2026, 3, 31, 16, 0));
        assertThat(section.getMidtermStart()).isNull();
        assertThat(section.getReservedFor()).containsExactly("CS year 1");
        assertThat(section.getMeetings()).hasSize(2);
        assertThat(section.getMeetings().get(0).getStartTime()).isEqualTo(LocalTime.of(9, 0));
        assertThat(section.getMeetings().get(0).getEndTime()).isEqualTo(LocalTime.of(12, 0));
        assertThat(section.getMeetings().get(1).getStartTime()).isNull();
        assertThat(section.getMeetings().get(1).getRoom()).isEqualTo("LAB-1");
        server.verify();
    }

    @Test
    void notFoundBecomesFetchException() {
        MockRestServiceServer server = server();
        server.expect(requestTo(URL)).andRespond(withStatus(HttpStatus.NOT_FOUND));

        assertThatThrownBy(() -> client.fetchByCode("CS101", 2568, 1, TIMEOUT))
                .isInstanceOf(CourseFetchException.class)
                .hasMessageContaining("not found");
    }

    @Test
    void serverErrorBecomesFetchException() {
        MockRestServiceServer server = server();
        server.expect(requestTo(URL)).andRespond(withServerError());

        assertThatThrownBy(() -> client.fetchByCode("CS101", 2568, 1, TIMEOUT))
                .isInstanceOf(CourseFetchException.class)
                .hasMessageContaining("failed");
    }

    @Test
    void blankBaseUrlIsRejected() {
        assertThatThrownBy(() -> new HttpCourseCatalogClient(new RestTemplateBuilder(), " "))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
