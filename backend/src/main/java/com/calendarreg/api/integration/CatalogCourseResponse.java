package com.calendarreg.api.integration;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/** Wire shape of {@code GET /courses/{code}} on the registrar catalog. */
@JsonIgnoreProperties(ignoreUnknown = true)
public class CatalogCourseResponse {
    public String code;
    @JsonProperty("name_en")
    public String nameEn;
    @JsonProperty("name_th")
    public String nameTh;
    public String faculty;
    public String department;
    public String credits;
    public String prerequisite;
    public int acadyear;
    public int semester;
    public String program;
    public List<Section> sections = new ArrayList<>();

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Section {
        public String number;
        public int seats;
        public String instructor;
        @JsonProperty("exam_date")
        public String examDate; // "31 มี.ค. 2569 เวลา 13:00 - 16:00"
        @JsonProperty("midterm_date")
        public String midtermDate;
        public String note;
        public String campus;
        public String program;
        @JsonProperty("reserved_for")
        public List<String> reservedFor = new ArrayList<>();
        public List<Schedule> schedules = new ArrayList<>();
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Schedule {
        public String day;
        public String time; // "HH:mm-HH:mm"
        public String room;
        public String type;
    }
}
