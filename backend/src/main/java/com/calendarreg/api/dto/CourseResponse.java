package com.calendarreg.api.dto;

import com.calendarreg.api.model.ClassMeeting;
import com.calendarreg.api.model.Course;
import com.calendarreg.api.model.CourseSection;

import java.time.temporal.Temporal;
import java.util.List;
import java.util.stream.Collectors;

public class CourseResponse {
    private Long id;
    private String code;
    private String nameEn;
    private String nameTh;
    private String faculty;
    private String department;
    private String credits;
    private String prerequisite;
    private int acadyear;
    private int semester;
    private String program;
    private List<SectionDTO> sections;
    // ISO-8601 strings
    private String createdAt;
    private String updatedAt;

    public static CourseResponse from(Course c) {
        CourseResponse dto = new CourseResponse();
        dto.id = c.getId();
        dto.code = c.getCode();
        dto.nameEn = c.getNameEn();
        dto.nameTh = c.getNameTh();
        dto.faculty = c.getFaculty();
        dto.department = c.getDepartment();
        dto.credits = c.getCredits();
        dto.prerequisite = c.getPrerequisite();
        dto.acadyear = c.getAcadyear();
        dto.semester = c.getSemester();
        dto.program = c.getProgram();
        dto.sections = c.getSections().stream().map(SectionDTO::from).collect(Collectors.toList());
        dto.createdAt = iso(c.getCreatedAt());
        dto.updatedAt = iso(c.getUpdatedAt());
        return dto;
    }

    static String iso(Temporal t) {
        return t != null ? t.toString() : null;
    }

    public static class SectionDTO {
        private String number;
        private int seats;
        private String instructor;
        private String examStart;
        private String examEnd;
        private String midtermStart;
        private String midtermEnd;
        private String note;
        private String campus;
        private String program;
        private List<String> reservedFor;
        private List<MeetingDTO> meetings;

        static SectionDTO from(CourseSection s) {
            SectionDTO dto = new SectionDTO();
            dto.number = s.getNumber();
            dto.seats = s.getSeats();
            dto.instructor = s.getInstructor();
            dto.examStart = iso(s.getExamStart());
            dto.examEnd = iso(s.getExamEnd());
            dto.midtermStart = iso(s.getMidtermStart());
            dto.midtermEnd = iso(s.getMidtermEnd());
            dto.note = s.getNote();
            dto.campus = s.getCampus();
            dto.program = s.getProgram();
            dto.reservedFor = List.copyOf(s.getReservedFor());
            dto.meetings = s.getMeetings().stream().map(MeetingDTO::from).collect(Collectors.toList());
            return dto;
        }

        public String getNumber() { return number; }
        public int getSeats() { return seats; }
        public String getInstructor() { return instructor; }
        public String getExamStart() { return examStart; }
        public String getExamEnd() { return examEnd; }
        public String getMidtermStart() { return midtermStart; }
        public String getMidtermEnd() { return midtermEnd; }
        public String getNote() { return note; }
        public String getCampus() { return campus; }
        public String getProgram() { return program; }
        public List<String> getReservedFor() { return reservedFor; }
        public List<MeetingDTO> getMeetings() { return meetings; }
    }

    public static class MeetingDTO {
        private String day;
        private String startTime; // HH:mm
        private String endTime;
        private String room;
        private String type;

        static MeetingDTO from(ClassMeeting m) {
            MeetingDTO dto = new MeetingDTO();
            dto.day = m.getDay();
            dto.startTime = iso(m.getStartTime());
            dto.endTime = iso(m.getEndTime());
            dto.room = m.getRoom();
            dto.type = m.getType();
            return dto;
        }

        public String getDay() { return day; }
        public String getStartTime() { return startTime; }
        public String getEndTime() { return endTime; }
        public String getRoom() { return room; }
        public String getType() { return type; }
    }

    public Long getId() { return id; }
    public String getCode() { return code; }
    public String getNameEn() { return nameEn; }
    public String getNameTh() { return nameTh; }
    public String getFaculty() { return faculty; }
    public String getDepartment() { return department; }
    public String getCredits() { return credits; }
    public String getPrerequisite() { return prerequisite; }
    public int getAcadyear() { return acadyear; }
    public int getSemester() { return semester; }
    public String getProgram() { return program; }
    public List<SectionDTO> getSections() { return sections; }
    public String getCreatedAt() { return createdAt; }
    public String getUpdatedAt() { return updatedAt; }
}
