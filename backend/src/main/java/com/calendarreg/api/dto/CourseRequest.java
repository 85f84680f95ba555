package com.calendarreg.api.dto;

import com.calendarreg.api.model.ClassMeeting;
import com.calendarreg.api.model.Course;
import com.calendarreg.api.model.CourseSection;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;

import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.List;

public class CourseRequest {
    @NotBlank(message = "code is required")
    private String code;
    @NotBlank(message = "nameEn is required")
    private String nameEn;
    private String nameTh;
    private String faculty;
    private String department;
    @NotBlank(message = "credits is required")
    private String credits;
    private String prerequisite;
    private int acadyear;
    private int semester;
    private String program;
    @Valid
    private List<SectionRequest> sections = new ArrayList<>();

    public Course toEntity() {
        Course c = new Course(code, acadyear, semester);
        c.setNameEn(nameEn);
        c.setNameTh(nameTh);
        c.setFaculty(faculty);
        c.setDepartment(department);
        c.setCredits(credits);
        c.setPrerequisite(prerequisite);
        c.setProgram(program);
        if (sections != null) {
            for (SectionRequest s : sections) {
                c.addSection(s.toEntity());
            }
        }
        return c;
    }

    public static class SectionRequest {
        @NotBlank(message = "section number is required")
        private String number;
        private int seats;
        private String instructor;
        private LocalDateTime examStart;
        private LocalDateTime examEnd;
        private LocalDateTime midtermStart;
        private LocalDateTime midtermEnd;
        private String note;
        private String campus;
        private String program;
        private List<String> reservedFor = new ArrayList<>();
        private List<MeetingRequest> meetings = new ArrayList<>();

        CourseSection toEntity() {
            CourseSection s = new CourseSection(number, seats, instructor);
            s.setExamStart(examStart);
            s.setExamEnd(examEnd);
            s.setMidtermStart(midtermStart);
            s.setMidtermEnd(midtermEnd);
            s.setNote(note);
            s.setCampus(campus);
            s.setProgram(program);
            s.setReservedFor(reservedFor);
            if (meetings != null) {
                for (MeetingRequest m : meetings) {
                    s.getMeetings().add(new ClassMeeting(m.day, m.startTime, m.endTime, m.room, m.type));
                }
            }
            return s;
        }

        public String getNumber() { return number; }
        public void setNumber(String number) { this.number = number; }
        public int getSeats() { return seats; }
        public void setSeats(int seats) { this.seats = seats; }
        public String getInstructor() { return instructor; }
        public void setInstructor(String instructor) { this.instructor = instructor; }
        public LocalDateTime getExamStart() { return examStart; }
        public void setExamStart(LocalDateTime examStart) { this.examStart = examStart; }
        public LocalDateTime getExamEnd() { return examEnd; }
        public void setExamEnd(LocalDateTime examEnd) { this.examEnd = examEnd; }
        public LocalDateTime getMidtermStart() { return midtermStart; }
        public void setMidtermStart(LocalDateTime midtermStart) { this.midtermStart = midtermStart; }
        public LocalDateTime getMidtermEnd() { return midtermEnd; }
        public void setMidtermEnd(LocalDateTime midtermEnd) { this.midtermEnd = midtermEnd; }
        public String getNote() { return note; }
        public void setNote(String note) { this.note = note; }
        public String getCampus() { return campus; }
        public void setCampus(String campus) { this.campus = campus; }
        public String getProgram() { return program; }
        public void setProgram(String program) { this.program = program; }
        public List<String> getReservedFor() { return reservedFor; }
        public void setReservedFor(List<String> reservedFor) { this.reservedFor = reservedFor; }
        public List<MeetingRequest> getMeetings() { return meetings; }
        public void setMeetings(List<MeetingRequest> meetings) { this.meetings = meetings; }
    }

    public static class MeetingRequest {
        private String day;
        private LocalTime startTime;
        private LocalTime endTime;
        private String room;
        private String type;

        public String getDay() { return day; }
        public void setDay(String day) { this.day = day; }
        public LocalTime getStartTime() { return startTime; }
        public void setStartTime(LocalTime startTime) { this.startTime = startTime; }
        public LocalTime getEndTime() { return endTime; }
        public void setEndTime(LocalTime endTime) { this.endTime = endTime; }
        public String getRoom() { return room; }
        public void setRoom(String room) { this.room = room; }
        public String getType() { return type; }
        public void setType(String type) { this.type = type; }
    }

    public String getCode() { return code; }
    public void setCode(String code) { this.code = code; }
    public String getNameEn() { return nameEn; }
    public void setNameEn(String nameEn) { this.nameEn = nameEn; }
    public String getNameTh() { return nameTh; }
    public void setNameTh(String nameTh) { this.nameTh = nameTh; }
    public String getFaculty() { return faculty; }
    public void setFaculty(String faculty) { this.faculty = faculty; }
    public String getDepartment() { return department; }
    public void setDepartment(String department) { this.department = department; }
    public String getCredits() { return credits; }
    public void setCredits(String credits) { this.credits = credits; }
    public String getPrerequisite() { return prerequisite; }
    public void setPrerequisite(String prerequisite) { this.prerequisite = prerequisite; }
    public int getAcadyear() { return acadyear; }
    public void setAcadyear(int acadyear) { this.acadyear = acadyear; }
    public int getSemester() { return semester; }
    public void setSemester(int semester) { this.semester = semester; }
    public String getProgram() { return program; }
    public void setProgram(String program) { this.program = program; }
    public List<SectionRequest> getSections() { return sections; }
    public void setSections(List<SectionRequest> sections) { this.sections = sections; }
}
