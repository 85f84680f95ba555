package com.calendarreg.api.model;

import jakarta.persistence.*;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

@Entity
@Table(name = "course_sections")
public class CourseSection {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(optional = false, fetch = FetchType.LAZY)
    @JoinColumn(name = "course_id", nullable = false, foreignKey = @ForeignKey(name = "fk_section_course"))
    private Course course;

    @Column(name = "section_number", length = 16)
    private String number; // e.g., "01"

    private int seats;

    private String instructor;

    @Column(name = "exam_start")
    private LocalDateTime examStart;

    @Column(name = "exam_end")
    private LocalDateTime examEnd;

    @Column(name = "midterm_start")
    private LocalDateTime midtermStart;

    @Column(name = "midterm_end")
    private LocalDateTime midtermEnd;

    @Column(length = 1000)
    private String note;

    private String campus;

    private String program;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "course_section_reserved", joinColumns = @JoinColumn(name = "section_id"))
    @OrderColumn(name = "position")
    @Column(name = "reserved_for")
    private List<String> reservedFor = new ArrayList<>();

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "course_section_meetings", joinColumns = @JoinColumn(name = "section_id"))
    @OrderColumn(name = "position")
    private List<ClassMeeting> meetings = new ArrayList<>();

    public CourseSection() {}

    public CourseSection(String number, int seats, String instructor) {
        this.number = number;
        this.seats = seats;
        this.instructor = instructor;
    }

    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }

    public Course getCourse() { return course; }
    public void setCourse(Course course) { this.course = course; }

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
    public void setReservedFor(List<String> reservedFor) {
        this.reservedFor = reservedFor != null ? new ArrayList<>(reservedFor) : new ArrayList<>();
    }

    public List<ClassMeeting> getMeetings() { return meetings; }
    public void setMeetings(List<ClassMeeting> meetings) {
        this.meetings = meetings != null ? new ArrayList<>(meetings) : new ArrayList<>();
    }
}
