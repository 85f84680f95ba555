package com.calendarreg.api.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Entity
@Table(name = "courses", indexes = {
        @Index(name = "idx_courses_key", columnList = "code, acadyear, semester"),
        @Index(name = "idx_courses_deleted_at", columnList = "deleted_at")
})
public class Course {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 32)
    private String code; // e.g., "CP353004"

    @Column(name = "name_en")
    private String nameEn;

    @Column(name = "name_th")
    private String nameTh;

    private String faculty;

    private String department;

    @Column(length = 64)
    private String credits; // e.g., "3 (2-2-5)"

    @Column(length = 512)
    private String prerequisite;

    @Column(nullable = false)
    private int acadyear; // Buddhist-era year, e.g., 2568

    @Column(nullable = false)
    private int semester;

    private String program;

    @OneToMany(mappedBy = "course", cascade = CascadeType.ALL, orphanRemoval = true, fetch = FetchType.EAGER)
    @OrderColumn(name = "position")
    private List<CourseSection> sections = new ArrayList<>();

    @Column(name = "created_at")
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @Column(name = "deleted_at")
    private Instant deletedAt;

    public Course() {}

    public Course(String code, int acadyear, int semester) {
        this.code = code;
        this.acadyear = acadyear;
        this.semester = semester;
    }

    public void addSection(CourseSection section) {
        section.setCourse(this);
        sections.add(section);
    }

    public boolean isDeleted() { return deletedAt != null; }

    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }

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

    public List<CourseSection> getSections() { return sections; }
    public void setSections(List<CourseSection> sections) {
        this.sections.clear();
        if (sections != null) {
            sections.forEach(this::addSection);
        }
    }

    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }

    public Instant getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(Instant updatedAt) { this.updatedAt = updatedAt; }

    public Instant getDeletedAt() { return deletedAt; }
    public void setDeletedAt(Instant deletedAt) { this.deletedAt = deletedAt; }
}
