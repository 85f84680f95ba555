package com.calendarreg.api.repository;

import com.calendarreg.api.model.Course;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

public interface CourseRepository extends JpaRepository<Course, Long> {

    // Composite key lookup, ignoring soft-deleted rows
    Optional<Course> findFirstByCodeAndAcadyearAndSemesterAndDeletedAtIsNullOrderByIdDesc(String code, int acadyear, int semester);

    Page<Course> findByDeletedAtIsNullOrderByCodeAscAcadyearDescSemesterDesc(Pageable pageable);

    List<Course> findByDeletedAtIsNullOrderByCodeAscAcadyearDescSemesterDesc();

    long countByDeletedAtIsNull();

    default Optional<Course> findActive(String code, int acadyear, int semester) {
        return findFirstByCodeAndAcadyearAndSemesterAndDeletedAtIsNullOrderByIdDesc(code, acadyear, semester);
    }
}
