package com.calendarreg.api.repository;

import com.calendarreg.api.model.CronJob;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

public interface CronJobRepository extends JpaRepository<CronJob, Long> {

    List<CronJob> findByDeletedAtIsNullOrderByIdAsc();

    Optional<CronJob> findByIdAndDeletedAtIsNull(Long id);

    List<CronJob> findByEnabledTrueAndDeletedAtIsNull();
}
