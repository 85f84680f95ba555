package com.calendarreg.api.config;

import com.calendarreg.api.integration.CourseCatalogClient;
import com.calendarreg.api.integration.HttpCourseCatalogClient;
import com.calendarreg.api.queue.RefreshQueue;
import com.calendarreg.api.scheduler.CourseRefreshScheduler;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class RefreshConfig {

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    // Workers are started by RefreshLifecycle once the handler is wired.
    @Bean
    public RefreshQueue refreshQueue(RefreshSettings settings, Clock clock) {
        return new RefreshQueue(settings.getQueueCapacity(), settings.getWorkers(), clock);
    }

    @Bean
    public CourseRefreshScheduler courseRefreshScheduler(RefreshQueue refreshQueue, RefreshSettings settings) {
        return new CourseRefreshScheduler(refreshQueue, settings.getSchedulerZone());
    }

    // No base url: no client, CourseService serves cached data only.
    @Bean
    @ConditionalOnExpression("!'${calendarreg.catalog.base-url:}'.isBlank()")
    public CourseCatalogClient courseCatalogClient(RestTemplateBuilder builder,
                                                   @Value("${calendarreg.catalog.base-url}") String baseUrl) {
        return new HttpCourseCatalogClient(builder, baseUrl);
    }
}
