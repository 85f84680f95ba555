package com.calendarreg.api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CalendarRegApplication {
    public static void main(String[] args) {
        SpringApplication.run(CalendarRegApplication.class, args);
    }
}
