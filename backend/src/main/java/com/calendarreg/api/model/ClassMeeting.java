package com.calendarreg.api.model;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import java.time.LocalTime;

/**
 * One weekly class slot of a section: day, time range, room and meeting type ("C" lecture, "L" lab).
 */
@Embeddable
public class ClassMeeting {

    @Column(name = "day_of_week", length = 32)
    private String day;

    @Column(name = "start_time")
    private LocalTime startTime;

    @Column(name = "end_time")
    private LocalTime endTime;

    @Column(length = 64)
    private String room;

    @Column(name = "meeting_type", length = 8)
    private String type;

    public ClassMeeting() {}

    public ClassMeeting(String day, LocalTime startTime, LocalTime endTime, String room, String type) {
        this.day = day;
        this.startTime = startTime;
        this.endTime = endTime;
        this.room = room;
        this.type = type;
    }

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
