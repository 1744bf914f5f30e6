package com.example.CourseRag.exception;

public class NoCourseMatchException extends CourseRagException {

    private final String courseName;

    public NoCourseMatchException(String courseName) {
        super("No course found matching '" + courseName + "'");
        this.courseName = courseName;
    }

    public String getCourseName() {
        return courseName;
    }
}
