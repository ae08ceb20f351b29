package com.learnguard.core.escalation;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Student to teacher assignments, optionally per course. A course-scoped assignment
 * wins over the student-wide one; the first teacher listed is the one notified.
 */
@Component
@Slf4j
public class TeacherDirectory {

    private final Map<String, List<String>> assignments = new ConcurrentHashMap<>();

    public void assign(String studentId, String courseId, String teacherId) {
        List<String> teachers = assignments.computeIfAbsent(key(studentId, courseId), k -> new CopyOnWriteArrayList<>());
        if (!teachers.contains(teacherId)) {
            teachers.add(teacherId);
        }
        log.info("[ESCALATION] Teacher assigned | studentId={} | courseId={} | teacherId={}", studentId, courseId, teacherId);
    }

    public boolean remove(String studentId, String courseId, String teacherId) {
        List<String> teachers = assignments.get(key(studentId, courseId));
        boolean removed = teachers != null && teachers.remove(teacherId);
        if (removed) {
            log.info("[ESCALATION] Teacher removed | studentId={} | courseId={} | teacherId={}", studentId, courseId, teacherId);
        }
        return removed;
    }

    public Optional<String> lookup(String studentId, String courseId) {
        if (courseId != null) {
            Optional<String> courseTeacher = first(assignments.get(key(studentId, courseId)));
            if (courseTeacher.isPresent()) {
                return courseTeacher;
            }
        }
        return first(assignments.get(key(studentId, null)));
    }

    public List<String> teachersOf(String studentId, String courseId) {
        return List.copyOf(assignments.getOrDefault(key(studentId, courseId), List.of()));
    }

    private static Optional<String> first(List<String> teachers) {
        return teachers == null ? Optional.empty() : teachers.stream().findFirst();
    }

    private static String key(String studentId, String courseId) {
        return courseId == null ? studentId : studentId + "|" + courseId;
    }
}
