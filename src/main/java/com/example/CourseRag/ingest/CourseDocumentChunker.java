package com.example.CourseRag.ingest;

import com.example.CourseRag.config.RagProperties;
import com.example.CourseRag.exception.MalformedDocumentException;
import com.example.CourseRag.model.ChunkedCourse;
import com.example.CourseRag.model.Course;
import com.example.CourseRag.model.CourseChunk;
import com.example.CourseRag.model.Lesson;
import com.example.CourseRag.util.SentenceSplitter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns a plain-text course transcript into a {@link Course} and its ordered, context-prefixed chunks.
 *
 * <p>Expected layout:
 * <pre>
 * Course Title: &lt;title&gt;
 * Course Link: &lt;url&gt;
 * Course Instructor: &lt;name&gt;
 * Lesson 0: &lt;title&gt;
 * Lesson Link: &lt;url&gt;      (optional)
 * ...lesson body...
 * Lesson 1: &lt;title&gt;
 * ...
 * </pre>
 * The title line is required; the link and instructor lines are read when present.
 * Text between the header and the first lesson marker is discarded.
 *
 * <p>Lesson bodies are cut into sentence-bounded windows of at most {@code chunkSize} characters;
 * the next window starts with as many trailing sentences of the previous one as fit in
 * {@code chunkOverlap} characters, as long as the next unseen sentence still fits.
 * A sentence longer than the window becomes a chunk of its own.
 * Stateless and safe for concurrent use.
 */
@Slf4j
@Component
public class CourseDocumentChunker {

    private static final Pattern TITLE = Pattern.compile("^Course Title:\\s*(.*)$", Pattern.CASE_INSENSITIVE);
    private static final Pattern LINK = Pattern.compile("^Course Link:\\s*(.*)$", Pattern.CASE_INSENSITIVE);
    private static final Pattern INSTRUCTOR = Pattern.compile("^Course Instructor:\\s*(.*)$", Pattern.CASE_INSENSITIVE);
    private static final Pattern LESSON = Pattern.compile("^Lesson\\s+(\\d+):\\s*(.*)$", Pattern.CASE_INSENSITIVE);
    private static final Pattern LESSON_LINK = Pattern.compile("^Lesson Link:\\s*(.*)$", Pattern.CASE_INSENSITIVE);

    private final int chunkSize;
    private final int chunkOverlap;

    @Autowired
    public CourseDocumentChunker(RagProperties properties) {
        this(properties.getChunkSize(), properties.getChunkOverlap());
    }

    public CourseDocumentChunker(int chunkSize, int chunkOverlap) {
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("chunkSize must be positive");
        }
        if (chunkOverlap < 0 || chunkOverlap >= chunkSize) {
            throw new IllegalArgumentException("chunkOverlap must be in [0, chunkSize)");
        }
        this.chunkSize = chunkSize;
        this.chunkOverlap = chunkOverlap;
    }

    public static String contextPrefix(String courseTitle, int lessonNumber) {
        return "Course " + courseTitle + " Lesson " + lessonNumber + " content: ";
    }

    public ChunkedCourse chunk(String documentText) {
        if (documentText == null || documentText.isBlank()) {
            throw new MalformedDocumentException("Document is empty");
        }
        String[] lines = documentText.replace("\r\n", "\n").replace('\r', '\n').split("\n", -1);

        String title = headerValue(lines, 0, TITLE);
        if (title == null || title.isEmpty()) {
            throw new MalformedDocumentException("First line must be 'Course Title: <title>'");
        }
        int next = 1;
        String link = headerValue(lines, next, LINK);
        if (link != null) {
            next++;
        }
        String instructor = headerValue(lines, next, INSTRUCTOR);
        if (instructor != null) {
            next++;
        }

        List<ParsedLesson> parsedLessons = parseLessons(lines, next);

        List<Lesson> lessons = new ArrayList<>();
        List<CourseChunk> chunks = new ArrayList<>();
        for (ParsedLesson parsed : parsedLessons) {
            if (lessons.stream().anyMatch(lesson -> lesson.number() == parsed.number())) {
                throw new MalformedDocumentException(
                        "Lesson " + parsed.number() + " appears more than once in course '" + title + "'");
            }
            lessons.add(new Lesson(parsed.number(), parsed.title(), parsed.link()));
            String prefix = contextPrefix(title, parsed.number());
            for (String window : window(SentenceSplitter.split(parsed.body()))) {
                chunks.add(new CourseChunk(prefix + window, title, parsed.number(), chunks.size()));
            }
        }

        Course course = new Course(title, emptyToNull(link), emptyToNull(instructor), lessons);
        log.debug("Chunked course '{}': {} lessons, {} chunks (size={}, overlap={})",
                title, lessons.size(), chunks.size(), chunkSize, chunkOverlap);
        return new ChunkedCourse(course, chunks);
    }

    /**
     * Sentence-bounded sliding windows over one lesson body.
     */
    List<String> window(List<String> sentences) {
        List<String> windows = new ArrayList<>();
        int start = 0;
        while (start < sentences.size()) {
            int end = start;
            int size = 0;
            while (end < sentences.size()) {
                int addition = sentences.get(end).length() + (end > start ? 1 : 0);
                if (end > start && size + addition > chunkSize) {
                    break;
                }
                size += addition;
                end++;
            }
            windows.add(String.join(" ", sentences.subList(start, end)));

            if (end >= sentences.size()) {
                break;
            }

            // Carry trailing sentences into the next window while they fit the overlap
            // and still leave room for the next unseen sentence.
            int nextLength = sentences.get(end).length() + 1;
            int carried = 0;
            int overlapSize = 0;
            for (int k = end - 1; k > start; k--) {
                int length = sentences.get(k).length() + (carried > 0 ? 1 : 0);
                if (overlapSize + length > chunkOverlap || overlapSize + length + nextLength > chunkSize) {
                    break;
                }
                overlapSize += length;
                carried++;
            }
            start = end - carried;
        }
        return windows;
    }

    private List<ParsedLesson> parseLessons(String[] lines, int from) {
        List<ParsedLesson> lessons = new ArrayList<>();
        Integer number = null;
        String lessonTitle = null;
        String lessonLink = null;
        StringBuilder body = new StringBuilder();

        int i = from;
        while (i < lines.length) {
            String line = lines[i].strip();
            Matcher marker = LESSON.matcher(line);
            if (marker.matches()) {
                if (number != null) {
                    lessons.add(new ParsedLesson(number, lessonTitle, lessonLink, body.toString()));
                }
                number = Integer.parseInt(marker.group(1));
                lessonTitle = marker.group(2).strip();
                lessonLink = null;
                body = new StringBuilder();

                if (i + 1 < lines.length) {
                    Matcher linkLine = LESSON_LINK.matcher(lines[i + 1].strip());
                    if (linkLine.matches()) {
                        lessonLink = emptyToNull(linkLine.group(1).strip());
                        i++;
                    }
                }
            } else if (number != null) {
                body.append(line).append('\n');
            }
            i++;
        }
        if (number != null) {
            lessons.add(new ParsedLesson(number, lessonTitle, lessonLink, body.toString()));
        }
        return lessons;
    }

    private static String headerValue(String[] lines, int index, Pattern label) {
        if (index >= lines.length) {
            return null;
        }
        Matcher matcher = label.matcher(lines[index].strip());
        return matcher.matches() ? matcher.group(1).strip() : null;
    }

    private static String emptyToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }

    private record ParsedLesson(int number, String title, String link, String body) {
    }
}
