package com.adlanda.channelknowledge.service.chunking;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits text into bounded chunks that follow the document's structure.
 *
 * <ol>
 *   <li>{@code ## Title} and {@code ===} lines split the text into sections when there is
 *       more than one. Chunks of a titled section start with {@code [Title]\n\n}.</li>
 *   <li>A section with at least three Q&amp;A units keeps each unit whole. An intro
 *       before the first question that is too long for one chunk is packed as prose.</li>
 *   <li>Otherwise paragraphs are packed greedily, falling back to sentences and then words
 *       for oversized pieces, with a word-aligned overlap between consecutive chunks.</li>
 * </ol>
 *
 * No chunk is empty and no chunk, prefix included, exceeds {@code maxSize}.
 */
@Component
public class ChunkingEngine {

    static final int MIN_QA_UNITS = 3;

    private static final Pattern SECTION_BOUNDARY =
            Pattern.compile("^(?:##[ \\t]+(.+?)|={3,})[ \\t]*$", Pattern.MULTILINE);
    private static final Pattern NUMBERED_QUESTION = Pattern.compile("^\\s*\\d{1,3}[.)]\\s+.*\\?.*$");
    private static final Pattern LABELLED_QUESTION =
            Pattern.compile("^\\s*(?:Q|Question|Вопрос)\\s*[:.\\-]", Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
    private static final Pattern PARAGRAPH_BREAK = Pattern.compile("\\n[ \\t]*\\n\\s*");
    private static final Pattern SENTENCE_BREAK = Pattern.compile("(?<=[.!?…])\\s+");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private static final String PARAGRAPH_JOINER = "\n\n";
    private static final String SENTENCE_JOINER = " ";

    public List<ChunkSpan> chunk(String text, int maxSize, int overlap) {
        if (maxSize < 1) {
            throw new IllegalArgumentException("maxSize must be positive, got " + maxSize);
        }
        if (overlap < 0 || overlap >= maxSize) {
            throw new IllegalArgumentException("overlap must be within [0, maxSize), got " + overlap);
        }
        if (text == null || text.isBlank()) {
            return List.of();
        }

        String normalized = text.replace("\r\n", "\n").replace('\r', '\n').strip();
        List<Section> sections = splitSections(normalized);

        List<ChunkSpan> spans = new ArrayList<>();
        for (Section section : sections) {
            for (Piece piece : chunkSection(section, maxSize, overlap)) {
                spans.add(new ChunkSpan(spans.size(), piece.title(), piece.prefix(), piece.body(), piece.overlap()));
            }
        }
        return spans;
    }

    private List<Section> splitSections(String text) {
        Matcher matcher = SECTION_BOUNDARY.matcher(text);
        List<Section> sections = new ArrayList<>();
        String currentTitle = "";
        int start = 0;
        while (matcher.find()) {
            addSection(sections, currentTitle, text.substring(start, matcher.start()));
            currentTitle = matcher.group(1) != null ? matcher.group(1).strip() : "";
            start = matcher.end();
        }
        addSection(sections, currentTitle, text.substring(start));

        if (sections.size() <= 1) {
            return List.of(new Section("", text));
        }
        return sections;
    }

    private static void addSection(List<Section> sections, String title, String content) {
        String body = content.strip();
        if (!body.isEmpty()) {
            sections.add(new Section(title, body));
        }
    }

    private List<Piece> chunkSection(Section section, int maxSize, int overlap) {
        String title = section.title();
        int maxTitle = maxSize / 4 - 4;
        if (title.length() > maxTitle) {
            title = maxTitle > 0 ? title.substring(0, maxTitle).strip() : "";
        }
        String prefix = title.isEmpty() ? "" : "[" + title + "]" + PARAGRAPH_JOINER;
        int limit = maxSize - prefix.length();
        int sectionOverlap = Math.min(overlap, limit / 2);

        List<String> units = qaUnits(section.content());
        List<Body> bodies;
        if (units.size() >= MIN_QA_UNITS) {
            bodies = new ArrayList<>();
            String lead = units.get(0);
            if (!opensWithQuestion(lead) && lead.length() > limit) {
                bodies.addAll(packParagraphs(lead, limit, sectionOverlap));
                units = units.subList(1, units.size());
            }
            bodies.addAll(packUnits(units, limit));
        } else {
            bodies = packParagraphs(section.content(), limit, sectionOverlap);
        }

        String finalTitle = title;
        return bodies.stream()
                .map(body -> new Piece(finalTitle, prefix, body.text(), body.overlap()))
                .toList();
    }

    /**
     * Splits the section at lines that open a question. Text before the first question
     * forms its own unit; when it does not fit a chunk it is packed as paragraphs instead
     * of being kept whole. Returns an empty list when there are too few questions.
     */
    List<String> qaUnits(String content) {
        String[] lines = content.split("\n", -1);
        List<String> units = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        int questions = 0;
        for (String line : lines) {
            if (isQuestionStart(line)) {
                questions++;
                addUnit(units, current);
                current.setLength(0);
            }
            if (current.length() > 0) {
                current.append('\n');
            }
            current.append(line);
        }
        addUnit(units, current);
        return questions >= MIN_QA_UNITS ? units : List.of();
    }

    private static boolean opensWithQuestion(String unit) {
        int lineEnd = unit.indexOf('\n');
        return isQuestionStart(lineEnd < 0 ? unit : unit.substring(0, lineEnd));
    }

    private static boolean isQuestionStart(String line) {
        return NUMBERED_QUESTION.matcher(line).matches() || LABELLED_QUESTION.matcher(line).lookingAt();
    }

    private static void addUnit(List<String> units, StringBuilder unit) {
        String text = unit.toString().strip();
        if (!text.isEmpty()) {
            units.add(text);
        }
    }

    /**
     * Packs whole units greedily. A single question longer than {@code limit} is cut.
     */
    private List<Body> packUnits(List<String> units, int limit) {
        List<Body> bodies = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        for (String unit : units) {
            if (unit.length() > limit) {
                flush(bodies, current, 0);
                bodies.add(new Body(cut(unit, limit).strip(), 0));
                continue;
            }
            if (current.length() > 0 && current.length() + PARAGRAPH_JOINER.length() + unit.length() > limit) {
                flush(bodies, current, 0);
            }
            if (current.length() > 0) {
                current.append(PARAGRAPH_JOINER);
            }
            current.append(unit);
        }
        flush(bodies, current, 0);
        return bodies;
    }

    private List<Body> packParagraphs(String content, int limit, int overlap) {
        List<Segment> segments = segments(content, limit);
        List<Body> bodies = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        int currentOverlap = 0;

        for (Segment segment : segments) {
            if (current.length() == 0) {
                current.append(segment.text());
                continue;
            }
            if (current.length() + segment.joiner().length() + segment.text().length() <= limit) {
                current.append(segment.joiner()).append(segment.text());
                continue;
            }

            String finished = current.toString();
            bodies.add(new Body(finished, currentOverlap));
            current.setLength(0);

            String tail = overlapTail(finished, Math.min(overlap, limit - segment.text().length() - segment.joiner().length()));
            if (tail.isEmpty()) {
                currentOverlap = 0;
            } else {
                current.append(tail).append(segment.joiner());
                currentOverlap = current.length();
            }
            current.append(segment.text());
        }
        if (current.length() > 0) {
            bodies.add(new Body(current.toString(), currentOverlap));
        }
        return bodies;
    }

    /**
     * Breaks content into pieces no longer than {@code limit}: whole paragraphs where they
     * fit, else sentences, else runs of words, else hard cuts.
     */
    private List<Segment> segments(String content, int limit) {
        List<Segment> segments = new ArrayList<>();
        for (String paragraph : PARAGRAPH_BREAK.split(content)) {
            String trimmed = paragraph.strip();
            if (trimmed.isEmpty()) {
                continue;
            }
            if (trimmed.length() <= limit) {
                segments.add(new Segment(trimmed, PARAGRAPH_JOINER));
                continue;
            }
            String joiner = PARAGRAPH_JOINER;
            for (String sentence : SENTENCE_BREAK.split(trimmed)) {
                for (String piece : fitSentence(sentence.strip(), limit)) {
                    segments.add(new Segment(piece, joiner));
                    joiner = SENTENCE_JOINER;
                }
            }
        }
        return segments;
    }

    private static List<String> fitSentence(String sentence, int limit) {
        if (sentence.isEmpty()) {
            return List.of();
        }
        if (sentence.length() <= limit) {
            return List.of(sentence);
        }
        List<String> pieces = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        for (String word : WHITESPACE.split(sentence)) {
            if (word.isEmpty()) {
                continue;
            }
            String remaining = word;
            while (remaining.length() > limit) {
                if (current.length() > 0) {
                    pieces.add(current.toString());
                    current.setLength(0);
                }
                String head = cut(remaining, limit);
                pieces.add(head);
                remaining = remaining.substring(head.length());
            }
            if (current.length() > 0 && current.length() + 1 + remaining.length() > limit) {
                pieces.add(current.toString());
                current.setLength(0);
            }
            if (current.length() > 0) {
                current.append(' ');
            }
            current.append(remaining);
        }
        if (current.length() > 0) {
            pieces.add(current.toString());
        }
        return pieces;
    }

    /**
     * Trailing text of at most {@code maxChars} characters that starts on a word boundary.
     */
    static String overlapTail(String text, int maxChars) {
        if (maxChars <= 0 || text.isEmpty()) {
            return "";
        }
        if (text.length() <= maxChars) {
            return text.strip();
        }
        int start = text.length() - maxChars;
        if (!Character.isWhitespace(text.charAt(start - 1))) {
            while (start < text.length() && !Character.isWhitespace(text.charAt(start))) {
                start++;
            }
        }
        return text.substring(start).strip();
    }

    /**
     * First {@code limit} characters, without splitting a surrogate pair.
     */
    private static String cut(String text, int limit) {
        int end = Math.min(limit, text.length());
        if (end > 0 && end < text.length() && Character.isHighSurrogate(text.charAt(end - 1))) {
            end--;
        }
        return text.substring(0, Math.max(end, 1));
    }

    private static void flush(List<Body> bodies, StringBuilder current, int overlap) {
        if (current.length() > 0) {
            bodies.add(new Body(current.toString(), overlap));
            current.setLength(0);
        }
    }

    private record Section(String title, String content) {}

    private record Segment(String text, String joiner) {}

    private record Body(String text, int overlap) {}

    private record Piece(String title, String prefix, String body, int overlap) {}
}
