package com.adlanda.channelknowledge.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits a YAML front matter block ({@code ---} delimited) from a document body.
 */
@Component
public class FrontMatterParser {

    private static final Logger log = LoggerFactory.getLogger(FrontMatterParser.class);

    private static final Pattern FRONT_MATTER = Pattern.compile("\\A---[ \\t]*\\r?\\n(.*?)\\r?\\n---[ \\t]*(?:\\r?\\n|\\z)", Pattern.DOTALL);

    private static final List<DateTimeFormatter> DATE_FORMATS = List.of(
            DateTimeFormatter.ISO_LOCAL_DATE,
            DateTimeFormatter.ofPattern("dd.MM.yyyy"),
            DateTimeFormatter.ofPattern("dd/MM/yyyy"));

    public FrontMatter parse(String raw) {
        String text = raw.startsWith("\uFEFF") ? raw.substring(1) : raw;
        Matcher matcher = FRONT_MATTER.matcher(text);
        if (!matcher.find()) {
            return new FrontMatter(Map.of(), text);
        }

        String body = text.substring(matcher.end());
        try {
            Object loaded = new Yaml(new SafeConstructor(new LoaderOptions())).load(matcher.group(1));
            if (!(loaded instanceof Map<?, ?> map)) {
                return new FrontMatter(Map.of(), body);
            }
            Map<String, Object> attributes = new LinkedHashMap<>();
            map.forEach((key, value) -> {
                if (key != null && value != null) {
                    attributes.put(key.toString(), value);
                }
            });
            return new FrontMatter(attributes, body);
        } catch (YAMLException e) {
            log.warn("Ignoring malformed front matter: {}", e.getMessage());
            return new FrontMatter(Map.of(), body);
        }
    }

    /**
     * Parsed front matter attributes and the remaining document body.
     */
    public record FrontMatter(Map<String, Object> attributes, String body) {

        public Optional<String> string(String key) {
            Object value = attributes.get(key);
            if (value == null || value.toString().isBlank()) {
                return Optional.empty();
            }
            return Optional.of(value.toString().strip());
        }

        /**
         * Reads a date attribute written as an unquoted YAML date or as yyyy-MM-dd,
         * dd.MM.yyyy or dd/MM/yyyy text.
         */
        public Optional<LocalDate> date(String key) {
            Object value = attributes.get(key);
            if (value instanceof Date date) {
                return Optional.of(date.toInstant().atZone(ZoneOffset.UTC).toLocalDate());
            }
            if (value instanceof LocalDate localDate) {
                return Optional.of(localDate);
            }
            if (value == null) {
                return Optional.empty();
            }
            String text = value.toString().strip();
            for (DateTimeFormatter format : DATE_FORMATS) {
                try {
                    return Optional.of(LocalDate.parse(text, format));
                } catch (DateTimeParseException e) {
                    log.trace("'{}' is not a {} date", text, format);
                }
            }
            log.warn("Unparseable date '{}' for front matter key '{}'", text, key);
            return Optional.empty();
        }
    }
}
