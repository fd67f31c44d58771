package com.enterprise.textpipe.module;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits text into sentences and words.
 * The result is CSV with the columns {@code sentence,offset,word}; offsets count word characters only.
 * Supports conversion to {@code csv} (prefixed with an id column) and {@code json}.
 */
public class TokenizeModule implements TextModule {

    public static final String NAME = "tokenize";

    static final String HEADER = "sentence,offset,word";

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public String process(String text) {
        StringBuilder out = new StringBuilder(HEADER).append('\n');
        int sentence = 1;
        int offset = 0;
        for (String token : text.trim().split("\\s+")) {
            if (token.isEmpty()) {
                continue;
            }
            boolean endOfSentence = token.endsWith(".") || token.endsWith("!") || token.endsWith("?");
            String word = endOfSentence ? token.substring(0, token.length() - 1) : token;
            if (!word.isEmpty()) {
                out.append(sentence).append(',').append(offset).append(',').append(quote(word)).append('\n');
                offset += word.length();
            }
            if (endOfSentence) {
                sentence++;
            }
        }
        return out.toString();
    }

    @Override
    public String convert(String id, String result, String format) {
        switch (format) {
            case "csv":
                return withIdColumn(id, result);
            case "json":
                return toJson(result);
            default:
                return TextModule.super.convert(id, result, format);
        }
    }

    private String withIdColumn(String id, String result) {
        StringBuilder out = new StringBuilder();
        List<String> lines = lines(result);
        out.append("id,").append(lines.get(0)).append('\n');
        for (String line : lines.subList(1, lines.size())) {
            out.append(quote(id)).append(',').append(line).append('\n');
        }
        return out.toString();
    }

    private String toJson(String result) {
        ArrayNode rows = objectMapper.createArrayNode();
        List<String> lines = lines(result);
        for (String line : lines.subList(1, lines.size())) {
            String[] fields = line.split(",", 3);
            ObjectNode row = rows.addObject();
            row.put("sentence", Integer.parseInt(fields[0]));
            row.put("offset", Integer.parseInt(fields[1]));
            row.put("word", unquote(fields[2]));
        }
        try {
            return objectMapper.writeValueAsString(rows);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot render tokens as json", e);
        }
    }

    private static List<String> lines(String result) {
        List<String> lines = new ArrayList<>();
        for (String line : result.split("\n")) {
            if (!line.isEmpty()) {
                lines.add(line);
            }
        }
        if (lines.isEmpty()) {
            lines.add(HEADER);
        }
        return lines;
    }

    static String quote(String field) {
        if (field.indexOf(',') < 0 && field.indexOf('"') < 0) {
            return field;
        }
        return '"' + field.replace("\"", "\"\"") + '"';
    }

    static String unquote(String field) {
        if (field.length() >= 2 && field.startsWith("\"") && field.endsWith("\"")) {
            return field.substring(1, field.length() - 1).replace("\"\"", "\"");
        }
        return field;
    }
}
